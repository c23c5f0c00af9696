package org.dendrite.pulse.filesystem.dto;

import java.util.List;

/**
 * JSON:API 错误文档。
 */
public record ErrorResponse(List<ErrorObject> errors) {

    public static ErrorResponse of(int status, String title, String detail) {
        return new ErrorResponse(List.of(new ErrorObject(String.valueOf(status), title, detail)));
    }

    /**
     * @param status HTTP 状态码（字符串）
     * @param title  状态码对应的标准短语
     * @param detail 面向调用方的说明（不含宿主机路径）
     */
    public record ErrorObject(String status, String title, String detail) {
    }
}
