package org.dendrite.pulse.web;

import org.dendrite.pulse.filesystem.FileAccessException;
import org.dendrite.pulse.filesystem.dto.ErrorResponse;
import org.dendrite.pulse.filesystem.query.InvalidQueryParameterException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * 统一把异常翻译为 JSON:API 错误文档。
 * <p>
 * 对外的 detail 只使用固定文案或虚拟路径相关信息，不泄露宿主机路径。
 */
@RestControllerAdvice
public class JsonApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(JsonApiExceptionHandler.class);

    @ExceptionHandler(FileAccessException.class)
    public ResponseEntity<ErrorResponse> handleFileAccess(FileAccessException e) {
        return switch (e.getReason()) {
            case ROOT_NOT_FOUND -> error(HttpStatus.NOT_FOUND, "file root not found");
            case OUTSIDE_ROOT -> error(HttpStatus.BAD_REQUEST, "path escapes configured root");
            case INVALID_PATH -> error(HttpStatus.BAD_REQUEST, "invalid path");
            case NOT_A_DIRECTORY -> error(HttpStatus.BAD_REQUEST, "not a directory");
            case NOT_FOUND -> error(HttpStatus.NOT_FOUND, "file not found");
            case PERMISSION_DENIED -> error(HttpStatus.FORBIDDEN, "permission denied");
            case CANCELED -> error(HttpStatus.REQUEST_TIMEOUT, "request canceled");
            case STAT_FAILURE -> {
                log.error("读取文件属性失败：{}", e.getVirtualPath(), e);
                yield error(HttpStatus.INTERNAL_SERVER_ERROR, "An unexpected error occurred.");
            }
        };
    }

    @ExceptionHandler(InvalidQueryParameterException.class)
    public ResponseEntity<ErrorResponse> handleInvalidQuery(InvalidQueryParameterException e) {
        return error(HttpStatus.BAD_REQUEST, e.getMessage());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnexpected(Exception e) {
        log.error("请求处理失败", e);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "An unexpected error occurred.");
    }

    private static ResponseEntity<ErrorResponse> error(HttpStatus status, String detail) {
        return ResponseEntity.status(status)
                .contentType(JsonApi.MEDIA_TYPE)
                .body(ErrorResponse.of(status.value(), status.getReasonPhrase(), detail));
    }
}
