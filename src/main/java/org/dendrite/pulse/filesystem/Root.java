package org.dendrite.pulse.filesystem;

import java.nio.file.Path;

/**
 * 已注册的虚拟根目录。
 *
 * @param virtual 对外虚拟名称（{@code /} 或 {@code /name}）
 * @param source  规范化后的源目录真实路径（已解析符号链接）
 */
public record Root(String virtual, Path source) {

    public boolean isSlash() {
        return "/".equals(virtual);
    }

    /**
     * 虚拟名称去掉前导 {@code /} 后的部分；{@code /} 根返回 {@code /}。
     */
    public String segment() {
        return isSlash() ? "/" : virtual.substring(1);
    }
}
