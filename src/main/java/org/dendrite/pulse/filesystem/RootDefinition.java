package org.dendrite.pulse.filesystem;

/**
 * 未经解析的根目录定义（来自配置）。
 *
 * @param virtual 对外虚拟名称，例如 {@code /public}
 * @param source  宿主机源目录
 */
public record RootDefinition(String virtual, String source) {
}
