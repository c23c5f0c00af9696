package org.dendrite.pulse.filesystem.dto;

/**
 * 对外可见的虚拟根目录信息（不暴露宿主机源路径）。
 *
 * @param virtual 虚拟名称
 * @param name    展示名称
 */
public record AllowedRoot(String virtual, String name) {
}
