package org.dendrite.pulse.filesystem;

import java.nio.file.Path;

/**
 * 一次解析得到的条目视图；每个请求重新构建，不缓存、不跨请求共享。
 *
 * @param root         所属虚拟根
 * @param virtualPath  虚拟路径
 * @param relPath      相对根目录的规范化路径（根目录自身为空字符串）
 * @param name         名称
 * @param kind         路径本身的类型
 * @param targetKind   跟随链接后的类型
 * @param absolutePath 目标真实路径（始终位于 {@code root.source()} 之内）
 * @param linkPath     链接自身路径；非链接时与拼接得到的候选路径一致
 * @param metadata     属性
 */
public record Descriptor(
        Root root,
        String virtualPath,
        String relPath,
        String name,
        ResourceKind kind,
        TargetKind targetKind,
        Path absolutePath,
        Path linkPath,
        Metadata metadata
) {

    public boolean isFolder() {
        return targetKind == TargetKind.FOLDER;
    }
}
