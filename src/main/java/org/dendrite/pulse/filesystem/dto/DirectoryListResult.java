package org.dendrite.pulse.filesystem.dto;

import java.util.List;

/**
 * {@code fs_list_directory} 的返回结果。
 *
 * @param path       目录虚拟路径
 * @param totalCount 分页前总条数
 * @param offset     分页偏移
 * @param limit      分页大小
 * @param sort       生效的排序（例如 {@code -name}）
 * @param hasMore    是否还有下一页
 * @param entries    当前页条目
 */
public record DirectoryListResult(
        String path,
        int totalCount,
        int offset,
        int limit,
        String sort,
        boolean hasMore,
        List<FileAttributes> entries
) {
}
