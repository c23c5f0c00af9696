package org.dendrite.pulse.filesystem.dto;

import java.util.List;

/**
 * JSON:API 集合响应。
 *
 * @param meta  分页元信息
 * @param data  当前页资源
 * @param links 分页导航
 */
public record CollectionResponse(
        PaginationMeta meta,
        List<FileResource> data,
        PaginationLinks links
) {
}
