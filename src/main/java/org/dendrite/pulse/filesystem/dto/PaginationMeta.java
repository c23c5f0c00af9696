package org.dendrite.pulse.filesystem.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * 集合响应的分页元信息。
 *
 * @param totalCount 分页前的总条数
 * @param offset     请求的偏移
 * @param limit      请求的每页条数
 */
public record PaginationMeta(
        @JsonProperty("total_count") int totalCount,
        int offset,
        int limit
) {
}
