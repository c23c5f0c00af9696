package org.dendrite.pulse.filesystem.dto;

/**
 * 分页导航链接；{@code prev} / {@code next} 不存在时为 null（序列化为 JSON null）。
 */
public record PaginationLinks(
        String self,
        String first,
        String last,
        String prev,
        String next
) {
}
