package org.dendrite.pulse.filesystem.query;

import org.dendrite.pulse.filesystem.Descriptor;
import org.dendrite.pulse.filesystem.dto.PaginationLinks;

import java.util.List;

/**
 * 排序、切片之后的一页结果。
 *
 * @param entries    当前页条目
 * @param links      分页导航链接
 * @param totalCount 切片前的总条数
 * @param params     生效的参数
 */
public record ListPage(List<Descriptor> entries, PaginationLinks links, int totalCount, ListParams params) {

    public boolean hasMore() {
        return links.next() != null;
    }
}
