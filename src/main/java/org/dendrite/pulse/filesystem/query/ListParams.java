package org.dendrite.pulse.filesystem.query;

/**
 * 分页与排序参数。
 *
 * @param limit      每页条数
 * @param offset     起始偏移
 * @param sortField  排序字段
 * @param descending 是否降序
 */
public record ListParams(int limit, int offset, SortField sortField, boolean descending) {

    public boolean isDefaultSort() {
        return sortField == SortField.NAME && !descending;
    }

    public String sortToken() {
        return (descending ? "-" : "") + sortField.token();
    }
}
