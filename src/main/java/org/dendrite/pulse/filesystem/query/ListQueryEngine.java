package org.dendrite.pulse.filesystem.query;

import org.dendrite.pulse.filesystem.Descriptor;
import org.dendrite.pulse.filesystem.dto.PaginationLinks;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * 目录列表的查询引擎：解析 {@code page[limit]} / {@code page[offset]} / {@code sort}，
 * 对完整结果集做稳定排序后再分页，保证相同参数的多次请求得到一致的分页窗口。
 */
public class ListQueryEngine {

    private final int defaultLimit;
    private final int maxLimit;

    public ListQueryEngine(int defaultLimit, int maxLimit) {
        this.defaultLimit = defaultLimit;
        this.maxLimit = maxLimit;
    }

    /**
     * 解析查询参数；空值使用默认值。
     *
     * @throws InvalidQueryParameterException 参数非法时
     */
    public ListParams parse(String limitParam, String offsetParam, String sortParam) {
        int limit = defaultLimit;
        if (limitParam != null && !limitParam.isEmpty()) {
            limit = parseInt(limitParam, "invalid page[limit]: must be a positive integer");
            if (limit < 1) {
                throw new InvalidQueryParameterException("invalid page[limit]: must be a positive integer");
            }
            if (limit > maxLimit) {
                throw new InvalidQueryParameterException("page[limit] exceeds maximum of " + maxLimit);
            }
        }

        int offset = 0;
        if (offsetParam != null && !offsetParam.isEmpty()) {
            offset = parseInt(offsetParam, "invalid page[offset]: must be a non-negative integer");
            if (offset < 0) {
                throw new InvalidQueryParameterException("invalid page[offset]: must be a non-negative integer");
            }
        }

        SortField sortField = SortField.NAME;
        boolean descending = false;
        if (sortParam != null && !sortParam.isEmpty()) {
            if (sortParam.contains(",")) {
                throw new InvalidQueryParameterException("sorting by multiple fields is not supported");
            }
            String token = sortParam;
            if (token.startsWith("-")) {
                descending = true;
                token = token.substring(1);
            }
            String field = token;
            sortField = SortField.fromToken(field)
                    .orElseThrow(() -> new InvalidQueryParameterException("invalid sort field: " + field));
        }

        return new ListParams(limit, offset, sortField, descending);
    }

    /**
     * 排序 + 分页 + 生成导航链接。
     *
     * @param descriptors 完整结果集（不会被修改）
     * @param params      已解析的参数
     * @param basePath    链接使用的请求路径（不含查询串）
     */
    public ListPage apply(List<Descriptor> descriptors, ListParams params, String basePath) {
        List<Descriptor> sorted = new ArrayList<>(descriptors);
        // List.sort 是稳定排序：比较结果相等的条目保持枚举顺序
        sorted.sort(Comparator.comparing(Descriptor::metadata, params.sortField().comparator(params.descending())));

        int total = sorted.size();
        int start = Math.min(params.offset(), total);
        int end = (int) Math.min((long) start + params.limit(), total);
        List<Descriptor> page = List.copyOf(sorted.subList(start, end));

        return new ListPage(page, buildLinks(basePath, params, total), total, params);
    }

    static PaginationLinks buildLinks(String basePath, ListParams params, int total) {
        int limit = params.limit();
        int offset = params.offset();
        int lastOffset = total > 0 ? ((total - 1) / limit) * limit : 0;

        String prev = null;
        if (offset > 0) {
            prev = link(basePath, params, Math.max(offset - limit, 0));
        }
        String next = null;
        if ((long) offset + limit < total) {
            next = link(basePath, params, offset + limit);
        }
        return new PaginationLinks(
                link(basePath, params, offset),
                link(basePath, params, 0),
                link(basePath, params, lastOffset),
                prev,
                next
        );
    }

    private static String link(String basePath, ListParams params, int offset) {
        StringBuilder sb = new StringBuilder(basePath)
                .append("?page[offset]=").append(offset)
                .append("&page[limit]=").append(params.limit());
        if (!params.isDefaultSort()) {
            sb.append("&sort=").append(params.sortToken());
        }
        return sb.toString();
    }

    private static int parseInt(String value, String message) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new InvalidQueryParameterException(message);
        }
    }
}
