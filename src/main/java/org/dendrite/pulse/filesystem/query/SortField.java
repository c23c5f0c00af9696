package org.dendrite.pulse.filesystem.query;

import org.dendrite.pulse.filesystem.Metadata;

import java.util.Comparator;
import java.util.Optional;
import java.util.function.Function;

/**
 * 允许排序的字段（白名单）。
 * <p>
 * 可缺失字段（大小、各时间戳）上，缺失值总是小于任何存在的值；降序时整体取反，因此缺失值排在最后。
 */
public enum SortField {
    NAME("name", Comparator.comparing(Metadata::name)),
    RESOURCE_KIND("resource_kind", Comparator.comparing((Metadata m) -> m.resourceKind().token())),
    SIZE_BYTES("size_bytes", absentFirst(Metadata::sizeBytes)),
    PERMISSION_MODE("permission_mode", Comparator.comparing(Metadata::permissionMode)),
    USER("user", Comparator.comparing(Metadata::user)),
    GROUP("group", Comparator.comparing(Metadata::group)),
    USER_ID("user_id", Comparator.comparingInt(Metadata::userId)),
    GROUP_ID("group_id", Comparator.comparingInt(Metadata::groupId)),
    MIME_TYPE("mime_type", Comparator.comparing(Metadata::mimeType)),
    ACCESSED_AT("accessed_at", absentFirst(Metadata::accessedAt)),
    MODIFIED_AT("modified_at", absentFirst(Metadata::modifiedAt)),
    CHANGED_AT("changed_at", absentFirst(Metadata::changedAt)),
    BORN_AT("born_at", absentFirst(Metadata::bornAt));

    private final String token;
    private final Comparator<Metadata> ascending;

    SortField(String token, Comparator<Metadata> ascending) {
        this.token = token;
        this.ascending = ascending;
    }

    public String token() {
        return token;
    }

    public Comparator<Metadata> comparator(boolean descending) {
        return descending ? ascending.reversed() : ascending;
    }

    public static Optional<SortField> fromToken(String token) {
        for (SortField field : values()) {
            if (field.token.equals(token)) {
                return Optional.of(field);
            }
        }
        return Optional.empty();
    }

    private static <T extends Comparable<? super T>> Comparator<Metadata> absentFirst(Function<Metadata, Optional<T>> getter) {
        return (a, b) -> {
            Optional<T> left = getter.apply(a);
            Optional<T> right = getter.apply(b);
            if (left.isEmpty() && right.isEmpty()) {
                return 0;
            }
            if (left.isEmpty()) {
                return -1;
            }
            if (right.isEmpty()) {
                return 1;
            }
            return left.get().compareTo(right.get());
        };
    }
}
