package org.dendrite.pulse.filesystem.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.dendrite.pulse.filesystem.Metadata;

import java.time.Instant;
import java.util.Optional;

/**
 * 条目属性的对外表示；缺失值输出为 JSON null，而不是默认值。
 */
public record FileAttributes(
        String name,
        @JsonProperty("resource_kind") String resourceKind,
        @JsonProperty("size_bytes") Long sizeBytes,
        @JsonProperty("permission_mode") String permissionMode,
        String user,
        String group,
        @JsonProperty("user_id") int userId,
        @JsonProperty("group_id") int groupId,
        @JsonProperty("mime_type") String mimeType,
        @JsonProperty("accessed_at") String accessedAt,
        @JsonProperty("modified_at") String modifiedAt,
        @JsonProperty("changed_at") String changedAt,
        @JsonProperty("born_at") String bornAt
) {

    public static FileAttributes from(Metadata metadata) {
        return new FileAttributes(
                metadata.name(),
                metadata.resourceKind().token(),
                metadata.sizeBytes().orElse(null),
                metadata.permissionMode(),
                metadata.user(),
                metadata.group(),
                metadata.userId(),
                metadata.groupId(),
                metadata.mimeType(),
                format(metadata.accessedAt()),
                format(metadata.modifiedAt()),
                format(metadata.changedAt()),
                format(metadata.bornAt())
        );
    }

    private static String format(Optional<Instant> time) {
        // Instant#toString 即 ISO-8601 UTC（带纳秒精度）
        return time.map(Instant::toString).orElse(null);
    }
}
