package org.dendrite.pulse.filesystem;

import java.time.Instant;
import java.util.Optional;

/**
 * 单个条目的属性集合。
 * <p>
 * 可能缺失的属性（大小、各时间戳）使用 {@link Optional} 表达，缺失即“平台未提供/不适用”，不会用 0 值代替。
 *
 * @param name           名称
 * @param virtualPath    虚拟路径（例如 {@code /public/docs/a.txt}）
 * @param resourceKind   路径本身的类型
 * @param sizeBytes      文件大小，仅普通文件存在（目录与符号链接始终缺失）
 * @param permissionMode 四位八进制权限，例如 {@code 0644}
 * @param user           属主名称
 * @param group          属组名称
 * @param userId         属主 uid
 * @param groupId        属组 gid
 * @param mimeType       MIME 类型；探测失败时为空字符串
 * @param accessedAt     最后访问时间
 * @param modifiedAt     最后修改时间
 * @param changedAt      最后状态变更时间（ctime）
 * @param bornAt         创建时间（仅部分平台提供）
 */
public record Metadata(
        String name,
        String virtualPath,
        ResourceKind resourceKind,
        Optional<Long> sizeBytes,
        String permissionMode,
        String user,
        String group,
        int userId,
        int groupId,
        String mimeType,
        Optional<Instant> accessedAt,
        Optional<Instant> modifiedAt,
        Optional<Instant> changedAt,
        Optional<Instant> bornAt
) {
}
