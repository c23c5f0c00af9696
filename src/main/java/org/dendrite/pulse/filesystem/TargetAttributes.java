package org.dendrite.pulse.filesystem;

import java.time.Instant;
import java.util.Optional;

/**
 * 从文件系统读取到的原始属性。
 *
 * @param size       字节数
 * @param mode       权限位（仅低 9 位有意义）
 * @param userId     uid；平台不提供时为 0
 * @param groupId    gid；平台不提供时为 0
 * @param user       属主名称
 * @param group      属组名称
 * @param accessedAt 最后访问时间
 * @param modifiedAt 最后修改时间
 * @param changedAt  状态变更时间
 * @param bornAt     创建时间
 */
public record TargetAttributes(
        long size,
        int mode,
        int userId,
        int groupId,
        String user,
        String group,
        Optional<Instant> accessedAt,
        Optional<Instant> modifiedAt,
        Optional<Instant> changedAt,
        Optional<Instant> bornAt
) {
}
