package org.dendrite.pulse.filesystem.dto;

import java.util.List;

/**
 * {@code fs_list_roots} 的返回结果。
 *
 * @param singleSlashRoot 是否只有一个 {@code /} 根（此时集合入口直接列出其内容）
 * @param roots           虚拟根目录列表
 */
public record AllowedRootsResult(boolean singleSlashRoot, List<AllowedRoot> roots) {
}
