package org.dendrite.pulse.filesystem;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.nio.file.attribute.FileTime;
import java.nio.file.attribute.PosixFileAttributes;
import java.nio.file.attribute.PosixFilePermission;
import java.nio.file.attribute.UserPrincipal;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 读取目标路径的原始属性（不跟随链接；调用方传入的已经是解析后的真实路径）。
 * <p>
 * 优先使用 {@code unix:*} 属性视图（uid/gid/mode/ctime）；不支持时退化到 posix 或 basic 视图，
 * 缺失的属性以 {@link Optional#empty()} 或 0 表达。
 */
public class TargetAttributeReader {

    private final BirthTimeSupport birthTimeSupport;

    public TargetAttributeReader(BirthTimeSupport birthTimeSupport) {
        this.birthTimeSupport = birthTimeSupport;
    }

    public TargetAttributes read(Path path) throws IOException {
        Set<String> views = path.getFileSystem().supportedFileAttributeViews();
        if (views.contains("unix")) {
            return readUnix(path);
        }
        if (views.contains("posix")) {
            return readPosix(path);
        }
        return readBasic(path);
    }

    private TargetAttributes readUnix(Path path) throws IOException {
        Map<String, Object> attrs = Files.readAttributes(path, "unix:*", LinkOption.NOFOLLOW_LINKS);
        int uid = (Integer) attrs.get("uid");
        int gid = (Integer) attrs.get("gid");
        int mode = (Integer) attrs.get("mode");
        return new TargetAttributes(
                (Long) attrs.get("size"),
                mode & 0777,
                uid,
                gid,
                ownerName((UserPrincipal) attrs.get("owner"), uid),
                ownerName((UserPrincipal) attrs.get("group"), gid),
                instant((FileTime) attrs.get("lastAccessTime")),
                instant((FileTime) attrs.get("lastModifiedTime")),
                instant((FileTime) attrs.get("ctime")),
                birthTimeSupport.birthTime((FileTime) attrs.get("creationTime"))
        );
    }

    private TargetAttributes readPosix(Path path) throws IOException {
        PosixFileAttributes attrs = Files.readAttributes(path, PosixFileAttributes.class, LinkOption.NOFOLLOW_LINKS);
        return new TargetAttributes(
                attrs.size(),
                toMode(attrs.permissions()),
                0,
                0,
                attrs.owner() == null ? "" : attrs.owner().getName(),
                attrs.group() == null ? "" : attrs.group().getName(),
                instant(attrs.lastAccessTime()),
                instant(attrs.lastModifiedTime()),
                Optional.empty(),
                birthTimeSupport.birthTime(attrs.creationTime())
        );
    }

    private TargetAttributes readBasic(Path path) throws IOException {
        BasicFileAttributes attrs = Files.readAttributes(path, BasicFileAttributes.class, LinkOption.NOFOLLOW_LINKS);
        return new TargetAttributes(
                attrs.size(),
                0,
                0,
                0,
                "",
                "",
                instant(attrs.lastAccessTime()),
                instant(attrs.lastModifiedTime()),
                Optional.empty(),
                birthTimeSupport.birthTime(attrs.creationTime())
        );
    }

    /**
     * 解析失败时 JDK 以数字字符串作为名称；此时退化为数字 id，但 id 为 0 时返回空字符串。
     */
    static String ownerName(UserPrincipal principal, int id) {
        String numeric = String.valueOf(id);
        if (principal == null || principal.getName() == null || principal.getName().equals(numeric)) {
            return id == 0 ? "" : numeric;
        }
        return principal.getName();
    }

    static int toMode(Set<PosixFilePermission> permissions) {
        int mode = 0;
        for (PosixFilePermission permission : permissions) {
            mode |= switch (permission) {
                case OWNER_READ -> 0400;
                case OWNER_WRITE -> 0200;
                case OWNER_EXECUTE -> 0100;
                case GROUP_READ -> 040;
                case GROUP_WRITE -> 020;
                case GROUP_EXECUTE -> 010;
                case OTHERS_READ -> 04;
                case OTHERS_WRITE -> 02;
                case OTHERS_EXECUTE -> 01;
            };
        }
        return mode;
    }

    private static Optional<Instant> instant(FileTime time) {
        return Optional.ofNullable(time).map(FileTime::toInstant);
    }
}
