package org.dendrite.pulse.filesystem;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AccessDeniedException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.LinkOption;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.List;

/**
 * 安全路径解析器：把“虚拟根 + 相对路径”解析成经过分类与越界校验的 {@link Descriptor}。
 * <p>
 * 设计目标：
 * <ul>
 *   <li>任何包含字面 {@code ..} 段的相对路径一律拒绝，即使规范化后会被抵消。</li>
 *   <li>符号链接会被完整解析（任意跳数），解析后的真实路径必须仍位于根目录之内。</li>
 *   <li>非链接路径同样做一次 realPath 校验，防止中间某一级目录是指向根外的链接。</li>
 * </ul>
 */
public class SecurePathResolver {

    private static final Logger log = LoggerFactory.getLogger(SecurePathResolver.class);

    private final MetadataExtractor metadataExtractor;

    public SecurePathResolver(MetadataExtractor metadataExtractor) {
        this.metadataExtractor = metadataExtractor;
    }

    public Descriptor describe(Root root, String relativePath) {
        String rel = cleanRelativePath(root, relativePath);
        String virtualPath = joinVirtual(root.virtual(), rel);

        Path candidate;
        try {
            candidate = rel.isEmpty() ? root.source() : root.source().resolve(rel);
        } catch (InvalidPathException e) {
            // 例如包含 NUL 字符，当前平台无法表示
            throw new FileAccessException(FileAccessException.Reason.INVALID_PATH, virtualPath, "路径格式非法", e);
        }
        BasicFileAttributes linkAttributes;
        try {
            linkAttributes = Files.readAttributes(candidate, BasicFileAttributes.class, LinkOption.NOFOLLOW_LINKS);
        } catch (IOException e) {
            throw translate(e, virtualPath);
        }

        ResourceKind kind = classify(linkAttributes);
        Target target = switch (kind) {
            case SYMLINK -> followLink(root, candidate, virtualPath);
            case FOLDER -> inPlace(root, candidate, TargetKind.FOLDER, virtualPath);
            case FILE -> inPlace(root, candidate, TargetKind.FILE, virtualPath);
        };

        String name = entryName(root, rel);
        Metadata metadata;
        try {
            metadata = metadataExtractor.extract(name, virtualPath, kind, target.absolutePath());
        } catch (IOException e) {
            throw translate(e, virtualPath);
        }
        return new Descriptor(root, virtualPath, rel, name, kind, target.kind(), target.absolutePath(), candidate, metadata);
    }

    private static Target followLink(Root root, Path link, String virtualPath) {
        // toRealPath 会跟随整条链接链，直到最终的真实文件/目录
        Path resolved;
        try {
            resolved = link.toRealPath();
        } catch (IOException e) {
            throw translate(e, virtualPath);
        }
        ensureWithinRoot(root, resolved, virtualPath);
        TargetKind kind = Files.isDirectory(resolved, LinkOption.NOFOLLOW_LINKS) ? TargetKind.FOLDER : TargetKind.FILE;
        return new Target(resolved, kind);
    }

    private static Target inPlace(Root root, Path candidate, TargetKind kind, String virtualPath) {
        try {
            ensureWithinRoot(root, candidate.toRealPath(), virtualPath);
        } catch (IOException e) {
            throw translate(e, virtualPath);
        }
        return new Target(candidate, kind);
    }

    /**
     * 清洗相对路径：拒绝任何字面 {@code ..} 段，去掉空段与 {@code .} 段，统一使用 {@code /} 分隔。
     * 返回空字符串表示根目录本身。
     */
    static String cleanRelativePath(Root root, String relativePath) {
        if (relativePath == null || relativePath.isEmpty()) {
            return "";
        }
        List<String> segments = new ArrayList<>();
        for (String part : relativePath.split("/", -1)) {
            if (part.equals("..")) {
                log.warn("拒绝包含 .. 的路径：{}", joinVirtual(root.virtual(), relativePath));
                throw new FileAccessException(FileAccessException.Reason.OUTSIDE_ROOT,
                        joinVirtual(root.virtual(), relativePath), "路径不允许包含 ..");
            }
            if (part.isEmpty() || part.equals(".")) {
                continue;
            }
            segments.add(part);
        }
        return String.join("/", segments);
    }

    static String joinVirtual(String virtual, String rel) {
        if (rel.isEmpty()) {
            return virtual;
        }
        return virtual.endsWith("/") ? virtual + rel : virtual + "/" + rel;
    }

    private static String entryName(Root root, String rel) {
        if (rel.isEmpty()) {
            return root.segment();
        }
        int idx = rel.lastIndexOf('/');
        return idx < 0 ? rel : rel.substring(idx + 1);
    }

    private static ResourceKind classify(BasicFileAttributes attributes) {
        if (attributes.isDirectory()) {
            return ResourceKind.FOLDER;
        }
        if (attributes.isSymbolicLink()) {
            return ResourceKind.SYMLINK;
        }
        return ResourceKind.FILE;
    }

    private static void ensureWithinRoot(Root root, Path real, String virtualPath) {
        // Path.startsWith 按路径段比较，/srv/a 不会被视为 /srv/ab 的前缀
        if (!real.normalize().startsWith(root.source())) {
            log.warn("路径通过链接逃逸出根目录：{}", virtualPath);
            throw new FileAccessException(FileAccessException.Reason.OUTSIDE_ROOT, virtualPath, "路径逃逸出根目录");
        }
    }

    static FileAccessException translate(IOException e, String virtualPath) {
        if (e instanceof NoSuchFileException) {
            return new FileAccessException(FileAccessException.Reason.NOT_FOUND, virtualPath, "路径不存在", e);
        }
        if (e instanceof AccessDeniedException) {
            return new FileAccessException(FileAccessException.Reason.PERMISSION_DENIED, virtualPath, "没有访问权限", e);
        }
        return new FileAccessException(FileAccessException.Reason.STAT_FAILURE, virtualPath, "读取路径属性失败", e);
    }

    private record Target(Path absolutePath, TargetKind kind) {
    }
}
