package org.dendrite.pulse.filesystem;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * 文件服务门面：供 HTTP 与 MCP 两种入口共用。
 */
public class FileService {

    private final RootRegistry registry;
    private final SecurePathResolver pathResolver;
    private final DirectoryLister directoryLister;
    private final ContentSniffer contentSniffer;

    public FileService(RootRegistry registry, SecurePathResolver pathResolver, DirectoryLister directoryLister, ContentSniffer contentSniffer) {
        this.registry = registry;
        this.pathResolver = pathResolver;
        this.directoryLister = directoryLister;
        this.contentSniffer = contentSniffer;
    }

    public RootRegistry registry() {
        return registry;
    }

    public Descriptor resolve(String virtual, String relativePath) {
        return pathResolver.describe(requireRoot(virtual), relativePath);
    }

    public List<Descriptor> list(String virtual, String relativePath, CancellationSignal signal) {
        return directoryLister.list(requireRoot(virtual), relativePath, signal);
    }

    /**
     * 每个虚拟根对应一个目录条目，名称为虚拟名去掉前导 {@code /}。
     */
    public List<Descriptor> listRoots() {
        List<Descriptor> result = new ArrayList<>(registry.all().size());
        for (Root root : registry.all()) {
            result.add(pathResolver.describe(root, ""));
        }
        return result;
    }

    /**
     * 集合入口：只有一个 {@code /} 根时直接列出其内容，否则列出所有虚拟根。
     */
    public List<Descriptor> listCollection(CancellationSignal signal) {
        if (registry.isSingleSlashRoot()) {
            return directoryLister.list(registry.all().get(0), "", signal);
        }
        return listRoots();
    }

    /**
     * 解析完整的虚拟路径（例如 {@code /public/docs/a.txt}）。
     */
    public Descriptor resolveVirtualPath(String virtualPath) {
        RootRegistry.RootMatch match = registry.match(virtualPath)
                .orElseThrow(() -> new FileAccessException(FileAccessException.Reason.ROOT_NOT_FOUND, virtualPath, "虚拟根目录不存在"));
        return pathResolver.describe(match.root(), match.relPath());
    }

    public List<Descriptor> listVirtualPath(String virtualPath, CancellationSignal signal) {
        RootRegistry.RootMatch match = registry.match(virtualPath)
                .orElseThrow(() -> new FileAccessException(FileAccessException.Reason.ROOT_NOT_FOUND, virtualPath, "虚拟根目录不存在"));
        return directoryLister.list(match.root(), match.relPath(), signal);
    }

    /**
     * 为文件下载准备目标路径与内容类型；符号链接的 MIME 是固定标记，因此对其真实目标重新探测。
     */
    public Delivery prepareDelivery(Descriptor descriptor) {
        String contentType = switch (descriptor.kind()) {
            case SYMLINK -> contentSniffer.sniff(descriptor.absolutePath());
            case FILE, FOLDER -> descriptor.metadata().mimeType();
        };
        if (contentType == null || contentType.isEmpty()) {
            contentType = ContentSniffer.OCTET_STREAM;
        }
        return new Delivery(descriptor.absolutePath(), descriptor.name(), contentType);
    }

    private Root requireRoot(String virtual) {
        return registry.lookup(virtual)
                .orElseThrow(() -> new FileAccessException(FileAccessException.Reason.ROOT_NOT_FOUND, String.valueOf(virtual), "虚拟根目录不存在"));
    }

    /**
     * 文件内容交付信息。
     *
     * @param path        真实路径（位于根目录之内）
     * @param fileName    下载时使用的文件名
     * @param contentType 内容类型
     */
    public record Delivery(Path path, String fileName, String contentType) {
    }
}
