package org.dendrite.pulse.filesystem;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Optional;

/**
 * 由目标属性与条目自身类型推导 {@link Metadata}。
 * <p>
 * 大小只对普通文件给出；符号链接即使指向文件也不给大小。
 * MIME：目录与符号链接使用固定标记，普通文件读取文件头做签名探测。
 */
public class MetadataExtractor {

    static final String MIME_DIRECTORY = "inode/directory";
    static final String MIME_SYMLINK = "inode/symlink";

    private final TargetAttributeReader attributeReader;
    private final ContentSniffer contentSniffer;

    public MetadataExtractor(TargetAttributeReader attributeReader, ContentSniffer contentSniffer) {
        this.attributeReader = attributeReader;
        this.contentSniffer = contentSniffer;
    }

    public Metadata extract(String name, String virtualPath, ResourceKind kind, Path target) throws IOException {
        TargetAttributes attributes = attributeReader.read(target);
        String mimeType = switch (kind) {
            case FOLDER -> MIME_DIRECTORY;
            case SYMLINK -> MIME_SYMLINK;
            case FILE -> contentSniffer.sniff(target);
        };
        return toMetadata(name, virtualPath, kind, attributes, mimeType);
    }

    static Metadata toMetadata(String name, String virtualPath, ResourceKind kind, TargetAttributes attributes, String mimeType) {
        Optional<Long> size = (kind == ResourceKind.FILE) ? Optional.of(attributes.size()) : Optional.empty();
        return new Metadata(
                name,
                virtualPath,
                kind,
                size,
                formatMode(attributes.mode()),
                attributes.user(),
                attributes.group(),
                attributes.userId(),
                attributes.groupId(),
                mimeType,
                attributes.accessedAt(),
                attributes.modifiedAt(),
                attributes.changedAt(),
                attributes.bornAt()
        );
    }

    static String formatMode(int mode) {
        return String.format("%04o", mode & 0777);
    }
}
