package org.dendrite.pulse.filesystem.dto;

import org.dendrite.pulse.filesystem.Descriptor;

/**
 * JSON:API 资源对象（type 固定为 {@code files}，id 为虚拟路径）。
 */
public record FileResource(
        String id,
        String type,
        FileAttributes attributes,
        ResourceLinks links
) {

    public static final String TYPE = "files";

    public static FileResource from(Descriptor descriptor, String apiPrefix) {
        String virtualPath = descriptor.metadata().virtualPath();
        String self = "/".equals(virtualPath) ? apiPrefix : apiPrefix + virtualPath;
        return new FileResource(virtualPath, TYPE, FileAttributes.from(descriptor.metadata()), new ResourceLinks(self));
    }

    /**
     * @param self 资源自身的访问路径
     */
    public record ResourceLinks(String self) {
    }
}
