package org.dendrite.pulse.filesystem;

import org.dendrite.pulse.filesystem.query.ListQueryEngine;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * 文件服务的 Bean 装配。
 * <p>
 * 说明：
 * <ul>
 *   <li>注册表在这里根据 {@link FileServerProperties} 构建一次；源目录无法解析时容器启动失败。</li>
 *   <li>这里不引入任何数据库/外部依赖，全部基于本地文件系统。</li>
 * </ul>
 */
@Configuration(proxyBeanMethods = false)
public class FileServerConfiguration {

    @Bean
    public RootRegistry rootRegistry(FileServerProperties properties) {
        return RootRegistry.create(properties.toDefinitions());
    }

    @Bean
    public ContentSniffer contentSniffer() {
        return new ContentSniffer();
    }

    @Bean
    public MetadataExtractor metadataExtractor(ContentSniffer contentSniffer) {
        return new MetadataExtractor(new TargetAttributeReader(BirthTimeSupport.forCurrentPlatform()), contentSniffer);
    }

    @Bean
    public SecurePathResolver securePathResolver(MetadataExtractor metadataExtractor) {
        return new SecurePathResolver(metadataExtractor);
    }

    @Bean
    public DirectoryLister directoryLister(SecurePathResolver securePathResolver) {
        return new DirectoryLister(securePathResolver);
    }

    @Bean
    public FileService fileService(RootRegistry rootRegistry, SecurePathResolver securePathResolver,
                                   DirectoryLister directoryLister, ContentSniffer contentSniffer) {
        return new FileService(rootRegistry, securePathResolver, directoryLister, contentSniffer);
    }

    @Bean
    public ListQueryEngine listQueryEngine(FileServerProperties properties) {
        return new ListQueryEngine(properties.getListDefaultLimit(), properties.getListMaxLimit());
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
