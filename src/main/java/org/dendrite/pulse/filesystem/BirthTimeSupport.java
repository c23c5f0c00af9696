package org.dendrite.pulse.filesystem;

import java.nio.file.attribute.FileTime;
import java.time.Instant;
import java.util.Locale;
import java.util.Optional;

/**
 * 创建时间（birth time）能力探测。
 * <p>
 * Linux 上 JDK 返回的 creationTime 在多数文件系统中只是 mtime 的替身，不能当作真实创建时间；
 * 因此只有 macOS / Windows 使用 creationTime，其余平台统一返回“不可用”。
 */
@FunctionalInterface
public interface BirthTimeSupport {

    BirthTimeSupport UNAVAILABLE = creationTime -> Optional.empty();

    BirthTimeSupport CREATION_TIME = creationTime -> Optional.ofNullable(creationTime).map(FileTime::toInstant);

    Optional<Instant> birthTime(FileTime creationTime);

    static BirthTimeSupport forCurrentPlatform() {
        return forOperatingSystem(System.getProperty("os.name", ""));
    }

    static BirthTimeSupport forOperatingSystem(String osName) {
        String os = osName.toLowerCase(Locale.ROOT);
        if (os.contains("mac") || os.contains("darwin") || os.contains("windows")) {
            return CREATION_TIME;
        }
        return UNAVAILABLE;
    }
}
