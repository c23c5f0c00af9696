package org.dendrite.pulse;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

@SpringBootApplication
@ConfigurationPropertiesScan
public class DendritePulseApplication {
    public static void main(String[] args) {
        ensureLogDirectory();
        SpringApplication.run(DendritePulseApplication.class, args);
    }

    /**
     * 提前创建日志目录（logback 的 RollingFileAppender 不会自行创建父目录）。
     * <p>
     * 规则与 logback-spring.xml 保持一致：优先读取系统属性/环境变量 LOG_PATH，默认使用 ./logs
     */
    static Path ensureLogDirectory() {
        String logPath = System.getProperty("LOG_PATH");
        if (logPath == null || logPath.isBlank()) {
            logPath = System.getenv("LOG_PATH");
        }
        if (logPath == null || logPath.isBlank()) {
            logPath = "logs";
        }
        try {
            return Files.createDirectories(Path.of(logPath));
        } catch (IOException e) {
            throw new UncheckedIOException("无法创建日志目录：" + logPath, e);
        }
    }
}
