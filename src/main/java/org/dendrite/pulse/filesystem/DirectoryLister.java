package org.dendrite.pulse.filesystem;

import java.io.IOException;
import java.nio.file.DirectoryIteratorException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * 列出目录的直接子条目，每个子条目都重新走一遍 {@link SecurePathResolver}。
 * <p>
 * 返回顺序即目录流的顺序（不保证有序），排序由 {@code ListQueryEngine} 负责。
 */
public class DirectoryLister {

    private final SecurePathResolver pathResolver;

    public DirectoryLister(SecurePathResolver pathResolver) {
        this.pathResolver = pathResolver;
    }

    public List<Descriptor> list(Root root, String relativePath, CancellationSignal signal) {
        Descriptor parent = pathResolver.describe(root, relativePath);
        if (!parent.isFolder()) {
            throw new FileAccessException(FileAccessException.Reason.NOT_A_DIRECTORY, parent.virtualPath(), "不是目录");
        }

        List<Descriptor> result = new ArrayList<>();
        // 使用 DirectoryStream 做流式遍历（比一次性 list() 更省内存）
        try (DirectoryStream<Path> stream = openDirectory(parent.absolutePath())) {
            for (Path child : stream) {
                if (signal.isCancelled()) {
                    throw new FileAccessException(FileAccessException.Reason.CANCELED, parent.virtualPath(), "目录列表已取消");
                }
                String name = child.getFileName().toString();
                String childRel = parent.relPath().isEmpty() ? name : parent.relPath() + "/" + name;
                result.add(pathResolver.describe(root, childRel));
            }
        } catch (IOException e) {
            throw SecurePathResolver.translate(e, parent.virtualPath());
        } catch (DirectoryIteratorException e) {
            // 遍历过程中的 IO 错误被包装为非受检异常
            throw SecurePathResolver.translate(e.getCause(), parent.virtualPath());
        }
        return result;
    }

    DirectoryStream<Path> openDirectory(Path directory) throws IOException {
        return Files.newDirectoryStream(directory);
    }
}
