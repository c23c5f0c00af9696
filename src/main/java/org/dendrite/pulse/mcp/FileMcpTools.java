package org.dendrite.pulse.mcp;

import org.dendrite.pulse.filesystem.CancellationSignal;
import org.dendrite.pulse.filesystem.Descriptor;
import org.dendrite.pulse.filesystem.FileServerProperties;
import org.dendrite.pulse.filesystem.FileService;
import org.dendrite.pulse.filesystem.Root;
import org.dendrite.pulse.filesystem.dto.AllowedRoot;
import org.dendrite.pulse.filesystem.dto.AllowedRootsResult;
import org.dendrite.pulse.filesystem.dto.DirectoryListResult;
import org.dendrite.pulse.filesystem.dto.FileAttributes;
import org.dendrite.pulse.filesystem.query.ListPage;
import org.dendrite.pulse.filesystem.query.ListParams;
import org.dendrite.pulse.filesystem.query.ListQueryEngine;
import org.springframework.ai.tool.annotation.Tool;
import org.springframework.ai.tool.annotation.ToolParam;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * 文件服务的 MCP 工具集合（只读）。
 * <p>
 * 提供能力：
 * <ul>
 *   <li>列出虚拟根目录（{@code fs_list_roots}）。</li>
 *   <li>列目录（{@code fs_list_directory}），分页/排序规则与 HTTP 接口一致。</li>
 *   <li>查看单个条目的属性（{@code fs_describe}）。</li>
 * </ul>
 * 所有路径都使用虚拟路径（例如 {@code /public/docs}），返回结果不包含宿主机源路径。
 */
@Component
public class FileMcpTools {

    private final FileService fileService;
    private final ListQueryEngine queryEngine;
    private final FileServerProperties properties;
    private final Clock clock;

    public FileMcpTools(FileService fileService, ListQueryEngine queryEngine, FileServerProperties properties, Clock clock) {
        this.fileService = fileService;
        this.queryEngine = queryEngine;
        this.properties = properties;
        this.clock = clock;
    }

    @Tool(
            name = "fs_list_roots",
            description = "列出对外暴露的虚拟根目录。"
    )
    public AllowedRootsResult listRoots() {
        List<AllowedRoot> roots = new ArrayList<>();
        for (Root root : fileService.registry().all()) {
            roots.add(new AllowedRoot(root.virtual(), root.segment()));
        }
        return new AllowedRootsResult(fileService.registry().isSingleSlashRoot(), roots);
    }

    @Tool(
            name = "fs_list_directory",
            description = "列出目录下的文件/子目录（非递归，支持 limit/offset 分页与单字段排序，字段前加 - 表示降序）。"
    )
    public DirectoryListResult listDirectory(
            @ToolParam(required = false, description = "目录虚拟路径，例如 /public/docs；为空或 / 时列出集合入口") String path,
            @ToolParam(required = false, description = "分页大小（默认 200，上限 500）") Integer limit,
            @ToolParam(required = false, description = "偏移量，从 0 开始") Integer offset,
            @ToolParam(required = false, description = "排序字段，例如 name、-size_bytes、modified_at") String sort
    ) {
        ListParams params = queryEngine.parse(
                limit == null ? null : String.valueOf(limit),
                offset == null ? null : String.valueOf(offset),
                sort
        );
        CancellationSignal signal = CancellationSignal.deadline(properties.getListTimeout(), clock);
        String virtualPath = normalize(path);

        List<Descriptor> entries = "/".equals(virtualPath)
                ? fileService.listCollection(signal)
                : fileService.listVirtualPath(virtualPath, signal);
        ListPage page = queryEngine.apply(entries, params, virtualPath);

        List<FileAttributes> result = new ArrayList<>(page.entries().size());
        for (Descriptor entry : page.entries()) {
            result.add(FileAttributes.from(entry.metadata()));
        }
        return new DirectoryListResult(virtualPath, page.totalCount(), params.offset(), params.limit(),
                params.sortToken(), page.hasMore(), result);
    }

    @Tool(
            name = "fs_describe",
            description = "查看单个文件/目录/符号链接的属性（大小、权限、属主、MIME、时间戳）。"
    )
    public FileAttributes describe(
            @ToolParam(description = "条目虚拟路径，例如 /public/docs/readme.md") String path
    ) {
        return FileAttributes.from(fileService.resolveVirtualPath(normalize(path)).metadata());
    }

    private static String normalize(String path) {
        if (path == null || path.isBlank()) {
            return "/";
        }
        String trimmed = path.trim();
        if (!trimmed.startsWith("/")) {
            trimmed = "/" + trimmed;
        }
        while (trimmed.length() > 1 && trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed;
    }
}
