package org.dendrite.pulse.web;

import jakarta.servlet.http.HttpServletRequest;
import org.dendrite.pulse.filesystem.CancellationSignal;
import org.dendrite.pulse.filesystem.Descriptor;
import org.dendrite.pulse.filesystem.FileAccessException;
import org.dendrite.pulse.filesystem.FileServerProperties;
import org.dendrite.pulse.filesystem.FileService;
import org.dendrite.pulse.filesystem.dto.CollectionResponse;
import org.dendrite.pulse.filesystem.dto.ErrorResponse;
import org.dendrite.pulse.filesystem.dto.FileResource;
import org.dendrite.pulse.filesystem.dto.PaginationMeta;
import org.dendrite.pulse.filesystem.query.ListPage;
import org.dendrite.pulse.filesystem.query.ListParams;
import org.dendrite.pulse.filesystem.query.ListQueryEngine;
import org.springframework.core.io.FileSystemResource;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.util.UriUtils;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * 文件/目录的 HTTP 入口（JSON:API）。
 * <ul>
 *   <li>{@code GET /api/v1/files}：集合入口，列出虚拟根；只有一个 {@code /} 根时直接列出其内容。</li>
 *   <li>{@code GET /api/v1/files/{虚拟路径}}：目录返回分页列表，文件直接输出内容（{@code download=1} 时作为附件）；以 {@code /} 结尾的路径返回 404。</li>
 * </ul>
 */
@RestController
@RequestMapping(FileController.API_PREFIX)
public class FileController {

    static final String API_PREFIX = "/api/v1/files";

    private final FileService fileService;
    private final ListQueryEngine queryEngine;
    private final FileServerProperties properties;
    private final Clock clock;

    public FileController(FileService fileService, ListQueryEngine queryEngine, FileServerProperties properties, Clock clock) {
        this.fileService = fileService;
        this.queryEngine = queryEngine;
        this.properties = properties;
        this.clock = clock;
    }

    @GetMapping({"", "/"})
    public ResponseEntity<CollectionResponse> listCollection(
            @RequestParam(name = "page[limit]", required = false) String limit,
            @RequestParam(name = "page[offset]", required = false) String offset,
            @RequestParam(name = "sort", required = false) String sort
    ) {
        ListParams params = queryEngine.parse(limit, offset, sort);
        List<Descriptor> entries = fileService.listCollection(requestSignal());
        return collection(entries, params, API_PREFIX);
    }

    @GetMapping("/**")
    public ResponseEntity<?> getResource(
            @RequestParam(name = "page[limit]", required = false) String limit,
            @RequestParam(name = "page[offset]", required = false) String offset,
            @RequestParam(name = "sort", required = false) String sort,
            @RequestParam(name = "download", required = false) String download,
            HttpServletRequest request
    ) {
        String basePath = request.getRequestURI().substring(request.getContextPath().length());
        String rest = basePath.length() > API_PREFIX.length() ? basePath.substring(API_PREFIX.length()) : "";
        if (rest.isEmpty() || "/".equals(rest)) {
            return listCollection(limit, offset, sort);
        }
        if (rest.endsWith("/")) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND)
                    .contentType(JsonApi.MEDIA_TYPE)
                    .body(ErrorResponse.of(HttpStatus.NOT_FOUND.value(), HttpStatus.NOT_FOUND.getReasonPhrase(),
                            "trailing slash is not allowed"));
        }
        String virtualPath;
        try {
            virtualPath = UriUtils.decode(rest, StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            throw new FileAccessException(FileAccessException.Reason.INVALID_PATH, rest, "路径编码非法", e);
        }

        Descriptor descriptor = fileService.resolveVirtualPath(virtualPath);
        if (descriptor.isFolder()) {
            ListParams params = queryEngine.parse(limit, offset, sort);
            List<Descriptor> entries = fileService.listVirtualPath(virtualPath, requestSignal());
            return collection(entries, params, basePath);
        }
        return serveFile(descriptor, "1".equals(download));
    }

    private ResponseEntity<CollectionResponse> collection(List<Descriptor> entries, ListParams params, String basePath) {
        ListPage page = queryEngine.apply(entries, params, basePath);
        List<FileResource> data = new ArrayList<>(page.entries().size());
        for (Descriptor entry : page.entries()) {
            data.add(FileResource.from(entry, API_PREFIX));
        }
        CollectionResponse body = new CollectionResponse(
                new PaginationMeta(page.totalCount(), params.offset(), params.limit()),
                data,
                page.links()
        );
        return ResponseEntity.ok().contentType(JsonApi.MEDIA_TYPE).body(body);
    }

    private ResponseEntity<FileSystemResource> serveFile(Descriptor descriptor, boolean attachment) {
        FileService.Delivery delivery = fileService.prepareDelivery(descriptor);
        ResponseEntity.BodyBuilder builder = ResponseEntity.ok()
                .contentType(MediaType.parseMediaType(delivery.contentType()));
        if (attachment) {
            ContentDisposition disposition = ContentDisposition.attachment()
                    .filename(delivery.fileName(), StandardCharsets.UTF_8)
                    .build();
            builder.header(HttpHeaders.CONTENT_DISPOSITION, disposition.toString());
        }
        // FileSystemResource 按流输出，不会把整个文件读入内存
        return builder.body(new FileSystemResource(delivery.path()));
    }

    private CancellationSignal requestSignal() {
        return CancellationSignal.deadline(properties.getListTimeout(), clock);
    }
}
