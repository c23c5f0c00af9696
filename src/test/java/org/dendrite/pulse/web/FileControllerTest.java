package org.dendrite.pulse.web;

import org.dendrite.pulse.filesystem.FileServerProperties;
import org.dendrite.pulse.filesystem.FileService;
import org.dendrite.pulse.filesystem.RootDefinition;
import org.dendrite.pulse.filesystem.TestFileServices;
import org.dendrite.pulse.filesystem.query.ListQueryEngine;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.http.HttpHeaders;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;

import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.not;
import static org.hamcrest.Matchers.nullValue;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class FileControllerTest {

    @TempDir
    Path tmp;

    @Test
    void listDirectory_sortsDescendingByName() throws Exception {
        Path data = Files.createDirectory(tmp.resolve("data"));
        TestFileServices.write(data, "alpha.txt", "a");
        TestFileServices.write(data, "zebra.txt", "z");
        MockMvc mockMvc = mockMvc(new RootDefinition("/data", data.toString()));

        mockMvc.perform(get("/api/v1/files/data").param("sort", "-name"))
                .andExpect(status().isOk())
                .andExpect(content().contentType(JsonApi.CONTENT_TYPE))
                .andExpect(jsonPath("$.data.length()").value(2))
                .andExpect(jsonPath("$.data[0].attributes.name").value("zebra.txt"))
                .andExpect(jsonPath("$.data[1].attributes.name").value("alpha.txt"))
                .andExpect(jsonPath("$.data[0].type").value("files"))
                .andExpect(jsonPath("$.data[0].id").value("/data/zebra.txt"))
                .andExpect(jsonPath("$.data[0].links.self").value("/api/v1/files/data/zebra.txt"))
                .andExpect(jsonPath("$.links.self").value("/api/v1/files/data?page[offset]=0&page[limit]=200&sort=-name"));
    }

    @Test
    void listDirectory_paginatesWithNavigationLinks() throws Exception {
        Path data = Files.createDirectory(tmp.resolve("data"));
        for (int i = 0; i < 10; i++) {
            TestFileServices.write(data, "file" + i, "x");
        }
        MockMvc mockMvc = mockMvc(new RootDefinition("/data", data.toString()));

        mockMvc.perform(get("/api/v1/files/data").param("page[limit]", "3").param("page[offset]", "3"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.meta.total_count").value(10))
                .andExpect(jsonPath("$.meta.offset").value(3))
                .andExpect(jsonPath("$.meta.limit").value(3))
                .andExpect(jsonPath("$.data[0].attributes.name").value("file3"))
                .andExpect(jsonPath("$.data[1].attributes.name").value("file4"))
                .andExpect(jsonPath("$.data[2].attributes.name").value("file5"))
                .andExpect(jsonPath("$.links.prev").value("/api/v1/files/data?page[offset]=0&page[limit]=3"))
                .andExpect(jsonPath("$.links.next").value("/api/v1/files/data?page[offset]=6&page[limit]=3"))
                .andExpect(jsonPath("$.links.last").value("/api/v1/files/data?page[offset]=9&page[limit]=3"));
    }

    @Test
    void listDirectory_attributesUseSnakeCaseAndNullForAbsentValues() throws Exception {
        Path data = Files.createDirectory(tmp.resolve("data"));
        Files.createDirectory(data.resolve("sub"));
        MockMvc mockMvc = mockMvc(new RootDefinition("/data", data.toString()));

        mockMvc.perform(get("/api/v1/files/data"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data[0].attributes.resource_kind").value("folder"))
                .andExpect(jsonPath("$.data[0].attributes.mime_type").value("inode/directory"))
                .andExpect(jsonPath("$.data[0].attributes.size_bytes").value(nullValue()))
                .andExpect(jsonPath("$.data[0].attributes.born_at").value(nullValue()));
    }

    @Test
    void collection_listsRootsWhenSeveralAreConfigured() throws Exception {
        Path a = Files.createDirectory(tmp.resolve("a"));
        Path b = Files.createDirectory(tmp.resolve("b"));
        MockMvc mockMvc = mockMvc(
                new RootDefinition("/public", a.toString()),
                new RootDefinition("/archive", b.toString()));

        mockMvc.perform(get("/api/v1/files"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.meta.total_count").value(2))
                .andExpect(jsonPath("$.data[0].attributes.name").value("archive"))
                .andExpect(jsonPath("$.data[1].attributes.name").value("public"))
                .andExpect(jsonPath("$.data[1].links.self").value("/api/v1/files/public"));
    }

    @Test
    void collection_singleSlashRootListsItsContents() throws Exception {
        Path a = Files.createDirectory(tmp.resolve("a"));
        TestFileServices.write(a, "readme.md", "# hi");
        MockMvc mockMvc = mockMvc(new RootDefinition("/", a.toString()));

        mockMvc.perform(get("/api/v1/files/"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.length()").value(1))
                .andExpect(jsonPath("$.data[0].attributes.name").value("readme.md"))
                .andExpect(jsonPath("$.data[0].id").value("/readme.md"));

        mockMvc.perform(get("/api/v1/files/readme.md"))
                .andExpect(status().isOk())
                .andExpect(content().string("# hi"));
    }

    @Test
    void file_isServedWithSniffedContentType() throws Exception {
        Path data = Files.createDirectory(tmp.resolve("data"));
        TestFileServices.write(data, "docs/a.txt", "hello world\n");
        MockMvc mockMvc = mockMvc(new RootDefinition("/data", data.toString()));

        mockMvc.perform(get("/api/v1/files/data/docs/a.txt"))
                .andExpect(status().isOk())
                .andExpect(header().string(HttpHeaders.CONTENT_TYPE, containsString("text/plain")))
                .andExpect(header().doesNotExist(HttpHeaders.CONTENT_DISPOSITION))
                .andExpect(content().string("hello world\n"));
    }

    @Test
    void file_downloadFlagSetsAttachmentDisposition() throws Exception {
        Path data = Files.createDirectory(tmp.resolve("data"));
        TestFileServices.write(data, "report.txt", "numbers");
        MockMvc mockMvc = mockMvc(new RootDefinition("/data", data.toString()));

        mockMvc.perform(get("/api/v1/files/data/report.txt").param("download", "1"))
                .andExpect(status().isOk())
                .andExpect(header().string(HttpHeaders.CONTENT_DISPOSITION, containsString("attachment")))
                .andExpect(header().string(HttpHeaders.CONTENT_DISPOSITION, containsString("report.txt")));
    }

    @Test
    void symlinkEscape_isBadRequest() throws Exception {
        Path data = Files.createDirectory(tmp.resolve("data"));
        Path outside = TestFileServices.write(tmp, "outside/secret.txt", "secret");
        Files.createSymbolicLink(data.resolve("escape"), outside);
        MockMvc mockMvc = mockMvc(new RootDefinition("/data", data.toString()));

        mockMvc.perform(get("/api/v1/files/data/escape"))
                .andExpect(status().isBadRequest())
                .andExpect(content().contentType(JsonApi.CONTENT_TYPE))
                .andExpect(jsonPath("$.errors[0].status").value("400"))
                .andExpect(jsonPath("$.errors[0].detail").value("path escapes configured root"));
    }

    @Test
    void errors_areMappedToStatusCodes() throws Exception {
        Path data = Files.createDirectory(tmp.resolve("data"));
        TestFileServices.write(data, "a.txt", "a");
        MockMvc mockMvc = mockMvc(new RootDefinition("/data", data.toString()));

        mockMvc.perform(get("/api/v1/files/nope/a.txt"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.errors[0].detail").value("file root not found"));
        mockMvc.perform(get("/api/v1/files/data/missing.txt"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.errors[0].detail").value("file not found"));
        mockMvc.perform(get("/api/v1/files/data").param("page[limit]", "501"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errors[0].detail").value("page[limit] exceeds maximum of 500"));
        mockMvc.perform(get("/api/v1/files/data").param("sort", "unknown_field"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errors[0].detail").value("invalid sort field: unknown_field"));
    }

    @Test
    void trailingSlashOnResourcePath_isNotFound() throws Exception {
        Path data = Files.createDirectory(tmp.resolve("data"));
        TestFileServices.write(data, "a.txt", "a");
        MockMvc mockMvc = mockMvc(new RootDefinition("/data", data.toString()));

        mockMvc.perform(get("/api/v1/files/data/a.txt/"))
                .andExpect(status().isNotFound())
                .andExpect(content().contentType(JsonApi.CONTENT_TYPE))
                .andExpect(jsonPath("$.errors[0].detail").value("trailing slash is not allowed"));
        mockMvc.perform(get("/api/v1/files/data/"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.errors[0].detail").value("trailing slash is not allowed"));
    }

    @Test
    void nulInPath_isBadRequest() throws Exception {
        Path data = Files.createDirectory(tmp.resolve("data"));
        MockMvc mockMvc = mockMvc(new RootDefinition("/data", data.toString()));

        mockMvc.perform(get(URI.create("/api/v1/files/data/a%00b")))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errors[0].detail").value("invalid path"));
    }

    @Test
    void errorDetail_neverContainsHostPath() throws Exception {
        Path data = Files.createDirectory(tmp.resolve("data"));
        MockMvc mockMvc = mockMvc(new RootDefinition("/data", data.toString()));

        mockMvc.perform(get("/api/v1/files/data/missing.txt"))
                .andExpect(status().isNotFound())
                .andExpect(content().string(not(containsString(tmp.toString()))));
    }

    private static MockMvc mockMvc(RootDefinition... roots) {
        FileService service = TestFileServices.service(roots);
        FileServerProperties properties = new FileServerProperties();
        properties.setListTimeout(Duration.ofSeconds(30));
        FileController controller = new FileController(service, new ListQueryEngine(200, 500), properties, Clock.systemUTC());
        return MockMvcBuilders.standaloneSetup(controller)
                .setControllerAdvice(new JsonApiExceptionHandler())
                .build();
    }
}
