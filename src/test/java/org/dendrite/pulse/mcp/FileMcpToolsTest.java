package org.dendrite.pulse.mcp;

import org.dendrite.pulse.filesystem.FileAccessException;
import org.dendrite.pulse.filesystem.FileServerProperties;
import org.dendrite.pulse.filesystem.RootDefinition;
import org.dendrite.pulse.filesystem.TestFileServices;
import org.dendrite.pulse.filesystem.dto.AllowedRoot;
import org.dendrite.pulse.filesystem.dto.AllowedRootsResult;
import org.dendrite.pulse.filesystem.dto.DirectoryListResult;
import org.dendrite.pulse.filesystem.dto.FileAttributes;
import org.dendrite.pulse.filesystem.query.InvalidQueryParameterException;
import org.dendrite.pulse.filesystem.query.ListQueryEngine;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FileMcpToolsTest {

    @TempDir
    Path tmp;

    @Test
    void listRoots_reportsVirtualNames() throws Exception {
        Path a = Files.createDirectory(tmp.resolve("a"));
        Path b = Files.createDirectory(tmp.resolve("b"));
        FileMcpTools tools = tools(new RootDefinition("/public", a.toString()), new RootDefinition("/private", b.toString()));

        AllowedRootsResult result = tools.listRoots();

        assertThat(result.singleSlashRoot()).isFalse();
        assertThat(result.roots()).extracting(AllowedRoot::name).containsExactly("public", "private");
        assertThat(result.roots()).extracting(AllowedRoot::virtual).containsExactly("/public", "/private");
    }

    @Test
    void listDirectory_appliesPagingAndSort() throws Exception {
        Path a = Files.createDirectory(tmp.resolve("a"));
        TestFileServices.write(a, "docs/small.txt", "1");
        TestFileServices.write(a, "docs/large.txt", "1234567890");
        TestFileServices.write(a, "docs/medium.txt", "12345");
        FileMcpTools tools = tools(new RootDefinition("/public", a.toString()));

        DirectoryListResult result = tools.listDirectory("public/docs/", 2, 0, "-size_bytes");

        assertThat(result.path()).isEqualTo("/public/docs");
        assertThat(result.totalCount()).isEqualTo(3);
        assertThat(result.hasMore()).isTrue();
        assertThat(result.sort()).isEqualTo("-size_bytes");
        assertThat(result.entries()).extracting(FileAttributes::name).containsExactly("large.txt", "medium.txt");
    }

    @Test
    void listDirectory_blankPathListsCollection() throws Exception {
        Path a = Files.createDirectory(tmp.resolve("a"));
        TestFileServices.write(a, "x.txt", "x");
        FileMcpTools tools = tools(new RootDefinition("/", a.toString()));

        DirectoryListResult result = tools.listDirectory(null, null, null, null);

        assertThat(result.path()).isEqualTo("/");
        assertThat(result.limit()).isEqualTo(200);
        assertThat(result.entries()).extracting(FileAttributes::name).containsExactly("x.txt");
    }

    @Test
    void listDirectory_rejectsInvalidParameters() throws Exception {
        Path a = Files.createDirectory(tmp.resolve("a"));
        FileMcpTools tools = tools(new RootDefinition("/public", a.toString()));

        assertThatThrownBy(() -> tools.listDirectory("/public", 501, null, null))
                .isInstanceOf(InvalidQueryParameterException.class);
        assertThatThrownBy(() -> tools.listDirectory("/public", null, null, "owner"))
                .isInstanceOf(InvalidQueryParameterException.class);
    }

    @Test
    void describe_returnsAttributes() throws Exception {
        Path a = Files.createDirectory(tmp.resolve("a"));
        TestFileServices.write(a, "readme.md", "hello");
        FileMcpTools tools = tools(new RootDefinition("/public", a.toString()));

        FileAttributes attributes = tools.describe("/public/readme.md");

        assertThat(attributes.resourceKind()).isEqualTo("file");
        assertThat(attributes.sizeBytes()).isEqualTo(5L);
        assertThat(tools.describe("/public").resourceKind()).isEqualTo("folder");
        assertThatThrownBy(() -> tools.describe("/public/../etc"))
                .isInstanceOf(FileAccessException.class)
                .extracting(e -> ((FileAccessException) e).getReason())
                .isEqualTo(FileAccessException.Reason.OUTSIDE_ROOT);
    }

    private static FileMcpTools tools(RootDefinition... roots) {
        return new FileMcpTools(TestFileServices.service(roots), new ListQueryEngine(200, 500),
                new FileServerProperties(), Clock.systemUTC());
    }
}
