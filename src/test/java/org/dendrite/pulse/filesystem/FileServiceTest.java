package org.dendrite.pulse.filesystem;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FileServiceTest {

    @TempDir
    Path tmp;

    @Test
    void listRoots_returnsOneFolderPerVirtualRoot() throws Exception {
        Path a = Files.createDirectory(tmp.resolve("a"));
        Path b = Files.createDirectory(tmp.resolve("b"));
        FileService service = TestFileServices.service(
                new RootDefinition("/public", a.toString()),
                new RootDefinition("/private", b.toString()));

        List<Descriptor> roots = service.listRoots();

        assertThat(roots).extracting(Descriptor::name).containsExactly("public", "private");
        assertThat(roots).allSatisfy(d -> assertThat(d.kind()).isEqualTo(ResourceKind.FOLDER));
        assertThat(service.listCollection(CancellationSignal.NONE)).hasSize(2);
    }

    @Test
    void listCollection_singleSlashRootListsContentsDirectly() throws Exception {
        Path a = Files.createDirectory(tmp.resolve("a"));
        TestFileServices.write(a, "one.txt", "1");
        TestFileServices.write(a, "two.txt", "2");
        FileService service = TestFileServices.service(new RootDefinition("/", a.toString()));

        List<Descriptor> entries = service.listCollection(CancellationSignal.NONE);

        assertThat(entries).extracting(Descriptor::name).containsExactlyInAnyOrder("one.txt", "two.txt");
        assertThat(entries).noneMatch(d -> d.name().equals("/"));
    }

    @Test
    void resolve_unknownRootIsRootNotFound() throws Exception {
        Path a = Files.createDirectory(tmp.resolve("a"));
        FileService service = TestFileServices.service(new RootDefinition("/public", a.toString()));

        assertThatThrownBy(() -> service.resolve("/nope", "x"))
                .isInstanceOf(FileAccessException.class)
                .extracting(e -> ((FileAccessException) e).getReason())
                .isEqualTo(FileAccessException.Reason.ROOT_NOT_FOUND);
        assertThatThrownBy(() -> service.list("/nope", "", CancellationSignal.NONE))
                .isInstanceOf(FileAccessException.class)
                .extracting(e -> ((FileAccessException) e).getReason())
                .isEqualTo(FileAccessException.Reason.ROOT_NOT_FOUND);
        assertThatThrownBy(() -> service.resolveVirtualPath("/nope/x"))
                .isInstanceOf(FileAccessException.class)
                .extracting(e -> ((FileAccessException) e).getReason())
                .isEqualTo(FileAccessException.Reason.ROOT_NOT_FOUND);
    }

    @Test
    void prepareDelivery_usesSniffedTypeForFilesAndSymlinkTargets() throws Exception {
        Path a = Files.createDirectory(tmp.resolve("a"));
        TestFileServices.write(a, "page.html", "<html><body>hi</body></html>");
        Files.createSymbolicLink(a.resolve("page-link"), a.resolve("page.html"));
        FileService service = TestFileServices.service(new RootDefinition("/site", a.toString()));

        FileService.Delivery direct = service.prepareDelivery(service.resolve("/site", "page.html"));
        FileService.Delivery viaLink = service.prepareDelivery(service.resolve("/site", "page-link"));

        assertThat(direct.contentType()).isEqualTo("text/html; charset=utf-8");
        assertThat(viaLink.contentType()).isEqualTo("text/html; charset=utf-8");
        assertThat(viaLink.fileName()).isEqualTo("page-link");
        assertThat(viaLink.path()).isEqualTo(a.toRealPath().resolve("page.html"));
    }
}
