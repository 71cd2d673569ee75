package com.jamra.offline.util;

import com.jamra.offline.model.OfflinePageMetadata;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OfflineFileStoreTest {

    private final OfflineFileStore fileStore = new OfflineFileStore();

    @Test
    void writeJsonCreatesParentsAndLeavesNoTempFile(@TempDir Path root) throws IOException {
        Path file = root.resolve("a/b/metadata.json");
        OfflinePageMetadata page = new OfflinePageMetadata(1, "https://cdn/1.jpg", "page-0001.jpg", 800, 1200, 1024L, "image/jpeg");

        fileStore.writeJson(file, page);

        assertThat(fileStore.readJson(file, OfflinePageMetadata.class)).isEqualTo(page);
        assertThat(Files.exists(root.resolve("a/b/metadata.json.tmp"))).isFalse();
    }

    @Test
    void readJsonRejectsMalformedAndEmptyFiles(@TempDir Path root) throws IOException {
        Path malformed = Files.writeString(root.resolve("bad.json"), "{not json");
        Path empty = Files.writeString(root.resolve("empty.json"), "");

        assertThatThrownBy(() -> fileStore.readJson(malformed, OfflinePageMetadata.class))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("Malformed JSON");
        assertThatThrownBy(() -> fileStore.readJson(empty, OfflinePageMetadata.class))
                .isInstanceOf(IOException.class);
    }

    @Test
    void dirSizeAndDeleteDirWalkNestedTrees(@TempDir Path root) throws IOException {
        Path manga = root.resolve("manga");
        Files.createDirectories(manga.resolve("chapters/chapter-0001"));
        Files.write(manga.resolve("cover.jpg"), new byte[10]);
        Files.write(manga.resolve("chapters/chapter-0001/page-0001.jpg"), new byte[25]);

        assertThat(fileStore.dirSize(manga)).isEqualTo(35);
        assertThat(fileStore.listDirs(root)).containsExactly(manga);

        fileStore.deleteDir(manga);

        assertThat(Files.exists(manga)).isFalse();
        assertThat(fileStore.dirSize(manga)).isZero();
        fileStore.deleteDir(manga);
    }
}
