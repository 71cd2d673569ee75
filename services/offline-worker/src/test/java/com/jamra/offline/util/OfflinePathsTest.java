package com.jamra.offline.util;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class OfflinePathsTest {

    @Test
    void buildsLayoutUnderOfflineRoot(@TempDir Path dataDir) {
        OfflinePaths paths = new OfflinePaths(dataDir);

        assertThat(paths.offlineDir()).isEqualTo(dataDir.toAbsolutePath().resolve("offline"));
        assertThat(paths.mangaMetadataFile("ext", "one-piece"))
                .isEqualTo(paths.offlineDir().resolve("ext/one-piece/metadata.json"));
        assertThat(paths.pagePath("ext", "one-piece", "chapter-0001", "page-0001.jpg"))
                .isEqualTo(paths.offlineDir().resolve("ext/one-piece/chapters/chapter-0001/page-0001.jpg"));
    }

    @Test
    void acceptsTheOfflineFolderItselfAsDataDir(@TempDir Path dataDir) {
        OfflinePaths paths = new OfflinePaths(dataDir.resolve("offline"));

        assertThat(paths.dataDir()).isEqualTo(dataDir.toAbsolutePath());
        assertThat(paths.offlineDir()).isEqualTo(dataDir.toAbsolutePath().resolve("offline"));
    }

    @Test
    void sanitizeSlugCollapsesAndTrimsDashes() {
        assertThat(OfflinePaths.sanitizeSlug("  One Piece!! (Official) ")).isEqualTo("one-piece-official");
        assertThat(OfflinePaths.sanitizeSlug("Re:Zero -- Starting Life")).isEqualTo("re-zero-starting-life");
        assertThat(OfflinePaths.sanitizeSlug(null)).isEmpty();
    }

    @Test
    void chapterFolderNamePadsNumbersAndDashesTheRest() {
        assertThat(OfflinePaths.chapterFolderName("1")).isEqualTo("chapter-0001");
        assertThat(OfflinePaths.chapterFolderName("1050")).isEqualTo("chapter-1050");
        assertThat(OfflinePaths.chapterFolderName("10.0")).isEqualTo("chapter-0010");
        assertThat(OfflinePaths.chapterFolderName("abc:def")).isEqualTo("chapter-abc-def");
    }

    @Test
    void decimalChapterNumbersDoNotShareTheWholeNumbersFolder() {
        assertThat(OfflinePaths.chapterFolderName("10")).isEqualTo("chapter-0010");
        assertThat(OfflinePaths.chapterFolderName("10.5")).isEqualTo("chapter-0010-5");
        assertThat(OfflinePaths.chapterFolderName("10.50")).isEqualTo("chapter-0010-5");
        assertThat(OfflinePaths.chapterFolderName("12.25 extra")).isEqualTo("chapter-0012-25");
        assertThat(OfflinePaths.chapterFolderNameForId("c10/alt")).isEqualTo("chapter-id-c10-alt");
    }

    @Test
    void imageExtensionPrefersMimeTypeThenUrl() {
        assertThat(OfflinePaths.imageExtension("https://cdn/x/1.jpg", "image/png")).isEqualTo("png");
        assertThat(OfflinePaths.imageExtension("https://cdn/x/1.WEBP?token=abc", null)).isEqualTo("webp");
        assertThat(OfflinePaths.imageExtension("https://cdn/x/page", "application/octet-stream")).isEqualTo("jpg");
        assertThat(OfflinePaths.pageFilename(7, "png")).isEqualTo("page-0007.png");
    }

    @Test
    void chapterTitlesCombineNumberAndTitle() {
        assertThat(ChapterTitles.format("12", "The Return", "c12")).isEqualTo("Chapter 12 - The Return");
        assertThat(ChapterTitles.format(null, "Prologue", "c0")).isEqualTo("Prologue");
        assertThat(ChapterTitles.format("3", " ", "c3")).isEqualTo("Chapter 3");
        assertThat(ChapterTitles.format(null, null, "c9")).isEqualTo("Chapter c9");
    }
}
