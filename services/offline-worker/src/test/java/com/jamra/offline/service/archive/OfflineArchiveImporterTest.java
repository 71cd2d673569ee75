package com.jamra.offline.service.archive;

import com.jamra.offline.model.OfflineChapterMetadata;
import com.jamra.offline.model.OfflineChapterPages;
import com.jamra.offline.model.OfflineMangaMetadata;
import com.jamra.offline.repository.OfflineChapterRecord;
import com.jamra.offline.repository.OfflineMangaRecord;
import com.jamra.offline.service.LoggerService;
import com.jamra.offline.service.storage.OfflineStorageManager;
import com.jamra.offline.util.OfflinePaths;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static com.jamra.offline.service.archive.ArchiveFixture.EXT;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class OfflineArchiveImporterTest {

    private static final String METADATA = "{\"mangaId\":\"m1\",\"slug\":\"solo-leveling\",\"extensionId\":\"weebcentral\",\"title\":\"Solo Leveling\"}";

    @TempDir
    Path tempDir;

    @Mock
    private OfflineStorageManager storageManager;

    @Mock
    private LoggerService logger;

    private ArchiveFixture source;
    private ArchiveFixture target;
    private OfflineArchiveImporter importer;
    private Path archive;

    @BeforeEach
    void setUp() throws IOException {
        source = new ArchiveFixture(tempDir.resolve("source"));
        OfflineMangaMetadata metadata = source.storeManga("m1", "solo-leveling", "Solo Leveling", 2, 3);
        when(storageManager.getMangaMetadata(EXT, "m1")).thenReturn(Optional.of(metadata));
        archive = tempDir.resolve("solo.zip");
        new OfflineArchiver(storageManager, source.fileStore, source.paths, logger)
                .archiveManga(EXT, "m1", archive, ArchiveOptions.defaults());

        target = new ArchiveFixture(tempDir.resolve("target"));
        importer = new OfflineArchiveImporter(target.repository, target.fileStore, target.paths, logger);
        importer.setCurrentTimeSupplier(() -> 777L);
    }

    @Test
    void exportedMangaImportsIntoAnotherDataDirectory() throws IOException {
        ImportResult result = importer.importMangaArchive(archive, ImportOptions.defaults());

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.isSkipped()).isFalse();
        assertThat(result.getChaptersImported()).isEqualTo(2);

        OfflineMangaRecord manga = target.repository.getManga(EXT, "m1").orElseThrow();
        assertThat(manga.getMangaSlug()).isEqualTo("solo-leveling");
        assertThat(manga.getTotalSizeBytes()).isPositive();
        List<OfflineChapterRecord> chapters = target.repository.getChapters(manga.getId());
        assertThat(chapters).extracting(OfflineChapterRecord::getChapterId).containsExactlyInAnyOrder("m1-c1", "m1-c2");
        assertThat(chapters).extracting(OfflineChapterRecord::getTotalPages).containsExactlyInAnyOrder(2, 3);
        assertThat(target.repository.isChapterDownloaded(EXT, "m1", "m1-c2")).isTrue();

        OfflineMangaMetadata sidecar = target.fileStore.readJson(target.paths.mangaMetadataFile(EXT, "solo-leveling"), OfflineMangaMetadata.class);
        assertThat(sidecar.getTitle()).isEqualTo("Solo Leveling");
        assertThat(sidecar.getCoverPath()).isEqualTo("cover.jpg");
        assertThat(sidecar.getChapters()).extracting(OfflineChapterMetadata::getFolderName)
                .containsExactly("chapter-0001", "chapter-0002");
        assertThat(target.paths.mangaDir(EXT, "solo-leveling").resolve("cover.jpg")).exists();
        assertThat(target.paths.pagePath(EXT, "solo-leveling", "chapter-0002", OfflinePaths.pageFilename(2, "jpg"))).exists();
        assertThat(target.paths.dataDir().resolve(".temp")).isEmptyDirectory();
    }

    @Test
    void storedMangaIsSkippedByDefault() throws IOException {
        importer.importMangaArchive(archive, ImportOptions.defaults());
        Path extra = target.paths.chapterDir(EXT, "solo-leveling", "chapter-0001").resolve("keep.txt");
        Files.writeString(extra, "local");

        ImportResult result = importer.importMangaArchive(archive, ImportOptions.defaults());

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.isSkipped()).isTrue();
        assertThat(result.getChaptersImported()).isZero();
        assertThat(extra).exists();
    }

    @Test
    void overwriteReplacesTheStoredCopy() throws IOException {
        importer.importMangaArchive(archive, ImportOptions.defaults());
        Path extra = target.paths.chapterDir(EXT, "solo-leveling", "chapter-0001").resolve("keep.txt");
        Files.writeString(extra, "local");

        ImportResult result = importer.importMangaArchive(archive, new ImportOptions(ConflictResolution.OVERWRITE, true));

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getChaptersImported()).isEqualTo(2);
        assertThat(extra).doesNotExist();
        OfflineMangaRecord manga = target.repository.getManga(EXT, "m1").orElseThrow();
        assertThat(target.repository.getChapters(manga.getId())).hasSize(2);
    }

    @Test
    void renameMovesAsideFromAForeignFolderButNotFromTheSameManga() throws IOException {
        Files.createDirectories(target.paths.mangaDir(EXT, "solo-leveling"));
        ImportOptions rename = new ImportOptions(ConflictResolution.RENAME, true);

        ImportResult renamed = importer.importMangaArchive(archive, rename);

        assertThat(renamed.isSuccess()).isTrue();
        assertThat(target.repository.getManga(EXT, "m1").orElseThrow().getMangaSlug()).isEqualTo("solo-leveling-777");
        assertThat(target.paths.mangaMetadataFile(EXT, "solo-leveling-777")).exists();

        ImportResult again = importer.importMangaArchive(archive, rename);

        assertThat(again.isSuccess()).isFalse();
        assertThat(again.getError()).startsWith("Manga m1 is already stored offline");
    }

    @Test
    void importedChapterSidecarsPointAtTheirNewFolder() throws IOException {
        importer.importMangaArchive(archive, ImportOptions.defaults());

        OfflineChapterPages pages = target.fileStore.readJson(
                target.paths.chapterMetadataFile(EXT, "solo-leveling", "chapter-0002"), OfflineChapterPages.class);

        assertThat(pages.getChapterId()).isEqualTo("m1-c2");
        assertThat(pages.getMangaId()).isEqualTo("m1");
        assertThat(pages.getFolderName()).isEqualTo("chapter-0002");
        assertThat(pages.getPages()).hasSize(3);
    }

    @Test
    void validArchiveIsSummarised() {
        ArchiveValidation validation = importer.validateArchive(archive);

        assertThat(validation.isValid()).isTrue();
        assertThat(validation.getErrors()).isEmpty();
        assertThat(validation.getManga()).isEqualTo(new ArchiveValidation.Summary("Solo Leveling", EXT, "m1", 2));
        assertThat(target.paths.dataDir().resolve(".temp")).isEmptyDirectory();
    }

    @Test
    void archiveWithoutMetadataIsRejected() throws IOException {
        Path bare = ArchiveFixture.zip(tempDir.resolve("bare.zip"), Map.of("chapters/chapter-0001/page-0000.jpg", "x"));

        ArchiveValidation validation = importer.validateArchive(bare);
        ImportResult result = importer.importMangaArchive(bare, ImportOptions.defaults());

        assertThat(validation.isValid()).isFalse();
        assertThat(validation.getErrors()).containsExactly("Missing metadata.json file");
        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getError()).isEqualTo("Archive validation failed: Missing metadata.json file");
        assertThat(target.repository.getManga(EXT, "m1")).isEmpty();
    }

    @Test
    void chaptersWithoutSidecarOrImagesAreReportedAsWarnings() throws IOException {
        Map<String, String> entries = new LinkedHashMap<>();
        entries.put("metadata.json", METADATA);
        entries.put("chapters/chapter-0001/page-0000.jpg", "x");
        entries.put("chapters/chapter-0002/metadata.json", "{\"chapterId\":\"c2\",\"pages\":[]}");
        Path broken = ArchiveFixture.zip(tempDir.resolve("broken.zip"), entries);

        ArchiveValidation validation = importer.validateArchive(broken);

        assertThat(validation.isValid()).isFalse();
        assertThat(validation.getWarnings()).containsExactly(
                "Chapter chapter-0001: missing metadata.json",
                "Chapter chapter-0002: no image files found");
        assertThat(validation.getErrors()).containsExactly("No valid chapters found in archive");
    }

    @Test
    void unreadableMetadataAndMissingFieldsAreErrors() throws IOException {
        Path garbled = ArchiveFixture.zip(tempDir.resolve("garbled.zip"), Map.of("metadata.json", "{not json"));
        Path partial = ArchiveFixture.zip(tempDir.resolve("partial.zip"), Map.of("metadata.json", "{\"mangaId\":\"m1\"}"));
        Path escaping = ArchiveFixture.zip(tempDir.resolve("escaping.zip"), Map.of("metadata.json",
                "{\"mangaId\":\"m1\",\"extensionId\":\"..\",\"title\":\"Solo Leveling\"}"));

        assertThat(importer.validateArchive(garbled).getErrors()).singleElement()
                .asString().startsWith("Failed to parse metadata.json: ");
        assertThat(importer.validateArchive(partial).getErrors())
                .contains("Invalid metadata.json: missing required fields");
        assertThat(importer.validateArchive(escaping).getErrors())
                .contains("Invalid metadata.json: unsafe extensionId ..");
    }

    @Test
    void entriesEscapingTheExtractionDirectoryAbortTheImport() throws IOException {
        Map<String, String> entries = new LinkedHashMap<>();
        entries.put("metadata.json", METADATA);
        entries.put("../../escaped.txt", "gotcha");
        Path hostile = ArchiveFixture.zip(tempDir.resolve("hostile.zip"), entries);

        ImportResult result = importer.importMangaArchive(hostile, ImportOptions.defaults());
        ArchiveValidation validation = importer.validateArchive(hostile);

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getError()).isEqualTo("Archive entry escapes target directory: ../../escaped.txt");
        assertThat(validation.getErrors()).containsExactly(
                "Failed to extract archive: Archive entry escapes target directory: ../../escaped.txt");
        assertThat(target.paths.dataDir().resolve("escaped.txt")).doesNotExist();
        assertThat(target.paths.dataDir().resolve(".temp").resolve("escaped.txt")).doesNotExist();
    }
}
