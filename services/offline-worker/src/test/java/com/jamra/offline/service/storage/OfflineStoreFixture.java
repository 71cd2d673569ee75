package com.jamra.offline.service.storage;

import com.jamra.offline.model.OfflineChapterMetadata;
import com.jamra.offline.model.OfflineChapterPages;
import com.jamra.offline.model.OfflineMangaMetadata;
import com.jamra.offline.model.OfflinePageMetadata;
import com.jamra.offline.repository.JdbiOfflineRepository;
import com.jamra.offline.repository.OfflineChapterRecord;
import com.jamra.offline.repository.OfflineMangaRecord;
import com.jamra.offline.util.OfflineFileStore;
import com.jamra.offline.util.OfflinePaths;
import org.jdbi.v3.core.Jdbi;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/** Builds stored manga on disk and in an in-memory database for the storage tests. */
class OfflineStoreFixture {

    static final String EXT = "weebcentral";
    static final String MANGA = "m1";
    static final String SLUG = "solo-leveling";

    final JdbiOfflineRepository repository;
    final OfflineFileStore fileStore = new OfflineFileStore();
    final OfflinePaths paths;

    OfflineStoreFixture(Path dataDir) {
        this.repository = new JdbiOfflineRepository(Jdbi.create(
                "jdbc:h2:mem:storage-" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1;DATABASE_TO_UPPER=FALSE"));
        this.paths = new OfflinePaths(dataDir);
    }

    long mangaRow() {
        return repository.insertManga(new OfflineMangaRecord(0, EXT, MANGA, SLUG,
                paths.mangaDir(EXT, SLUG).toString(), 1_000, 1_000, 0));
    }

    /** Writes the page files, the chapter sidecar and the chapter row. */
    void storeChapter(String chapterId, String number, int pageCount, long downloadedAt) throws IOException {
        long mangaRow = mangaRow();
        String folder = OfflinePaths.chapterFolderName(number);
        Path chapterDir = paths.chapterDir(EXT, SLUG, folder);
        Files.createDirectories(chapterDir);

        List<OfflinePageMetadata> pages = new ArrayList<>();
        for (int i = 0; i < pageCount; i++) {
            String filename = OfflinePaths.pageFilename(i, "jpg");
            Files.write(chapterDir.resolve(filename), new byte[]{1, 2, 3, 4, 5});
            pages.add(new OfflinePageMetadata(i, "https://cdn.example/" + chapterId + "/" + i, filename, null, null, 5, "image/jpeg"));
        }
        fileStore.writeJson(paths.chapterMetadataFile(EXT, SLUG, folder),
                new OfflineChapterPages(1, downloadedAt, chapterId, MANGA, folder, pages));
        repository.insertChapter(new OfflineChapterRecord(0, mangaRow, chapterId, number, null, folder,
                pageCount, downloadedAt, 5L * pageCount));
    }

    /** Writes a manga sidecar listing exactly {@code chapterIds}. */
    void writeMangaSidecar(String title, long lastUpdatedAt, String... chapterIds) throws IOException {
        OfflineMangaMetadata metadata = new OfflineMangaMetadata();
        metadata.setMangaId(MANGA);
        metadata.setSlug(SLUG);
        metadata.setExtensionId(EXT);
        metadata.setTitle(title);
        metadata.setDownloadedAt(1_000);
        metadata.setLastUpdatedAt(lastUpdatedAt);
        List<OfflineChapterMetadata> chapters = new ArrayList<>();
        for (String chapterId : chapterIds) {
            OfflineChapterMetadata chapter = new OfflineChapterMetadata();
            chapter.setChapterId(chapterId);
            chapter.setFolderName("chapter-" + chapterId);
            chapters.add(chapter);
        }
        metadata.setChapters(chapters);
        fileStore.writeJson(paths.mangaMetadataFile(EXT, SLUG), metadata);
    }

    OfflineMangaMetadata readMangaSidecar() throws IOException {
        return fileStore.readJson(paths.mangaMetadataFile(EXT, SLUG), OfflineMangaMetadata.class);
    }
}
