package com.jamra.offline.service.cleanup;

import com.jamra.offline.model.OfflineChapterMetadata;
import com.jamra.offline.model.OfflineMangaMetadata;
import com.jamra.offline.repository.JdbiOfflineRepository;
import com.jamra.offline.repository.OfflineMangaRecord;
import com.jamra.offline.service.LoggerService;
import com.jamra.offline.service.event.OfflineEvent;
import com.jamra.offline.service.event.OfflineEventType;
import com.jamra.offline.util.OfflineFileStore;
import com.jamra.offline.util.OfflinePaths;
import org.jdbi.v3.core.Jdbi;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class StorageCleanupServiceTest {

    private static final long GB = 1024L * 1024L * 1024L;
    private static final String EXT = "weebcentral";

    @TempDir
    Path tempDir;

    @Mock
    private LoggerService logger;

    private final Set<Path> undeletable = new HashSet<>();
    private final Map<Path, Long> accessTimes = new HashMap<>();
    private final List<OfflineEvent> events = new ArrayList<>();
    private final OfflineFileStore fileStore = new OfflineFileStore() {
        @Override
        public void deleteDir(Path dir) throws IOException {
            if (undeletable.contains(dir)) {
                throw new IOException("Permission denied");
            }
            super.deleteDir(dir);
        }
    };

    private JdbiOfflineRepository repository;
    private OfflinePaths paths;
    private StorageCleanupService service;

    @BeforeEach
    void setUp() {
        repository = new JdbiOfflineRepository(Jdbi.create(
                "jdbc:h2:mem:cleanup-" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1;DATABASE_TO_UPPER=FALSE"));
        paths = new OfflinePaths(tempDir);
        service = new StorageCleanupService(repository, fileStore, paths, logger) {
            @Override
            protected long lastAccessedAt(Path mangaDir) {
                return accessTimes.getOrDefault(mangaDir, 0L);
            }
        };
        service.on(events::add);
    }

    @Test
    void largestStrategyFreesAtLeastWhatIsNeeded() throws IOException {
        storeManga("small", 100, 2 * GB);
        storeManga("huge", 200, 3 * GB, 2 * GB);
        storeManga("medium", 300, 2 * GB, 2 * GB);

        CleanupResult result = service.performCleanup(settings(10, CleanupStrategy.LARGEST), 1);

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getItemsRemoved()).isEqualTo(1);
        assertThat(result.getFreedBytes()).isGreaterThanOrEqualTo(2 * GB);
        assertThat(paths.mangaDir(EXT, "huge")).doesNotExist();
        assertThat(paths.mangaDir(EXT, "medium")).exists();
        assertThat(repository.getManga(EXT, "huge")).isEmpty();
        assertThat(repository.getManga(EXT, "medium")).isPresent();
        assertThat(events).singleElement().satisfies(event -> {
            assertThat(event.getType()).isEqualTo(OfflineEventType.CLEANUP_PERFORMED);
            assertThat(event.getDeletedBytes()).isEqualTo(5 * GB);
            assertThat(event.getDeletedChapters()).isEqualTo(2);
        });
    }

    @Test
    void oldestStrategyEvictsByDownloadTimeUntilEnoughIsFreed() throws IOException {
        storeManga("newest", 300, 4 * GB);
        storeManga("oldest", 100, 1 * GB);
        storeManga("middle", 200, 6 * GB);

        CleanupResult result = service.performCleanup(settings(10, CleanupStrategy.OLDEST));

        assertThat(result.getItemsRemoved()).isEqualTo(2);
        assertThat(result.getFreedBytes()).isEqualTo(7 * GB);
        assertThat(paths.mangaDir(EXT, "newest")).exists();
    }

    @Test
    void leastAccessedStrategyUsesDirectoryAccessTime() throws IOException {
        storeManga("read-often", 100, 6 * GB);
        storeManga("forgotten", 200, 6 * GB);
        accessTimes.put(paths.mangaDir(EXT, "read-often"), 9_000L);
        accessTimes.put(paths.mangaDir(EXT, "forgotten"), 1_000L);

        service.performCleanup(settings(10, CleanupStrategy.LEAST_ACCESSED), 1);

        assertThat(paths.mangaDir(EXT, "forgotten")).doesNotExist();
        assertThat(paths.mangaDir(EXT, "read-often")).exists();
    }

    @Test
    void failedDeletionIsReportedAndTheNextCandidateIsTried() throws IOException {
        storeManga("huge", 100, 5 * GB);
        storeManga("medium", 200, 4 * GB);
        storeManga("small", 300, 2 * GB);
        undeletable.add(paths.mangaDir(EXT, "huge"));

        CleanupResult result = service.performCleanup(settings(10, CleanupStrategy.LARGEST), 1);

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getErrors()).singleElement().asString()
                .startsWith("Failed to delete weebcentral/huge")
                .contains("Permission denied");
        assertThat(result.getItemsRemoved()).isEqualTo(1);
        assertThat(result.getFreedBytes()).isEqualTo(4 * GB);
        assertThat(repository.getManga(EXT, "huge")).isPresent();
        verify(logger).error(eq("CLEANUP"), anyString(), any(IOException.class));
    }

    @Test
    void nothingHappensBelowTheTarget() throws IOException {
        storeManga("small", 100, 2 * GB);

        CleanupResult result = service.performCleanup(settings(10, CleanupStrategy.OLDEST), 1);

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getItemsRemoved()).isZero();
        assertThat(events).isEmpty();
    }

    @Test
    void shouldCleanupComparesUsageWithTheThreshold() throws IOException {
        storeManga("a", 100, 9 * GB);
        StorageSettings settings = settings(10, CleanupStrategy.OLDEST);

        assertThat(service.shouldCleanup(settings)).isTrue();

        settings.setCleanupThresholdPercent(95);
        assertThat(service.shouldCleanup(settings)).isFalse();

        settings.setCleanupThresholdPercent(90);
        settings.setAutoCleanupEnabled(false);
        assertThat(service.shouldCleanup(settings)).isFalse();

        settings.setAutoCleanupEnabled(true);
        settings.setMaxStorageGB(0);
        assertThat(service.shouldCleanup(settings)).isFalse();
    }

    @Test
    void scanSkipsHiddenDirectoriesAndMangaWithoutSidecar() throws IOException {
        storeManga("listed", 100, GB);
        Files.createDirectories(paths.offlineDir().resolve(".trash").resolve("old"));
        Files.createDirectories(paths.mangaDir(EXT, "half-written"));

        StorageUsage usage = service.getStorageUsage();

        assertThat(usage.getTotalBytes()).isEqualTo(GB);
        assertThat(usage.getMangaCount()).isEqualTo(1);
    }

    @Test
    void strategyNamesMatchTheWireValues() {
        assertThat(CleanupStrategy.fromValue("least-accessed")).isEqualTo(CleanupStrategy.LEAST_ACCESSED);
        assertThat(StorageCleanupService.comparatorFor(null)).isNotNull();
    }

    private StorageSettings settings(double maxGb, CleanupStrategy strategy) {
        StorageSettings settings = new StorageSettings();
        settings.setMaxStorageGB(maxGb);
        settings.setAutoCleanupEnabled(true);
        settings.setCleanupStrategy(strategy);
        return settings;
    }

    /** Sidecar with one chapter per size; the files themselves stay tiny. */
    private void storeManga(String slug, long downloadedAt, long... chapterSizes) throws IOException {
        OfflineMangaMetadata metadata = new OfflineMangaMetadata();
        metadata.setMangaId(slug);
        metadata.setSlug(slug);
        metadata.setExtensionId(EXT);
        metadata.setTitle(slug);
        metadata.setDownloadedAt(downloadedAt);
        List<OfflineChapterMetadata> chapters = new ArrayList<>();
        for (int i = 0; i < chapterSizes.length; i++) {
            OfflineChapterMetadata chapter = new OfflineChapterMetadata();
            chapter.setChapterId(slug + "-c" + i);
            chapter.setSizeBytes(chapterSizes[i]);
            chapters.add(chapter);
        }
        metadata.setChapters(chapters);
        fileStore.writeJson(paths.mangaMetadataFile(EXT, slug), metadata);
        repository.insertManga(new OfflineMangaRecord(0, EXT, slug, slug, paths.mangaDir(EXT, slug).toString(),
                downloadedAt, downloadedAt, 0));
    }
}
