package com.jamra.offline.service.storage;

import com.jamra.offline.catalog.ChapterSummary;
import com.jamra.offline.catalog.ContentProvider;
import com.jamra.offline.catalog.MangaDetails;
import com.jamra.offline.model.OfflineChapterPages;
import com.jamra.offline.model.OfflineMangaMetadata;
import com.jamra.offline.repository.DownloadStatus;
import com.jamra.offline.repository.QueuedDownload;
import com.jamra.offline.service.DownloadException;
import com.jamra.offline.service.LoggerService;
import com.jamra.offline.service.download.DownloadWorker;
import com.jamra.offline.service.event.OfflineEvent;
import com.jamra.offline.service.event.OfflineEventType;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

import static com.jamra.offline.service.storage.OfflineStoreFixture.EXT;
import static com.jamra.offline.service.storage.OfflineStoreFixture.MANGA;
import static com.jamra.offline.service.storage.OfflineStoreFixture.SLUG;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class OfflineStorageManagerTest {

    @TempDir
    Path tempDir;

    @Mock
    private ContentProvider contentProvider;

    @Mock
    private LoggerService logger;

    @Mock
    private DownloadWorker downloadWorker;

    private final List<OfflineEvent> events = new CopyOnWriteArrayList<>();
    private OfflineStoreFixture store;
    private MangaMetadataRebuilder rebuilder;
    private OfflineStorageManager manager;

    @BeforeEach
    void setUp() {
        store = new OfflineStoreFixture(tempDir);
        rebuilder = new MangaMetadataRebuilder(store.repository, contentProvider, store.fileStore, store.paths, logger);
        manager = new OfflineStorageManager(store.repository, contentProvider, rebuilder, store.fileStore, store.paths, logger, downloadWorker) {
            @Override
            protected void sleep(long millis) {
                // batches run back to back in tests
            }
        };
        manager.on(events::add);
    }

    @AfterEach
    void tearDown() {
        manager.destroy();
    }

    // ── queue ────────────────────────────────────────────────────

    @Test
    void queueChapterCapturesCatalogDetailsAndEmitsQueued() {
        when(contentProvider.fetchMangaDetails(EXT, MANGA)).thenReturn(details(
                new ChapterSummary("c1", "I'm Used to It", "1"),
                new ChapterSummary("c2", null, "2")));
        manager.setCurrentTimeSupplier(() -> 42L);

        long queueId = manager.queueChapterDownload(EXT, MANGA, "c1", new DownloadOptions(3, null));

        QueuedDownload row = store.repository.getQueueItem(queueId).orElseThrow();
        assertThat(row.getMangaSlug()).isEqualTo(SLUG);
        assertThat(row.getMangaTitle()).isEqualTo("Solo Leveling");
        assertThat(row.getChapterNumber()).isEqualTo("1");
        assertThat(row.getChapterTitle()).isEqualTo("I'm Used to It");
        assertThat(row.getPriority()).isEqualTo(3);
        assertThat(row.getQueuedAt()).isEqualTo(42L);
        assertThat(events).singleElement().satisfies(event -> {
            assertThat(event.getType()).isEqualTo(OfflineEventType.DOWNLOAD_QUEUED);
            assertThat(event.getQueueId()).isEqualTo(queueId);
        });
    }

    @Test
    void queueChapterRejectsAStoredChapterWithoutCallingTheCatalog() throws IOException {
        store.storeChapter("c1", "1", 1, 1_000);

        assertThatThrownBy(() -> manager.queueChapterDownload(EXT, MANGA, "c1", DownloadOptions.defaults()))
                .isInstanceOf(DownloadException.class)
                .hasMessage("Chapter already downloaded");
        verifyNoInteractions(contentProvider);
        assertThat(store.repository.getQueuedDownloads()).isEmpty();
    }

    @Test
    void queueMangaSkipsStoredChaptersHonoursTheFilterAndEmitsOnce() throws IOException {
        store.storeChapter("c1", "1", 1, 1_000);
        when(contentProvider.fetchMangaDetails(EXT, MANGA)).thenReturn(details(
                new ChapterSummary("c1", null, "1"),
                new ChapterSummary("c2", null, "2"),
                new ChapterSummary("c3", null, "3"),
                new ChapterSummary("c4", null, "4")));

        List<Long> queueIds = manager.queueMangaDownload(EXT, MANGA, new DownloadOptions(0, List.of("c1", "c2", "c4")));

        assertThat(queueIds).hasSize(2);
        assertThat(store.repository.getQueuedDownloads()).extracting(QueuedDownload::getChapterId)
                .containsExactlyInAnyOrder("c2", "c4");
        assertThat(events).singleElement().satisfies(event -> {
            assertThat(event.getQueueId()).isEqualTo(queueIds.get(0));
            assertThat(event.getChapterId()).isEqualTo("c2");
        });
    }

    @Test
    void queueMangaWithEverythingStoredQueuesNothingAndStaysQuiet() throws IOException {
        store.storeChapter("c1", "1", 1, 1_000);
        when(contentProvider.fetchMangaDetails(EXT, MANGA)).thenReturn(details(new ChapterSummary("c1", null, "1")));

        assertThat(manager.queueMangaDownload(EXT, MANGA, null)).isEmpty();
        assertThat(events).isEmpty();
    }

    @Test
    void cancelRemovesTheRowAndReportsItAsFailed() {
        long queueId = enqueue("c1");

        manager.cancelDownload(queueId);

        assertThat(store.repository.getQueueItem(queueId)).isEmpty();
        assertThat(events).singleElement().satisfies(event -> {
            assertThat(event.getType()).isEqualTo(OfflineEventType.DOWNLOAD_FAILED);
            assertThat(event.getError()).isEqualTo("Cancelled by user");
        });
        assertThatThrownBy(() -> manager.cancelDownload(queueId))
                .isInstanceOf(DownloadException.class)
                .hasMessage("Queue item " + queueId + " not found");
    }

    @Test
    void retryResetsAFailedRow() {
        long queueId = enqueue("c1");
        store.repository.updateQueueStatus(queueId, DownloadStatus.FAILED, "HTTP 500");

        manager.retryDownload(queueId);

        QueuedDownload row = store.repository.getQueueItem(queueId).orElseThrow();
        assertThat(row.getStatus()).isEqualTo(DownloadStatus.QUEUED);
        assertThat(row.getErrorMessage()).isNull();
        assertThat(events).extracting(OfflineEvent::getType).containsExactly(OfflineEventType.DOWNLOAD_RETRIED);
    }

    @Test
    void retryFrozenDownloadsRequeuesOnlyStalledRows() {
        long stalled = enqueue("c1");
        long waiting = enqueue("c2");
        store.repository.updateQueueStatus(stalled, DownloadStatus.DOWNLOADING, null);
        long startedAt = store.repository.getQueueItem(stalled).orElseThrow().getStartedAt();
        manager.setCurrentTimeSupplier(() -> startedAt + 30_001);

        List<Long> retried = manager.retryFrozenDownloads();

        assertThat(retried).containsExactly(stalled);
        assertThat(store.repository.getQueueItem(stalled).orElseThrow().getStatus()).isEqualTo(DownloadStatus.QUEUED);
        assertThat(store.repository.getQueueItem(waiting).orElseThrow().getStatus()).isEqualTo(DownloadStatus.QUEUED);
        assertThat(events).extracting(OfflineEvent::getQueueId).containsExactly(stalled);
    }

    @Test
    void pauseAndResumeOnlyTouchWaitingRows() {
        long first = enqueue("c1");
        enqueue("c2");
        store.repository.updateQueueStatus(first, DownloadStatus.DOWNLOADING, null);

        assertThat(manager.pauseDownloads()).isEqualTo(1);
        assertThat(manager.getQueuedDownloads()).extracting(QueuedDownload::getStatus)
                .containsExactlyInAnyOrder(DownloadStatus.DOWNLOADING, DownloadStatus.PAUSED);
        assertThat(manager.resumeDownloads()).isEqualTo(1);
        assertThat(manager.resumeDownloads()).isZero();
    }

    @Test
    void progressIsRoundedToWholePercent() {
        long queueId = enqueue("c1");
        store.repository.updateQueueProgress(queueId, 1, 3);

        DownloadProgress progress = manager.getDownloadProgress(queueId).orElseThrow();

        assertThat(progress.getProgressPercent()).isEqualTo(33);
        assertThat(progress.getMangaTitle()).isEqualTo("Solo Leveling");
        assertThat(progress.getChapterTitle()).isEqualTo("Chapter 1");
        assertThat(manager.getDownloadProgress(9_999)).isEmpty();
        verifyNoInteractions(contentProvider);
    }

    // ── queries ──────────────────────────────────────────────────

    @Test
    void pagePathResolvesInsideTheChapterAndRejectsTraversal() throws IOException {
        store.storeChapter("c1", "1", 2, 1_000);
        Path chapterDir = store.paths.chapterDir(EXT, SLUG, "chapter-0001");

        assertThat(manager.getPagePath(MANGA, "c1", "page-0001.jpg")).contains(chapterDir.resolve("page-0001.jpg"));
        assertThat(manager.getPagePath(MANGA, "c1", "../../metadata.json")).isEmpty();
        assertThat(manager.getPagePath(MANGA, "c1", "..")).isEmpty();
        assertThat(manager.getPagePath(MANGA, "c9", "page-0001.jpg")).isEmpty();
        assertThat(manager.getPagePath("unknown", "c1", "page-0001.jpg")).isEmpty();
        verify(logger, times(2)).warn(eq("OFFLINE"), anyString());
    }

    @Test
    void chapterPagesComeFromTheChapterSidecar() throws IOException {
        store.storeChapter("c1", "1", 3, 1_000);

        OfflineChapterPages pages = manager.getChapterPages(EXT, MANGA, "c1").orElseThrow();

        assertThat(pages.getPages()).hasSize(3);
        assertThat(manager.getChapterPages(EXT, MANGA, "c2")).isEmpty();
        assertThat(manager.isMangaDownloaded(EXT, MANGA)).isTrue();
        assertThat(manager.isChapterDownloaded(EXT, MANGA, "c1")).isTrue();
    }

    @Test
    void validateRebuildsFromLocalDataWhenCountsDiffer() throws IOException {
        store.storeChapter("c1", "1", 1, 1_000);
        store.storeChapter("c2", "2", 1, 2_000);
        store.writeMangaSidecar("Solo Leveling", 5_000, "c1");

        ChapterCountValidation validation = manager.validateMangaChapterCount(EXT, MANGA);

        assertThat(validation.valid()).isFalse();
        assertThat(validation.rebuilt()).isTrue();
        assertThat(store.readMangaSidecar().getChapters()).hasSize(2);
        assertThat(manager.validateMangaChapterCount(EXT, MANGA)).isEqualTo(new ChapterCountValidation(true, false));
        verifyNoInteractions(contentProvider);
    }

    @Test
    void rebuildAllForcesEverySidecarEvenWhenItMatches() throws IOException {
        store.storeChapter("c1", "1", 1, 1_000);
        store.writeMangaSidecar("Stale Title", 5_000, "c1");
        MangaDetails fresh = new MangaDetails();
        fresh.setTitle("Solo Leveling");
        when(contentProvider.fetchMangaDetails(EXT, MANGA)).thenReturn(fresh);

        manager.rebuildAllMetadata();

        OfflineMangaMetadata sidecar = store.readMangaSidecar();
        assertThat(sidecar.getTitle()).isEqualTo("Solo Leveling");
        assertThat(sidecar.getChapters()).hasSize(1);
    }

    // ── deletion ─────────────────────────────────────────────────

    @Test
    void deletingOneOfTwoChaptersUpdatesTheSidecar() throws IOException {
        store.storeChapter("c1", "1", 1, 1_000);
        store.storeChapter("c2", "2", 1, 2_000);
        manager.rebuildMangaMetadata(EXT, MANGA);

        manager.deleteChapter(EXT, MANGA, "c1");

        assertThat(store.paths.chapterDir(EXT, SLUG, "chapter-0001")).doesNotExist();
        assertThat(store.readMangaSidecar().getChapters()).singleElement()
                .satisfies(chapter -> assertThat(chapter.getChapterId()).isEqualTo("c2"));
        assertThat(events).extracting(OfflineEvent::getType).containsExactly(OfflineEventType.CHAPTER_DELETED);
    }

    @Test
    void deletingTheLastChapterDeletesTheManga() throws IOException {
        store.storeChapter("c1", "1", 1, 1_000);

        manager.deleteChapter(EXT, MANGA, "c1");

        assertThat(store.paths.mangaDir(EXT, SLUG)).doesNotExist();
        assertThat(store.repository.getManga(EXT, MANGA)).isEmpty();
        assertThat(events).extracting(OfflineEvent::getType)
                .containsExactly(OfflineEventType.CHAPTER_DELETED, OfflineEventType.MANGA_DELETED);
    }

    @Test
    void deletingSomethingNotStoredFails() {
        assertThatThrownBy(() -> manager.deleteManga(EXT, MANGA))
                .isInstanceOf(DownloadException.class)
                .hasMessage("Manga not found in offline storage");
        store.mangaRow();
        assertThatThrownBy(() -> manager.deleteChapter(EXT, MANGA, "c1"))
                .isInstanceOf(DownloadException.class)
                .hasMessage("Chapter not found in offline storage");
    }

    @Test
    void nukeLeavesAnEmptyOfflineRoot() throws IOException {
        store.storeChapter("c1", "1", 1, 1_000);
        enqueue("c2");

        manager.nukeOfflineData();

        assertThat(store.paths.offlineDir()).isEmptyDirectory();
        assertThat(store.repository.getAllManga()).isEmpty();
        assertThat(store.repository.getQueuedDownloads()).isEmpty();
    }

    // ── metadata sync ────────────────────────────────────────────

    @Test
    void backgroundSyncRefreshesOnlyStaleSidecars() throws Exception {
        store.storeChapter("c1", "1", 1, 1_000);
        store.writeMangaSidecar("Old Title", 1_000, "c1");
        when(contentProvider.fetchMangaDetails(EXT, MANGA)).thenReturn(details(new ChapterSummary("c1", null, "1")));
        manager.setCurrentTimeSupplier(() -> 1_000_000L);
        rebuilder.setCurrentTimeSupplier(() -> 1_000_000L);

        manager.startBackgroundMetadataSync(60_000, 2, 0).get(10, TimeUnit.SECONDS);

        OfflineMangaMetadata refreshed = store.readMangaSidecar();
        assertThat(refreshed.getTitle()).isEqualTo("Solo Leveling");
        assertThat(refreshed.getLastUpdatedAt()).isEqualTo(1_000_000L);

        manager.startBackgroundMetadataSync(60_000, 2, 0).get(10, TimeUnit.SECONDS);
        verify(contentProvider, times(1)).fetchMangaDetails(EXT, MANGA);
    }

    @Test
    @SuppressWarnings("unchecked")
    void workerEventsAreReEmittedToManagerSubscribers() {
        ArgumentCaptor<Consumer<OfflineEvent>> forwarder = ArgumentCaptor.forClass(Consumer.class);
        verify(downloadWorker).on(forwarder.capture());

        forwarder.getValue().accept(OfflineEvent.progress(7, MANGA, "c1", 3, 10));

        assertThat(events).singleElement()
                .satisfies(event -> assertThat(event.getProgressCurrent()).isEqualTo(3));
    }

    private long enqueue(String chapterId) {
        return store.repository.insertQueueItem(QueuedDownload.builder()
                .extensionId(EXT)
                .mangaId(MANGA)
                .mangaSlug(SLUG)
                .mangaTitle("Solo Leveling")
                .chapterId(chapterId)
                .chapterNumber(chapterId.substring(1))
                .status(DownloadStatus.QUEUED)
                .queuedAt(1_000L)
                .build());
    }

    private static MangaDetails details(ChapterSummary... chapters) {
        MangaDetails details = new MangaDetails();
        details.setId(MANGA);
        details.setTitle("Solo Leveling");
        details.setChapters(List.of(chapters));
        return details;
    }
}
