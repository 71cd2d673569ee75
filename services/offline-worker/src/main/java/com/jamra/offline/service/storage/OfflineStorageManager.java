package com.jamra.offline.service.storage;

import com.jamra.offline.catalog.ChapterSummary;
import com.jamra.offline.catalog.ContentProvider;
import com.jamra.offline.catalog.MangaDetails;
import com.jamra.offline.model.OfflineChapterMetadata;
import com.jamra.offline.model.OfflineChapterPages;
import com.jamra.offline.model.OfflineMangaMetadata;
import com.jamra.offline.model.StorageStats;
import com.jamra.offline.repository.DownloadHistoryItem;
import com.jamra.offline.repository.DownloadStatus;
import com.jamra.offline.repository.OfflineChapterRecord;
import com.jamra.offline.repository.OfflineMangaRecord;
import com.jamra.offline.repository.OfflineRepository;
import com.jamra.offline.repository.QueuedDownload;
import com.jamra.offline.service.DownloadException;
import com.jamra.offline.service.LoggerService;
import com.jamra.offline.service.download.DownloadWorker;
import com.jamra.offline.service.event.OfflineEvent;
import com.jamra.offline.service.event.OfflineEventListeners;
import com.jamra.offline.util.OfflineFileStore;
import com.jamra.offline.util.OfflinePaths;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.Consumer;
import java.util.function.Supplier;

import static com.jamra.offline.service.LoggerService.sanitizeForLog;

/**
 * Entry point for everything the controlling process asks of the offline store: queueing,
 * cancellation and retries, read projections, deletion and metadata maintenance.
 * <p>
 * Events from the {@link DownloadWorker} are re-emitted to this manager's subscribers, so one
 * subscription sees the whole subsystem.
 */
@Service
public class OfflineStorageManager implements DisposableBean {

    private static final String TAG = "OFFLINE";
    private static final Duration SYNC_BATCH_TIMEOUT = Duration.ofMinutes(10);

    private final OfflineRepository repository;
    private final ContentProvider contentProvider;
    private final MangaMetadataRebuilder metadataRebuilder;
    private final OfflineFileStore fileStore;
    private final OfflinePaths paths;
    private final LoggerService logger;
    private final OfflineEventListeners listeners;

    private final ExecutorService syncExecutor = Executors.newSingleThreadExecutor(runnable -> {
        Thread thread = new Thread(runnable, "metadata-sync");
        thread.setDaemon(true);
        return thread;
    });

    private FrozenDownloadPolicy frozenPolicy = FrozenDownloadPolicy.DEFAULT;
    private Supplier<Long> currentTimeSupplier = System::currentTimeMillis;

    public OfflineStorageManager(OfflineRepository repository,
                                 ContentProvider contentProvider,
                                 MangaMetadataRebuilder metadataRebuilder,
                                 OfflineFileStore fileStore,
                                 OfflinePaths paths,
                                 LoggerService logger,
                                 DownloadWorker downloadWorker) {
        this.repository = repository;
        this.contentProvider = contentProvider;
        this.metadataRebuilder = metadataRebuilder;
        this.fileStore = fileStore;
        this.paths = paths;
        this.logger = logger;
        this.listeners = new OfflineEventListeners(logger, TAG);
        downloadWorker.on(listeners::emit);
    }

    public Runnable on(Consumer<OfflineEvent> listener) {
        return listeners.subscribe(listener);
    }

    // ─────────────────────────────────────────────────────────────
    // QUEUE
    // ─────────────────────────────────────────────────────────────

    /**
     * @return the queue id
     * @throws DownloadException when the chapter is already stored
     */
    public long queueChapterDownload(String extensionId, String mangaId, String chapterId, DownloadOptions options) {
        if (repository.isChapterDownloaded(extensionId, mangaId, chapterId)) {
            logger.warn(TAG, "⚠️ Chapter already downloaded, rejecting queue request | mangaId="
                    + sanitizeForLog(mangaId) + " | chapterId=" + sanitizeForLog(chapterId));
            throw new DownloadException("Chapter already downloaded");
        }

        MangaDetails details = contentProvider.fetchMangaDetails(extensionId, mangaId);
        ChapterSummary chapter = details.getChapters() == null ? null : details.getChapters().stream()
                .filter(candidate -> Objects.equals(candidate.getId(), chapterId))
                .findFirst()
                .orElse(null);

        long queueId = repository.insertQueueItem(QueuedDownload.builder()
                .extensionId(extensionId)
                .mangaId(mangaId)
                .mangaSlug(slugFor(details, mangaId))
                .mangaTitle(details.getTitle())
                .chapterId(chapterId)
                .chapterNumber(chapter == null ? null : chapter.getNumber())
                .chapterTitle(chapter == null ? null : chapter.getTitle())
                .status(DownloadStatus.QUEUED)
                .priority(priorityOf(options))
                .queuedAt(currentTimeSupplier.get())
                .build());

        logger.info(TAG, "📥 Queued chapter " + sanitizeForLog(chapterId) + " of [" + sanitizeForLog(details.getTitle()) + "] as #" + queueId);
        listeners.emit(OfflineEvent.queued(queueId, mangaId, chapterId));
        return queueId;
    }

    /**
     * Queues every chapter of a manga that is not stored yet, optionally limited to
     * {@code options.chapterIds}. One {@code download-queued} event is emitted for the batch.
     *
     * @return the new queue ids, in chapter order
     */
    public List<Long> queueMangaDownload(String extensionId, String mangaId, DownloadOptions options) {
        MangaDetails details = contentProvider.fetchMangaDetails(extensionId, mangaId);
        List<ChapterSummary> chapters = details.getChapters() == null ? List.of() : details.getChapters();
        String slug = slugFor(details, mangaId);

        List<String> requested = options == null ? null : options.getChapterIds();
        Set<String> alreadyStored = new HashSet<>();
        repository.getManga(extensionId, mangaId).ifPresent(manga ->
                repository.getChapters(manga.getId()).forEach(row -> alreadyStored.add(row.getChapterId())));

        long now = currentTimeSupplier.get();
        List<Long> queueIds = new ArrayList<>();
        List<String> queuedChapterIds = new ArrayList<>();
        int considered = 0;

        for (ChapterSummary chapter : chapters) {
            if (requested != null && !requested.contains(chapter.getId())) {
                continue;
            }
            considered++;
            if (alreadyStored.contains(chapter.getId())) {
                continue;
            }

            try {
                long queueId = repository.insertQueueItem(QueuedDownload.builder()
                        .extensionId(extensionId)
                        .mangaId(mangaId)
                        .mangaSlug(slug)
                        .mangaTitle(details.getTitle())
                        .chapterId(chapter.getId())
                        .chapterNumber(chapter.getNumber())
                        .chapterTitle(chapter.getTitle())
                        .status(DownloadStatus.QUEUED)
                        .priority(priorityOf(options))
                        .queuedAt(now)
                        .build());
                queueIds.add(queueId);
                queuedChapterIds.add(chapter.getId());
            } catch (RuntimeException e) {
                logger.error(TAG, "❌ Failed to queue chapter " + sanitizeForLog(chapter.getId()) + ": " + e.getMessage(), e);
            }
        }

        logger.info(TAG, "📥 Queued " + queueIds.size() + " chapters of [" + sanitizeForLog(details.getTitle())
                + "] (skipped " + (considered - queueIds.size()) + ")");

        if (!queueIds.isEmpty()) {
            listeners.emit(OfflineEvent.queued(queueIds.get(0), mangaId, queuedChapterIds.get(0)));
        }
        return queueIds;
    }

    /**
     * Removes the row. A download in progress notices at its next batch boundary and stops.
     */
    public void cancelDownload(long queueId) {
        QueuedDownload item = requireQueueItem(queueId);
        repository.deleteQueueItem(queueId);
        logger.info(TAG, "🛑 Cancelled download #" + queueId);
        listeners.emit(OfflineEvent.failed(queueId, item.getMangaId(), item.getChapterId(), "Cancelled by user"));
    }

    public void retryDownload(long queueId) {
        QueuedDownload item = requireQueueItem(queueId);
        repository.updateQueueStatus(queueId, DownloadStatus.QUEUED, null);
        logger.info(TAG, "🔁 Retrying download #" + queueId);
        listeners.emit(OfflineEvent.retried(queueId, item.getMangaId(), item.getChapterId()));
    }

    /**
     * Re-queues downloads that look stalled according to the {@link FrozenDownloadPolicy}.
     *
     * @return ids of the re-queued rows
     */
    public List<Long> retryFrozenDownloads() {
        long now = currentTimeSupplier.get();
        List<Long> retried = new ArrayList<>();

        for (QueuedDownload item : repository.getQueuedDownloads()) {
            if (!frozenPolicy.isFrozen(item, now)) {
                continue;
            }
            repository.updateQueueStatus(item.getId(), DownloadStatus.QUEUED, null);
            retried.add(item.getId());
            listeners.emit(OfflineEvent.retried(item.getId(), item.getMangaId(), item.getChapterId()));
        }

        if (!retried.isEmpty()) {
            logger.warn(TAG, "⚠️ Re-queued " + retried.size() + " frozen downloads: " + retried);
        }
        return retried;
    }

    public int pauseDownloads() {
        int paused = repository.updateQueueStatusForAll(DownloadStatus.QUEUED, DownloadStatus.PAUSED);
        logger.info(TAG, "⏸️ Paused " + paused + " queued downloads");
        return paused;
    }

    public int resumeDownloads() {
        int resumed = repository.updateQueueStatusForAll(DownloadStatus.PAUSED, DownloadStatus.QUEUED);
        logger.info(TAG, "▶️ Resumed " + resumed + " paused downloads");
        return resumed;
    }

    public List<QueuedDownload> getQueuedDownloads() {
        return repository.getQueuedDownloads();
    }

    public Optional<DownloadProgress> getDownloadProgress(long queueId) {
        return repository.getQueueItem(queueId).map(DownloadProgress::of);
    }

    public List<DownloadHistoryItem> getDownloadHistory(Integer limit) {
        return repository.getDownloadHistory(limit);
    }

    public void deleteHistoryItem(long historyId) {
        if (!repository.deleteHistoryItem(historyId)) {
            logger.debug(TAG, "History item #" + historyId + " was already gone");
        }
    }

    public void clearDownloadHistory() {
        repository.clearDownloadHistory();
        logger.info(TAG, "🗑️ Cleared download history");
    }

    // ─────────────────────────────────────────────────────────────
    // QUERIES
    // ─────────────────────────────────────────────────────────────

    public boolean isChapterDownloaded(String extensionId, String mangaId, String chapterId) {
        return repository.isChapterDownloaded(extensionId, mangaId, chapterId);
    }

    public boolean isMangaDownloaded(String extensionId, String mangaId) {
        return repository.getManga(extensionId, mangaId)
                .map(manga -> !repository.getChapters(manga.getId()).isEmpty())
                .orElse(false);
    }

    public List<OfflineMangaMetadata> getDownloadedManga() {
        List<OfflineMangaMetadata> result = new ArrayList<>();
        for (OfflineMangaRecord manga : repository.getAllManga()) {
            ensureMetadata(manga.getExtensionId(), manga.getMangaId(), false, true).ifPresent(result::add);
        }
        return result;
    }

    public Optional<OfflineMangaMetadata> getMangaMetadata(String extensionId, String mangaId) {
        return ensureMetadata(extensionId, mangaId, false, true);
    }

    public List<OfflineChapterMetadata> getDownloadedChapters(String extensionId, String mangaId) {
        return getMangaMetadata(extensionId, mangaId)
                .map(OfflineMangaMetadata::getChapters)
                .orElse(List.of());
    }

    public Optional<OfflineChapterPages> getChapterPages(String extensionId, String mangaId, String chapterId) {
        Optional<OfflineMangaMetadata> metadata = getMangaMetadata(extensionId, mangaId);
        if (metadata.isEmpty() || metadata.get().getChapters() == null) {
            return Optional.empty();
        }

        Optional<OfflineChapterMetadata> chapter = metadata.get().getChapters().stream()
                .filter(candidate -> Objects.equals(candidate.getChapterId(), chapterId))
                .findFirst();
        if (chapter.isEmpty()) {
            return Optional.empty();
        }

        Path file = paths.chapterMetadataFile(extensionId, metadata.get().getSlug(), chapter.get().getFolderName());
        try {
            return Optional.of(fileStore.readJson(file, OfflineChapterPages.class));
        } catch (IOException e) {
            logger.warn(TAG, "⚠️ Chapter pages unavailable at " + file + ": " + e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Absolute path of a stored page, or empty when the manga or chapter is not stored or the
     * filename would leave the chapter directory.
     */
    public Optional<Path> getPagePath(String mangaId, String chapterId, String filename) {
        Optional<OfflineMangaRecord> manga = repository.getAllManga().stream()
                .filter(candidate -> Objects.equals(candidate.getMangaId(), mangaId))
                .findFirst();
        if (manga.isEmpty()) {
            return Optional.empty();
        }

        Optional<OfflineChapterRecord> chapter = repository.getChapter(manga.get().getId(), chapterId);
        if (chapter.isEmpty()) {
            return Optional.empty();
        }

        Path chapterDir = paths.chapterDir(manga.get().getExtensionId(), manga.get().getMangaSlug(), chapter.get().getFolderName());
        Path page = chapterDir.resolve(filename).normalize();
        if (!page.startsWith(chapterDir) || page.equals(chapterDir)) {
            logger.warn(TAG, "⚠️ Rejected page path outside chapter directory: " + sanitizeForLog(filename));
            return Optional.empty();
        }
        return Optional.of(page);
    }

    public StorageStats getStorageStats() {
        return repository.getStorageStats();
    }

    // ─────────────────────────────────────────────────────────────
    // METADATA MAINTENANCE
    // ─────────────────────────────────────────────────────────────

    public Optional<OfflineMangaMetadata> rebuildMangaMetadata(String extensionId, String mangaId) {
        return ensureMetadata(extensionId, mangaId, true, true);
    }

    public void rebuildAllMetadata() {
        for (OfflineMangaRecord manga : repository.getAllManga()) {
            ensureMetadata(manga.getExtensionId(), manga.getMangaId(), true, true);
        }
    }

    /**
     * Compares the sidecar's chapter count with the relational rows and rebuilds from local data
     * only when they differ.
     */
    public ChapterCountValidation validateMangaChapterCount(String extensionId, String mangaId) {
        Optional<OfflineMangaRecord> manga = repository.getManga(extensionId, mangaId);
        if (manga.isEmpty()) {
            return new ChapterCountValidation(true, false);
        }

        Path metadataFile = paths.mangaMetadataFile(extensionId, manga.get().getMangaSlug());
        int sidecarCount = -1;
        if (fileStore.exists(metadataFile)) {
            try {
                OfflineMangaMetadata metadata = fileStore.readJson(metadataFile, OfflineMangaMetadata.class);
                sidecarCount = metadata.getChapters() == null ? 0 : metadata.getChapters().size();
            } catch (IOException e) {
                logger.warn(TAG, "⚠️ Metadata unreadable during validation for " + sanitizeForLog(mangaId) + ": " + e.getMessage());
            }
        }

        int rowCount = repository.getChapters(manga.get().getId()).size();
        if (sidecarCount == rowCount) {
            return new ChapterCountValidation(true, false);
        }

        logger.warn(TAG, "⚠️ Chapter count mismatch for " + sanitizeForLog(mangaId)
                + ": metadata=" + sidecarCount + ", db=" + rowCount + ". Rebuilding...");
        ensureMetadata(extensionId, mangaId, true, false);
        return new ChapterCountValidation(false, true);
    }

    /**
     * Refreshes sidecars whose {@code lastUpdatedAt} is older than {@code ttlMs}, {@code concurrency}
     * manga at a time with {@code delayMs} between batches. Returns at once; the returned future
     * completes when the sync is done.
     */
    public CompletableFuture<Void> startBackgroundMetadataSync(long ttlMs, int concurrency, long delayMs) {
        int batchSize = Math.max(1, concurrency);
        return CompletableFuture.runAsync(() -> runMetadataSync(ttlMs, batchSize, delayMs), syncExecutor);
    }

    private void runMetadataSync(long ttlMs, int batchSize, long delayMs) {
        List<OfflineMangaRecord> allManga = repository.getAllManga();
        long now = currentTimeSupplier.get();
        List<OfflineMangaRecord> stale = new ArrayList<>();

        for (OfflineMangaRecord manga : allManga) {
            try {
                Optional<OfflineMangaMetadata> metadata = metadataRebuilder.ensure(manga.getExtensionId(), manga.getMangaId(), false, true);
                if (metadata.isPresent() && now - metadata.get().getLastUpdatedAt() > ttlMs) {
                    stale.add(manga);
                }
            } catch (IOException | RuntimeException e) {
                logger.error(TAG, "❌ Failed to inspect metadata for " + sanitizeForLog(manga.getMangaSlug()) + ": " + e.getMessage(), e);
            }
        }

        logger.info(TAG, "🔄 Background metadata sync: " + stale.size() + "/" + allManga.size() + " manga are stale");

        for (int start = 0; start < stale.size(); start += batchSize) {
            List<OfflineMangaRecord> batch = stale.subList(start, Math.min(start + batchSize, stale.size()));
            try (AutoCloseableExecutor batchPool = new AutoCloseableExecutor(Executors.newFixedThreadPool(batch.size()), SYNC_BATCH_TIMEOUT)) {
                batch.forEach(manga -> batchPool.executor().submit(() -> syncManga(manga)));
            }

            if (start + batchSize < stale.size()) {
                try {
                    sleep(delayMs);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    logger.warn(TAG, "⚠️ Background metadata sync interrupted");
                    return;
                }
            }
        }

        logger.info(TAG, "✅ Background metadata sync complete");
    }

    private void syncManga(OfflineMangaRecord manga) {
        try {
            int before = metadataRebuilder.ensure(manga.getExtensionId(), manga.getMangaId(), false, true)
                    .map(metadata -> metadata.getChapters() == null ? 0 : metadata.getChapters().size())
                    .orElse(0);
            int after = metadataRebuilder.ensure(manga.getExtensionId(), manga.getMangaId(), true, true)
                    .map(metadata -> metadata.getChapters() == null ? 0 : metadata.getChapters().size())
                    .orElse(0);

            if (after > before) {
                logger.info(TAG, "🆕 Discovered " + (after - before) + " new chapters for " + sanitizeForLog(manga.getMangaSlug()));
                listeners.emit(OfflineEvent.newChaptersAvailable(manga.getMangaId(), after - before));
            }
        } catch (IOException | RuntimeException e) {
            logger.error(TAG, "❌ Failed to sync metadata for " + sanitizeForLog(manga.getMangaSlug()) + ": " + e.getMessage(), e);
        }
    }

    private Optional<OfflineMangaMetadata> ensureMetadata(String extensionId, String mangaId, boolean force, boolean useCatalog) {
        try {
            return metadataRebuilder.ensure(extensionId, mangaId, force, useCatalog);
        } catch (IOException e) {
            throw new DownloadException("Failed to load metadata for manga " + mangaId + ": " + e.getMessage(), e);
        }
    }

    // ─────────────────────────────────────────────────────────────
    // DELETION
    // ─────────────────────────────────────────────────────────────

    /**
     * Deletes one chapter; deleting the last chapter deletes the manga too.
     */
    public void deleteChapter(String extensionId, String mangaId, String chapterId) {
        OfflineMangaRecord manga = repository.getManga(extensionId, mangaId)
                .orElseThrow(() -> new DownloadException("Manga not found in offline storage"));
        OfflineChapterRecord chapter = repository.getChapter(manga.getId(), chapterId)
                .orElseThrow(() -> new DownloadException("Chapter not found in offline storage"));

        String slug = manga.getMangaSlug();
        try {
            fileStore.deleteDir(paths.chapterDir(extensionId, slug, chapter.getFolderName()));
            repository.deleteChapter(manga.getId(), chapterId);

            Path metadataFile = paths.mangaMetadataFile(extensionId, slug);
            if (fileStore.exists(metadataFile)) {
                OfflineMangaMetadata metadata = fileStore.readJson(metadataFile, OfflineMangaMetadata.class);
                List<OfflineChapterMetadata> remaining = new ArrayList<>(
                        metadata.getChapters() == null ? List.of() : metadata.getChapters());
                remaining.removeIf(entry -> Objects.equals(entry.getChapterId(), chapterId));
                metadata.setChapters(remaining);
                metadata.setLastUpdatedAt(currentTimeSupplier.get());
                fileStore.writeJson(metadataFile, metadata);
            }

            repository.updateMangaSize(manga.getId(), fileStore.dirSize(paths.mangaDir(extensionId, slug)));
        } catch (IOException e) {
            throw new DownloadException("Failed to delete chapter " + chapterId + ": " + e.getMessage(), e);
        }

        logger.info(TAG, "🗑️ Deleted chapter " + sanitizeForLog(chapterId) + " of " + sanitizeForLog(slug));
        listeners.emit(OfflineEvent.chapterDeleted(mangaId, chapterId));
        if (repository.getChapters(manga.getId()).isEmpty()) {
            deleteManga(extensionId, mangaId);
        }
    }

    public void deleteManga(String extensionId, String mangaId) {
        OfflineMangaRecord manga = repository.getManga(extensionId, mangaId)
                .orElseThrow(() -> new DownloadException("Manga not found in offline storage"));

        try {
            fileStore.deleteDir(paths.mangaDir(extensionId, manga.getMangaSlug()));
        } catch (IOException e) {
            throw new DownloadException("Failed to delete manga " + mangaId + ": " + e.getMessage(), e);
        }
        repository.deleteManga(manga.getId());

        logger.info(TAG, "🗑️ Deleted manga " + sanitizeForLog(manga.getMangaSlug()));
        listeners.emit(OfflineEvent.mangaDeleted(mangaId));
    }

    /**
     * Removes every stored file plus the queue, history and manga index, then recreates an empty
     * offline root.
     */
    public void nukeOfflineData() {
        try {
            for (OfflineMangaRecord manga : repository.getAllManga()) {
                fileStore.deleteDir(paths.mangaDir(manga.getExtensionId(), manga.getMangaSlug()));
            }
            fileStore.deleteDir(paths.offlineDir());
            repository.clearAllOfflineData();
            fileStore.ensureDir(paths.offlineDir());
        } catch (IOException e) {
            throw new DownloadException("Failed to clear offline data: " + e.getMessage(), e);
        }
        logger.warn(TAG, "💣 All offline data removed");
    }

    // ─────────────────────────────────────────────────────────────
    // HELPERS
    // ─────────────────────────────────────────────────────────────

    private QueuedDownload requireQueueItem(long queueId) {
        return repository.getQueueItem(queueId)
                .orElseThrow(() -> new DownloadException("Queue item " + queueId + " not found"));
    }

    private static String slugFor(MangaDetails details, String mangaId) {
        String source = details.getSlug() != null && !details.getSlug().isBlank() ? details.getSlug() : details.getTitle();
        String slug = OfflinePaths.sanitizeSlug(source);
        return slug.isEmpty() ? OfflinePaths.sanitizeSlug(mangaId) : slug;
    }

    private static int priorityOf(DownloadOptions options) {
        return options == null ? 0 : options.getPriority();
    }

    protected void sleep(long millis) throws InterruptedException {
        Thread.sleep(millis);
    }

    @Override
    public void destroy() {
        syncExecutor.shutdownNow();
    }

    void setCurrentTimeSupplier(Supplier<Long> currentTimeSupplier) {
        this.currentTimeSupplier = Objects.requireNonNull(currentTimeSupplier);
    }

    void setFrozenPolicy(FrozenDownloadPolicy frozenPolicy) {
        this.frozenPolicy = Objects.requireNonNull(frozenPolicy);
    }
}
