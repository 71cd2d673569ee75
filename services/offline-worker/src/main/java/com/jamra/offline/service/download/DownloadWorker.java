package com.jamra.offline.service.download;

import com.jamra.offline.catalog.ChapterPages;
import com.jamra.offline.catalog.ChapterSummary;
import com.jamra.offline.catalog.ContentProvider;
import com.jamra.offline.catalog.MangaDetails;
import com.jamra.offline.catalog.PageImage;
import com.jamra.offline.metrics.PerformanceMetrics;
import com.jamra.offline.metrics.PerformanceMetricsTracker;
import com.jamra.offline.model.OfflineChapterMetadata;
import com.jamra.offline.model.OfflineChapterPages;
import com.jamra.offline.model.OfflineMangaMetadata;
import com.jamra.offline.model.OfflinePageMetadata;
import com.jamra.offline.repository.DownloadStatus;
import com.jamra.offline.repository.OfflineChapterRecord;
import com.jamra.offline.repository.OfflineMangaRecord;
import com.jamra.offline.repository.OfflineRepository;
import com.jamra.offline.repository.QueuedDownload;
import com.jamra.offline.service.DownloadException;
import com.jamra.offline.service.LoggerService;
import com.jamra.offline.service.event.OfflineEvent;
import com.jamra.offline.service.event.OfflineEventListeners;
import com.jamra.offline.util.ChapterTitles;
import com.jamra.offline.util.OfflineFileStore;
import com.jamra.offline.util.OfflinePaths;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;
import java.util.function.Supplier;

import static com.jamra.offline.service.LoggerService.sanitizeForLog;

/**
 * Pulls queued items one at a time and downloads them into the offline store.
 * <p>
 * Pages are fetched in parallel batches of {@code concurrency}; every batch is awaited as a unit,
 * after which the queue row is re-read. A row that has disappeared means the item was cancelled:
 * the partial chapter directory is removed and no sidecar is written.
 */
@Service
public class DownloadWorker implements DisposableBean {

    private static final String TAG = "DOWNLOAD";

    private final OfflineRepository repository;
    private final ContentProvider contentProvider;
    private final PageFetcher pageFetcher;
    private final OfflineFileStore fileStore;
    private final OfflinePaths paths;
    private final LoggerService logger;
    private final PerformanceMetricsTracker metrics;
    private final OfflineEventListeners listeners;

    @Value("${offline.worker.concurrency:3}")
    private int concurrency = 3;

    @Value("${offline.worker.polling-interval-ms:1000}")
    private long pollingIntervalMs = 1000;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private volatile QueuedDownload currentDownload;
    private ScheduledExecutorService poller;
    private ExecutorService pagePool;
    private Supplier<Long> currentTimeSupplier = System::currentTimeMillis;

    public DownloadWorker(OfflineRepository repository,
                          ContentProvider contentProvider,
                          PageFetcher pageFetcher,
                          OfflineFileStore fileStore,
                          OfflinePaths paths,
                          LoggerService logger,
                          PerformanceMetricsTracker metrics) {
        this.repository = repository;
        this.contentProvider = contentProvider;
        this.pageFetcher = pageFetcher;
        this.fileStore = fileStore;
        this.paths = paths;
        this.logger = logger;
        this.metrics = metrics;
        this.listeners = new OfflineEventListeners(logger, TAG);
    }

    // ─────────────────────────────────────────────────────────────
    // LIFECYCLE
    // ─────────────────────────────────────────────────────────────

    public synchronized void start() {
        if (!running.compareAndSet(false, true)) {
            throw new IllegalStateException("Download worker is already running");
        }

        poller = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "download-worker");
            thread.setDaemon(true);
            return thread;
        });
        poller.scheduleWithFixedDelay(this::pollQueue, 0, pollingIntervalMs, TimeUnit.MILLISECONDS);
        logger.info(TAG, "▶️ Download worker started (concurrency=" + concurrency + ", pollingInterval=" + pollingIntervalMs + "ms)");
    }

    /** Stops polling. An item already in progress runs to completion. */
    public synchronized void stop() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        if (poller != null) {
            poller.shutdown();
            poller = null;
        }
        logger.info(TAG, "⏹️ Download worker stopped");
    }

    public boolean isActive() {
        return running.get();
    }

    public Optional<QueuedDownload> getCurrentDownload() {
        return Optional.ofNullable(currentDownload);
    }

    public List<Long> getActiveDownloads() {
        QueuedDownload active = currentDownload;
        return active == null ? List.of() : List.of(active.getId());
    }

    public Runnable on(Consumer<OfflineEvent> listener) {
        return listeners.subscribe(listener);
    }

    public PerformanceMetrics getMetrics() {
        return metrics.snapshot();
    }

    public void resetMetrics() {
        metrics.reset();
    }

    @Override
    public synchronized void destroy() {
        stop();
        if (pagePool != null) {
            pagePool.shutdownNow();
            pagePool = null;
        }
    }

    private void pollQueue() {
        if (!running.get() || currentDownload != null) {
            return;
        }
        try {
            repository.getNextQueuedDownload().ifPresent(this::processDownload);
        } catch (RuntimeException e) {
            // the scheduler drops a task that throws, so keep the loop alive
            logger.error(TAG, "❌ Failed to poll download queue: " + e.getMessage(), e);
        }
    }

    // ─────────────────────────────────────────────────────────────
    // ITEM PROCESSING
    // ─────────────────────────────────────────────────────────────

    void processDownload(QueuedDownload item) {
        currentDownload = item;
        long started = currentTimeSupplier.get();
        metrics.recordDownloadStarted();

        try {
            repository.updateQueueStatus(item.getId(), DownloadStatus.DOWNLOADING, null);
            metrics.recordDatabaseWrite();
            listeners.emit(OfflineEvent.started(item.getId(), item.getMangaId(), item.getChapterId()));
            logger.info(TAG, "🚀 Starting download #" + item.getId() + " for [" + sanitizeForLog(describe(item)) + "]");

            if (item.isWholeManga()) {
                downloadManga(item);
            } else {
                downloadSingleChapter(item);
            }

            repository.updateQueueStatus(item.getId(), DownloadStatus.COMPLETED, null);
            repository.moveQueueItemToHistory(item.getId());
            metrics.recordDatabaseWrite();
            metrics.recordDownloadCompleted(currentTimeSupplier.get() - started);
            listeners.emit(OfflineEvent.completed(item.getId(), item.getMangaId(), item.getChapterId()));
            logger.info(TAG, "✅ Download #" + item.getId() + " completed");

        } catch (DownloadCancelledException e) {
            metrics.recordDownloadCancelled();
            logger.info(TAG, "🛑 Download #" + item.getId() + " was cancelled, stopping");

        } catch (Exception e) {
            String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            if (wasCancelled(item.getId())) {
                metrics.recordDownloadCancelled();
                logger.info(TAG, "🛑 Download #" + item.getId() + " was cancelled while failing: " + message);
                return;
            }
            logger.error(TAG, "❌ Download #" + item.getId() + " failed: " + message, e);
            try {
                repository.updateQueueStatus(item.getId(), DownloadStatus.FAILED, message);
                metrics.recordDatabaseWrite();
            } catch (RuntimeException dbError) {
                logger.error(TAG, "❌ Failed to mark download #" + item.getId() + " as failed", dbError);
            }
            metrics.recordDownloadFailed();
            listeners.emit(OfflineEvent.failed(item.getId(), item.getMangaId(), item.getChapterId(), message));

        } finally {
            currentDownload = null;
        }
    }

    private void downloadSingleChapter(QueuedDownload item) throws IOException {
        // another queue row for the same chapter may have finished first
        if (repository.isChapterDownloaded(item.getExtensionId(), item.getMangaId(), item.getChapterId())) {
            logger.info(TAG, "⏭️ Chapter already stored, nothing to download | queueId=" + item.getId()
                    + " | chapterId=" + sanitizeForLog(item.getChapterId()));
            return;
        }

        MangaDetails details = contentProvider.fetchMangaDetails(item.getExtensionId(), item.getMangaId());
        String slug = resolveSlug(item, details);
        ChapterSummary chapter = findChapter(details, item);

        ensureMangaMetadata(item, details, slug);
        downloadChapterPages(item, slug, chapter, (current, total) -> reportProgress(item, current, total));
    }

    private void downloadManga(QueuedDownload item) throws IOException {
        MangaDetails details = contentProvider.fetchMangaDetails(item.getExtensionId(), item.getMangaId());
        List<ChapterSummary> chapters = details.getChapters() == null ? List.of() : details.getChapters();
        if (chapters.isEmpty()) {
            throw new DownloadException("No chapters found for this manga");
        }

        String slug = resolveSlug(item, details);
        ensureMangaMetadata(item, details, slug);

        int chapterCount = chapters.size();
        for (int i = 0; i < chapterCount; i++) {
            ChapterSummary chapter = chapters.get(i);
            if (repository.isChapterDownloaded(item.getExtensionId(), item.getMangaId(), chapter.getId())) {
                logger.debug(TAG, "Skipping stored chapter | queueId=" + item.getId() + " | chapterId=" + sanitizeForLog(chapter.getId()));
                continue;
            }

            int chapterIndex = i;
            downloadChapterPages(item, slug, chapter, (current, total) -> {
                double fraction = total == 0 ? 0 : (double) current / total;
                int overall = (int) Math.floor((chapterIndex + fraction) * 100);
                reportProgress(item, overall, chapterCount * 100);
            });
        }
    }

    private void downloadChapterPages(QueuedDownload item,
                                      String slug,
                                      ChapterSummary chapter,
                                      ProgressCallback onProgress) throws IOException {
        ChapterPages chapterPages = contentProvider.fetchChapterPages(item.getExtensionId(), item.getMangaId(), chapter.getId());
        List<PageImage> pages = chapterPages == null ? null : chapterPages.getPages();
        if (pages == null || pages.isEmpty()) {
            throw new DownloadException("No pages found for this chapter");
        }

        String extensionId = item.getExtensionId();
        String folderName = resolveChapterFolder(extensionId, slug, chapter);
        Path chapterDir = paths.chapterDir(extensionId, slug, folderName);
        fileStore.ensureDir(chapterDir);

        int total = pages.size();
        repository.updateQueueProgress(item.getId(), 0, total);
        metrics.recordDatabaseWrite();

        List<OfflinePageMetadata> pageMetadata = new ArrayList<>();
        try {
            for (int start = 0; start < total; start += concurrency) {
                List<PageImage> batch = pages.subList(start, Math.min(start + concurrency, total));
                pageMetadata.addAll(fetchBatch(batch, chapterDir));
                ensureNotCancelled(item.getId());
                onProgress.report(pageMetadata.size(), total);
            }
        } catch (DownloadCancelledException e) {
            discardPartialChapter(chapterDir);
            throw e;
        } catch (RuntimeException e) {
            // a page failing after the row was removed is a cancellation, not a failure
            if (wasCancelled(item.getId())) {
                discardPartialChapter(chapterDir);
                throw new DownloadCancelledException(item.getId());
            }
            throw e;
        }

        long now = currentTimeSupplier.get();
        pageMetadata.sort(Comparator.comparingInt(OfflinePageMetadata::getIndex));
        fileStore.writeJson(paths.chapterMetadataFile(extensionId, slug, folderName),
                new OfflineChapterPages(OfflineMangaMetadata.CURRENT_VERSION, now, chapter.getId(), item.getMangaId(), folderName, pageMetadata));

        long chapterSize = fileStore.dirSize(chapterDir);
        OfflineChapterMetadata entry = new OfflineChapterMetadata(
                chapter.getId(),
                OfflinePaths.sanitizeSlug(hasText(chapter.getNumber()) ? chapter.getNumber() : chapter.getId()),
                chapter.getNumber(),
                chapter.getTitle(),
                ChapterTitles.format(chapter.getNumber(), chapter.getTitle(), chapter.getId()),
                chapter.getVolume(),
                chapter.getPublishedAt(),
                chapter.getLanguageCode(),
                chapter.getScanlators(),
                folderName,
                total,
                now,
                chapterSize);

        Path metadataFile = paths.mangaMetadataFile(extensionId, slug);
        OfflineMangaMetadata mangaMetadata = fileStore.readJson(metadataFile, OfflineMangaMetadata.class);
        List<OfflineChapterMetadata> chapters = mangaMetadata.getChapters() == null
                ? new ArrayList<>()
                : new ArrayList<>(mangaMetadata.getChapters());
        int existingIndex = indexOfChapter(chapters, chapter.getId());
        if (existingIndex >= 0) {
            chapters.set(existingIndex, entry);
        } else {
            chapters.add(entry);
        }
        mangaMetadata.setChapters(chapters);
        mangaMetadata.setLastUpdatedAt(now);
        fileStore.writeJson(metadataFile, mangaMetadata);

        OfflineMangaRecord mangaRecord = repository.getManga(extensionId, item.getMangaId())
                .orElseThrow(() -> new DownloadException("Manga " + item.getMangaId() + " is missing from offline storage"));
        repository.insertChapter(new OfflineChapterRecord(
                0L, mangaRecord.getId(), chapter.getId(), chapter.getNumber(), chapter.getTitle(),
                folderName, total, now, chapterSize));
        repository.updateMangaSize(mangaRecord.getId(), fileStore.dirSize(paths.mangaDir(extensionId, slug)));
        metrics.recordDatabaseWrite();

        logger.info(TAG, "📦 Saved [" + sanitizeForLog(entry.getDisplayTitle()) + "] with " + total + " pages at " + chapterDir);
    }

    /**
     * Number-based folder name, or the id-based one when a different chapter already lives in the
     * number-based folder.
     */
    private String resolveChapterFolder(String extensionId, String slug, ChapterSummary chapter) throws IOException {
        String folderName = OfflinePaths.chapterFolderName(hasText(chapter.getNumber()) ? chapter.getNumber() : chapter.getId());
        if (!folderOwnedByOtherChapter(extensionId, slug, folderName, chapter.getId())) {
            return folderName;
        }
        String fallback = OfflinePaths.chapterFolderNameForId(chapter.getId());
        logger.warn(TAG, "⚠️ Folder " + folderName + " belongs to another chapter, storing chapter "
                + sanitizeForLog(chapter.getId()) + " in " + fallback);
        return fallback;
    }

    private boolean folderOwnedByOtherChapter(String extensionId, String slug, String folderName, String chapterId) throws IOException {
        Path chapterMetadata = paths.chapterMetadataFile(extensionId, slug, folderName);
        if (fileStore.exists(chapterMetadata)
                && !Objects.equals(fileStore.readJson(chapterMetadata, OfflineChapterPages.class).getChapterId(), chapterId)) {
            return true;
        }

        Path mangaMetadata = paths.mangaMetadataFile(extensionId, slug);
        if (!fileStore.exists(mangaMetadata)) {
            return false;
        }
        List<OfflineChapterMetadata> chapters = fileStore.readJson(mangaMetadata, OfflineMangaMetadata.class).getChapters();
        return chapters != null && chapters.stream()
                .anyMatch(entry -> folderName.equals(entry.getFolderName()) && !Objects.equals(entry.getChapterId(), chapterId));
    }

    private List<OfflinePageMetadata> fetchBatch(List<PageImage> batch, Path chapterDir) {
        List<Future<OfflinePageMetadata>> futures = new ArrayList<>();
        for (PageImage page : batch) {
            futures.add(pagePool().submit(() -> fetchPage(page, chapterDir)));
        }

        List<OfflinePageMetadata> results = new ArrayList<>();
        try {
            for (Future<OfflinePageMetadata> future : futures) {
                results.add(future.get());
            }
        } catch (ExecutionException e) {
            futures.forEach(future -> future.cancel(true));
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new DownloadException("Page download failed: " + cause.getMessage(), cause);
        } catch (InterruptedException e) {
            futures.forEach(future -> future.cancel(true));
            Thread.currentThread().interrupt();
            throw new DownloadException("Interrupted while downloading pages", e);
        }
        return results;
    }

    private OfflinePageMetadata fetchPage(PageImage page, Path chapterDir) {
        Path destination = chapterDir.resolve(OfflinePaths.pageFilename(page.getIndex(), "jpg"));
        FetchedPage fetched = pageFetcher.fetch(page.getUrl(), destination);
        return new OfflinePageMetadata(
                page.getIndex(),
                page.getUrl(),
                fetched.filename(),
                page.getWidth(),
                page.getHeight(),
                fetched.sizeBytes(),
                fetched.mimeType());
    }

    /**
     * Creates the manga directory, cover and sidecar plus the relational row on first download;
     * afterwards only bumps {@code lastUpdatedAt}.
     */
    private void ensureMangaMetadata(QueuedDownload item, MangaDetails details, String slug) throws IOException {
        String extensionId = item.getExtensionId();
        Path mangaDir = paths.mangaDir(extensionId, slug);
        Path metadataFile = paths.mangaMetadataFile(extensionId, slug);
        long now = currentTimeSupplier.get();

        if (fileStore.exists(metadataFile)) {
            OfflineMangaMetadata metadata = fileStore.readJson(metadataFile, OfflineMangaMetadata.class);
            metadata.setLastUpdatedAt(now);
            fileStore.writeJson(metadataFile, metadata);
            if (repository.getManga(extensionId, item.getMangaId()).isEmpty()) {
                insertMangaRecord(item, slug, mangaDir, now);
            }
            return;
        }

        fileStore.ensureDir(mangaDir);
        fileStore.ensureDir(paths.chaptersDir(extensionId, slug));

        String coverPath = OfflinePaths.DEFAULT_COVER;
        if (hasText(details.getCoverUrl())) {
            try {
                coverPath = pageFetcher.fetch(details.getCoverUrl(), mangaDir.resolve(OfflinePaths.DEFAULT_COVER)).filename();
            } catch (RuntimeException e) {
                logger.warn(TAG, "⚠️ Failed to download cover for " + sanitizeForLog(details.getTitle()) + ": " + e.getMessage());
            }
        }

        OfflineMangaMetadata metadata = new OfflineMangaMetadata();
        metadata.setDownloadedAt(now);
        metadata.setLastUpdatedAt(now);
        metadata.setMangaId(item.getMangaId());
        metadata.setSlug(slug);
        metadata.setExtensionId(extensionId);
        metadata.setTitle(details.getTitle());
        metadata.setDescription(details.getDescription());
        metadata.setCoverUrl(details.getCoverUrl());
        metadata.setCoverPath(coverPath);
        metadata.setAuthors(details.getAuthors());
        metadata.setArtists(details.getArtists());
        metadata.setGenres(details.getGenres());
        metadata.setTags(details.getTags());
        metadata.setRating(details.getRating());
        metadata.setYear(details.getYear());
        metadata.setStatus(details.getStatus());
        metadata.setDemographic(details.getDemographic());
        metadata.setAltTitles(details.getAltTitles());
        fileStore.writeJson(metadataFile, metadata);

        insertMangaRecord(item, slug, mangaDir, now);
        logger.info(TAG, "📁 Created offline entry for [" + sanitizeForLog(details.getTitle()) + "] at " + mangaDir);
    }

    private void insertMangaRecord(QueuedDownload item, String slug, Path mangaDir, long now) throws IOException {
        repository.insertManga(new OfflineMangaRecord(
                0L, item.getExtensionId(), item.getMangaId(), slug, mangaDir.toString(), now, now, fileStore.dirSize(mangaDir)));
        metrics.recordDatabaseWrite();
    }

    private void reportProgress(QueuedDownload item, int current, int total) {
        repository.updateQueueProgress(item.getId(), current, total);
        metrics.recordDatabaseWrite();
        listeners.emit(OfflineEvent.progress(item.getId(), item.getMangaId(), item.getChapterId(), current, total));
    }

    private void ensureNotCancelled(long queueId) {
        if (repository.getQueueItem(queueId).isEmpty()) {
            throw new DownloadCancelledException(queueId);
        }
    }

    private boolean wasCancelled(long queueId) {
        try {
            return repository.getQueueItem(queueId).isEmpty();
        } catch (RuntimeException e) {
            logger.warn(TAG, "⚠️ Could not re-read download #" + queueId + ": " + e.getMessage());
            return false;
        }
    }

    private void discardPartialChapter(Path chapterDir) {
        try {
            fileStore.deleteDir(chapterDir);
        } catch (IOException e) {
            logger.warn(TAG, "⚠️ Failed to remove partial chapter at " + chapterDir + ": " + e.getMessage());
        }
    }

    private ChapterSummary findChapter(MangaDetails details, QueuedDownload item) {
        if (details.getChapters() != null) {
            for (ChapterSummary chapter : details.getChapters()) {
                if (Objects.equals(chapter.getId(), item.getChapterId())) {
                    return chapter;
                }
            }
        }
        // the catalog no longer lists it, fall back to what was captured at enqueue time
        return new ChapterSummary(item.getChapterId(), item.getChapterTitle(), item.getChapterNumber());
    }

    private static String resolveSlug(QueuedDownload item, MangaDetails details) {
        if (hasText(item.getMangaSlug())) {
            return item.getMangaSlug();
        }
        String source = hasText(details.getSlug()) ? details.getSlug() : details.getTitle();
        String slug = OfflinePaths.sanitizeSlug(source);
        return slug.isEmpty() ? OfflinePaths.sanitizeSlug(item.getMangaId()) : slug;
    }

    private static int indexOfChapter(List<OfflineChapterMetadata> chapters, String chapterId) {
        if (chapters == null) {
            return -1;
        }
        for (int i = 0; i < chapters.size(); i++) {
            if (Objects.equals(chapters.get(i).getChapterId(), chapterId)) {
                return i;
            }
        }
        return -1;
    }

    private static String describe(QueuedDownload item) {
        String title = hasText(item.getMangaTitle()) ? item.getMangaTitle() : item.getMangaId();
        if (item.isWholeManga()) {
            return title + " (all chapters)";
        }
        return title + " / " + ChapterTitles.format(item.getChapterNumber(), item.getChapterTitle(), item.getChapterId());
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }

    private synchronized ExecutorService pagePool() {
        if (pagePool == null) {
            pagePool = Executors.newFixedThreadPool(Math.max(1, concurrency), runnable -> {
                Thread thread = new Thread(runnable, "page-fetch");
                thread.setDaemon(true);
                return thread;
            });
        }
        return pagePool;
    }

    void setCurrentTimeSupplier(Supplier<Long> currentTimeSupplier) {
        this.currentTimeSupplier = Objects.requireNonNull(currentTimeSupplier);
    }

    @FunctionalInterface
    private interface ProgressCallback {
        void report(int current, int total);
    }
}
