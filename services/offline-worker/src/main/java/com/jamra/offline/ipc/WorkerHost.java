package com.jamra.offline.ipc;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.reflect.TypeToken;
import com.jamra.offline.metrics.PerformanceMetrics;
import com.jamra.offline.model.OfflineChapterMetadata;
import com.jamra.offline.model.OfflineChapterPages;
import com.jamra.offline.model.OfflineMangaMetadata;
import com.jamra.offline.model.StorageStats;
import com.jamra.offline.repository.DownloadHistoryItem;
import com.jamra.offline.repository.QueuedDownload;
import com.jamra.offline.service.archive.ArchiveOptions;
import com.jamra.offline.service.archive.ArchiveResult;
import com.jamra.offline.service.archive.ArchiveValidation;
import com.jamra.offline.service.archive.ImportOptions;
import com.jamra.offline.service.archive.ImportResult;
import com.jamra.offline.service.cleanup.CleanupResult;
import com.jamra.offline.service.cleanup.StorageSettings;
import com.jamra.offline.service.event.ConsolidatedEvent;
import com.jamra.offline.service.storage.ChapterCountValidation;
import com.jamra.offline.service.storage.DownloadOptions;
import com.jamra.offline.service.storage.DownloadProgress;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.lang.reflect.Type;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Controller-side proxy for the offline worker process.
 * <p>
 * The worker is launched lazily on the first call and must report {@code ready} within
 * {@link WorkerProtocol#READY_TIMEOUT}. Requests are correlated by id; a worker that exits
 * abnormally fails every pending request and is relaunched, at most {@code maxRestarts} times per
 * {@code restartWindow}.
 */
@Slf4j
public class WorkerHost {

    private static final Duration KILL_GRACE = Duration.ofSeconds(5);
    private static final long RESTART_DELAY_MS = 1000;

    private final WorkerLauncher launcher;
    private final boolean autoRestart;
    private final int maxRestarts;
    private final Duration restartWindow;

    private final Map<String, PendingRequest> pendingRequests = new ConcurrentHashMap<>();
    private final List<Consumer<ConsolidatedEvent>> listeners = new CopyOnWriteArrayList<>();
    private final AtomicLong nextRequestId = new AtomicLong(1);
    private final Deque<Long> restartAttempts = new ArrayDeque<>();
    private final ExecutorService restartExecutor = Executors.newSingleThreadExecutor(runnable -> {
        Thread thread = new Thread(runnable, "worker-restart");
        thread.setDaemon(true);
        return thread;
    });

    private volatile WorkerConnection connection;
    private volatile CompletableFuture<Void> readyFuture;
    private volatile boolean initialized;
    private volatile boolean started;
    private volatile boolean expectingExit;
    private volatile boolean destroyed;

    private Supplier<Long> currentTimeSupplier = System::currentTimeMillis;

    public WorkerHost(WorkerLauncher launcher) {
        this(launcher, true, 5, Duration.ofSeconds(60));
    }

    public WorkerHost(WorkerLauncher launcher, boolean autoRestart, int maxRestarts, Duration restartWindow) {
        this.launcher = launcher;
        this.autoRestart = autoRestart;
        this.maxRestarts = maxRestarts;
        this.restartWindow = restartWindow;
    }

    /** Subscribes to consolidated event envelopes sent by the worker. */
    public Runnable on(Consumer<ConsolidatedEvent> listener) {
        listeners.add(listener);
        return () -> listeners.remove(listener);
    }

    // ─────────────────────────────────────────────────────────────
    // LIFECYCLE
    // ─────────────────────────────────────────────────────────────

    public synchronized void start() {
        if (started) {
            log.warn("[WorkerHost] ⚠️ Worker already started");
            return;
        }
        ensureInitialized();
        request(WorkerCommandType.START, null, WorkerProtocol.START_TIMEOUT);
        started = true;
        log.info("[WorkerHost] ▶️ Worker started");
    }

    public synchronized void stop() {
        if (!started) {
            return;
        }
        try {
            request(WorkerCommandType.STOP, null, WorkerProtocol.STOP_TIMEOUT);
        } catch (WorkerIpcException e) {
            log.error("[WorkerHost] ❌ Error stopping worker: {}", e.getMessage());
        }
        started = false;
        killWorker();
    }

    public void destroy() {
        log.info("[WorkerHost] Destroying worker host");
        destroyed = true;
        rejectPending(new WorkerUnavailableException("Worker host destroyed"));
        if (started) {
            stop();
        } else {
            killWorker();
        }
        listeners.clear();
        initialized = false;
        restartExecutor.shutdownNow();
    }

    public boolean isInitialized() {
        return initialized;
    }

    public boolean isStarted() {
        return started;
    }

    // ─────────────────────────────────────────────────────────────
    // COMMANDS
    // ─────────────────────────────────────────────────────────────

    public boolean isActive() {
        if (!initialized || connection == null) {
            return false;
        }
        try {
            Boolean active = field(query(WorkerCommandType.IS_ACTIVE, null), "isActive", Boolean.class);
            return Boolean.TRUE.equals(active);
        } catch (WorkerIpcException e) {
            return false;
        }
    }

    public List<Long> getActiveDownloads() {
        if (!initialized || connection == null) {
            return List.of();
        }
        try {
            List<Long> active = field(query(WorkerCommandType.GET_ACTIVE_DOWNLOADS, null), "activeDownloads",
                    new TypeToken<List<Long>>() { }.getType());
            return active == null ? List.of() : active;
        } catch (WorkerIpcException e) {
            return List.of();
        }
    }

    public long queueChapterDownload(String extensionId, String mangaId, String chapterId, DownloadOptions options) {
        WorkerPayloads.QueueChapter payload = new WorkerPayloads.QueueChapter(extensionId, mangaId, chapterId, toRequestOptions(options));
        Long queueId = field(query(WorkerCommandType.QUEUE_CHAPTER, payload), "queueId", Long.class);
        return Objects.requireNonNull(queueId, "queue-chapter returned no queueId");
    }

    public List<Long> queueMangaDownload(String extensionId, String mangaId, DownloadOptions options) {
        WorkerPayloads.QueueManga payload = new WorkerPayloads.QueueManga(extensionId, mangaId, toRequestOptions(options));
        return listField(query(WorkerCommandType.QUEUE_MANGA, payload), "queueIds", new TypeToken<List<Long>>() { }.getType());
    }

    public void cancelDownload(long queueId) {
        query(WorkerCommandType.CANCEL_DOWNLOAD, new WorkerPayloads.QueueRef(queueId));
    }

    public void retryDownload(long queueId) {
        query(WorkerCommandType.RETRY_DOWNLOAD, new WorkerPayloads.QueueRef(queueId));
    }

    public List<Long> retryFrozenDownloads() {
        return listField(query(WorkerCommandType.RETRY_FROZEN_DOWNLOADS, null), "retriedQueueIds",
                new TypeToken<List<Long>>() { }.getType());
    }

    public int pauseDownloads() {
        Integer paused = field(query(WorkerCommandType.PAUSE_DOWNLOADS, null), "paused", Integer.class);
        return paused == null ? 0 : paused;
    }

    public int resumeDownloads() {
        Integer resumed = field(query(WorkerCommandType.RESUME_DOWNLOADS, null), "resumed", Integer.class);
        return resumed == null ? 0 : resumed;
    }

    public List<QueuedDownload> getQueuedDownloads() {
        return listField(query(WorkerCommandType.GET_QUEUED_DOWNLOADS, null), "queue",
                new TypeToken<List<QueuedDownload>>() { }.getType());
    }

    /** @return {@code null} when the queue item does not exist */
    public DownloadProgress getDownloadProgress(long queueId) {
        return field(query(WorkerCommandType.GET_DOWNLOAD_PROGRESS, new WorkerPayloads.QueueRef(queueId)), "progress", DownloadProgress.class);
    }

    public StorageStats getStorageStats() {
        return field(query(WorkerCommandType.GET_STORAGE_STATS, null), "stats", StorageStats.class);
    }

    public List<OfflineMangaMetadata> getDownloadedManga() {
        return listField(query(WorkerCommandType.GET_DOWNLOADED_MANGA, null), "manga",
                new TypeToken<List<OfflineMangaMetadata>>() { }.getType());
    }

    public OfflineMangaMetadata getMangaMetadata(String extensionId, String mangaId) {
        return field(query(WorkerCommandType.GET_MANGA_METADATA, new WorkerPayloads.MangaRef(extensionId, mangaId)),
                "metadata", OfflineMangaMetadata.class);
    }

    public List<OfflineChapterMetadata> getDownloadedChapters(String extensionId, String mangaId) {
        return listField(query(WorkerCommandType.GET_DOWNLOADED_CHAPTERS, new WorkerPayloads.MangaRef(extensionId, mangaId)),
                "chapters", new TypeToken<List<OfflineChapterMetadata>>() { }.getType());
    }

    public OfflineChapterPages getChapterPages(String extensionId, String mangaId, String chapterId) {
        return field(query(WorkerCommandType.GET_CHAPTER_PAGES, new WorkerPayloads.ChapterRef(extensionId, mangaId, chapterId)),
                "pages", OfflineChapterPages.class);
    }

    public boolean isChapterDownloaded(String extensionId, String mangaId, String chapterId) {
        Boolean downloaded = field(query(WorkerCommandType.IS_CHAPTER_DOWNLOADED,
                new WorkerPayloads.ChapterRef(extensionId, mangaId, chapterId)), "downloaded", Boolean.class);
        return Boolean.TRUE.equals(downloaded);
    }

    public void deleteChapter(String extensionId, String mangaId, String chapterId) {
        query(WorkerCommandType.DELETE_CHAPTER, new WorkerPayloads.ChapterRef(extensionId, mangaId, chapterId));
    }

    public void deleteManga(String extensionId, String mangaId) {
        query(WorkerCommandType.DELETE_MANGA, new WorkerPayloads.MangaRef(extensionId, mangaId));
    }

    public void nukeOfflineData() {
        query(WorkerCommandType.NUKE_OFFLINE_DATA, null);
    }

    public List<DownloadHistoryItem> getDownloadHistory(Integer limit) {
        return listField(query(WorkerCommandType.GET_DOWNLOAD_HISTORY, new WorkerPayloads.HistoryQuery(limit)), "history",
                new TypeToken<List<DownloadHistoryItem>>() { }.getType());
    }

    public void deleteHistoryItem(long historyId) {
        query(WorkerCommandType.DELETE_HISTORY_ITEM, new WorkerPayloads.HistoryRef(historyId));
    }

    public void clearDownloadHistory() {
        query(WorkerCommandType.CLEAR_DOWNLOAD_HISTORY, null);
    }

    public ChapterCountValidation validateMangaChapterCount(String extensionId, String mangaId) {
        JsonElement result = query(WorkerCommandType.VALIDATE_MANGA_CHAPTER_COUNT, new WorkerPayloads.MangaRef(extensionId, mangaId));
        Boolean valid = field(result, "valid", Boolean.class);
        Boolean rebuilt = field(result, "rebuilt", Boolean.class);
        return new ChapterCountValidation(Boolean.TRUE.equals(valid), Boolean.TRUE.equals(rebuilt));
    }

    /** Returns once the worker has accepted the request; the sync itself runs in the background. */
    public void startBackgroundMetadataSync(long ttlMs, Integer concurrency, Long delayMs) {
        query(WorkerCommandType.START_BACKGROUND_SYNC, new WorkerPayloads.BackgroundSync(ttlMs, concurrency, delayMs));
    }

    /** @return the absolute page path inside the worker's data directory, or {@code null} */
    public String getPagePath(String mangaId, String chapterId, String filename) {
        return field(query(WorkerCommandType.GET_PAGE_PATH, new WorkerPayloads.PagePath(mangaId, chapterId, filename)),
                "path", String.class);
    }

    public CleanupResult performCleanup(StorageSettings settings, Double targetFreeGB) {
        JsonElement result = query(WorkerCommandType.PERFORM_CLEANUP, new WorkerPayloads.Cleanup(settings, targetFreeGB));
        return result == null ? null : WorkerProtocol.gson().fromJson(result, CleanupResult.class);
    }

    /** @param outputPath where to write the archive, or {@code null} for the worker's archives directory */
    public ArchiveResult archiveManga(String extensionId, String mangaId, String outputPath, ArchiveOptions options) {
        JsonElement result = request(WorkerCommandType.ARCHIVE_MANGA,
                new WorkerPayloads.ArchiveManga(extensionId, mangaId, outputPath, options), WorkerProtocol.ARCHIVE_TIMEOUT);
        return WorkerProtocol.gson().fromJson(result, ArchiveResult.class);
    }

    public ArchiveResult archiveChapter(String extensionId, String mangaId, String chapterId, String outputPath, ArchiveOptions options) {
        JsonElement result = request(WorkerCommandType.ARCHIVE_CHAPTER,
                new WorkerPayloads.ArchiveChapter(extensionId, mangaId, chapterId, outputPath, options), WorkerProtocol.ARCHIVE_TIMEOUT);
        return WorkerProtocol.gson().fromJson(result, ArchiveResult.class);
    }

    public List<ArchiveResult> archiveBulk(List<WorkerPayloads.MangaRef> items, String outputDir, ArchiveOptions options) {
        JsonElement result = request(WorkerCommandType.ARCHIVE_BULK,
                new WorkerPayloads.ArchiveBulk(items, outputDir, options), WorkerProtocol.ARCHIVE_TIMEOUT);
        return listField(result, "results", new TypeToken<List<ArchiveResult>>() { }.getType());
    }

    public long estimateArchiveSize(String extensionId, String mangaId) {
        Long size = field(query(WorkerCommandType.ESTIMATE_ARCHIVE_SIZE, new WorkerPayloads.MangaRef(extensionId, mangaId)),
                "sizeBytes", Long.class);
        return size == null ? 0L : size;
    }

    public ArchiveValidation validateArchive(String archivePath) {
        JsonElement result = request(WorkerCommandType.VALIDATE_ARCHIVE,
                new WorkerPayloads.ArchiveFile(archivePath), WorkerProtocol.ARCHIVE_TIMEOUT);
        return WorkerProtocol.gson().fromJson(result, ArchiveValidation.class);
    }

    public ImportResult importMangaArchive(String archivePath, ImportOptions options) {
        JsonElement result = request(WorkerCommandType.IMPORT_ARCHIVE,
                new WorkerPayloads.ImportArchive(archivePath, options), WorkerProtocol.ARCHIVE_TIMEOUT);
        return WorkerProtocol.gson().fromJson(result, ImportResult.class);
    }

    public PerformanceMetrics getMetrics() {
        if (!initialized || connection == null) {
            return null;
        }
        try {
            return field(query(WorkerCommandType.GET_METRICS, null), "metrics", PerformanceMetrics.class);
        } catch (WorkerIpcException e) {
            return null;
        }
    }

    public void resetMetrics() {
        query(WorkerCommandType.RESET_METRICS, null);
    }

    // ─────────────────────────────────────────────────────────────
    // TRANSPORT
    // ─────────────────────────────────────────────────────────────

    synchronized void ensureInitialized() {
        if (initialized && connection != null) {
            return;
        }
        if (destroyed) {
            throw new WorkerUnavailableException("Worker host destroyed");
        }

        log.info("[WorkerHost] Initialising worker process...");
        CompletableFuture<Void> ready = new CompletableFuture<>();
        readyFuture = ready;
        expectingExit = false;
        try {
            connection = launcher.launch(this::handleMessage, this::handleExit);
        } catch (IOException e) {
            throw new WorkerUnavailableException("Failed to launch worker: " + e.getMessage(), e);
        }

        try {
            ready.get(WorkerProtocol.READY_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            killWorker();
            throw new WorkerUnavailableException("Worker initialization timeout");
        } catch (ExecutionException e) {
            killWorker();
            throw new WorkerUnavailableException(e.getCause().getMessage(), e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            killWorker();
            throw new WorkerUnavailableException("Interrupted while waiting for the worker", e);
        }

        initialized = true;
        log.info("[WorkerHost] ✅ Worker initialised");
    }

    private JsonElement query(WorkerCommandType command, Object payload) {
        return request(command, payload, WorkerProtocol.QUERY_TIMEOUT);
    }

    JsonElement request(WorkerCommandType command, Object payload, Duration timeout) {
        ensureInitialized();
        WorkerConnection current = connection;
        if (current == null) {
            throw new WorkerUnavailableException("Worker process not available");
        }

        String requestId = String.valueOf(nextRequestId.getAndIncrement());
        CompletableFuture<JsonElement> future = new CompletableFuture<>();
        pendingRequests.put(requestId, new PendingRequest(command, future));

        try {
            log.debug("[WorkerHost] -> {} (requestId={})", command.getValue(), requestId);
            current.send(new WorkerRequest(command.getValue(), requestId, payload == null ? null : WorkerProtocol.toTree(payload)));
        } catch (IOException e) {
            pendingRequests.remove(requestId);
            throw new WorkerUnavailableException("Failed to send " + command.getValue() + ": " + e.getMessage(), e);
        }

        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            pendingRequests.remove(requestId);
            log.error("[WorkerHost] ❌ Command {} timed out (requestId={})", command.getValue(), requestId);
            throw new WorkerTimeoutException("Worker command timeout: " + command.getValue());
        } catch (ExecutionException e) {
            if (e.getCause() instanceof WorkerIpcException ipcException) {
                throw ipcException;
            }
            throw new WorkerIpcException(e.getCause().getMessage(), e.getCause());
        } catch (InterruptedException e) {
            pendingRequests.remove(requestId);
            Thread.currentThread().interrupt();
            throw new WorkerUnavailableException("Interrupted while waiting for " + command.getValue(), e);
        }
    }

    void handleMessage(WorkerMessage message) {
        if (message.getType() == null) {
            log.warn("[WorkerHost] ⚠️ Received worker message without a type");
            return;
        }
        switch (message.getType()) {
            case WorkerMessage.READY -> {
                CompletableFuture<Void> ready = readyFuture;
                if (ready != null) {
                    ready.complete(null);
                }
            }
            case WorkerMessage.EVENT -> emitEvent(WorkerProtocol.decodeEnvelope(message.getEvent()));
            case WorkerMessage.STARTED -> log.info("[WorkerHost] Worker signalled started");
            case WorkerMessage.STOPPED -> log.info("[WorkerHost] Worker signalled stopped");
            case WorkerMessage.RESULT -> {
                PendingRequest pending = message.getRequestId() == null ? null : pendingRequests.remove(message.getRequestId());
                if (pending != null) {
                    log.debug("[WorkerHost] <- {} (requestId={})", pending.command().getValue(), message.getRequestId());
                    pending.future().complete(message.getResult());
                }
            }
            case WorkerMessage.ERROR -> {
                PendingRequest pending = message.getRequestId() == null ? null : pendingRequests.remove(message.getRequestId());
                if (pending != null) {
                    pending.future().completeExceptionally(
                            new WorkerCommandException(pending.command(), message.getError(), message.getStack()));
                } else {
                    log.error("[WorkerHost] ❌ Worker error: {}", message.getError());
                }
            }
            case WorkerMessage.FATAL_ERROR -> {
                log.error("[WorkerHost] ❌ Worker fatal error: {}", message.getError());
                CompletableFuture<Void> ready = readyFuture;
                if (ready != null && !ready.isDone()) {
                    ready.completeExceptionally(new WorkerUnavailableException("Worker fatal error: " + message.getError()));
                }
            }
            default -> log.warn("[WorkerHost] ⚠️ Received unknown worker message type: {}", message.getType());
        }
    }

    void handleExit(int exitCode) {
        log.info("[WorkerHost] Worker exited with code {}", exitCode);
        boolean wasStarted = started;
        boolean intentional = expectingExit;

        connection = null;
        initialized = false;
        started = false;

        CompletableFuture<Void> ready = readyFuture;
        if (ready != null && !ready.isDone()) {
            ready.completeExceptionally(new WorkerUnavailableException("Worker process exited during startup"));
        }
        rejectPending(new WorkerUnavailableException("Worker process exited"));

        if (autoRestart && exitCode != 0 && !intentional && !destroyed) {
            restartExecutor.submit(() -> attemptRestart(wasStarted));
        }
    }

    void attemptRestart(boolean resume) {
        long now = currentTimeSupplier.get();
        synchronized (restartAttempts) {
            restartAttempts.removeIf(timestamp -> now - timestamp >= restartWindow.toMillis());
            if (restartAttempts.size() >= maxRestarts) {
                log.error("[WorkerHost] ❌ Max restart attempts ({}) exceeded", maxRestarts);
                return;
            }
            restartAttempts.addLast(now);
            log.info("[WorkerHost] 🔁 Attempting worker restart ({}/{})...", restartAttempts.size(), maxRestarts);
        }

        try {
            sleep(RESTART_DELAY_MS);
            ensureInitialized();
            if (resume) {
                start();
            }
            log.info("[WorkerHost] ✅ Worker restarted successfully");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (WorkerIpcException e) {
            log.error("[WorkerHost] ❌ Failed to restart worker: {}", e.getMessage());
        }
    }

    private void killWorker() {
        WorkerConnection current = connection;
        if (current == null) {
            return;
        }
        expectingExit = true;
        current.terminate(KILL_GRACE);
        connection = null;
        initialized = false;
    }

    private void rejectPending(WorkerIpcException error) {
        pendingRequests.values().forEach(pending -> pending.future().completeExceptionally(error));
        pendingRequests.clear();
    }

    private void emitEvent(ConsolidatedEvent envelope) {
        if (envelope == null) {
            log.warn("[WorkerHost] ⚠️ Dropped event with an unknown envelope type");
            return;
        }
        for (Consumer<ConsolidatedEvent> listener : listeners) {
            try {
                listener.accept(envelope);
            } catch (RuntimeException e) {
                log.error("[WorkerHost] ❌ Error in event listener", e);
            }
        }
    }

    private static WorkerPayloads.DownloadRequestOptions toRequestOptions(DownloadOptions options) {
        if (options == null) {
            return null;
        }
        return new WorkerPayloads.DownloadRequestOptions(options.getPriority(), options.getChapterIds());
    }

    private static <T> T field(JsonElement result, String key, Type type) {
        if (result == null || !result.isJsonObject()) {
            return null;
        }
        JsonObject object = result.getAsJsonObject();
        if (!object.has(key) || object.get(key).isJsonNull()) {
            return null;
        }
        return WorkerProtocol.gson().fromJson(object.get(key), type);
    }

    private static <T> List<T> listField(JsonElement result, String key, Type type) {
        List<T> list = field(result, key, type);
        return list == null ? List.of() : list;
    }

    protected void sleep(long millis) throws InterruptedException {
        Thread.sleep(millis);
    }

    void setCurrentTimeSupplier(Supplier<Long> currentTimeSupplier) {
        this.currentTimeSupplier = currentTimeSupplier;
    }

    private record PendingRequest(WorkerCommandType command, CompletableFuture<JsonElement> future) {
    }
}
