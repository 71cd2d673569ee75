package com.jamra.offline.ipc;

import com.google.gson.JsonElement;
import com.jamra.offline.service.LoggerService;
import com.jamra.offline.service.archive.ArchiveResult;
import com.jamra.offline.service.archive.ImportOptions;
import com.jamra.offline.service.archive.OfflineArchiveImporter;
import com.jamra.offline.service.archive.OfflineArchiver;
import com.jamra.offline.service.cleanup.CleanupResult;
import com.jamra.offline.service.cleanup.StorageCleanupService;
import com.jamra.offline.service.download.DownloadWorker;
import com.jamra.offline.service.storage.ChapterCountValidation;
import com.jamra.offline.service.storage.DownloadOptions;
import com.jamra.offline.service.storage.OfflineStorageManager;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;
import java.util.stream.Collectors;

import static com.jamra.offline.service.LoggerService.sanitizeForLog;

/**
 * Maps a decoded {@link WorkerRequest} onto the storage manager, download worker, cleanup
 * service or archive services and shapes the reply.
 */
@Service
public class WorkerCommandDispatcher {

    private static final String TAG = "IPC";

    private static final int DEFAULT_SYNC_CONCURRENCY = 2;
    private static final long DEFAULT_SYNC_DELAY_MS = 1000;

    private final OfflineStorageManager storageManager;
    private final DownloadWorker downloadWorker;
    private final StorageCleanupService cleanupService;
    private final OfflineArchiver archiver;
    private final OfflineArchiveImporter importer;
    private final LoggerService logger;

    private Supplier<Long> currentTimeSupplier = System::currentTimeMillis;

    public WorkerCommandDispatcher(OfflineStorageManager storageManager,
                                   DownloadWorker downloadWorker,
                                   StorageCleanupService cleanupService,
                                   OfflineArchiver archiver,
                                   OfflineArchiveImporter importer,
                                   LoggerService logger) {
        this.storageManager = storageManager;
        this.downloadWorker = downloadWorker;
        this.cleanupService = cleanupService;
        this.archiver = archiver;
        this.importer = importer;
        this.logger = logger;
    }

    public WorkerCommandType resolve(WorkerRequest request) {
        return WorkerCommandType.fromValue(request.getType())
                .orElseThrow(() -> new IllegalArgumentException("Unknown command: " + request.getType()));
    }

    /**
     * Runs the command.
     *
     * @return the JSON result, or {@code null} for commands that reply without a result body
     * @throws IllegalArgumentException for an unknown command, a missing payload or a missing required field
     */
    public JsonElement dispatch(WorkerRequest request) {
        WorkerCommandType command = resolve(request);
        logger.debug(TAG, "<- " + command.getValue() + (request.getRequestId() == null ? "" : " (requestId=" + sanitizeForLog(request.getRequestId()) + ")"));

        switch (command) {
            case START:
                if (downloadWorker.isActive()) {
                    logger.warn(TAG, "⚠️ Start requested while the download worker is already running");
                } else {
                    downloadWorker.start();
                }
                return null;
            case STOP:
                downloadWorker.stop();
                return null;
            case PING:
                return result("timestamp", currentTimeSupplier.get());
            case IS_ACTIVE:
                return result("isActive", downloadWorker.isActive());
            case GET_ACTIVE_DOWNLOADS:
                return result("activeDownloads", downloadWorker.getActiveDownloads());

            case QUEUE_CHAPTER: {
                WorkerPayloads.QueueChapter payload = payload(request, command);
                require(command, "extensionId", payload.getExtensionId());
                require(command, "mangaId", payload.getMangaId());
                require(command, "chapterId", payload.getChapterId());
                logger.info(TAG, "📥 queue-chapter " + sanitizeForLog(payload.getExtensionId()) + "/"
                        + sanitizeForLog(payload.getMangaId()) + "/" + sanitizeForLog(payload.getChapterId()));
                long queueId = storageManager.queueChapterDownload(payload.getExtensionId(), payload.getMangaId(),
                        payload.getChapterId(), toOptions(payload.getOptions()));
                return result("queueId", queueId);
            }
            case QUEUE_MANGA: {
                WorkerPayloads.QueueManga payload = payload(request, command);
                require(command, "extensionId", payload.getExtensionId());
                require(command, "mangaId", payload.getMangaId());
                logger.info(TAG, "📥 queue-manga " + sanitizeForLog(payload.getExtensionId()) + "/" + sanitizeForLog(payload.getMangaId()));
                return result("queueIds", storageManager.queueMangaDownload(payload.getExtensionId(), payload.getMangaId(),
                        toOptions(payload.getOptions())));
            }
            case CANCEL_DOWNLOAD: {
                WorkerPayloads.QueueRef payload = payload(request, command);
                storageManager.cancelDownload(require(command, "queueId", payload.getQueueId()));
                return null;
            }
            case RETRY_DOWNLOAD: {
                WorkerPayloads.QueueRef payload = payload(request, command);
                storageManager.retryDownload(require(command, "queueId", payload.getQueueId()));
                return null;
            }
            case RETRY_FROZEN_DOWNLOADS:
                return result("retriedQueueIds", storageManager.retryFrozenDownloads());
            case GET_QUEUED_DOWNLOADS:
                return result("queue", storageManager.getQueuedDownloads());
            case GET_DOWNLOAD_PROGRESS: {
                WorkerPayloads.QueueRef payload = payload(request, command);
                return result("progress", storageManager.getDownloadProgress(require(command, "queueId", payload.getQueueId())).orElse(null));
            }
            case PAUSE_DOWNLOADS:
                return result("paused", storageManager.pauseDownloads());
            case RESUME_DOWNLOADS:
                return result("resumed", storageManager.resumeDownloads());

            case GET_STORAGE_STATS:
                return result("stats", storageManager.getStorageStats());
            case GET_DOWNLOADED_MANGA:
                return result("manga", storageManager.getDownloadedManga());
            case GET_MANGA_METADATA: {
                WorkerPayloads.MangaRef payload = mangaRef(request, command);
                return result("metadata", storageManager.getMangaMetadata(payload.getExtensionId(), payload.getMangaId()).orElse(null));
            }
            case GET_DOWNLOADED_CHAPTERS: {
                WorkerPayloads.MangaRef payload = mangaRef(request, command);
                return result("chapters", storageManager.getDownloadedChapters(payload.getExtensionId(), payload.getMangaId()));
            }
            case GET_CHAPTER_PAGES: {
                WorkerPayloads.ChapterRef payload = chapterRef(request, command);
                return result("pages", storageManager.getChapterPages(payload.getExtensionId(), payload.getMangaId(),
                        payload.getChapterId()).orElse(null));
            }
            case IS_CHAPTER_DOWNLOADED: {
                WorkerPayloads.ChapterRef payload = chapterRef(request, command);
                return result("downloaded", storageManager.isChapterDownloaded(payload.getExtensionId(), payload.getMangaId(),
                        payload.getChapterId()));
            }
            case GET_PAGE_PATH: {
                WorkerPayloads.PagePath payload = payload(request, command);
                require(command, "mangaId", payload.getMangaId());
                require(command, "chapterId", payload.getChapterId());
                require(command, "filename", payload.getFilename());
                String path = storageManager.getPagePath(payload.getMangaId(), payload.getChapterId(), payload.getFilename())
                        .map(Path::toString)
                        .orElse(null);
                return result("path", path);
            }

            case DELETE_CHAPTER: {
                WorkerPayloads.ChapterRef payload = chapterRef(request, command);
                storageManager.deleteChapter(payload.getExtensionId(), payload.getMangaId(), payload.getChapterId());
                return null;
            }
            case DELETE_MANGA: {
                WorkerPayloads.MangaRef payload = mangaRef(request, command);
                storageManager.deleteManga(payload.getExtensionId(), payload.getMangaId());
                return null;
            }
            case NUKE_OFFLINE_DATA:
                storageManager.nukeOfflineData();
                return null;

            case GET_DOWNLOAD_HISTORY: {
                WorkerPayloads.HistoryQuery payload = optionalPayload(request, command);
                return result("history", storageManager.getDownloadHistory(payload == null ? null : payload.getLimit()));
            }
            case DELETE_HISTORY_ITEM: {
                WorkerPayloads.HistoryRef payload = payload(request, command);
                storageManager.deleteHistoryItem(require(command, "historyId", payload.getHistoryId()));
                return null;
            }
            case CLEAR_DOWNLOAD_HISTORY:
                storageManager.clearDownloadHistory();
                return null;

            case VALIDATE_MANGA_CHAPTER_COUNT: {
                WorkerPayloads.MangaRef payload = mangaRef(request, command);
                ChapterCountValidation validation = storageManager.validateMangaChapterCount(payload.getExtensionId(), payload.getMangaId());
                Map<String, Object> body = new LinkedHashMap<>();
                body.put("valid", validation.valid());
                body.put("rebuilt", validation.rebuilt());
                return WorkerProtocol.toTree(body);
            }
            case START_BACKGROUND_SYNC: {
                WorkerPayloads.BackgroundSync payload = payload(request, command);
                int concurrency = payload.getConcurrency() == null ? DEFAULT_SYNC_CONCURRENCY : payload.getConcurrency();
                long delayMs = payload.getDelayMs() == null ? DEFAULT_SYNC_DELAY_MS : payload.getDelayMs();
                storageManager.startBackgroundMetadataSync(require(command, "ttlMs", payload.getTtlMs()), concurrency, delayMs)
                        .exceptionally(error -> {
                            logger.error(TAG, "❌ Background metadata sync failed: " + error.getMessage(), error);
                            return null;
                        });
                return null;
            }

            case PERFORM_CLEANUP: {
                WorkerPayloads.Cleanup payload = payload(request, command);
                if (payload.getSettings() == null) {
                    throw new IllegalArgumentException("Missing settings for " + command.getValue() + " command");
                }
                CleanupResult cleanup = payload.getTargetFreeGB() == null
                        ? cleanupService.performCleanup(payload.getSettings())
                        : cleanupService.performCleanup(payload.getSettings(), payload.getTargetFreeGB());
                return WorkerProtocol.toTree(cleanup);
            }

            case ARCHIVE_MANGA: {
                WorkerPayloads.ArchiveManga payload = payload(request, command);
                require(command, "extensionId", payload.getExtensionId());
                require(command, "mangaId", payload.getMangaId());
                ArchiveResult archive = payload.getOutputPath() == null || payload.getOutputPath().isBlank()
                        ? archiver.archiveManga(payload.getExtensionId(), payload.getMangaId(), payload.getOptions())
                        : archiver.archiveManga(payload.getExtensionId(), payload.getMangaId(), Path.of(payload.getOutputPath()), payload.getOptions());
                return WorkerProtocol.toTree(archive);
            }
            case ARCHIVE_CHAPTER: {
                WorkerPayloads.ArchiveChapter payload = payload(request, command);
                require(command, "extensionId", payload.getExtensionId());
                require(command, "mangaId", payload.getMangaId());
                require(command, "chapterId", payload.getChapterId());
                ArchiveResult archive = payload.getOutputPath() == null || payload.getOutputPath().isBlank()
                        ? archiver.archiveChapter(payload.getExtensionId(), payload.getMangaId(), payload.getChapterId(), payload.getOptions())
                        : archiver.archiveChapter(payload.getExtensionId(), payload.getMangaId(), payload.getChapterId(),
                                Path.of(payload.getOutputPath()), payload.getOptions());
                return WorkerProtocol.toTree(archive);
            }
            case ARCHIVE_BULK: {
                WorkerPayloads.ArchiveBulk payload = payload(request, command);
                List<OfflineArchiver.MangaKey> items = require(command, "items", payload.getItems()).stream()
                        .map(item -> new OfflineArchiver.MangaKey(
                                require(command, "extensionId", item.getExtensionId()),
                                require(command, "mangaId", item.getMangaId())))
                        .collect(Collectors.toList());
                List<ArchiveResult> archives = payload.getOutputDir() == null || payload.getOutputDir().isBlank()
                        ? archiver.archiveBulk(items, payload.getOptions())
                        : archiver.archiveBulk(items, Path.of(payload.getOutputDir()), payload.getOptions());
                return result("results", archives);
            }
            case ESTIMATE_ARCHIVE_SIZE: {
                WorkerPayloads.MangaRef payload = mangaRef(request, command);
                return result("sizeBytes", archiver.estimateArchiveSize(payload.getExtensionId(), payload.getMangaId()));
            }
            case VALIDATE_ARCHIVE: {
                WorkerPayloads.ArchiveFile payload = payload(request, command);
                return WorkerProtocol.toTree(importer.validateArchive(Path.of(require(command, "archivePath", payload.getArchivePath()))));
            }
            case IMPORT_ARCHIVE: {
                WorkerPayloads.ImportArchive payload = payload(request, command);
                Path archive = Path.of(require(command, "archivePath", payload.getArchivePath()));
                ImportOptions options = payload.getOptions() == null ? ImportOptions.defaults() : payload.getOptions();
                logger.info(TAG, "📥 import-archive " + sanitizeForLog(archive.toString()) + " (" + options.getConflictResolution() + ")");
                return WorkerProtocol.toTree(importer.importMangaArchive(archive, options));
            }

            case GET_METRICS:
                return result("metrics", downloadWorker.getMetrics());
            case RESET_METRICS:
                downloadWorker.resetMetrics();
                return null;

            default:
                throw new IllegalArgumentException("Unknown command: " + command.getValue());
        }
    }

    private static <T> T payload(WorkerRequest request, WorkerCommandType command) {
        T payload = optionalPayload(request, command);
        if (payload == null) {
            throw new IllegalArgumentException("Missing payload for " + command.getValue() + " command");
        }
        return payload;
    }

    private static WorkerPayloads.MangaRef mangaRef(WorkerRequest request, WorkerCommandType command) {
        WorkerPayloads.MangaRef payload = payload(request, command);
        require(command, "extensionId", payload.getExtensionId());
        require(command, "mangaId", payload.getMangaId());
        return payload;
    }

    private static WorkerPayloads.ChapterRef chapterRef(WorkerRequest request, WorkerCommandType command) {
        WorkerPayloads.ChapterRef payload = payload(request, command);
        require(command, "extensionId", payload.getExtensionId());
        require(command, "mangaId", payload.getMangaId());
        require(command, "chapterId", payload.getChapterId());
        return payload;
    }

    /** A field the payload class leaves nullable but the command cannot do without. */
    private static <T> T require(WorkerCommandType command, String field, T value) {
        if (value == null || (value instanceof String text && text.isBlank())) {
            throw new IllegalArgumentException("Missing " + field + " for " + command.getValue() + " command");
        }
        return value;
    }

    @SuppressWarnings("unchecked")
    private static <T> T optionalPayload(WorkerRequest request, WorkerCommandType command) {
        JsonElement raw = request.getPayload();
        if (raw == null || raw.isJsonNull() || command.getPayloadType() == null) {
            return null;
        }
        return (T) WorkerProtocol.gson().fromJson(raw, command.getPayloadType());
    }

    private static DownloadOptions toOptions(WorkerPayloads.DownloadRequestOptions options) {
        if (options == null) {
            return DownloadOptions.defaults();
        }
        return new DownloadOptions(options.getPriority() == null ? 0 : options.getPriority(), options.getChapterIds());
    }

    private static JsonElement result(String key, Object value) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put(key, value);
        // a null value drops the key, which the host reads back as null
        return WorkerProtocol.toTree(body);
    }

    void setCurrentTimeSupplier(Supplier<Long> currentTimeSupplier) {
        this.currentTimeSupplier = currentTimeSupplier;
    }
}
