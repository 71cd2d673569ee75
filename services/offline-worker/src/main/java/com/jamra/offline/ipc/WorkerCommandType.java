package com.jamra.offline.ipc;

import java.util.Arrays;
import java.util.Optional;

/**
 * Every command the worker process accepts, keyed by its wire name, with the payload class the
 * request carries.
 */
public enum WorkerCommandType {
    START("start"),
    STOP("stop"),
    PING("ping"),
    IS_ACTIVE("is-active"),
    GET_ACTIVE_DOWNLOADS("get-active-downloads"),
    QUEUE_CHAPTER("queue-chapter", WorkerPayloads.QueueChapter.class, true),
    QUEUE_MANGA("queue-manga", WorkerPayloads.QueueManga.class, true),
    CANCEL_DOWNLOAD("cancel-download", WorkerPayloads.QueueRef.class, true),
    RETRY_DOWNLOAD("retry-download", WorkerPayloads.QueueRef.class, true),
    RETRY_FROZEN_DOWNLOADS("retry-frozen-downloads"),
    GET_QUEUED_DOWNLOADS("get-queued-downloads"),
    GET_DOWNLOAD_PROGRESS("get-download-progress", WorkerPayloads.QueueRef.class, true),
    GET_STORAGE_STATS("get-storage-stats"),
    GET_DOWNLOADED_MANGA("get-downloaded-manga"),
    GET_MANGA_METADATA("get-manga-metadata", WorkerPayloads.MangaRef.class, true),
    GET_DOWNLOADED_CHAPTERS("get-downloaded-chapters", WorkerPayloads.MangaRef.class, true),
    GET_CHAPTER_PAGES("get-chapter-pages", WorkerPayloads.ChapterRef.class, true),
    IS_CHAPTER_DOWNLOADED("is-chapter-downloaded", WorkerPayloads.ChapterRef.class, true),
    DELETE_CHAPTER("delete-chapter", WorkerPayloads.ChapterRef.class, true),
    DELETE_MANGA("delete-manga", WorkerPayloads.MangaRef.class, true),
    NUKE_OFFLINE_DATA("nuke-offline-data"),
    GET_DOWNLOAD_HISTORY("get-download-history", WorkerPayloads.HistoryQuery.class, false),
    DELETE_HISTORY_ITEM("delete-history-item", WorkerPayloads.HistoryRef.class, true),
    CLEAR_DOWNLOAD_HISTORY("clear-download-history"),
    VALIDATE_MANGA_CHAPTER_COUNT("validate-manga-chapter-count", WorkerPayloads.MangaRef.class, true),
    START_BACKGROUND_SYNC("start-background-sync", WorkerPayloads.BackgroundSync.class, true),
    GET_PAGE_PATH("get-page-path", WorkerPayloads.PagePath.class, true),
    GET_METRICS("get-metrics"),
    RESET_METRICS("reset-metrics"),
    PAUSE_DOWNLOADS("pause-downloads"),
    RESUME_DOWNLOADS("resume-downloads"),
    PERFORM_CLEANUP("perform-cleanup", WorkerPayloads.Cleanup.class, true),
    ARCHIVE_MANGA("archive-manga", WorkerPayloads.ArchiveManga.class, true),
    ARCHIVE_CHAPTER("archive-chapter", WorkerPayloads.ArchiveChapter.class, true),
    ARCHIVE_BULK("archive-bulk", WorkerPayloads.ArchiveBulk.class, true),
    ESTIMATE_ARCHIVE_SIZE("estimate-archive-size", WorkerPayloads.MangaRef.class, true),
    VALIDATE_ARCHIVE("validate-archive", WorkerPayloads.ArchiveFile.class, true),
    IMPORT_ARCHIVE("import-archive", WorkerPayloads.ImportArchive.class, true);

    private final String value;
    private final Class<?> payloadType;
    private final boolean payloadRequired;

    WorkerCommandType(String value) {
        this(value, null, false);
    }

    WorkerCommandType(String value, Class<?> payloadType, boolean payloadRequired) {
        this.value = value;
        this.payloadType = payloadType;
        this.payloadRequired = payloadRequired;
    }

    public String getValue() {
        return value;
    }

    /** @return the payload class, or {@code null} when the command takes none */
    public Class<?> getPayloadType() {
        return payloadType;
    }

    public boolean isPayloadRequired() {
        return payloadRequired;
    }

    public static Optional<WorkerCommandType> fromValue(String value) {
        return Arrays.stream(values())
                .filter(type -> type.value.equals(value))
                .findFirst();
    }
}
