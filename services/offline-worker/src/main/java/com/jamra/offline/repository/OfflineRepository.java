package com.jamra.offline.repository;

import com.jamra.offline.model.StorageStats;

import java.util.List;
import java.util.Optional;

/**
 * Relational side of the offline store: the download queue, download history and the index of
 * downloaded manga and chapters. Sidecar files are handled elsewhere.
 */
public interface OfflineRepository {

    // ── queue ────────────────────────────────────────────────────

    /**
     * Inserts a queued row, or resets the existing row for the same extension, manga and chapter
     * back to {@code queued} with the new priority and queue time.
     *
     * @return the queue id
     */
    long insertQueueItem(QueuedDownload item);

    Optional<QueuedDownload> getQueueItem(long queueId);

    /** Highest priority first, then oldest. Only {@code queued} rows are considered. */
    Optional<QueuedDownload> getNextQueuedDownload();

    /** Rows that are queued, downloading or paused. */
    List<QueuedDownload> getQueuedDownloads();

    List<QueuedDownload> getDownloadsByStatus(DownloadStatus status);

    /**
     * Sets the status and error message ({@code null} clears it). Moving to
     * {@code downloading} stamps {@code startedAt} once; completed and failed stamp
     * {@code completedAt}; queued clears both.
     */
    void updateQueueStatus(long queueId, DownloadStatus status, String errorMessage);

    void updateQueueProgress(long queueId, int current, int total);

    /** @return the number of rows switched */
    int updateQueueStatusForAll(DownloadStatus from, DownloadStatus to);

    void deleteQueueItem(long queueId);

    /** Copies the row into the history table and removes it from the queue. */
    void moveQueueItemToHistory(long queueId);

    // ── history ──────────────────────────────────────────────────

    /** Newest completion first; {@code limit} may be null for everything. */
    List<DownloadHistoryItem> getDownloadHistory(Integer limit);

    boolean deleteHistoryItem(long historyId);

    void clearDownloadHistory();

    // ── downloaded manga / chapters ──────────────────────────────

    /** Upserts on (extension, manga). @return the offline manga id */
    long insertManga(OfflineMangaRecord manga);

    Optional<OfflineMangaRecord> getManga(String extensionId, String mangaId);

    List<OfflineMangaRecord> getAllManga();

    /** Also bumps {@code lastUpdatedAt}. */
    void updateMangaSize(long offlineMangaId, long sizeBytes);

    void deleteManga(long offlineMangaId);

    /** Upserts on (manga, chapter). @return the chapter row id */
    long insertChapter(OfflineChapterRecord chapter);

    Optional<OfflineChapterRecord> getChapter(long offlineMangaId, String chapterId);

    List<OfflineChapterRecord> getChapters(long offlineMangaId);

    void deleteChapter(long offlineMangaId, String chapterId);

    boolean isChapterDownloaded(String extensionId, String mangaId, String chapterId);

    StorageStats getStorageStats();

    /** Wipes queue, history and the manga index in one transaction. */
    void clearAllOfflineData();
}
