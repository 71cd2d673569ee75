package com.jamra.offline.service.event;

import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * Something that happened in the offline subsystem. Which fields are set depends on the
 * {@link OfflineEventType}; use the static factories rather than the builder.
 */
@Getter
@ToString
@Builder(access = AccessLevel.PRIVATE)
public class OfflineEvent {

    private final OfflineEventType type;
    private final Long queueId;
    private final String mangaId;
    private final String chapterId;
    private final Integer progressCurrent;
    private final Integer progressTotal;
    private final String error;
    private final Integer newChapterCount;
    private final Long deletedBytes;
    private final Integer deletedChapters;

    public static OfflineEvent queued(long queueId, String mangaId, String chapterId) {
        return builder().type(OfflineEventType.DOWNLOAD_QUEUED).queueId(queueId).mangaId(mangaId).chapterId(chapterId).build();
    }

    public static OfflineEvent started(long queueId, String mangaId, String chapterId) {
        return builder().type(OfflineEventType.DOWNLOAD_STARTED).queueId(queueId).mangaId(mangaId).chapterId(chapterId).build();
    }

    public static OfflineEvent progress(long queueId, String mangaId, String chapterId, int current, int total) {
        return builder().type(OfflineEventType.DOWNLOAD_PROGRESS)
                .queueId(queueId).mangaId(mangaId).chapterId(chapterId)
                .progressCurrent(current).progressTotal(total)
                .build();
    }

    public static OfflineEvent completed(long queueId, String mangaId, String chapterId) {
        return builder().type(OfflineEventType.DOWNLOAD_COMPLETED).queueId(queueId).mangaId(mangaId).chapterId(chapterId).build();
    }

    public static OfflineEvent failed(long queueId, String mangaId, String chapterId, String error) {
        return builder().type(OfflineEventType.DOWNLOAD_FAILED)
                .queueId(queueId).mangaId(mangaId).chapterId(chapterId).error(error)
                .build();
    }

    public static OfflineEvent retried(long queueId, String mangaId, String chapterId) {
        return builder().type(OfflineEventType.DOWNLOAD_RETRIED).queueId(queueId).mangaId(mangaId).chapterId(chapterId).build();
    }

    public static OfflineEvent chapterDeleted(String mangaId, String chapterId) {
        return builder().type(OfflineEventType.CHAPTER_DELETED).mangaId(mangaId).chapterId(chapterId).build();
    }

    public static OfflineEvent mangaDeleted(String mangaId) {
        return builder().type(OfflineEventType.MANGA_DELETED).mangaId(mangaId).build();
    }

    public static OfflineEvent newChaptersAvailable(String mangaId, int newChapterCount) {
        return builder().type(OfflineEventType.NEW_CHAPTERS_AVAILABLE).mangaId(mangaId).newChapterCount(newChapterCount).build();
    }

    public static OfflineEvent cleanupPerformed(long deletedBytes, int deletedChapters) {
        return builder().type(OfflineEventType.CLEANUP_PERFORMED).deletedBytes(deletedBytes).deletedChapters(deletedChapters).build();
    }
}
