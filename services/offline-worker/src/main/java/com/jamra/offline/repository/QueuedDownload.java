package com.jamra.offline.repository;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A row of the download queue. A missing {@code chapterId} means the whole manga is queued.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class QueuedDownload {
    private long id;
    private String extensionId;
    private String mangaId;
    private String mangaSlug;
    private String mangaTitle;
    private String chapterId;
    private String chapterNumber;
    private String chapterTitle;
    private DownloadStatus status;
    private int priority;
    private long queuedAt;
    private Long startedAt;
    private Long completedAt;
    private int progressCurrent;
    private int progressTotal;
    private String errorMessage;

    public boolean isWholeManga() {
        return chapterId == null;
    }
}
