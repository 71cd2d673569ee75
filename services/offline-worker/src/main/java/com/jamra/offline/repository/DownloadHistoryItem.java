package com.jamra.offline.repository;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/** A finished queue item kept for the downloads history view. */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class DownloadHistoryItem {
    private long id;
    private String extensionId;
    private String mangaId;
    private String mangaSlug;
    private String mangaTitle;
    private String chapterId;
    private String chapterNumber;
    private String chapterTitle;
    private DownloadStatus status;
    private long queuedAt;
    private Long startedAt;
    private long completedAt;
    private String errorMessage;
    private int progressCurrent;
    private int progressTotal;
}
