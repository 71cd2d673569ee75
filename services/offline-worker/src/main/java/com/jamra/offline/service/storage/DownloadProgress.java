package com.jamra.offline.service.storage;

import com.jamra.offline.repository.DownloadStatus;
import com.jamra.offline.repository.QueuedDownload;
import com.jamra.offline.util.ChapterTitles;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * Read-only progress snapshot of a queue item.
 */
@Getter
@ToString
@AllArgsConstructor
public class DownloadProgress {

    private final long queueId;
    private final String mangaTitle;
    private final String chapterTitle;
    private final DownloadStatus status;
    private final int progressCurrent;
    private final int progressTotal;
    /** Rounded to the nearest whole percent, 0 while the total is unknown. */
    private final int progressPercent;
    private final String errorMessage;

    public static DownloadProgress of(QueuedDownload item) {
        int percent = item.getProgressTotal() > 0
                ? (int) Math.round((double) item.getProgressCurrent() / item.getProgressTotal() * 100)
                : 0;
        String mangaTitle = item.getMangaTitle() != null ? item.getMangaTitle() : "Unknown";
        String chapterTitle = item.isWholeManga()
                ? null
                : ChapterTitles.format(item.getChapterNumber(), item.getChapterTitle(), item.getChapterId());

        return new DownloadProgress(
                item.getId(),
                mangaTitle,
                chapterTitle,
                item.getStatus(),
                item.getProgressCurrent(),
                item.getProgressTotal(),
                percent,
                item.getErrorMessage());
    }
}
