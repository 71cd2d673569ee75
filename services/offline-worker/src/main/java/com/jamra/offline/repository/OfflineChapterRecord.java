package com.jamra.offline.repository;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class OfflineChapterRecord {
    private long id;
    private long offlineMangaId;
    private String chapterId;
    private String chapterNumber;
    private String chapterTitle;
    private String folderName;
    private int totalPages;
    private long downloadedAt;
    private long sizeBytes;
}
