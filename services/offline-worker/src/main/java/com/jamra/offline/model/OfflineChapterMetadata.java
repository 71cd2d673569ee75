package com.jamra.offline.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/** One chapter entry inside the manga sidecar. */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class OfflineChapterMetadata {
    private String chapterId;
    private String slug;
    private String number;
    private String title;
    private String displayTitle;
    private String volume;
    private String publishedAt;
    private String languageCode;
    private List<String> scanlators;
    private String folderName;
    private int totalPages;
    private long downloadedAt;
    private long sizeBytes;
}
