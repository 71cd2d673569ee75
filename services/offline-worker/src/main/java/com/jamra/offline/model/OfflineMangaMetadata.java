package com.jamra.offline.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Contents of a manga's {@code metadata.json}. Lets offline readers render the title and its
 * chapter list without the catalog service.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class OfflineMangaMetadata {

    public static final int CURRENT_VERSION = 1;

    private int version = CURRENT_VERSION;
    private long downloadedAt;
    private long lastUpdatedAt;

    private String mangaId;
    private String slug;
    private String extensionId;

    private String title;
    private String description;
    private String coverUrl;
    /** Relative to the manga directory, e.g. {@code cover.jpg}. */
    private String coverPath;
    private List<String> authors;
    private List<String> artists;
    private List<String> genres;
    private List<String> tags;
    private Double rating;
    private Integer year;
    private String status;
    private String demographic;
    private List<String> altTitles;

    private List<OfflineChapterMetadata> chapters = new ArrayList<>();
}
