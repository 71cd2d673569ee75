package com.jamra.offline.catalog;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Manga details as served by the catalog service. {@code chapters} is in provider order.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class MangaDetails {
    private String id;
    private String slug;
    private String title;
    private String description;
    private String coverUrl;
    private List<String> authors;
    private List<String> artists;
    private List<String> genres;
    private List<String> tags;
    private Double rating;
    private Integer year;
    private String status;
    private String demographic;
    private List<String> altTitles;
    private List<ChapterSummary> chapters;
}
