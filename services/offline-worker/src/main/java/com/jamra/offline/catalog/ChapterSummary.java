package com.jamra.offline.catalog;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ChapterSummary {
    private String id;
    private String title;
    /** Free-form chapter number, e.g. {@code "12"} or {@code "12.5"}. */
    private String number;
    private String volume;
    private String languageCode;
    private String publishedAt;
    private List<String> scanlators;

    public ChapterSummary(String id, String title, String number) {
        this.id = id;
        this.title = title;
        this.number = number;
    }
}
