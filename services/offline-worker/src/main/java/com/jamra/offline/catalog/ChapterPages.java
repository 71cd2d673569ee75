package com.jamra.offline.catalog;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ChapterPages {
    private String chapterId;
    private String mangaId;
    private List<PageImage> pages;
}
