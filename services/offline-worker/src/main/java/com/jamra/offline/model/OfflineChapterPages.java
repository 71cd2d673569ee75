package com.jamra.offline.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/** Contents of a chapter directory's {@code metadata.json}. Pages are kept sorted by index. */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class OfflineChapterPages {
    private int version = OfflineMangaMetadata.CURRENT_VERSION;
    private long downloadedAt;
    private String chapterId;
    private String mangaId;
    private String folderName;
    private List<OfflinePageMetadata> pages = new ArrayList<>();
}
