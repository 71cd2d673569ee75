package com.jamra.offline.model;

import com.jamra.offline.repository.MangaStorageInfo;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * Aggregate view of what is stored offline.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class StorageStats {
    private long totalBytes;
    private int mangaCount;
    private int chapterCount;
    private int pageCount;
    private Map<String, Long> byExtension;
    private List<MangaStorageInfo> byManga;
}
