package com.jamra.offline.repository;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class MangaStorageInfo {
    private String extensionId;
    private String mangaId;
    private String mangaSlug;
    private long sizeBytes;
    private int chapterCount;
    private int pageCount;
}
