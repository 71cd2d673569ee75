package com.jamra.offline.repository;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class OfflineMangaRecord {
    private long id;
    private String extensionId;
    private String mangaId;
    private String mangaSlug;
    private String downloadPath;
    private long downloadedAt;
    private long lastUpdatedAt;
    private long totalSizeBytes;
}
