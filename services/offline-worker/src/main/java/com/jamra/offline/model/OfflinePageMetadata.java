package com.jamra.offline.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class OfflinePageMetadata {
    private int index;
    private String originalUrl;
    private String filename;
    private Integer width;
    private Integer height;
    private long sizeBytes;
    private String mimeType;
}
