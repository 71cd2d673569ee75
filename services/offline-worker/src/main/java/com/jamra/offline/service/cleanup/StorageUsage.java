package com.jamra.offline.service.cleanup;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class StorageUsage {
    private long totalBytes;
    private int mangaCount;
}
