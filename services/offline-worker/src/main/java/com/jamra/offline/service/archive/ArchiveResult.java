package com.jamra.offline.service.archive;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ArchiveResult {
    private boolean success;
    private String outputPath;
    private long sizeBytes;
    private String error;

    static ArchiveResult created(String outputPath, long sizeBytes) {
        return new ArchiveResult(true, outputPath, sizeBytes, null);
    }

    static ArchiveResult failed(String outputPath, String error) {
        return new ArchiveResult(false, outputPath, 0L, error);
    }
}
