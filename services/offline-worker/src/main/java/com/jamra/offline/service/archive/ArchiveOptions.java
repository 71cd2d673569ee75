package com.jamra.offline.service.archive;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.zip.Deflater;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ArchiveOptions {
    private boolean includeMetadata = true;
    private boolean includeCover = true;
    /** 0 (store) to 9 (smallest). */
    private int compressionLevel = 6;

    public static ArchiveOptions defaults() {
        return new ArchiveOptions();
    }

    int deflaterLevel() {
        return Math.max(Deflater.NO_COMPRESSION, Math.min(Deflater.BEST_COMPRESSION, compressionLevel));
    }
}
