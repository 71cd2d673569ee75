package com.jamra.offline.service.archive;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ImportResult {
    private boolean success;
    private boolean skipped;
    private String extensionId;
    private String mangaId;
    private int chaptersImported;
    private String error;

    static ImportResult imported(String extensionId, String mangaId, int chaptersImported) {
        return new ImportResult(true, false, extensionId, mangaId, chaptersImported, null);
    }

    static ImportResult skipped(String extensionId, String mangaId) {
        return new ImportResult(true, true, extensionId, mangaId, 0, null);
    }

    static ImportResult failed(String error) {
        return new ImportResult(false, false, null, null, 0, error);
    }
}
