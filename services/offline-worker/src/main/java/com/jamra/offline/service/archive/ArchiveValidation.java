package com.jamra.offline.service.archive;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of checking an archive's layout. Errors make it unusable; warnings name chapters that
 * an import would leave out.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ArchiveValidation {
    private boolean valid;
    private List<String> errors = new ArrayList<>();
    private List<String> warnings = new ArrayList<>();
    private Summary manga;

    /** What the archive holds, present once its metadata could be read. */
    public record Summary(String title, String extensionId, String mangaId, int chapterCount) {
    }
}
