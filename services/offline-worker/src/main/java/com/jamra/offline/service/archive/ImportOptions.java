package com.jamra.offline.service.archive;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ImportOptions {
    private ConflictResolution conflictResolution = ConflictResolution.SKIP;
    private boolean validate = true;

    public static ImportOptions defaults() {
        return new ImportOptions();
    }
}
