package com.jamra.offline.service.cleanup;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Quota configuration for one cleanup cycle. Supplied by the controller with each request.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class StorageSettings {
    private double maxStorageGB;
    private boolean autoCleanupEnabled;
    private CleanupStrategy cleanupStrategy = CleanupStrategy.OLDEST;
    private double cleanupThresholdPercent = 90;
}
