package com.jamra.offline.metrics;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Point-in-time copy of the worker's counters. */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class PerformanceMetrics {
    private long totalDownloads;
    private int activeDownloads;
    private long completedDownloads;
    private long failedDownloads;
    private long totalPagesDownloaded;
    private long totalBytesDownloaded;
    private double averageDownloadTimeMs;
    private double averagePageTimeMs;
    private long eventsEmitted;
    private double eventsPerSecond;
    private long databaseWrites;
    private long networkRequests;
    private long startTime;
    private long uptimeMs;
}
