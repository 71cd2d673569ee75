package com.jamra.offline.metrics;

import org.springframework.stereotype.Component;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * Process-wide counters for downloads, pages, events and I/O. Reset through the
 * {@code reset-metrics} command.
 */
@Component
public class PerformanceMetricsTracker {

    private Supplier<Long> currentTimeSupplier = System::currentTimeMillis;

    private final AtomicLong totalDownloads = new AtomicLong();
    private final AtomicInteger activeDownloads = new AtomicInteger();
    private final AtomicLong completedDownloads = new AtomicLong();
    private final AtomicLong failedDownloads = new AtomicLong();
    private final AtomicLong totalDownloadTimeMs = new AtomicLong();
    private final AtomicLong totalPages = new AtomicLong();
    private final AtomicLong totalPageTimeMs = new AtomicLong();
    private final AtomicLong totalBytes = new AtomicLong();
    private final AtomicLong eventsEmitted = new AtomicLong();
    private final AtomicLong databaseWrites = new AtomicLong();
    private final AtomicLong networkRequests = new AtomicLong();
    private volatile long startTime = System.currentTimeMillis();

    public void recordDownloadStarted() {
        totalDownloads.incrementAndGet();
        activeDownloads.incrementAndGet();
    }

    public void recordDownloadCompleted(long durationMs) {
        activeDownloads.updateAndGet(value -> Math.max(0, value - 1));
        completedDownloads.incrementAndGet();
        totalDownloadTimeMs.addAndGet(durationMs);
    }

    public void recordDownloadFailed() {
        activeDownloads.updateAndGet(value -> Math.max(0, value - 1));
        failedDownloads.incrementAndGet();
    }

    /** A download that ended because its queue row was removed. */
    public void recordDownloadCancelled() {
        activeDownloads.updateAndGet(value -> Math.max(0, value - 1));
    }

    public void recordPageDownloaded(long bytes, long durationMs) {
        totalPages.incrementAndGet();
        totalBytes.addAndGet(bytes);
        totalPageTimeMs.addAndGet(durationMs);
    }

    public void recordEventEmitted() {
        eventsEmitted.incrementAndGet();
    }

    public void recordDatabaseWrite() {
        databaseWrites.incrementAndGet();
    }

    public void recordNetworkRequest() {
        networkRequests.incrementAndGet();
    }

    public PerformanceMetrics snapshot() {
        long now = currentTimeSupplier.get();
        long uptime = Math.max(0, now - startTime);
        long completed = completedDownloads.get();
        long pages = totalPages.get();
        long events = eventsEmitted.get();

        return new PerformanceMetrics(
                totalDownloads.get(),
                activeDownloads.get(),
                completed,
                failedDownloads.get(),
                pages,
                totalBytes.get(),
                completed == 0 ? 0 : (double) totalDownloadTimeMs.get() / completed,
                pages == 0 ? 0 : (double) totalPageTimeMs.get() / pages,
                events,
                uptime == 0 ? 0 : events / (uptime / 1000.0),
                databaseWrites.get(),
                networkRequests.get(),
                startTime,
                uptime);
    }

    public void reset() {
        totalDownloads.set(0);
        activeDownloads.set(0);
        completedDownloads.set(0);
        failedDownloads.set(0);
        totalDownloadTimeMs.set(0);
        totalPages.set(0);
        totalPageTimeMs.set(0);
        totalBytes.set(0);
        eventsEmitted.set(0);
        databaseWrites.set(0);
        networkRequests.set(0);
        startTime = currentTimeSupplier.get();
    }

    void setCurrentTimeSupplier(Supplier<Long> currentTimeSupplier) {
        this.currentTimeSupplier = Objects.requireNonNull(currentTimeSupplier);
        this.startTime = currentTimeSupplier.get();
    }
}
