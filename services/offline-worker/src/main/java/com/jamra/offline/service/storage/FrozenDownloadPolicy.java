package com.jamra.offline.service.storage;

import com.jamra.offline.repository.DownloadStatus;
import com.jamra.offline.repository.QueuedDownload;

/**
 * Decides when a {@code downloading} row has stalled: no progress at all after
 * {@code noProgressAfterMs}, or less than {@code minProgressRatio} done after
 * {@code slowProgressAfterMs}.
 */
public record FrozenDownloadPolicy(long noProgressAfterMs, long slowProgressAfterMs, double minProgressRatio) {

    public static final FrozenDownloadPolicy DEFAULT = new FrozenDownloadPolicy(30_000, 120_000, 0.10);

    public boolean isFrozen(QueuedDownload item, long now) {
        if (item.getStatus() != DownloadStatus.DOWNLOADING || item.getStartedAt() == null) {
            return false;
        }

        long elapsed = now - item.getStartedAt();
        if (elapsed > noProgressAfterMs && item.getProgressCurrent() == 0) {
            return true;
        }
        return elapsed > slowProgressAfterMs
                && item.getProgressTotal() > 0
                && (double) item.getProgressCurrent() / item.getProgressTotal() < minProgressRatio;
    }
}
