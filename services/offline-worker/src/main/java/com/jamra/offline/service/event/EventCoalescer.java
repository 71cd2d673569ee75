package com.jamra.offline.service.event;

import com.jamra.offline.service.LoggerService;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Buffers {@link OfflineEvent}s and hands them to a sink as at most four consolidated envelopes
 * per flush.
 * <p>
 * A flush happens {@code flushIntervalMs} after the first buffered event, immediately when the
 * buffer reaches {@code maxBatchSize}, and synchronously on the caller's thread for
 * {@code download-failed} and {@code download-completed}. Progress for the same queue item is
 * collapsed to its latest state.
 */
public class EventCoalescer {

    public static final long DEFAULT_FLUSH_INTERVAL_MS = 500;
    public static final int DEFAULT_MAX_BATCH_SIZE = 50;

    private static final String TAG = "EVENTS";

    private final Consumer<ConsolidatedEvent> sink;
    private final LoggerService logger;
    private final long flushIntervalMs;
    private final int maxBatchSize;
    private final ScheduledExecutorService scheduler;

    private final List<OfflineEvent> buffer = new ArrayList<>();
    private ScheduledFuture<?> pendingFlush;
    private boolean destroyed;

    public EventCoalescer(Consumer<ConsolidatedEvent> sink, LoggerService logger) {
        this(sink, logger, DEFAULT_FLUSH_INTERVAL_MS, DEFAULT_MAX_BATCH_SIZE);
    }

    public EventCoalescer(Consumer<ConsolidatedEvent> sink, LoggerService logger, long flushIntervalMs, int maxBatchSize) {
        this.sink = sink;
        this.logger = logger;
        this.flushIntervalMs = flushIntervalMs;
        this.maxBatchSize = maxBatchSize;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "event-coalescer");
            thread.setDaemon(true);
            return thread;
        });
    }

    public synchronized void push(OfflineEvent event) {
        if (destroyed) {
            // late events during shutdown still go out, just without batching
            deliver(consolidate(List.of(event)));
            return;
        }

        buffer.add(event);

        if (event.getType() == OfflineEventType.DOWNLOAD_FAILED
                || event.getType() == OfflineEventType.DOWNLOAD_COMPLETED
                || buffer.size() >= maxBatchSize) {
            flush();
            return;
        }

        if (pendingFlush == null) {
            pendingFlush = scheduler.schedule(this::flush, flushIntervalMs, TimeUnit.MILLISECONDS);
        }
    }

    public synchronized void flush() {
        if (pendingFlush != null) {
            pendingFlush.cancel(false);
            pendingFlush = null;
        }
        if (buffer.isEmpty()) {
            return;
        }

        List<OfflineEvent> batch = new ArrayList<>(buffer);
        buffer.clear();
        deliver(consolidate(batch));
    }

    public synchronized boolean hasPending() {
        return !buffer.isEmpty();
    }

    public synchronized int getPendingCount() {
        return buffer.size();
    }

    /** Flushes whatever is buffered and stops the timer. */
    public synchronized void destroy() {
        if (destroyed) {
            return;
        }
        flush();
        destroyed = true;
        scheduler.shutdownNow();
    }

    private void deliver(List<ConsolidatedEvent> envelopes) {
        for (ConsolidatedEvent envelope : envelopes) {
            try {
                sink.accept(envelope);
            } catch (RuntimeException e) {
                logger.error(TAG, "❌ Failed to deliver " + envelope.getType() + " envelope: " + e.getMessage(), e);
            }
        }
    }

    static List<ConsolidatedEvent> consolidate(List<OfflineEvent> events) {
        List<ConsolidatedEvent.QueueItem> queueItems = new ArrayList<>();
        Map<Long, ConsolidatedEvent.DownloadItem> downloadItems = new LinkedHashMap<>();
        List<ConsolidatedEvent.ContentItem> contentItems = new ArrayList<>();
        List<ConsolidatedEvent> systemEvents = new ArrayList<>();

        for (OfflineEvent event : events) {
            switch (event.getType()) {
                case DOWNLOAD_QUEUED -> queueItems.add(queueItem(event, "queued"));
                case DOWNLOAD_RETRIED -> queueItems.add(queueItem(event, "retried"));
                case DOWNLOAD_STARTED -> downloadItems.put(event.getQueueId(), downloadItem(event, "started"));
                case DOWNLOAD_PROGRESS -> downloadItems.put(event.getQueueId(), downloadItem(event, "progress"));
                case DOWNLOAD_COMPLETED -> downloadItems.put(event.getQueueId(), downloadItem(event, "completed"));
                case DOWNLOAD_FAILED -> downloadItems.put(event.getQueueId(), downloadItem(event, "failed"));
                case CHAPTER_DELETED -> contentItems.add(new ConsolidatedEvent.ContentItem(
                        "chapter-deleted", event.getMangaId(), event.getChapterId(), null));
                case MANGA_DELETED -> contentItems.add(new ConsolidatedEvent.ContentItem(
                        "manga-deleted", event.getMangaId(), null, null));
                case NEW_CHAPTERS_AVAILABLE -> contentItems.add(new ConsolidatedEvent.ContentItem(
                        "new-chapters", event.getMangaId(), null, event.getNewChapterCount()));
                case CLEANUP_PERFORMED -> systemEvents.add(new ConsolidatedEvent.SystemUpdate(
                        "cleanup-performed",
                        event.getDeletedBytes() == null ? 0L : event.getDeletedBytes(),
                        event.getDeletedChapters() == null ? 0 : event.getDeletedChapters()));
            }
        }

        List<ConsolidatedEvent> envelopes = new ArrayList<>();
        if (!queueItems.isEmpty()) {
            envelopes.add(new ConsolidatedEvent.QueueUpdate(queueItems));
        }
        if (!downloadItems.isEmpty()) {
            envelopes.add(new ConsolidatedEvent.DownloadUpdate(new ArrayList<>(downloadItems.values())));
        }
        if (!contentItems.isEmpty()) {
            envelopes.add(new ConsolidatedEvent.ContentUpdate(contentItems));
        }
        envelopes.addAll(systemEvents);
        return envelopes;
    }

    private static ConsolidatedEvent.QueueItem queueItem(OfflineEvent event, String state) {
        return new ConsolidatedEvent.QueueItem(event.getQueueId(), event.getMangaId(), event.getChapterId(), state);
    }

    private static ConsolidatedEvent.DownloadItem downloadItem(OfflineEvent event, String state) {
        return new ConsolidatedEvent.DownloadItem(
                event.getQueueId(),
                event.getMangaId(),
                event.getChapterId(),
                state,
                event.getProgressCurrent(),
                event.getProgressTotal(),
                event.getError());
    }
}
