package com.jamra.offline.service.event;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.util.List;

/**
 * Envelope the {@link EventCoalescer} hands to its sink. Each subclass serializes with a
 * {@code type} discriminator: {@code queue-update}, {@code download-update},
 * {@code content-update} or {@code system}.
 */
@Getter
@ToString
@EqualsAndHashCode
public abstract class ConsolidatedEvent {

    private final String type;

    protected ConsolidatedEvent(String type) {
        this.type = type;
    }

    @Getter
    @ToString(callSuper = true)
    @EqualsAndHashCode(callSuper = true)
    public static class QueueUpdate extends ConsolidatedEvent {
        private final List<QueueItem> items;

        public QueueUpdate(List<QueueItem> items) {
            super("queue-update");
            this.items = items;
        }
    }

    @Getter
    @ToString(callSuper = true)
    @EqualsAndHashCode(callSuper = true)
    public static class DownloadUpdate extends ConsolidatedEvent {
        private final List<DownloadItem> items;

        public DownloadUpdate(List<DownloadItem> items) {
            super("download-update");
            this.items = items;
        }
    }

    @Getter
    @ToString(callSuper = true)
    @EqualsAndHashCode(callSuper = true)
    public static class ContentUpdate extends ConsolidatedEvent {
        private final List<ContentItem> updates;

        public ContentUpdate(List<ContentItem> updates) {
            super("content-update");
            this.updates = updates;
        }
    }

    @Getter
    @ToString(callSuper = true)
    @EqualsAndHashCode(callSuper = true)
    public static class SystemUpdate extends ConsolidatedEvent {
        private final String action;
        private final long deletedBytes;
        private final int deletedChapters;

        public SystemUpdate(String action, long deletedBytes, int deletedChapters) {
            super("system");
            this.action = action;
            this.deletedBytes = deletedBytes;
            this.deletedChapters = deletedChapters;
        }
    }

    /** {@code state} is {@code queued} or {@code retried}. */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class QueueItem {
        private long queueId;
        private String mangaId;
        private String chapterId;
        private String state;
    }

    /** {@code state} is {@code started}, {@code progress}, {@code completed} or {@code failed}. */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class DownloadItem {
        private long queueId;
        private String mangaId;
        private String chapterId;
        private String state;
        private Integer current;
        private Integer total;
        private String error;
    }

    /** {@code action} is {@code chapter-deleted}, {@code manga-deleted} or {@code new-chapters}. */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ContentItem {
        private String action;
        private String mangaId;
        private String chapterId;
        private Integer count;
    }
}
