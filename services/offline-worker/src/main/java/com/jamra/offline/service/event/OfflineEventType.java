package com.jamra.offline.service.event;

public enum OfflineEventType {
    DOWNLOAD_QUEUED("download-queued"),
    DOWNLOAD_STARTED("download-started"),
    DOWNLOAD_PROGRESS("download-progress"),
    DOWNLOAD_COMPLETED("download-completed"),
    DOWNLOAD_FAILED("download-failed"),
    DOWNLOAD_RETRIED("download-retried"),
    CHAPTER_DELETED("chapter-deleted"),
    MANGA_DELETED("manga-deleted"),
    NEW_CHAPTERS_AVAILABLE("new-chapters-available"),
    CLEANUP_PERFORMED("cleanup-performed");

    private final String value;

    OfflineEventType(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }
}
