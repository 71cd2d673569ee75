package com.jamra.offline.ipc;

import com.jamra.offline.service.archive.ArchiveOptions;
import com.jamra.offline.service.archive.ImportOptions;
import com.jamra.offline.service.cleanup.StorageSettings;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Request payloads, one class per distinct shape. See {@link WorkerCommandType} for which
 * command uses which.
 */
public final class WorkerPayloads {

    private WorkerPayloads() {
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class QueueChapter {
        private String extensionId;
        private String mangaId;
        private String chapterId;
        private DownloadRequestOptions options;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class QueueManga {
        private String extensionId;
        private String mangaId;
        private DownloadRequestOptions options;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class DownloadRequestOptions {
        private Integer priority;
        private List<String> chapterIds;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class QueueRef {
        private Long queueId;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class MangaRef {
        private String extensionId;
        private String mangaId;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ChapterRef {
        private String extensionId;
        private String mangaId;
        private String chapterId;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class HistoryQuery {
        private Integer limit;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class HistoryRef {
        private Long historyId;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class BackgroundSync {
        private Long ttlMs;
        private Integer concurrency;
        private Long delayMs;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class PagePath {
        private String mangaId;
        private String chapterId;
        private String filename;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Cleanup {
        private StorageSettings settings;
        private Double targetFreeGB;
    }

    /** {@code outputPath} is optional; without it the archive lands in the worker's archives directory. */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ArchiveManga {
        private String extensionId;
        private String mangaId;
        private String outputPath;
        private ArchiveOptions options;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ArchiveChapter {
        private String extensionId;
        private String mangaId;
        private String chapterId;
        private String outputPath;
        private ArchiveOptions options;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ArchiveBulk {
        private List<MangaRef> items;
        private String outputDir;
        private ArchiveOptions options;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ArchiveFile {
        private String archivePath;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ImportArchive {
        private String archivePath;
        private ImportOptions options;
    }
}
