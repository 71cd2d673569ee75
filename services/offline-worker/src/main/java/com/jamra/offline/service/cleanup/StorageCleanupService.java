package com.jamra.offline.service.cleanup;

import com.jamra.offline.model.OfflineChapterMetadata;
import com.jamra.offline.model.OfflineMangaMetadata;
import com.jamra.offline.repository.OfflineRepository;
import com.jamra.offline.service.LoggerService;
import com.jamra.offline.service.event.OfflineEvent;
import com.jamra.offline.service.event.OfflineEventListeners;
import com.jamra.offline.util.OfflineFileStore;
import com.jamra.offline.util.OfflinePaths;
import lombok.AllArgsConstructor;
import lombok.Getter;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.function.Consumer;

import static com.jamra.offline.service.LoggerService.sanitizeForLog;

/**
 * Enforces the storage quota by evicting whole manga directories.
 * <p>
 * Sizes come from the chapter entries of each {@code metadata.json} found under the offline root,
 * so a manga with an unreadable sidecar is invisible here until it has been repaired.
 */
@Service
public class StorageCleanupService {

    private static final String TAG = "CLEANUP";
    private static final long BYTES_PER_GB = 1024L * 1024L * 1024L;
    public static final double DEFAULT_TARGET_FREE_GB = 1;

    private final OfflineRepository repository;
    private final OfflineFileStore fileStore;
    private final OfflinePaths paths;
    private final LoggerService logger;
    private final OfflineEventListeners listeners;

    public StorageCleanupService(OfflineRepository repository,
                                 OfflineFileStore fileStore,
                                 OfflinePaths paths,
                                 LoggerService logger) {
        this.repository = repository;
        this.fileStore = fileStore;
        this.paths = paths;
        this.logger = logger;
        this.listeners = new OfflineEventListeners(logger, TAG);
    }

    public Runnable on(Consumer<OfflineEvent> listener) {
        return listeners.subscribe(listener);
    }

    public boolean shouldCleanup(StorageSettings settings) {
        if (!settings.isAutoCleanupEnabled()) {
            return false;
        }
        if (settings.getMaxStorageGB() <= 0) {
            logger.warn(TAG, "⚠️ Ignoring cleanup check, maxStorageGB is " + settings.getMaxStorageGB());
            return false;
        }

        long totalBytes = scanStoredManga().stream().mapToLong(StoredManga::getTotalBytes).sum();
        double usagePercent = ((double) totalBytes / BYTES_PER_GB) / settings.getMaxStorageGB() * 100;
        logger.debug(TAG, String.format(Locale.ROOT, "Storage usage %.1f%% (threshold %.1f%%)",
                usagePercent, settings.getCleanupThresholdPercent()));
        return usagePercent >= settings.getCleanupThresholdPercent();
    }

    public CleanupResult performCleanup(StorageSettings settings) {
        return performCleanup(settings, DEFAULT_TARGET_FREE_GB);
    }

    /**
     * Deletes manga in strategy order until usage is {@code targetFreeGB} below the quota.
     * A manga that cannot be deleted is recorded in {@link CleanupResult#getErrors()} and the
     * loop moves on to the next candidate.
     */
    public CleanupResult performCleanup(StorageSettings settings, double targetFreeGB) {
        CleanupResult result = new CleanupResult();
        List<StoredManga> candidates = scanStoredManga();
        candidates.sort(comparatorFor(settings.getCleanupStrategy()));

        long currentBytes = candidates.stream().mapToLong(StoredManga::getTotalBytes).sum();
        long maxBytes = (long) (settings.getMaxStorageGB() * BYTES_PER_GB);
        long targetBytes = maxBytes - (long) (targetFreeGB * BYTES_PER_GB);
        long needToFree = currentBytes - targetBytes;

        if (needToFree <= 0) {
            logger.debug(TAG, "No cleanup needed, " + formatGb(currentBytes) + " GB in use");
            return result;
        }

        logger.info(TAG, "🧹 Need to free " + formatGb(needToFree) + " GB using strategy "
                + settings.getCleanupStrategy().getValue());

        long freedBytes = 0;
        int itemsRemoved = 0;
        int chaptersRemoved = 0;

        for (StoredManga manga : candidates) {
            if (freedBytes >= needToFree) {
                break;
            }
            try {
                logger.info(TAG, "🗑️ Removing [" + sanitizeForLog(manga.getTitle()) + "] ("
                        + String.format(Locale.ROOT, "%.2f", manga.getTotalBytes() / (1024.0 * 1024.0)) + " MB)");
                fileStore.deleteDir(manga.getDirectory());
                forgetManga(manga);
                freedBytes += manga.getTotalBytes();
                itemsRemoved++;
                chaptersRemoved += manga.getChapterCount();
            } catch (IOException | RuntimeException e) {
                String message = "Failed to delete " + manga.getExtensionId() + "/" + manga.getDirectory().getFileName()
                        + ": " + e.getMessage();
                logger.error(TAG, "❌ " + message, e);
                result.getErrors().add(message);
            }
        }

        result.setFreedBytes(freedBytes);
        result.setItemsRemoved(itemsRemoved);
        result.setSuccess(result.getErrors().isEmpty());

        logger.info(TAG, "✅ Cleanup complete. Freed " + formatGb(freedBytes) + " GB by removing " + itemsRemoved + " manga");
        if (itemsRemoved > 0) {
            listeners.emit(OfflineEvent.cleanupPerformed(freedBytes, chaptersRemoved));
        }
        return result;
    }

    public StorageUsage getStorageUsage() {
        List<StoredManga> stored = scanStoredManga();
        long totalBytes = stored.stream().mapToLong(StoredManga::getTotalBytes).sum();
        return new StorageUsage(totalBytes, stored.size());
    }

    static Comparator<StoredManga> comparatorFor(CleanupStrategy strategy) {
        switch (strategy == null ? CleanupStrategy.OLDEST : strategy) {
            case LARGEST:
                return Comparator.comparingLong(StoredManga::getTotalBytes).reversed();
            case LEAST_ACCESSED:
                return Comparator.comparingLong(StoredManga::getLastAccessedAt);
            case OLDEST:
            default:
                return Comparator.comparingLong(StoredManga::getDownloadedAt);
        }
    }

    private void forgetManga(StoredManga manga) {
        if (manga.getMangaId() == null) {
            return;
        }
        repository.getManga(manga.getExtensionId(), manga.getMangaId())
                .ifPresent(record -> repository.deleteManga(record.getId()));
    }

    List<StoredManga> scanStoredManga() {
        List<StoredManga> result = new ArrayList<>();
        Path offlineDir = paths.offlineDir();
        if (!fileStore.exists(offlineDir)) {
            return result;
        }

        List<Path> extensionDirs;
        try {
            extensionDirs = fileStore.listDirs(offlineDir);
        } catch (IOException e) {
            logger.error(TAG, "❌ Failed to list offline storage at " + offlineDir + ": " + e.getMessage(), e);
            return result;
        }

        for (Path extensionDir : extensionDirs) {
            String extensionId = extensionDir.getFileName().toString();
            if (extensionId.startsWith(".")) {
                continue;
            }
            try {
                for (Path mangaDir : fileStore.listDirs(extensionDir)) {
                    readStoredManga(extensionId, mangaDir, result);
                }
            } catch (IOException e) {
                logger.warn(TAG, "⚠️ Failed to list manga under " + extensionDir + ": " + e.getMessage());
            }
        }
        return result;
    }

    private void readStoredManga(String extensionId, Path mangaDir, List<StoredManga> into) {
        Path metadataFile = mangaDir.resolve(OfflinePaths.METADATA_FILE);
        if (!fileStore.exists(metadataFile)) {
            return;
        }
        try {
            OfflineMangaMetadata metadata = fileStore.readJson(metadataFile, OfflineMangaMetadata.class);
            List<OfflineChapterMetadata> chapters = metadata.getChapters() == null ? List.of() : metadata.getChapters();
            long totalBytes = chapters.stream().mapToLong(OfflineChapterMetadata::getSizeBytes).sum();
            into.add(new StoredManga(
                    extensionId,
                    metadata.getMangaId(),
                    metadata.getTitle() != null ? metadata.getTitle() : mangaDir.getFileName().toString(),
                    mangaDir,
                    totalBytes,
                    chapters.size(),
                    metadata.getDownloadedAt(),
                    lastAccessedAt(mangaDir)));
        } catch (IOException e) {
            logger.warn(TAG, "⚠️ Failed to read manga stats: " + extensionId + "/" + mangaDir.getFileName() + ": " + e.getMessage());
        }
    }

    /** @return the directory's last access time, or 0 when the filesystem cannot tell */
    protected long lastAccessedAt(Path mangaDir) {
        try {
            return Files.readAttributes(mangaDir, BasicFileAttributes.class).lastAccessTime().toMillis();
        } catch (IOException e) {
            return 0;
        }
    }

    private static String formatGb(long bytes) {
        return String.format(Locale.ROOT, "%.2f", (double) bytes / BYTES_PER_GB);
    }

    @Getter
    @AllArgsConstructor
    static class StoredManga {
        private final String extensionId;
        private final String mangaId;
        private final String title;
        private final Path directory;
        private final long totalBytes;
        private final int chapterCount;
        private final long downloadedAt;
        private final long lastAccessedAt;
    }
}
