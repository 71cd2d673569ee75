package com.jamra.offline.service.archive;

import com.jamra.offline.model.OfflineChapterMetadata;
import com.jamra.offline.model.OfflineMangaMetadata;
import com.jamra.offline.service.LoggerService;
import com.jamra.offline.service.storage.OfflineStorageManager;
import com.jamra.offline.util.OfflineFileStore;
import com.jamra.offline.util.OfflinePaths;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

import static com.jamra.offline.service.LoggerService.sanitizeForLog;

/**
 * Packs stored manga into ZIP files for sharing or backup.
 * <p>
 * A manga archive holds {@code metadata.json}, the cover and one
 * {@code chapters/{folder}/} entry per chapter with its sidecar and page images, the same
 * shape {@link OfflineArchiveImporter} reads back. A chapter archive holds the chapter sidecar
 * and its pages at the root.
 */
@Service
public class OfflineArchiver {

    private static final String TAG = "ARCHIVE";
    private static final String ARCHIVES_DIR = ".archives";
    private static final Pattern IMAGE_FILE = Pattern.compile("(?i).+\\.(jpg|jpeg|png|webp|gif)$");
    // deflate barely shrinks already-compressed images
    private static final double SIZE_ESTIMATE_RATIO = 0.97;

    private final OfflineStorageManager storageManager;
    private final OfflineFileStore fileStore;
    private final OfflinePaths paths;
    private final LoggerService logger;

    private Supplier<Long> currentTimeSupplier = System::currentTimeMillis;

    public OfflineArchiver(OfflineStorageManager storageManager,
                           OfflineFileStore fileStore,
                           OfflinePaths paths,
                           LoggerService logger) {
        this.storageManager = storageManager;
        this.fileStore = fileStore;
        this.paths = paths;
        this.logger = logger;
    }

    /** {@code {dataDir}/.archives}, where archives land when the caller names no path. */
    public Path archivesDir() {
        return paths.dataDir().resolve(ARCHIVES_DIR);
    }

    public ArchiveResult archiveManga(String extensionId, String mangaId, ArchiveOptions options) {
        String name = storageManager.getMangaMetadata(extensionId, mangaId)
                .map(OfflineMangaMetadata::getTitle)
                .orElse(mangaId);
        return archiveManga(extensionId, mangaId, archivesDir().resolve(archiveFileName(name + "-" + currentTimeSupplier.get())), options);
    }

    public ArchiveResult archiveManga(String extensionId, String mangaId, Path output, ArchiveOptions options) {
        ArchiveOptions effective = options == null ? ArchiveOptions.defaults() : options;
        Optional<OfflineMangaMetadata> found = storageManager.getMangaMetadata(extensionId, mangaId);
        if (found.isEmpty()) {
            return ArchiveResult.failed(output.toString(), "Manga not found in offline storage");
        }
        OfflineMangaMetadata metadata = found.get();

        try {
            fileStore.ensureDir(output.toAbsolutePath().getParent());
            try (ZipOutputStream zip = new ZipOutputStream(Files.newOutputStream(output))) {
                zip.setLevel(effective.deflaterLevel());

                Path mangaMetadata = paths.mangaMetadataFile(extensionId, metadata.getSlug());
                if (effective.isIncludeMetadata() && fileStore.exists(mangaMetadata)) {
                    addFile(zip, mangaMetadata, OfflinePaths.METADATA_FILE);
                }

                Path cover = coverFile(extensionId, metadata);
                if (effective.isIncludeCover() && fileStore.exists(cover)) {
                    addFile(zip, cover, "cover" + extensionOf(cover));
                }

                for (OfflineChapterMetadata chapter : chaptersOf(metadata)) {
                    String prefix = OfflinePaths.CHAPTERS_DIR + "/" + chapter.getFolderName() + "/";
                    addChapter(zip, extensionId, metadata.getSlug(), chapter, prefix, effective);
                }
            }

            long size = Files.size(output);
            logger.info(TAG, "📦 Archived [" + sanitizeForLog(metadata.getTitle()) + "] with "
                    + chaptersOf(metadata).size() + " chapters to " + output + " (" + size + " bytes)");
            return ArchiveResult.created(output.toString(), size);
        } catch (IOException e) {
            logger.error(TAG, "❌ Failed to archive manga " + sanitizeForLog(mangaId) + ": " + e.getMessage(), e);
            return ArchiveResult.failed(output.toString(), e.getMessage());
        }
    }

    public ArchiveResult archiveChapter(String extensionId, String mangaId, String chapterId, ArchiveOptions options) {
        String name = mangaId + "-" + chapterId + "-" + currentTimeSupplier.get();
        return archiveChapter(extensionId, mangaId, chapterId, archivesDir().resolve(archiveFileName(name)), options);
    }

    public ArchiveResult archiveChapter(String extensionId, String mangaId, String chapterId, Path output, ArchiveOptions options) {
        ArchiveOptions effective = options == null ? ArchiveOptions.defaults() : options;
        Optional<OfflineMangaMetadata> metadata = storageManager.getMangaMetadata(extensionId, mangaId);
        Optional<OfflineChapterMetadata> chapter = metadata.stream()
                .flatMap(manga -> chaptersOf(manga).stream())
                .filter(candidate -> Objects.equals(candidate.getChapterId(), chapterId))
                .findFirst();
        if (chapter.isEmpty()) {
            return ArchiveResult.failed(output.toString(), "Chapter not found in offline storage");
        }

        try {
            fileStore.ensureDir(output.toAbsolutePath().getParent());
            try (ZipOutputStream zip = new ZipOutputStream(Files.newOutputStream(output))) {
                zip.setLevel(effective.deflaterLevel());
                addChapter(zip, extensionId, metadata.get().getSlug(), chapter.get(), "", effective);
            }
            long size = Files.size(output);
            logger.info(TAG, "📦 Archived chapter " + sanitizeForLog(chapterId) + " to " + output + " (" + size + " bytes)");
            return ArchiveResult.created(output.toString(), size);
        } catch (IOException e) {
            logger.error(TAG, "❌ Failed to archive chapter " + sanitizeForLog(chapterId) + ": " + e.getMessage(), e);
            return ArchiveResult.failed(output.toString(), e.getMessage());
        }
    }

    /**
     * One archive per manga, named after its title, inside {@code outputDir}. A manga that fails
     * does not stop the rest.
     */
    public List<ArchiveResult> archiveBulk(List<MangaKey> items, Path outputDir, ArchiveOptions options) {
        List<ArchiveResult> results = new ArrayList<>();
        Set<String> usedNames = new HashSet<>();
        for (MangaKey item : items) {
            String title = storageManager.getMangaMetadata(item.extensionId(), item.mangaId())
                    .map(OfflineMangaMetadata::getTitle)
                    .orElse(item.mangaId());
            String fileName = archiveFileName(title);
            // two titles can sanitize to the same name
            for (int n = 2; !usedNames.add(fileName); n++) {
                fileName = archiveFileName(title + "-" + n);
            }
            results.add(archiveManga(item.extensionId(), item.mangaId(), outputDir.resolve(fileName), options));
        }
        return results;
    }

    public List<ArchiveResult> archiveBulk(List<MangaKey> items, ArchiveOptions options) {
        return archiveBulk(items, archivesDir().resolve("bulk-archive-" + currentTimeSupplier.get()), options);
    }

    /** Stored chapter bytes plus their sidecars, scaled for the little deflate gains on images. */
    public long estimateArchiveSize(String extensionId, String mangaId) {
        Optional<OfflineMangaMetadata> metadata = storageManager.getMangaMetadata(extensionId, mangaId);
        if (metadata.isEmpty()) {
            return 0L;
        }

        long total = 0L;
        for (OfflineChapterMetadata chapter : chaptersOf(metadata.get())) {
            total += chapter.getSizeBytes();
            Path sidecar = paths.chapterMetadataFile(extensionId, metadata.get().getSlug(), chapter.getFolderName());
            try {
                if (fileStore.exists(sidecar)) {
                    total += Files.size(sidecar);
                }
            } catch (IOException e) {
                logger.debug(TAG, "Sidecar size unavailable at " + sidecar + ": " + e.getMessage());
            }
        }
        return (long) Math.floor(total * SIZE_ESTIMATE_RATIO);
    }

    private void addChapter(ZipOutputStream zip,
                            String extensionId,
                            String slug,
                            OfflineChapterMetadata chapter,
                            String prefix,
                            ArchiveOptions options) throws IOException {
        Path chapterDir = paths.chapterDir(extensionId, slug, chapter.getFolderName());
        Path sidecar = paths.chapterMetadataFile(extensionId, slug, chapter.getFolderName());
        if (options.isIncludeMetadata() && fileStore.exists(sidecar)) {
            addFile(zip, sidecar, prefix + OfflinePaths.METADATA_FILE);
        }
        for (Path image : imageFiles(chapterDir)) {
            addFile(zip, image, prefix + image.getFileName());
        }
    }

    private static void addFile(ZipOutputStream zip, Path file, String entryName) throws IOException {
        zip.putNextEntry(new ZipEntry(entryName));
        Files.copy(file, zip);
        zip.closeEntry();
    }

    /** Page images directly inside the chapter directory, by name. */
    static List<Path> imageFiles(Path dir) throws IOException {
        if (!Files.isDirectory(dir)) {
            return List.of();
        }
        try (Stream<Path> files = Files.list(dir)) {
            return files.filter(Files::isRegularFile)
                    .filter(file -> IMAGE_FILE.matcher(file.getFileName().toString()).matches())
                    .sorted()
                    .collect(Collectors.toList());
        }
    }

    private Path coverFile(String extensionId, OfflineMangaMetadata metadata) {
        String cover = metadata.getCoverPath() == null || metadata.getCoverPath().isBlank()
                ? OfflinePaths.DEFAULT_COVER
                : metadata.getCoverPath();
        return paths.mangaDir(extensionId, metadata.getSlug()).resolve(cover);
    }

    private static List<OfflineChapterMetadata> chaptersOf(OfflineMangaMetadata metadata) {
        return metadata.getChapters() == null ? List.of() : metadata.getChapters();
    }

    private static String extensionOf(Path file) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot < 0 ? ".jpg" : name.substring(dot);
    }

    /** Strips characters that are not allowed in file names on common file systems. */
    static String archiveFileName(String name) {
        String safe = name == null ? "" : name.replaceAll("[<>:\"/\\\\|?*\\x00-\\x1F]", "_").trim();
        return (safe.isEmpty() ? "archive" : safe) + ".zip";
    }

    void setCurrentTimeSupplier(Supplier<Long> currentTimeSupplier) {
        this.currentTimeSupplier = Objects.requireNonNull(currentTimeSupplier);
    }

    /** Identifies one stored manga in a bulk request. */
    public record MangaKey(String extensionId, String mangaId) {
    }
}
