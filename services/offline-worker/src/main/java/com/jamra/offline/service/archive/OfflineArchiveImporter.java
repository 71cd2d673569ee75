package com.jamra.offline.service.archive;

import com.jamra.offline.model.OfflineChapterMetadata;
import com.jamra.offline.model.OfflineChapterPages;
import com.jamra.offline.model.OfflineMangaMetadata;
import com.jamra.offline.repository.OfflineChapterRecord;
import com.jamra.offline.repository.OfflineMangaRecord;
import com.jamra.offline.repository.OfflineRepository;
import com.jamra.offline.service.LoggerService;
import com.jamra.offline.util.ChapterTitles;
import com.jamra.offline.util.OfflineFileStore;
import com.jamra.offline.util.OfflinePaths;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;
import java.util.regex.Pattern;
import java.util.zip.ZipEntry;
import java.util.zip.ZipInputStream;

import static com.jamra.offline.service.LoggerService.sanitizeForLog;

/**
 * Reads archives written by {@link OfflineArchiver} back into the offline store, sidecars and
 * relational rows included, so an imported manga is indistinguishable from a downloaded one.
 * <p>
 * Archives are unpacked into {@code {dataDir}/.temp} first and that directory is removed
 * afterwards, whatever the outcome.
 */
@Service
public class OfflineArchiveImporter {

    private static final String TAG = "IMPORT";
    private static final String TEMP_DIR = ".temp";
    private static final List<String> COVER_EXTENSIONS = List.of("jpg", "png", "jpeg", "webp");
    private static final Pattern SAFE_SEGMENT = Pattern.compile("[A-Za-z0-9._-]+");

    private final OfflineRepository repository;
    private final OfflineFileStore fileStore;
    private final OfflinePaths paths;
    private final LoggerService logger;

    private Supplier<Long> currentTimeSupplier = System::currentTimeMillis;

    public OfflineArchiveImporter(OfflineRepository repository,
                                  OfflineFileStore fileStore,
                                  OfflinePaths paths,
                                  LoggerService logger) {
        this.repository = repository;
        this.fileStore = fileStore;
        this.paths = paths;
        this.logger = logger;
    }

    /** Checks an archive without touching the offline store. */
    public ArchiveValidation validateArchive(Path archive) {
        Path tempDir = tempDir("validate");
        try {
            extract(archive, tempDir);
            return validateStructure(tempDir);
        } catch (IOException e) {
            ArchiveValidation validation = new ArchiveValidation();
            validation.getErrors().add("Failed to extract archive: " + e.getMessage());
            return validation;
        } finally {
            removeTemp(tempDir);
        }
    }

    public ImportResult importMangaArchive(Path archive, ImportOptions options) {
        ImportOptions effective = options == null ? ImportOptions.defaults() : options;
        ConflictResolution resolution = effective.getConflictResolution() == null
                ? ConflictResolution.SKIP
                : effective.getConflictResolution();
        Path tempDir = tempDir("import");

        try {
            extract(archive, tempDir);

            if (effective.isValidate()) {
                ArchiveValidation validation = validateStructure(tempDir);
                if (!validation.isValid()) {
                    return ImportResult.failed("Archive validation failed: " + String.join(", ", validation.getErrors()));
                }
            }

            OfflineMangaMetadata metadata = fileStore.readJson(tempDir.resolve(OfflinePaths.METADATA_FILE), OfflineMangaMetadata.class);
            String problem = identityProblem(metadata);
            if (problem != null) {
                return ImportResult.failed(problem);
            }
            String extensionId = metadata.getExtensionId();
            String mangaId = metadata.getMangaId();
            String slug = slugOf(metadata);

            Optional<OfflineMangaRecord> stored = repository.getManga(extensionId, mangaId);
            boolean conflict = stored.isPresent() || fileStore.exists(paths.mangaDir(extensionId, slug));
            if (conflict) {
                switch (resolution) {
                    case SKIP -> {
                        logger.info(TAG, "⏭️ Skipped import of [" + sanitizeForLog(metadata.getTitle()) + "], already stored");
                        return ImportResult.skipped(extensionId, mangaId);
                    }
                    case OVERWRITE -> removeStoredCopy(extensionId, slug, stored);
                    case RENAME -> {
                        if (stored.isPresent()) {
                            return ImportResult.failed("Manga " + mangaId + " is already stored offline; "
                                    + "rename only resolves folder collisions with other manga");
                        }
                        slug = slug + "-" + currentTimeSupplier.get();
                    }
                }
            }

            int chaptersImported = copyIntoStore(tempDir, metadata, extensionId, mangaId, slug);
            logger.info(TAG, "📥 Imported [" + sanitizeForLog(metadata.getTitle()) + "] with " + chaptersImported
                    + " chapters into " + paths.mangaDir(extensionId, slug));
            return ImportResult.imported(extensionId, mangaId, chaptersImported);

        } catch (IOException | RuntimeException e) {
            logger.error(TAG, "❌ Failed to import " + archive + ": " + e.getMessage(), e);
            return ImportResult.failed(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        } finally {
            removeTemp(tempDir);
        }
    }

    // ─────────────────────────────────────────────────────────────
    // VALIDATION
    // ─────────────────────────────────────────────────────────────

    ArchiveValidation validateStructure(Path root) throws IOException {
        ArchiveValidation validation = new ArchiveValidation();
        List<String> errors = validation.getErrors();
        List<String> warnings = validation.getWarnings();

        Path metadataFile = root.resolve(OfflinePaths.METADATA_FILE);
        if (!fileStore.exists(metadataFile)) {
            errors.add("Missing metadata.json file");
            return validation;
        }

        OfflineMangaMetadata metadata;
        try {
            metadata = fileStore.readJson(metadataFile, OfflineMangaMetadata.class);
        } catch (IOException e) {
            errors.add("Failed to parse metadata.json: " + e.getMessage());
            return validation;
        }
        if (isBlank(metadata.getTitle()) || isBlank(metadata.getMangaId()) || isBlank(metadata.getExtensionId())) {
            errors.add("Invalid metadata.json: missing required fields");
        } else {
            Optional.ofNullable(identityProblem(metadata)).ifPresent(errors::add);
        }

        Path chaptersDir = root.resolve(OfflinePaths.CHAPTERS_DIR);
        int validChapters = 0;
        if (!Files.isDirectory(chaptersDir)) {
            warnings.add("No chapters directory found");
        } else {
            for (Path chapterDir : fileStore.listDirs(chaptersDir)) {
                String problemWithChapter = chapterProblem(chapterDir);
                if (problemWithChapter == null) {
                    validChapters++;
                } else {
                    warnings.add("Chapter " + chapterDir.getFileName() + ": " + problemWithChapter);
                }
            }
            if (validChapters == 0) {
                errors.add("No valid chapters found in archive");
            }
        }

        validation.setValid(errors.isEmpty());
        validation.setManga(new ArchiveValidation.Summary(metadata.getTitle(), metadata.getExtensionId(),
                metadata.getMangaId(), validChapters));
        return validation;
    }

    /** @return why the chapter directory cannot be imported, or {@code null} */
    private String chapterProblem(Path chapterDir) throws IOException {
        Path sidecar = chapterDir.resolve(OfflinePaths.METADATA_FILE);
        if (!fileStore.exists(sidecar)) {
            return "missing metadata.json";
        }
        OfflineChapterPages pages;
        try {
            pages = fileStore.readJson(sidecar, OfflineChapterPages.class);
        } catch (IOException e) {
            return "unreadable metadata.json";
        }
        if (isBlank(pages.getChapterId())) {
            return "metadata.json has no chapterId";
        }
        if (OfflineArchiver.imageFiles(chapterDir).isEmpty()) {
            return "no image files found";
        }
        return null;
    }

    /** Extension id and slug become directory names, so they must stay single path segments. */
    private static String identityProblem(OfflineMangaMetadata metadata) {
        if (isBlank(metadata.getMangaId()) || isBlank(metadata.getExtensionId())) {
            return "Invalid metadata.json: missing required fields";
        }
        String extensionId = metadata.getExtensionId();
        if (!SAFE_SEGMENT.matcher(extensionId).matches() || ".".equals(extensionId) || "..".equals(extensionId)) {
            return "Invalid metadata.json: unsafe extensionId " + extensionId;
        }
        return null;
    }

    // ─────────────────────────────────────────────────────────────
    // IMPORT
    // ─────────────────────────────────────────────────────────────

    private int copyIntoStore(Path root,
                              OfflineMangaMetadata metadata,
                              String extensionId,
                              String mangaId,
                              String slug) throws IOException {
        long now = currentTimeSupplier.get();
        Path mangaDir = paths.mangaDir(extensionId, slug);
        fileStore.ensureDir(paths.chaptersDir(extensionId, slug));

        metadata.setSlug(slug);
        metadata.setCoverPath(copyCover(root, mangaDir).orElse(OfflinePaths.DEFAULT_COVER));

        List<OfflineChapterMetadata> listed = metadata.getChapters() == null ? List.of() : metadata.getChapters();
        List<OfflineChapterMetadata> imported = new ArrayList<>();
        List<OfflineChapterRecord> chapterRows = new ArrayList<>();

        Path chaptersDir = root.resolve(OfflinePaths.CHAPTERS_DIR);
        for (Path source : fileStore.listDirs(chaptersDir)) {
            String problem = chapterProblem(source);
            if (problem != null) {
                logger.warn(TAG, "⚠️ Skipping chapter " + source.getFileName() + ": " + problem);
                continue;
            }

            String folderName = source.getFileName().toString();
            Path target = paths.chapterDir(extensionId, slug, folderName);
            fileStore.deleteDir(target);
            fileStore.ensureDir(target);
            List<Path> images = OfflineArchiver.imageFiles(source);
            for (Path image : images) {
                Files.copy(image, target.resolve(image.getFileName().toString()), StandardCopyOption.REPLACE_EXISTING);
            }

            OfflineChapterPages pages = fileStore.readJson(source.resolve(OfflinePaths.METADATA_FILE), OfflineChapterPages.class);
            pages.setMangaId(mangaId);
            pages.setFolderName(folderName);
            fileStore.writeJson(paths.chapterMetadataFile(extensionId, slug, folderName), pages);

            int totalPages = pages.getPages() == null || pages.getPages().isEmpty() ? images.size() : pages.getPages().size();
            long size = fileStore.dirSize(target);
            OfflineChapterMetadata entry = listed.stream()
                    .filter(candidate -> Objects.equals(candidate.getChapterId(), pages.getChapterId()))
                    .findFirst()
                    .orElseGet(() -> minimalEntry(pages.getChapterId()));
            entry.setFolderName(folderName);
            entry.setTotalPages(totalPages);
            entry.setSizeBytes(size);
            entry.setDownloadedAt(now);
            imported.add(entry);
            chapterRows.add(new OfflineChapterRecord(0L, 0L, entry.getChapterId(), entry.getNumber(), entry.getTitle(),
                    folderName, totalPages, now, size));
        }

        metadata.setChapters(imported);
        if (metadata.getDownloadedAt() == 0L) {
            metadata.setDownloadedAt(now);
        }
        metadata.setLastUpdatedAt(now);
        fileStore.writeJson(paths.mangaMetadataFile(extensionId, slug), metadata);

        long mangaRow = repository.insertManga(new OfflineMangaRecord(
                0L, extensionId, mangaId, slug, mangaDir.toString(), now, now, fileStore.dirSize(mangaDir)));
        for (OfflineChapterRecord row : chapterRows) {
            row.setOfflineMangaId(mangaRow);
            repository.insertChapter(row);
        }
        return imported.size();
    }

    private void removeStoredCopy(String extensionId, String slug, Optional<OfflineMangaRecord> stored) throws IOException {
        if (stored.isPresent()) {
            fileStore.deleteDir(paths.mangaDir(extensionId, stored.get().getMangaSlug()));
            repository.deleteManga(stored.get().getId());
        }
        fileStore.deleteDir(paths.mangaDir(extensionId, slug));
        logger.info(TAG, "♻️ Replacing stored copy at " + paths.mangaDir(extensionId, slug));
    }

    /** @return the cover file name inside the manga directory, when the archive carries one */
    private Optional<String> copyCover(Path root, Path mangaDir) throws IOException {
        for (String extension : COVER_EXTENSIONS) {
            Path cover = root.resolve("cover." + extension);
            if (fileStore.exists(cover)) {
                String name = "cover." + extension;
                Files.copy(cover, mangaDir.resolve(name), StandardCopyOption.REPLACE_EXISTING);
                return Optional.of(name);
            }
        }
        return Optional.empty();
    }

    private static OfflineChapterMetadata minimalEntry(String chapterId) {
        OfflineChapterMetadata entry = new OfflineChapterMetadata();
        entry.setChapterId(chapterId);
        entry.setSlug(OfflinePaths.sanitizeSlug(chapterId));
        entry.setDisplayTitle(ChapterTitles.format(null, null, chapterId));
        return entry;
    }

    private static String slugOf(OfflineMangaMetadata metadata) {
        String slug = OfflinePaths.sanitizeSlug(isBlank(metadata.getSlug()) ? metadata.getTitle() : metadata.getSlug());
        return slug.isEmpty() ? OfflinePaths.sanitizeSlug(metadata.getMangaId()) : slug;
    }

    // ─────────────────────────────────────────────────────────────
    // EXTRACTION
    // ─────────────────────────────────────────────────────────────

    /** Unpacks every entry below {@code target}; an entry naming a path outside it aborts. */
    void extract(Path archive, Path target) throws IOException {
        fileStore.ensureDir(target);
        Path root = target.toAbsolutePath().normalize();
        try (InputStream in = Files.newInputStream(archive);
             ZipInputStream zip = new ZipInputStream(in)) {
            for (ZipEntry entry = zip.getNextEntry(); entry != null; entry = zip.getNextEntry()) {
                Path destination = root.resolve(entry.getName()).normalize();
                if (!destination.startsWith(root) || destination.equals(root)) {
                    throw new IOException("Archive entry escapes target directory: " + entry.getName());
                }
                if (entry.isDirectory()) {
                    fileStore.ensureDir(destination);
                } else {
                    fileStore.ensureDir(destination.getParent());
                    Files.copy(zip, destination, StandardCopyOption.REPLACE_EXISTING);
                }
                zip.closeEntry();
            }
        }
    }

    private Path tempDir(String purpose) {
        return paths.dataDir().resolve(TEMP_DIR).resolve(purpose + "-" + currentTimeSupplier.get() + "-" + Thread.currentThread().getId());
    }

    private void removeTemp(Path tempDir) {
        try {
            fileStore.deleteDir(tempDir);
        } catch (IOException e) {
            logger.warn(TAG, "⚠️ Failed to clean up " + tempDir + ": " + e.getMessage());
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    void setCurrentTimeSupplier(Supplier<Long> currentTimeSupplier) {
        this.currentTimeSupplier = Objects.requireNonNull(currentTimeSupplier);
    }
}
