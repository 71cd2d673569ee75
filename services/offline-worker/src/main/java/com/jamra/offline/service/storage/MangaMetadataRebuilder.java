package com.jamra.offline.service.storage;

import com.jamra.offline.catalog.ChapterSummary;
import com.jamra.offline.catalog.ContentProvider;
import com.jamra.offline.catalog.MangaDetails;
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
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

import static com.jamra.offline.service.LoggerService.sanitizeForLog;

/**
 * Keeps a manga's {@code metadata.json} in step with the relational chapter rows.
 * <p>
 * The relational rows are authoritative for which chapters exist. A sidecar that is missing,
 * unreadable, or lists a different chapter set is rebuilt from the chapter sidecars, the rows,
 * and catalog details when those can be fetched.
 */
@Component
public class MangaMetadataRebuilder {

    private static final String TAG = "METADATA";
    private static final List<String> COVER_CANDIDATES = List.of("cover.webp", "cover.png", "cover.jpeg", "cover.jpg");

    private final OfflineRepository repository;
    private final ContentProvider contentProvider;
    private final OfflineFileStore fileStore;
    private final OfflinePaths paths;
    private final LoggerService logger;

    private Supplier<Long> currentTimeSupplier = System::currentTimeMillis;

    public MangaMetadataRebuilder(OfflineRepository repository,
                                  ContentProvider contentProvider,
                                  OfflineFileStore fileStore,
                                  OfflinePaths paths,
                                  LoggerService logger) {
        this.repository = repository;
        this.contentProvider = contentProvider;
        this.fileStore = fileStore;
        this.paths = paths;
        this.logger = logger;
    }

    /**
     * Returns the manga's sidecar, rebuilding it first when forced or out of step.
     *
     * @param useCatalog whether a rebuild may ask the content provider for fresh details
     * @return empty when the manga is not stored offline
     */
    public Optional<OfflineMangaMetadata> ensure(String extensionId, String mangaId, boolean force, boolean useCatalog)
            throws IOException {
        Optional<OfflineMangaRecord> record = repository.getManga(extensionId, mangaId);
        if (record.isEmpty()) {
            return Optional.empty();
        }

        OfflineMangaRecord manga = record.get();
        List<OfflineChapterRecord> rows = repository.getChapters(manga.getId());
        OfflineMangaMetadata existing = readExisting(manga, force);

        String reason = rebuildReason(existing, rows, force);
        if (reason == null) {
            return Optional.of(existing);
        }

        String message = "Rebuilding metadata for manga " + sanitizeForLog(mangaId) + ": " + reason;
        if (force) {
            logger.info(TAG, "🔧 " + message);
        } else {
            logger.warn(TAG, "⚠️ " + message);
        }
        return Optional.of(rebuild(manga, rows, existing, useCatalog));
    }

    /**
     * @return why a rebuild is needed, or {@code null} when the sidecar matches the rows
     */
    static String rebuildReason(OfflineMangaMetadata existing, List<OfflineChapterRecord> rows, boolean force) {
        if (force) {
            return "forced";
        }
        if (existing == null) {
            return "metadata missing";
        }

        Set<String> sidecarIds = new HashSet<>();
        if (existing.getChapters() != null) {
            existing.getChapters().forEach(chapter -> sidecarIds.add(chapter.getChapterId()));
        }
        Set<String> rowIds = new HashSet<>();
        rows.forEach(row -> rowIds.add(row.getChapterId()));

        if (sidecarIds.size() != rowIds.size() || !sidecarIds.containsAll(rowIds)) {
            return "chapter mismatch (db=" + rowIds.size() + ", metadata=" + sidecarIds.size() + ")";
        }
        return null;
    }

    private OfflineMangaMetadata readExisting(OfflineMangaRecord manga, boolean force) {
        Path metadataFile = paths.mangaMetadataFile(manga.getExtensionId(), manga.getMangaSlug());
        if (!fileStore.exists(metadataFile)) {
            return null;
        }
        try {
            return fileStore.readJson(metadataFile, OfflineMangaMetadata.class);
        } catch (IOException e) {
            if (!force) {
                logger.warn(TAG, "⚠️ Metadata file unreadable for manga " + sanitizeForLog(manga.getMangaId()) + ": " + e.getMessage());
            }
            return null;
        }
    }

    private OfflineMangaMetadata rebuild(OfflineMangaRecord manga,
                                         List<OfflineChapterRecord> rows,
                                         OfflineMangaMetadata existing,
                                         boolean useCatalog) throws IOException {
        String extensionId = manga.getExtensionId();
        String slug = manga.getMangaSlug();
        MangaDetails details = useCatalog ? fetchDetails(extensionId, manga.getMangaId()) : null;

        Map<String, ChapterSummary> catalogChapters = new HashMap<>();
        if (details != null && details.getChapters() != null) {
            details.getChapters().forEach(chapter -> catalogChapters.put(chapter.getId(), chapter));
        }
        Map<String, OfflineChapterMetadata> existingChapters = new HashMap<>();
        if (existing != null && existing.getChapters() != null) {
            existing.getChapters().forEach(chapter -> existingChapters.put(chapter.getChapterId(), chapter));
        }

        List<OfflineChapterMetadata> chapters = new ArrayList<>();
        for (OfflineChapterRecord row : rows) {
            chapters.add(buildChapter(extensionId, slug, row,
                    catalogChapters.get(row.getChapterId()), existingChapters.get(row.getChapterId())));
        }
        chapters.sort(Comparator.comparingLong(OfflineChapterMetadata::getDownloadedAt));

        long now = currentTimeSupplier.get();
        OfflineMangaMetadata metadata = new OfflineMangaMetadata();
        metadata.setDownloadedAt(existing != null && existing.getDownloadedAt() > 0
                ? existing.getDownloadedAt()
                : manga.getDownloadedAt() > 0 ? manga.getDownloadedAt() : now);
        metadata.setLastUpdatedAt(now);
        metadata.setMangaId(manga.getMangaId());
        metadata.setSlug(slug);
        metadata.setExtensionId(extensionId);
        metadata.setTitle(firstNonNull(details == null ? null : details.getTitle(),
                existing == null ? null : existing.getTitle(), manga.getMangaId()));
        metadata.setDescription(firstNonNull(details == null ? null : details.getDescription(),
                existing == null ? null : existing.getDescription()));
        metadata.setCoverUrl(firstNonNull(details == null ? null : details.getCoverUrl(),
                existing == null ? null : existing.getCoverUrl()));
        metadata.setCoverPath(resolveCoverPath(extensionId, slug, existing));
        metadata.setAuthors(firstNonNull(details == null ? null : details.getAuthors(),
                existing == null ? null : existing.getAuthors()));
        metadata.setArtists(firstNonNull(details == null ? null : details.getArtists(),
                existing == null ? null : existing.getArtists()));
        metadata.setGenres(firstNonNull(details == null ? null : details.getGenres(),
                existing == null ? null : existing.getGenres()));
        metadata.setTags(firstNonNull(details == null ? null : details.getTags(),
                existing == null ? null : existing.getTags()));
        metadata.setRating(firstNonNull(details == null ? null : details.getRating(),
                existing == null ? null : existing.getRating()));
        metadata.setYear(firstNonNull(details == null ? null : details.getYear(),
                existing == null ? null : existing.getYear()));
        metadata.setStatus(firstNonNull(details == null ? null : details.getStatus(),
                existing == null ? null : existing.getStatus()));
        metadata.setDemographic(firstNonNull(details == null ? null : details.getDemographic(),
                existing == null ? null : existing.getDemographic()));
        metadata.setAltTitles(firstNonNull(details == null ? null : details.getAltTitles(),
                existing == null ? null : existing.getAltTitles()));
        metadata.setChapters(chapters);

        fileStore.writeJson(paths.mangaMetadataFile(extensionId, slug), metadata);
        repository.updateMangaSize(manga.getId(), fileStore.dirSize(paths.mangaDir(extensionId, slug)));
        return metadata;
    }

    private OfflineChapterMetadata buildChapter(String extensionId,
                                                String slug,
                                                OfflineChapterRecord row,
                                                ChapterSummary catalog,
                                                OfflineChapterMetadata previous) throws IOException {
        OfflineChapterPages pages = null;
        Path chapterMetadataFile = paths.chapterMetadataFile(extensionId, slug, row.getFolderName());
        if (fileStore.exists(chapterMetadataFile)) {
            try {
                pages = fileStore.readJson(chapterMetadataFile, OfflineChapterPages.class);
            } catch (IOException e) {
                logger.warn(TAG, "⚠️ Chapter metadata unreadable at " + chapterMetadataFile + ": " + e.getMessage());
            }
        }

        long downloadedAt = pages != null && pages.getDownloadedAt() > 0
                ? pages.getDownloadedAt()
                : row.getDownloadedAt() > 0 ? row.getDownloadedAt() : currentTimeSupplier.get();
        int totalPages = pages != null && pages.getPages() != null ? pages.getPages().size() : row.getTotalPages();
        long sizeBytes = row.getSizeBytes() > 0
                ? row.getSizeBytes()
                : fileStore.dirSize(paths.chapterDir(extensionId, slug, row.getFolderName()));

        String number = firstNonNull(catalog == null ? null : catalog.getNumber(), row.getChapterNumber());
        String title = firstNonNull(catalog == null ? null : catalog.getTitle(), row.getChapterTitle());
        String slugSource = number != null && !number.isBlank() ? number : row.getChapterId();

        return new OfflineChapterMetadata(
                row.getChapterId(),
                OfflinePaths.sanitizeSlug(slugSource),
                number,
                title,
                ChapterTitles.format(number, title, row.getChapterId()),
                firstNonNull(catalog == null ? null : catalog.getVolume(), previous == null ? null : previous.getVolume()),
                firstNonNull(catalog == null ? null : catalog.getPublishedAt(), previous == null ? null : previous.getPublishedAt()),
                firstNonNull(catalog == null ? null : catalog.getLanguageCode(), previous == null ? null : previous.getLanguageCode()),
                firstNonNull(catalog == null ? null : catalog.getScanlators(), previous == null ? null : previous.getScanlators()),
                row.getFolderName(),
                totalPages,
                downloadedAt,
                sizeBytes);
    }

    private String resolveCoverPath(String extensionId, String slug, OfflineMangaMetadata existing) {
        Path mangaDir = paths.mangaDir(extensionId, slug);
        String current = existing == null ? null : existing.getCoverPath();
        if (current != null && !current.isBlank() && fileStore.exists(mangaDir.resolve(current))) {
            return current;
        }
        for (String candidate : COVER_CANDIDATES) {
            if (fileStore.exists(mangaDir.resolve(candidate))) {
                return candidate;
            }
        }
        return current != null && !current.isBlank() ? current : OfflinePaths.DEFAULT_COVER;
    }

    private MangaDetails fetchDetails(String extensionId, String mangaId) {
        try {
            return contentProvider.fetchMangaDetails(extensionId, mangaId);
        } catch (RuntimeException e) {
            logger.warn(TAG, "⚠️ Unable to fetch catalog details while rebuilding metadata for "
                    + sanitizeForLog(mangaId) + ": " + e.getMessage());
            return null;
        }
    }

    @SafeVarargs
    private static <T> T firstNonNull(T... values) {
        for (T value : values) {
            if (value != null) {
                return value;
            }
        }
        return null;
    }

    void setCurrentTimeSupplier(Supplier<Long> currentTimeSupplier) {
        this.currentTimeSupplier = Objects.requireNonNull(currentTimeSupplier);
    }
}
