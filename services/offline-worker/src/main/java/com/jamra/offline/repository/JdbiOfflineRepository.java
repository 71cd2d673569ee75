package com.jamra.offline.repository;

import com.jamra.offline.model.StorageStats;
import lombok.extern.slf4j.Slf4j;
import org.jdbi.v3.core.Jdbi;
import org.jdbi.v3.core.mapper.RowMapper;
import org.jdbi.v3.core.statement.UnableToExecuteStatementException;
import org.springframework.stereotype.Repository;

import java.sql.SQLException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * OfflineRepository on an embedded H2 database through Jdbi.
 */
@Slf4j
@Repository
public class JdbiOfflineRepository implements OfflineRepository {

    private static final String QUEUE_COLUMNS = """
            id, extension_id, manga_id, manga_slug, manga_title, chapter_id, chapter_number,
            chapter_title, status, priority, queued_at, started_at, completed_at,
            progress_current, progress_total, error_message
            """;

    private static final RowMapper<QueuedDownload> QUEUE_MAPPER = (rs, ctx) -> new QueuedDownload(
            rs.getLong("id"),
            rs.getString("extension_id"),
            rs.getString("manga_id"),
            rs.getString("manga_slug"),
            rs.getString("manga_title"),
            rs.getString("chapter_id"),
            rs.getString("chapter_number"),
            rs.getString("chapter_title"),
            DownloadStatus.fromValue(rs.getString("status")),
            rs.getInt("priority"),
            rs.getLong("queued_at"),
            rs.getObject("started_at", Long.class),
            rs.getObject("completed_at", Long.class),
            rs.getInt("progress_current"),
            rs.getInt("progress_total"),
            rs.getString("error_message"));

    private static final RowMapper<DownloadHistoryItem> HISTORY_MAPPER = (rs, ctx) -> new DownloadHistoryItem(
            rs.getLong("id"),
            rs.getString("extension_id"),
            rs.getString("manga_id"),
            rs.getString("manga_slug"),
            rs.getString("manga_title"),
            rs.getString("chapter_id"),
            rs.getString("chapter_number"),
            rs.getString("chapter_title"),
            DownloadStatus.fromValue(rs.getString("status")),
            rs.getLong("queued_at"),
            rs.getObject("started_at", Long.class),
            rs.getLong("completed_at"),
            rs.getString("error_message"),
            rs.getInt("progress_current"),
            rs.getInt("progress_total"));

    private static final RowMapper<OfflineMangaRecord> MANGA_MAPPER = (rs, ctx) -> new OfflineMangaRecord(
            rs.getLong("id"),
            rs.getString("extension_id"),
            rs.getString("manga_id"),
            rs.getString("manga_slug"),
            rs.getString("download_path"),
            rs.getLong("downloaded_at"),
            rs.getLong("last_updated_at"),
            rs.getLong("total_size_bytes"));

    private static final RowMapper<OfflineChapterRecord> CHAPTER_MAPPER = (rs, ctx) -> new OfflineChapterRecord(
            rs.getLong("id"),
            rs.getLong("offline_manga_id"),
            rs.getString("chapter_id"),
            rs.getString("chapter_number"),
            rs.getString("chapter_title"),
            rs.getString("folder_name"),
            rs.getInt("total_pages"),
            rs.getLong("downloaded_at"),
            rs.getLong("size_bytes"));

    private static final String UNIQUE_VIOLATION = "23505";

    private final Jdbi jdbi;
    private Supplier<Long> currentTimeSupplier = System::currentTimeMillis;

    public JdbiOfflineRepository(Jdbi jdbi) {
        this.jdbi = jdbi;
        initializeSchema();
    }

    private void initializeSchema() {
        jdbi.useHandle(handle -> {
            handle.execute("""
                        CREATE TABLE IF NOT EXISTS offline_manga (
                            id BIGINT AUTO_INCREMENT PRIMARY KEY,
                            extension_id VARCHAR(255) NOT NULL,
                            manga_id VARCHAR(255) NOT NULL,
                            manga_slug VARCHAR(500) NOT NULL,
                            download_path VARCHAR(2000) NOT NULL,
                            downloaded_at BIGINT NOT NULL,
                            last_updated_at BIGINT NOT NULL,
                            total_size_bytes BIGINT DEFAULT 0,
                            UNIQUE(extension_id, manga_id)
                        )
                    """);
            handle.execute("CREATE INDEX IF NOT EXISTS idx_offline_manga_slug ON offline_manga(extension_id, manga_slug)");

            handle.execute("""
                        CREATE TABLE IF NOT EXISTS offline_chapters (
                            id BIGINT AUTO_INCREMENT PRIMARY KEY,
                            offline_manga_id BIGINT NOT NULL,
                            chapter_id VARCHAR(255) NOT NULL,
                            chapter_number VARCHAR(64),
                            chapter_title VARCHAR(1000),
                            folder_name VARCHAR(255) NOT NULL,
                            total_pages INT NOT NULL,
                            downloaded_at BIGINT NOT NULL,
                            size_bytes BIGINT DEFAULT 0,
                            FOREIGN KEY (offline_manga_id) REFERENCES offline_manga(id) ON DELETE CASCADE,
                            UNIQUE(offline_manga_id, chapter_id)
                        )
                    """);
            handle.execute("CREATE INDEX IF NOT EXISTS idx_offline_chapters_manga ON offline_chapters(offline_manga_id)");

            handle.execute("""
                        CREATE TABLE IF NOT EXISTS download_queue (
                            id BIGINT AUTO_INCREMENT PRIMARY KEY,
                            extension_id VARCHAR(255) NOT NULL,
                            manga_id VARCHAR(255) NOT NULL,
                            manga_slug VARCHAR(500) NOT NULL,
                            manga_title VARCHAR(1000),
                            chapter_id VARCHAR(255),
                            chapter_number VARCHAR(64),
                            chapter_title VARCHAR(1000),
                            status VARCHAR(20) NOT NULL,
                            priority INT DEFAULT 0,
                            queued_at BIGINT NOT NULL,
                            started_at BIGINT,
                            completed_at BIGINT,
                            error_message VARCHAR(4000),
                            progress_current INT DEFAULT 0,
                            progress_total INT DEFAULT 0,
                            chapter_key VARCHAR(255) GENERATED ALWAYS AS (COALESCE(chapter_id, ''))
                        )
                    """);
            // one row per chapter, and one whole-manga row per manga
            handle.execute("CREATE UNIQUE INDEX IF NOT EXISTS idx_download_queue_target ON download_queue(extension_id, manga_id, chapter_key)");
            handle.execute("CREATE INDEX IF NOT EXISTS idx_download_queue_status ON download_queue(status, priority DESC, queued_at ASC)");

            handle.execute("""
                        CREATE TABLE IF NOT EXISTS download_history (
                            id BIGINT AUTO_INCREMENT PRIMARY KEY,
                            extension_id VARCHAR(255) NOT NULL,
                            manga_id VARCHAR(255) NOT NULL,
                            manga_slug VARCHAR(500) NOT NULL,
                            manga_title VARCHAR(1000),
                            chapter_id VARCHAR(255),
                            chapter_number VARCHAR(64),
                            chapter_title VARCHAR(1000),
                            status VARCHAR(20) NOT NULL,
                            queued_at BIGINT NOT NULL,
                            started_at BIGINT,
                            completed_at BIGINT NOT NULL,
                            error_message VARCHAR(4000),
                            progress_current INT DEFAULT 0,
                            progress_total INT DEFAULT 0
                        )
                    """);
            handle.execute("CREATE INDEX IF NOT EXISTS idx_download_history_completed ON download_history(completed_at DESC)");

            log.info("✅ Offline storage schema initialized");
        });
    }

    // ─────────────────────────────────────────────────────────────
    // QUEUE
    // ─────────────────────────────────────────────────────────────

    /**
     * Upserts on (extension, manga, chapter). Callers in this process are serialized; the unique
     * index on the target catches writers sharing the database file from elsewhere.
     */
    @Override
    public synchronized long insertQueueItem(QueuedDownload item) {
        try {
            return upsertQueueItem(item);
        } catch (UnableToExecuteStatementException e) {
            if (!isUniqueViolation(e)) {
                throw e;
            }
            // a concurrent caller inserted the same target first, its row is visible now
            log.debug("Queue row for {}/{}/{} was inserted concurrently, updating it instead",
                    item.getExtensionId(), item.getMangaId(), item.getChapterId());
            return upsertQueueItem(item);
        }
    }

    private long upsertQueueItem(QueuedDownload item) {
        return jdbi.inTransaction(handle -> {
            // chapter_id is null for whole-manga rows, so the lookup has to be null-safe
            Optional<Long> existing = handle.createQuery("""
                            SELECT id FROM download_queue
                            WHERE extension_id = ? AND manga_id = ? AND chapter_id IS NOT DISTINCT FROM ?
                            """)
                    .bind(0, item.getExtensionId())
                    .bind(1, item.getMangaId())
                    .bind(2, item.getChapterId())
                    .mapTo(Long.class)
                    .findFirst();

            if (existing.isPresent()) {
                handle.createUpdate("""
                                UPDATE download_queue
                                SET status = ?, priority = ?, queued_at = ?, started_at = NULL, completed_at = NULL,
                                    error_message = NULL, progress_current = 0, progress_total = 0,
                                    manga_slug = ?, manga_title = ?, chapter_number = ?, chapter_title = ?
                                WHERE id = ?
                                """)
                        .bind(0, DownloadStatus.QUEUED.getValue())
                        .bind(1, item.getPriority())
                        .bind(2, item.getQueuedAt())
                        .bind(3, item.getMangaSlug())
                        .bind(4, item.getMangaTitle())
                        .bind(5, item.getChapterNumber())
                        .bind(6, item.getChapterTitle())
                        .bind(7, existing.get())
                        .execute();
                return existing.get();
            }

            return handle.createUpdate("""
                            INSERT INTO download_queue (extension_id, manga_id, manga_slug, manga_title, chapter_id,
                                chapter_number, chapter_title, status, priority, queued_at)
                            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                            """)
                    .bind(0, item.getExtensionId())
                    .bind(1, item.getMangaId())
                    .bind(2, item.getMangaSlug())
                    .bind(3, item.getMangaTitle())
                    .bind(4, item.getChapterId())
                    .bind(5, item.getChapterNumber())
                    .bind(6, item.getChapterTitle())
                    .bind(7, DownloadStatus.QUEUED.getValue())
                    .bind(8, item.getPriority())
                    .bind(9, item.getQueuedAt())
                    .executeAndReturnGeneratedKeys("id")
                    .mapTo(Long.class)
                    .one();
        });
    }

    private static boolean isUniqueViolation(UnableToExecuteStatementException e) {
        for (Throwable cause = e.getCause(); cause != null; cause = cause.getCause()) {
            if (cause instanceof SQLException sql && UNIQUE_VIOLATION.equals(sql.getSQLState())) {
                return true;
            }
        }
        return false;
    }

    @Override
    public Optional<QueuedDownload> getQueueItem(long queueId) {
        return jdbi.withHandle(handle -> handle.createQuery("SELECT " + QUEUE_COLUMNS + " FROM download_queue WHERE id = ?")
                .bind(0, queueId)
                .map(QUEUE_MAPPER)
                .findFirst());
    }

    @Override
    public Optional<QueuedDownload> getNextQueuedDownload() {
        return jdbi.withHandle(handle -> handle.createQuery("SELECT " + QUEUE_COLUMNS + """
                         FROM download_queue
                        WHERE status = ?
                        ORDER BY priority DESC, queued_at ASC, id ASC
                        LIMIT 1
                        """)
                .bind(0, DownloadStatus.QUEUED.getValue())
                .map(QUEUE_MAPPER)
                .findFirst());
    }

    @Override
    public List<QueuedDownload> getQueuedDownloads() {
        return jdbi.withHandle(handle -> handle.createQuery("SELECT " + QUEUE_COLUMNS + """
                         FROM download_queue
                        WHERE status IN (?, ?, ?)
                        ORDER BY priority DESC, queued_at ASC, id ASC
                        """)
                .bind(0, DownloadStatus.QUEUED.getValue())
                .bind(1, DownloadStatus.DOWNLOADING.getValue())
                .bind(2, DownloadStatus.PAUSED.getValue())
                .map(QUEUE_MAPPER)
                .list());
    }

    @Override
    public List<QueuedDownload> getDownloadsByStatus(DownloadStatus status) {
        return jdbi.withHandle(handle -> handle.createQuery("SELECT " + QUEUE_COLUMNS + """
                         FROM download_queue
                        WHERE status = ?
                        ORDER BY priority DESC, queued_at ASC, id ASC
                        """)
                .bind(0, status.getValue())
                .map(QUEUE_MAPPER)
                .list());
    }

    @Override
    public void updateQueueStatus(long queueId, DownloadStatus status, String errorMessage) {
        long now = currentTimeSupplier.get();
        jdbi.useHandle(handle -> {
            switch (status) {
                case DOWNLOADING -> handle.createUpdate("""
                                UPDATE download_queue
                                SET status = ?, error_message = ?, started_at = COALESCE(started_at, ?)
                                WHERE id = ?
                                """)
                        .bind(0, status.getValue())
                        .bind(1, errorMessage)
                        .bind(2, now)
                        .bind(3, queueId)
                        .execute();
                case COMPLETED, FAILED -> handle.createUpdate("""
                                UPDATE download_queue SET status = ?, error_message = ?, completed_at = ? WHERE id = ?
                                """)
                        .bind(0, status.getValue())
                        .bind(1, errorMessage)
                        .bind(2, now)
                        .bind(3, queueId)
                        .execute();
                case QUEUED -> handle.createUpdate("""
                                UPDATE download_queue
                                SET status = ?, error_message = ?, started_at = NULL, completed_at = NULL
                                WHERE id = ?
                                """)
                        .bind(0, status.getValue())
                        .bind(1, errorMessage)
                        .bind(2, queueId)
                        .execute();
                default -> handle.createUpdate("UPDATE download_queue SET status = ?, error_message = ? WHERE id = ?")
                        .bind(0, status.getValue())
                        .bind(1, errorMessage)
                        .bind(2, queueId)
                        .execute();
            }
        });
    }

    @Override
    public void updateQueueProgress(long queueId, int current, int total) {
        jdbi.useHandle(handle -> handle.createUpdate(
                        "UPDATE download_queue SET progress_current = ?, progress_total = ? WHERE id = ?")
                .bind(0, current)
                .bind(1, total)
                .bind(2, queueId)
                .execute());
    }

    @Override
    public int updateQueueStatusForAll(DownloadStatus from, DownloadStatus to) {
        return jdbi.withHandle(handle -> handle.createUpdate("UPDATE download_queue SET status = ? WHERE status = ?")
                .bind(0, to.getValue())
                .bind(1, from.getValue())
                .execute());
    }

    @Override
    public void deleteQueueItem(long queueId) {
        jdbi.useHandle(handle -> handle.execute("DELETE FROM download_queue WHERE id = ?", queueId));
    }

    @Override
    public void moveQueueItemToHistory(long queueId) {
        long now = currentTimeSupplier.get();
        jdbi.useTransaction(handle -> {
            handle.createUpdate("""
                            INSERT INTO download_history (extension_id, manga_id, manga_slug, manga_title, chapter_id,
                                chapter_number, chapter_title, status, queued_at, started_at, completed_at,
                                error_message, progress_current, progress_total)
                            SELECT extension_id, manga_id, manga_slug, manga_title, chapter_id,
                                chapter_number, chapter_title, status, queued_at, started_at, COALESCE(completed_at, ?),
                                error_message, progress_current, progress_total
                            FROM download_queue WHERE id = ?
                            """)
                    .bind(0, now)
                    .bind(1, queueId)
                    .execute();
            handle.execute("DELETE FROM download_queue WHERE id = ?", queueId);
        });
    }

    // ─────────────────────────────────────────────────────────────
    // HISTORY
    // ─────────────────────────────────────────────────────────────

    @Override
    public List<DownloadHistoryItem> getDownloadHistory(Integer limit) {
        return jdbi.withHandle(handle -> {
            if (limit == null) {
                return handle.createQuery("SELECT * FROM download_history ORDER BY completed_at DESC, id DESC")
                        .map(HISTORY_MAPPER)
                        .list();
            }
            return handle.createQuery("SELECT * FROM download_history ORDER BY completed_at DESC, id DESC LIMIT ?")
                    .bind(0, Math.max(0, limit))
                    .map(HISTORY_MAPPER)
                    .list();
        });
    }

    @Override
    public boolean deleteHistoryItem(long historyId) {
        return jdbi.withHandle(handle -> handle.execute("DELETE FROM download_history WHERE id = ?", historyId) > 0);
    }

    @Override
    public void clearDownloadHistory() {
        jdbi.useHandle(handle -> handle.execute("DELETE FROM download_history"));
    }

    // ─────────────────────────────────────────────────────────────
    // MANGA / CHAPTERS
    // ─────────────────────────────────────────────────────────────

    @Override
    public long insertManga(OfflineMangaRecord manga) {
        return jdbi.inTransaction(handle -> {
            int updated = handle.createUpdate("""
                            UPDATE offline_manga
                            SET manga_slug = ?, download_path = ?, last_updated_at = ?, total_size_bytes = ?
                            WHERE extension_id = ? AND manga_id = ?
                            """)
                    .bind(0, manga.getMangaSlug())
                    .bind(1, manga.getDownloadPath())
                    .bind(2, manga.getLastUpdatedAt())
                    .bind(3, manga.getTotalSizeBytes())
                    .bind(4, manga.getExtensionId())
                    .bind(5, manga.getMangaId())
                    .execute();

            if (updated > 0) {
                return handle.createQuery("SELECT id FROM offline_manga WHERE extension_id = ? AND manga_id = ?")
                        .bind(0, manga.getExtensionId())
                        .bind(1, manga.getMangaId())
                        .mapTo(Long.class)
                        .one();
            }

            return handle.createUpdate("""
                            INSERT INTO offline_manga (extension_id, manga_id, manga_slug, download_path,
                                downloaded_at, last_updated_at, total_size_bytes)
                            VALUES (?, ?, ?, ?, ?, ?, ?)
                            """)
                    .bind(0, manga.getExtensionId())
                    .bind(1, manga.getMangaId())
                    .bind(2, manga.getMangaSlug())
                    .bind(3, manga.getDownloadPath())
                    .bind(4, manga.getDownloadedAt())
                    .bind(5, manga.getLastUpdatedAt())
                    .bind(6, manga.getTotalSizeBytes())
                    .executeAndReturnGeneratedKeys("id")
                    .mapTo(Long.class)
                    .one();
        });
    }

    @Override
    public Optional<OfflineMangaRecord> getManga(String extensionId, String mangaId) {
        return jdbi.withHandle(handle -> handle.createQuery(
                        "SELECT * FROM offline_manga WHERE extension_id = ? AND manga_id = ?")
                .bind(0, extensionId)
                .bind(1, mangaId)
                .map(MANGA_MAPPER)
                .findFirst());
    }

    @Override
    public List<OfflineMangaRecord> getAllManga() {
        return jdbi.withHandle(handle -> handle.createQuery("SELECT * FROM offline_manga ORDER BY last_updated_at DESC, id DESC")
                .map(MANGA_MAPPER)
                .list());
    }

    @Override
    public void updateMangaSize(long offlineMangaId, long sizeBytes) {
        long now = currentTimeSupplier.get();
        jdbi.useHandle(handle -> handle.createUpdate(
                        "UPDATE offline_manga SET total_size_bytes = ?, last_updated_at = ? WHERE id = ?")
                .bind(0, sizeBytes)
                .bind(1, now)
                .bind(2, offlineMangaId)
                .execute());
    }

    @Override
    public void deleteManga(long offlineMangaId) {
        jdbi.useTransaction(handle -> {
            handle.execute("DELETE FROM offline_chapters WHERE offline_manga_id = ?", offlineMangaId);
            handle.execute("DELETE FROM offline_manga WHERE id = ?", offlineMangaId);
        });
    }

    @Override
    public long insertChapter(OfflineChapterRecord chapter) {
        return jdbi.inTransaction(handle -> {
            int updated = handle.createUpdate("""
                            UPDATE offline_chapters
                            SET chapter_number = ?, chapter_title = ?, folder_name = ?, total_pages = ?,
                                downloaded_at = ?, size_bytes = ?
                            WHERE offline_manga_id = ? AND chapter_id = ?
                            """)
                    .bind(0, chapter.getChapterNumber())
                    .bind(1, chapter.getChapterTitle())
                    .bind(2, chapter.getFolderName())
                    .bind(3, chapter.getTotalPages())
                    .bind(4, chapter.getDownloadedAt())
                    .bind(5, chapter.getSizeBytes())
                    .bind(6, chapter.getOfflineMangaId())
                    .bind(7, chapter.getChapterId())
                    .execute();

            if (updated > 0) {
                return handle.createQuery("SELECT id FROM offline_chapters WHERE offline_manga_id = ? AND chapter_id = ?")
                        .bind(0, chapter.getOfflineMangaId())
                        .bind(1, chapter.getChapterId())
                        .mapTo(Long.class)
                        .one();
            }

            return handle.createUpdate("""
                            INSERT INTO offline_chapters (offline_manga_id, chapter_id, chapter_number, chapter_title,
                                folder_name, total_pages, downloaded_at, size_bytes)
                            VALUES (?, ?, ?, ?, ?, ?, ?, ?)
                            """)
                    .bind(0, chapter.getOfflineMangaId())
                    .bind(1, chapter.getChapterId())
                    .bind(2, chapter.getChapterNumber())
                    .bind(3, chapter.getChapterTitle())
                    .bind(4, chapter.getFolderName())
                    .bind(5, chapter.getTotalPages())
                    .bind(6, chapter.getDownloadedAt())
                    .bind(7, chapter.getSizeBytes())
                    .executeAndReturnGeneratedKeys("id")
                    .mapTo(Long.class)
                    .one();
        });
    }

    @Override
    public Optional<OfflineChapterRecord> getChapter(long offlineMangaId, String chapterId) {
        return jdbi.withHandle(handle -> handle.createQuery(
                        "SELECT * FROM offline_chapters WHERE offline_manga_id = ? AND chapter_id = ?")
                .bind(0, offlineMangaId)
                .bind(1, chapterId)
                .map(CHAPTER_MAPPER)
                .findFirst());
    }

    @Override
    public List<OfflineChapterRecord> getChapters(long offlineMangaId) {
        return jdbi.withHandle(handle -> handle.createQuery(
                        "SELECT * FROM offline_chapters WHERE offline_manga_id = ? ORDER BY downloaded_at ASC, id ASC")
                .bind(0, offlineMangaId)
                .map(CHAPTER_MAPPER)
                .list());
    }

    @Override
    public void deleteChapter(long offlineMangaId, String chapterId) {
        jdbi.useHandle(handle -> handle.execute(
                "DELETE FROM offline_chapters WHERE offline_manga_id = ? AND chapter_id = ?", offlineMangaId, chapterId));
    }

    @Override
    public boolean isChapterDownloaded(String extensionId, String mangaId, String chapterId) {
        return jdbi.withHandle(handle -> {
            Integer count = handle.createQuery("""
                            SELECT COUNT(*) FROM offline_chapters c
                            JOIN offline_manga m ON m.id = c.offline_manga_id
                            WHERE m.extension_id = ? AND m.manga_id = ? AND c.chapter_id = ?
                            """)
                    .bind(0, extensionId)
                    .bind(1, mangaId)
                    .bind(2, chapterId)
                    .mapTo(Integer.class)
                    .one();
            return count > 0;
        });
    }

    @Override
    public StorageStats getStorageStats() {
        return jdbi.withHandle(handle -> {
            long totalBytes = handle.createQuery("SELECT COALESCE(SUM(total_size_bytes), 0) FROM offline_manga")
                    .mapTo(Long.class)
                    .one();
            int mangaCount = handle.createQuery("SELECT COUNT(*) FROM offline_manga")
                    .mapTo(Integer.class)
                    .one();
            int chapterCount = handle.createQuery("SELECT COUNT(*) FROM offline_chapters")
                    .mapTo(Integer.class)
                    .one();
            int pageCount = handle.createQuery("SELECT COALESCE(SUM(total_pages), 0) FROM offline_chapters")
                    .mapTo(Integer.class)
                    .one();

            Map<String, Long> byExtension = new LinkedHashMap<>();
            handle.createQuery("""
                            SELECT extension_id, COALESCE(SUM(total_size_bytes), 0) AS size_bytes
                            FROM offline_manga GROUP BY extension_id ORDER BY extension_id
                            """)
                    .map((rs, ctx) -> Map.entry(rs.getString("extension_id"), rs.getLong("size_bytes")))
                    .forEach(entry -> byExtension.put(entry.getKey(), entry.getValue()));

            List<MangaStorageInfo> byManga = handle.createQuery("""
                            SELECT m.extension_id, m.manga_id, m.manga_slug, m.total_size_bytes,
                                COUNT(c.id) AS chapter_count, COALESCE(SUM(c.total_pages), 0) AS page_count
                            FROM offline_manga m
                            LEFT JOIN offline_chapters c ON c.offline_manga_id = m.id
                            GROUP BY m.id, m.extension_id, m.manga_id, m.manga_slug, m.total_size_bytes
                            ORDER BY m.total_size_bytes DESC
                            """)
                    .map((rs, ctx) -> new MangaStorageInfo(
                            rs.getString("extension_id"),
                            rs.getString("manga_id"),
                            rs.getString("manga_slug"),
                            rs.getLong("total_size_bytes"),
                            rs.getInt("chapter_count"),
                            rs.getInt("page_count")))
                    .list();

            return new StorageStats(totalBytes, mangaCount, chapterCount, pageCount, byExtension, byManga);
        });
    }

    @Override
    public void clearAllOfflineData() {
        jdbi.useTransaction(handle -> {
            handle.execute("DELETE FROM download_queue");
            handle.execute("DELETE FROM download_history");
            handle.execute("DELETE FROM offline_chapters");
            handle.execute("DELETE FROM offline_manga");
        });
        log.info("🗑️ Cleared all offline data from the database");
    }

    void setCurrentTimeSupplier(Supplier<Long> currentTimeSupplier) {
        this.currentTimeSupplier = Objects.requireNonNull(currentTimeSupplier);
    }
}
