package com.jamra.offline.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.beans.factory.InitializingBean;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Comparator;
import java.util.stream.Stream;

/**
 * Tagged logger shared by the worker services.
 * <p>
 * Lines are appended to {@code <dataDir>/logs/latest.log} and mirrored to stderr, since stdout
 * is reserved for IPC frames. The previous {@code latest.log} is archived on startup and only the
 * newest {@value #MAX_LOGS} files are kept.
 */
@Slf4j
@Service
public class LoggerService implements InitializingBean, DisposableBean {

    private static final String LATEST_LOG = "latest.log";
    private static final int MAX_LOGS = 5;
    private static final DateTimeFormatter FILE_FORMATTER = DateTimeFormatter.ofPattern("yyyy-MM-dd_HH-mm-ss");
    private static final DateTimeFormatter LOG_FORMATTER = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    @Value("${offline.data-dir:.jamra-data}")
    private String dataDir;

    private Path dataRoot;
    private Path logsPath;
    private BufferedWriter writer;

    @Override
    public void afterPropertiesSet() {
        dataRoot = initializeDataRoot();

        if (dataRoot == null) {
            log.warn("⚠️ LoggerService initialized without a writable data root. Console output only.");
            return;
        }

        logsPath = dataRoot.resolve("logs");
        try {
            createDirectories(logsPath);
        } catch (IOException e) {
            log.warn("⚠️ Failed to create logs directory at {}. LoggerService will operate in console-only mode.", logsPath.toAbsolutePath(), e);
            logsPath = null;
            return;
        }

        try {
            rotateLogs();
        } catch (IOException e) {
            log.warn("⚠️ Failed to rotate logs at {}. Continuing without rotating existing logs.", logsPath.toAbsolutePath(), e);
        }

        Path latestLogPath = logsPath.resolve(LATEST_LOG);
        try {
            writer = Files.newBufferedWriter(latestLogPath, StandardOpenOption.CREATE, StandardOpenOption.APPEND);
            logSystemEnvironment();
            log.info("📝 LoggerService initialized. Logging to {}", latestLogPath.toAbsolutePath());
        } catch (IOException e) {
            log.warn("⚠️ Failed to initialize log writer at {}. LoggerService will operate in console-only mode.", latestLogPath.toAbsolutePath(), e);
            writer = null;
        }
    }

    private Path initializeDataRoot() {
        Path resolved = tryInitialize(resolveConfiguredDataPath(),
                "📁 Using configured data root at {}",
                "⚠️ Failed to create configured data directory at {}. Falling back to user home.");
        if (resolved != null) {
            return resolved;
        }

        return tryInitialize(resolveUserHomeDataPath(),
                "📁 Using fallback data root at {}",
                "⚠️ Failed to create fallback data directory at {}. LoggerService will operate in console-only mode.");
    }

    private Path tryInitialize(Path path, String successMessage, String failureMessage) {
        if (path == null) {
            return null;
        }

        try {
            Path created = createDirectories(path);
            log.info(successMessage, created.toAbsolutePath());
            return created;
        } catch (IOException e) {
            log.warn(failureMessage, path.toAbsolutePath(), e);
            return null;
        }
    }

    protected Path createDirectories(Path path) throws IOException {
        return Files.createDirectories(path);
    }

    protected Path resolveConfiguredDataPath() {
        if (dataDir == null || dataDir.isBlank()) {
            return null;
        }
        return Path.of(dataDir);
    }

    protected Path resolveUserHomeDataPath() {
        String userHome = System.getProperty("user.home");
        if (userHome != null && !userHome.isBlank()) {
            return Path.of(userHome, ".jamra", "offline-worker");
        }
        return Path.of(".jamra", "offline-worker");
    }

    private void rotateLogs() throws IOException {
        Path latestLog = logsPath.resolve(LATEST_LOG);
        if (Files.exists(latestLog) && Files.size(latestLog) > 0) {
            String timestamp = LocalDateTime.now().format(FILE_FORMATTER);
            Path archivedLog = logsPath.resolve(timestamp + ".log");
            Files.move(latestLog, archivedLog, StandardCopyOption.REPLACE_EXISTING);
            log.info("🔄 Rotated log to {}", archivedLog.getFileName());
        }

        try (Stream<Path> files = Files.list(logsPath)
                .filter(p -> p.getFileName().toString().endsWith(".log"))
                .filter(p -> !p.getFileName().toString().equals(LATEST_LOG))
                .sorted(Comparator.comparingLong(this::getFileModifiedTime).reversed())) {

            files.skip(MAX_LOGS - 1)
                    .forEach(p -> {
                        try {
                            Files.delete(p);
                            log.info("🗑️ Deleted old log file: {}", p.getFileName());
                        } catch (IOException e) {
                            log.warn("⚠️ Failed to delete old log file: {}", p.getFileName(), e);
                        }
                    });
        }
    }

    private long getFileModifiedTime(Path path) {
        try {
            return Files.getLastModifiedTime(path).toMillis();
        } catch (IOException e) {
            return 0L;
        }
    }

    private synchronized void write(String level, String tag, String message) {
        String logLine = String.format("%s [%s] [%s] %s%n", LocalDateTime.now().format(LOG_FORMATTER), level, tag, message);
        if (writer != null) {
            try {
                writer.write(logLine);
                writer.flush();
            } catch (IOException e) {
                log.error("❌ Failed to write to log file", e);
                writer = null;
            }
        }
        System.err.print(logLine);
    }

    public void info(String tag, String message) {
        write("INFO", tag, message);
    }

    public void warn(String tag, String message) {
        write("WARN", tag, message);
    }

    public void error(String tag, String message, Throwable throwable) {
        write("ERROR", tag, message + " | Exception: " + throwable.getMessage());
    }

    public void debug(String tag, String message) {
        write("DEBUG", tag, message);
    }

    public Path getDataRoot() {
        return dataRoot;
    }

    /**
     * Strips line breaks and anything outside a conservative character set so user-supplied ids
     * and titles cannot forge log lines.
     */
    public static String sanitizeForLog(String value) {
        if (value == null) {
            return "";
        }
        return value.replaceAll("[\\r\\n]", "").replaceAll("[^-\\p{Alnum}\\s_:./]", "").trim();
    }

    @Override
    public synchronized void destroy() {
        if (writer == null) {
            return;
        }
        try {
            writer.close();
        } catch (IOException e) {
            log.warn("⚠️ Failed to close log writer", e);
        }
        writer = null;
    }

    private void logSystemEnvironment() {
        write("SYSTEM", "DATA_ROOT", dataRoot.toAbsolutePath().toString());
        write("SYSTEM", "USER", System.getProperty("user.name"));
        write("SYSTEM", "OS", System.getProperty("os.name") + " " + System.getProperty("os.version"));
        write("SYSTEM", "JAVA", System.getProperty("java.version"));
    }
}
