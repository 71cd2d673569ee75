package com.jamra.offline.service;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.boot.test.system.CapturedOutput;
import org.springframework.boot.test.system.OutputCaptureExtension;

import java.io.IOException;
import java.nio.file.AccessDeniedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;

@ExtendWith(OutputCaptureExtension.class)
class LoggerServiceTest {

    @Test
    void fallsBackToUserHomeWhenConfiguredDirectoryIsDenied(@TempDir Path fallback, CapturedOutput output) {
        LoggerService service = new LoggerService() {
            @Override
            protected Path resolveConfiguredDataPath() {
                return Path.of("/denied/data");
            }

            @Override
            protected Path resolveUserHomeDataPath() {
                return fallback;
            }

            @Override
            protected Path createDirectories(Path path) throws IOException {
                if (path.startsWith("/denied")) {
                    throw new AccessDeniedException(path.toString());
                }
                return Files.createDirectories(path);
            }
        };

        service.afterPropertiesSet();

        assertThat(service.getDataRoot()).isEqualTo(fallback);
        assertThat(output).contains("⚠️ Failed to create configured data directory");
        service.destroy();
    }

    @Test
    void writesTaggedLinesToLatestLogAndStderr(@TempDir Path dataDir, CapturedOutput output) throws IOException {
        LoggerService service = new LoggerService() {
            @Override
            protected Path resolveConfiguredDataPath() {
                return dataDir;
            }
        };

        service.afterPropertiesSet();
        service.info("DOWNLOAD", "📥 Queued chapter 12");
        service.warn("OFFLINE", "⚠️ Chapter count mismatch");
        service.destroy();

        String logFile = Files.readString(dataDir.resolve("logs").resolve("latest.log"));
        assertThat(logFile).contains("[SYSTEM] [DATA_ROOT] " + dataDir.toAbsolutePath());
        assertThat(logFile).contains("[INFO] [DOWNLOAD] 📥 Queued chapter 12");
        assertThat(logFile).contains("[WARN] [OFFLINE] ⚠️ Chapter count mismatch");
        assertThat(output.getErr()).contains("[INFO] [DOWNLOAD] 📥 Queued chapter 12");
    }

    @Test
    void rotatesPreviousLatestLogOnStartup(@TempDir Path dataDir) throws IOException {
        Path logs = Files.createDirectories(dataDir.resolve("logs"));
        Files.writeString(logs.resolve("latest.log"), "previous run\n");

        LoggerService service = new LoggerService() {
            @Override
            protected Path resolveConfiguredDataPath() {
                return dataDir;
            }
        };
        service.afterPropertiesSet();
        service.destroy();

        try (Stream<Path> files = Files.list(logs)) {
            assertThat(files.map(path -> path.getFileName().toString()))
                    .contains("latest.log")
                    .anyMatch(name -> name.endsWith(".log") && !name.equals("latest.log"));
        }
        assertThat(Files.readString(logs.resolve("latest.log"))).doesNotContain("previous run");
    }

    @Test
    void sanitizeForLogStripsLineBreaksAndControlCharacters() {
        assertThat(LoggerService.sanitizeForLog("manga-1\r\n[ERROR] forged")).isEqualTo("manga-1ERROR forged");
        assertThat(LoggerService.sanitizeForLog(null)).isEmpty();
        assertThat(LoggerService.sanitizeForLog("  one-piece/ch_1.5  ")).isEqualTo("one-piece/ch_1.5");
    }
}
