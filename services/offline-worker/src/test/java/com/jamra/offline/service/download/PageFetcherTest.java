package com.jamra.offline.service.download;

import com.jamra.offline.metrics.PerformanceMetricsTracker;
import com.jamra.offline.service.LoggerService;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mockito;
import org.springframework.test.util.ReflectionTestUtils;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PageFetcherTest {

    private static final byte[] PNG_BYTES = {(byte) 0x89, 'P', 'N', 'G', 1, 2, 3, 4};

    @TempDir
    Path tempDir;

    private HttpServer server;
    private int port;
    private final List<Long> sleeps = new ArrayList<>();
    private final PerformanceMetricsTracker metrics = new PerformanceMetricsTracker();
    private PageFetcher fetcher;

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress(0), 0);
        port = server.getAddress().getPort();
        fetcher = new PageFetcher(Mockito.mock(LoggerService.class), metrics) {
            @Override
            protected void sleep(long millis) {
                sleeps.add(millis);
            }
        };
    }

    @AfterEach
    void tearDown() {
        if (server != null) {
            server.stop(0);
        }
    }

    @Test
    void savesTheImageUnderTheExtensionOfItsContentType() throws IOException {
        server.createContext("/img/001", exchange -> {
            exchange.getResponseHeaders().set("Content-Type", "image/png");
            exchange.sendResponseHeaders(200, PNG_BYTES.length);
            try (OutputStream os = exchange.getResponseBody()) {
                os.write(PNG_BYTES);
            }
        });
        server.start();

        FetchedPage page = fetcher.fetch("http://127.0.0.1:" + port + "/img/001", tempDir.resolve("chapter-0001").resolve("page-0001.jpg"));

        assertThat(page.filename()).isEqualTo("page-0001.png");
        assertThat(page.sizeBytes()).isEqualTo(PNG_BYTES.length);
        assertThat(page.mimeType()).isEqualTo("image/png");
        assertThat(Files.readAllBytes(tempDir.resolve("chapter-0001").resolve("page-0001.png"))).isEqualTo(PNG_BYTES);
        assertThat(metrics.snapshot().getNetworkRequests()).isEqualTo(1);
    }

    @Test
    void serverErrorsAreRetriedWithGrowingDelay() {
        AtomicInteger calls = new AtomicInteger();
        server.createContext("/flaky.webp", exchange -> {
            if (calls.incrementAndGet() < 3) {
                exchange.sendResponseHeaders(503, -1);
                exchange.close();
                return;
            }
            exchange.sendResponseHeaders(200, PNG_BYTES.length);
            try (OutputStream os = exchange.getResponseBody()) {
                os.write(PNG_BYTES);
            }
        });
        server.start();

        FetchedPage page = fetcher.fetch("http://127.0.0.1:" + port + "/flaky.webp", tempDir.resolve("page-0002"));

        assertThat(calls).hasValue(3);
        assertThat(sleeps).containsExactly(1000L, 2000L);
        assertThat(page.filename()).startsWith("page-0002.");
    }

    @Test
    void clientErrorsFailWithoutRetrying() {
        AtomicInteger calls = new AtomicInteger();
        server.createContext("/missing.jpg", exchange -> {
            calls.incrementAndGet();
            exchange.sendResponseHeaders(404, -1);
            exchange.close();
        });
        server.start();

        assertThatThrownBy(() -> fetcher.fetch("http://127.0.0.1:" + port + "/missing.jpg", tempDir.resolve("page-0003.jpg")))
                .isInstanceOf(PageFetchException.class)
                .hasMessageContaining("HTTP 404");
        assertThat(calls).hasValue(1);
        assertThat(sleeps).isEmpty();
    }

    @Test
    void givesUpAfterTheConfiguredNumberOfAttempts() {
        AtomicInteger calls = new AtomicInteger();
        server.createContext("/down.jpg", exchange -> {
            calls.incrementAndGet();
            exchange.sendResponseHeaders(500, -1);
            exchange.close();
        });
        server.start();
        ReflectionTestUtils.setField(fetcher, "maxRetries", 2);

        assertThatThrownBy(() -> fetcher.fetch("http://127.0.0.1:" + port + "/down.jpg", tempDir.resolve("page-0004.jpg")))
                .isInstanceOf(PageFetchException.class)
                .hasMessageStartingWith("Failed to download image after 2 attempts");
        assertThat(calls).hasValue(2);
        assertThat(tempDir.resolve("page-0004.jpg")).doesNotExist();
    }
}
