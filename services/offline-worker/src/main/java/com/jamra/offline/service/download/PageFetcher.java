package com.jamra.offline.service.download;

import com.jamra.offline.metrics.PerformanceMetricsTracker;
import com.jamra.offline.service.LoggerService;
import com.jamra.offline.util.OfflinePaths;
import lombok.RequiredArgsConstructor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.io.IOException;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

/**
 * Downloads a single image to disk with bounded retries.
 * <p>
 * Client errors (HTTP 4xx) fail at once. Anything else is retried up to {@code maxRetries}
 * attempts with a linearly growing delay. The file extension is taken from the response's
 * content type, then from the URL, defaulting to {@code jpg}.
 */
@Service
@RequiredArgsConstructor
public class PageFetcher {

    private static final String USER_AGENT = "JAMRA/1.0";
    private static final String DEFAULT_MIME_TYPE = "image/jpeg";
    private static final int MAX_IMAGE_BYTES = 64 * 1024 * 1024;

    private final LoggerService logger;
    private final PerformanceMetricsTracker metrics;

    private final WebClient webClient = WebClient.builder()
            .exchangeStrategies(ExchangeStrategies.builder()
                    .codecs(codecs -> codecs.defaultCodecs().maxInMemorySize(MAX_IMAGE_BYTES))
                    .build())
            .build();

    @Value("${offline.fetch.max-retries:3}")
    private int maxRetries = 3;

    @Value("${offline.fetch.retry-delay-ms:1000}")
    private long retryDelayMs = 1000;

    @Value("${offline.fetch.timeout-ms:30000}")
    private long timeoutMs = 30000;

    /**
     * @param destination target path; only its base name is kept, the extension is replaced
     * @throws PageFetchException once retries are exhausted or on a client error
     */
    public FetchedPage fetch(String url, Path destination) {
        Exception lastError = null;

        for (int attempt = 1; attempt <= maxRetries; attempt++) {
            try {
                return attemptFetch(url, destination);
            } catch (WebClientResponseException e) {
                if (e.getStatusCode().is4xxClientError()) {
                    throw new PageFetchException("HTTP " + e.getStatusCode().value() + " for " + url, e);
                }
                lastError = e;
            } catch (IOException | RuntimeException e) {
                lastError = e;
            }

            if (attempt < maxRetries) {
                logger.warn("FETCH", "⚠️ Page download failed, retrying (" + attempt + "/" + maxRetries + "): "
                        + LoggerService.sanitizeForLog(url));
                try {
                    sleep(retryDelayMs * attempt);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new PageFetchException("Interrupted while retrying " + url, e);
                }
            }
        }

        String reason = lastError == null ? "unknown error" : lastError.getMessage();
        throw new PageFetchException("Failed to download image after " + maxRetries + " attempts: " + reason, lastError);
    }

    private FetchedPage attemptFetch(String url, Path destination) throws IOException {
        long started = System.currentTimeMillis();
        metrics.recordNetworkRequest();

        ResponseEntity<byte[]> response = webClient.get()
                .uri(URI.create(url))
                .header(HttpHeaders.USER_AGENT, USER_AGENT)
                .retrieve()
                .toEntity(byte[].class)
                .block(Duration.ofMillis(timeoutMs));

        if (response == null) {
            throw new IOException("No response for " + url);
        }

        byte[] body = response.getBody() == null ? new byte[0] : response.getBody();
        MediaType contentType = response.getHeaders().getContentType();
        String mimeType = contentType == null ? DEFAULT_MIME_TYPE : contentType.toString();

        String extension = OfflinePaths.imageExtension(url, mimeType);
        Path target = destination.resolveSibling(baseName(destination) + "." + extension);
        Files.createDirectories(target.getParent());
        Files.write(target, body);

        metrics.recordPageDownloaded(body.length, System.currentTimeMillis() - started);
        return new FetchedPage(target.getFileName().toString(), body.length, mimeType);
    }

    protected void sleep(long millis) throws InterruptedException {
        Thread.sleep(millis);
    }

    private static String baseName(Path path) {
        String name = path.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }
}
