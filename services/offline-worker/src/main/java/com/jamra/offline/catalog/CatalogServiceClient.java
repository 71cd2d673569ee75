package com.jamra.offline.catalog;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;

/**
 * ContentProvider backed by the catalog service's HTTP API.
 * <p>
 * The catalog service owns the extension runtime; this client only reads
 * {@code /api/manga/{id}} and {@code /api/manga/{id}/chapters/{chapterId}/pages}.
 */
@Slf4j
@Service
public class CatalogServiceClient implements ContentProvider {

    private final WebClient webClient = WebClient.builder().build();
    private final Gson gson = new Gson();

    @Value("${offline.catalog.url:http://localhost:4545}")
    private String catalogUrl;

    @Value("${offline.extension-id:}")
    private String defaultExtensionId;

    @Value("${offline.catalog.timeout-ms:30000}")
    private long timeoutMs;

    @Override
    public MangaDetails fetchMangaDetails(String extensionId, String mangaId) {
        String body = get("/api/manga/{mangaId}?extensionId={extensionId}",
                mangaId, resolveExtensionId(extensionId));
        MangaDetailsResponse response = parse(body, MangaDetailsResponse.class);
        if (response == null || response.details == null) {
            throw new CatalogException("Catalog returned no details for manga " + mangaId);
        }
        return response.details;
    }

    @Override
    public ChapterPages fetchChapterPages(String extensionId, String mangaId, String chapterId) {
        String body = get("/api/manga/{mangaId}/chapters/{chapterId}/pages?extensionId={extensionId}",
                mangaId, chapterId, resolveExtensionId(extensionId));
        ChapterPagesResponse response = parse(body, ChapterPagesResponse.class);
        if (response == null || response.pages == null) {
            throw new CatalogException("Catalog returned no pages for chapter " + chapterId);
        }
        return response.pages;
    }

    private String get(String path, Object... uriVariables) {
        try {
            return webClient.get()
                    .uri(catalogUrl + path, uriVariables)
                    .accept(MediaType.APPLICATION_JSON)
                    .retrieve()
                    .bodyToMono(String.class)
                    .block(Duration.ofMillis(timeoutMs));
        } catch (Exception e) {
            throw new CatalogException("Catalog request failed: " + e.getMessage(), e);
        }
    }

    private <T> T parse(String body, Class<T> type) {
        try {
            return gson.fromJson(body, type);
        } catch (JsonParseException e) {
            throw new CatalogException("Catalog returned malformed JSON: " + e.getMessage(), e);
        }
    }

    private String resolveExtensionId(String extensionId) {
        if (extensionId != null && !extensionId.isBlank()) {
            return extensionId;
        }
        return defaultExtensionId == null ? "" : defaultExtensionId;
    }

    private static class MangaDetailsResponse {
        private MangaDetails details;
    }

    private static class ChapterPagesResponse {
        private ChapterPages pages;
    }
}
