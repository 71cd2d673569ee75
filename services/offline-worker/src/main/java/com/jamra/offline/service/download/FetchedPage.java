package com.jamra.offline.service.download;

/**
 * Result of a page download. {@code filename} carries the extension chosen from the response.
 */
public record FetchedPage(String filename, long sizeBytes, String mimeType) {
}
