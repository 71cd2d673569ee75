package com.jamra.offline.service;

/**
 * A download or storage request that cannot be honoured, e.g. an unknown queue item or a chapter
 * that is already stored. The message is shown to callers as-is.
 */
public class DownloadException extends RuntimeException {

    public DownloadException(String message) {
        super(message);
    }

    public DownloadException(String message, Throwable cause) {
        super(message, cause);
    }
}
