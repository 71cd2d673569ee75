package com.jamra.offline.service.download;

/** The queue row vanished while its download was running. */
class DownloadCancelledException extends RuntimeException {

    DownloadCancelledException(long queueId) {
        super("Queue item " + queueId + " was cancelled");
    }
}
