package com.jamra.offline.ipc;

/** The worker process is not running, failed to become ready, or exited mid-request. */
public class WorkerUnavailableException extends WorkerIpcException {

    public WorkerUnavailableException(String message) {
        super(message);
    }

    public WorkerUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
