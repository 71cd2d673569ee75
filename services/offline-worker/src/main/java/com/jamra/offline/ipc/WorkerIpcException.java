package com.jamra.offline.ipc;

/** Base for failures talking to the worker process. */
public class WorkerIpcException extends RuntimeException {

    public WorkerIpcException(String message) {
        super(message);
    }

    public WorkerIpcException(String message, Throwable cause) {
        super(message, cause);
    }
}
