package com.jamra.offline.ipc;

public class WorkerTimeoutException extends WorkerIpcException {

    public WorkerTimeoutException(String message) {
        super(message);
    }
}
