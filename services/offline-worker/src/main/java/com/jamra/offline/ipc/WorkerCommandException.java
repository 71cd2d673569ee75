package com.jamra.offline.ipc;

/**
 * The worker ran the command and replied with an {@code error} frame.
 */
public class WorkerCommandException extends WorkerIpcException {

    private final WorkerCommandType command;
    private final String remoteStack;

    public WorkerCommandException(WorkerCommandType command, String message, String remoteStack) {
        super(message);
        this.command = command;
        this.remoteStack = remoteStack;
    }

    public WorkerCommandType getCommand() {
        return command;
    }

    /** Stack trace as printed inside the worker, if it sent one. */
    public String getRemoteStack() {
        return remoteStack;
    }
}
