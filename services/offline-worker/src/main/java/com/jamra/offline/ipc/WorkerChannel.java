package com.jamra.offline.ipc;

/** Outbound side of the worker's connection to its controller. */
@FunctionalInterface
public interface WorkerChannel {
    void send(WorkerMessage message);
}
