package com.jamra.offline.ipc;

import java.io.IOException;
import java.time.Duration;

/** Controller's handle on one running worker. */
public interface WorkerConnection {

    void send(WorkerRequest request) throws IOException;

    boolean isAlive();

    /**
     * Asks the worker to exit and forces it after {@code grace}. Returns once it is gone.
     */
    void terminate(Duration grace);
}
