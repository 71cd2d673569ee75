package com.jamra.offline.ipc;

import java.io.IOException;
import java.util.function.Consumer;
import java.util.function.IntConsumer;

/**
 * Starts a worker and wires its output back to the host. {@code onMessage} receives every decoded
 * frame; {@code onExit} is called once with the exit code when the worker goes away.
 */
@FunctionalInterface
public interface WorkerLauncher {
    WorkerConnection launch(Consumer<WorkerMessage> onMessage, IntConsumer onExit) throws IOException;
}
