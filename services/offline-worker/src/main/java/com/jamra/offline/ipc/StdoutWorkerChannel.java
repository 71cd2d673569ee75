package com.jamra.offline.ipc;

import java.io.OutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

/**
 * Writes frames to the process's standard output as UTF-8, whatever the platform charset. Nothing
 * else in the worker may print to stdout.
 */
public class StdoutWorkerChannel implements WorkerChannel {

    private final PrintStream out;

    public StdoutWorkerChannel(OutputStream out) {
        this.out = new PrintStream(out, false, StandardCharsets.UTF_8);
    }

    @Override
    public synchronized void send(WorkerMessage message) {
        out.print(WorkerProtocol.encode(message));
        out.print('\n');
        out.flush();
    }
}
