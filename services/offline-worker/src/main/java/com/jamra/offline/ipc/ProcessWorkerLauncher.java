package com.jamra.offline.ipc;

import com.google.gson.JsonParseException;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import java.util.function.IntConsumer;

/**
 * Runs the worker as a child JVM on the current classpath. Worker configuration is passed as
 * Spring command-line properties; stderr is inherited so worker logs show up in the controller's
 * console.
 */
@Slf4j
public class ProcessWorkerLauncher implements WorkerLauncher {

    static final String MAIN_CLASS = "com.jamra.offline.OfflineWorkerApplication";

    private final Map<String, String> properties;

    /**
     * @param properties worker settings such as {@code offline.data-dir} or
     *                   {@code offline.worker.concurrency}
     */
    public ProcessWorkerLauncher(Map<String, String> properties) {
        this.properties = Map.copyOf(properties);
    }

    @Override
    public WorkerConnection launch(Consumer<WorkerMessage> onMessage, IntConsumer onExit) throws IOException {
        ProcessBuilder builder = new ProcessBuilder(command())
                .redirectInput(ProcessBuilder.Redirect.PIPE)
                .redirectOutput(ProcessBuilder.Redirect.PIPE)
                .redirectError(ProcessBuilder.Redirect.INHERIT);
        Process process = builder.start();
        log.info("[WorkerHost] 🚀 Launched worker process pid={}", process.pid());

        Thread reader = new Thread(() -> pump(process, onMessage), "worker-stdout-" + process.pid());
        reader.setDaemon(true);
        reader.start();

        process.onExit().thenAccept(exited -> onExit.accept(exited.exitValue()));
        return new ProcessConnection(process);
    }

    List<String> command() {
        Path javaBin = Path.of(System.getProperty("java.home"), "bin", "java");
        List<String> command = new ArrayList<>();
        command.add(javaBin.toString());
        command.add("-cp");
        command.add(System.getProperty("java.class.path"));
        command.add(MAIN_CLASS);
        properties.entrySet().stream()
                .sorted(Map.Entry.comparingByKey())
                .forEach(entry -> command.add("--" + entry.getKey() + "=" + entry.getValue()));
        return command;
    }

    private static void pump(Process process, Consumer<WorkerMessage> onMessage) {
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                if (line.isBlank()) {
                    continue;
                }
                try {
                    onMessage.accept(WorkerProtocol.decodeMessage(line));
                } catch (JsonParseException e) {
                    log.warn("[WorkerHost] ⚠️ Received invalid worker message: {}", line);
                }
            }
        } catch (IOException e) {
            log.debug("[WorkerHost] Worker stdout closed: {}", e.getMessage());
        }
    }

    private static final class ProcessConnection implements WorkerConnection {

        private final Process process;
        private final BufferedWriter writer;

        private ProcessConnection(Process process) {
            this.process = process;
            this.writer = new BufferedWriter(new OutputStreamWriter(process.getOutputStream(), StandardCharsets.UTF_8));
        }

        @Override
        public synchronized void send(WorkerRequest request) throws IOException {
            writer.write(WorkerProtocol.encode(request));
            writer.write('\n');
            writer.flush();
        }

        @Override
        public boolean isAlive() {
            return process.isAlive();
        }

        @Override
        public void terminate(Duration grace) {
            if (!process.isAlive()) {
                return;
            }
            process.destroy();
            try {
                if (!process.waitFor(grace.toMillis(), TimeUnit.MILLISECONDS)) {
                    log.warn("[WorkerHost] ⚠️ Worker did not exit gracefully, killing pid={}", process.pid());
                    process.destroyForcibly().waitFor();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                process.destroyForcibly();
            }
        }
    }
}
