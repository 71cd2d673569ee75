package com.jamra.offline.ipc;

import com.google.gson.JsonElement;
import com.google.gson.JsonParseException;
import com.jamra.offline.metrics.PerformanceMetricsTracker;
import com.jamra.offline.service.LoggerService;
import com.jamra.offline.service.cleanup.StorageCleanupService;
import com.jamra.offline.service.download.DownloadWorker;
import com.jamra.offline.service.event.EventCoalescer;
import com.jamra.offline.service.event.OfflineEvent;
import com.jamra.offline.service.storage.OfflineStorageManager;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;

import static com.jamra.offline.service.LoggerService.sanitizeForLog;

/**
 * Worker side of the controller connection. Reads one request per stdin line, answers on the
 * {@link WorkerChannel}, and forwards coalesced events as they are flushed. The process ends when
 * stdin closes.
 */
@Component
@ConditionalOnProperty(name = "offline.worker.ipc-enabled", havingValue = "true")
public class WorkerProcessRunner implements CommandLineRunner {

    private static final String TAG = "WORKER";

    private final WorkerCommandDispatcher dispatcher;
    private final WorkerChannel channel;
    private final EventCoalescer coalescer;
    private final OfflineStorageManager storageManager;
    private final StorageCleanupService cleanupService;
    private final DownloadWorker downloadWorker;
    private final PerformanceMetricsTracker metrics;
    private final LoggerService logger;

    private final List<Runnable> subscriptions = new ArrayList<>();
    private Supplier<Long> currentTimeSupplier = System::currentTimeMillis;

    public WorkerProcessRunner(WorkerCommandDispatcher dispatcher,
                               WorkerChannel channel,
                               EventCoalescer coalescer,
                               OfflineStorageManager storageManager,
                               StorageCleanupService cleanupService,
                               DownloadWorker downloadWorker,
                               PerformanceMetricsTracker metrics,
                               LoggerService logger) {
        this.dispatcher = dispatcher;
        this.channel = channel;
        this.coalescer = coalescer;
        this.storageManager = storageManager;
        this.cleanupService = cleanupService;
        this.downloadWorker = downloadWorker;
        this.metrics = metrics;
        this.logger = logger;
    }

    @Override
    public void run(String... args) {
        logger.info(TAG, "🚀 Worker process starting (pid=" + ProcessHandle.current().pid() + ")");
        connect();

        try (BufferedReader reader = openInput()) {
            String line;
            while ((line = reader.readLine()) != null) {
                if (!line.isBlank()) {
                    handleLine(line);
                }
            }
            logger.info(TAG, "🔌 Controller disconnected, shutting down...");
        } catch (IOException e) {
            logger.error(TAG, "❌ Lost the controller connection: " + e.getMessage(), e);
            channel.send(WorkerMessage.fatal(e));
        } finally {
            disconnect();
        }
    }

    /** Subscribes the coalescer to every event source and announces readiness. */
    void connect() {
        subscriptions.add(storageManager.on(this::forward));
        subscriptions.add(cleanupService.on(this::forward));
        channel.send(WorkerMessage.lifecycle(WorkerMessage.READY, null, currentTimeSupplier.get()));
        logger.info(TAG, "✅ Worker ready, waiting for commands");
    }

    void disconnect() {
        try {
            downloadWorker.stop();
        } catch (RuntimeException e) {
            logger.error(TAG, "❌ Error stopping download worker: " + e.getMessage(), e);
        }
        subscriptions.forEach(Runnable::run);
        subscriptions.clear();
        coalescer.destroy();
    }

    /**
     * Handles one request line. Malformed frames are answered with an {@code error} frame rather
     * than ending the loop.
     */
    void handleLine(String line) {
        WorkerRequest request;
        try {
            request = WorkerProtocol.decodeRequest(line);
        } catch (JsonParseException e) {
            logger.warn(TAG, "⚠️ Received invalid frame: " + sanitizeForLog(line));
            channel.send(WorkerMessage.error(null, e));
            return;
        }

        try {
            WorkerCommandType command = dispatcher.resolve(request);
            JsonElement result = dispatcher.dispatch(request);

            if (request.getRequestId() != null) {
                channel.send(WorkerMessage.result(request.getRequestId(), command, result));
            }
            if (command == WorkerCommandType.START) {
                channel.send(WorkerMessage.lifecycle(WorkerMessage.STARTED, request.getRequestId(), currentTimeSupplier.get()));
            } else if (command == WorkerCommandType.STOP) {
                coalescer.flush();
                channel.send(WorkerMessage.lifecycle(WorkerMessage.STOPPED, request.getRequestId(), currentTimeSupplier.get()));
            }
        } catch (RuntimeException e) {
            logger.error(TAG, "❌ Command " + sanitizeForLog(request.getType()) + " failed: " + e.getMessage(), e);
            channel.send(WorkerMessage.error(request.getRequestId(), e));
        }
    }

    private void forward(OfflineEvent event) {
        metrics.recordEventEmitted();
        coalescer.push(event);
    }

    protected BufferedReader openInput() {
        return new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
    }

    void setCurrentTimeSupplier(Supplier<Long> currentTimeSupplier) {
        this.currentTimeSupplier = currentTimeSupplier;
    }
}
