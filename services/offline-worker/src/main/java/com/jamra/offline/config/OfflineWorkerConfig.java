package com.jamra.offline.config;

import com.google.gson.JsonElement;
import com.jamra.offline.ipc.StdoutWorkerChannel;
import com.jamra.offline.ipc.WorkerChannel;
import com.jamra.offline.ipc.WorkerMessage;
import com.jamra.offline.ipc.WorkerProtocol;
import com.jamra.offline.service.LoggerService;
import com.jamra.offline.service.event.EventCoalescer;
import com.jamra.offline.util.OfflinePaths;
import lombok.extern.slf4j.Slf4j;
import org.jdbi.v3.core.Jdbi;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.FileDescriptor;
import java.io.FileOutputStream;
import java.nio.file.Path;

/**
 * Wires the pieces that need constructor arguments from configuration: the H2 database, the
 * offline directory layout, the stdout channel and the event coalescer feeding it.
 */
@Slf4j
@Configuration
public class OfflineWorkerConfig {

    @Bean
    public Jdbi jdbi(@Value("${offline.db-url:}") String dbUrl,
                     @Value("${offline.db-path:.jamra-data/offline-db}") String dbPath) {
        String url = dbUrl;
        if (url == null || url.isBlank()) {
            // H2 only accepts absolute file paths or ones starting with ./
            Path absolute = Path.of(dbPath).toAbsolutePath().normalize();
            url = "jdbc:h2:file:" + absolute
                    + ";DATABASE_TO_UPPER=FALSE"
                    + ";AUTO_SERVER=TRUE";
        }
        log.info("🗄️ Offline database: {}", url);
        return Jdbi.create(url);
    }

    @Bean
    public OfflinePaths offlinePaths(@Value("${offline.data-dir:.jamra-data}") String dataDir) {
        return new OfflinePaths(Path.of(dataDir));
    }

    @Bean
    public WorkerChannel workerChannel() {
        // System.out encodes with the platform charset, the host reads UTF-8
        return new StdoutWorkerChannel(new FileOutputStream(FileDescriptor.out));
    }

    @Bean(destroyMethod = "destroy")
    public EventCoalescer eventCoalescer(WorkerChannel workerChannel,
                                         LoggerService logger,
                                         @Value("${offline.events.flush-interval-ms:500}") long flushIntervalMs,
                                         @Value("${offline.events.max-batch-size:50}") int maxBatchSize) {
        return new EventCoalescer(envelope -> {
            JsonElement tree = WorkerProtocol.toTree(envelope);
            workerChannel.send(WorkerMessage.event(tree));
        }, logger, flushIntervalMs, maxBatchSize);
    }
}
