package com.jamra.offline;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * 📥 Offline Worker Entry Point
 *
 * Runs the offline download worker as a child process. Commands arrive as JSON lines
 * on stdin and replies, lifecycle messages and batched events leave on stdout.
 */
@SpringBootApplication
public class OfflineWorkerApplication {
    public static void main(String[] args) {
        SpringApplication.run(OfflineWorkerApplication.class, args);
    }
}
