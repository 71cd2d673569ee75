package com.jamra.offline.util;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * File helpers for the offline store: sidecar JSON, directory sizes and recursive deletes.
 */
@Component
public class OfflineFileStore {

    private final Gson gson = new GsonBuilder().setPrettyPrinting().create();

    public <T> T readJson(Path file, Class<T> type) throws IOException {
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            T value = gson.fromJson(reader, type);
            if (value == null) {
                throw new IOException("Empty JSON document: " + file);
            }
            return value;
        } catch (JsonParseException e) {
            throw new IOException("Malformed JSON in " + file + ": " + e.getMessage(), e);
        }
    }

    /**
     * Writes through a temp file in the same directory so readers never observe a half-written
     * sidecar.
     */
    public void writeJson(Path file, Object value) throws IOException {
        ensureDir(file.getParent());
        Path temp = file.resolveSibling(file.getFileName() + ".tmp");
        try (Writer writer = Files.newBufferedWriter(temp, StandardCharsets.UTF_8)) {
            gson.toJson(value, writer);
        }
        try {
            Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    public void ensureDir(Path dir) throws IOException {
        Files.createDirectories(dir);
    }

    public boolean exists(Path path) {
        return Files.exists(path);
    }

    public long dirSize(Path dir) throws IOException {
        if (!Files.exists(dir)) {
            return 0L;
        }
        try (Stream<Path> files = Files.walk(dir)) {
            return files.filter(Files::isRegularFile)
                    .mapToLong(path -> {
                        try {
                            return Files.size(path);
                        } catch (IOException e) {
                            return 0L;
                        }
                    })
                    .sum();
        }
    }

    public void deleteDir(Path dir) throws IOException {
        if (!Files.exists(dir)) {
            return;
        }
        try (Stream<Path> paths = Files.walk(dir)) {
            for (Path path : paths.sorted(Comparator.reverseOrder()).collect(Collectors.toList())) {
                Files.delete(path);
            }
        }
    }

    /** Immediate child directories, sorted by name. Missing parent yields an empty list. */
    public List<Path> listDirs(Path parent) throws IOException {
        if (!Files.isDirectory(parent)) {
            return List.of();
        }
        try (Stream<Path> children = Files.list(parent)) {
            return children.filter(Files::isDirectory)
                    .sorted()
                    .collect(Collectors.toList());
        }
    }
}
