package com.metbull.sync.reconcile.persistence;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.metbull.sync.reconcile.model.CrawlCheckpoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/** Keeps the last crawl position next to the dataset so an interrupted run can resume. */
@Repository
public class CheckpointStore {
    private static final Logger log = LoggerFactory.getLogger(CheckpointStore.class);

    private final ObjectMapper objectMapper;

    public CheckpointStore(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public void write(CrawlCheckpoint checkpoint, Path path) {
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            objectMapper.writeValue(path.toFile(), checkpoint);
        } catch (IOException e) {
            throw new UncheckedIOException("failed to write checkpoint " + path, e);
        }
    }

    public Optional<CrawlCheckpoint> read(Path path) {
        if (path == null || !Files.isRegularFile(path)) {
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(objectMapper.readValue(path.toFile(), CrawlCheckpoint.class));
        } catch (IOException e) {
            // A torn write from a crashed run is expected here; start from the profile's first page.
            log.warn("Ignoring unreadable checkpoint {}: {}", path, e.getMessage());
            return Optional.empty();
        }
    }
}
