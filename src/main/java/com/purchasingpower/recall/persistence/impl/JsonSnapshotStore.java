package com.purchasingpower.recall.persistence.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.purchasingpower.recall.configuration.AppProperties;
import com.purchasingpower.recall.core.GraphSnapshot;
import com.purchasingpower.recall.exception.PersistenceFailureException;
import com.purchasingpower.recall.persistence.PendingReflectionMarker;
import com.purchasingpower.recall.persistence.SnapshotStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Optional;

/**
 * Snapshot and marker as JSON files on the local disk.
 *
 * @since 1.0.0
 */
@Slf4j
@Component
public class JsonSnapshotStore implements SnapshotStore {

    private final ObjectMapper objectMapper;
    private final Path snapshotPath;
    private final Path markerPath;

    @Autowired
    public JsonSnapshotStore(ObjectMapper objectMapper, AppProperties properties) {
        this(objectMapper,
            Paths.get(properties.getGraph().getSnapshotPath()),
            Paths.get(properties.getGraph().getPendingMarkerPath()));
    }

    public JsonSnapshotStore(ObjectMapper objectMapper, Path snapshotPath, Path markerPath) {
        this.objectMapper = objectMapper.copy()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .enable(SerializationFeature.INDENT_OUTPUT);
        this.snapshotPath = snapshotPath;
        this.markerPath = markerPath;
    }

    @Override
    public void save(GraphSnapshot snapshot) {
        try {
            AtomicFileWriter.write(snapshotPath, objectMapper.writeValueAsBytes(snapshot));
            log.info("💾 Snapshot saved: {} nodes, {} edges -> {}",
                snapshot.getNodes().size(), snapshot.getEdges().size(), snapshotPath);
        } catch (IOException e) {
            log.error("❌ Failed to save snapshot to {}: {}", snapshotPath, e.getMessage());
            throw new PersistenceFailureException("Failed to save snapshot", snapshotPath, e);
        }
    }

    @Override
    public Optional<GraphSnapshot> load() {
        if (!Files.exists(snapshotPath)) {
            log.info("No snapshot at {}, starting with an empty graph", snapshotPath);
            return Optional.empty();
        }
        try {
            GraphSnapshot snapshot = objectMapper.readValue(snapshotPath.toFile(), GraphSnapshot.class);
            log.info("📂 Snapshot loaded: {} nodes, {} edges", snapshot.getNodes().size(), snapshot.getEdges().size());
            return Optional.of(snapshot);
        } catch (IOException e) {
            log.error("❌ Failed to read snapshot {}: {}", snapshotPath, e.getMessage());
            throw new PersistenceFailureException("Failed to read snapshot", snapshotPath, e);
        }
    }

    @Override
    public void writeMarker(PendingReflectionMarker marker) {
        try {
            AtomicFileWriter.write(markerPath, objectMapper.writeValueAsBytes(marker));
        } catch (IOException e) {
            throw new PersistenceFailureException("Failed to write pending marker", markerPath, e);
        }
    }

    @Override
    public Optional<PendingReflectionMarker> readMarker() {
        if (!Files.exists(markerPath)) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(markerPath.toFile(), PendingReflectionMarker.class));
        } catch (IOException e) {
            throw new PersistenceFailureException("Failed to read pending marker", markerPath, e);
        }
    }

    @Override
    public void clearMarker() {
        try {
            Files.deleteIfExists(markerPath);
        } catch (IOException e) {
            throw new PersistenceFailureException("Failed to delete pending marker", markerPath, e);
        }
    }
}
