package com.skyfinal.history;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.skyfinal.state.Snapshot;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Rolling window of accepted snapshots, mirrored to a JSON file.
 *
 * Every accepted append rewrites the whole file with the projection of the
 * current window, so the file never holds more entries than the window.
 * Persistence is best-effort: write failures are logged and the in-memory
 * window stays authoritative for in-process readers.
 *
 * The file is written to a sibling temp file and renamed into place, so a
 * reader never sees a half-written array. Only the poller thread appends.
 */
public class HistoryStore {

    private static final Logger logger = LoggerFactory.getLogger(HistoryStore.class);
    private static final TypeReference<List<HistoryEntry>> ENTRY_LIST = new TypeReference<>() {
    };

    private final SnapshotWindow window;
    private final Path historyFile;
    private final ObjectMapper objectMapper;

    public HistoryStore(int windowSize, Path historyFile) {
        this.window = new SnapshotWindow(windowSize);
        this.historyFile = historyFile;
        this.objectMapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    }

    /**
     * Adds a snapshot to the window and rewrites the history file.
     * Empty snapshots are rejected and leave both untouched.
     *
     * @return true if the snapshot was accepted
     */
    public boolean append(Snapshot snapshot) {
        if (snapshot == null || snapshot.isEmpty()) {
            logger.debug("Ignoring empty snapshot");
            return false;
        }
        window.add(snapshot);
        persist();
        return true;
    }

    private void persist() {
        List<HistoryEntry> entries = new ArrayList<>();
        for (Snapshot snapshot : window.toList()) {
            entries.add(HistoryEntry.of(snapshot));
        }

        try {
            Path parent = historyFile.toAbsolutePath().getParent();
            Files.createDirectories(parent);
            Path temp = Files.createTempFile(parent, historyFile.getFileName().toString(), ".tmp");
            try {
                objectMapper.writeValue(temp.toFile(), entries);
                moveIntoPlace(temp);
            } finally {
                Files.deleteIfExists(temp);
            }
        } catch (IOException | RuntimeException e) {
            logger.error("Failed to write history to {}", historyFile, e);
        }
    }

    private void moveIntoPlace(Path temp) throws IOException {
        try {
            Files.move(temp, historyFile, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(temp, historyFile, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    /**
     * Reads back the persisted projection. Survives process restarts, unlike
     * {@link #getSnapshots(int)}. Returns an empty list when the file is
     * missing or unreadable.
     */
    public List<HistoryEntry> readPersisted() {
        if (!Files.exists(historyFile)) {
            return Collections.emptyList();
        }
        try {
            return objectMapper.readValue(historyFile.toFile(), ENTRY_LIST);
        } catch (IOException e) {
            logger.error("Failed to read history from {}", historyFile, e);
            return Collections.emptyList();
        }
    }

    /**
     * Returns up to {@code limit} of the most recent in-memory snapshots, oldest first.
     */
    public List<Snapshot> getSnapshots(int limit) {
        return window.latest(limit);
    }

    public Snapshot getLatest() {
        return window.newest();
    }

    public int size() {
        return window.size();
    }

    public Path getHistoryFile() {
        return historyFile;
    }
}
