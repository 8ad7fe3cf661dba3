package com.govmatrix.extract.checkpoint;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.govmatrix.extract.util.Ticker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * File-backed checkpoint for one organization. Every write replaces the whole file through a temp
 * file and a rename, so a crash leaves either the previous or the new snapshot on disk.
 */
public class CheckpointStore {
    private static final Logger log = LoggerFactory.getLogger(CheckpointStore.class);
    private static final TypeReference<Map<String, VoteCursorEntry>> VOTE_CURSORS = new TypeReference<>() {};

    private final Path checkpointFile;
    private final Path voteCursorFile;
    private final ObjectMapper objectMapper;
    private final Ticker ticker;

    private CheckpointState current;
    private Map<String, VoteCursorEntry> voteCursors;

    public CheckpointStore(Path directory, String slug, ObjectMapper objectMapper, Ticker ticker) {
        this.checkpointFile = directory.resolve(slug + "_checkpoint.json");
        this.voteCursorFile = directory.resolve(slug + "_vote_checkpoint.json");
        this.objectMapper = objectMapper.copy().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        this.ticker = ticker;
    }

    public synchronized CheckpointState load() {
        current = read(checkpointFile, CheckpointState.class, CheckpointState.empty());
        if (!current.isEmpty()) {
            log.info(
                "Loaded checkpoint {}: {} delegates (complete={}), {} proposals (complete={}), votes cached for {} proposals",
                checkpointFile.getFileName(),
                current.delegates().size(),
                current.delegatesComplete(),
                current.proposals().size(),
                current.proposalsComplete(),
                current.votesCache().size()
            );
        }
        return current;
    }

    public synchronized CheckpointState current() {
        if (current == null) {
            load();
        }
        return current;
    }

    public synchronized CheckpointState save(CheckpointUpdate update) {
        CheckpointState next = update.applyTo(current()).touchedAt(Instant.ofEpochMilli(ticker.nowMillis()));
        write(checkpointFile, next);
        current = next;
        log.debug("Checkpoint saved ({})", update.section());
        return next;
    }

    public synchronized String loadVoteCursor(String proposalId) {
        VoteCursorEntry entry = voteCursors().get(proposalId);
        return entry == null ? null : entry.afterCursor();
    }

    public synchronized void saveVoteCursor(String proposalId, String cursor) {
        Map<String, VoteCursorEntry> next = new LinkedHashMap<>(voteCursors());
        next.put(proposalId, new VoteCursorEntry(cursor, ticker.nowMillis()));
        write(voteCursorFile, next);
        voteCursors = next;
    }

    public synchronized void clearVoteCursor(String proposalId) {
        Map<String, VoteCursorEntry> cursors = voteCursors();
        if (!cursors.containsKey(proposalId)) {
            return;
        }
        Map<String, VoteCursorEntry> next = new LinkedHashMap<>(cursors);
        next.remove(proposalId);
        write(voteCursorFile, next);
        voteCursors = next;
    }

    public synchronized void clear() {
        try {
            Files.deleteIfExists(checkpointFile);
            Files.deleteIfExists(voteCursorFile);
        } catch (IOException e) {
            throw new CheckpointException("could not delete checkpoint files in " + checkpointFile.getParent(), e);
        }
        current = CheckpointState.empty();
        voteCursors = new LinkedHashMap<>();
        log.info("Cleared checkpoint {}", checkpointFile.getFileName());
    }

    public Path checkpointFile() {
        return checkpointFile;
    }

    public Path voteCursorFile() {
        return voteCursorFile;
    }

    private Map<String, VoteCursorEntry> voteCursors() {
        if (voteCursors == null) {
            Map<String, VoteCursorEntry> loaded = read(voteCursorFile, VOTE_CURSORS, Map.of());
            voteCursors = new LinkedHashMap<>(loaded);
        }
        return voteCursors;
    }

    private <T> T read(Path file, Class<T> type, T fallback) {
        if (!Files.exists(file)) {
            return fallback;
        }
        try {
            T value = objectMapper.readValue(file.toFile(), type);
            return value == null ? fallback : value;
        } catch (IOException | RuntimeException e) {
            log.warn("Ignoring unreadable checkpoint {}: {}", file, e.getMessage());
            return fallback;
        }
    }

    private <T> T read(Path file, TypeReference<T> type, T fallback) {
        if (!Files.exists(file)) {
            return fallback;
        }
        try {
            T value = objectMapper.readValue(file.toFile(), type);
            return value == null ? fallback : value;
        } catch (IOException | RuntimeException e) {
            log.warn("Ignoring unreadable checkpoint {}: {}", file, e.getMessage());
            return fallback;
        }
    }

    private void write(Path file, Object value) {
        Path temp = null;
        try {
            Path directory = file.toAbsolutePath().getParent();
            Files.createDirectories(directory);
            temp = Files.createTempFile(directory, file.getFileName().toString(), ".tmp");
            objectMapper.writeValue(temp.toFile(), value);
            try {
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            deleteQuietly(temp);
            throw new CheckpointException("could not write checkpoint " + file, e);
        }
    }

    private void deleteQuietly(Path temp) {
        if (temp == null) {
            return;
        }
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            log.debug("Could not remove temp file {}: {}", temp, e.getMessage());
        }
    }
}
