package com.aera.client.offline.infrastructure;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.aera.client.offline.application.MutationStore;
import com.aera.client.offline.application.MutationStoreException;
import com.aera.client.offline.application.QueueSnapshot;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * Keeps the queue in a single JSON document. Saves go to a sibling temp file which then
 * replaces the target, so a crash leaves either the old or the new snapshot.
 */
public class JsonFileMutationStore implements MutationStore {

    private static final Logger log = LoggerFactory.getLogger(JsonFileMutationStore.class);

    private final Path file;
    private final ObjectMapper objectMapper;

    public JsonFileMutationStore(Path file) {
        this(file, defaultObjectMapper());
    }

    public JsonFileMutationStore(Path file, ObjectMapper objectMapper) {
        this.file = Objects.requireNonNull(file, "file");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
    }

    @Override
    public synchronized QueueSnapshot load() {
        if (!Files.exists(file)) {
            return QueueSnapshot.empty();
        }
        try {
            QueueSnapshot snapshot = objectMapper.readValue(file.toFile(), QueueSnapshot.class);
            log.debug("Loaded {} pending and {} failed mutations from {}",
                    snapshot.pending().size(), snapshot.failed().size(), file);
            return snapshot;
        } catch (IOException ex) {
            throw new MutationStoreException("Failed to read offline queue from " + file, ex);
        }
    }

    @Override
    public synchronized void save(QueueSnapshot snapshot) {
        Path temp = file.resolveSibling(file.getFileName() + ".tmp");
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            objectMapper.writeValue(temp.toFile(), snapshot);
            moveIntoPlace(temp);
        } catch (IOException ex) {
            throw new MutationStoreException("Failed to write offline queue to " + file, ex);
        }
    }

    private void moveIntoPlace(Path temp) throws IOException {
        try {
            Files.move(temp, file, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException ex) {
            log.debug("Atomic move unsupported for {}, falling back to replace", file);
            Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    static ObjectMapper defaultObjectMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }
}
