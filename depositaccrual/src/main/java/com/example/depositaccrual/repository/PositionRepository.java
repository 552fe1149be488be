package com.example.depositaccrual.repository;

import com.example.depositaccrual.entity.Position;
import com.example.depositaccrual.exception.PositionStorageException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Repository;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Position store backed by a JSON array in a local file.
 *
 * The file is read once on first access and rewritten completely after every change.
 * Positions handed out are copies.
 */
@Repository
@Slf4j
public class PositionRepository {

    private static final TypeReference<List<Position>> POSITION_LIST = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;
    private final Path storageFile;

    private List<Position> positions; // loaded lazily, guarded by this

    public PositionRepository(ObjectMapper objectMapper,
                              @Value("${positions.storage.file:data/positions.json}") String storageFile) {
        this.objectMapper = objectMapper.copy().disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.storageFile = Paths.get(storageFile);
    }

    public synchronized List<Position> findAll() {
        return loaded().stream()
                .map(this::copy)
                .toList();
    }

    public synchronized Optional<Position> findById(String id) {
        return loaded().stream()
                .filter(position -> position.getId().equals(id))
                .findFirst()
                .map(this::copy);
    }

    public synchronized long count() {
        return loaded().size();
    }

    /**
     * Insert or replace a position by id; a position without id gets a new UUID
     *
     * @param position The position to store
     * @return Copy of the stored position
     */
    public synchronized Position save(Position position) {
        Position stored = copy(position);
        if (stored.getId() == null || stored.getId().isBlank()) {
            stored.setId(UUID.randomUUID().toString());
        }

        List<Position> updated = new ArrayList<>(loaded());
        int index = indexOf(updated, stored.getId());
        if (index >= 0) {
            updated.set(index, stored);
        } else {
            updated.add(stored);
        }

        write(updated);
        positions = updated;
        return copy(stored);
    }

    /**
     * Delete a position
     *
     * @param id The position id
     * @return true if a position was removed
     */
    public synchronized boolean deleteById(String id) {
        List<Position> updated = new ArrayList<>(loaded());
        int index = indexOf(updated, id);
        if (index < 0) {
            return false;
        }
        updated.remove(index);

        write(updated);
        positions = updated;
        return true;
    }

    private List<Position> loaded() {
        if (positions == null) {
            positions = read();
        }
        return positions;
    }

    private List<Position> read() {
        if (!Files.exists(storageFile)) {
            log.info("Position store {} does not exist yet, starting empty", storageFile.toAbsolutePath());
            return new ArrayList<>();
        }

        try {
            List<Position> stored = objectMapper.readValue(storageFile.toFile(), POSITION_LIST);
            List<Position> result = new ArrayList<>(stored.size());
            boolean idsAssigned = false;
            for (Position position : stored) {
                // Legacy files carry no ids
                if (position.getId() == null || position.getId().isBlank()) {
                    position.setId(UUID.randomUUID().toString());
                    idsAssigned = true;
                }
                result.add(position);
            }
            log.info("Loaded {} positions from {}", result.size(), storageFile.toAbsolutePath());
            if (idsAssigned) {
                write(result);
            }
            return result;
        } catch (IOException e) {
            throw new PositionStorageException("Failed to read position store " + storageFile.toAbsolutePath(), e);
        }
    }

    private void write(List<Position> content) {
        try {
            Path directory = storageFile.toAbsolutePath().getParent();
            if (directory != null) {
                Files.createDirectories(directory);
            }
            Path tempFile = Files.createTempFile(directory, "positions", ".tmp");
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(tempFile.toFile(), content);
            Files.move(tempFile, storageFile, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            log.debug("Wrote {} positions to {}", content.size(), storageFile.toAbsolutePath());
        } catch (IOException e) {
            throw new PositionStorageException("Failed to write position store " + storageFile.toAbsolutePath(), e);
        }
    }

    private int indexOf(List<Position> content, String id) {
        for (int i = 0; i < content.size(); i++) {
            if (content.get(i).getId().equals(id)) {
                return i;
            }
        }
        return -1;
    }

    private Position copy(Position position) {
        return position.toBuilder().build();
    }
}
