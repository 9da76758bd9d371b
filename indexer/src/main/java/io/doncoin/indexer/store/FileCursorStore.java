package io.doncoin.indexer.store;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Optional;
import java.util.UUID;

public class FileCursorStore implements CursorStore {

    private final Path directory;

    public FileCursorStore(Path directory) {
        this.directory = directory;
    }

    @Override
    public synchronized Optional<Long> loadLastProcessedBlock(UUID sessionId) {
        Path cursorFile = cursorFile(sessionId);
        if (!Files.exists(cursorFile)) {
            return Optional.empty();
        }
        try {
            String value = Files.readString(cursorFile, StandardCharsets.UTF_8).trim();
            if (value.isEmpty()) {
                return Optional.empty();
            }
            return Optional.of(Long.parseLong(value));
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read cursor file: " + cursorFile, e);
        } catch (NumberFormatException e) {
            throw new IllegalStateException("Invalid block number in cursor file: " + cursorFile, e);
        }
    }

    @Override
    public synchronized void saveLastProcessedBlock(UUID sessionId, long blockNumber) {
        Path cursorFile = cursorFile(sessionId);
        try {
            Files.createDirectories(directory);
            Files.writeString(
                cursorFile,
                Long.toString(blockNumber),
                StandardCharsets.UTF_8,
                StandardOpenOption.CREATE,
                StandardOpenOption.TRUNCATE_EXISTING
            );
        } catch (IOException e) {
            throw new IllegalStateException("Failed to persist cursor file: " + cursorFile, e);
        }
    }

    Path cursorFile(UUID sessionId) {
        return directory.resolve("cursor-" + sessionId + ".txt");
    }
}
