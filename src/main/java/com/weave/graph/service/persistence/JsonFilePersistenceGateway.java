package com.weave.graph.service.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Stores one JSON file per key under a data directory.
 *
 * File names are a reversible encoding of the key: characters outside
 * {@code [A-Za-z0-9_-]} become {@code ~<hex>~}, so no key can name a path
 * outside the data directory. Writes go to a temp file that is then moved
 * over the target atomically.
 */
@Slf4j
public class JsonFilePersistenceGateway implements PersistenceGateway {

    static final String FILE_SUFFIX = ".json";
    private static final String TEMP_SUFFIX = ".tmp";
    private static final char ESCAPE = '~';

    private final Path dataDir;
    private final ObjectMapper objectMapper;
    private volatile boolean closed = false;

    public JsonFilePersistenceGateway(Path dataDir, ObjectMapper objectMapper) {
        this.dataDir = dataDir.toAbsolutePath().normalize();
        this.objectMapper = objectMapper;
        try {
            Files.createDirectories(this.dataDir);
        } catch (IOException e) {
            throw new PersistenceException("Cannot create data directory " + this.dataDir, e);
        }
        log.info("JSON persistence gateway using {}", this.dataDir);
    }

    public Path getDataDir() {
        return dataDir;
    }

    // ==================== Gateway Operations ====================

    @Override
    public Optional<JsonNode> get(String key) {
        ensureOpen();
        var file = fileFor(key);
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readTree(file.toFile()));
        } catch (JsonProcessingException e) {
            throw new MalformedSnapshotException(key, "invalid JSON", e);
        } catch (IOException e) {
            throw new PersistenceException("Cannot read " + file, e);
        }
    }

    @Override
    public void set(String key, JsonNode value) {
        ensureOpen();
        var target = fileFor(key);
        Path temp = null;
        try {
            temp = Files.createTempFile(dataDir, encodeKey(key), TEMP_SUFFIX);
            objectMapper.writeValue(temp.toFile(), value);
            Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            deleteQuietly(temp);
            throw new PersistenceException("Cannot write " + target, e);
        }
    }

    @Override
    public void delete(String key) {
        ensureOpen();
        try {
            Files.deleteIfExists(fileFor(key));
        } catch (IOException e) {
            throw new PersistenceException("Cannot delete key " + key, e);
        }
    }

    @Override
    public List<String> list(String prefix) {
        ensureOpen();
        try (Stream<Path> files = Files.list(dataDir)) {
            return files
                    .map(path -> path.getFileName().toString())
                    .filter(name -> name.endsWith(FILE_SUFFIX))
                    .map(name -> decodeKey(name.substring(0, name.length() - FILE_SUFFIX.length())))
                    .filter(key -> prefix == null || key.startsWith(prefix))
                    .sorted()
                    .toList();
        } catch (IOException e) {
            throw new PersistenceException("Cannot list " + dataDir, e);
        }
    }

    @Override
    public void clear(String prefix) {
        list(prefix).forEach(this::delete);
    }

    @Override
    public boolean isClosed() {
        return closed;
    }

    @Override
    public String getName() {
        return "json";
    }

    @Override
    public void close() {
        if (!closed) {
            closed = true;
            log.info("JSON persistence gateway closed ({})", dataDir);
        }
    }

    // ==================== Key Encoding ====================

    static String encodeKey(String key) {
        var encoded = new StringBuilder(key.length());
        for (int i = 0; i < key.length(); i++) {
            char c = key.charAt(i);
            if (isSafe(c)) {
                encoded.append(c);
            } else {
                encoded.append(ESCAPE).append(Integer.toHexString(c)).append(ESCAPE);
            }
        }
        return encoded.toString();
    }

    static String decodeKey(String encoded) {
        var key = new StringBuilder(encoded.length());
        int i = 0;
        while (i < encoded.length()) {
            char c = encoded.charAt(i);
            if (c == ESCAPE) {
                int end = encoded.indexOf(ESCAPE, i + 1);
                if (end < 0) {
                    throw new IllegalArgumentException("Unterminated escape in file name: " + encoded);
                }
                key.append((char) Integer.parseInt(encoded.substring(i + 1, end), 16));
                i = end + 1;
            } else {
                key.append(c);
                i++;
            }
        }
        return key.toString();
    }

    private static boolean isSafe(char c) {
        return (c >= 'a' && c <= 'z')
                || (c >= 'A' && c <= 'Z')
                || (c >= '0' && c <= '9')
                || c == '_' || c == '-';
    }

    private Path fileFor(String key) {
        var file = dataDir.resolve(encodeKey(key) + FILE_SUFFIX).normalize();
        if (!file.getParent().equals(dataDir)) {
            throw new IllegalArgumentException("Key resolves outside the data directory: " + key);
        }
        return file;
    }

    private void deleteQuietly(Path temp) {
        if (temp == null) {
            return;
        }
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            log.warn("Could not remove temp file {}: {}", temp, e.getMessage());
        }
    }

    private void ensureOpen() {
        if (closed) {
            throw new GatewayClosedException(getName());
        }
    }
}
