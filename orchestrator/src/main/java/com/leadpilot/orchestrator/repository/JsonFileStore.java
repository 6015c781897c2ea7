package com.leadpilot.orchestrator.repository;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URLDecoder;
import java.net.URLEncoder;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * {@link KeyValueStore} backed by one JSON file per key in a directory.
 *
 * Writes go to a temp file in the same directory, are forced to disk, then
 * renamed over the target with ATOMIC_MOVE. A crash at any point leaves either
 * the old file or the new one, plus possibly an orphaned *.tmp that readers ignore.
 *
 * Keys are URL-encoded into file names so entity names with spaces or slashes
 * stay inside the directory.
 */
public class JsonFileStore<V> implements KeyValueStore<V> {

    private static final Logger log = LoggerFactory.getLogger(JsonFileStore.class);

    private static final String SUFFIX     = ".json";
    private static final String TMP_SUFFIX = ".tmp";

    private final Path         dir;
    private final Class<V>     type;
    private final ObjectMapper json;

    public JsonFileStore(Path dir, Class<V> type, ObjectMapper objectMapper) {
        this.dir  = dir;
        this.type = type;
        this.json = objectMapper.copy().enable(SerializationFeature.INDENT_OUTPUT);
    }

    // ------------------------------------------------------------------
    // KeyValueStore
    // ------------------------------------------------------------------

    @Override
    public Optional<V> load(String key) {
        Path file = fileFor(key);
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        try {
            return Optional.of(json.readValue(file.toFile(), type));
        } catch (IOException e) {
            throw new StoreException("Could not read " + type.getSimpleName() + " '" + key + "' from " + file, e);
        }
    }

    @Override
    public void save(String key, V value) {
        Path target = fileFor(key);
        Path tmp = null;
        try {
            Files.createDirectories(dir);
            tmp = Files.createTempFile(dir, target.getFileName().toString(), TMP_SUFFIX);
            byte[] bytes = json.writeValueAsBytes(value);
            try (FileChannel ch = FileChannel.open(tmp, StandardOpenOption.WRITE,
                                                   StandardOpenOption.TRUNCATE_EXISTING)) {
                ch.write(ByteBuffer.wrap(bytes));
                ch.force(true);
            }
            moveIntoPlace(tmp, target);
            tmp = null;
        } catch (IOException e) {
            throw new StoreException("Could not write " + type.getSimpleName() + " '" + key + "' to " + target, e);
        } finally {
            if (tmp != null) {
                deleteQuietly(tmp);
            }
        }
    }

    @Override
    public boolean delete(String key) {
        try {
            return Files.deleteIfExists(fileFor(key));
        } catch (IOException e) {
            throw new StoreException("Could not delete " + type.getSimpleName() + " '" + key + "'", e);
        }
    }

    @Override
    public List<String> keys() {
        List<String> keys = new ArrayList<>();
        if (!Files.isDirectory(dir)) {
            return keys;
        }
        try (DirectoryStream<Path> files = Files.newDirectoryStream(dir, "*" + SUFFIX)) {
            for (Path f : files) {
                String name = f.getFileName().toString();
                keys.add(URLDecoder.decode(name.substring(0, name.length() - SUFFIX.length()),
                        StandardCharsets.UTF_8));
            }
        } catch (IOException e) {
            throw new StoreException("Could not list " + dir, e);
        }
        return keys;
    }

    @Override
    public List<V> loadAll() {
        List<V> values = new ArrayList<>();
        for (String key : keys()) {
            try {
                load(key).ifPresent(values::add);
            } catch (StoreException e) {
                log.warn("Skipping unreadable {} '{}': {}", type.getSimpleName(), key, e.getMessage());
            }
        }
        return values;
    }

    public Path directory() {
        return dir;
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private Path fileFor(String key) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("Store key must not be blank");
        }
        return dir.resolve(URLEncoder.encode(key, StandardCharsets.UTF_8) + SUFFIX);
    }

    private static void moveIntoPlace(Path tmp, Path target) throws IOException {
        try {
            Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            // Same directory, so this only happens on exotic file systems.
            log.warn("Atomic move not supported for {}, falling back to replace", target);
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void deleteQuietly(Path tmp) {
        try {
            Files.deleteIfExists(tmp);
        } catch (IOException e) {
            log.warn("Could not remove temp file {}: {}", tmp, e.getMessage());
        }
    }
}
