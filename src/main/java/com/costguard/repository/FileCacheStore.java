package com.costguard.repository;

import com.costguard.exception.CacheDisabledException;
import com.costguard.exception.CacheException;
import com.costguard.exception.CacheExpiredException;
import com.costguard.exception.CacheNotFoundException;
import com.costguard.exception.InvalidCacheKeyException;
import com.costguard.model.CacheEntry;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * File-based cache store with TTL expiration.
 * One JSON file per entry: {directory}/{sanitized-key}.json
 *
 * Writes go to a temp file in the same directory and are renamed into place, so
 * concurrent readers (including other processes sharing the directory) never see
 * a partially written entry. Last writer wins.
 *
 * A disabled store fails every operation with {@link CacheDisabledException} and never
 * touches the file system.
 */
@Slf4j
public class FileCacheStore {

    private static final String FILE_EXTENSION = ".json";
    private static final String TEMP_SUFFIX = ".tmp";

    private final Path directory;
    private final boolean enabled;
    private final int ttlSeconds;
    private final int maxSizeMb;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    /**
     * Create a store. When enabled, the directory is created if absent.
     *
     * @param directory  cache directory
     * @param enabled    whether caching is active
     * @param ttlSeconds TTL applied to new entries (non-negative)
     * @param maxSizeMb  size budget in MB, 0 = unlimited; advisory only
     * @throws CacheException if the directory cannot be created
     */
    public FileCacheStore(
            Path directory,
            boolean enabled,
            int ttlSeconds,
            int maxSizeMb,
            ObjectMapper objectMapper,
            Clock clock) throws CacheException {
        this.directory = directory;
        this.enabled = enabled;
        this.ttlSeconds = ttlSeconds;
        this.maxSizeMb = maxSizeMb;
        this.objectMapper = objectMapper;
        this.clock = clock;

        if (!enabled) {
            return;
        }

        if (directory == null || directory.toString().isEmpty()) {
            throw new IllegalArgumentException("cache directory cannot be empty");
        }
        if (ttlSeconds < 0) {
            throw new IllegalArgumentException("cache TTL cannot be negative: " + ttlSeconds);
        }

        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            throw new CacheException("failed to create cache directory: " + directory, e);
        }
    }

    /**
     * A store that rejects every operation.
     */
    public static FileCacheStore disabled() {
        try {
            return new FileCacheStore(null, false, 0, 0, null, Clock.systemUTC());
        } catch (CacheException e) {
            // Unreachable: a disabled store performs no I/O
            throw new IllegalStateException(e);
        }
    }

    /**
     * Get cache entry by key.
     *
     * @param key cache key
     * @return the entry, if present and not expired
     * @throws CacheNotFoundException   if no entry exists
     * @throws CacheExpiredException    if the entry expired (its file is removed)
     * @throws CacheDisabledException   if the store is disabled
     * @throws InvalidCacheKeyException if the key is empty
     * @throws CacheException           if the file is unreadable or not a cache entry (a corrupt file is removed)
     */
    public CacheEntry get(String key) throws CacheException {
        checkUsable(key);

        Path file = keyToPath(key);
        CacheEntry entry;
        try {
            entry = objectMapper.readValue(Files.readAllBytes(file), CacheEntry.class);
        } catch (NoSuchFileException e) {
            log.debug("File cache miss: {}", key);
            throw new CacheNotFoundException(key);
        } catch (IOException e) {
            throw new CacheException("failed to read cache file: " + file, e);
        }

        if (entry == null || entry.getCreatedAt() == null) {
            deleteQuietly(file);
            throw new CacheException("corrupt cache entry: " + file.getFileName());
        }

        if (entry.isExpiredAt(clock.instant())) {
            deleteQuietly(file);
            log.debug("File cache entry expired: {}", key);
            throw new CacheExpiredException(key);
        }

        log.debug("File cache hit: {}", key);
        return entry;
    }

    /**
     * Store data under key with the store's TTL. Overwrites any existing entry.
     *
     * @param key  cache key
     * @param data opaque payload
     */
    public void set(String key, byte[] data) throws CacheException {
        checkUsable(key);

        CacheEntry entry = CacheEntry.create(key, data, ttlSeconds, clock.instant());
        Path file = keyToPath(key);
        Path temp = null;

        try {
            byte[] json = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(entry);

            // Write to temporary file first, then rename for atomicity
            temp = Files.createTempFile(directory, file.getFileName().toString() + ".", TEMP_SUFFIX);
            Files.write(temp, json);
            moveIntoPlace(temp, file);
            temp = null;

            log.debug("Stored in file cache: key={}, ttl={}s, size={}B", key, ttlSeconds, json.length);
        } catch (IOException e) {
            throw new CacheException("failed to write cache file: " + file, e);
        } finally {
            if (temp != null) {
                deleteQuietly(temp);
            }
        }
    }

    /**
     * Delete entry. Deleting an absent key succeeds.
     */
    public void delete(String key) throws CacheException {
        checkUsable(key);

        Path file = keyToPath(key);
        try {
            Files.deleteIfExists(file);
            log.debug("Deleted from file cache: {}", key);
        } catch (IOException e) {
            throw new CacheException("failed to delete cache file: " + file, e);
        }
    }

    /**
     * Remove all entries.
     */
    public void clear() throws CacheException {
        checkEnabled();

        List<Path> files = listEntryFiles();
        for (Path file : files) {
            try {
                Files.deleteIfExists(file);
            } catch (IOException e) {
                throw new CacheException("failed to remove cache file: " + file.getFileName(), e);
            }
        }

        log.info("Cleared {} entries from file cache", files.size());
    }

    /**
     * Remove every expired entry; valid entries are left untouched.
     * Unreadable or corrupt files are skipped.
     *
     * @return number of entries removed
     */
    public int cleanupExpired() throws CacheException {
        checkEnabled();

        Instant now = clock.instant();
        int removed = 0;

        for (Path file : listEntryFiles()) {
            CacheEntry entry;
            try {
                entry = objectMapper.readValue(Files.readAllBytes(file), CacheEntry.class);
            } catch (IOException e) {
                log.debug("Skipping unreadable cache file {}: {}", file.getFileName(), e.getMessage());
                continue;
            }

            if (entry == null || entry.getCreatedAt() == null) {
                log.debug("Skipping corrupt cache file {}", file.getFileName());
                continue;
            }

            if (entry.isExpiredAt(now) && deleteQuietly(file)) {
                removed++;
            }
        }

        if (removed > 0) {
            log.info("Removed {} expired entries from file cache", removed);
        }
        return removed;
    }

    /**
     * Total size of all entry files in bytes.
     */
    public long size() throws CacheException {
        checkEnabled();

        long total = 0;
        for (Path file : listEntryFiles()) {
            try {
                total += Files.size(file);
            } catch (NoSuchFileException e) {
                // Removed concurrently; not part of the current contents
                log.trace("Cache file vanished while sizing: {}", file.getFileName());
            } catch (IOException e) {
                throw new CacheException("failed to stat cache file: " + file.getFileName(), e);
            }
        }
        return total;
    }

    /**
     * Number of entry files, including expired ones not yet removed.
     */
    public int count() throws CacheException {
        checkEnabled();
        return listEntryFiles().size();
    }

    public boolean isEnabled() {
        return enabled;
    }

    public Path getDirectory() {
        return directory;
    }

    public int getTtlSeconds() {
        return ttlSeconds;
    }

    public int getMaxSizeMb() {
        return maxSizeMb;
    }

    /**
     * File name for a key: path-unsafe characters replaced by '_'.
     * The original key is kept inside the entry.
     */
    static String sanitizeKey(String key) {
        return key.replace('/', '_')
                .replace('\\', '_')
                .replace(':', '_');
    }

    private Path keyToPath(String key) {
        return directory.resolve(sanitizeKey(key) + FILE_EXTENSION);
    }

    private void moveIntoPlace(Path temp, Path target) throws IOException {
        try {
            Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            log.debug("Atomic move not supported in {}, falling back to replace", directory);
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private List<Path> listEntryFiles() throws CacheException {
        List<Path> files = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory, "*" + FILE_EXTENSION)) {
            for (Path file : stream) {
                if (Files.isRegularFile(file)) {
                    files.add(file);
                }
            }
        } catch (IOException e) {
            throw new CacheException("failed to read cache directory: " + directory, e);
        }
        return files;
    }

    /**
     * Best-effort delete. Failures are logged, never thrown.
     */
    private boolean deleteQuietly(Path file) {
        try {
            return Files.deleteIfExists(file);
        } catch (IOException e) {
            log.warn("Failed to delete cache file {}: {}", file.getFileName(), e.getMessage());
            return false;
        }
    }

    private void checkEnabled() throws CacheDisabledException {
        if (!enabled) {
            throw new CacheDisabledException();
        }
    }

    private void checkUsable(String key) throws CacheException {
        checkEnabled();
        if (key == null || key.isEmpty()) {
            throw new InvalidCacheKeyException();
        }
    }
}
