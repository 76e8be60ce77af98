package com.costguard.repository;

import com.costguard.config.JacksonConfiguration;
import com.costguard.exception.CacheDisabledException;
import com.costguard.exception.CacheException;
import com.costguard.exception.CacheExpiredException;
import com.costguard.exception.CacheNotFoundException;
import com.costguard.exception.InvalidCacheKeyException;
import com.costguard.model.CacheEntry;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.List;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for FileCacheStore.
 */
class FileCacheStoreTest {

    @TempDir
    Path tempDir;

    private MutableClock clock;
    private ObjectMapper objectMapper;
    private FileCacheStore store;

    @BeforeEach
    void setUp() throws Exception {
        clock = new MutableClock(Instant.parse("2024-03-15T10:00:00Z"));
        objectMapper = JacksonConfiguration.createObjectMapper();
        store = new FileCacheStore(tempDir.resolve("cache"), true, 3600, 100, objectMapper, clock);
    }

    @Test
    void testCreatesDirectory() {
        assertTrue(Files.isDirectory(tempDir.resolve("cache")));
    }

    @Test
    void testSetAndGet() throws Exception {
        store.set("abc123", "payload".getBytes(StandardCharsets.UTF_8));

        CacheEntry entry = store.get("abc123");
        assertEquals("abc123", entry.getKey());
        assertEquals("payload", new String(entry.getData(), StandardCharsets.UTF_8));
        assertEquals(3600, entry.getTtlSeconds());
        assertEquals(clock.instant(), entry.getCreatedAt());
        assertEquals(clock.instant().plusSeconds(3600), entry.getExpiresAt());
    }

    @Test
    void testSetOverwrites() throws Exception {
        store.set("k", "one".getBytes(StandardCharsets.UTF_8));
        store.set("k", "two".getBytes(StandardCharsets.UTF_8));

        assertEquals("two", new String(store.get("k").getData(), StandardCharsets.UTF_8));
        assertEquals(1, store.count());
    }

    @Test
    void testGetMissingKey() {
        assertThrows(CacheNotFoundException.class, () -> store.get("missing"));
    }

    @Test
    void testExpiredEntryIsRemovedOnRead() throws Exception {
        FileCacheStore shortLived = new FileCacheStore(tempDir.resolve("short"), true, 1, 0, objectMapper, clock);
        shortLived.set("k", new byte[]{1, 2, 3});

        clock.advance(Duration.ofMillis(999));
        assertNotNull(shortLived.get("k"));

        clock.advance(Duration.ofMillis(1));
        assertThrows(CacheExpiredException.class, () -> shortLived.get("k"));
        assertThrows(CacheNotFoundException.class, () -> shortLived.get("k"));
        assertEquals(0, shortLived.count());
    }

    @Test
    void testEmptyKeyRejected() {
        assertThrows(InvalidCacheKeyException.class, () -> store.get(""));
        assertThrows(InvalidCacheKeyException.class, () -> store.set("", new byte[0]));
        assertThrows(InvalidCacheKeyException.class, () -> store.delete(""));
    }

    @Test
    void testDisabledStoreRejectsEverythingWithoutTouchingDisk() throws Exception {
        Path dir = tempDir.resolve("never");
        FileCacheStore disabled = new FileCacheStore(dir, false, 3600, 100, objectMapper, clock);

        assertFalse(disabled.isEnabled());
        assertThrows(CacheDisabledException.class, () -> disabled.get("k"));
        assertThrows(CacheDisabledException.class, () -> disabled.get(""));
        assertThrows(CacheDisabledException.class, () -> disabled.set("k", new byte[0]));
        assertThrows(CacheDisabledException.class, () -> disabled.delete("k"));
        assertThrows(CacheDisabledException.class, disabled::clear);
        assertThrows(CacheDisabledException.class, disabled::cleanupExpired);
        assertThrows(CacheDisabledException.class, disabled::size);
        assertThrows(CacheDisabledException.class, disabled::count);
        assertFalse(Files.exists(dir));

        assertThrows(CacheDisabledException.class, () -> FileCacheStore.disabled().get("k"));
    }

    @Test
    void testInvalidConstructionArguments() {
        assertThrows(IllegalArgumentException.class,
                () -> new FileCacheStore(null, true, 3600, 0, objectMapper, clock));
        assertThrows(IllegalArgumentException.class,
                () -> new FileCacheStore(tempDir.resolve("neg"), true, -1, 0, objectMapper, clock));
    }

    @Test
    void testDeleteIsIdempotent() throws Exception {
        store.set("k", new byte[]{1});
        store.delete("k");
        store.delete("k");
        assertThrows(CacheNotFoundException.class, () -> store.get("k"));
    }

    @Test
    void testClear() throws Exception {
        store.set("a", new byte[]{1});
        store.set("b", new byte[]{2});
        store.set("c", new byte[]{3});
        Files.writeString(tempDir.resolve("cache").resolve("notes.txt"), "keep me");

        store.clear();

        assertEquals(0, store.count());
        assertEquals(0, store.size());
        assertTrue(Files.exists(tempDir.resolve("cache").resolve("notes.txt")));
    }

    @Test
    void testCleanupExpiredRemovesOnlyExpired() throws Exception {
        store.set("old", new byte[]{1});
        clock.advance(Duration.ofMinutes(30));
        store.set("fresh", new byte[]{2});
        Files.writeString(tempDir.resolve("cache").resolve("corrupt.json"), "{not json");

        clock.advance(Duration.ofMinutes(31));
        int removed = store.cleanupExpired();

        assertEquals(1, removed);
        assertNotNull(store.get("fresh"));
        assertThrows(CacheNotFoundException.class, () -> store.get("old"));
        assertTrue(Files.exists(tempDir.resolve("cache").resolve("corrupt.json")));
    }

    @Test
    void testSizeAndCount() throws Exception {
        assertEquals(0, store.count());
        assertEquals(0, store.size());

        store.set("a", new byte[100]);
        store.set("b", new byte[200]);

        assertEquals(2, store.count());
        long expected;
        try (Stream<Path> files = Files.list(tempDir.resolve("cache"))) {
            expected = files.mapToLong(p -> p.toFile().length()).sum();
        }
        assertEquals(expected, store.size());
        assertTrue(store.size() > 300);
    }

    @Test
    void testKeysWithPathCharactersAreSanitized() throws Exception {
        String key = "aws:ec2/instance\\us-east-1";
        store.set(key, new byte[]{7});

        assertTrue(Files.exists(tempDir.resolve("cache").resolve("aws_ec2_instance_us-east-1.json")));
        assertEquals(key, store.get(key).getKey());
    }

    @Test
    void testNoTempFilesLeftBehind() throws Exception {
        for (int i = 0; i < 10; i++) {
            store.set("key-" + i, new byte[]{(byte) i});
        }

        try (Stream<Path> files = Files.list(tempDir.resolve("cache"))) {
            assertTrue(files.noneMatch(p -> p.getFileName().toString().endsWith(".tmp")));
        }
        assertEquals(10, store.count());
    }

    @Test
    void testEntryWithoutMetadataIsCorrupt() throws Exception {
        Path file = tempDir.resolve("cache").resolve("k.json");
        Files.writeString(file, "{}");

        CacheException e = assertThrows(CacheException.class, () -> store.get("k"));
        assertTrue(e.getMessage().contains("corrupt cache entry"));
        assertFalse(Files.exists(file));
    }

    @Test
    void testJsonNullEntryIsCorrupt() throws Exception {
        Files.writeString(tempDir.resolve("cache").resolve("n.json"), "null");

        assertThrows(CacheException.class, () -> store.get("n"));
    }

    @Test
    void testCleanupSkipsJsonNullAndEmptyObjects() throws Exception {
        store.set("old", new byte[]{1});
        Files.writeString(tempDir.resolve("cache").resolve("n.json"), "null");
        Files.writeString(tempDir.resolve("cache").resolve("e.json"), "{}");

        clock.advance(Duration.ofHours(2));

        assertEquals(1, store.cleanupExpired());
        assertEquals(2, store.count());
    }

    @Test
    void testConcurrentWritersNeverExposePartialEntries() throws Exception {
        byte[] first = new byte[256 * 1024];
        byte[] second = new byte[512 * 1024];
        Arrays.fill(first, (byte) 'a');
        Arrays.fill(second, (byte) 'b');
        store.set("shared", first);

        int rounds = 50;
        Queue<String> failures = new ConcurrentLinkedQueue<>();
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService executor = Executors.newFixedThreadPool(3);

        try {
            List<Future<?>> tasks = List.of(
                    executor.submit(() -> writeRepeatedly(start, first, rounds, failures)),
                    executor.submit(() -> writeRepeatedly(start, second, rounds, failures)),
                    executor.submit(() -> {
                        awaitQuietly(start);
                        for (int i = 0; i < rounds * 2; i++) {
                            try {
                                byte[] data = store.get("shared").getData();
                                if (!Arrays.equals(data, first) && !Arrays.equals(data, second)) {
                                    failures.add("read a mixed or truncated payload of " + data.length + " bytes");
                                }
                            } catch (Exception e) {
                                failures.add("read failed: " + e);
                            }
                        }
                    }));

            start.countDown();
            for (Future<?> task : tasks) {
                task.get(60, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        assertTrue(failures.isEmpty(), () -> String.join("; ", failures));
        try (Stream<Path> files = Files.list(tempDir.resolve("cache"))) {
            assertTrue(files.noneMatch(p -> p.getFileName().toString().endsWith(".tmp")));
        }
        assertEquals(1, store.count());
    }

    private void writeRepeatedly(CountDownLatch start, byte[] payload, int rounds, Queue<String> failures) {
        awaitQuietly(start);
        for (int i = 0; i < rounds; i++) {
            try {
                store.set("shared", payload);
            } catch (Exception e) {
                failures.add("write failed: " + e);
            }
        }
    }

    private static void awaitQuietly(CountDownLatch latch) {
        try {
            latch.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    static class MutableClock extends Clock {
        private Instant now;

        MutableClock(Instant start) {
            this.now = start;
        }

        void advance(Duration duration) {
            now = now.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
