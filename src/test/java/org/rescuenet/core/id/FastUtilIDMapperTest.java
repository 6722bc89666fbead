package org.rescuenet.core.id;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class FastUtilIDMapperTest {

    @Test
    @DisplayName("Baseline Correctness: dense reverse table maps both ways")
    void testSimpleMapping() {
        IDMapper mapper = new FastUtilIDMapper(new long[]{900L, 17L, 42L});

        assertEquals(0, mapper.toInternal(900L));
        assertEquals(2, mapper.toInternal(42L));
        assertEquals(17L, mapper.toExternal(1));

        assertTrue(mapper.containsExternal(17L));
        assertFalse(mapper.containsExternal(18L));
        assertTrue(mapper.containsInternal(0));
        assertFalse(mapper.containsInternal(3));
        assertFalse(mapper.containsInternal(-1));
        assertEquals(3, mapper.size());
    }

    @Test
    @DisplayName("Sorted Factory: index order follows persisted id order")
    void testSortedOf() {
        long[] ids = {500L, -3L, 12L, 7L};
        IDMapper mapper = IDMapper.sortedOf(ids);

        assertEquals(-3L, mapper.toExternal(0));
        assertEquals(7L, mapper.toExternal(1));
        assertEquals(12L, mapper.toExternal(2));
        assertEquals(500L, mapper.toExternal(3));
        assertEquals(500L, ids[0], "Input array must not be reordered");
    }

    @Test
    @DisplayName("Exception Path: Unknown External ID")
    void testUnknownExternalId() {
        IDMapper mapper = IDMapper.sortedOf(new long[]{1L, 2L});

        assertThrows(IDMapper.UnknownIDException.class, () -> mapper.toInternal(3L),
                "Should throw UnknownIDException for missing ids");
    }

    @Test
    @DisplayName("Exception Path: Invalid Internal ID")
    void testInvalidInternalId() {
        IDMapper mapper = IDMapper.sortedOf(new long[]{1L, 2L});

        assertThrows(IndexOutOfBoundsException.class, () -> mapper.toExternal(2));
        assertThrows(IndexOutOfBoundsException.class, () -> mapper.toExternal(-1));
    }

    @Test
    @DisplayName("Constructor Validation: Reject null and duplicate ids")
    void testConstructorValidation() {
        assertThrows(IllegalArgumentException.class, () -> new FastUtilIDMapper(null));
        assertThrows(IllegalArgumentException.class, () -> IDMapper.sortedOf(null));

        Exception exception = assertThrows(IllegalArgumentException.class,
                () -> IDMapper.sortedOf(new long[]{4L, 9L, 4L}));
        assertTrue(exception.getMessage().contains("Duplicate external id"));
    }

    @Test
    @DisplayName("Empty mapping is valid")
    void testEmptyMapping() {
        IDMapper mapper = IDMapper.sortedOf(new long[0]);
        assertEquals(0, mapper.size());
        assertFalse(mapper.containsInternal(0));
    }

    @Test
    @DisplayName("Concurrency: Thread-safe Read Operations")
    void testConcurrentReads() throws InterruptedException {
        long[] ids = new long[1_000];
        for (int i = 0; i < ids.length; i++) {
            ids[i] = 10_000L + i * 3L;
        }
        IDMapper mapper = IDMapper.sortedOf(ids);
        ExecutorService executor = Executors.newFixedThreadPool(8);
        AtomicInteger errors = new AtomicInteger();

        for (int t = 0; t < 8; t++) {
            executor.submit(() -> {
                for (int i = 0; i < ids.length; i++) {
                    if (mapper.toExternal(mapper.toInternal(ids[i])) != ids[i]) {
                        errors.incrementAndGet();
                    }
                }
            });
        }

        executor.shutdown();
        assertTrue(executor.awaitTermination(5, TimeUnit.SECONDS), "Executor did not finish in time");
        assertEquals(0, errors.get());
    }
}
