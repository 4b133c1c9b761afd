package com.dcruver.medi.store;

import com.dcruver.medi.MediTestFixture;
import com.dcruver.medi.error.CounterException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class TaskIdGeneratorTest {

    @TempDir
    Path tempDir;

    private KeyValueStore store;
    private TaskIdGenerator generator;

    @BeforeEach
    void setUp() {
        store = MediTestFixture.openStore(tempDir);
        generator = new TaskIdGenerator(store);
    }

    @Test
    void testFreshDatabaseStartsAtOne() {
        assertEquals(1, generator.nextId());
        assertEquals(2, generator.nextId());
        assertEquals(3, generator.nextId());
    }

    @Test
    void testSequenceUnaffectedByOtherWrites() {
        List<Long> ids = new ArrayList<>();
        for (int i = 0; i < 20; i++) {
            ids.add(generator.nextId());
            store.put("notes/n" + i, new byte[]{1});
            if (i % 3 == 0) {
                store.delete("notes/n" + i);
            }
            store.deletePrefix("tasks/");
        }

        for (int i = 0; i < 20; i++) {
            assertEquals((long) (i + 1), ids.get(i));
        }
    }

    @Test
    void testCounterIsLittleEndianEightBytes() {
        generator.nextId();
        generator.nextId();

        byte[] raw = store.get(TaskIdGenerator.COUNTER_KEY).orElseThrow();
        assertArrayEquals(new byte[]{2, 0, 0, 0, 0, 0, 0, 0}, raw);
    }

    @Test
    void testCounterSurvivesReopen() {
        generator.nextId();
        generator.nextId();

        TaskIdGenerator reopened = new TaskIdGenerator(MediTestFixture.openStore(tempDir));
        assertEquals(3, reopened.nextId());
    }

    @Test
    void testResetRestartsAtOne() {
        generator.nextId();
        generator.nextId();

        generator.reset();

        assertEquals(1, generator.nextId());
    }

    @Test
    void testConcurrentCallersNeverShareAnId() throws Exception {
        int threads = 4;
        int perThread = 25;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        try {
            List<Future<List<Long>>> futures = new ArrayList<>();
            for (int t = 0; t < threads; t++) {
                // separate store instances, as separate processes would have
                TaskIdGenerator own = new TaskIdGenerator(MediTestFixture.openStore(tempDir));
                Callable<List<Long>> work = () -> {
                    List<Long> ids = new ArrayList<>();
                    for (int i = 0; i < perThread; i++) {
                        ids.add(own.nextId());
                    }
                    return ids;
                };
                futures.add(pool.submit(work));
            }

            Set<Long> all = new HashSet<>();
            for (Future<List<Long>> future : futures) {
                List<Long> ids = future.get(60, TimeUnit.SECONDS);
                for (int i = 1; i < ids.size(); i++) {
                    assertTrue(ids.get(i) > ids.get(i - 1), "ids must increase within one caller");
                }
                all.addAll(ids);
            }

            assertEquals(threads * perThread, all.size());
            for (long id = 1; id <= threads * perThread; id++) {
                assertTrue(all.contains(id), "missing id " + id);
            }
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void testMalformedCounterIsCounterFailure() {
        store.put(TaskIdGenerator.COUNTER_KEY, new byte[]{1, 2, 3});

        assertThrows(CounterException.class, () -> generator.nextId());
        // the failed update must not have changed the stored value
        assertArrayEquals(new byte[]{1, 2, 3}, store.get(TaskIdGenerator.COUNTER_KEY).orElseThrow());
    }
}
