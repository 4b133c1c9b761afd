package com.dcruver.medi.store;

import com.dcruver.medi.error.CounterException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.Optional;

/**
 * Issues task ids from a counter kept in the primary store as an 8-byte little-endian value.
 * The increment runs through {@link KeyValueStore#atomicUpdate}, so concurrent callers,
 * including other processes on the same database, never receive the same id.
 */
@Component
@Slf4j
public class TaskIdGenerator {

    static final String COUNTER_KEY = "__counter__/tasks";

    private final KeyValueStore store;

    public TaskIdGenerator(KeyValueStore store) {
        this.store = store;
    }

    /**
     * Increment the counter and return the new value. A fresh database yields 1.
     */
    public long nextId() {
        Optional<byte[]> written = store.atomicUpdate(COUNTER_KEY, old -> {
            long current = old.map(TaskIdGenerator::decode).orElse(0L);
            if (current == -1L) {
                // unsigned overflow
                throw new CounterException("Task id counter exhausted");
            }
            return Optional.of(encode(current + 1));
        });

        long id = written
            .map(TaskIdGenerator::decode)
            .orElseThrow(() -> new CounterException("Failed to update task counter"));
        log.debug("Issued task id {}", id);
        return id;
    }

    /**
     * Force the counter back to zero. Ids will be reused if old tasks still exist.
     */
    public void reset() {
        store.put(COUNTER_KEY, encode(0L));
        log.warn("Task id counter reset to 0");
    }

    static byte[] encode(long value) {
        return ByteBuffer.allocate(Long.BYTES).order(ByteOrder.LITTLE_ENDIAN).putLong(value).array();
    }

    static long decode(byte[] bytes) {
        if (bytes.length != Long.BYTES) {
            throw new CounterException("Task counter holds " + bytes.length + " bytes, expected " + Long.BYTES);
        }
        return ByteBuffer.wrap(bytes).order(ByteOrder.LITTLE_ENDIAN).getLong();
    }
}
