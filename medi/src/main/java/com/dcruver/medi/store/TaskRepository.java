package com.dcruver.medi.store;

import com.dcruver.medi.domain.Task;
import com.dcruver.medi.error.KeyNotFoundException;
import com.dcruver.medi.error.StorageException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * JSON persistence of tasks under {@code tasks/<id>}.
 */
@Component
@Slf4j
public class TaskRepository {

    public static final String TASK_PREFIX = "tasks/";

    private final KeyValueStore store;
    private final ObjectMapper objectMapper;

    public TaskRepository(KeyValueStore store, ObjectMapper objectMapper) {
        this.store = store;
        this.objectMapper = objectMapper;
    }

    public void save(Task task) {
        try {
            store.put(storeKey(task.getId()), objectMapper.writeValueAsBytes(task));
        } catch (IOException e) {
            throw new StorageException("Failed to serialize task " + task.getId(), e);
        }
        log.debug("Stored task {}", task.getId());
    }

    public Optional<Task> find(long id) {
        return store.get(storeKey(id)).map(this::decode);
    }

    public void delete(long id) {
        try {
            store.delete(storeKey(id));
        } catch (KeyNotFoundException e) {
            throw KeyNotFoundException.task(id);
        }
    }

    /**
     * All tasks ordered by id. Store order is lexicographic ("tasks/10" before "tasks/2"),
     * so the list is re-sorted numerically.
     */
    public List<Task> findAll() {
        List<Task> tasks = new ArrayList<>();
        for (KeyValueStore.Entry entry : store.scanPrefix(TASK_PREFIX)) {
            tasks.add(decode(entry.getValue()));
        }
        tasks.sort(Comparator.comparingLong(Task::getId));
        return tasks;
    }

    /**
     * @return number of tasks removed
     */
    public int deleteAll() {
        return store.deletePrefix(TASK_PREFIX);
    }

    static String storeKey(long id) {
        return TASK_PREFIX + id;
    }

    private Task decode(byte[] bytes) {
        try {
            return objectMapper.readValue(bytes, Task.class);
        } catch (IOException e) {
            throw new StorageException("Corrupt task record: " + e.getMessage(), e);
        }
    }
}
