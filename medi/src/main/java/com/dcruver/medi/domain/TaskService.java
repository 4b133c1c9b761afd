package com.dcruver.medi.domain;

import com.dcruver.medi.error.KeyNotFoundException;
import com.dcruver.medi.store.NoteRepository;
import com.dcruver.medi.store.TaskIdGenerator;
import com.dcruver.medi.store.TaskRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;

/**
 * Task tracker linked to notes.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class TaskService {

    private final TaskRepository taskRepository;
    private final TaskIdGenerator taskIdGenerator;
    private final NoteRepository noteRepository;
    private final Clock clock;

    /**
     * @throws KeyNotFoundException if no note exists under {@code noteKey}
     */
    public Task add(String noteKey, String description) {
        if (!noteRepository.exists(noteKey)) {
            throw new KeyNotFoundException(noteKey);
        }

        Task task = Task.builder()
            .id(taskIdGenerator.nextId())
            .noteKey(noteKey)
            .description(description)
            .status(TaskStatus.OPEN)
            .createdAt(clock.instant())
            .build();

        taskRepository.save(task);
        log.info("Added task {} for note '{}'", task.getId(), noteKey);
        return task;
    }

    public List<Task> list() {
        return taskRepository.findAll();
    }

    public Task get(long id) {
        return taskRepository.find(id).orElseThrow(() -> KeyNotFoundException.task(id));
    }

    public Task setStatus(long id, TaskStatus status) {
        Task updated = get(id).withStatus(status);
        taskRepository.save(updated);
        log.info("Task {} is now {}", id, status.getLabel());
        return updated;
    }

    public Task complete(long id) {
        return setStatus(id, TaskStatus.DONE);
    }

    public Task prioritize(long id) {
        return setStatus(id, TaskStatus.PRIO);
    }

    public Task reopen(long id) {
        return setStatus(id, TaskStatus.OPEN);
    }

    public void delete(long id) {
        taskRepository.delete(id);
        log.info("Deleted task {}", id);
    }

    /**
     * Delete every task and restart ids at 1.
     *
     * @return number of tasks deleted
     */
    public int reset() {
        int removed = taskRepository.deleteAll();
        taskIdGenerator.reset();
        log.info("Reset tasks: {} removed", removed);
        return removed;
    }
}
