package com.dcruver.medi.app;

import com.dcruver.medi.config.MediProperties;
import com.dcruver.medi.domain.Note;
import com.dcruver.medi.domain.NoteService;
import com.dcruver.medi.domain.SortBy;
import com.dcruver.medi.domain.Task;
import com.dcruver.medi.domain.TaskService;
import com.dcruver.medi.domain.TaskStatus;
import com.dcruver.medi.io.ExportFormat;
import com.dcruver.medi.io.ImportResult;
import com.dcruver.medi.io.NoteExporter;
import com.dcruver.medi.io.NoteImporter;
import com.dcruver.medi.sync.ConsistencyReport;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.shell.standard.ShellComponent;
import org.springframework.shell.standard.ShellMethod;
import org.springframework.shell.standard.ShellOption;

import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Spring Shell commands for medi. Thin wrappers: parse options, call the services, format output.
 * Failures propagate to {@link ShellErrorResolver}.
 */
@ShellComponent
@RequiredArgsConstructor
public class MediShellCommands {

    private final NoteService noteService;
    private final TaskService taskService;
    private final NoteImporter noteImporter;
    private final NoteExporter noteExporter;
    private final ObjectMapper objectMapper;
    private final MediProperties properties;

    // -------------------- Notes --------------------

    @ShellMethod(key = "new", value = "Create a new note with the specified key")
    public String newNote(
        @ShellOption(help = "Key of the new note") String key,
        @ShellOption(value = {"--message", "-m"}, defaultValue = "", help = "Note content") String message,
        @ShellOption(value = {"--tag", "-T"}, defaultValue = ShellOption.NULL, help = "Comma separated tags") String[] tags,
        @ShellOption(value = {"--title", "-t"}, defaultValue = ShellOption.NULL, help = "Title, defaults to the key") String title
    ) {
        noteService.create(key, title, message, toList(tags));
        return "Successfully created note: '" + key + "'";
    }

    @ShellMethod(key = "edit", value = "Edit the content, title or tags of an existing note")
    public String edit(
        @ShellOption(help = "Key of the note to edit") String key,
        @ShellOption(value = {"--message", "-m"}, defaultValue = ShellOption.NULL, help = "Replacement content") String message,
        @ShellOption(value = {"--title", "-t"}, defaultValue = ShellOption.NULL, help = "Replacement title") String title,
        @ShellOption(value = {"--add-tag", "-a"}, defaultValue = ShellOption.NULL, help = "Comma separated tags to add") String[] addTags,
        @ShellOption(value = {"--rm-tag", "-r"}, defaultValue = ShellOption.NULL, help = "Comma separated tags to remove") String[] rmTags
    ) {
        Note before = noteService.get(key);
        Note after = noteService.edit(key, message, title, toList(addTags), toList(rmTags));
        if (after.equals(before)) {
            return "Nothing to change for note: '" + key + "'";
        }
        return "Successfully updated note: '" + key + "'";
    }

    @ShellMethod(key = "get", value = "Show a note, or every note carrying a tag")
    public String get(
        @ShellOption(defaultValue = ShellOption.NULL, help = "Key of the note") String key,
        @ShellOption(value = {"--tag", "-t"}, defaultValue = ShellOption.NULL, help = "Comma separated tags") String[] tags,
        @ShellOption(value = "--json", defaultValue = "false", help = "Print the full note as JSON") boolean json
    ) throws JsonProcessingException {
        if (key == null && (tags == null || tags.length == 0)) {
            throw new IllegalArgumentException("Give a note key or --tag");
        }

        if (key != null) {
            Note note = noteService.get(key);
            return json ? objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(note) : note.getContent();
        }

        List<Note> notes = noteService.getByTags(toList(tags));
        if (notes.isEmpty()) {
            return "No notes found with tag(s): " + String.join(", ", tags);
        }
        if (json) {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(notes);
        }

        StringBuilder sb = new StringBuilder();
        for (Note note : notes) {
            sb.append("--- ").append(note.getKey()).append(" ---\n");
            sb.append(note.getContent()).append("\n\n");
        }
        return sb.toString().stripTrailing();
    }

    @ShellMethod(key = "list", value = "List all notes")
    public String list(
        @ShellOption(value = {"--sort-by", "-s"}, defaultValue = "key", help = "key, created or modified") String sortBy
    ) {
        List<Note> notes = noteService.list(parseEnum(SortBy.class, sortBy));
        if (notes.isEmpty()) {
            return "No notes found.";
        }

        StringBuilder sb = new StringBuilder();
        for (Note note : notes) {
            sb.append(String.format("- %s", note.getKey()));
            if (!note.getTitle().equals(note.getKey())) {
                sb.append(String.format(" (%s)", note.getTitle()));
            }
            if (!note.getTags().isEmpty()) {
                sb.append(String.format(" [%s]", String.join(", ", note.getTags())));
            }
            sb.append("\n");
        }
        return sb.toString().stripTrailing();
    }

    @ShellMethod(key = "delete", value = "Delete a note with the specified key")
    public String delete(@ShellOption(help = "Key of the note to delete") String key) {
        noteService.delete(key);
        return "Successfully deleted note: '" + key + "'";
    }

    @ShellMethod(key = "search", value = "Search notes by content, title or tags")
    public String search(@ShellOption(help = "Query string") String query) {
        List<String> keys = noteService.search(query);
        if (keys.isEmpty()) {
            return "No matching notes found.";
        }

        StringBuilder sb = new StringBuilder(String.format("Found %d matching notes:\n", keys.size()));
        keys.forEach(k -> sb.append("- ").append(k).append("\n"));
        return sb.toString().stripTrailing();
    }

    @ShellMethod(key = "reindex", value = "Rebuild the search index from the stored notes")
    public String reindex() {
        int count = noteService.reindex();
        return String.format("Reindexed %d notes.", count);
    }

    @ShellMethod(key = "check", value = "Compare the search index with the stored notes")
    public String check() {
        ConsistencyReport report = noteService.check();

        StringBuilder sb = new StringBuilder("Search Index Status\n\n");
        sb.append(String.format("- Stored notes: %d\n", report.getStoredNotes()));
        sb.append(String.format("- Indexed documents: %d\n", report.getIndexedDocuments()));
        sb.append(String.format("- Missing from index: %s\n", describe(report.getMissingFromIndex())));
        sb.append(String.format("- Orphaned in index: %s\n", describe(report.getOrphanedInIndex())));
        sb.append(String.format("- Duplicated in index: %s\n", describe(report.getDuplicatedInIndex())));
        sb.append("\n");
        sb.append(report.isConsistent() ? "Index is in sync." : "Index is out of sync. Run 'reindex' to repair it.");
        return sb.toString();
    }

    @ShellMethod(key = "import", value = "Import notes from a directory of .md files or a single file")
    public String importNotes(
        @ShellOption(value = "--dir", defaultValue = ShellOption.NULL, help = "Directory of .md files") String dir,
        @ShellOption(value = "--file", defaultValue = ShellOption.NULL, help = "Single file, requires --key") String file,
        @ShellOption(value = "--key", defaultValue = ShellOption.NULL, help = "Key for a single file") String key,
        @ShellOption(value = "--overwrite", defaultValue = "false", help = "Replace existing notes") boolean overwrite
    ) {
        if ((dir == null) == (file == null)) {
            throw new IllegalArgumentException("Give exactly one of --dir or --file");
        }

        List<ImportResult> results;
        if (file != null) {
            if (key == null || key.isBlank()) {
                throw new IllegalArgumentException("--file requires --key");
            }
            results = List.of(noteImporter.importFile(Path.of(file), key, overwrite));
        } else {
            results = noteImporter.importDirectory(Path.of(dir), overwrite);
        }

        if (results.isEmpty()) {
            return "No .md files found to import.";
        }

        StringBuilder sb = new StringBuilder();
        for (ImportResult result : results) {
            sb.append(result.getOutcome() == ImportResult.Outcome.FAILED ? "✗ " : "")
                .append(result.getMessage())
                .append("\n");
        }
        return sb.toString().stripTrailing();
    }

    @ShellMethod(key = "export", value = "Export notes to markdown files or JSON")
    public String export(
        @ShellOption(defaultValue = ShellOption.NULL, help = "Export directory or file") String path,
        @ShellOption(value = "--format", defaultValue = "markdown", help = "markdown or json") String format,
        @ShellOption(value = {"--tag", "-t"}, defaultValue = ShellOption.NULL, help = "Comma separated tags") String[] tags
    ) {
        Path target = Path.of(path != null ? path : properties.getExportDir());
        int count = noteExporter.export(target, parseEnum(ExportFormat.class, format), toList(tags));
        return String.format("Successfully exported %d notes to %s", count, target);
    }

    // -------------------- Tasks --------------------

    @ShellMethod(key = "task add", value = "Add a new task linked to a note")
    public String taskAdd(
        @ShellOption(help = "Key of the note this task is for") String noteKey,
        @ShellOption(help = "Description of the task") String description
    ) {
        Task task = taskService.add(noteKey, description);
        return "Added new task with ID: " + task.getId();
    }

    @ShellMethod(key = "task list", value = "List all tasks")
    public String taskList() {
        List<Task> tasks = taskService.list();
        if (tasks.isEmpty()) {
            return "No tasks found.";
        }

        StringBuilder sb = new StringBuilder();
        for (Task task : tasks) {
            sb.append(formatTask(task)).append("\n");
        }
        return sb.toString().stripTrailing();
    }

    @ShellMethod(key = "task done", value = "Mark a task as done")
    public String taskDone(@ShellOption(help = "Task ID") long taskId) {
        taskService.complete(taskId);
        return "Completed task: " + taskId;
    }

    @ShellMethod(key = "task prio", value = "Prioritize a task")
    public String taskPrio(@ShellOption(help = "Task ID") long taskId) {
        taskService.prioritize(taskId);
        return "Prioritized task: " + taskId;
    }

    @ShellMethod(key = "task open", value = "Reopen a task")
    public String taskOpen(@ShellOption(help = "Task ID") long taskId) {
        taskService.reopen(taskId);
        return "Reopened task: " + taskId;
    }

    @ShellMethod(key = "task delete", value = "Delete a task")
    public String taskDelete(@ShellOption(help = "Task ID") long taskId) {
        taskService.delete(taskId);
        return "Deleted task: " + taskId;
    }

    @ShellMethod(key = "task reset", value = "Delete all tasks and restart IDs at 1")
    public String taskReset() {
        int removed = taskService.reset();
        return String.format("Deleted %d tasks and reset the task counter.", removed);
    }

    static String formatTask(Task task) {
        String marker = task.getStatus() == TaskStatus.PRIO ? " ⭐" : "";
        return String.format("[%d] [%s]%s: %s (for note %s)",
            task.getId(), task.getStatus().getLabel(), marker, task.getDescription(), task.getNoteKey());
    }

    private static List<String> toList(String[] values) {
        if (values == null) {
            return List.of();
        }
        return Arrays.stream(values)
            .map(String::trim)
            .filter(v -> !v.isEmpty())
            .toList();
    }

    private static <E extends Enum<E>> E parseEnum(Class<E> type, String value) {
        try {
            return Enum.valueOf(type, value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown value '" + value + "', expected one of "
                + Arrays.toString(type.getEnumConstants()).toLowerCase(Locale.ROOT), e);
        }
    }

    private static String describe(Set<String> keys) {
        return keys.isEmpty() ? "none" : keys.size() + " (" + String.join(", ", keys) + ")";
    }
}
