package com.dcruver.medi.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Data;
import lombok.With;

import java.time.Instant;

/**
 * A unit of work linked to a note. The note reference is checked on creation only.
 */
@Data
@Builder
@With
public class Task {
    private final long id;
    private final String noteKey;
    private final String description;
    private final TaskStatus status;
    private final Instant createdAt;

    @JsonCreator
    public Task(
            @JsonProperty("id") long id,
            @JsonProperty("noteKey") String noteKey,
            @JsonProperty("description") String description,
            @JsonProperty("status") TaskStatus status,
            @JsonProperty("createdAt") Instant createdAt) {
        this.id = id;
        this.noteKey = noteKey;
        this.description = description;
        this.status = status != null ? status : TaskStatus.OPEN;
        this.createdAt = createdAt;
    }
}
