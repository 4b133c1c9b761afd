package com.dcruver.medi.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Data;
import lombok.With;

import java.time.Instant;
import java.util.Collection;
import java.util.List;

/**
 * A markdown note stored under its caller-chosen key.
 * Tags keep their insertion order and are not de-duplicated.
 */
@Data
@Builder
@With
public class Note {
    private final String key;
    private final String title;
    private final List<String> tags;
    private final String content;
    private final Instant createdAt;   // set once, on first save
    private final Instant modifiedAt;

    @JsonCreator
    public Note(
            @JsonProperty("key") String key,
            @JsonProperty("title") String title,
            @JsonProperty("tags") List<String> tags,
            @JsonProperty("content") String content,
            @JsonProperty("createdAt") Instant createdAt,
            @JsonProperty("modifiedAt") Instant modifiedAt) {
        this.key = key;
        this.title = title != null ? title : key;
        // records written before tags existed have no tags field
        this.tags = tags != null ? List.copyOf(tags) : List.of();
        this.content = content != null ? content : "";
        this.createdAt = createdAt;
        this.modifiedAt = modifiedAt;
    }

    public boolean hasAnyTag(Collection<String> wanted) {
        return tags.stream().anyMatch(wanted::contains);
    }
}
