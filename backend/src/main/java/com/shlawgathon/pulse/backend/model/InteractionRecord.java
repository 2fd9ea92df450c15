package com.shlawgathon.pulse.backend.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * One query/response turn between a developer and the coding assistant.
 * Written by the ingestion callback; the analysis pipeline only reads it.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = "interaction_records")
@CompoundIndex(name = "user_timestamp", def = "{'userId': 1, 'timestamp': -1}")
public class InteractionRecord {

    @Id
    private String id;

    @Indexed
    private String userId;

    @Indexed
    private String projectId;

    private String projectName;

    private String queryText;

    /**
     * Assistant response, null while the turn is still pending.
     */
    private String responseText;

    @Indexed
    private Instant timestamp;

    /**
     * When the response finished, if the hook reported it.
     */
    private Instant completedAt;

    @Builder.Default
    private CompletionStatus completionStatus = CompletionStatus.COMPLETED;

    @JsonIgnore
    public boolean isCompleted() {
        return completionStatus == CompletionStatus.COMPLETED;
    }
}
