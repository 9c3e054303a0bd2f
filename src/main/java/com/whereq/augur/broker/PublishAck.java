package com.whereq.augur.broker;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Successful outcome of a publication
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PublishAck {

    public enum Outcome {
        /**
         * The entity was created or replaced
         */
        WRITTEN,

        /**
         * The broker already holds an equal or newer generation; nothing was written
         */
        SKIPPED_STALE
    }

    private String entityId;

    private Instant generatedAt;

    private Outcome outcome;

    private int attempts;
}
