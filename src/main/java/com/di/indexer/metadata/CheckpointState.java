package com.di.indexer.metadata;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Singleton row of {@code indexer_state} (id = 1).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CheckpointState {

    /** Highest block whose window was fully committed; -1 when scanning starts at block 0. */
    @Builder.Default
    private long    lastBlock = -1;
    @Builder.Default
    private String  lastAttestationUid = "";
    private long    processedCount;
    private long    errorCount;
    private Instant updatedAt;

    public static CheckpointState empty() {
        return CheckpointState.builder().build();
    }
}
