package dev.brainlift.research;

import java.time.Instant;
import org.jspecify.annotations.Nullable;

/**
 * Point-in-time view of one execution slot.
 *
 * @param workerId slot identifier
 * @param state current slot state
 * @param currentJobId job occupying the slot while busy
 * @param lastActivity last time the slot changed state or reported progress
 * @param completedCount jobs completed successfully on this slot
 * @param errorCount jobs that failed on this slot
 * @param failureCount crashes and timeouts counted towards retirement
 */
public record WorkerStatus(
    String workerId,
    WorkerState state,
    @Nullable String currentJobId,
    Instant lastActivity,
    int completedCount,
    int errorCount,
    int failureCount) {}
