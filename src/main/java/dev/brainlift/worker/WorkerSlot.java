package dev.brainlift.worker;

import dev.brainlift.research.WorkerState;
import dev.brainlift.research.WorkerStatus;
import java.time.Instant;

/**
 * One execution slot. Not thread-safe: the pool manager mutates it on its control loop, the graph
 * engine under its slot table lock.
 */
public final class WorkerSlot {

    private final String id;
    private WorkerState state = WorkerState.IDLE;
    private String currentJobId;
    private Instant lastActivity;
    private int completedCount;
    private int errorCount;
    private int failureCount;
    private int incarnation;

    public WorkerSlot(String id, Instant createdAt) {
        this.id = id;
        this.lastActivity = createdAt;
    }

    public String id() {
        return id;
    }

    public WorkerState state() {
        return state;
    }

    public String currentJobId() {
        return currentJobId;
    }

    public int failureCount() {
        return failureCount;
    }

    public int incarnation() {
        return incarnation;
    }

    public boolean isIdle() {
        return state == WorkerState.IDLE;
    }

    public boolean isRetired() {
        return state == WorkerState.RETIRED;
    }

    public void assign(String jobId, Instant now) {
        state = WorkerState.BUSY;
        currentJobId = jobId;
        lastActivity = now;
    }

    public void touch(Instant now) {
        lastActivity = now;
    }

    public void release(Instant now) {
        state = WorkerState.IDLE;
        currentJobId = null;
        lastActivity = now;
    }

    public void completed(Instant now) {
        completedCount++;
        release(now);
    }

    public void jobFailed(Instant now) {
        errorCount++;
        release(now);
    }

    /** Records a crash or timeout and leaves the slot in {@link WorkerState#ERROR}. */
    public void crashed(Instant now) {
        errorCount++;
        failureCount++;
        state = WorkerState.ERROR;
        currentJobId = null;
        lastActivity = now;
    }

    public void respawn(Instant now) {
        incarnation++;
        release(now);
    }

    public void retire(Instant now) {
        state = WorkerState.RETIRED;
        currentJobId = null;
        lastActivity = now;
    }

    public WorkerStatus snapshot() {
        return new WorkerStatus(id, state, currentJobId, lastActivity, completedCount, errorCount, failureCount);
    }
}
