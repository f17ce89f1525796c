package dev.brainlift.graph;

import dev.brainlift.research.WorkerStatus;
import dev.brainlift.worker.WorkerSlot;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Bounds how many branches run the pipeline at once. Jobs wait in a FIFO line and {@link #acquire}
 * hands an idle slot only to the job at its head. Failed slots are respawned after a delay or
 * retired once they reach the failure limit.
 */
final class SlotTable {

  private static final Logger log = LoggerFactory.getLogger(SlotTable.class);

  private final List<WorkerSlot> slots = new ArrayList<>();
  private final Deque<String> waiting = new ArrayDeque<>();
  private final int maxFailures;
  private final Duration respawnDelay;
  private final ScheduledExecutorService timers;
  private final Clock clock;

  SlotTable(
      int size,
      int maxFailures,
      Duration respawnDelay,
      ScheduledExecutorService timers,
      Clock clock) {
    this.maxFailures = maxFailures;
    this.respawnDelay = respawnDelay;
    this.timers = timers;
    this.clock = clock;
    for (int i = 1; i <= size; i++) {
      slots.add(new WorkerSlot("worker-" + i, clock.instant()));
    }
  }

  /** Queue jobs in submission order, behind the jobs already waiting. */
  synchronized void enqueue(Collection<String> jobIds) {
    for (String jobId : jobIds) {
      if (!waiting.contains(jobId)) {
        waiting.addLast(jobId);
      }
    }
  }

  /** Put a job that is about to be retried at the head of the line. */
  synchronized void requeueFirst(String jobId) {
    waiting.remove(jobId);
    waiting.addFirst(jobId);
    notifyAll();
  }

  /** Remove a job from the line, for instance because it was cancelled before getting a slot. */
  synchronized void withdraw(String jobId) {
    if (waiting.remove(jobId)) {
      notifyAll();
    }
  }

  /**
   * Wait until the job is first in line and a slot is idle, then assign the job to that slot. A job
   * that was not queued joins the end of the line.
   *
   * @return the slot, or {@code null} once every slot is retired
   */
  synchronized @Nullable WorkerSlot acquire(String jobId) throws InterruptedException {
    if (!waiting.contains(jobId)) {
      waiting.addLast(jobId);
    }
    try {
      while (true) {
        if (slots.stream().allMatch(WorkerSlot::isRetired)) {
          waiting.remove(jobId);
          notifyAll();
          return null;
        }
        if (jobId.equals(waiting.peekFirst())) {
          for (WorkerSlot slot : slots) {
            if (slot.isIdle()) {
              waiting.removeFirst();
              slot.assign(jobId, clock.instant());
              notifyAll();
              return slot;
            }
          }
        }
        wait();
      }
    } catch (InterruptedException e) {
      waiting.remove(jobId);
      notifyAll();
      throw e;
    }
  }

  synchronized List<String> waitingJobIds() {
    return List.copyOf(waiting);
  }

  synchronized void touch(String slotId) {
    for (WorkerSlot slot : slots) {
      if (slot.id().equals(slotId)) {
        slot.touch(clock.instant());
      }
    }
  }

  synchronized void completed(WorkerSlot slot) {
    slot.completed(clock.instant());
    notifyAll();
  }

  synchronized void jobFailed(WorkerSlot slot) {
    slot.jobFailed(clock.instant());
    notifyAll();
  }

  synchronized void release(WorkerSlot slot) {
    slot.release(clock.instant());
    notifyAll();
  }

  /** Record a crash or timeout; respawn the slot later or retire it. */
  synchronized void failed(WorkerSlot slot) {
    slot.crashed(clock.instant());
    if (slot.failureCount() < maxFailures) {
      int incarnation = slot.incarnation();
      timers.schedule(
          () -> respawn(slot, incarnation), respawnDelay.toMillis(), TimeUnit.MILLISECONDS);
      return;
    }
    slot.retire(clock.instant());
    long remaining = slots.stream().filter(candidate -> !candidate.isRetired()).count();
    log.warn(
        "Retired {} after {} failures; capacity degraded to {}/{}",
        slot.id(),
        slot.failureCount(),
        remaining,
        slots.size());
    notifyAll();
  }

  synchronized void retireAll() {
    slots.forEach(slot -> slot.retire(clock.instant()));
    notifyAll();
  }

  synchronized List<WorkerStatus> snapshot() {
    return slots.stream().map(WorkerSlot::snapshot).toList();
  }

  private synchronized void respawn(WorkerSlot slot, int incarnation) {
    if (slot.incarnation() != incarnation || slot.isRetired()) {
      return;
    }
    slot.respawn(clock.instant());
    log.info("{} respawned", slot.id());
    notifyAll();
  }
}
