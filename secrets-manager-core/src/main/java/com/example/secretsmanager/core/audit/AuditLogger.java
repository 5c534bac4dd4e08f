package com.example.secretsmanager.core.audit;

import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.ERROR;
import static java.lang.System.Logger.Level.WARNING;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Front of the audit trail.
 *
 * <p>{@link #logEvent} never throws. A record the sink rejects is reported on this class's logger,
 * kept in a bounded pending queue and written again before the next record. After {@code
 * failureThreshold} consecutive failures {@link #isHealthy()} reports degraded health until a
 * write succeeds and the queue is drained. When the queue is full the oldest pending record is
 * reported at {@code ERROR} as dropped.
 */
public class AuditLogger implements AutoCloseable {

  private static final System.Logger LOGGER = System.getLogger(AuditLogger.class.getName());

  public static final int DEFAULT_MAX_PENDING = 1_000;

  private final AuditSink sink;
  private final int failureThreshold;
  private final int maxPending;
  private final Deque<AuditEvent> pending = new ArrayDeque<>();
  private int consecutiveFailures;
  private long droppedEvents;
  private volatile boolean healthy = true;

  public AuditLogger(final AuditSink sink, final int failureThreshold) {
    this(sink, failureThreshold, DEFAULT_MAX_PENDING);
  }

  public AuditLogger(final AuditSink sink, final int failureThreshold, final int maxPending) {
    if (sink == null) throw new IllegalArgumentException("sink must not be null");
    if (failureThreshold < 1) throw new IllegalArgumentException("failureThreshold must be >= 1");
    if (maxPending < 1) throw new IllegalArgumentException("maxPending must be >= 1");
    this.sink = sink;
    this.failureThreshold = failureThreshold;
    this.maxPending = maxPending;
  }

  /**
   * Appends a record to the trail. Pending records are written first so the trail keeps its
   * order.
   *
   * @param event record to append
   */
  public synchronized void logEvent(final AuditEvent event) {
    pending.addLast(event);
    trimPending();
    drain();
  }

  /** Writes pending records now. */
  public synchronized void flush() {
    drain();
  }

  /** False while the sink keeps failing. */
  public boolean isHealthy() {
    return healthy;
  }

  public synchronized int pendingCount() {
    return pending.size();
  }

  public synchronized long droppedCount() {
    return droppedEvents;
  }

  @Override
  public synchronized void close() {
    drain();
    if (!pending.isEmpty())
      LOGGER.log(ERROR, "Closing audit trail with {0} unwritten events", pending.size());
    try {
      sink.close();
    } catch (final RuntimeException e) {
      LOGGER.log(WARNING, "Failed to close audit sink", e);
    }
  }

  private void drain() {
    while (!pending.isEmpty()) {
      final var next = pending.peekFirst();
      try {
        sink.write(next);
      } catch (final RuntimeException e) {
        consecutiveFailures++;
        LOGGER.log(
            WARNING,
            "Audit write failed for {0} on {1} ({2} consecutive failures, {3} pending): {4}",
            next.type().wireName(),
            next.secretPath(),
            consecutiveFailures,
            pending.size(),
            e.getMessage());
        if (consecutiveFailures >= failureThreshold && healthy) {
          healthy = false;
          LOGGER.log(
              ERROR, "Audit trail degraded after {0} consecutive failures", consecutiveFailures);
        }
        return;
      }
      pending.removeFirst();
      if (consecutiveFailures > 0) {
        LOGGER.log(DEBUG, "Audit sink recovered after {0} failures", consecutiveFailures);
        consecutiveFailures = 0;
      }
    }
    healthy = true;
  }

  private void trimPending() {
    while (pending.size() > maxPending) {
      final var dropped = pending.removeFirst();
      droppedEvents++;
      LOGGER.log(
          ERROR,
          "Audit event dropped, pending queue full: type={0} path={1} requester={2} at={3}",
          dropped.type().wireName(),
          dropped.secretPath(),
          dropped.requester(),
          dropped.timestamp());
    }
  }
}
