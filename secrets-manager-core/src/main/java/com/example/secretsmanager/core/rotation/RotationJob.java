package com.example.secretsmanager.core.rotation;

import com.example.secretsmanager.core.model.RotationPolicy;
import java.time.Duration;
import java.time.Instant;

/**
 * Scheduler entry for one secret with an automatic policy. Replaced as a whole on every change.
 *
 * @param secretId secret to rotate
 * @param policy policy driving the cadence and retries
 * @param nextRunAt regular due time of the current cycle
 * @param attempts failed attempts in the current cycle
 * @param nextAttemptAt due time of the next retry, null when not retrying
 * @param notified whether the upcoming notice was sent for this cycle
 * @param overdueNotified whether the overdue signal was sent for the current due time
 */
public record RotationJob(
    String secretId,
    RotationPolicy policy,
    Instant nextRunAt,
    int attempts,
    Instant nextAttemptAt,
    boolean notified,
    boolean overdueNotified) {

  static RotationJob first(final String secretId, final RotationPolicy policy, final Instant now) {
    return new RotationJob(secretId, policy, now.plus(interval(policy)), 0, null, false, false);
  }

  /** When the job should run next. */
  public Instant dueAt() {
    return nextAttemptAt != null ? nextAttemptAt : nextRunAt;
  }

  public boolean isDue(final Instant now) {
    return !now.isBefore(dueAt());
  }

  /** Due for longer than {@code grace} without the overdue signal having been sent. */
  boolean isOverdue(final Instant now, final Duration grace) {
    return !overdueNotified && now.isAfter(dueAt().plus(grace));
  }

  boolean inNoticeWindow(final Instant now) {
    final var notice = Duration.ofDays(policy.notifyBeforeDays());
    return !notified
        && policy.notifyBeforeDays() > 0
        && !now.isBefore(nextRunAt.minus(notice))
        && now.isBefore(nextRunAt);
  }

  RotationJob withNotified() {
    return new RotationJob(
        secretId, policy, nextRunAt, attempts, nextAttemptAt, true, overdueNotified);
  }

  RotationJob withOverdueNotified() {
    return new RotationJob(secretId, policy, nextRunAt, attempts, nextAttemptAt, notified, true);
  }

  RotationJob withRetry(final int newAttempts, final Instant retryAt) {
    return new RotationJob(secretId, policy, nextRunAt, newAttempts, retryAt, notified, false);
  }

  /** Next cycle on the original cadence: the first regular slot after {@code now}. */
  RotationJob nextCycle(final Instant now) {
    var next = nextRunAt.plus(interval(policy));
    while (!next.isAfter(now)) next = next.plus(interval(policy));
    return new RotationJob(secretId, policy, next, 0, null, false, false);
  }

  private static Duration interval(final RotationPolicy policy) {
    return Duration.ofDays(policy.intervalDays());
  }
}
