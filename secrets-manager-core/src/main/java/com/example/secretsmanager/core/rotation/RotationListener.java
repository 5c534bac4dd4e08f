package com.example.secretsmanager.core.rotation;

import com.example.secretsmanager.core.model.RotationResult;
import java.time.Instant;

/** Observer of scheduler outcomes. All methods default to no-ops. */
public interface RotationListener {

  /** The secret enters its notice window; fired once per cycle. */
  default void onRotationUpcoming(final String secretId, final Instant dueAt) {}

  /**
   * The job has been due for longer than a poll interval without completing, for example after
   * downtime or while a rotation hangs; fired once per due time.
   */
  default void onRotationOverdue(final String secretId, final Instant dueAt) {}

  default void onRotationSucceeded(final String secretId, final RotationResult result) {}

  /** A failed attempt will be retried at {@code nextAttemptAt}. */
  default void onRotationRetry(
      final String secretId,
      final int attempt,
      final Instant nextAttemptAt,
      final Throwable error) {}

  /** Retries are exhausted or the secret can no longer be rotated. */
  default void onRotationFailed(final String secretId, final int attempts, final Throwable error) {}
}
