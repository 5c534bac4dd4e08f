package com.example.secretsmanager.core;

import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.WARNING;

import com.example.secretsmanager.core.exception.ProviderException;
import com.example.secretsmanager.core.exception.SecretConflictException;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Retry helper for idempotent provider reads and for the rotation scheduler's backoff.
 *
 * <p>Writes are never passed through here: a retried write could double-increment a version.
 */
public final class Retry {

  private static final System.Logger LOGGER = System.getLogger(Retry.class.getName());

  private Retry() {}

  /**
   * Retry policy configuration supporting exponential backoff.
   *
   * @param maxAttempts maximum number of attempts (including first), must be >= 1
   * @param initialDelayMillis initial delay between retries in milliseconds, must be >= 0
   * @param maxDelayMillis maximum delay cap for exponential backoff, must be >= initialDelayMillis
   * @param backoffMultiplier multiplier for exponential backoff (1.0 = fixed delay), must be >= 1.0
   * @param jitter whether to add random jitter (up to 25%) to delays
   */
  public record Policy(
      int maxAttempts,
      long initialDelayMillis,
      long maxDelayMillis,
      double backoffMultiplier,
      boolean jitter) {

    public Policy {
      if (maxAttempts < 1) throw new IllegalArgumentException("maxAttempts must be >= 1");
      if (initialDelayMillis < 0)
        throw new IllegalArgumentException("initialDelayMillis must be >= 0");
      if (maxDelayMillis < initialDelayMillis)
        throw new IllegalArgumentException("maxDelayMillis must be >= initialDelayMillis");
      if (backoffMultiplier < 1.0)
        throw new IllegalArgumentException("backoffMultiplier must be >= 1.0");
    }

    /**
     * Creates a fixed delay retry policy.
     *
     * @param attempts number of attempts (including first)
     * @param delayMillis delay between attempts in milliseconds
     * @return fixed delay retry policy
     */
    static Policy fixed(final int attempts, final long delayMillis) {
      return new Policy(attempts, delayMillis, delayMillis, 1.0, false);
    }

    /**
     * Creates an exponential backoff retry policy with jitter, doubling up to one minute.
     *
     * @param attempts number of attempts (including first)
     * @param initialDelay initial delay in milliseconds
     * @return exponential backoff retry policy with jitter
     */
    static Policy exponential(final int attempts, final long initialDelay) {
      return new Policy(attempts, initialDelay, Math.max(initialDelay, 60_000L), 2.0, true);
    }

    /**
     * Calculates the delay for a given attempt number.
     *
     * @param attempt current attempt number (1-based)
     * @return delay in milliseconds before the attempt
     */
    public long calculateDelay(final int attempt) {
      if (attempt <= 1) return 0L;

      var delay = initialDelayMillis;
      if (backoffMultiplier > 1.0) {
        final var grown = initialDelayMillis * Math.pow(backoffMultiplier, attempt - 2);
        delay = (long) Math.min(grown, (double) maxDelayMillis);
      }

      if (jitter) {
        final var jitterAmount = (long) (delay * 0.25 * Math.random());
        delay += jitterAmount;
      }

      return delay;
    }
  }

  /**
   * Whether a provider failure is worth another read attempt. Conflicts are answers, not
   * failures, and everything outside the provider taxonomy is left alone.
   *
   * @param e failure to classify
   * @return true for retryable provider failures, timeouts included
   */
  public static boolean isRetryableRead(final RuntimeException e) {
    return e instanceof ProviderException && !(e instanceof SecretConflictException);
  }

  /**
   * Runs {@code op}, retrying retryable failures according to {@code policy}.
   *
   * @param op idempotent operation
   * @param shouldRetry decides whether a failure is retried
   * @param policy attempts and delays
   * @param <T> result type
   * @return operation result
   * @throws RuntimeException the last failure once attempts are exhausted or when not retryable
   */
  public static <T> T withPolicy(
      final Supplier<? extends T> op,
      final Predicate<RuntimeException> shouldRetry,
      final Policy policy) {
    var attempt = 0;
    while (true) {
      attempt++;
      try {
        return op.get();
      } catch (final RuntimeException e) {
        if (!shouldRetry.test(e)) throw e;

        if (attempt >= policy.maxAttempts()) {
          if (attempt > 1) LOGGER.log(WARNING, "All {0} retry attempts failed", attempt);
          throw e;
        }

        LOGGER.log(DEBUG, "Attempt {0} failed ({1}), retrying...", attempt, e.getMessage());
        sleep(policy.calculateDelay(attempt + 1), e);
      }
    }
  }

  private static void sleep(final long delayMillis, final RuntimeException pending) {
    if (delayMillis <= 0) return;
    try {
      Thread.sleep(delayMillis);
    } catch (final InterruptedException ie) {
      Thread.currentThread().interrupt();
      throw pending;
    }
  }
}
