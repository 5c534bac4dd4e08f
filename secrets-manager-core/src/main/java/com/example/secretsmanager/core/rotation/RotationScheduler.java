package com.example.secretsmanager.core.rotation;

import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.ERROR;
import static java.lang.System.Logger.Level.INFO;
import static java.lang.System.Logger.Level.WARNING;

import com.example.secretsmanager.core.Retry.Policy;
import com.example.secretsmanager.core.exception.PolicyMissingException;
import com.example.secretsmanager.core.exception.SecretNotFoundException;
import com.example.secretsmanager.core.model.RotationPolicy;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * Drives automatic rotations.
 *
 * <p>One job per secret with an automatic policy is kept in a table. A single timer thread sweeps
 * the table every poll interval and hands due jobs to a small worker pool, so a slow provider never
 * stalls the sweep. A job already in flight is not dispatched again.
 *
 * <p>A failed rotation is retried after {@code retryBaseDelay * backoffMultiplier^(n-1)}, capped
 * at {@code retryMaxDelay}, up to {@code policy.maxRetries} times. When retries run out listeners
 * get {@link RotationListener#onRotationFailed} and the job moves to the next slot of its original
 * cadence.
 *
 * <pre>{@code
 * var scheduler = new RotationScheduler(Clock.systemUTC(), Duration.ofSeconds(60),
 *     Duration.ofMinutes(1), Duration.ofHours(1), 2);
 * scheduler.addListener(new RotationListener() {
 *   public void onRotationFailed(String secretId, int attempts, Throwable error) {
 *     alerting.page(secretId, error);
 *   }
 * });
 * scheduler.start(secretId -> manager.rotateSecret(secretId, "system"));
 * }</pre>
 */
public class RotationScheduler {

  private static final System.Logger LOGGER = System.getLogger(RotationScheduler.class.getName());

  private static final Duration DRAIN_TIMEOUT = Duration.ofSeconds(5);

  private final Clock clock;
  private final Duration pollInterval;
  private final Duration retryBaseDelay;
  private final Duration retryMaxDelay;
  private final int workerThreads;
  private final Map<String, RotationJob> jobs = new ConcurrentHashMap<>();
  private final Set<String> inFlight = ConcurrentHashMap.newKeySet();
  private final List<RotationListener> listeners = new CopyOnWriteArrayList<>();

  private volatile RotationHandler handler;
  private volatile Executor dispatcher;
  private ScheduledExecutorService timer;
  private ExecutorService workers;

  public RotationScheduler(
      final Clock clock,
      final Duration pollInterval,
      final Duration retryBaseDelay,
      final Duration retryMaxDelay,
      final int workerThreads) {
    if (pollInterval.isZero() || pollInterval.isNegative())
      throw new IllegalArgumentException("pollInterval must be positive");
    if (retryBaseDelay.isNegative())
      throw new IllegalArgumentException("retryBaseDelay must be >= 0");
    if (retryMaxDelay.compareTo(retryBaseDelay) < 0)
      throw new IllegalArgumentException("retryMaxDelay must be >= retryBaseDelay");
    if (workerThreads < 1) throw new IllegalArgumentException("workerThreads must be >= 1");
    this.clock = clock;
    this.pollInterval = pollInterval;
    this.retryBaseDelay = retryBaseDelay;
    this.retryMaxDelay = retryMaxDelay;
    this.workerThreads = workerThreads;
  }

  public void addListener(final RotationListener listener) {
    listeners.add(listener);
  }

  /**
   * Records or replaces the job of {@code secretId}. Automatic policies get a job due {@code
   * intervalDays} from now; any other policy removes the job.
   */
  public void scheduleRotation(final String secretId, final RotationPolicy policy) {
    if (policy == null || !policy.isAutomatic()) {
      cancelRotation(secretId);
      return;
    }
    final var job = RotationJob.first(secretId, policy, clock.instant());
    jobs.put(secretId, job);
    LOGGER.log(DEBUG, "Rotation of {0} scheduled for {1}", secretId, job.nextRunAt());
  }

  /**
   * Re-creates the job of a secret that existed before this scheduler, for example after a
   * restart. The cadence is anchored at {@code lastRotatedAt}, so a job whose slot passed while
   * nothing was running is due at once. An existing job is kept.
   *
   * @return true if a job was added
   */
  public boolean restoreRotation(
      final String secretId, final RotationPolicy policy, final Instant lastRotatedAt) {
    if (policy == null || !policy.isAutomatic()) return false;
    final var job = RotationJob.first(secretId, policy, lastRotatedAt);
    if (jobs.putIfAbsent(secretId, job) != null) return false;
    LOGGER.log(DEBUG, "Rotation of {0} restored, due {1}", secretId, job.nextRunAt());
    return true;
  }

  /** Removes the job of {@code secretId}; absent jobs are ignored. */
  public void cancelRotation(final String secretId) {
    if (jobs.remove(secretId) != null) LOGGER.log(DEBUG, "Rotation of {0} cancelled", secretId);
  }

  /** When the job of {@code secretId} runs next, including a pending retry. */
  public Optional<Instant> getNextRotationTime(final String secretId) {
    return Optional.ofNullable(jobs.get(secretId)).map(RotationJob::dueAt);
  }

  public Optional<RotationJob> job(final String secretId) {
    return Optional.ofNullable(jobs.get(secretId));
  }

  public int getScheduledRotationsCount() {
    return jobs.size();
  }

  public int getOverdueRotationsCount() {
    final var now = clock.instant();
    return (int) jobs.values().stream().filter(job -> job.isDue(now)).count();
  }

  /**
   * Starts the timer.
   *
   * @param rotationHandler performs due rotations
   * @throws IllegalStateException if already started
   */
  public synchronized void start(final RotationHandler rotationHandler) {
    if (timer != null) throw new IllegalStateException("RotationScheduler already started");
    this.handler = rotationHandler;
    this.workers = Executors.newFixedThreadPool(workerThreads, daemonThreads("secret-rotation-"));
    this.dispatcher = workers;
    this.timer =
        Executors.newSingleThreadScheduledExecutor(daemonThreads("secret-rotation-timer-"));
    final var millis = pollInterval.toMillis();
    timer.scheduleAtFixedRate(this::sweepSafely, millis, millis, TimeUnit.MILLISECONDS);
    LOGGER.log(INFO, "Rotation scheduler started, polling every {0}", pollInterval);
  }

  public synchronized boolean isRunning() {
    return timer != null && !timer.isShutdown();
  }

  /**
   * Halts the timer before returning. Rotations already running get a bounded time to finish and
   * are abandoned afterwards; a rotation commits fully or not at all.
   */
  public synchronized void stop() {
    if (timer == null) return;
    timer.shutdownNow();
    awaitQuietly(timer, DRAIN_TIMEOUT);
    workers.shutdown();
    if (!awaitQuietly(workers, DRAIN_TIMEOUT)) {
      LOGGER.log(WARNING, "Abandoning {0} in-flight rotations", inFlight.size());
      workers.shutdownNow();
    }
    timer = null;
    workers = null;
    dispatcher = null;
    LOGGER.log(INFO, "Rotation scheduler stopped");
  }

  private void sweepSafely() {
    try {
      sweep();
    } catch (final RuntimeException e) {
      LOGGER.log(ERROR, "Rotation sweep failed", e);
    }
  }

  /** Sends upcoming and overdue signals and dispatches due jobs. */
  void sweep() {
    final var now = clock.instant();
    for (final var listed : List.copyOf(jobs.values())) {
      var job = listed;
      if (job.inNoticeWindow(now)) {
        final var upcoming = job;
        job =
            signalOnce(
                job,
                job.withNotified(),
                l -> l.onRotationUpcoming(upcoming.secretId(), upcoming.nextRunAt()));
      }
      if (job.isOverdue(now, pollInterval)) {
        final var overdue = job;
        job =
            signalOnce(
                job,
                job.withOverdueNotified(),
                l -> l.onRotationOverdue(overdue.secretId(), overdue.dueAt()));
        if (job != overdue)
          LOGGER.log(
              WARNING,
              "Rotation of {0} overdue since {1}",
              overdue.secretId(),
              overdue.dueAt());
      }
      if (job.isDue(now) && inFlight.add(job.secretId())) dispatch(job);
    }
  }

  /** Swaps in {@code marked} and signals listeners, unless the job changed meanwhile. */
  private RotationJob signalOnce(
      final RotationJob job,
      final RotationJob marked,
      final Consumer<RotationListener> signal) {
    if (!jobs.replace(job.secretId(), job, marked)) return job;
    notifyListeners(signal);
    return marked;
  }

  /** Runs due jobs on the calling thread when {@link #sweep()} is invoked; no timer is started. */
  synchronized void runInline(final RotationHandler rotationHandler) {
    this.handler = rotationHandler;
    this.dispatcher = Runnable::run;
  }

  private void dispatch(final RotationJob job) {
    final var pool = dispatcher;
    if (pool == null) {
      inFlight.remove(job.secretId());
      return;
    }
    try {
      pool.execute(() -> runJob(job));
    } catch (final RejectedExecutionException e) {
      inFlight.remove(job.secretId());
      LOGGER.log(DEBUG, "Rotation of {0} not dispatched, scheduler stopping", job.secretId());
    }
  }

  void runJob(final RotationJob job) {
    final var secretId = job.secretId();
    try {
      final var result = handler.rotate(secretId);
      // The handler normally re-schedules; keep the cadence if it did not.
      jobs.replace(secretId, job, RotationJob.first(secretId, job.policy(), clock.instant()));
      LOGGER.log(INFO, "Rotated {0} to version {1}", secretId, result.newVersion());
      notifyListeners(l -> l.onRotationSucceeded(secretId, result));
    } catch (final SecretNotFoundException | PolicyMissingException e) {
      jobs.remove(secretId, job);
      LOGGER.log(WARNING, "Rotation of {0} dropped: {1}", secretId, e.getMessage());
      notifyListeners(l -> l.onRotationFailed(secretId, job.attempts() + 1, e));
    } catch (final RuntimeException e) {
      onFailure(job, e);
    } finally {
      inFlight.remove(secretId);
    }
  }

  private void onFailure(final RotationJob job, final RuntimeException error) {
    final var secretId = job.secretId();
    final var attempts = job.attempts() + 1;
    final var policy = job.policy();
    final var now = clock.instant();
    if (attempts > policy.maxRetries()) {
      final var next = job.nextCycle(now);
      jobs.replace(secretId, job, next);
      LOGGER.log(
          ERROR,
          "Rotation of {0} failed after {1} attempts, next attempt at {2}: {3}",
          secretId,
          attempts,
          next.nextRunAt(),
          error.getMessage());
      notifyListeners(l -> l.onRotationFailed(secretId, attempts, error));
      return;
    }
    final var retryAt = now.plusMillis(retryDelay(policy, attempts));
    jobs.replace(secretId, job, job.withRetry(attempts, retryAt));
    LOGGER.log(
        WARNING,
        "Rotation of {0} failed (attempt {1}), retrying at {2}: {3}",
        secretId,
        attempts,
        retryAt,
        error.getMessage());
    notifyListeners(l -> l.onRotationRetry(secretId, attempts, retryAt, error));
  }

  /** Delay before retry {@code retry} (1-based). */
  long retryDelay(final RotationPolicy policy, final int retry) {
    final var backoff =
        new Policy(
            policy.maxRetries() + 1,
            retryBaseDelay.toMillis(),
            retryMaxDelay.toMillis(),
            policy.backoffMultiplier(),
            false);
    return backoff.calculateDelay(retry + 1);
  }

  private void notifyListeners(final Consumer<RotationListener> signal) {
    for (final var listener : listeners) {
      try {
        signal.accept(listener);
      } catch (final RuntimeException e) {
        LOGGER.log(WARNING, "Rotation listener failed", e);
      }
    }
  }

  private static boolean awaitQuietly(final ExecutorService executor, final Duration timeout) {
    try {
      return executor.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS);
    } catch (final InterruptedException e) {
      executor.shutdownNow();
      Thread.currentThread().interrupt();
      return false;
    }
  }

  private static ThreadFactory daemonThreads(final String prefix) {
    final var counter = new AtomicInteger();
    return r -> {
      final var t = new Thread(r, prefix + counter.incrementAndGet());
      t.setDaemon(true);
      return t;
    };
  }
}
