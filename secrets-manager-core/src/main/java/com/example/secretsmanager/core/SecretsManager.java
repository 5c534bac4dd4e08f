package com.example.secretsmanager.core;

import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.INFO;
import static java.lang.System.Logger.Level.WARNING;

import com.example.secretsmanager.core.Retry.Policy;
import com.example.secretsmanager.core.access.AccessController;
import com.example.secretsmanager.core.audit.AuditEvent;
import com.example.secretsmanager.core.audit.AuditEventType;
import com.example.secretsmanager.core.audit.AuditLogger;
import com.example.secretsmanager.core.audit.AuditSink;
import com.example.secretsmanager.core.audit.LoggingAuditSink;
import com.example.secretsmanager.core.cache.SecretCache;
import com.example.secretsmanager.core.crypto.EncryptionService;
import com.example.secretsmanager.core.exception.EncryptionException;
import com.example.secretsmanager.core.exception.PolicyMissingException;
import com.example.secretsmanager.core.exception.ProviderException;
import com.example.secretsmanager.core.exception.ProviderTimeoutException;
import com.example.secretsmanager.core.exception.SecretNotFoundException;
import com.example.secretsmanager.core.exception.SecretsException;
import com.example.secretsmanager.core.exception.ValidationException;
import com.example.secretsmanager.core.model.AccessPolicy;
import com.example.secretsmanager.core.model.Action;
import com.example.secretsmanager.core.model.ListFilter;
import com.example.secretsmanager.core.model.ListResult;
import com.example.secretsmanager.core.model.ProviderType;
import com.example.secretsmanager.core.model.RotationResult;
import com.example.secretsmanager.core.model.Secret;
import com.example.secretsmanager.core.model.SecretMetadata;
import com.example.secretsmanager.core.model.SecretRequest;
import com.example.secretsmanager.core.model.SecretResponse;
import com.example.secretsmanager.core.model.UpdateOptions;
import com.example.secretsmanager.core.provider.ProviderRegistry;
import com.example.secretsmanager.core.provider.SecretProvider;
import com.example.secretsmanager.core.rotation.RotationListener;
import com.example.secretsmanager.core.rotation.RotationScheduler;
import com.example.secretsmanager.core.rotation.SecretValueGenerator;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import java.util.regex.Pattern;

/**
 * Stores, reads, updates, rotates and deletes secrets across the configured providers.
 *
 * <p>Every operation passes the {@link AccessController}, is bounded by the provider timeout and is
 * audited on success and on failure. Values are encrypted before they reach a provider and
 * decrypted values are cached for a bounded time; every mutation invalidates the cached entries of
 * its path before returning. Mutations of the same path are serialized, and providers additionally
 * check the expected previous version on update, so versions never collide or skip.
 *
 * <h2>Basic Usage</h2>
 *
 * <pre>{@code
 * var manager = SecretsManager.builder()
 *     .config(SecretsManagerConfig.fromSystemProperties())
 *     .provider(new VaultSecretProvider(VaultSettings.fromSystemProperties()))
 *     .policy(AccessPolicy.forRoles("database/*", Set.of("dba"), Action.READ, Action.WRITE))
 *     .roles("alice", Set.of("dba"))
 *     .build();
 *
 * manager.storeSecret(
 *     SecretRequest.builder("database/production/main", "s3cr3t", "alice").build());
 * var secret = manager.getSecret("database/production/main", "alice");
 * }</pre>
 *
 * <h2>Automatic Rotation</h2>
 *
 * <pre>{@code
 * manager.storeSecret(
 *     SecretRequest.builder("api-keys/github", "ghp_test123", "alice")
 *         .rotationPolicy(RotationPolicy.automatic(30, GenerationType.API_KEY))
 *         .build());
 * }</pre>
 *
 * <p>The scheduler rotates as the {@value AccessController#SYSTEM_PRINCIPAL} principal, which
 * needs an explicit {@code rotate} grant.
 */
public final class SecretsManager implements AutoCloseable {

  private static final System.Logger LOGGER = System.getLogger(SecretsManager.class.getName());

  private static final Pattern PATH_PATTERN = Pattern.compile("^[a-zA-Z0-9/_-]+$");
  private static final String ROOT_SCOPE = "/";
  private static final int LOCK_STRIPES = 64;

  private final SecretsManagerConfig config;
  private final ProviderRegistry providers;
  private final EncryptionService encryption;
  private final AccessController access;
  private final AuditLogger audit;
  private final SecretCache cache;
  private final RotationScheduler scheduler;
  private final SecretValueGenerator generator;
  private final Clock clock;
  private final ExecutorService providerExecutor;
  private final Policy readPolicy;
  private final ReentrantLock[] pathLocks = new ReentrantLock[LOCK_STRIPES];
  private final AtomicBoolean closed = new AtomicBoolean(false);

  private SecretsManager(final Builder builder, final ProviderRegistry providers) {
    this.config = builder.config;
    this.providers = providers;
    this.clock = builder.clock;
    this.audit =
        builder.auditLogger != null
            ? builder.auditLogger
            : new AuditLogger(builder.auditSink, config.auditFailureThreshold());
    this.access = new AccessController(builder.policies, builder.roles, audit, clock);
    this.encryption =
        config.encryptionEnabled()
            ? (builder.encryption != null
                ? builder.encryption
                : EncryptionService.fromSystemProperties())
            : builder.encryption;
    this.cache = config.cacheEnabled() ? new SecretCache(config.cacheMaxSize()) : null;
    if (cache != null && encryption != null) encryption.addListener(cache);
    this.generator = new SecretValueGenerator(builder.generators);
    this.scheduler =
        builder.scheduler != null
            ? builder.scheduler
            : new RotationScheduler(
                clock,
                config.rotationPollInterval(),
                config.rotationRetryBaseDelay(),
                config.rotationRetryMaxDelay(),
                config.rotationWorkers());
    builder.rotationListeners.forEach(scheduler::addListener);
    for (int i = 0; i < LOCK_STRIPES; i++) pathLocks[i] = new ReentrantLock();

    final var threads = new AtomicInteger();
    this.providerExecutor =
        Executors.newCachedThreadPool(
            r -> {
              final var t = new Thread(r, "secrets-provider-" + threads.incrementAndGet());
              t.setDaemon(true);
              return t;
            });
    final var retryDelay = config.readRetryDelay().toMillis();
    this.readPolicy =
        new Policy(config.readRetryAttempts(), retryDelay, retryDelay * 8, 2.0, false);

    if (builder.startScheduler) {
      restoreState();
      scheduler.start(secretId -> rotateSecret(secretId, AccessController.SYSTEM_PRINCIPAL));
    }
    LOGGER.log(
        INFO,
        "SecretsManager ready: providers={0}, default={1}, encryption={2}, cache={3}",
        providers.types(),
        providers.defaultType().code(),
        encryption != null,
        cache != null);
  }

  /**
   * Creates a new builder instance.
   *
   * @return new builder
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * Creates a secret at version 1.
   *
   * @param request path, value, requester and optional policies
   * @return id and version of the new secret
   * @throws ValidationException on malformed input or a provider that does not serve the path
   * @throws com.example.secretsmanager.core.exception.AccessDeniedException without write access
   * @throws ProviderException when the provider fails, including an existing secret at the path
   */
  public SecretResponse storeSecret(final SecretRequest request) {
    final var started = System.nanoTime();
    final var path = request == null ? null : request.path();
    final var requester = request == null ? null : request.requester();
    try {
      ensureOpen();
      if (request == null) throw new ValidationException("Secret request is required");
      validatePath(path);
      validateValue(request.value());
      validateRequester(requester);
      if (request.rotationPolicy() != null)
        request.rotationPolicy().validate(config.minRotationIntervalDays());
      access.checkAccess(requester, Action.WRITE, path);

      final var type = providers.resolveType(path);
      if (request.provider() != null && request.provider() != type)
        throw new ValidationException(
            "Path %s is served by provider %s, not %s"
                .formatted(path, type.code(), request.provider().code()));
      final var provider = providers.get(type);

      final var lock = lockFor(path);
      lock.lock();
      try {
        final var encrypt = encryption != null && !request.skipEncryption();
        final var stored = encrypt ? encryption.encrypt(request.value()) : request.value();
        final var metadata = SecretMetadata.initial(request, type, encrypt, clock.instant());
        final var result =
            write(
                path,
                "storeSecret",
                () -> provider.storeSecret(path, stored, metadata, request.options()));

        if (request.accessPolicy() != null)
          access.registerSecretPolicy(path, request.accessPolicy());
        if (request.rotationPolicy() != null)
          scheduler.scheduleRotation(result.id(), request.rotationPolicy());

        auditSuccess(
            AuditEventType.SECRET_STORED,
            path,
            requester,
            details(
                "secretId", result.id(),
                "version", result.version(),
                "provider", type.code(),
                "encrypted", encrypt),
            started);
        LOGGER.log(INFO, "Stored secret {0} in {1}", path, type.code());
        return SecretResponse.of(result.id(), metadata);
      } finally {
        lock.unlock();
      }
    } catch (final RuntimeException e) {
      auditFailure(AuditEventType.SECRET_STORE_FAILED, path, requester, e, started);
      throw e;
    }
  }

  /** Reads the latest version of a secret. */
  public Secret getSecret(final String path, final String requester) {
    return getSecret(path, requester, null);
  }

  /**
   * Reads a secret, serving from the cache while the cached entry is fresh.
   *
   * @param path secret path
   * @param requester principal reading
   * @param version version to read, null for the latest
   * @return the decrypted secret with its decrypted history
   * @throws SecretNotFoundException if the path or version does not exist
   * @throws EncryptionException if a stored value fails authentication
   */
  public Secret getSecret(final String path, final String requester, final Integer version) {
    final var started = System.nanoTime();
    try {
      ensureOpen();
      validatePath(path);
      validateRequester(requester);
      if (version != null && version < 1)
        throw new ValidationException("Version must be >= 1, got " + version);
      access.checkAccess(requester, Action.READ, path);

      final var key = SecretCache.key(path, version);
      if (cache != null) {
        final var cached = cache.get(key);
        if (cached.isPresent()) {
          auditSuccess(
              AuditEventType.SECRET_ACCESSED,
              path,
              requester,
              details("source", "cache", "version", cached.get().metadata().version()),
              started);
          return cached.get();
        }
      }

      final var provider = providers.resolve(path);
      final var stamp = cache != null ? cache.stamp() : 0L;
      final var raw = read("getSecret", () -> provider.getSecret(path, version));
      final var secret = decrypt(raw);
      if (cache != null) cache.put(key, secret, config.cacheTtl(), stamp);

      auditSuccess(
          AuditEventType.SECRET_ACCESSED,
          path,
          requester,
          details(
              "source", "provider",
              "version", version != null ? version : secret.metadata().version()),
          started);
      return secret;
    } catch (final RuntimeException e) {
      auditFailure(AuditEventType.SECRET_ACCESS_FAILED, path, requester, e, started);
      throw e;
    }
  }

  /** Writes a new version without metadata changes. */
  public SecretResponse updateSecret(
      final String path, final String newValue, final String requester) {
    return updateSecret(path, newValue, requester, UpdateOptions.none());
  }

  /**
   * Writes {@code newValue} as the next version.
   *
   * @param path secret path
   * @param newValue new plaintext value
   * @param requester principal writing
   * @param options description and tags to apply, may be null
   * @return the new version
   * @throws SecretNotFoundException if no secret exists at {@code path}
   * @throws com.example.secretsmanager.core.exception.SecretConflictException if another writer
   *     committed first
   */
  public SecretResponse updateSecret(
      final String path,
      final String newValue,
      final String requester,
      final UpdateOptions options) {
    final var started = System.nanoTime();
    try {
      ensureOpen();
      validatePath(path);
      validateValue(newValue);
      validateRequester(requester);
      access.checkAccess(requester, Action.WRITE, path);

      final var response = writeNextVersion(path, newValue, requester, options, null);
      auditSuccess(
          AuditEventType.SECRET_UPDATED,
          path,
          requester,
          details("secretId", response.secretId(), "version", response.version()),
          started);
      return response;
    } catch (final RuntimeException e) {
      auditFailure(AuditEventType.SECRET_UPDATE_FAILED, path, requester, e, started);
      throw e;
    }
  }

  /**
   * Deletes a secret with its history and cancels its rotation.
   *
   * @throws SecretNotFoundException if no secret exists at {@code path}
   */
  public void deleteSecret(final String path, final String requester) {
    final var started = System.nanoTime();
    try {
      ensureOpen();
      validatePath(path);
      validateRequester(requester);
      access.checkAccess(requester, Action.DELETE, path);

      final var provider = providers.resolve(path);
      final var lock = lockFor(path);
      lock.lock();
      try {
        final var existing = read("getSecret", () -> provider.getSecret(path, null));
        write(
            path,
            "deleteSecret",
            () -> {
              provider.deleteSecret(path);
              return null;
            });
        scheduler.cancelRotation(existing.id());
        access.removeSecretPolicy(path);

        auditSuccess(
            AuditEventType.SECRET_DELETED,
            path,
            requester,
            details("secretId", existing.id(), "version", existing.metadata().version()),
            started);
        LOGGER.log(INFO, "Deleted secret {0}", path);
      } finally {
        lock.unlock();
      }
    } catch (final RuntimeException e) {
      auditFailure(AuditEventType.SECRET_DELETE_FAILED, path, requester, e, started);
      throw e;
    }
  }

  /**
   * Replaces the value of a secret with one generated from its rotation policy and re-schedules
   * the next rotation.
   *
   * @param secretId id returned by {@link #storeSecret}
   * @param requester principal rotating, {@value AccessController#SYSTEM_PRINCIPAL} for the
   *     scheduler
   * @return old and new version with the generated value
   * @throws SecretNotFoundException if no provider knows the id
   * @throws PolicyMissingException if the secret has no rotation policy
   * @throws com.example.secretsmanager.core.exception.UnsupportedGenerationException for
   *     certificates and unknown custom generators
   */
  public RotationResult rotateSecret(final String secretId, final String requester) {
    final var started = System.nanoTime();
    String path = null;
    try {
      ensureOpen();
      if (secretId == null || secretId.isBlank())
        throw new ValidationException("Secret id is required");
      validateRequester(requester);

      final var secret = findById(secretId);
      path = secret.path();
      access.checkAccess(requester, Action.ROTATE, path);
      final var policy = secret.metadata().rotationPolicy();
      if (policy == null) throw new PolicyMissingException(path);

      final var lock = lockFor(path);
      lock.lock();
      try {
        final var newValue = generator.generate(policy);
        final var rotatedAt = clock.instant();
        final var response =
            writeNextVersion(
                path,
                newValue,
                requester,
                UpdateOptions.description("Rotated on " + rotatedAt),
                secretId);
        scheduler.scheduleRotation(secretId, policy);
        final var nextRotation = scheduler.getNextRotationTime(secretId).orElse(null);
        final var result =
            new RotationResult(
                secretId,
                path,
                response.version() - 1,
                response.version(),
                newValue,
                rotatedAt,
                nextRotation);

        auditSuccess(
            AuditEventType.SECRET_ROTATED,
            path,
            requester,
            details(
                "secretId", secretId,
                "oldVersion", result.oldVersion(),
                "newVersion", result.newVersion(),
                "generationType", policy.generationType().code()),
            started);
        LOGGER.log(INFO, "Rotated secret {0} to version {1}", path, result.newVersion());
        return result;
      } finally {
        lock.unlock();
      }
    } catch (final RuntimeException e) {
      auditFailure(
          AuditEventType.SECRET_ROTATION_FAILED,
          path != null ? path : secretId,
          requester,
          e,
          started);
      throw e;
    }
  }

  /**
   * Lists the metadata of secrets the requester can read. Items the requester cannot read are
   * left out silently; paging applies after that filter.
   *
   * @param requester principal listing, needs {@code list} on the prefix
   * @param filter prefix, tags, provider and paging; null lists everything
   * @return one page of accessible secrets
   */
  public ListResult listSecrets(final String requester, final ListFilter filter) {
    final var started = System.nanoTime();
    final var effective = filter != null ? filter : ListFilter.all();
    final var prefix = effective.prefix();
    final var scope = prefix == null || prefix.isBlank() ? ROOT_SCOPE : prefix;
    try {
      ensureOpen();
      validateRequester(requester);
      access.checkAccess(requester, Action.LIST, scope);

      final Collection<SecretProvider> targets =
          effective.provider() != null
              ? List.of(providers.get(effective.provider()))
              : providers.all();
      final var visible = new ArrayList<SecretMetadata>();
      for (final var provider : targets) {
        final var listed =
            read(
                "listSecrets",
                () -> provider.listSecrets(prefix, effective.tags(), Integer.MAX_VALUE, 0));
        listed.secrets().stream()
            .filter(m -> prefix == null || m.path().startsWith(prefix))
            .filter(m -> m.hasTags(effective.tags()))
            .filter(m -> access.evaluate(requester, Action.READ, m.path()).allowed())
            .forEach(visible::add);
      }
      visible.sort(Comparator.comparing(SecretMetadata::path));

      final var total = visible.size();
      final var page = visible.stream().skip(effective.offset()).limit(effective.limit()).toList();
      final var hasMore = effective.offset() + page.size() < total;

      auditSuccess(
          AuditEventType.SECRETS_LISTED,
          scope,
          requester,
          details("count", page.size(), "total", total),
          started);
      return new ListResult(page, total, hasMore);
    } catch (final RuntimeException e) {
      auditFailure(AuditEventType.SECRETS_LIST_FAILED, scope, requester, e, started);
      throw e;
    }
  }

  /** Checks every provider and reports audit health. */
  public HealthReport healthCheck() {
    final var results = new EnumMap<ProviderType, HealthReport.ProviderHealth>(ProviderType.class);
    for (final var type : providers.types()) {
      final var provider = providers.get(type);
      final var started = System.nanoTime();
      HealthReport.ProviderHealth health;
      try {
        call(
            "healthCheck",
            () -> {
              provider.healthCheck();
              return null;
            });
        health = new HealthReport.ProviderHealth(true, elapsedMillis(started), null);
      } catch (final SecretsException e) {
        LOGGER.log(WARNING, "Provider {0} unhealthy: {1}", type.code(), e.getMessage());
        health = new HealthReport.ProviderHealth(false, elapsedMillis(started), e.getMessage());
      }
      results.put(type, health);
    }
    final var providersHealthy =
        results.values().stream().allMatch(HealthReport.ProviderHealth::healthy);
    return new HealthReport(
        providersHealthy && audit.isHealthy(),
        results,
        audit.isHealthy(),
        audit.pendingCount(),
        clock.instant());
  }

  public SecretsManagerStats getStats() {
    return new SecretsManagerStats(
        cache != null ? cache.size() : 0L,
        cache != null ? cache.hitCount() : 0L,
        cache != null ? cache.missCount() : 0L,
        cache != null ? cache.hitRate() : 0.0,
        providers.types(),
        scheduler.getScheduledRotationsCount(),
        scheduler.getOverdueRotationsCount(),
        audit.pendingCount(),
        audit.isHealthy());
  }

  /**
   * Installs a new data key. Existing ciphertext stays readable; the cache is flushed.
   *
   * @return id of the new key
   * @throws IllegalStateException if encryption is disabled
   */
  public String rotateEncryptionKey() {
    ensureOpen();
    if (encryption == null) throw new IllegalStateException("Encryption is disabled");
    return encryption.rotateKey();
  }

  /**
   * Registers the secret-level access policies stored in provider metadata, for example after a
   * restart.
   *
   * @return number of registered policies
   */
  public int reloadSecretPolicies() {
    ensureOpen();
    var count = 0;
    for (final var provider : providers.all()) {
      final var listed =
          read("listSecrets", () -> provider.listSecrets(null, Map.of(), Integer.MAX_VALUE, 0));
      for (final var metadata : listed.secrets()) {
        if (metadata.accessPolicy() == null) continue;
        access.registerSecretPolicy(metadata.path(), metadata.accessPolicy());
        count++;
      }
    }
    LOGGER.log(DEBUG, "Registered {0} secret-level access policies", count);
    return count;
  }

  /**
   * Restores the rotation jobs of stored secrets with an automatic policy, for example after a
   * restart. Each cadence continues from the last write of the secret; secrets that already have
   * a job are left alone.
   *
   * @return number of restored jobs
   */
  public int reloadRotationSchedules() {
    ensureOpen();
    var count = 0;
    for (final var provider : providers.all()) {
      final var listed =
          read("listSecrets", () -> provider.listSecrets(null, Map.of(), Integer.MAX_VALUE, 0));
      for (final var metadata : listed.secrets()) {
        final var policy = metadata.rotationPolicy();
        if (policy == null || !policy.isAutomatic()) continue;
        final Secret secret;
        try {
          secret = read("getSecret", () -> provider.getSecret(metadata.path(), null));
        } catch (final SecretNotFoundException e) {
          LOGGER.log(DEBUG, "Secret {0} vanished while restoring schedules", metadata.path());
          continue;
        }
        final var anchor =
            metadata.updatedAt() != null ? metadata.updatedAt() : metadata.createdAt();
        if (scheduler.restoreRotation(secret.id(), policy, anchor)) count++;
      }
    }
    LOGGER.log(INFO, "Restored {0} rotation schedules", count);
    return count;
  }

  /** The scheduler driving automatic rotations. */
  public RotationScheduler scheduler() {
    return scheduler;
  }

  public AccessController accessController() {
    return access;
  }

  public SecretsManagerConfig config() {
    return config;
  }

  /**
   * Stops the scheduler, releases the providers and clears the cache. Idempotent.
   *
   * <p>The timer is halted before this method returns; in-flight rotations get a bounded time to
   * finish.
   */
  public void shutdown() {
    if (!closed.compareAndSet(false, true)) return;
    scheduler.stop();
    providerExecutor.shutdown();
    try {
      if (!providerExecutor.awaitTermination(5, TimeUnit.SECONDS))
        providerExecutor.shutdownNow();
    } catch (final InterruptedException e) {
      providerExecutor.shutdownNow();
      Thread.currentThread().interrupt();
    }
    for (final var provider : providers.all()) {
      try {
        provider.close();
      } catch (final RuntimeException e) {
        LOGGER.log(WARNING, "Failed to close provider " + provider.type().code(), e);
      }
    }
    if (cache != null) cache.clear();
    audit.close();
    LOGGER.log(INFO, "SecretsManager shut down");
  }

  @Override
  public void close() {
    shutdown();
  }

  private SecretResponse writeNextVersion(
      final String path,
      final String newValue,
      final String requester,
      final UpdateOptions options,
      final String expectedId) {
    final var provider = providers.resolve(path);
    final var lock = lockFor(path);
    lock.lock();
    try {
      final var existing = read("getSecret", () -> provider.getSecret(path, null));
      if (expectedId != null && !expectedId.equals(existing.id()))
        throw SecretNotFoundException.forId(expectedId);
      final var current = existing.metadata();
      final var stored =
          current.encrypted() ? requireEncryption().encrypt(newValue) : newValue;
      final var next = current.nextVersion(options, requester, clock.instant());
      write(
          path,
          "updateSecret",
          () -> {
            provider.updateSecret(path, stored, next, next.version());
            return null;
          });
      LOGGER.log(DEBUG, "Secret {0} now at version {1}", path, next.version());
      return SecretResponse.of(existing.id(), next);
    } finally {
      lock.unlock();
    }
  }

  /** Reloads secret policies and rotation jobs; an unreachable provider only logs a warning. */
  private void restoreState() {
    try {
      reloadSecretPolicies();
      reloadRotationSchedules();
    } catch (final SecretsException e) {
      LOGGER.log(WARNING, "Could not restore state from providers: {0}", e.getMessage());
    }
  }

  private Secret findById(final String secretId) {
    for (final var provider : providers.all()) {
      final var found = read("getSecretById", () -> provider.getSecretById(secretId));
      if (found.isPresent()) return found.get();
    }
    throw SecretNotFoundException.forId(secretId);
  }

  private Secret decrypt(final Secret raw) {
    if (!raw.metadata().encrypted()) return raw;
    final var service = requireEncryption();
    final var versions = raw.versions().stream().map(v -> v.withValue(service.decrypt(v.value())));
    return raw.withValues(service.decrypt(raw.value()), versions.toList());
  }

  private EncryptionService requireEncryption() {
    if (encryption == null)
      throw new EncryptionException("Secret is encrypted but no encryption key is configured");
    return encryption;
  }

  private void invalidate(final String path) {
    if (cache != null) cache.invalidate(path);
  }

  /**
   * Runs a provider write through {@link #call} and invalidates {@code path} whatever the outcome.
   * The provider thread invalidates again once the write ends, since a write the caller stopped
   * waiting for may still commit.
   */
  private <T> T write(final String path, final String operation, final Supplier<T> op) {
    try {
      return call(
          operation,
          () -> {
            try {
              return op.get();
            } finally {
              invalidate(path);
            }
          });
    } finally {
      invalidate(path);
    }
  }

  /** Idempotent provider read: bounded by the timeout and retried on provider failures. */
  private <T> T read(final String operation, final Supplier<T> op) {
    return Retry.withPolicy(() -> call(operation, op), Retry::isRetryableRead, readPolicy);
  }

  /** Runs a provider call on the provider executor, bounded by the configured timeout. */
  private <T> T call(final String operation, final Supplier<T> op) {
    final var timeout = config.providerTimeout();
    final var future = providerExecutor.submit(op::get);
    try {
      return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
    } catch (final TimeoutException e) {
      future.cancel(true);
      LOGGER.log(WARNING, "Provider call {0} timed out after {1}", operation, timeout);
      throw new ProviderTimeoutException(operation, timeout);
    } catch (final ExecutionException e) {
      final var cause = e.getCause();
      if (cause instanceof SecretsException se) throw se;
      if (cause instanceof Error error) throw error;
      throw new ProviderException(
          "Provider call %s failed: %s".formatted(operation, cause.getMessage()), cause);
    } catch (final InterruptedException e) {
      future.cancel(true);
      Thread.currentThread().interrupt();
      throw new ProviderException("Interrupted while waiting for provider call " + operation, e);
    }
  }

  private ReentrantLock lockFor(final String path) {
    return pathLocks[Math.floorMod(path.hashCode(), LOCK_STRIPES)];
  }

  private void ensureOpen() {
    if (closed.get()) throw new IllegalStateException("SecretsManager is shut down");
  }

  private void validatePath(final String path) {
    if (path == null || path.isBlank()) throw new ValidationException("Secret path is required");
    if (!PATH_PATTERN.matcher(path).matches())
      throw new ValidationException("Invalid secret path format: " + path);
    if (path.startsWith("/") || path.endsWith("/"))
      throw new ValidationException("Secret path must not start or end with '/': " + path);
    if (path.contains("..") || path.contains("//"))
      throw new ValidationException("Secret path contains an empty or relative segment: " + path);
  }

  private void validateValue(final String value) {
    if (value == null || value.isEmpty()) throw new ValidationException("Secret value is required");
    final var size = value.getBytes(StandardCharsets.UTF_8).length;
    if (size > config.maxSecretSize())
      throw new ValidationException(
          "Secret exceeds maximum size of %d bytes".formatted(config.maxSecretSize()));
  }

  private static void validateRequester(final String requester) {
    if (requester == null || requester.isBlank())
      throw new ValidationException("Requester is required");
  }

  private void auditSuccess(
      final AuditEventType type,
      final String path,
      final String requester,
      final Map<String, Object> metadata,
      final long startedNanos) {
    audit.logEvent(
        AuditEvent.success(
            type, path, requester, clock.instant(), metadata, elapsedMillis(startedNanos)));
  }

  private void auditFailure(
      final AuditEventType type,
      final String path,
      final String requester,
      final RuntimeException error,
      final long startedNanos) {
    audit.logEvent(
        AuditEvent.failure(
            type,
            path,
            requester,
            clock.instant(),
            details("errorType", error.getClass().getSimpleName()),
            error.getMessage(),
            elapsedMillis(startedNanos)));
  }

  private static long elapsedMillis(final long startedNanos) {
    return Duration.ofNanos(System.nanoTime() - startedNanos).toMillis();
  }

  private static Map<String, Object> details(final Object... keyValues) {
    final var map = new LinkedHashMap<String, Object>();
    for (int i = 0; i + 1 < keyValues.length; i += 2)
      map.put(String.valueOf(keyValues[i]), keyValues[i + 1]);
    return map;
  }

  /**
   * Builder for {@link SecretsManager}.
   *
   * <p>At least one provider is required. With encryption enabled and no {@link EncryptionService}
   * given, the key is read from {@code secrets.encryption.key} / {@code SECRETS_ENCRYPTION_KEY}.
   */
  public static final class Builder {
    private SecretsManagerConfig config = SecretsManagerConfig.defaults();
    private final Map<ProviderType, SecretProvider> providerMap = new EnumMap<>(ProviderType.class);
    private EncryptionService encryption;
    private final List<AccessPolicy> policies = new ArrayList<>();
    private final Map<String, Set<String>> roles = new HashMap<>();
    private AuditSink auditSink = new LoggingAuditSink();
    private AuditLogger auditLogger;
    private Clock clock = Clock.systemUTC();
    private final Map<String, Supplier<String>> generators = new HashMap<>();
    private final List<RotationListener> rotationListeners = new ArrayList<>();
    private RotationScheduler scheduler;
    private boolean startScheduler = true;

    private Builder() {}

    public Builder config(final SecretsManagerConfig config) {
      this.config = config;
      return this;
    }

    /** Registers a provider under its own type. */
    public Builder provider(final SecretProvider provider) {
      return provider(provider.type(), provider);
    }

    public Builder provider(final ProviderType type, final SecretProvider provider) {
      providerMap.put(type, provider);
      return this;
    }

    public Builder encryptionService(final EncryptionService encryption) {
      this.encryption = encryption;
      return this;
    }

    public Builder policy(final AccessPolicy policy) {
      policies.add(policy);
      return this;
    }

    public Builder policies(final Collection<AccessPolicy> accessPolicies) {
      policies.addAll(accessPolicies);
      return this;
    }

    public Builder roles(final String principal, final Set<String> principalRoles) {
      roles.put(principal, Set.copyOf(principalRoles));
      return this;
    }

    /** Destination of audit records. Default: the {@code secrets.audit} logger. */
    public Builder auditSink(final AuditSink auditSink) {
      this.auditSink = auditSink;
      return this;
    }

    /** Uses a preconfigured audit logger; overrides {@link #auditSink}. */
    public Builder auditLogger(final AuditLogger auditLogger) {
      this.auditLogger = auditLogger;
      return this;
    }

    public Builder clock(final Clock clock) {
      this.clock = clock;
      return this;
    }

    /** Registers a generator for {@code custom} rotation policies naming it. */
    public Builder generator(final String name, final Supplier<String> generator) {
      generators.put(name, generator);
      return this;
    }

    public Builder rotationListener(final RotationListener listener) {
      rotationListeners.add(listener);
      return this;
    }

    public Builder scheduler(final RotationScheduler scheduler) {
      this.scheduler = scheduler;
      return this;
    }

    /**
     * Whether {@link #build()} starts the rotation timer.
     *
     * <p>Default: true
     */
    public Builder startScheduler(final boolean startScheduler) {
      this.startScheduler = startScheduler;
      return this;
    }

    /**
     * Builds the SecretsManager instance.
     *
     * @return configured instance
     * @throws IllegalStateException if no provider is registered, the default provider is missing
     *     or encryption is enabled without a usable key
     */
    public SecretsManager build() {
      if (config == null) throw new IllegalStateException("config is required");
      if (clock == null) throw new IllegalStateException("clock is required");
      if (auditSink == null && auditLogger == null)
        throw new IllegalStateException("auditSink is required");
      final var registry = ProviderRegistry.builder();
      providerMap.forEach(registry::register);
      registry.defaultProvider(config.defaultProvider());
      return new SecretsManager(this, registry.build());
    }
  }
}
