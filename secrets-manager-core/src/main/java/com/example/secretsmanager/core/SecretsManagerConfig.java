package com.example.secretsmanager.core;

import com.example.secretsmanager.core.model.ProviderType;
import java.time.Duration;
import java.util.Optional;

/**
 * Settings of a {@link SecretsManager}.
 *
 * <p>{@link #fromSystemProperties()} resolves every option from a system property, then an
 * environment variable, then the default:
 *
 * <ul>
 *   <li>secrets.provider.default / SECRETS_PROVIDER_DEFAULT (vault)
 *   <li>secrets.encryption.enabled / SECRETS_ENCRYPTION_ENABLED (true)
 *   <li>secrets.cache.enabled / SECRETS_CACHE_ENABLED (true)
 *   <li>secrets.cache.ttl.seconds / SECRETS_CACHE_TTL_SECONDS (300)
 *   <li>secrets.cache.max.size / SECRETS_CACHE_MAX_SIZE (1000)
 *   <li>secrets.rotation.min.interval.days / SECRETS_ROTATION_MIN_INTERVAL_DAYS (1)
 *   <li>secrets.rotation.poll.seconds / SECRETS_ROTATION_POLL_SECONDS (60)
 *   <li>secrets.rotation.retry.base.millis / SECRETS_ROTATION_RETRY_BASE_MILLIS (60000)
 *   <li>secrets.rotation.retry.max.millis / SECRETS_ROTATION_RETRY_MAX_MILLIS (3600000)
 *   <li>secrets.rotation.workers / SECRETS_ROTATION_WORKERS (2)
 *   <li>secrets.audit.failure.threshold / SECRETS_AUDIT_FAILURE_THRESHOLD (3)
 *   <li>secrets.max.size / SECRETS_MAX_SIZE (65536 bytes)
 *   <li>secrets.provider.timeout.millis / SECRETS_PROVIDER_TIMEOUT_MILLIS (30000)
 *   <li>secrets.provider.read.attempts / SECRETS_PROVIDER_READ_ATTEMPTS (3)
 *   <li>secrets.provider.read.retry.millis / SECRETS_PROVIDER_READ_RETRY_MILLIS (200)
 * </ul>
 *
 * <p>Unparseable or non-positive numbers fall back to the default.
 */
public record SecretsManagerConfig(
    ProviderType defaultProvider,
    boolean encryptionEnabled,
    boolean cacheEnabled,
    Duration cacheTtl,
    long cacheMaxSize,
    int minRotationIntervalDays,
    Duration rotationPollInterval,
    Duration rotationRetryBaseDelay,
    Duration rotationRetryMaxDelay,
    int rotationWorkers,
    int auditFailureThreshold,
    int maxSecretSize,
    Duration providerTimeout,
    int readRetryAttempts,
    Duration readRetryDelay) {

  public SecretsManagerConfig {
    if (defaultProvider == null) throw new IllegalArgumentException("defaultProvider is required");
    if (cacheTtl.isNegative()) throw new IllegalArgumentException("cacheTtl must be >= 0");
    if (cacheMaxSize < 1) throw new IllegalArgumentException("cacheMaxSize must be >= 1");
    if (minRotationIntervalDays < 1)
      throw new IllegalArgumentException("minRotationIntervalDays must be >= 1");
    if (rotationPollInterval.isZero() || rotationPollInterval.isNegative())
      throw new IllegalArgumentException("rotationPollInterval must be positive");
    if (rotationRetryMaxDelay.compareTo(rotationRetryBaseDelay) < 0)
      throw new IllegalArgumentException("rotationRetryMaxDelay must be >= rotationRetryBaseDelay");
    if (rotationWorkers < 1) throw new IllegalArgumentException("rotationWorkers must be >= 1");
    if (auditFailureThreshold < 1)
      throw new IllegalArgumentException("auditFailureThreshold must be >= 1");
    if (maxSecretSize < 1) throw new IllegalArgumentException("maxSecretSize must be >= 1");
    if (providerTimeout.isZero() || providerTimeout.isNegative())
      throw new IllegalArgumentException("providerTimeout must be positive");
    if (readRetryAttempts < 1) throw new IllegalArgumentException("readRetryAttempts must be >= 1");
    if (readRetryDelay.isNegative())
      throw new IllegalArgumentException("readRetryDelay must be >= 0");
  }

  public static SecretsManagerConfig defaults() {
    return builder().build();
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Reads every option from system properties, then environment variables, then defaults. */
  public static SecretsManagerConfig fromSystemProperties() {
    final var defaults = defaults();
    return builder()
        .defaultProvider(
            setting("secrets.provider.default", "SECRETS_PROVIDER_DEFAULT")
                .flatMap(SecretsManagerConfig::parseProvider)
                .orElse(defaults.defaultProvider()))
        .encryptionEnabled(
            bool("secrets.encryption.enabled", "SECRETS_ENCRYPTION_ENABLED", true))
        .cacheEnabled(bool("secrets.cache.enabled", "SECRETS_CACHE_ENABLED", true))
        .cacheTtl(
            Duration.ofSeconds(
                number("secrets.cache.ttl.seconds", "SECRETS_CACHE_TTL_SECONDS", 300L)))
        .cacheMaxSize(number("secrets.cache.max.size", "SECRETS_CACHE_MAX_SIZE", 1_000L))
        .minRotationIntervalDays(
            (int)
                number(
                    "secrets.rotation.min.interval.days", "SECRETS_ROTATION_MIN_INTERVAL_DAYS", 1L))
        .rotationPollInterval(
            Duration.ofSeconds(
                number("secrets.rotation.poll.seconds", "SECRETS_ROTATION_POLL_SECONDS", 60L)))
        .rotationRetryBaseDelay(
            Duration.ofMillis(
                number(
                    "secrets.rotation.retry.base.millis",
                    "SECRETS_ROTATION_RETRY_BASE_MILLIS",
                    60_000L)))
        .rotationRetryMaxDelay(
            Duration.ofMillis(
                number(
                    "secrets.rotation.retry.max.millis",
                    "SECRETS_ROTATION_RETRY_MAX_MILLIS",
                    3_600_000L)))
        .rotationWorkers((int) number("secrets.rotation.workers", "SECRETS_ROTATION_WORKERS", 2L))
        .auditFailureThreshold(
            (int)
                number("secrets.audit.failure.threshold", "SECRETS_AUDIT_FAILURE_THRESHOLD", 3L))
        .maxSecretSize((int) number("secrets.max.size", "SECRETS_MAX_SIZE", 65_536L))
        .providerTimeout(
            Duration.ofMillis(
                number(
                    "secrets.provider.timeout.millis", "SECRETS_PROVIDER_TIMEOUT_MILLIS", 30_000L)))
        .readRetryAttempts(
            (int) number("secrets.provider.read.attempts", "SECRETS_PROVIDER_READ_ATTEMPTS", 3L))
        .readRetryDelay(
            Duration.ofMillis(
                number(
                    "secrets.provider.read.retry.millis",
                    "SECRETS_PROVIDER_READ_RETRY_MILLIS",
                    200L)))
        .build();
  }

  /** System property, else environment variable; blank values count as absent. */
  public static Optional<String> setting(final String property, final String env) {
    return Optional.ofNullable(System.getProperty(property))
        .or(() -> Optional.ofNullable(System.getenv(env)))
        .filter(val -> !val.isBlank())
        .map(String::trim);
  }

  /** Positive number from {@link #setting}, else {@code defaultValue}. */
  public static long number(final String property, final String env, final long defaultValue) {
    return setting(property, env)
        .flatMap(
            val -> {
              try {
                return Optional.of(Long.parseLong(val));
              } catch (final NumberFormatException e) {
                return Optional.empty();
              }
            })
        .filter(parsed -> parsed > 0)
        .orElse(defaultValue);
  }

  public static boolean bool(final String property, final String env, final boolean defaultValue) {
    return setting(property, env).map(Boolean::parseBoolean).orElse(defaultValue);
  }

  private static Optional<ProviderType> parseProvider(final String value) {
    try {
      return Optional.of(ProviderType.fromCode(value));
    } catch (final IllegalArgumentException e) {
      return Optional.empty();
    }
  }

  /** Builder for {@link SecretsManagerConfig}, pre-filled with the defaults. */
  public static final class Builder {
    private ProviderType defaultProvider = ProviderType.VAULT;
    private boolean encryptionEnabled = true;
    private boolean cacheEnabled = true;
    private Duration cacheTtl = Duration.ofSeconds(300);
    private long cacheMaxSize = 1_000L;
    private int minRotationIntervalDays = 1;
    private Duration rotationPollInterval = Duration.ofSeconds(60);
    private Duration rotationRetryBaseDelay = Duration.ofMinutes(1);
    private Duration rotationRetryMaxDelay = Duration.ofHours(1);
    private int rotationWorkers = 2;
    private int auditFailureThreshold = 3;
    private int maxSecretSize = 65_536;
    private Duration providerTimeout = Duration.ofSeconds(30);
    private int readRetryAttempts = 3;
    private Duration readRetryDelay = Duration.ofMillis(200);

    private Builder() {}

    public Builder defaultProvider(final ProviderType defaultProvider) {
      this.defaultProvider = defaultProvider;
      return this;
    }

    public Builder encryptionEnabled(final boolean encryptionEnabled) {
      this.encryptionEnabled = encryptionEnabled;
      return this;
    }

    public Builder cacheEnabled(final boolean cacheEnabled) {
      this.cacheEnabled = cacheEnabled;
      return this;
    }

    public Builder cacheTtl(final Duration cacheTtl) {
      this.cacheTtl = cacheTtl;
      return this;
    }

    public Builder cacheMaxSize(final long cacheMaxSize) {
      this.cacheMaxSize = cacheMaxSize;
      return this;
    }

    public Builder minRotationIntervalDays(final int minRotationIntervalDays) {
      this.minRotationIntervalDays = minRotationIntervalDays;
      return this;
    }

    public Builder rotationPollInterval(final Duration rotationPollInterval) {
      this.rotationPollInterval = rotationPollInterval;
      return this;
    }

    public Builder rotationRetryBaseDelay(final Duration rotationRetryBaseDelay) {
      this.rotationRetryBaseDelay = rotationRetryBaseDelay;
      return this;
    }

    public Builder rotationRetryMaxDelay(final Duration rotationRetryMaxDelay) {
      this.rotationRetryMaxDelay = rotationRetryMaxDelay;
      return this;
    }

    public Builder rotationWorkers(final int rotationWorkers) {
      this.rotationWorkers = rotationWorkers;
      return this;
    }

    public Builder auditFailureThreshold(final int auditFailureThreshold) {
      this.auditFailureThreshold = auditFailureThreshold;
      return this;
    }

    public Builder maxSecretSize(final int maxSecretSize) {
      this.maxSecretSize = maxSecretSize;
      return this;
    }

    public Builder providerTimeout(final Duration providerTimeout) {
      this.providerTimeout = providerTimeout;
      return this;
    }

    public Builder readRetryAttempts(final int readRetryAttempts) {
      this.readRetryAttempts = readRetryAttempts;
      return this;
    }

    public Builder readRetryDelay(final Duration readRetryDelay) {
      this.readRetryDelay = readRetryDelay;
      return this;
    }

    public SecretsManagerConfig build() {
      return new SecretsManagerConfig(
          defaultProvider,
          encryptionEnabled,
          cacheEnabled,
          cacheTtl,
          cacheMaxSize,
          minRotationIntervalDays,
          rotationPollInterval,
          rotationRetryBaseDelay,
          rotationRetryMaxDelay,
          rotationWorkers,
          auditFailureThreshold,
          maxSecretSize,
          providerTimeout,
          readRetryAttempts,
          readRetryDelay);
    }
  }
}
