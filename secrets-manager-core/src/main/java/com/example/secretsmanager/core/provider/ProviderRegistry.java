package com.example.secretsmanager.core.provider;

import com.example.secretsmanager.core.exception.ProviderException;
import com.example.secretsmanager.core.model.ProviderType;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/** Configured providers keyed by {@link ProviderType}, with path based resolution. */
public final class ProviderRegistry {

  private final Map<ProviderType, SecretProvider> providers;
  private final ProviderType defaultType;

  private ProviderRegistry(
      final Map<ProviderType, SecretProvider> providers, final ProviderType defaultType) {
    this.providers = Collections.unmodifiableMap(new EnumMap<>(providers));
    this.defaultType = defaultType;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Resolves the provider type for a path: an explicit {@code vault/}, {@code aws/} or {@code
   * azure/} prefix wins, otherwise the default.
   */
  public ProviderType resolveType(final String path) {
    return ProviderType.fromPathPrefix(path).orElse(defaultType);
  }

  /**
   * Resolves the provider serving {@code path}.
   *
   * @throws ProviderException if that provider is not configured
   */
  public SecretProvider resolve(final String path) {
    return get(resolveType(path));
  }

  /**
   * Returns the configured provider of the given type.
   *
   * @throws ProviderException if that provider is not configured
   */
  public SecretProvider get(final ProviderType type) {
    return find(type)
        .orElseThrow(() -> new ProviderException("Provider not configured: " + type.code()));
  }

  public Optional<SecretProvider> find(final ProviderType type) {
    return Optional.ofNullable(providers.get(type));
  }

  public ProviderType defaultType() {
    return defaultType;
  }

  public Set<ProviderType> types() {
    return providers.keySet();
  }

  public Collection<SecretProvider> all() {
    return providers.values();
  }

  /** Builder for {@link ProviderRegistry}. */
  public static final class Builder {
    private final Map<ProviderType, SecretProvider> providers = new EnumMap<>(ProviderType.class);
    private ProviderType defaultType;

    private Builder() {}

    /** Registers a provider under its own {@link SecretProvider#type()}. */
    public Builder register(final SecretProvider provider) {
      if (provider == null) throw new IllegalArgumentException("provider must not be null");
      return register(provider.type(), provider);
    }

    /** Registers a provider under an explicit slot. */
    public Builder register(final ProviderType type, final SecretProvider provider) {
      if (type == null || provider == null)
        throw new IllegalArgumentException("type and provider must not be null");
      providers.put(type, provider);
      return this;
    }

    public Builder defaultProvider(final ProviderType type) {
      this.defaultType = type;
      return this;
    }

    public ProviderRegistry build() {
      if (providers.isEmpty()) throw new IllegalStateException("at least one provider is required");
      final var resolvedDefault =
          Optional.ofNullable(defaultType)
              .orElseGet(() -> providers.keySet().iterator().next());
      if (!providers.containsKey(resolvedDefault))
        throw new IllegalStateException(
            "default provider " + resolvedDefault.code() + " is not registered");
      return new ProviderRegistry(providers, resolvedDefault);
    }
  }
}
