package com.example.secretsmanager.core.model;

import java.util.Map;

/**
 * Input of {@code storeSecret}.
 *
 * @param path secret path
 * @param value plaintext value
 * @param requester principal performing the store
 * @param provider expected provider, null to route by path
 * @param tags tags, may be empty
 * @param description description, may be null
 * @param rotationPolicy rotation policy, may be null
 * @param accessPolicy secret-level access policy, may be null
 * @param skipEncryption store the value without encryption
 * @param options provider specific options passed through unchanged
 */
public record SecretRequest(
    String path,
    String value,
    String requester,
    ProviderType provider,
    Map<String, String> tags,
    String description,
    RotationPolicy rotationPolicy,
    AccessPolicy accessPolicy,
    boolean skipEncryption,
    Map<String, String> options) {

  public SecretRequest {
    tags = tags == null ? Map.of() : Map.copyOf(tags);
    options = options == null ? Map.of() : Map.copyOf(options);
  }

  public static Builder builder(final String path, final String value, final String requester) {
    return new Builder(path, value, requester);
  }

  @Override
  public String toString() {
    return "SecretRequest[path=%s, requester=%s, provider=%s]".formatted(path, requester, provider);
  }

  /** Fluent construction of a {@link SecretRequest}. */
  public static final class Builder {
    private final String path;
    private final String value;
    private final String requester;
    private ProviderType provider;
    private Map<String, String> tags = Map.of();
    private String description;
    private RotationPolicy rotationPolicy;
    private AccessPolicy accessPolicy;
    private boolean skipEncryption;
    private Map<String, String> options = Map.of();

    private Builder(final String path, final String value, final String requester) {
      this.path = path;
      this.value = value;
      this.requester = requester;
    }

    public Builder provider(final ProviderType provider) {
      this.provider = provider;
      return this;
    }

    public Builder tags(final Map<String, String> tags) {
      this.tags = tags;
      return this;
    }

    public Builder description(final String description) {
      this.description = description;
      return this;
    }

    public Builder rotationPolicy(final RotationPolicy rotationPolicy) {
      this.rotationPolicy = rotationPolicy;
      return this;
    }

    public Builder accessPolicy(final AccessPolicy accessPolicy) {
      this.accessPolicy = accessPolicy;
      return this;
    }

    public Builder skipEncryption(final boolean skipEncryption) {
      this.skipEncryption = skipEncryption;
      return this;
    }

    public Builder options(final Map<String, String> options) {
      this.options = options;
      return this;
    }

    public SecretRequest build() {
      return new SecretRequest(
          path,
          value,
          requester,
          provider,
          tags,
          description,
          rotationPolicy,
          accessPolicy,
          skipEncryption,
          options);
    }
  }
}
