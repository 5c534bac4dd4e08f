package com.example.secretsmanager.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * The closed set of backend kinds a secret can live in. Each kind owns a path prefix that selects
 * it explicitly.
 */
public enum ProviderType {
  VAULT("vault"),
  AWS("aws"),
  AZURE("azure");

  private final String code;

  ProviderType(final String code) {
    this.code = code;
  }

  @JsonValue
  public String code() {
    return code;
  }

  /** Path prefix, including the trailing slash, that routes a path to this provider. */
  public String pathPrefix() {
    return code + "/";
  }

  @JsonCreator
  public static ProviderType fromCode(final String code) {
    final var normalized = code.trim().toLowerCase(Locale.ROOT);
    return Arrays.stream(values())
        .filter(type -> type.code.equals(normalized))
        .findFirst()
        .orElseThrow(() -> new IllegalArgumentException("Unknown provider: " + code));
  }

  /**
   * Returns the provider named by the first path segment, if any.
   *
   * @param path secret path
   * @return provider selected by prefix, or empty when the path carries no provider prefix
   */
  public static Optional<ProviderType> fromPathPrefix(final String path) {
    return Arrays.stream(values()).filter(type -> path.startsWith(type.pathPrefix())).findFirst();
  }
}
