package com.example.secretsmanager.core.rotation;

import com.example.secretsmanager.core.exception.UnsupportedGenerationException;
import com.example.secretsmanager.core.model.RotationPolicy;
import java.security.SecureRandom;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Produces replacement values for rotations.
 *
 * <p>Passwords draw from {@value #DEFAULT_PASSWORD_CHARSET} (or the policy charset) with a default
 * length of {@value #DEFAULT_PASSWORD_LENGTH}; API keys are alphanumeric with a default length of
 * {@value #DEFAULT_API_KEY_LENGTH}. Certificates need a CA integration and are not generated here.
 * Custom values come from generators registered by name.
 */
public class SecretValueGenerator {

  public static final String DEFAULT_PASSWORD_CHARSET =
      "ABCDEFGHIJKLMNOPQRSTUVWXYZabcdefghijklmnopqrstuvwxyz0123456789!@#$%^&*";
  public static final String ALPHANUMERIC =
      "ABCDEFGHIJKLMNOPQRSTUVWXYZabcdefghijklmnopqrstuvwxyz0123456789";
  public static final int DEFAULT_PASSWORD_LENGTH = 32;
  public static final int DEFAULT_API_KEY_LENGTH = 64;

  private final SecureRandom random = new SecureRandom();
  private final Map<String, Supplier<String>> customGenerators = new ConcurrentHashMap<>();

  public SecretValueGenerator() {}

  public SecretValueGenerator(final Map<String, Supplier<String>> customGenerators) {
    this.customGenerators.putAll(customGenerators);
  }

  public void register(final String name, final Supplier<String> generator) {
    customGenerators.put(name, generator);
  }

  /**
   * Generates a value for the policy.
   *
   * @throws UnsupportedGenerationException for certificates, unknown custom generators or a
   *     custom generator returning a blank value
   */
  public String generate(final RotationPolicy policy) {
    return switch (policy.generationType()) {
      case PASSWORD -> randomString(
          policy.charset() != null ? policy.charset() : DEFAULT_PASSWORD_CHARSET,
          policy.length() != null ? policy.length() : DEFAULT_PASSWORD_LENGTH);
      case API_KEY -> randomString(
          ALPHANUMERIC, policy.length() != null ? policy.length() : DEFAULT_API_KEY_LENGTH);
      case CERTIFICATE -> throw new UnsupportedGenerationException(
          "Certificate generation is not supported");
      case CUSTOM -> custom(policy.customGenerator());
    };
  }

  private String custom(final String name) {
    final var generator = name == null ? null : customGenerators.get(name);
    if (generator == null)
      throw new UnsupportedGenerationException("No custom generator registered as " + name);
    final var value = generator.get();
    if (value == null || value.isBlank())
      throw new UnsupportedGenerationException("Custom generator " + name + " returned no value");
    return value;
  }

  private String randomString(final String charset, final int length) {
    final var sb = new StringBuilder(length);
    for (int i = 0; i < length; i++) sb.append(charset.charAt(random.nextInt(charset.length())));
    return sb.toString();
  }
}
