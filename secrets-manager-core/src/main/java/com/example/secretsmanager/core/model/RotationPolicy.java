package com.example.secretsmanager.core.model;

import com.example.secretsmanager.core.exception.ValidationException;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/**
 * How and when a secret gets a freshly generated value.
 *
 * @param type automatic policies are driven by the scheduler, manual ones only by explicit calls
 * @param intervalDays days between rotations
 * @param generationType kind of value to generate
 * @param notifyBeforeDays days before a due rotation at which listeners are told it is upcoming
 * @param maxRetries retries after a failed automatic rotation
 * @param backoffMultiplier growth factor of the delay between retries
 * @param length generated value length, null for the default of the generation type
 * @param charset password alphabet, null for the default
 * @param customGenerator name of a registered generator, used with {@link GenerationType#CUSTOM}
 */
public record RotationPolicy(
    Type type,
    int intervalDays,
    GenerationType generationType,
    int notifyBeforeDays,
    int maxRetries,
    double backoffMultiplier,
    Integer length,
    String charset,
    String customGenerator) {

  /** Rotation trigger. */
  public enum Type {
    AUTOMATIC,
    MANUAL;

    @JsonValue
    public String code() {
      return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static Type fromCode(final String code) {
      return valueOf(code.trim().toUpperCase(Locale.ROOT));
    }
  }

  /** Kind of value produced on rotation. */
  public enum GenerationType {
    PASSWORD,
    API_KEY,
    CERTIFICATE,
    CUSTOM;

    @JsonValue
    public String code() {
      return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static GenerationType fromCode(final String code) {
      return valueOf(code.trim().toUpperCase(Locale.ROOT));
    }
  }

  /**
   * Automatic policy with 7 days notice, 3 retries and a backoff multiplier of 2.
   *
   * @param intervalDays days between rotations
   * @param generationType value kind
   * @return automatic policy
   */
  public static RotationPolicy automatic(
      final int intervalDays, final GenerationType generationType) {
    return new RotationPolicy(
        Type.AUTOMATIC, intervalDays, generationType, 7, 3, 2.0, null, null, null);
  }

  /**
   * Manual policy: rotation only on request.
   *
   * @param generationType value kind
   * @return manual policy
   */
  public static RotationPolicy manual(final GenerationType generationType) {
    return new RotationPolicy(Type.MANUAL, 1, generationType, 0, 0, 1.0, null, null, null);
  }

  /** Automatic policy that rotates through a generator registered under {@code name}. */
  public static RotationPolicy custom(final int intervalDays, final String name) {
    return new RotationPolicy(
        Type.AUTOMATIC, intervalDays, GenerationType.CUSTOM, 7, 3, 2.0, null, null, name);
  }

  public RotationPolicy withLength(final int newLength) {
    return new RotationPolicy(
        type,
        intervalDays,
        generationType,
        notifyBeforeDays,
        maxRetries,
        backoffMultiplier,
        newLength,
        charset,
        customGenerator);
  }

  public RotationPolicy withCharset(final String newCharset) {
    return new RotationPolicy(
        type,
        intervalDays,
        generationType,
        notifyBeforeDays,
        maxRetries,
        backoffMultiplier,
        length,
        newCharset,
        customGenerator);
  }

  public RotationPolicy withRetries(final int newMaxRetries, final double newBackoffMultiplier) {
    return new RotationPolicy(
        type,
        intervalDays,
        generationType,
        notifyBeforeDays,
        newMaxRetries,
        newBackoffMultiplier,
        length,
        charset,
        customGenerator);
  }

  public RotationPolicy withNotifyBeforeDays(final int days) {
    return new RotationPolicy(
        type,
        intervalDays,
        generationType,
        days,
        maxRetries,
        backoffMultiplier,
        length,
        charset,
        customGenerator);
  }

  @JsonIgnore
  public boolean isAutomatic() {
    return type == Type.AUTOMATIC;
  }

  /**
   * Checks the policy against the configured minimum interval.
   *
   * @param minIntervalDays smallest interval accepted for automatic policies
   * @throws ValidationException when the policy is malformed
   */
  public void validate(final int minIntervalDays) {
    if (type == null) throw new ValidationException("Invalid rotation policy type");
    if (generationType == null)
      throw new ValidationException("Rotation policy requires a generation type");
    if (intervalDays < 1)
      throw new ValidationException("Rotation interval must be at least 1 day");
    if (type == Type.AUTOMATIC && intervalDays < minIntervalDays)
      throw new ValidationException(
          "Rotation interval must be at least %d days".formatted(minIntervalDays));
    if (maxRetries < 0) throw new ValidationException("maxRetries must be >= 0");
    if (backoffMultiplier < 1.0) throw new ValidationException("backoffMultiplier must be >= 1.0");
    if (notifyBeforeDays < 0) throw new ValidationException("notifyBeforeDays must be >= 0");
    if (length != null && length < 1) throw new ValidationException("length must be >= 1");
    if (charset != null && charset.isEmpty())
      throw new ValidationException("charset must not be empty");
    if (generationType == GenerationType.CUSTOM
        && (customGenerator == null || customGenerator.isBlank()))
      throw new ValidationException("Custom generation requires a generator name");
  }
}
