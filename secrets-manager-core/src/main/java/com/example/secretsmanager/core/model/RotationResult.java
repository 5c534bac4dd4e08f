package com.example.secretsmanager.core.model;

import java.time.Instant;
import java.util.Optional;

/**
 * Outcome of a rotation.
 *
 * @param secretId rotated secret
 * @param path secret path
 * @param oldVersion version before the rotation
 * @param newVersion version written by the rotation
 * @param newValue generated plaintext value
 * @param rotatedAt rotation time
 * @param nextRotation next scheduled rotation, null when none is scheduled
 */
public record RotationResult(
    String secretId,
    String path,
    int oldVersion,
    int newVersion,
    String newValue,
    Instant rotatedAt,
    Instant nextRotation) {

  public Optional<Instant> nextRotationTime() {
    return Optional.ofNullable(nextRotation);
  }

  @Override
  public String toString() {
    return "RotationResult[secretId=%s, path=%s, oldVersion=%d, newVersion=%d, nextRotation=%s]"
        .formatted(secretId, path, oldVersion, newVersion, nextRotation);
  }
}
