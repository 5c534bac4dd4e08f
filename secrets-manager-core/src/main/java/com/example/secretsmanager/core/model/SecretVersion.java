package com.example.secretsmanager.core.model;

import java.time.Instant;

/**
 * One numbered snapshot of a secret value.
 *
 * @param version version number, starting at 1
 * @param value ciphertext as persisted, or plaintext once decrypted by the orchestrator
 * @param createdAt when the version was written
 * @param createdBy requester that wrote the version
 * @param active whether this is the current version
 */
public record SecretVersion(
    int version, String value, Instant createdAt, String createdBy, boolean active) {

  public SecretVersion withValue(final String newValue) {
    return new SecretVersion(version, newValue, createdAt, createdBy, active);
  }

  @Override
  public String toString() {
    return "SecretVersion[version=%d, createdAt=%s, createdBy=%s, active=%s]"
        .formatted(version, createdAt, createdBy, active);
  }
}
