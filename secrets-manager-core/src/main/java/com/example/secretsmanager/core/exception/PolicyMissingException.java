package com.example.secretsmanager.core.exception;

/** Rotation was requested for a secret that has no rotation policy. */
public class PolicyMissingException extends SecretsException {

  public PolicyMissingException(final String path) {
    super("Secret %s does not have a rotation policy".formatted(path));
  }
}
