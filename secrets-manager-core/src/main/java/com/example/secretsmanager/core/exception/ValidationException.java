package com.example.secretsmanager.core.exception;

/** Malformed path, value or policy. Never retried. */
public class ValidationException extends SecretsException {

  public ValidationException(final String message) {
    super(message);
  }
}
