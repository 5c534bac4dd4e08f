package com.example.secretsmanager.core.exception;

/**
 * Base type of every failure raised by the secrets core.
 *
 * <p>All subclasses are unchecked. Messages are meant for callers and never contain secret
 * material or raw backend responses.
 */
public class SecretsException extends RuntimeException {

  public SecretsException(final String message) {
    super(message);
  }

  public SecretsException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
