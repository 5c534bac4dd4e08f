package com.example.secretsmanager.core.exception;

/** A backend provider failed to serve the request. */
public class ProviderException extends SecretsException {

  public ProviderException(final String message) {
    super(message);
  }

  public ProviderException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
