package com.example.secretsmanager.core.exception;

import java.time.Duration;

/** A provider call did not complete within the configured timeout. */
public class ProviderTimeoutException extends ProviderException {

  public ProviderTimeoutException(final String operation, final Duration timeout) {
    super("Provider call %s timed out after %d ms".formatted(operation, timeout.toMillis()));
  }

  public ProviderTimeoutException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
