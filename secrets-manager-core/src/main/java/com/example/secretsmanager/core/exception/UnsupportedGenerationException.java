package com.example.secretsmanager.core.exception;

/** The rotation policy asks for a value generator that is not available. */
public class UnsupportedGenerationException extends SecretsException {

  public UnsupportedGenerationException(final String message) {
    super(message);
  }
}
