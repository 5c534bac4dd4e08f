package com.example.secretsmanager.core.exception;

/**
 * A conditional write was rejected: the path already exists on create, or the stored version is
 * not the one the update was computed from.
 */
public class SecretConflictException extends ProviderException {

  public SecretConflictException(final String message) {
    super(message);
  }
}
