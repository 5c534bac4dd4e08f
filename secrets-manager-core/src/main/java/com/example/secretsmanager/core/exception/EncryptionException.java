package com.example.secretsmanager.core.exception;

/**
 * Ciphertext could not be produced or did not authenticate. A decryption failure means corrupted
 * or tampered data.
 */
public class EncryptionException extends SecretsException {

  public EncryptionException(final String message) {
    super(message);
  }

  public EncryptionException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
