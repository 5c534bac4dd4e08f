package com.example.secretsmanager.core.crypto;

/** Notified synchronously after {@link EncryptionService} installs a new data key. */
@FunctionalInterface
public interface KeyRotationListener {

  /**
   * Called once the new key is current.
   *
   * @param newKeyId id of the key now used for encryption
   */
  void onKeyRotated(String newKeyId);
}
