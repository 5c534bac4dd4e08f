package com.example.secretsmanager.core.rotation;

import com.example.secretsmanager.core.model.RotationResult;

/** Performs the rotation of a due secret. Invoked by {@link RotationScheduler} worker threads. */
@FunctionalInterface
public interface RotationHandler {

  /**
   * Rotates the secret.
   *
   * @param secretId id of the due secret
   * @return the committed rotation
   * @throws RuntimeException when the rotation did not commit
   */
  RotationResult rotate(String secretId);
}
