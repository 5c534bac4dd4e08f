package com.example.secretsmanager.core.provider;

import com.example.secretsmanager.core.exception.ProviderException;
import com.example.secretsmanager.core.exception.SecretConflictException;
import com.example.secretsmanager.core.exception.SecretNotFoundException;
import com.example.secretsmanager.core.model.ProviderType;
import com.example.secretsmanager.core.model.Secret;
import com.example.secretsmanager.core.model.SecretMetadata;
import java.util.Map;
import java.util.Optional;

/**
 * Backend secret store.
 *
 * <p>Values handed to a provider are already in their persisted form (ciphertext when encryption
 * is enabled) and are returned unchanged. Providers translate only: versioning, encryption and
 * access rules belong to the caller. Implementations must be safe for concurrent use and must
 * report backend failures as {@link ProviderException} without leaking raw client exceptions.
 */
public interface SecretProvider extends AutoCloseable {

  /** Provider slot this implementation serves. */
  ProviderType type();

  /**
   * Creates the secret at {@code path} with version 1.
   *
   * @param path secret path
   * @param value persisted value
   * @param metadata metadata of version 1
   * @param options provider specific options
   * @return generated id and the stored version
   * @throws SecretConflictException if a secret already exists at {@code path}
   */
  StoreResult storeSecret(
      String path, String value, SecretMetadata metadata, Map<String, String> options);

  /**
   * Reads a secret with its version history.
   *
   * @param path secret path
   * @param version version to read as {@link Secret#value()}, null for the latest
   * @return the secret
   * @throws SecretNotFoundException if no secret or no such version exists
   */
  Secret getSecret(String path, Integer version);

  /**
   * Appends {@code version} to the secret at {@code path}. The write only succeeds when the
   * current version is {@code version - 1}.
   *
   * @throws SecretNotFoundException if no secret exists at {@code path}
   * @throws SecretConflictException if the current version is not {@code version - 1}
   */
  void updateSecret(String path, String value, SecretMetadata metadata, int version);

  /**
   * Removes the secret and its history.
   *
   * @throws SecretNotFoundException if no secret exists at {@code path}
   */
  void deleteSecret(String path);

  /**
   * Lists metadata of secrets below {@code prefix} carrying all {@code tags}, ordered by path.
   *
   * @param prefix path prefix, null for all
   * @param tags required tags, may be empty
   * @param limit page size
   * @param offset entries to skip
   */
  ProviderListResult listSecrets(String prefix, Map<String, String> tags, int limit, int offset);

  /** Looks a secret up by the id returned from {@link #storeSecret}. */
  Optional<Secret> getSecretById(String id);

  /**
   * Checks that the backend is reachable and healthy.
   *
   * @throws ProviderException when the backend is unhealthy
   */
  void healthCheck();

  /** Releases backend connections. */
  @Override
  void close();
}
