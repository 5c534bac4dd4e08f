package com.example.secretsmanager.core.model;

/**
 * Result of a store or update.
 *
 * @param success always true; failures are raised as exceptions
 * @param secretId id of the secret
 * @param path secret path
 * @param version version written
 * @param metadata metadata after the write
 */
public record SecretResponse(
    boolean success, String secretId, String path, int version, SecretMetadata metadata) {

  public static SecretResponse of(final String secretId, final SecretMetadata metadata) {
    return new SecretResponse(true, secretId, metadata.path(), metadata.version(), metadata);
  }
}
