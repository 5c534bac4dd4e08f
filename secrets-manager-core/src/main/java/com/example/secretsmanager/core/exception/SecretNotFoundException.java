package com.example.secretsmanager.core.exception;

/** No secret at the given path, version or id. */
public class SecretNotFoundException extends SecretsException {

  public SecretNotFoundException(final String message) {
    super(message);
  }

  public static SecretNotFoundException forPath(final String path) {
    return new SecretNotFoundException("Secret not found: " + path);
  }

  public static SecretNotFoundException forVersion(final String path, final int version) {
    return new SecretNotFoundException(
        "Secret not found: %s (version %d)".formatted(path, version));
  }

  public static SecretNotFoundException forId(final String secretId) {
    return new SecretNotFoundException("Secret with id %s not found".formatted(secretId));
  }
}
