package com.example.secretsmanager.core.provider.vault;

import static com.example.secretsmanager.core.SecretsManagerConfig.number;
import static com.example.secretsmanager.core.SecretsManagerConfig.setting;

import java.net.URI;
import java.time.Duration;

/**
 * Connection settings of the Vault KV v2 adapter.
 *
 * <p>{@link #fromSystemProperties()} reads:
 *
 * <ul>
 *   <li>vault.addr / VAULT_ADDR (default http://127.0.0.1:8200)
 *   <li>vault.token / VAULT_TOKEN (required)
 *   <li>vault.namespace / VAULT_NAMESPACE (optional, Vault Enterprise)
 *   <li>vault.kv.mount / VAULT_KV_MOUNT (default secret)
 *   <li>vault.timeout.millis / VAULT_TIMEOUT_MILLIS (default 10000)
 * </ul>
 *
 * @param address Vault server URL
 * @param token client token
 * @param namespace namespace, null for the root namespace
 * @param mount KV v2 mount path
 * @param requestTimeout per request timeout
 */
public record VaultSettings(
    URI address, String token, String namespace, String mount, Duration requestTimeout) {

  public static final String DEFAULT_ADDRESS = "http://127.0.0.1:8200";
  public static final String DEFAULT_MOUNT = "secret";

  public VaultSettings {
    if (address == null) throw new IllegalArgumentException("address is required");
    if (token == null || token.isBlank()) throw new IllegalArgumentException("token is required");
    mount = mount == null ? "" : strip(mount);
    if (mount.isEmpty()) mount = DEFAULT_MOUNT;
    if (requestTimeout == null || requestTimeout.isZero() || requestTimeout.isNegative())
      requestTimeout = Duration.ofSeconds(10);
  }

  public static VaultSettings of(final String address, final String token) {
    return new VaultSettings(URI.create(address), token, null, DEFAULT_MOUNT, null);
  }

  /**
   * Reads the settings from system properties, then environment variables.
   *
   * @throws IllegalStateException if no token is configured
   */
  public static VaultSettings fromSystemProperties() {
    final var token =
        setting("vault.token", "VAULT_TOKEN")
            .orElseThrow(() -> new IllegalStateException("vault.token / VAULT_TOKEN is not set"));
    return new VaultSettings(
        URI.create(setting("vault.addr", "VAULT_ADDR").orElse(DEFAULT_ADDRESS)),
        token,
        setting("vault.namespace", "VAULT_NAMESPACE").orElse(null),
        setting("vault.kv.mount", "VAULT_KV_MOUNT").orElse(DEFAULT_MOUNT),
        Duration.ofMillis(number("vault.timeout.millis", "VAULT_TIMEOUT_MILLIS", 10_000L)));
  }

  @Override
  public String toString() {
    return "VaultSettings[address=%s, namespace=%s, mount=%s, requestTimeout=%s]"
        .formatted(address, namespace, mount, requestTimeout);
  }

  private static String strip(final String value) {
    var result = value.trim();
    while (result.startsWith("/")) result = result.substring(1);
    while (result.endsWith("/")) result = result.substring(0, result.length() - 1);
    return result;
  }
}
