package com.example.secretsmanager.core.provider.vault;

import static java.lang.System.Logger.Level.DEBUG;

import com.example.secretsmanager.core.Json;
import com.example.secretsmanager.core.exception.ProviderException;
import com.example.secretsmanager.core.exception.ProviderTimeoutException;
import com.example.secretsmanager.core.exception.SecretConflictException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Minimal client for the Vault KV version 2 HTTP API.
 *
 * <p>Authenticates with the {@code X-Vault-Token} header and scopes requests with {@code
 * X-Vault-Namespace} when a namespace is configured. Failures are reported as {@link
 * ProviderException}s carrying the HTTP status and Vault's first error message; response bodies
 * are never included otherwise.
 */
public class VaultKvClient {

  private static final System.Logger LOGGER = System.getLogger(VaultKvClient.class.getName());

  private static final Duration CONNECT_TIMEOUT = Duration.ofSeconds(10);
  private static final String HEADER_TOKEN = "X-Vault-Token";
  private static final String HEADER_NAMESPACE = "X-Vault-Namespace";
  private static final String CONTENT_TYPE_JSON = "application/json";
  private static final int NOT_FOUND = 404;

  /** Active, standby and performance standby nodes all serve reads. */
  private static final Set<Integer> HEALTHY_STATUSES = Set.of(200, 429, 472, 473);

  private final HttpClient httpClient;
  private final VaultSettings settings;
  private final String baseUrl;

  public VaultKvClient(final VaultSettings settings) {
    this(
        HttpClient.newBuilder()
            .connectTimeout(CONNECT_TIMEOUT)
            .followRedirects(HttpClient.Redirect.NORMAL)
            .build(),
        settings);
  }

  /** Uses an injected {@link HttpClient}. */
  public VaultKvClient(final HttpClient httpClient, final VaultSettings settings) {
    this.httpClient = httpClient;
    this.settings = settings;
    final var address = settings.address().toString();
    this.baseUrl = address.endsWith("/") ? address.substring(0, address.length() - 1) : address;
  }

  /**
   * Reads the {@code data} block of a secret version.
   *
   * @param path secret path below the mount
   * @param version version number, null for the current one
   * @return {@code data} with the stored payload under {@code data} and version details under
   *     {@code metadata}; empty when the secret or version does not exist or was deleted
   */
  public Optional<JsonNode> readData(final String path, final Integer version) {
    final var query = version == null ? "" : "?version=" + version;
    final var response = send("read", request(dataPath(path) + query).GET());
    if (response.status() == NOT_FOUND) return Optional.empty();
    expectSuccess("read", response);
    final var data = response.body().path("data");
    return data.path("data").isObject() ? Optional.of(data) : Optional.empty();
  }

  /**
   * Reads the version history of a secret.
   *
   * @return {@code data} with {@code current_version} and the {@code versions} map, empty when the
   *     secret does not exist
   */
  public Optional<JsonNode> readMetadata(final String path) {
    final var response = send("read metadata", request(metadataPath(path)).GET());
    if (response.status() == NOT_FOUND) return Optional.empty();
    expectSuccess("read metadata", response);
    return Optional.of(response.body().path("data"));
  }

  /**
   * Writes a new version guarded by check-and-set.
   *
   * @param path secret path below the mount
   * @param data payload to store
   * @param cas expected current version, 0 when the secret must not exist yet
   * @return the version Vault assigned
   * @throws SecretConflictException if the current version is not {@code cas}
   */
  public int writeData(final String path, final Map<String, Object> data, final int cas) {
    final var body = new LinkedHashMap<String, Object>();
    body.put("options", Map.of("cas", cas));
    body.put("data", data);
    final var response =
        send(
            "write",
            request(dataPath(path))
                .header("Content-Type", CONTENT_TYPE_JSON)
                .POST(HttpRequest.BodyPublishers.ofString(toJson(body))));
    if (response.status() == 400 && errors(response.body()).contains("check-and-set"))
      throw new SecretConflictException(
          "Version conflict on %s: expected current version %d".formatted(path, cas));
    expectSuccess("write", response);
    return response.body().path("data").path("version").asInt();
  }

  /** Removes every version and the metadata of a secret. */
  public void deleteMetadata(final String path) {
    expectSuccess("delete", send("delete", request(metadataPath(path)).DELETE()));
  }

  /**
   * Lists the keys directly below {@code folder}. Sub-folders end with {@code /}.
   *
   * @param folder folder path below the mount, empty for the mount root
   * @return keys, empty when the folder does not exist
   */
  public List<String> listKeys(final String folder) {
    final var response = send("list", request(metadataPath(folder) + "?list=true").GET());
    if (response.status() == NOT_FOUND) return List.of();
    expectSuccess("list", response);
    final var keys = new ArrayList<String>();
    response.body().path("data").path("keys").forEach(key -> keys.add(key.asText()));
    return keys;
  }

  /**
   * Calls {@code /v1/sys/health}.
   *
   * @throws ProviderException if the node is sealed, uninitialized or unreachable
   */
  public void health() {
    final var response = send("health", request("/v1/sys/health").GET());
    if (!HEALTHY_STATUSES.contains(response.status()))
      throw new ProviderException("Vault unhealthy: status " + response.status());
  }

  public VaultSettings settings() {
    return settings;
  }

  private String dataPath(final String path) {
    return "/v1/" + settings.mount() + "/data/" + path;
  }

  private String metadataPath(final String path) {
    return "/v1/" + settings.mount() + "/metadata/" + path;
  }

  private HttpRequest.Builder request(final String apiPath) {
    final var builder =
        HttpRequest.newBuilder()
            .uri(URI.create(baseUrl + apiPath))
            .timeout(settings.requestTimeout())
            .header(HEADER_TOKEN, settings.token());
    if (settings.namespace() != null && !settings.namespace().isBlank())
      builder.header(HEADER_NAMESPACE, settings.namespace());
    return builder;
  }

  private Response send(final String operation, final HttpRequest.Builder builder) {
    final var request = builder.build();
    LOGGER.log(DEBUG, "Vault request: {0} {1}", request.method(), request.uri().getPath());
    try {
      final var response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
      LOGGER.log(DEBUG, "Vault response: {0}", response.statusCode());
      return new Response(response.statusCode(), parse(response.body()));
    } catch (final HttpTimeoutException e) {
      throw new ProviderTimeoutException("Vault " + operation + " timed out", e);
    } catch (final IOException e) {
      throw new ProviderException(
          "Vault %s failed: connection error %s".formatted(operation, e.getMessage()), e);
    } catch (final InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new ProviderException("Vault " + operation + " interrupted", e);
    }
  }

  private static void expectSuccess(final String operation, final Response response) {
    if (response.status() < 400) return;
    final var reason = errors(response.body());
    throw new ProviderException(
        "Vault %s failed with status %d%s"
            .formatted(operation, response.status(), reason.isEmpty() ? "" : ": " + reason));
  }

  private static String errors(final JsonNode body) {
    final var errors = body.path("errors");
    return errors.isArray() && errors.size() > 0 ? errors.get(0).asText() : "";
  }

  private static JsonNode parse(final String body) {
    if (body == null || body.isBlank()) return MissingNode.getInstance();
    try {
      return Json.mapper().readTree(body);
    } catch (final JsonProcessingException e) {
      throw new ProviderException("Malformed Vault response", e);
    }
  }

  private static String toJson(final Object body) {
    try {
      return Json.mapper().writeValueAsString(body);
    } catch (final JsonProcessingException e) {
      throw new ProviderException("Failed to serialize Vault payload", e);
    }
  }

  private record Response(int status, JsonNode body) {}
}
