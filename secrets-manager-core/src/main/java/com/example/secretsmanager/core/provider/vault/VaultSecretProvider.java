package com.example.secretsmanager.core.provider.vault;

import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.INFO;

import com.example.secretsmanager.core.Json;
import com.example.secretsmanager.core.exception.ProviderException;
import com.example.secretsmanager.core.exception.SecretConflictException;
import com.example.secretsmanager.core.exception.SecretNotFoundException;
import com.example.secretsmanager.core.model.ProviderType;
import com.example.secretsmanager.core.model.Secret;
import com.example.secretsmanager.core.model.SecretMetadata;
import com.example.secretsmanager.core.model.SecretVersion;
import com.example.secretsmanager.core.provider.ProviderListResult;
import com.example.secretsmanager.core.provider.SecretProvider;
import com.example.secretsmanager.core.provider.StoreResult;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeSet;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * {@link SecretProvider} backed by a HashiCorp Vault KV version 2 mount.
 *
 * <p>Each secret path maps to one KV entry. Every KV version stores the persisted value, the
 * secret id and the metadata of that version, so KV version numbers equal secret versions. Writes
 * use check-and-set: {@code cas=0} on create, the expected previous version on update. Ids have the
 * form {@code vault:<path>#<uuid>} and are resolved without an index.
 */
public class VaultSecretProvider implements SecretProvider {

  private static final System.Logger LOGGER = System.getLogger(VaultSecretProvider.class.getName());

  static final String ID_PREFIX = "vault:";
  private static final String FIELD_VALUE = "value";
  private static final String FIELD_ID = "id";
  private static final String FIELD_METADATA = "metadata";

  private final VaultKvClient client;
  private final AtomicBoolean closed = new AtomicBoolean();

  public VaultSecretProvider(final VaultSettings settings) {
    this(new VaultKvClient(settings));
  }

  public VaultSecretProvider(final VaultKvClient client) {
    this.client = client;
    LOGGER.log(
        INFO,
        "Vault provider using {0}, mount {1}",
        client.settings().address(),
        client.settings().mount());
  }

  @Override
  public ProviderType type() {
    return ProviderType.VAULT;
  }

  @Override
  public StoreResult storeSecret(
      final String path,
      final String value,
      final SecretMetadata metadata,
      final Map<String, String> options) {
    ensureOpen();
    final var id = ID_PREFIX + path + "#" + UUID.randomUUID();
    try {
      final var version = client.writeData(path, payload(value, id, metadata), 0);
      LOGGER.log(DEBUG, "Stored {0} as {1}", path, id);
      return new StoreResult(id, version);
    } catch (final SecretConflictException e) {
      throw new SecretConflictException("Secret already exists: " + path);
    }
  }

  @Override
  public Secret getSecret(final String path, final Integer version) {
    ensureOpen();
    final var history =
        client.readMetadata(path).orElseThrow(() -> SecretNotFoundException.forPath(path));
    final var current = history.path("current_version").asInt();

    final var numbers = new TreeSet<Integer>();
    history.path("versions").fieldNames().forEachRemaining(n -> numbers.add(Integer.parseInt(n)));
    final var requested = version == null ? current : version;
    if (!numbers.contains(requested)) throw SecretNotFoundException.forVersion(path, requested);

    final var versions = new ArrayList<SecretVersion>(numbers.size());
    Stored latest = null;
    Stored selected = null;
    for (final var number : numbers) {
      final var stored = client.readData(path, number).map(VaultSecretProvider::stored);
      if (stored.isEmpty()) continue;
      final var entry = stored.get();
      versions.add(
          new SecretVersion(
              number,
              entry.value(),
              entry.metadata().updatedAt(),
              entry.metadata().updatedBy(),
              number == current));
      if (number == current) latest = entry;
      if (number == requested) selected = entry;
    }
    if (latest == null) throw SecretNotFoundException.forPath(path);
    if (selected == null) throw SecretNotFoundException.forVersion(path, requested);
    return new Secret(latest.id(), path, selected.value(), latest.metadata(), versions);
  }

  @Override
  public void updateSecret(
      final String path, final String value, final SecretMetadata metadata, final int version) {
    ensureOpen();
    final var current =
        client
            .readData(path, null)
            .map(VaultSecretProvider::stored)
            .orElseThrow(() -> SecretNotFoundException.forPath(path));
    final var written = client.writeData(path, payload(value, current.id(), metadata), version - 1);
    if (written != version)
      throw new ProviderException(
          "Vault assigned version %d to %s, expected %d".formatted(written, path, version));
  }

  @Override
  public void deleteSecret(final String path) {
    ensureOpen();
    if (client.readMetadata(path).isEmpty()) throw SecretNotFoundException.forPath(path);
    client.deleteMetadata(path);
    LOGGER.log(DEBUG, "Deleted {0}", path);
  }

  @Override
  public ProviderListResult listSecrets(
      final String prefix, final Map<String, String> tags, final int limit, final int offset) {
    ensureOpen();
    final var start = prefix == null ? "" : prefix.substring(0, prefix.lastIndexOf('/') + 1);
    final var paths = new ArrayList<String>();
    collect(start, prefix, paths);

    final var matches = new ArrayList<SecretMetadata>();
    for (final var path : paths) {
      client
          .readData(path, null)
          .map(VaultSecretProvider::stored)
          .map(Stored::metadata)
          .filter(m -> m.hasTags(tags))
          .ifPresent(matches::add);
    }
    matches.sort(Comparator.comparing(SecretMetadata::path));
    final var page = matches.stream().skip(offset).limit(limit).toList();
    return new ProviderListResult(page, matches.size());
  }

  @Override
  public Optional<Secret> getSecretById(final String id) {
    ensureOpen();
    final var separator = id == null ? -1 : id.lastIndexOf('#');
    if (separator <= ID_PREFIX.length() || !id.startsWith(ID_PREFIX)) return Optional.empty();
    final var path = id.substring(ID_PREFIX.length(), separator);
    final var current = client.readData(path, null).map(VaultSecretProvider::stored);
    if (current.isEmpty() || !id.equals(current.get().id())) return Optional.empty();
    try {
      return Optional.of(getSecret(path, null));
    } catch (final SecretNotFoundException e) {
      return Optional.empty();
    }
  }

  @Override
  public void healthCheck() {
    ensureOpen();
    client.health();
  }

  @Override
  public void close() {
    closed.set(true);
  }

  private void collect(final String folder, final String prefix, final List<String> out) {
    for (final var key : client.listKeys(folder)) {
      final var child = folder + key;
      final var matches = prefix == null || child.startsWith(prefix);
      if (key.endsWith("/")) {
        if (matches || prefix.startsWith(child)) collect(child, prefix, out);
      } else if (matches) {
        out.add(child);
      }
    }
  }

  private void ensureOpen() {
    if (closed.get()) throw new ProviderException("Provider vault is closed");
  }

  private static Map<String, Object> payload(
      final String value, final String id, final SecretMetadata metadata) {
    final var data = new LinkedHashMap<String, Object>();
    data.put(FIELD_VALUE, value);
    data.put(FIELD_ID, id);
    data.put(FIELD_METADATA, Json.mapper().convertValue(metadata, JsonNode.class));
    return data;
  }

  private static Stored stored(final JsonNode data) {
    final var payload = data.path("data");
    try {
      final var metadata =
          Json.mapper().treeToValue(payload.path(FIELD_METADATA), SecretMetadata.class);
      return new Stored(
          payload.path(FIELD_VALUE).asText(), payload.path(FIELD_ID).asText(), metadata);
    } catch (final JsonProcessingException | IllegalArgumentException e) {
      throw new ProviderException("Malformed secret payload in Vault", e);
    }
  }

  private record Stored(String value, String id, SecretMetadata metadata) {}
}
