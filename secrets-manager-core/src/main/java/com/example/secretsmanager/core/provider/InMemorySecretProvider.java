package com.example.secretsmanager.core.provider;

import static java.lang.System.Logger.Level.DEBUG;

import com.example.secretsmanager.core.exception.ProviderException;
import com.example.secretsmanager.core.exception.SecretConflictException;
import com.example.secretsmanager.core.exception.SecretNotFoundException;
import com.example.secretsmanager.core.model.ProviderType;
import com.example.secretsmanager.core.model.Secret;
import com.example.secretsmanager.core.model.SecretMetadata;
import com.example.secretsmanager.core.model.SecretVersion;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Process-local provider backed by concurrent maps. Useful for tests and single-node setups; it
 * honours the same conflict and not-found contract as the remote adapters.
 */
public class InMemorySecretProvider implements SecretProvider {

  private static final System.Logger LOGGER =
      System.getLogger(InMemorySecretProvider.class.getName());

  private final ProviderType type;
  private final ConcurrentHashMap<String, Entry> byPath = new ConcurrentHashMap<>();
  private final ConcurrentHashMap<String, String> pathById = new ConcurrentHashMap<>();
  private final AtomicBoolean closed = new AtomicBoolean();

  public InMemorySecretProvider(final ProviderType type) {
    this.type = type;
  }

  @Override
  public ProviderType type() {
    return type;
  }

  @Override
  public StoreResult storeSecret(
      final String path,
      final String value,
      final SecretMetadata metadata,
      final Map<String, String> options) {
    ensureOpen();
    final var id = type.code() + "-" + UUID.randomUUID();
    final var version =
        new SecretVersion(1, value, metadata.createdAt(), metadata.createdBy(), true);
    final var created = new Entry(id, metadata, List.of(version));
    if (byPath.putIfAbsent(path, created) != null)
      throw new SecretConflictException("Secret already exists: " + path);
    pathById.put(id, path);
    LOGGER.log(DEBUG, "Stored {0} as {1}", path, id);
    return new StoreResult(id, 1);
  }

  @Override
  public Secret getSecret(final String path, final Integer version) {
    ensureOpen();
    final var entry = byPath.get(path);
    if (entry == null) throw SecretNotFoundException.forPath(path);
    return entry.toSecret(path, version);
  }

  @Override
  public void updateSecret(
      final String path, final String value, final SecretMetadata metadata, final int version) {
    ensureOpen();
    final var found = new AtomicBoolean();
    byPath.computeIfPresent(
        path,
        (key, current) -> {
          found.set(true);
          final var currentVersion = current.metadata().version();
          if (currentVersion != version - 1)
            throw new SecretConflictException(
                "Version conflict on %s: expected %d, found %d"
                    .formatted(path, version - 1, currentVersion));
          final var versions = new ArrayList<SecretVersion>(current.versions().size() + 1);
          current.versions().forEach(v -> versions.add(v.active() ? deactivate(v) : v));
          versions.add(
              new SecretVersion(version, value, metadata.updatedAt(), metadata.updatedBy(), true));
          return new Entry(current.id(), metadata, versions);
        });
    if (!found.get()) throw SecretNotFoundException.forPath(path);
  }

  @Override
  public void deleteSecret(final String path) {
    ensureOpen();
    final var removed = byPath.remove(path);
    if (removed == null) throw SecretNotFoundException.forPath(path);
    pathById.remove(removed.id());
  }

  @Override
  public ProviderListResult listSecrets(
      final String prefix, final Map<String, String> tags, final int limit, final int offset) {
    ensureOpen();
    final var matches =
        byPath.entrySet().stream()
            .filter(e -> prefix == null || e.getKey().startsWith(prefix))
            .map(e -> e.getValue().metadata())
            .filter(m -> m.hasTags(tags))
            .sorted(Comparator.comparing(SecretMetadata::path))
            .toList();
    final var page = matches.stream().skip(offset).limit(limit).toList();
    return new ProviderListResult(page, matches.size());
  }

  @Override
  public Optional<Secret> getSecretById(final String id) {
    ensureOpen();
    return Optional.ofNullable(pathById.get(id))
        .flatMap(path -> Optional.ofNullable(byPath.get(path)).map(e -> e.toSecret(path, null)));
  }

  @Override
  public void healthCheck() {
    ensureOpen();
  }

  @Override
  public void close() {
    closed.set(true);
  }

  /** Number of stored secrets. */
  public int size() {
    return byPath.size();
  }

  private void ensureOpen() {
    if (closed.get()) throw new ProviderException("Provider " + type.code() + " is closed");
  }

  private static SecretVersion deactivate(final SecretVersion v) {
    return new SecretVersion(v.version(), v.value(), v.createdAt(), v.createdBy(), false);
  }

  private record Entry(String id, SecretMetadata metadata, List<SecretVersion> versions) {

    Entry {
      versions = List.copyOf(versions);
    }

    Secret toSecret(final String path, final Integer version) {
      final var requested = version == null ? metadata.version() : version;
      final var selected =
          versions.stream()
              .filter(v -> v.version() == requested)
              .findFirst()
              .orElseThrow(() -> SecretNotFoundException.forVersion(path, requested));
      return new Secret(id, path, selected.value(), metadata, versions);
    }
  }
}
