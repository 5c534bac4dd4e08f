package com.example.secretsmanager.core.model;

import java.util.List;
import java.util.Optional;

/**
 * A secret as returned by a provider or by the orchestrator.
 *
 * <p>Instances are immutable. {@link #toString()} never renders values.
 *
 * @param id identifier assigned when the secret was created; a path reused after deletion gets a
 *     new id
 * @param path unique hierarchical key
 * @param value value of the requested version
 * @param metadata current metadata
 * @param versions known versions in ascending order
 */
public record Secret(
    String id, String path, String value, SecretMetadata metadata, List<SecretVersion> versions) {

  public Secret {
    versions = versions == null ? List.of() : List.copyOf(versions);
  }

  public Secret withValues(final String newValue, final List<SecretVersion> newVersions) {
    return new Secret(id, path, newValue, metadata, newVersions);
  }

  public Optional<SecretVersion> version(final int number) {
    return versions.stream().filter(v -> v.version() == number).findFirst();
  }

  @Override
  public String toString() {
    return "Secret[id=%s, path=%s, version=%d, versions=%d]"
        .formatted(id, path, metadata == null ? 0 : metadata.version(), versions.size());
  }
}
