package com.example.secretsmanager.core.model;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * Descriptive and policy data attached to a secret.
 *
 * <p>{@code version} starts at 1 and grows by exactly one per update or rotation.
 *
 * @param path secret path
 * @param description free text, may be null
 * @param tags string tags used for filtering
 * @param createdBy requester that created the secret
 * @param createdAt creation time
 * @param updatedBy requester of the last change
 * @param updatedAt time of the last change
 * @param version current version number
 * @param rotationPolicy rotation policy, may be null
 * @param accessPolicy secret-level access policy, may be null
 * @param encrypted whether stored values are ciphertext
 * @param provider backend holding the secret
 */
public record SecretMetadata(
    String path,
    String description,
    Map<String, String> tags,
    String createdBy,
    Instant createdAt,
    String updatedBy,
    Instant updatedAt,
    int version,
    RotationPolicy rotationPolicy,
    AccessPolicy accessPolicy,
    boolean encrypted,
    ProviderType provider) {

  public SecretMetadata {
    tags = tags == null ? Map.of() : Map.copyOf(tags);
  }

  /**
   * Metadata for the first version of a new secret.
   *
   * @param request store request
   * @param provider resolved provider
   * @param encrypted whether the value is stored encrypted
   * @param now creation time
   * @return metadata with version 1
   */
  public static SecretMetadata initial(
      final SecretRequest request,
      final ProviderType provider,
      final boolean encrypted,
      final Instant now) {
    return new SecretMetadata(
        request.path(),
        request.description(),
        request.tags(),
        request.requester(),
        now,
        request.requester(),
        now,
        1,
        request.rotationPolicy(),
        request.accessPolicy(),
        encrypted,
        provider);
  }

  /**
   * Metadata for the next version: description replaced when given, tags merged, editor and
   * timestamp refreshed, version incremented.
   *
   * @param options description and tags to apply, may be null
   * @param requester requester performing the change
   * @param now change time
   * @return metadata for {@code version + 1}
   */
  public SecretMetadata nextVersion(
      final UpdateOptions options, final String requester, final Instant now) {
    var newDescription = description;
    final var newTags = new HashMap<>(tags);
    if (options != null) {
      if (options.description() != null && !options.description().isBlank())
        newDescription = options.description();
      newTags.putAll(options.tags());
    }
    return new SecretMetadata(
        path,
        newDescription,
        newTags,
        createdBy,
        createdAt,
        requester,
        now,
        version + 1,
        rotationPolicy,
        accessPolicy,
        encrypted,
        provider);
  }

  /**
   * Whether every given tag is present with the same value.
   *
   * @param required tags to match, may be null
   * @return true when all required tags match
   */
  public boolean hasTags(final Map<String, String> required) {
    if (required == null) return true;
    return required.entrySet().stream()
        .allMatch(e -> e.getValue().equals(tags.get(e.getKey())));
  }
}
