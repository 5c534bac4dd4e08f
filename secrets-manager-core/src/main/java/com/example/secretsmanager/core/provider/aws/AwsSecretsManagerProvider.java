package com.example.secretsmanager.core.provider.aws;

import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.INFO;
import static java.lang.System.Logger.Level.WARNING;

import com.example.secretsmanager.core.Json;
import com.example.secretsmanager.core.exception.ProviderException;
import com.example.secretsmanager.core.exception.ProviderTimeoutException;
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
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;
import software.amazon.awssdk.core.exception.ApiCallAttemptTimeoutException;
import software.amazon.awssdk.core.exception.ApiCallTimeoutException;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.secretsmanager.SecretsManagerClient;
import software.amazon.awssdk.services.secretsmanager.model.CreateSecretRequest;
import software.amazon.awssdk.services.secretsmanager.model.DeleteSecretRequest;
import software.amazon.awssdk.services.secretsmanager.model.DescribeSecretRequest;
import software.amazon.awssdk.services.secretsmanager.model.Filter;
import software.amazon.awssdk.services.secretsmanager.model.FilterNameStringType;
import software.amazon.awssdk.services.secretsmanager.model.GetSecretValueRequest;
import software.amazon.awssdk.services.secretsmanager.model.InvalidRequestException;
import software.amazon.awssdk.services.secretsmanager.model.ListSecretVersionIdsRequest;
import software.amazon.awssdk.services.secretsmanager.model.ListSecretsRequest;
import software.amazon.awssdk.services.secretsmanager.model.PutSecretValueRequest;
import software.amazon.awssdk.services.secretsmanager.model.ResourceExistsException;
import software.amazon.awssdk.services.secretsmanager.model.ResourceNotFoundException;
import software.amazon.awssdk.services.secretsmanager.model.SecretsManagerException;
import software.amazon.awssdk.services.secretsmanager.model.Tag;
import software.amazon.awssdk.services.secretsmanager.model.TagResourceRequest;

/**
 * {@link SecretProvider} backed by AWS Secrets Manager.
 *
 * <p>Each secret path is one AWS secret named {@code <prefix>/<path>} whose secret string is a JSON
 * envelope holding the persisted value, the version number and the metadata of that version. AWS
 * keeps superseded values as deprecated versions, which form the history. Updates check the
 * envelope version of the current value and use a client request token derived from path and
 * version, so two writers of the same version cannot both succeed. The id of a secret is its ARN.
 */
public class AwsSecretsManagerProvider implements SecretProvider {

  private static final System.Logger LOGGER =
      System.getLogger(AwsSecretsManagerProvider.class.getName());

  private static final String CURRENT_STAGE = "AWSCURRENT";
  private static final int PAGE_SIZE = 100;

  private final SecretsManagerClient client;
  private final AwsSettings settings;
  private final AtomicBoolean closed = new AtomicBoolean();

  public AwsSecretsManagerProvider(final AwsSettings settings) {
    this(settings.buildClient(), settings);
  }

  public AwsSecretsManagerProvider(final SecretsManagerClient client, final AwsSettings settings) {
    this.client = client;
    this.settings = settings;
    LOGGER.log(INFO, "AWS Secrets Manager provider using {0}", settings);
  }

  @Override
  public ProviderType type() {
    return ProviderType.AWS;
  }

  @Override
  public StoreResult storeSecret(
      final String path,
      final String value,
      final SecretMetadata metadata,
      final Map<String, String> options) {
    ensureOpen();
    final var name = settings.secretName(path);
    final var request =
        CreateSecretRequest.builder()
            .name(name)
            .description(metadata.description())
            .secretString(envelope(value, 1, metadata))
            .clientRequestToken(token(path, 1))
            .tags(tags(metadata))
            .build();
    try {
      final var arn = call("createSecret", () -> client.createSecret(request)).arn();
      LOGGER.log(DEBUG, "Created {0} as {1}", path, arn);
      return new StoreResult(arn, 1);
    } catch (final ResourceExistsException e) {
      throw new SecretConflictException("Secret already exists: " + path);
    } catch (final InvalidRequestException e) {
      // AWS reserves the name of a secret in its recovery window
      throw new SecretConflictException("Secret already exists or is pending deletion: " + path);
    }
  }

  @Override
  public Secret getSecret(final String path, final Integer version) {
    ensureOpen();
    final var name = settings.secretName(path);
    final var versions = new ArrayList<SecretVersion>();
    Envelope latest = null;
    Envelope selected = null;
    String arn = null;
    try {
      String nextToken = null;
      do {
        final var request =
            ListSecretVersionIdsRequest.builder()
                .secretId(name)
                .includeDeprecated(true)
                .maxResults(PAGE_SIZE)
                .nextToken(nextToken)
                .build();
        final var page = call("listSecretVersionIds", () -> client.listSecretVersionIds(request));
        arn = page.arn();
        for (final var entry : page.versions()) {
          final var current = entry.versionStages().contains(CURRENT_STAGE);
          final var envelope = readVersion(name, entry.versionId());
          versions.add(
              new SecretVersion(
                  envelope.version(),
                  envelope.value(),
                  envelope.metadata().updatedAt(),
                  envelope.metadata().updatedBy(),
                  current));
          if (current) latest = envelope;
          if (version != null && envelope.version() == version) selected = envelope;
        }
        nextToken = page.nextToken();
      } while (nextToken != null);
    } catch (final ResourceNotFoundException e) {
      throw SecretNotFoundException.forPath(path);
    } catch (final InvalidRequestException e) {
      // Deleted secrets in their recovery window
      throw SecretNotFoundException.forPath(path);
    }
    if (latest == null) throw SecretNotFoundException.forPath(path);
    if (version == null) selected = latest;
    if (selected == null) throw SecretNotFoundException.forVersion(path, version);

    versions.sort(Comparator.comparingInt(SecretVersion::version));
    return new Secret(arn, path, selected.value(), latest.metadata(), versions);
  }

  @Override
  public void updateSecret(
      final String path, final String value, final SecretMetadata metadata, final int version) {
    ensureOpen();
    final var name = settings.secretName(path);
    try {
      final var current = readCurrent(name);
      if (current.version() != version - 1)
        throw new SecretConflictException(
            "Version conflict on %s: expected %d, found %d"
                .formatted(path, version - 1, current.version()));
      final var request =
          PutSecretValueRequest.builder()
              .secretId(name)
              .secretString(envelope(value, version, metadata))
              .clientRequestToken(token(path, version))
              .build();
      call("putSecretValue", () -> client.putSecretValue(request));
      if (!metadata.tags().isEmpty()) {
        final var tagRequest =
            TagResourceRequest.builder().secretId(name).tags(tags(metadata)).build();
        call("tagResource", () -> client.tagResource(tagRequest));
      }
    } catch (final ResourceNotFoundException e) {
      throw SecretNotFoundException.forPath(path);
    } catch (final ResourceExistsException | InvalidRequestException e) {
      throw new SecretConflictException(
          "Version %d of %s was written concurrently".formatted(version, path));
    }
  }

  @Override
  public void deleteSecret(final String path) {
    ensureOpen();
    final var builder = DeleteSecretRequest.builder().secretId(settings.secretName(path));
    if (settings.forceDelete()) builder.forceDeleteWithoutRecovery(true);
    else builder.recoveryWindowInDays((long) settings.recoveryWindowDays());
    final var request = builder.build();
    try {
      call("deleteSecret", () -> client.deleteSecret(request));
      LOGGER.log(DEBUG, "Deleted {0}", path);
    } catch (final ResourceNotFoundException | InvalidRequestException e) {
      throw SecretNotFoundException.forPath(path);
    }
  }

  @Override
  public ProviderListResult listSecrets(
      final String prefix, final Map<String, String> tags, final int limit, final int offset) {
    ensureOpen();
    final var namePrefix = settings.secretName(prefix == null ? "" : prefix);
    final var matches = new ArrayList<SecretMetadata>();
    String nextToken = null;
    do {
      final var builder = ListSecretsRequest.builder().maxResults(PAGE_SIZE).nextToken(nextToken);
      if (!namePrefix.isEmpty())
        builder.filters(Filter.builder().key(FilterNameStringType.NAME).values(namePrefix).build());
      final var request = builder.build();
      final var page = call("listSecrets", () -> client.listSecrets(request));
      for (final var entry : page.secretList()) {
        if (entry.deletedDate() != null) continue;
        final var path = settings.pathOf(entry.name());
        if (path.isEmpty() || (prefix != null && !path.get().startsWith(prefix))) continue;
        try {
          final var metadata = readCurrent(entry.name()).metadata();
          if (metadata.hasTags(tags)) matches.add(metadata);
        } catch (final ResourceNotFoundException | InvalidRequestException e) {
          LOGGER.log(DEBUG, "Skipping {0}: deleted while listing", entry.name());
        }
      }
      nextToken = page.nextToken();
    } while (nextToken != null);

    matches.sort(Comparator.comparing(SecretMetadata::path));
    final var page = matches.stream().skip(offset).limit(limit).toList();
    return new ProviderListResult(page, matches.size());
  }

  @Override
  public Optional<Secret> getSecretById(final String id) {
    ensureOpen();
    if (id == null || !id.startsWith("arn:")) return Optional.empty();
    try {
      final var request = DescribeSecretRequest.builder().secretId(id).build();
      final var described = call("describeSecret", () -> client.describeSecret(request));
      if (described.deletedDate() != null) return Optional.empty();
      final var path = settings.pathOf(described.name());
      if (path.isEmpty()) return Optional.empty();
      return Optional.of(getSecret(path.get(), null)).filter(s -> id.equals(s.id()));
    } catch (final ResourceNotFoundException | SecretNotFoundException e) {
      return Optional.empty();
    }
  }

  @Override
  public void healthCheck() {
    ensureOpen();
    final var request = ListSecretsRequest.builder().maxResults(1).build();
    call("listSecrets", () -> client.listSecrets(request));
  }

  @Override
  public void close() {
    if (!closed.compareAndSet(false, true)) return;
    try {
      client.close();
    } catch (final RuntimeException e) {
      LOGGER.log(WARNING, "Failed to close Secrets Manager client", e);
    }
  }

  private Envelope readCurrent(final String name) {
    final var request = GetSecretValueRequest.builder().secretId(name).build();
    return parse(call("getSecretValue", () -> client.getSecretValue(request)).secretString());
  }

  private Envelope readVersion(final String name, final String versionId) {
    final var request = GetSecretValueRequest.builder().secretId(name).versionId(versionId).build();
    return parse(call("getSecretValue", () -> client.getSecretValue(request)).secretString());
  }

  /**
   * Runs an SDK call. Not-found, exists and invalid-request errors pass through for the caller to
   * map; everything else becomes a {@link ProviderException}.
   */
  private static <T> T call(final String operation, final Supplier<T> op) {
    try {
      return op.get();
    } catch (final ResourceNotFoundException
        | ResourceExistsException
        | InvalidRequestException e) {
      throw e;
    } catch (final ApiCallTimeoutException | ApiCallAttemptTimeoutException e) {
      throw new ProviderTimeoutException("Secrets Manager " + operation + " timed out", e);
    } catch (final SecretsManagerException e) {
      final var code =
          e.awsErrorDetails() != null ? e.awsErrorDetails().errorCode() : "unknown error";
      throw new ProviderException(
          "Secrets Manager %s failed: %s (status %d)".formatted(operation, code, e.statusCode()),
          e);
    } catch (final SdkException e) {
      throw new ProviderException(
          "Secrets Manager %s failed: %s".formatted(operation, e.getClass().getSimpleName()), e);
    }
  }

  private void ensureOpen() {
    if (closed.get()) throw new ProviderException("Provider aws is closed");
  }

  private static String token(final String path, final int version) {
    return UUID.nameUUIDFromBytes((path + ":" + version).getBytes(StandardCharsets.UTF_8))
        .toString();
  }

  private static List<Tag> tags(final SecretMetadata metadata) {
    return metadata.tags().entrySet().stream()
        .map(e -> Tag.builder().key(e.getKey()).value(e.getValue()).build())
        .toList();
  }

  private static String envelope(
      final String value, final int version, final SecretMetadata metadata) {
    try {
      return Json.mapper().writeValueAsString(new Envelope(value, version, metadata));
    } catch (final JsonProcessingException e) {
      throw new ProviderException("Failed to serialize secret envelope", e);
    }
  }

  private static Envelope parse(final String secretString) {
    try {
      final var envelope = Json.mapper().readValue(secretString, Envelope.class);
      if (envelope.metadata() == null || envelope.version() < 1)
        throw new ProviderException("Secret string is not a managed envelope");
      return envelope;
    } catch (final JsonProcessingException | IllegalArgumentException e) {
      throw new ProviderException("Malformed secret envelope in Secrets Manager", e);
    }
  }

  record Envelope(String value, int version, SecretMetadata metadata) {}
}
