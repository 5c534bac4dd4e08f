package com.example.secretsmanager.core.provider.aws;

import static com.example.secretsmanager.core.SecretsManagerConfig.bool;
import static com.example.secretsmanager.core.SecretsManagerConfig.number;
import static com.example.secretsmanager.core.SecretsManagerConfig.setting;

import java.net.URI;
import java.util.Optional;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.secretsmanager.SecretsManagerClient;

/**
 * Settings of the AWS Secrets Manager adapter.
 *
 * <p>{@link #fromSystemProperties()} reads:
 *
 * <ul>
 *   <li>aws.region / AWS_REGION (default us-east-1)
 *   <li>aws.sm.endpoint / AWS_SM_ENDPOINT (useful for Localstack)
 *   <li>aws.accessKeyId / AWS_ACCESS_KEY_ID
 *   <li>aws.secretAccessKey / AWS_SECRET_ACCESS_KEY
 *   <li>aws.sm.prefix / AWS_SM_PREFIX (default secrets-manager)
 *   <li>aws.sm.recovery.days / AWS_SM_RECOVERY_DAYS (default 30, used without force delete)
 *   <li>aws.sm.force.delete / AWS_SM_FORCE_DELETE (default true)
 * </ul>
 *
 * @param region AWS region
 * @param endpoint endpoint override, null for the regional endpoint
 * @param accessKeyId static access key, null for the default credentials chain
 * @param secretAccessKey static secret key, null for the default credentials chain
 * @param secretPrefix name prefix of every AWS secret written by the adapter, may be empty
 * @param recoveryWindowDays recovery window of deleted secrets, between 7 and 30
 * @param forceDelete delete without a recovery window so the path can be reused immediately
 */
public record AwsSettings(
    Region region,
    URI endpoint,
    String accessKeyId,
    String secretAccessKey,
    String secretPrefix,
    int recoveryWindowDays,
    boolean forceDelete) {

  public static final String DEFAULT_PREFIX = "secrets-manager";

  public AwsSettings {
    if (region == null) region = Region.US_EAST_1;
    if (secretPrefix == null) secretPrefix = DEFAULT_PREFIX;
    while (secretPrefix.endsWith("/"))
      secretPrefix = secretPrefix.substring(0, secretPrefix.length() - 1);
    if (recoveryWindowDays < 7 || recoveryWindowDays > 30)
      throw new IllegalArgumentException("recoveryWindowDays must be between 7 and 30");
  }

  public static AwsSettings defaults() {
    return new AwsSettings(Region.US_EAST_1, null, null, null, DEFAULT_PREFIX, 30, true);
  }

  /** Reads the settings from system properties, then environment variables. */
  public static AwsSettings fromSystemProperties() {
    final var recovery = number("aws.sm.recovery.days", "AWS_SM_RECOVERY_DAYS", 30L);
    return new AwsSettings(
        setting("aws.region", "AWS_REGION").map(Region::of).orElse(Region.US_EAST_1),
        setting("aws.sm.endpoint", "AWS_SM_ENDPOINT").map(URI::create).orElse(null),
        setting("aws.accessKeyId", "AWS_ACCESS_KEY_ID").orElse(null),
        setting("aws.secretAccessKey", "AWS_SECRET_ACCESS_KEY").orElse(null),
        setting("aws.sm.prefix", "AWS_SM_PREFIX").orElse(DEFAULT_PREFIX),
        (int) Math.max(7L, Math.min(30L, recovery)),
        bool("aws.sm.force.delete", "AWS_SM_FORCE_DELETE", true));
  }

  /**
   * Builds the {@link SecretsManagerClient} honoring region, endpoint and credentials overrides.
   *
   * @return configured {@link SecretsManagerClient}
   */
  public SecretsManagerClient buildClient() {
    final var builder = SecretsManagerClient.builder().region(region);

    Optional.ofNullable(endpoint).ifPresent(builder::endpointOverride);

    // Static credentials only when both halves are present
    Optional.ofNullable(accessKeyId)
        .flatMap(
            accessKey ->
                Optional.ofNullable(secretAccessKey)
                    .map(secretKey -> AwsBasicCredentials.create(accessKey, secretKey)))
        .map(StaticCredentialsProvider::create)
        .ifPresentOrElse(
            builder::credentialsProvider,
            () -> builder.credentialsProvider(DefaultCredentialsProvider.builder().build()));

    return builder.build();
  }

  /** AWS secret name of a secret path. */
  public String secretName(final String path) {
    return secretPrefix.isEmpty() ? path : secretPrefix + "/" + path;
  }

  /** Secret path of an AWS secret name, empty when the name is outside the prefix. */
  public Optional<String> pathOf(final String secretName) {
    if (secretPrefix.isEmpty()) return Optional.of(secretName);
    final var head = secretPrefix + "/";
    return secretName.startsWith(head)
        ? Optional.of(secretName.substring(head.length()))
        : Optional.empty();
  }

  @Override
  public String toString() {
    return "AwsSettings[region=%s, endpoint=%s, secretPrefix=%s, forceDelete=%s]"
        .formatted(region, endpoint, secretPrefix, forceDelete);
  }
}
