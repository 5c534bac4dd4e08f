package com.example.secretsmanager.core;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

import com.example.secretsmanager.core.audit.AuditEvent;
import com.example.secretsmanager.core.audit.AuditEventType;
import com.example.secretsmanager.core.audit.InMemoryAuditSink;
import com.example.secretsmanager.core.crypto.EncryptionService;
import com.example.secretsmanager.core.exception.AccessDeniedException;
import com.example.secretsmanager.core.exception.EncryptionException;
import com.example.secretsmanager.core.exception.PolicyMissingException;
import com.example.secretsmanager.core.exception.ProviderException;
import com.example.secretsmanager.core.exception.ProviderTimeoutException;
import com.example.secretsmanager.core.exception.SecretConflictException;
import com.example.secretsmanager.core.exception.SecretNotFoundException;
import com.example.secretsmanager.core.exception.UnsupportedGenerationException;
import com.example.secretsmanager.core.exception.ValidationException;
import com.example.secretsmanager.core.model.AccessPolicy;
import com.example.secretsmanager.core.model.Action;
import com.example.secretsmanager.core.model.ListFilter;
import com.example.secretsmanager.core.model.ProviderType;
import com.example.secretsmanager.core.model.RotationPolicy;
import com.example.secretsmanager.core.model.RotationPolicy.GenerationType;
import com.example.secretsmanager.core.model.RotationResult;
import com.example.secretsmanager.core.model.SecretMetadata;
import com.example.secretsmanager.core.model.SecretRequest;
import com.example.secretsmanager.core.model.SecretVersion;
import com.example.secretsmanager.core.model.UpdateOptions;
import com.example.secretsmanager.core.provider.InMemorySecretProvider;
import com.example.secretsmanager.core.provider.SecretProvider;
import com.example.secretsmanager.core.provider.StoreResult;
import com.example.secretsmanager.core.rotation.RotationListener;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.IntStream;
import org.junit.jupiter.api.*;

@TestInstance(TestInstance.Lifecycle.PER_CLASS)
public class SecretsManagerTest {

  private static final String ADMIN = "admin";
  private static final String READER = "reader";
  private static final String SYSTEM = "system";

  private MutableClock clock;
  private InMemorySecretProvider vault;
  private InMemoryAuditSink sink;
  private EncryptionService encryption;
  private SecretsManager manager;
  private final List<SecretsManager> extraManagers = new ArrayList<>();

  @BeforeEach
  void setUp() {
    clock = MutableClock.at("2024-01-01T00:00:00Z");
    vault = new InMemorySecretProvider(ProviderType.VAULT);
    sink = new InMemoryAuditSink();
    encryption = EncryptionService.fromBase64(EncryptionService.generateKey());
    manager = builder(SecretsManagerConfig.builder().build()).build();
  }

  @AfterEach
  void tearDown() {
    manager.shutdown();
    extraManagers.forEach(SecretsManager::shutdown);
    extraManagers.clear();
  }

  private SecretsManager.Builder builder(final SecretsManagerConfig config) {
    return SecretsManager.builder()
        .config(config)
        .provider(vault)
        .encryptionService(encryption)
        .policy(AccessPolicy.forPrincipals("*", Set.of(ADMIN), Action.values()))
        .policy(AccessPolicy.forPrincipals("db/*", Set.of(READER), Action.READ))
        .policy(AccessPolicy.forPrincipals("*", Set.of(READER), Action.LIST))
        .policy(AccessPolicy.forPrincipals("api-keys/*", Set.of(SYSTEM), Action.ROTATE))
        .auditSink(sink)
        .clock(clock)
        .startScheduler(false);
  }

  private SecretsManager extra(final SecretsManager.Builder builder) {
    final var built = builder.build();
    extraManagers.add(built);
    return built;
  }

  private String store(final String path, final String value) {
    return manager.storeSecret(SecretRequest.builder(path, value, ADMIN).build()).secretId();
  }

  private static void awaitUninterruptibly(final CountDownLatch latch) {
    var interrupted = false;
    while (true) {
      try {
        latch.await();
        break;
      } catch (final InterruptedException e) {
        interrupted = true;
      }
    }
    if (interrupted) Thread.currentThread().interrupt();
  }

  private AuditEvent lastEvent(final AuditEventType type) {
    final var events = sink.events(type);
    assertFalse(events.isEmpty(), "no " + type + " event");
    return events.get(events.size() - 1);
  }

  @Nested
  @DisplayName("Store and Read")
  class StoreAndRead {

    @Test
    @DisplayName("Should store version 1 encrypted and read it back decrypted")
    void shouldRoundTrip() {
      final var response =
          manager.storeSecret(
              SecretRequest.builder("database/production/main", "s3cr3t", ADMIN)
                  .description("primary database")
                  .tags(Map.of("env", "prod"))
                  .build());

      assertTrue(response.success());
      assertEquals(1, response.version());
      assertNotNull(response.secretId());
      assertTrue(vault.getSecret("database/production/main", null).value().startsWith("enc:v1:"));

      final var secret = manager.getSecret("database/production/main", ADMIN);
      assertEquals("s3cr3t", secret.value());
      assertEquals(response.secretId(), secret.id());
      assertEquals(1, secret.metadata().version());
      assertTrue(secret.metadata().encrypted());
      assertEquals("prod", secret.metadata().tags().get("env"));
      assertEquals(ProviderType.VAULT, secret.metadata().provider());
      assertEquals(ADMIN, secret.metadata().createdBy());
    }

    @Test
    @DisplayName("Should store the plain value when encryption is skipped")
    void shouldSkipEncryption() {
      manager.storeSecret(
          SecretRequest.builder("config/flag", "on", ADMIN).skipEncryption(true).build());

      assertEquals("on", vault.getSecret("config/flag", null).value());
      assertFalse(manager.getSecret("config/flag", ADMIN).metadata().encrypted());
    }

    @Test
    @DisplayName("Should refuse a second store at the same path")
    void shouldRefuseDuplicateStore() {
      store("db/main", "v1");

      assertThrows(SecretConflictException.class, () -> store("db/main", "v2"));
      assertEquals(
          "SecretConflictException",
          lastEvent(AuditEventType.SECRET_STORE_FAILED).metadata().get("errorType"));
    }

    @Test
    @DisplayName("Should report unknown paths and versions")
    void shouldReportMissing() {
      store("db/main", "v1");

      assertThrows(SecretNotFoundException.class, () -> manager.getSecret("db/none", ADMIN));
      assertThrows(SecretNotFoundException.class, () -> manager.getSecret("db/main", ADMIN, 2));
    }

    @Test
    @DisplayName("Should never put values into audit records")
    void shouldKeepValuesOutOfAudit() {
      store("db/main", "very-secret-value");
      manager.getSecret("db/main", ADMIN);
      manager.updateSecret("db/main", "another-secret-value", ADMIN);

      final var rendered = sink.events().toString();
      assertFalse(rendered.contains("very-secret-value"));
      assertFalse(rendered.contains("another-secret-value"));
    }
  }

  @Nested
  @DisplayName("Versioning")
  class Versioning {

    @Test
    @DisplayName("Should grow the version by one per update and keep history readable")
    void shouldGrowVersions() {
      final var id = store("db/main", "v1");

      manager.updateSecret("db/main", "v2", ADMIN);
      final var third =
          manager.updateSecret(
              "db/main",
              "v3",
              ADMIN,
              new UpdateOptions("rotated by hand", Map.of("owner", "payments")));

      assertEquals(3, third.version());
      assertEquals(id, third.secretId());
      final var secret = manager.getSecret("db/main", ADMIN);
      assertEquals("v3", secret.value());
      assertEquals("rotated by hand", secret.metadata().description());
      assertEquals("payments", secret.metadata().tags().get("owner"));
      assertEquals(
          List.of("v1", "v2", "v3"), secret.versions().stream().map(SecretVersion::value).toList());
      assertEquals("v1", manager.getSecret("db/main", ADMIN, 1).value());
    }

    @Test
    @DisplayName("Should fail to update a missing secret")
    void shouldFailToUpdateMissing() {
      assertThrows(
          SecretNotFoundException.class, () -> manager.updateSecret("db/none", "v", ADMIN));
    }

    @Test
    @DisplayName("Should hand out unique, gap-free versions to concurrent writers")
    void shouldSerializeConcurrentUpdates() throws Exception {
      store("db/main", "v0");
      final var pool = Executors.newFixedThreadPool(8);
      try {
        final var futures = new ArrayList<Future<Integer>>();
        for (int i = 0; i < 40; i++) {
          final var value = "v-" + i;
          futures.add(pool.submit(() -> manager.updateSecret("db/main", value, ADMIN).version()));
        }
        final var versions = new ArrayList<Integer>();
        for (final var future : futures) versions.add(future.get(30, TimeUnit.SECONDS));

        versions.sort(Integer::compare);
        assertEquals(IntStream.rangeClosed(2, 41).boxed().toList(), versions);
        assertEquals(41, manager.getSecret("db/main", ADMIN).metadata().version());
      } finally {
        pool.shutdownNow();
      }
    }
  }

  @Nested
  @DisplayName("Cache")
  class Cache {

    @Test
    @DisplayName("Should serve repeated reads from the cache")
    void shouldServeFromCache() {
      store("db/main", "v1");

      manager.getSecret("db/main", ADMIN);
      manager.getSecret("db/main", ADMIN);

      final var reads = sink.events(AuditEventType.SECRET_ACCESSED);
      assertEquals("provider", reads.get(0).metadata().get("source"));
      assertEquals("cache", reads.get(1).metadata().get("source"));
      assertEquals(1L, manager.getStats().cacheHits());
    }

    @Test
    @DisplayName("Should never serve a value older than the last write")
    void shouldInvalidateOnWrite() {
      store("db/main", "v1");
      manager.getSecret("db/main", ADMIN);

      manager.updateSecret("db/main", "v2", ADMIN);

      assertEquals("v2", manager.getSecret("db/main", ADMIN).value());
    }

    @Test
    @DisplayName("Should flush the cache on key rotation and keep values readable")
    void shouldFlushOnKeyRotation() {
      store("db/main", "v1");
      manager.getSecret("db/main", ADMIN);
      assertEquals(1L, manager.getStats().cacheSize());

      final var newKey = manager.rotateEncryptionKey();

      assertEquals(newKey, encryption.currentKeyId());
      assertEquals(0L, manager.getStats().cacheSize());
      assertEquals("v1", manager.getSecret("db/main", ADMIN).value());
      manager.updateSecret("db/main", "v2", ADMIN);
      assertTrue(vault.getSecret("db/main", null).value().contains(":" + newKey + ":"));
    }

    @Test
    @DisplayName("Should read from the provider every time when caching is disabled")
    void shouldBypassDisabledCache() {
      final var uncached =
          extra(builder(SecretsManagerConfig.builder().cacheEnabled(false).build()));
      store("db/main", "v1");

      uncached.getSecret("db/main", ADMIN);
      uncached.getSecret("db/main", ADMIN);

      assertEquals(0L, uncached.getStats().cacheHits());
      assertTrue(
          sink.events(AuditEventType.SECRET_ACCESSED).stream()
              .allMatch(e -> "provider".equals(e.metadata().get("source"))));
    }

    @Test
    @DisplayName("Should drop a value cached before a timed out write commits")
    void shouldInvalidateAfterLateCommit() throws Exception {
      final var release = new CountDownLatch(1);
      final var committed = new CountDownLatch(1);
      final var lagging =
          new InMemorySecretProvider(ProviderType.VAULT) {
            @Override
            public void updateSecret(
                final String path,
                final String value,
                final SecretMetadata metadata,
                final int expectedVersion) {
              awaitUninterruptibly(release);
              super.updateSecret(path, value, metadata, expectedVersion);
              committed.countDown();
            }
          };
      final var slow =
          extra(
              SecretsManager.builder()
                  .config(
                      SecretsManagerConfig.builder()
                          .providerTimeout(Duration.ofMillis(100))
                          .cacheTtl(Duration.ofHours(1))
                          .build())
                  .provider(lagging)
                  .encryptionService(encryption)
                  .policy(AccessPolicy.forPrincipals("*", Set.of(ADMIN), Action.values()))
                  .auditSink(sink)
                  .clock(clock)
                  .startScheduler(false));
      slow.storeSecret(SecretRequest.builder("db/main", "v1", ADMIN).build());
      assertEquals("v1", slow.getSecret("db/main", ADMIN).value());

      assertThrows(
          ProviderTimeoutException.class, () -> slow.updateSecret("db/main", "v2", ADMIN));
      assertEquals("v1", slow.getSecret("db/main", ADMIN).value());
      release.countDown();
      assertTrue(committed.await(5, TimeUnit.SECONDS));

      final var deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
      var secret = slow.getSecret("db/main", ADMIN);
      while (secret.metadata().version() != 2 && System.nanoTime() < deadline) {
        Thread.sleep(10);
        secret = slow.getSecret("db/main", ADMIN);
      }
      assertEquals(2, secret.metadata().version());
      assertEquals("v2", secret.value());
    }
  }

  @Nested
  @DisplayName("Deletion")
  class Deletion {

    @Test
    @DisplayName("Should delete the secret and its history")
    void shouldDelete() {
      store("foo/bar", "v1");
      manager.getSecret("foo/bar", ADMIN);

      manager.deleteSecret("foo/bar", ADMIN);

      assertThrows(SecretNotFoundException.class, () -> manager.getSecret("foo/bar", ADMIN));
      assertEquals(1, sink.events(AuditEventType.SECRET_DELETED).size());
    }

    @Test
    @DisplayName("Should give a reused path a new id at version 1")
    void shouldReuseDeletedPath() {
      final var first = store("foo/bar", "v1");
      manager.updateSecret("foo/bar", "v2", ADMIN);
      manager.deleteSecret("foo/bar", ADMIN);

      final var second = manager.storeSecret(SecretRequest.builder("foo/bar", "w1", ADMIN).build());

      assertNotEquals(first, second.secretId());
      assertEquals(1, second.version());
      assertEquals("w1", manager.getSecret("foo/bar", ADMIN).value());
    }

    @Test
    @DisplayName("Should cancel the rotation of a deleted secret")
    void shouldCancelRotation() {
      final var id =
          manager
              .storeSecret(
                  SecretRequest.builder("api-keys/github", "ghp_test123", ADMIN)
                      .rotationPolicy(RotationPolicy.automatic(30, GenerationType.API_KEY))
                      .build())
              .secretId();
      assertTrue(manager.scheduler().getNextRotationTime(id).isPresent());

      manager.deleteSecret("api-keys/github", ADMIN);

      assertTrue(manager.scheduler().getNextRotationTime(id).isEmpty());
      assertThrows(SecretNotFoundException.class, () -> manager.rotateSecret(id, ADMIN));
    }

    @Test
    @DisplayName("Should fail to delete a missing secret")
    void shouldFailToDeleteMissing() {
      assertThrows(SecretNotFoundException.class, () -> manager.deleteSecret("foo/bar", ADMIN));
      assertEquals(1, sink.events(AuditEventType.SECRET_DELETE_FAILED).size());
    }
  }

  @Nested
  @DisplayName("Access Control")
  class AccessControl {

    @Test
    @DisplayName("Should deny and audit requesters without a grant")
    void shouldDenyWithoutGrant() {
      store("db/main", "v1");

      assertThrows(AccessDeniedException.class, () -> manager.getSecret("db/main", "mallory"));
      assertThrows(
          AccessDeniedException.class, () -> manager.updateSecret("db/main", "x", READER));
      assertThrows(AccessDeniedException.class, () -> manager.deleteSecret("db/main", READER));

      assertEquals(3, sink.events(AuditEventType.ACCESS_DENIED).size());
      assertEquals("v1", manager.getSecret("db/main", READER).value());
    }

    @Test
    @DisplayName("Should honour and then forget a secret-level policy")
    void shouldHonourSecretPolicy() {
      manager.storeSecret(
          SecretRequest.builder("team/app", "v1", ADMIN)
              .accessPolicy(AccessPolicy.forPrincipals("team/app", Set.of("dave"), Action.READ))
              .build());

      assertEquals("v1", manager.getSecret("team/app", "dave").value());
      manager.deleteSecret("team/app", ADMIN);
      manager.storeSecret(SecretRequest.builder("team/app", "v2", ADMIN).build());

      assertThrows(AccessDeniedException.class, () -> manager.getSecret("team/app", "dave"));
    }

    @Test
    @DisplayName("Should reload secret-level policies from provider metadata")
    void shouldReloadSecretPolicies() {
      manager.storeSecret(
          SecretRequest.builder("team/app", "v1", ADMIN)
              .accessPolicy(AccessPolicy.forPrincipals("team/app", Set.of("dave"), Action.READ))
              .build());
      final var restarted = extra(builder(SecretsManagerConfig.builder().build()));
      assertThrows(AccessDeniedException.class, () -> restarted.getSecret("team/app", "dave"));

      assertEquals(1, restarted.reloadSecretPolicies());

      assertEquals("v1", restarted.getSecret("team/app", "dave").value());
    }
  }

  @Nested
  @DisplayName("Listing")
  class Listing {

    @BeforeEach
    void seed() {
      manager.storeSecret(
          SecretRequest.builder("db/a", "v", ADMIN).tags(Map.of("env", "prod")).build());
      manager.storeSecret(
          SecretRequest.builder("db/b", "v", ADMIN).tags(Map.of("env", "dev")).build());
      manager.storeSecret(
          SecretRequest.builder("db/c", "v", ADMIN).tags(Map.of("env", "prod")).build());
      store("api-keys/x", "v");
    }

    @Test
    @DisplayName("Should silently leave out secrets the requester cannot read")
    void shouldHideUnreadable() {
      final var result = manager.listSecrets(READER, ListFilter.all());

      assertEquals(3, result.total());
      assertEquals(
          List.of("db/a", "db/b", "db/c"),
          result.secrets().stream().map(SecretMetadata::path).toList());
      assertEquals(4, manager.listSecrets(ADMIN, null).total());
    }

    @Test
    @DisplayName("Should page after the access filter")
    void shouldPageAfterFilter() {
      final var first = manager.listSecrets(READER, ListFilter.all().page(2, 0));
      final var last = manager.listSecrets(READER, ListFilter.all().page(2, 2));

      assertEquals(
          List.of("db/a", "db/b"), first.secrets().stream().map(SecretMetadata::path).toList());
      assertTrue(first.hasMore());
      assertEquals(List.of("db/c"), last.secrets().stream().map(SecretMetadata::path).toList());
      assertFalse(last.hasMore());
      assertEquals(3, last.total());
    }

    @Test
    @DisplayName("Should filter by prefix and tags")
    void shouldFilterByPrefixAndTags() {
      final var result =
          manager.listSecrets(ADMIN, ListFilter.prefix("db/").withTags(Map.of("env", "prod")));

      assertEquals(
          List.of("db/a", "db/c"), result.secrets().stream().map(SecretMetadata::path).toList());
      assertEquals("db/", lastEvent(AuditEventType.SECRETS_LISTED).secretPath());
    }

    @Test
    @DisplayName("Should require list access on the prefix")
    void shouldRequireListAccess() {
      assertThrows(
          AccessDeniedException.class, () -> manager.listSecrets("mallory", ListFilter.all()));
    }
  }

  @Nested
  @DisplayName("Rotation")
  class Rotation {

    private String storeWithPolicy(final String path, final RotationPolicy policy) {
      return manager
          .storeSecret(
              SecretRequest.builder(path, "ghp_test123", ADMIN).rotationPolicy(policy).build())
          .secretId();
    }

    @Test
    @DisplayName("Should rotate to a generated value and schedule the next rotation")
    void shouldRotate() {
      final var id =
          storeWithPolicy("api-keys/github", RotationPolicy.automatic(30, GenerationType.API_KEY));

      final var result = manager.rotateSecret(id, SYSTEM);

      assertEquals(1, result.oldVersion());
      assertEquals(2, result.newVersion());
      assertTrue(result.newValue().matches("[A-Za-z0-9]{64}"));
      assertEquals(clock.instant().plus(Duration.ofDays(30)), result.nextRotation());
      final var secret = manager.getSecret("api-keys/github", ADMIN);
      assertEquals(result.newValue(), secret.value());
      assertEquals("ghp_test123", manager.getSecret("api-keys/github", ADMIN, 1).value());
      assertTrue(secret.metadata().description().startsWith("Rotated on "));
      assertEquals(SYSTEM, secret.metadata().updatedBy());
      final var event = lastEvent(AuditEventType.SECRET_ROTATED);
      assertEquals("api_key", event.metadata().get("generationType"));
      assertEquals(2, event.metadata().get("newVersion"));
    }

    @Test
    @DisplayName("Should rotate with a registered custom generator")
    void shouldUseCustomGenerator() {
      final var custom =
          extra(builder(SecretsManagerConfig.builder().build()).generator("fixed", () -> "tok-1"));
      final var id =
          custom
              .storeSecret(
                  SecretRequest.builder("api-keys/custom", "old", ADMIN)
                      .rotationPolicy(RotationPolicy.custom(30, "fixed"))
                      .build())
              .secretId();

      assertEquals("tok-1", custom.rotateSecret(id, ADMIN).newValue());
    }

    @Test
    @DisplayName("Should refuse secrets without a policy or with certificate generation")
    void shouldRefuseUnrotatable() {
      final var plain = store("db/plain", "v1");
      final var certificate =
          storeWithPolicy("db/cert", RotationPolicy.manual(GenerationType.CERTIFICATE));

      assertThrows(PolicyMissingException.class, () -> manager.rotateSecret(plain, ADMIN));
      assertThrows(
          UnsupportedGenerationException.class, () -> manager.rotateSecret(certificate, ADMIN));
      assertEquals(1, manager.getSecret("db/cert", ADMIN).metadata().version());
      assertEquals(2, sink.events(AuditEventType.SECRET_ROTATION_FAILED).size());
    }

    @Test
    @DisplayName("Should require rotate access and report unknown ids")
    void shouldCheckRotateAccess() {
      final var id = storeWithPolicy("db/main", RotationPolicy.manual(GenerationType.PASSWORD));

      assertThrows(AccessDeniedException.class, () -> manager.rotateSecret(id, SYSTEM));
      assertThrows(SecretNotFoundException.class, () -> manager.rotateSecret("nope", ADMIN));
    }

    @Test
    @DisplayName("Should restore rotation jobs of stored secrets on a new manager")
    void shouldRestoreRotationJobs() {
      final var id =
          storeWithPolicy("api-keys/github", RotationPolicy.automatic(30, GenerationType.API_KEY));
      storeWithPolicy("api-keys/manual", RotationPolicy.manual(GenerationType.API_KEY));
      store("api-keys/plain", "v1");
      clock.advance(Duration.ofDays(10));
      final var restarted = extra(builder(SecretsManagerConfig.builder().build()));
      assertEquals(0, restarted.getStats().scheduledRotations());

      assertEquals(1, restarted.reloadRotationSchedules());
      assertEquals(0, restarted.reloadRotationSchedules());

      assertEquals(1, restarted.getStats().scheduledRotations());
      assertEquals(
          clock.instant().plus(Duration.ofDays(20)),
          restarted.scheduler().getNextRotationTime(id).orElseThrow());
    }

    @Test
    @DisplayName("Should restore rotation jobs and secret policies when the scheduler starts")
    void shouldRestoreOnStart() {
      final var id =
          storeWithPolicy("api-keys/github", RotationPolicy.automatic(30, GenerationType.API_KEY));
      manager.storeSecret(
          SecretRequest.builder("team/app", "v1", ADMIN)
              .accessPolicy(AccessPolicy.forPrincipals("team/app", Set.of("dave"), Action.READ))
              .build());
      clock.advance(Duration.ofDays(45));

      final var restarted =
          extra(builder(SecretsManagerConfig.builder().build()).startScheduler(true));

      assertTrue(restarted.scheduler().getNextRotationTime(id).isPresent());
      assertEquals(1, restarted.getStats().overdueRotations());
      assertEquals("v1", restarted.getSecret("team/app", "dave").value());
    }

    @Test
    @DisplayName("Should reject policies below the minimum interval")
    void shouldRejectShortIntervals() {
      final var strict =
          extra(builder(SecretsManagerConfig.builder().minRotationIntervalDays(7).build()));

      assertThrows(
          ValidationException.class,
          () ->
              strict.storeSecret(
                  SecretRequest.builder("api-keys/short", "v", ADMIN)
                      .rotationPolicy(RotationPolicy.automatic(3, GenerationType.PASSWORD))
                      .build()));
    }

    @Test
    @DisplayName("Should rotate due secrets from the scheduler as the system principal")
    void shouldRotateFromScheduler() throws Exception {
      final var rotated = new CountDownLatch(1);
      final var scheduled =
          extra(
              builder(
                      SecretsManagerConfig.builder()
                          .rotationPollInterval(Duration.ofMillis(20))
                          .build())
                  .rotationListener(
                      new RotationListener() {
                        @Override
                        public void onRotationSucceeded(
                            final String secretId, final RotationResult result) {
                          rotated.countDown();
                        }
                      })
                  .startScheduler(true));
      final var id =
          scheduled
              .storeSecret(
                  SecretRequest.builder("api-keys/github", "ghp_test123", ADMIN)
                      .rotationPolicy(RotationPolicy.automatic(30, GenerationType.API_KEY))
                      .build())
              .secretId();

      clock.advance(Duration.ofDays(30));

      assertTrue(rotated.await(5, TimeUnit.SECONDS));
      assertEquals(2, scheduled.getSecret("api-keys/github", ADMIN).metadata().version());
      assertEquals(SYSTEM, lastEvent(AuditEventType.SECRET_ROTATED).requester());
      assertEquals(
          clock.instant().plus(Duration.ofDays(30)),
          scheduled.scheduler().getNextRotationTime(id).orElseThrow());
    }
  }

  @Nested
  @DisplayName("Validation")
  class Validation {

    @Test
    @DisplayName("Should reject malformed paths")
    void shouldRejectMalformedPaths() {
      for (final var path : List.of("", "/db/main", "db/main/", "db//main", "db/../x", "db main"))
        assertThrows(ValidationException.class, () -> store(path, "v"), path);
    }

    @Test
    @DisplayName("Should reject empty, oversized and unattributed requests")
    void shouldRejectBadRequests() {
      final var small =
          extra(builder(SecretsManagerConfig.builder().maxSecretSize(8).build()));

      assertThrows(ValidationException.class, () -> store("db/main", ""));
      assertThrows(
          ValidationException.class,
          () -> small.storeSecret(SecretRequest.builder("db/big", "123456789", ADMIN).build()));
      assertThrows(
          ValidationException.class,
          () -> manager.storeSecret(SecretRequest.builder("db/main", "v", " ").build()));
      assertThrows(ValidationException.class, () -> manager.storeSecret(null));
      assertThrows(ValidationException.class, () -> manager.getSecret("db/main", ADMIN, 0));
    }

    @Test
    @DisplayName("Should reject a provider that does not serve the path")
    void shouldRejectProviderMismatch() {
      assertThrows(
          ValidationException.class,
          () ->
              manager.storeSecret(
                  SecretRequest.builder("db/main", "v", ADMIN).provider(ProviderType.AWS).build()));
      assertThrows(ProviderException.class, () -> store("aws/payments/key", "v"));
    }
  }

  @Nested
  @DisplayName("Providers and Encryption")
  class ProvidersAndEncryption {

    private void storeRaw(final String path, final String stored) {
      final var request = SecretRequest.builder(path, "value", ADMIN).build();
      vault.storeSecret(
          path,
          stored,
          SecretMetadata.initial(request, ProviderType.VAULT, true, clock.instant()),
          Map.of());
    }

    @Test
    @DisplayName("Should refuse tampered ciphertext")
    void shouldRefuseTamperedCiphertext() {
      final var ciphertext = encryption.encrypt("value");
      final var separator = ciphertext.lastIndexOf(':');
      final var payload = Base64.getDecoder().decode(ciphertext.substring(separator + 1));
      payload[payload.length - 1] ^= 0x01;
      storeRaw(
          "db/tampered",
          ciphertext.substring(0, separator + 1) + Base64.getEncoder().encodeToString(payload));

      assertThrows(EncryptionException.class, () -> manager.getSecret("db/tampered", ADMIN));
    }

    @Test
    @DisplayName("Should refuse every single-bit change of the stored value")
    void shouldRefuseEveryBitFlip() {
      final var ciphertext = encryption.encrypt("abc");
      var count = 0;
      for (int i = 0; i < ciphertext.length(); i++) {
        for (int bit = 0; bit < 8; bit++) {
          final var chars = ciphertext.toCharArray();
          chars[i] ^= (char) (1 << bit);
          final var path = "db/flipped-" + count++;
          storeRaw(path, new String(chars));

          assertThrows(
              EncryptionException.class,
              () -> manager.getSecret(path, ADMIN),
              "char " + i + " bit " + bit);
        }
      }
      storeRaw("db/intact", ciphertext);
      assertEquals("abc", manager.getSecret("db/intact", ADMIN).value());
    }

    @Test
    @DisplayName("Should store plain values when encryption is disabled")
    void shouldStorePlainWithoutEncryption() {
      final var plain =
          extra(
              SecretsManager.builder()
                  .config(SecretsManagerConfig.builder().encryptionEnabled(false).build())
                  .provider(vault)
                  .policy(AccessPolicy.forPrincipals("*", Set.of(ADMIN), Action.values()))
                  .auditSink(sink)
                  .startScheduler(false));

      plain.storeSecret(SecretRequest.builder("db/plain", "v1", ADMIN).build());

      assertEquals("v1", vault.getSecret("db/plain", null).value());
      assertThrows(IllegalStateException.class, plain::rotateEncryptionKey);
    }

    @Test
    @DisplayName("Should bound provider calls by the timeout")
    void shouldTimeOutSlowProviders() {
      final var slow = mock(SecretProvider.class);
      when(slow.type()).thenReturn(ProviderType.AWS);
      when(slow.storeSecret(any(), any(), any(), any()))
          .thenAnswer(
              inv -> {
                Thread.sleep(5_000);
                return new StoreResult("late", 1);
              });
      final var bounded =
          extra(
              builder(
                      SecretsManagerConfig.builder()
                          .providerTimeout(Duration.ofMillis(100))
                          .build())
                  .provider(slow));

      assertThrows(
          ProviderTimeoutException.class,
          () -> bounded.storeSecret(SecretRequest.builder("aws/slow", "v", ADMIN).build()));
      assertEquals(
          "ProviderTimeoutException",
          lastEvent(AuditEventType.SECRET_STORE_FAILED).metadata().get("errorType"));
    }

    @Test
    @DisplayName("Should report provider health, audit health and stats")
    void shouldReportHealthAndStats() {
      manager.storeSecret(
          SecretRequest.builder("api-keys/github", "ghp_test123", ADMIN)
              .rotationPolicy(RotationPolicy.automatic(30, GenerationType.API_KEY))
              .build());

      final var report = manager.healthCheck();
      final var stats = manager.getStats();

      assertTrue(report.healthy());
      assertTrue(report.providers().get(ProviderType.VAULT).healthy());
      assertEquals(Set.of(ProviderType.VAULT), stats.providers());
      assertEquals(1, stats.scheduledRotations());
      assertEquals(0, stats.overdueRotations());
      assertTrue(stats.auditHealthy());
    }

    @Test
    @DisplayName("Should report an unhealthy provider without throwing")
    void shouldReportUnhealthyProvider() {
      final var broken = mock(SecretProvider.class);
      when(broken.type()).thenReturn(ProviderType.AWS);
      doThrow(new ProviderException("unreachable")).when(broken).healthCheck();
      final var mixed = extra(builder(SecretsManagerConfig.builder().build()).provider(broken));

      final var report = mixed.healthCheck();

      assertFalse(report.healthy());
      assertTrue(report.providers().get(ProviderType.VAULT).healthy());
      assertEquals("unreachable", report.providers().get(ProviderType.AWS).error());
    }
  }

  @Nested
  @DisplayName("Shutdown")
  class Shutdown {

    @Test
    @DisplayName("Should refuse operations after shutdown and close providers")
    void shouldRefuseAfterShutdown() {
      store("db/main", "v1");

      manager.shutdown();
      manager.close();

      assertThrows(IllegalStateException.class, () -> manager.getSecret("db/main", ADMIN));
      assertThrows(ProviderException.class, vault::healthCheck);
    }
  }
}
