/**
 * Root package of the secrets-manager library.
 *
 * <p>This package contains the orchestrator that stores, reads, rotates and deletes secrets across
 * pluggable backends, together with the collaborators it wires together.
 *
 * <p>Package contents:
 *
 * <ul>
 *   <li>{@link com.example.secretsmanager.core.SecretsManager} – entry point; enforces access,
 *       encrypts values, caches reads and audits every operation.
 *   <li>{@link com.example.secretsmanager.core.SecretsManagerConfig} – settings read from system
 *       properties and environment variables.
 *   <li>{@link com.example.secretsmanager.core.provider.SecretProvider} – backend contract, with
 *       {@link com.example.secretsmanager.core.provider.vault.VaultSecretProvider Vault KV v2},
 *       {@link com.example.secretsmanager.core.provider.aws.AwsSecretsManagerProvider AWS Secrets
 *       Manager} and {@link com.example.secretsmanager.core.provider.InMemorySecretProvider
 *       in-memory} implementations.
 *   <li>{@link com.example.secretsmanager.core.crypto.EncryptionService} – AES-GCM encryption of
 *       values with key rotation.
 *   <li>{@link com.example.secretsmanager.core.access.AccessController} – path scoped policies for
 *       principals and roles.
 *   <li>{@link com.example.secretsmanager.core.audit.AuditLogger} – buffered audit trail over a
 *       pluggable sink.
 *   <li>{@link com.example.secretsmanager.core.cache.SecretCache} – bounded TTL cache of decrypted
 *       secrets.
 *   <li>{@link com.example.secretsmanager.core.rotation.RotationScheduler} – timer driven automatic
 *       rotation with retry backoff.
 *   <li>{@link com.example.secretsmanager.core.Retry} – retry helper for idempotent provider
 *       reads.
 * </ul>
 */
package com.example.secretsmanager.core;
