package com.example.secretsmanager.core.provider;

/**
 * Result of {@link SecretProvider#storeSecret}.
 *
 * @param id generated secret id
 * @param version stored version, always 1
 */
public record StoreResult(String id, int version) {}
