package com.example.secretsmanager.core;

import com.example.secretsmanager.core.model.ProviderType;
import java.util.Set;

/**
 * Point-in-time counters of a {@link SecretsManager}.
 *
 * @param cacheSize cached entries, 0 when caching is disabled
 * @param cacheHits cache hits since start
 * @param cacheMisses cache misses since start
 * @param cacheHitRate hits divided by lookups, 1.0 before the first lookup
 * @param providers configured providers
 * @param scheduledRotations secrets with an automatic rotation job
 * @param overdueRotations jobs whose due time has passed
 * @param pendingAuditEvents audit records waiting to be written
 * @param auditHealthy whether audit writes are succeeding
 */
public record SecretsManagerStats(
    long cacheSize,
    long cacheHits,
    long cacheMisses,
    double cacheHitRate,
    Set<ProviderType> providers,
    int scheduledRotations,
    int overdueRotations,
    int pendingAuditEvents,
    boolean auditHealthy) {

  public SecretsManagerStats {
    providers = Set.copyOf(providers);
  }
}
