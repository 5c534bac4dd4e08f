package com.example.secretsmanager.core;

import com.example.secretsmanager.core.model.ProviderType;
import java.time.Instant;
import java.util.Map;

/**
 * Result of {@link SecretsManager#healthCheck()}.
 *
 * @param healthy true when every provider and the audit trail are healthy
 * @param providers per provider outcome
 * @param auditHealthy whether audit writes are succeeding
 * @param pendingAuditEvents audit records waiting to be written
 * @param checkedAt time of the check
 */
public record HealthReport(
    boolean healthy,
    Map<ProviderType, ProviderHealth> providers,
    boolean auditHealthy,
    int pendingAuditEvents,
    Instant checkedAt) {

  public HealthReport {
    providers = Map.copyOf(providers);
  }

  /**
   * Outcome of one provider health check.
   *
   * @param healthy whether the check succeeded
   * @param latencyMillis check duration
   * @param error failure message, null when healthy
   */
  public record ProviderHealth(boolean healthy, long latencyMillis, String error) {}
}
