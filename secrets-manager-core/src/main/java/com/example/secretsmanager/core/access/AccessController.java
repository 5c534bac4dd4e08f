package com.example.secretsmanager.core.access;

import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.INFO;

import com.example.secretsmanager.core.audit.AuditEvent;
import com.example.secretsmanager.core.audit.AuditEventType;
import com.example.secretsmanager.core.audit.AuditLogger;
import com.example.secretsmanager.core.exception.AccessDeniedException;
import com.example.secretsmanager.core.model.AccessPolicy;
import com.example.secretsmanager.core.model.Action;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Stream;

/**
 * Single policy decision point.
 *
 * <p>Access is denied unless a configured policy or the secret's own policy grants the action to
 * the requester, directly or through one of its roles. The {@value #SYSTEM_PRINCIPAL} principal
 * used by the rotation scheduler gets no implicit rights. Every denial raised by {@link
 * #checkAccess} is appended to the audit trail.
 */
public class AccessController {

  private static final System.Logger LOGGER = System.getLogger(AccessController.class.getName());

  public static final String SYSTEM_PRINCIPAL = "system";

  private final List<AccessPolicy> policies;
  private final Map<String, Set<String>> principalRoles;
  private final Map<String, AccessPolicy> secretPolicies = new ConcurrentHashMap<>();
  private final AuditLogger auditLogger;
  private final Clock clock;

  public AccessController(
      final Collection<AccessPolicy> policies,
      final Map<String, Set<String>> principalRoles,
      final AuditLogger auditLogger,
      final Clock clock) {
    this.policies = new CopyOnWriteArrayList<>(policies);
    this.principalRoles = new ConcurrentHashMap<>(principalRoles);
    this.auditLogger = auditLogger;
    this.clock = clock;
  }

  /**
   * Evaluates the policies without side effects.
   *
   * @param requester principal asking
   * @param action action requested
   * @param path secret path or listed prefix
   * @return the decision
   */
  public AccessDecision evaluate(final String requester, final Action action, final String path) {
    if (requester == null || requester.isBlank()) return AccessDecision.deny("no requester");
    final var roles = principalRoles.getOrDefault(requester, Set.of());
    return Stream.concat(policies.stream(), secretPolicies.values().stream())
        .filter(policy -> policy.matchesPath(path))
        .filter(policy -> policy.grants(requester, roles, action))
        .findFirst()
        .map(AccessDecision::allow)
        .orElseGet(
            () -> AccessDecision.deny("no policy grants %s on %s".formatted(action.code(), path)));
  }

  /**
   * Enforces the policies.
   *
   * @return the allowing decision
   * @throws AccessDeniedException if no policy allows the action; the denial is audited
   */
  public AccessDecision checkAccess(
      final String requester, final Action action, final String path) {
    final var decision = evaluate(requester, action, path);
    if (decision.allowed()) {
      LOGGER.log(DEBUG, "{0} allowed to {1} {2}", requester, action.code(), path);
      return decision;
    }
    LOGGER.log(INFO, "{0} denied {1} on {2}", requester, action.code(), path);
    auditLogger.logEvent(
        AuditEvent.failure(
            AuditEventType.ACCESS_DENIED,
            path,
            requester,
            clock.instant(),
            Map.of("action", action.code()),
            decision.reason(),
            0L));
    throw new AccessDeniedException(requester, action, path, decision.reason());
  }

  /** Registers the policy carried by a secret, scoped to exactly its path. */
  public void registerSecretPolicy(final String path, final AccessPolicy policy) {
    secretPolicies.put(path, policy.scopedTo(path));
  }

  public void removeSecretPolicy(final String path) {
    secretPolicies.remove(path);
  }

  public void addPolicy(final AccessPolicy policy) {
    policies.add(policy);
  }

  public void assignRoles(final String principal, final Set<String> roles) {
    principalRoles.put(principal, Set.copyOf(roles));
  }

  /** Configured policies followed by secret-level ones. */
  public List<AccessPolicy> policies() {
    final var all = new ArrayList<>(policies);
    all.addAll(secretPolicies.values());
    return List.copyOf(all);
  }
}
