package com.example.secretsmanager.core.access;

import com.example.secretsmanager.core.model.AccessPolicy;
import java.util.Optional;

/**
 * Outcome of a policy evaluation.
 *
 * @param allowed whether the action is permitted
 * @param reason human readable explanation
 * @param grantingPolicy policy that allowed the action, null on denial
 */
public record AccessDecision(boolean allowed, String reason, AccessPolicy grantingPolicy) {

  static AccessDecision allow(final AccessPolicy policy) {
    return new AccessDecision(true, "granted by policy on " + policy.pathScope(), policy);
  }

  static AccessDecision deny(final String reason) {
    return new AccessDecision(false, reason, null);
  }

  public Optional<AccessPolicy> policy() {
    return Optional.ofNullable(grantingPolicy);
  }
}
