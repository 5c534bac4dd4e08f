package com.example.secretsmanager.core.model;

import java.util.Collection;
import java.util.EnumSet;
import java.util.Set;

/**
 * Grants a set of actions on a path scope to principals and roles.
 *
 * <p>Scope syntax: {@code *} matches every path, {@code a/b/*} matches {@code a/b} and everything
 * below it, anything else matches that exact path. A principal entry of {@code *} matches any
 * requester.
 *
 * @param pathScope path pattern
 * @param principals requesters granted the actions
 * @param roles roles granted the actions
 * @param actions allowed actions
 */
public record AccessPolicy(
    String pathScope, Set<String> principals, Set<String> roles, Set<Action> actions) {

  public static final String ANY = "*";

  public AccessPolicy {
    principals = principals == null ? Set.of() : Set.copyOf(principals);
    roles = roles == null ? Set.of() : Set.copyOf(roles);
    actions = actions == null || actions.isEmpty() ? Set.of() : Set.copyOf(EnumSet.copyOf(actions));
  }

  public static AccessPolicy forPrincipals(
      final String pathScope, final Set<String> principals, final Action... actions) {
    return new AccessPolicy(pathScope, principals, Set.of(), Set.of(actions));
  }

  public static AccessPolicy forRoles(
      final String pathScope, final Set<String> roles, final Action... actions) {
    return new AccessPolicy(pathScope, Set.of(), roles, Set.of(actions));
  }

  /** Same grants, scoped to exactly one path. */
  public AccessPolicy scopedTo(final String path) {
    return new AccessPolicy(path, principals, roles, actions);
  }

  public boolean matchesPath(final String path) {
    if (pathScope == null || path == null) return false;
    if (ANY.equals(pathScope)) return true;
    if (pathScope.endsWith("/*")) {
      final var base = pathScope.substring(0, pathScope.length() - 2);
      return path.equals(base) || path.startsWith(base + "/");
    }
    return pathScope.equals(path);
  }

  public boolean grants(
      final String principal, final Collection<String> principalRoles, final Action action) {
    if (!actions.contains(action)) return false;
    if (principals.contains(ANY) || principals.contains(principal)) return true;
    return principalRoles.stream().anyMatch(roles::contains);
  }
}
