package com.example.secretsmanager.core.access;

import static org.junit.jupiter.api.Assertions.*;

import com.example.secretsmanager.core.MutableClock;
import com.example.secretsmanager.core.audit.AuditEventType;
import com.example.secretsmanager.core.audit.AuditLogger;
import com.example.secretsmanager.core.audit.InMemoryAuditSink;
import com.example.secretsmanager.core.exception.AccessDeniedException;
import com.example.secretsmanager.core.model.AccessPolicy;
import com.example.secretsmanager.core.model.Action;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.*;

@TestInstance(TestInstance.Lifecycle.PER_CLASS)
public class AccessControllerTest {

  private InMemoryAuditSink sink;
  private AccessController controller;

  @BeforeEach
  void setUp() {
    sink = new InMemoryAuditSink();
    controller =
        new AccessController(
            List.of(
                AccessPolicy.forPrincipals("db/*", Set.of("alice"), Action.READ, Action.WRITE),
                AccessPolicy.forRoles("api-keys/*", Set.of("ops"), Action.values()),
                AccessPolicy.forPrincipals("public/banner", Set.of("*"), Action.READ)),
            Map.of("bob", Set.of("ops")),
            new AuditLogger(sink, 3),
            MutableClock.at("2024-03-01T00:00:00Z"));
  }

  @Nested
  @DisplayName("Path Scopes")
  class PathScopes {

    @Test
    @DisplayName("Should match the base path and everything below a wildcard scope")
    void shouldMatchWildcardScope() {
      final var policy = AccessPolicy.forPrincipals("db/*", Set.of("alice"), Action.READ);

      assertTrue(policy.matchesPath("db"));
      assertTrue(policy.matchesPath("db/main"));
      assertTrue(policy.matchesPath("db/main/replica"));
      assertFalse(policy.matchesPath("dbx/main"));
    }

    @Test
    @DisplayName("Should match only the exact path without a wildcard")
    void shouldMatchExactScope() {
      final var policy = AccessPolicy.forPrincipals("db/main", Set.of("alice"), Action.READ);

      assertTrue(policy.matchesPath("db/main"));
      assertFalse(policy.matchesPath("db/main/replica"));
    }

    @Test
    @DisplayName("Should match every path with the global scope")
    void shouldMatchGlobalScope() {
      assertTrue(AccessPolicy.forPrincipals("*", Set.of("a"), Action.READ).matchesPath("x/y"));
    }
  }

  @Nested
  @DisplayName("Decisions")
  class Decisions {

    @Test
    @DisplayName("Should allow a granted principal and name the granting policy")
    void shouldAllowGrantedPrincipal() {
      final var decision = controller.evaluate("alice", Action.READ, "db/main");

      assertTrue(decision.allowed());
      assertEquals("db/*", decision.policy().orElseThrow().pathScope());
    }

    @Test
    @DisplayName("Should deny actions the policy does not list")
    void shouldDenyUnlistedAction() {
      assertFalse(controller.evaluate("alice", Action.DELETE, "db/main").allowed());
    }

    @Test
    @DisplayName("Should allow through roles")
    void shouldAllowThroughRoles() {
      assertTrue(controller.evaluate("bob", Action.ROTATE, "api-keys/github").allowed());
      assertFalse(controller.evaluate("alice", Action.ROTATE, "api-keys/github").allowed());
    }

    @Test
    @DisplayName("Should allow any requester through a wildcard principal")
    void shouldAllowWildcardPrincipal() {
      assertTrue(controller.evaluate("mallory", Action.READ, "public/banner").allowed());
    }

    @Test
    @DisplayName("Should give the system principal no implicit rights")
    void shouldNotTrustSystemPrincipal() {
      assertFalse(
          controller
              .evaluate(AccessController.SYSTEM_PRINCIPAL, Action.ROTATE, "db/main")
              .allowed());
    }

    @Test
    @DisplayName("Should deny blank requesters")
    void shouldDenyBlankRequesters() {
      assertFalse(controller.evaluate(" ", Action.READ, "public/banner").allowed());
      assertFalse(controller.evaluate(null, Action.READ, "public/banner").allowed());
    }

    @Test
    @DisplayName("Should pick up roles assigned later")
    void shouldPickUpAssignedRoles() {
      controller.assignRoles("carol", Set.of("ops"));

      assertTrue(controller.evaluate("carol", Action.DELETE, "api-keys/stripe").allowed());
    }
  }

  @Nested
  @DisplayName("Secret Policies")
  class SecretPolicies {

    @Test
    @DisplayName("Should scope a secret policy to exactly its path")
    void shouldScopeToExactPath() {
      controller.registerSecretPolicy(
          "team/app", AccessPolicy.forPrincipals("*", Set.of("dave"), Action.READ));

      assertTrue(controller.evaluate("dave", Action.READ, "team/app").allowed());
      assertFalse(controller.evaluate("dave", Action.READ, "team/app/other").allowed());
      assertFalse(controller.evaluate("dave", Action.READ, "team/other").allowed());
    }

    @Test
    @DisplayName("Should stop granting after the secret policy is removed")
    void shouldStopGrantingAfterRemoval() {
      controller.registerSecretPolicy(
          "team/app", AccessPolicy.forPrincipals("team/app", Set.of("dave"), Action.READ));
      controller.removeSecretPolicy("team/app");

      assertFalse(controller.evaluate("dave", Action.READ, "team/app").allowed());
      assertEquals(3, controller.policies().size());
    }
  }

  @Nested
  @DisplayName("Enforcement")
  class Enforcement {

    @Test
    @DisplayName("Should throw and audit a denial")
    void shouldThrowAndAuditDenial() {
      final var error =
          assertThrows(
              AccessDeniedException.class,
              () -> controller.checkAccess("mallory", Action.READ, "db/main"));

      assertEquals("mallory", error.requester());
      assertEquals(Action.READ, error.action());
      assertEquals("db/main", error.path());
      final var denials = sink.events(AuditEventType.ACCESS_DENIED);
      assertEquals(1, denials.size());
      assertEquals("mallory", denials.get(0).requester());
      assertEquals("read", denials.get(0).metadata().get("action"));
      assertNotNull(denials.get(0).error());
    }

    @Test
    @DisplayName("Should not audit allowed access")
    void shouldNotAuditAllowedAccess() {
      assertTrue(controller.checkAccess("alice", Action.WRITE, "db/main").allowed());
      assertTrue(sink.events().isEmpty());
    }
  }
}
