package com.example.secretsmanager.core.audit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

import com.example.secretsmanager.core.Json;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Map;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;

@TestInstance(TestInstance.Lifecycle.PER_CLASS)
public class AuditLoggerTest {

  private static final Instant NOW = Instant.parse("2024-03-01T12:00:00Z");

  private static AuditEvent event(final String path) {
    return AuditEvent.success(
        AuditEventType.SECRET_ACCESSED, path, "alice", NOW, Map.of("source", "cache"), 3L);
  }

  @Nested
  @DisplayName("Event Types")
  class EventTypes {

    @Test
    @DisplayName("Should expose wire names and failure kinds")
    void shouldExposeWireNames() {
      assertEquals("secret_rotation_failed", AuditEventType.SECRET_ROTATION_FAILED.wireName());
      assertEquals(AuditEventType.SECRETS_LISTED, AuditEventType.fromWireName("secrets_listed"));
      assertTrue(AuditEventType.ACCESS_DENIED.isFailure());
      assertTrue(AuditEventType.SECRET_STORE_FAILED.isFailure());
      assertFalse(AuditEventType.SECRET_STORED.isFailure());
      assertThrows(IllegalArgumentException.class, () -> AuditEventType.fromWireName("nope"));
    }
  }

  @Nested
  @DisplayName("Healthy Sink")
  class HealthySink {

    @Test
    @DisplayName("Should write events in order")
    void shouldWriteInOrder() {
      final var sink = new InMemoryAuditSink();
      final var logger = new AuditLogger(sink, 3);

      logger.logEvent(event("a"));
      logger.logEvent(event("b"));

      assertEquals(2, sink.events().size());
      assertEquals("a", sink.events().get(0).secretPath());
      assertEquals("b", sink.events().get(1).secretPath());
      assertTrue(logger.isHealthy());
      assertEquals(0, logger.pendingCount());
    }

    @Test
    @DisplayName("Should append JSON lines with wire names and ISO timestamps")
    void shouldAppendJsonLines(@TempDir final Path dir) throws Exception {
      final var file = dir.resolve("audit.jsonl");
      final var logger = new AuditLogger(new JsonLinesAuditSink(file), 3);

      logger.logEvent(event("db/main"));
      logger.logEvent(
          AuditEvent.failure(
              AuditEventType.ACCESS_DENIED, "db/main", "mallory", NOW, Map.of(), "denied", 0L));

      final var lines = Files.readAllLines(file);
      assertEquals(2, lines.size());
      final var first = Json.mapper().readTree(lines.get(0));
      assertEquals("secret_accessed", first.get("type").asText());
      assertEquals("2024-03-01T12:00:00Z", first.get("timestamp").asText());
      assertFalse(first.has("error"));
      final var second = Json.mapper().readValue(lines.get(1), AuditEvent.class);
      assertEquals(AuditEventType.ACCESS_DENIED, second.type());
      assertEquals("denied", second.error());
    }

    @Test
    @DisplayName("Should render events through the audit logger")
    void shouldRenderThroughLogger() {
      final var target = mock(System.Logger.class);
      final var sink = new LoggingAuditSink(target);

      sink.write(event("db/main"));

      verify(target).log(eq(System.Logger.Level.INFO), contains("\"secret_accessed\""));
    }
  }

  @Nested
  @DisplayName("Failing Sink")
  class FailingSink {

    @Test
    @DisplayName("Should degrade after the failure threshold and never throw")
    void shouldDegradeAfterThreshold() {
      final var sink = mock(AuditSink.class);
      doThrow(new UncheckedIOException("disk full", new java.io.IOException()))
          .when(sink)
          .write(any());
      final var logger = new AuditLogger(sink, 3);

      assertDoesNotThrow(() -> logger.logEvent(event("a")));
      logger.logEvent(event("b"));
      assertTrue(logger.isHealthy());

      logger.logEvent(event("c"));

      assertFalse(logger.isHealthy());
      assertEquals(3, logger.pendingCount());
    }

    @Test
    @DisplayName("Should flush pending events in order once the sink recovers")
    void shouldFlushAfterRecovery() {
      final var delegate = new InMemoryAuditSink();
      final var failing = new boolean[] {true};
      final AuditSink sink =
          e -> {
            if (failing[0]) throw new IllegalStateException("unavailable");
            delegate.write(e);
          };
      final var logger = new AuditLogger(sink, 1);

      logger.logEvent(event("a"));
      logger.logEvent(event("b"));
      assertFalse(logger.isHealthy());

      failing[0] = false;
      logger.logEvent(event("c"));

      assertTrue(logger.isHealthy());
      assertEquals(0, logger.pendingCount());
      assertEquals(
          java.util.List.of("a", "b", "c"),
          delegate.events().stream().map(AuditEvent::secretPath).toList());
    }

    @Test
    @DisplayName("Should drop the oldest events when the pending queue is full")
    void shouldDropOldestWhenFull() {
      final AuditSink sink =
          e -> {
            throw new IllegalStateException("unavailable");
          };
      final var logger = new AuditLogger(sink, 1, 2);

      logger.logEvent(event("a"));
      logger.logEvent(event("b"));
      logger.logEvent(event("c"));

      assertEquals(2, logger.pendingCount());
      assertEquals(1L, logger.droppedCount());
    }

    @Test
    @DisplayName("Should close the sink even when it fails")
    void shouldCloseSink() {
      final var sink = mock(AuditSink.class);
      doThrow(new IllegalStateException("close failed")).when(sink).close();
      final var logger = new AuditLogger(sink, 3);

      assertDoesNotThrow(logger::close);
      verify(sink).close();
    }
  }

  @Nested
  @DisplayName("Validation")
  class Validation {

    @Test
    @DisplayName("Should reject invalid settings")
    void shouldRejectInvalidSettings() {
      assertThrows(IllegalArgumentException.class, () -> new AuditLogger(null, 3));
      assertThrows(
          IllegalArgumentException.class, () -> new AuditLogger(new InMemoryAuditSink(), 0));
      assertThrows(
          IllegalArgumentException.class, () -> new AuditLogger(new InMemoryAuditSink(), 3, 0));
    }
  }
}
