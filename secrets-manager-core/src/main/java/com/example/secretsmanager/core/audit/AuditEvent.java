package com.example.secretsmanager.core.audit;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One append-only audit record. Never carries secret values.
 *
 * @param type event kind
 * @param secretPath path concerned, or the listed prefix
 * @param requester principal that triggered the event
 * @param timestamp when the operation finished
 * @param metadata operation specific details
 * @param error failure message, null on success
 * @param durationMillis operation duration
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AuditEvent(
    AuditEventType type,
    String secretPath,
    String requester,
    Instant timestamp,
    Map<String, Object> metadata,
    String error,
    long durationMillis) {

  public AuditEvent {
    metadata =
        metadata == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
  }

  public static AuditEvent success(
      final AuditEventType type,
      final String secretPath,
      final String requester,
      final Instant timestamp,
      final Map<String, Object> metadata,
      final long durationMillis) {
    return new AuditEvent(type, secretPath, requester, timestamp, metadata, null, durationMillis);
  }

  public static AuditEvent failure(
      final AuditEventType type,
      final String secretPath,
      final String requester,
      final Instant timestamp,
      final Map<String, Object> metadata,
      final String error,
      final long durationMillis) {
    return new AuditEvent(type, secretPath, requester, timestamp, metadata, error, durationMillis);
  }
}
