package com.example.secretsmanager.core.audit;

import static java.lang.System.Logger.Level.INFO;

import com.example.secretsmanager.core.Json;
import com.fasterxml.jackson.core.JsonProcessingException;
import java.io.UncheckedIOException;

/** Writes each record as one JSON document to the {@value #AUDIT_LOGGER} logger. */
public class LoggingAuditSink implements AuditSink {

  public static final String AUDIT_LOGGER = "secrets.audit";

  private final System.Logger auditLogger;

  public LoggingAuditSink() {
    this(System.getLogger(AUDIT_LOGGER));
  }

  LoggingAuditSink(final System.Logger auditLogger) {
    this.auditLogger = auditLogger;
  }

  @Override
  public void write(final AuditEvent event) {
    try {
      auditLogger.log(INFO, Json.mapper().writeValueAsString(event));
    } catch (final JsonProcessingException e) {
      throw new UncheckedIOException("Failed to serialize audit event " + event.type(), e);
    }
  }
}
