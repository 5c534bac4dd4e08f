package com.example.secretsmanager.core.audit;

/** Destination of audit records. */
public interface AuditSink extends AutoCloseable {

  /**
   * Persists one record.
   *
   * @param event record to persist
   * @throws RuntimeException when the record could not be persisted
   */
  void write(AuditEvent event);

  @Override
  default void close() {}
}
