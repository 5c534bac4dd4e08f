package com.example.secretsmanager.core.audit;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/** Keeps records in memory. */
public class InMemoryAuditSink implements AuditSink {

  private final List<AuditEvent> events = new CopyOnWriteArrayList<>();

  @Override
  public void write(final AuditEvent event) {
    events.add(event);
  }

  public List<AuditEvent> events() {
    return List.copyOf(events);
  }

  public List<AuditEvent> events(final AuditEventType type) {
    return events.stream().filter(e -> e.type() == type).toList();
  }

  public void clear() {
    events.clear();
  }
}
