package com.example.secretsmanager.core.audit;

import com.example.secretsmanager.core.Json;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/** Appends records to a file, one JSON document per line. */
public class JsonLinesAuditSink implements AuditSink {

  private final Path file;

  public JsonLinesAuditSink(final Path file) {
    this.file = file;
  }

  public Path file() {
    return file;
  }

  @Override
  public synchronized void write(final AuditEvent event) {
    try {
      final var line = Json.mapper().writeValueAsString(event) + System.lineSeparator();
      Files.writeString(
          file,
          line,
          StandardCharsets.UTF_8,
          StandardOpenOption.CREATE,
          StandardOpenOption.APPEND,
          StandardOpenOption.WRITE);
    } catch (final IOException e) {
      throw new UncheckedIOException("Failed to append audit event to " + file, e);
    }
  }
}
