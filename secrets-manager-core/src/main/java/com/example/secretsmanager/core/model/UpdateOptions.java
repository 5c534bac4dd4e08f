package com.example.secretsmanager.core.model;

import java.util.Map;

/**
 * Optional metadata changes applied together with a new value.
 *
 * @param description replaces the description when non-blank
 * @param tags merged over the existing tags
 */
public record UpdateOptions(String description, Map<String, String> tags) {

  public UpdateOptions {
    tags = tags == null ? Map.of() : Map.copyOf(tags);
  }

  public static UpdateOptions none() {
    return new UpdateOptions(null, Map.of());
  }

  public static UpdateOptions description(final String description) {
    return new UpdateOptions(description, Map.of());
  }
}
