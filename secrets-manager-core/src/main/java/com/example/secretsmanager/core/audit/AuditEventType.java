package com.example.secretsmanager.core.audit;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Arrays;

/** Kinds of audit records, rendered with their persisted wire names. */
public enum AuditEventType {
  SECRET_STORED("secret_stored"),
  SECRET_STORE_FAILED("secret_store_failed"),
  SECRET_ACCESSED("secret_accessed"),
  SECRET_ACCESS_FAILED("secret_access_failed"),
  SECRET_UPDATED("secret_updated"),
  SECRET_UPDATE_FAILED("secret_update_failed"),
  SECRET_DELETED("secret_deleted"),
  SECRET_DELETE_FAILED("secret_delete_failed"),
  SECRET_ROTATED("secret_rotated"),
  SECRET_ROTATION_FAILED("secret_rotation_failed"),
  SECRETS_LISTED("secrets_listed"),
  SECRETS_LIST_FAILED("secrets_list_failed"),
  ACCESS_DENIED("access_denied");

  private final String wireName;

  AuditEventType(final String wireName) {
    this.wireName = wireName;
  }

  @JsonValue
  public String wireName() {
    return wireName;
  }

  public boolean isFailure() {
    return this == ACCESS_DENIED || wireName.endsWith("_failed");
  }

  @JsonCreator
  public static AuditEventType fromWireName(final String wireName) {
    return Arrays.stream(values())
        .filter(type -> type.wireName.equals(wireName))
        .findFirst()
        .orElseThrow(() -> new IllegalArgumentException("Unknown audit event type: " + wireName));
  }
}
