package com.example.secretsmanager.core.model;

import java.util.List;

/**
 * One page of accessible secrets.
 *
 * @param secrets metadata of the page
 * @param total accessible matches across all pages
 * @param hasMore whether a later page exists
 */
public record ListResult(List<SecretMetadata> secrets, int total, boolean hasMore) {

  public ListResult {
    secrets = List.copyOf(secrets);
  }
}
