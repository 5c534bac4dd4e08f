package com.example.secretsmanager.core.provider;

import com.example.secretsmanager.core.model.SecretMetadata;
import java.util.List;

/**
 * Result of {@link SecretProvider#listSecrets}.
 *
 * @param secrets metadata of the requested page
 * @param total matches before paging
 */
public record ProviderListResult(List<SecretMetadata> secrets, int total) {

  public ProviderListResult {
    secrets = List.copyOf(secrets);
  }
}
