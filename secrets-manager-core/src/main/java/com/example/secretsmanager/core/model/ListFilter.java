package com.example.secretsmanager.core.model;

import java.util.Map;

/**
 * Selection and paging for {@code listSecrets}.
 *
 * @param prefix path prefix, null for all paths
 * @param tags tags every result must carry
 * @param provider restricts the listing to one provider, null for all configured providers
 * @param limit page size
 * @param offset number of accessible results to skip
 */
public record ListFilter(
    String prefix, Map<String, String> tags, ProviderType provider, int limit, int offset) {

  public static final int DEFAULT_LIMIT = 50;

  public ListFilter {
    tags = tags == null ? Map.of() : Map.copyOf(tags);
    if (limit <= 0) limit = DEFAULT_LIMIT;
    if (offset < 0) offset = 0;
  }

  public static ListFilter all() {
    return new ListFilter(null, Map.of(), null, DEFAULT_LIMIT, 0);
  }

  public static ListFilter prefix(final String prefix) {
    return new ListFilter(prefix, Map.of(), null, DEFAULT_LIMIT, 0);
  }

  public ListFilter withTags(final Map<String, String> newTags) {
    return new ListFilter(prefix, newTags, provider, limit, offset);
  }

  public ListFilter withProvider(final ProviderType newProvider) {
    return new ListFilter(prefix, tags, newProvider, limit, offset);
  }

  public ListFilter page(final int newLimit, final int newOffset) {
    return new ListFilter(prefix, tags, provider, newLimit, newOffset);
  }
}
