package com.assistme.backend.integration.api;

import java.util.List;

/** Request-side overrides of an email listing; {@code null} falls back to integration config. */
public record EmailListQuery(
    String query, String filter, List<String> labelIds, Integer maxResults, String pageToken) {

  /** Limit on the caller's own query; filter prefixes come on top of it. */
  public static final int MAX_QUERY_LENGTH = 500;
}
