package com.assistme.backend.integration.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

public record EmailListResponse(
    JsonNode items, @JsonProperty("next_page_token") String nextPageToken) {}
