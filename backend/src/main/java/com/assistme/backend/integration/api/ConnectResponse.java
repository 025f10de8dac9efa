package com.assistme.backend.integration.api;

import com.fasterxml.jackson.annotation.JsonProperty;

public record ConnectResponse(
    @JsonProperty("authorization_url") String authorizationUrl, String state) {}
