package com.assistme.backend.integration.api;

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record ExecuteRequest(
    @NotBlank(message = "action is required") @Size(max = 64) String action, JsonNode params) {}
