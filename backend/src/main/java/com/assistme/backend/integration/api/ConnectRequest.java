package com.assistme.backend.integration.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import java.util.List;

public record ConnectRequest(
    @JsonProperty("redirect_uri")
        @NotBlank(message = "redirect_uri is required")
        @Size(max = 512, message = "redirect_uri is too long")
        String redirectUri,
    List<String> scopes) {}
