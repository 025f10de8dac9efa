package com.assistme.backend.integration.provider;

import com.fasterxml.jackson.annotation.JsonProperty;

public record ProviderDescriptor(
    @JsonProperty("provider_type") String providerType, String name, String description) {}
