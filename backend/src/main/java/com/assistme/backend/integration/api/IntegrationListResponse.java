package com.assistme.backend.integration.api;

import java.util.List;

public record IntegrationListResponse(List<IntegrationSummary> items) {}
