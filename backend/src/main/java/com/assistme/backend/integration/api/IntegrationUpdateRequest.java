package com.assistme.backend.integration.api;

import com.assistme.backend.integration.domain.IntegrationStatus;
import java.util.Map;

public record IntegrationUpdateRequest(IntegrationStatus status, Map<String, Object> config) {}
