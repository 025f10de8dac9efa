package com.assistme.backend.integration.controller;

import com.assistme.backend.integration.api.ConnectRequest;
import com.assistme.backend.integration.api.ConnectResponse;
import com.assistme.backend.integration.api.EmailListQuery;
import com.assistme.backend.integration.api.EmailListResponse;
import com.assistme.backend.integration.api.ExecuteRequest;
import com.assistme.backend.integration.api.ExecuteResponse;
import com.assistme.backend.integration.api.IntegrationListResponse;
import com.assistme.backend.integration.api.IntegrationSummary;
import com.assistme.backend.integration.api.IntegrationUpdateRequest;
import com.assistme.backend.integration.provider.ProviderDescriptor;
import com.assistme.backend.integration.security.OwnerIdentityResolver;
import com.assistme.backend.integration.service.CallbackOutcome;
import com.assistme.backend.integration.service.IntegrationEmailService;
import com.assistme.backend.integration.service.IntegrationException;
import com.assistme.backend.integration.service.IntegrationManager;
import com.fasterxml.jackson.databind.JsonNode;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.enums.ParameterIn;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Size;
import java.net.URI;
import java.util.List;
import java.util.Locale;
import java.util.UUID;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.util.StringUtils;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.util.UriComponentsBuilder;

@RestController
@RequestMapping("/api/integrations")
@Validated
@Tag(name = "Integrations", description = "Connect third-party accounts and run actions on them.")
public class IntegrationController {

  private final IntegrationManager integrationManager;
  private final IntegrationEmailService emailService;
  private final OwnerIdentityResolver ownerIdentityResolver;

  public IntegrationController(
      IntegrationManager integrationManager,
      IntegrationEmailService emailService,
      OwnerIdentityResolver ownerIdentityResolver) {
    this.integrationManager = integrationManager;
    this.emailService = emailService;
    this.ownerIdentityResolver = ownerIdentityResolver;
  }

  @GetMapping("/available")
  @Operation(summary = "List providers that are enabled and configured.")
  public List<ProviderDescriptor> availableProviders() {
    return integrationManager.listAvailableProviders();
  }

  @GetMapping
  @Operation(summary = "List integrations of the calling owner.")
  @Parameter(in = ParameterIn.HEADER, name = OwnerIdentityResolver.OWNER_HEADER, required = true)
  public IntegrationListResponse list(HttpServletRequest request) {
    UUID ownerId = ownerIdentityResolver.resolveOwner(request);
    return new IntegrationListResponse(integrationManager.list(ownerId));
  }

  @PostMapping("/{provider}/connect")
  @Operation(
      summary = "Start an authorization.",
      description =
          "Issues a single-use state and returns the provider consent URL. After consent the"
              + " caller is redirected to redirect_uri with status and integration_id or reason.")
  @Parameter(in = ParameterIn.HEADER, name = OwnerIdentityResolver.OWNER_HEADER, required = true)
  @ApiResponse(responseCode = "400", description = "Unknown provider or invalid redirect_uri.")
  public ConnectResponse connect(
      @PathVariable String provider,
      @Valid @RequestBody ConnectRequest connectRequest,
      HttpServletRequest request) {
    UUID ownerId = ownerIdentityResolver.resolveOwner(request);
    return integrationManager.connect(
        ownerId, provider, connectRequest.redirectUri(), connectRequest.scopes());
  }

  @GetMapping("/callback")
  @Operation(summary = "Provider redirect target; completes the authorization.")
  @ApiResponse(responseCode = "302", description = "Redirect back to the caller.")
  @ApiResponse(responseCode = "400", description = "Unknown, expired or reused state.")
  public ResponseEntity<Void> callback(
      @RequestParam(required = false) String state,
      @RequestParam(required = false) String code,
      @RequestParam(required = false) String error) {
    // a callback without code still consumes the state
    String providerError = error == null && !StringUtils.hasText(code) ? "missing_code" : error;
    return redirect(integrationManager.completeCallback(state, code, providerError));
  }

  @DeleteMapping("/{integrationId}")
  @Operation(summary = "Disconnect an integration and delete its tokens.")
  @Parameter(in = ParameterIn.HEADER, name = OwnerIdentityResolver.OWNER_HEADER, required = true)
  public ResponseEntity<Void> disconnect(
      @PathVariable UUID integrationId, HttpServletRequest request) {
    UUID ownerId = ownerIdentityResolver.resolveOwner(request);
    integrationManager.disconnect(ownerId, integrationId);
    return ResponseEntity.noContent().build();
  }

  @PatchMapping("/{integrationId}")
  @Operation(summary = "Change status (active or disconnected) or merge config values.")
  @Parameter(in = ParameterIn.HEADER, name = OwnerIdentityResolver.OWNER_HEADER, required = true)
  public IntegrationSummary update(
      @PathVariable UUID integrationId,
      @RequestBody IntegrationUpdateRequest updateRequest,
      HttpServletRequest request) {
    UUID ownerId = ownerIdentityResolver.resolveOwner(request);
    return integrationManager.update(ownerId, integrationId, updateRequest);
  }

  @PostMapping("/{integrationId}/execute")
  @Operation(
      summary = "Run a provider action.",
      description = "Failures are reported as success=false with a short public message.")
  @Parameter(in = ParameterIn.HEADER, name = OwnerIdentityResolver.OWNER_HEADER, required = true)
  public ResponseEntity<ExecuteResponse> execute(
      @PathVariable UUID integrationId,
      @Valid @RequestBody ExecuteRequest executeRequest,
      HttpServletRequest request) {
    UUID ownerId = ownerIdentityResolver.resolveOwner(request);
    try {
      JsonNode data =
          integrationManager.execute(
              ownerId, integrationId, executeRequest.action(), executeRequest.params());
      return ResponseEntity.ok(ExecuteResponse.success(data));
    } catch (IntegrationException ex) {
      return ResponseEntity.status(ex.code().status())
          .body(ExecuteResponse.failure(ex.getMessage()));
    }
  }

  @GetMapping("/{integrationId}/emails")
  @Operation(summary = "List emails of an email integration.")
  @Parameter(in = ParameterIn.HEADER, name = OwnerIdentityResolver.OWNER_HEADER, required = true)
  public EmailListResponse emails(
      @PathVariable UUID integrationId,
      @RequestParam(required = false)
          @Size(max = EmailListQuery.MAX_QUERY_LENGTH, message = "query is too long")
          String query,
      @RequestParam(required = false) String filter,
      @RequestParam(name = "label_ids", required = false) List<String> labelIds,
      @RequestParam(name = "max_results", required = false) Integer maxResults,
      @RequestParam(name = "page_token", required = false) String pageToken,
      HttpServletRequest request) {
    UUID ownerId = ownerIdentityResolver.resolveOwner(request);
    return emailService.listEmails(
        ownerId,
        integrationId,
        new EmailListQuery(query, filter, labelIds, maxResults, pageToken));
  }

  private ResponseEntity<Void> redirect(CallbackOutcome outcome) {
    UriComponentsBuilder target = UriComponentsBuilder.fromUriString(outcome.redirectUri());
    if (outcome.successful()) {
      target
          .queryParam("status", "success")
          .queryParam("integration_id", outcome.integration().id());
    } else {
      target
          .queryParam("status", "error")
          .queryParam("reason", outcome.failure().code().name().toLowerCase(Locale.ROOT));
    }
    URI location = target.encode().build().toUri();
    return ResponseEntity.status(HttpStatus.FOUND).location(location).build();
  }
}
