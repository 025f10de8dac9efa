package com.assistme.backend.integration.security;

import jakarta.servlet.http.HttpServletRequest;
import java.util.UUID;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.server.ResponseStatusException;

/** Resolves the authenticated owner from the {@code X-Owner-Id} header set by the gateway. */
@Component
public class OwnerIdentityResolver {

  public static final String OWNER_HEADER = "X-Owner-Id";

  public UUID resolveOwner(HttpServletRequest request) {
    String headerValue = request.getHeader(OWNER_HEADER);
    if (!StringUtils.hasText(headerValue)) {
      throw new ResponseStatusException(
          HttpStatus.UNAUTHORIZED, OWNER_HEADER + " header is required");
    }
    try {
      return UUID.fromString(headerValue.trim());
    } catch (IllegalArgumentException ex) {
      throw new ResponseStatusException(
          HttpStatus.BAD_REQUEST, OWNER_HEADER + " must be a UUID", ex);
    }
  }
}
