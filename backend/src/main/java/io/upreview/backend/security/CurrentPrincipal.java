package io.upreview.backend.security;

import io.upreview.backend.exception.ReviewFlowError;
import io.upreview.backend.exception.ReviewFlowException;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.oauth2.server.resource.authentication.JwtAuthenticationToken;

/** Reads the authenticated user id (the JWT {@code sub} claim) for the current request. */
public final class CurrentPrincipal {

  private CurrentPrincipal() {}

  /**
   * @return the principal id of the caller
   * @throws ReviewFlowException ACCESS_DENIED if the request is not JWT-authenticated
   */
  public static String requireId() {
    Authentication auth = SecurityContextHolder.getContext().getAuthentication();
    if (auth instanceof JwtAuthenticationToken jwtAuth) {
      String subject = jwtAuth.getToken().getSubject();
      if (subject != null && !subject.isBlank()) {
        return subject;
      }
    }
    throw new ReviewFlowException(ReviewFlowError.ACCESS_DENIED, "Authentication required.");
  }
}
