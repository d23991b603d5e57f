package io.b2mash.s3manager.security;

import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.oauth2.server.resource.authentication.JwtAuthenticationToken;

/**
 * The authenticated principal on whose behalf a request runs. {@code userId} is the token subject
 * and doubles as the owner id of storage configurations and objects.
 */
public record Caller(String userId, boolean admin) {

  public static Caller from(JwtAuthenticationToken auth) {
    boolean admin =
        auth.getAuthorities().stream()
            .anyMatch(a -> Roles.AUTHORITY_ADMIN.equals(a.getAuthority()));
    return new Caller(auth.getToken().getSubject(), admin);
  }

  /** Returns the caller bound to the current security context, or null outside a request. */
  public static Caller currentOrNull() {
    Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
    if (authentication instanceof JwtAuthenticationToken jwtAuth) {
      return from(jwtAuth);
    }
    return null;
  }
}
