package io.b2mash.s3manager.security;

/**
 * Role constants shared by authentication and authorization. Token roles come from the JWT {@code
 * roles} claim; Spring authorities are the {@code ROLE_} prefixed versions used by
 * {@code @PreAuthorize}.
 */
public final class Roles {

  // JWT "roles" claim values
  public static final String ADMIN = "admin";
  public static final String USER = "user";

  // Spring Security granted authorities
  public static final String AUTHORITY_ADMIN = "ROLE_ADMIN";
  public static final String AUTHORITY_USER = "ROLE_USER";

  private Roles() {}
}
