package io.b2mash.s3manager.security;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import org.springframework.core.convert.converter.Converter;
import org.springframework.security.authentication.AbstractAuthenticationToken;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.security.oauth2.server.resource.authentication.JwtAuthenticationToken;
import org.springframework.stereotype.Component;

/**
 * Maps the {@code roles} claim of an access token to Spring authorities. Every authenticated caller
 * gets {@link Roles#AUTHORITY_USER}; unknown role names are ignored.
 */
@Component
public class JwtRoleAuthenticationConverter
    implements Converter<Jwt, AbstractAuthenticationToken> {

  static final String ROLES_CLAIM = "roles";

  private static final Map<String, String> ROLE_MAPPING =
      Map.of(Roles.ADMIN, Roles.AUTHORITY_ADMIN, Roles.USER, Roles.AUTHORITY_USER);

  @Override
  public AbstractAuthenticationToken convert(Jwt jwt) {
    return new JwtAuthenticationToken(jwt, extractAuthorities(jwt), jwt.getSubject());
  }

  private Collection<GrantedAuthority> extractAuthorities(Jwt jwt) {
    List<String> roles = jwt.getClaimAsStringList(ROLES_CLAIM);
    var authorities = new ArrayList<GrantedAuthority>();
    authorities.add(new SimpleGrantedAuthority(Roles.AUTHORITY_USER));
    if (roles == null) {
      return authorities;
    }
    for (String role : roles) {
      String springRole = ROLE_MAPPING.get(role);
      if (springRole != null && !Roles.AUTHORITY_USER.equals(springRole)) {
        authorities.add(new SimpleGrantedAuthority(springRole));
      }
    }
    return authorities;
  }
}
