package io.b2mash.s3manager.security;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.security.oauth2.server.resource.authentication.JwtAuthenticationToken;

class JwtRoleAuthenticationConverterTest {

  private final JwtRoleAuthenticationConverter converter = new JwtRoleAuthenticationConverter();

  @Test
  void adminRole_grantsAdminAndUserAuthorities() {
    var token = converter.convert(jwt(List.of("admin")));

    assertThat(token.getAuthorities())
        .extracting(GrantedAuthority::getAuthority)
        .containsExactlyInAnyOrder(Roles.AUTHORITY_USER, Roles.AUTHORITY_ADMIN);
    assertThat(token.getName()).isEqualTo("user_123");
  }

  @Test
  void missingRolesClaim_grantsUserOnly() {
    var token = converter.convert(jwt(null));

    assertThat(token.getAuthorities())
        .extracting(GrantedAuthority::getAuthority)
        .containsExactly(Roles.AUTHORITY_USER);
  }

  @Test
  void unknownRoles_areIgnored() {
    var token = converter.convert(jwt(List.of("user", "superuser")));

    assertThat(token.getAuthorities())
        .extracting(GrantedAuthority::getAuthority)
        .containsExactly(Roles.AUTHORITY_USER);
  }

  @Test
  void caller_reflectsSubjectAndAdminRole() {
    var caller = Caller.from((JwtAuthenticationToken) converter.convert(jwt(List.of("admin"))));

    assertThat(caller.userId()).isEqualTo("user_123");
    assertThat(caller.admin()).isTrue();
  }

  private static Jwt jwt(List<String> roles) {
    var builder = Jwt.withTokenValue("token").header("alg", "none").subject("user_123");
    if (roles != null) {
      builder.claim(JwtRoleAuthenticationConverter.ROLES_CLAIM, roles);
    }
    return builder.build();
  }
}
