package io.b2mash.s3manager.security;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;

class ClientIpResolverTest {

  @Test
  void forwardedFor_firstHopWins() {
    var request = request("10.0.0.9");
    request.addHeader("X-Forwarded-For", " 203.0.113.7 , 10.0.0.1");
    request.addHeader("X-Real-IP", "198.51.100.2");

    assertThat(ClientIpResolver.resolve(request)).isEqualTo("203.0.113.7");
  }

  @Test
  void unknownForwardedHop_fallsThroughToRealIp() {
    var request = request("10.0.0.9");
    request.addHeader("X-Forwarded-For", "unknown, 10.0.0.1");
    request.addHeader("X-Real-IP", "198.51.100.2");

    assertThat(ClientIpResolver.resolve(request)).isEqualTo("198.51.100.2");
  }

  @Test
  void noForwardingHeaders_usesRemoteAddress() {
    var request = request("10.0.0.9");
    request.addHeader("X-Forwarded-For", "  ");

    assertThat(ClientIpResolver.resolve(request)).isEqualTo("10.0.0.9");
  }

  @Test
  void missingRequest_resolvesToNull() {
    assertThat(ClientIpResolver.resolve(null)).isNull();
  }

  private static MockHttpServletRequest request(String remoteAddr) {
    var request = new MockHttpServletRequest();
    request.setRemoteAddr(remoteAddr);
    return request;
  }
}
