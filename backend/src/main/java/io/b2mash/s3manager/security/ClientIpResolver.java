package io.b2mash.s3manager.security;

import jakarta.servlet.http.HttpServletRequest;
import java.util.List;

/**
 * Picks the address recorded in audit events and auth failure logs. The first hop of a proxy
 * forwarding header wins over the socket peer; empty and {@code unknown} hops are ignored.
 */
public final class ClientIpResolver {

  static final List<String> FORWARDING_HEADERS = List.of("X-Forwarded-For", "X-Real-IP");

  private ClientIpResolver() {}

  public static String resolve(HttpServletRequest request) {
    if (request == null) {
      return null;
    }
    for (String header : FORWARDING_HEADERS) {
      String hop = firstHop(request.getHeader(header));
      if (hop != null) {
        return hop;
      }
    }
    return request.getRemoteAddr();
  }

  static String firstHop(String headerValue) {
    if (headerValue == null) {
      return null;
    }
    int comma = headerValue.indexOf(',');
    String hop = (comma < 0 ? headerValue : headerValue.substring(0, comma)).trim();
    if (hop.isEmpty() || "unknown".equalsIgnoreCase(hop)) {
      return null;
    }
    return hop;
  }
}
