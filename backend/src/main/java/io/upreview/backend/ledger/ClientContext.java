package io.upreview.backend.ledger;

import jakarta.servlet.http.HttpServletRequest;
import java.util.Map;

/** Request metadata stored with public recipient actions. */
public record ClientContext(String ipAddress, String userAgent) {

  public static ClientContext unknown() {
    return new ClientContext(null, null);
  }

  /**
   * Reads the caller as the proxy saw it: the first X-Forwarded-For hop, else X-Real-IP. The
   * socket address is never used since it is always the proxy's.
   */
  public static ClientContext from(HttpServletRequest request) {
    return new ClientContext(proxiedAddress(request), request.getHeader("User-Agent"));
  }

  private static String proxiedAddress(HttpServletRequest request) {
    String hops = request.getHeader("X-Forwarded-For");
    if (hops != null) {
      int comma = hops.indexOf(',');
      String first = (comma < 0 ? hops : hops.substring(0, comma)).strip();
      if (!first.isEmpty()) {
        return first;
      }
    }
    String realIp = request.getHeader("X-Real-IP");
    return realIp == null || realIp.isBlank() ? null : realIp.strip();
  }

  Map<String, Object> toMeta() {
    return Map.of(
        "ip", ipAddress != null ? ipAddress : "", "ua", userAgent != null ? userAgent : "");
  }
}
