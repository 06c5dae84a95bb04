package com.tdprofiler.quality.service.ratelimit;

import jakarta.servlet.http.HttpServletRequest;

/** Client address of a request, honouring the headers set by reverse proxies. */
public final class ClientIpResolver {

  static final String FORWARDED_FOR_HEADER = "X-Forwarded-For";
  static final String REAL_IP_HEADER = "X-Real-IP";
  static final String UNKNOWN = "unknown";

  private ClientIpResolver() {}

  public static String resolve(HttpServletRequest request) {
    String forwarded = request.getHeader(FORWARDED_FOR_HEADER);
    if (forwarded != null && !forwarded.isBlank()) {
      return forwarded.split(",")[0].trim();
    }

    String realIp = request.getHeader(REAL_IP_HEADER);
    if (realIp != null && !realIp.isBlank()) {
      return realIp.trim();
    }

    String remote = request.getRemoteAddr();
    return remote != null && !remote.isEmpty() ? remote : UNKNOWN;
  }
}
