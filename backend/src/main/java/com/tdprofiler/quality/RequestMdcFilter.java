package com.tdprofiler.quality;

import java.io.IOException;

import org.slf4j.MDC;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import com.tdprofiler.quality.service.ratelimit.ClientIpResolver;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

@Component
@Order(1)
public class RequestMdcFilter extends OncePerRequestFilter {

  static final String CLIENT_IP_MDC_KEY = "clientIp";
  static final String CORRELATION_ID_MDC_KEY = "correlationId";
  static final String CORRELATION_ID_HEADER = "X-Correlation-Id";

  @Override
  protected void doFilterInternal(
      HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
      throws ServletException, IOException {
    try {
      MDC.put(CLIENT_IP_MDC_KEY, ClientIpResolver.resolve(request));

      // Correlation id only when the client sends one
      String correlationId = request.getHeader(CORRELATION_ID_HEADER);
      if (correlationId != null && !correlationId.isEmpty()) {
        MDC.put(CORRELATION_ID_MDC_KEY, correlationId);
      }

      filterChain.doFilter(request, response);
    } finally {
      MDC.remove(CLIENT_IP_MDC_KEY);
      MDC.remove(CORRELATION_ID_MDC_KEY);
    }
  }
}
