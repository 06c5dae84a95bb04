package com.tdprofiler.quality.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.ViewControllerRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

import com.tdprofiler.quality.controller.FileUploadController;

/**
 * Browser access to the API: CORS for the configured front-end origins, with the headers a client
 * needs to honour rate limits and name downloaded reports.
 */
@Configuration
public class WebConfig implements WebMvcConfigurer {

  private static final String API_PATTERN = "/api/**";
  private static final long PREFLIGHT_MAX_AGE_SECONDS = 3600;

  @Value("${cors.allowed-origins:}")
  private String[] allowedOrigins;

  @Override
  public void addViewControllers(ViewControllerRegistry registry) {
    registry.addRedirectViewController("/", "/swagger-ui/index.html");
    registry.setOrder(1);
  }

  @Override
  public void addCorsMappings(CorsRegistry registry) {
    // An empty list opens the API to any origin, e.g. for local tooling
    String[] origins = allowedOrigins.length == 0 ? new String[] {"*"} : allowedOrigins;

    registry
        .addMapping(API_PATTERN)
        .allowedOriginPatterns(origins)
        .allowedMethods("GET", "POST", "OPTIONS")
        .allowedHeaders("*")
        .exposedHeaders(
            HttpHeaders.RETRY_AFTER,
            FileUploadController.RATE_LIMIT_REMAINING_HEADER,
            HttpHeaders.CONTENT_DISPOSITION)
        .allowCredentials(true)
        .maxAge(PREFLIGHT_MAX_AGE_SECONDS);
  }
}
