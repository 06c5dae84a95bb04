package com.tdprofiler.quality.config;

import java.util.List;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import io.swagger.v3.oas.models.tags.Tag;

/** API documentation served by springdoc at {@code /swagger-ui.html}. */
@Configuration
public class OpenApiConfig {

  private static final String DESCRIPTION =
      "Data quality profiling for tabular files. Upload a CSV, JSON or Excel file, poll the"
          + " returned job, then read per-column types, completeness, statistics, outliers,"
          + " patterns and semantic types together with a 0-100 quality score.";

  @Value("${springdoc.info.title:TD Profiler API}")
  private String title;

  @Value("${springdoc.info.version:1.0.0}")
  private String version;

  @Value("${server.port:8080}")
  private int serverPort;

  @Bean
  public OpenAPI profilerOpenApi() {
    return new OpenAPI()
        .info(new Info().title(title).version(version).description(DESCRIPTION))
        .servers(
            List.of(
                new Server()
                    .url("http://localhost:" + serverPort)
                    .description("Local development server")))
        .tags(
            List.of(
                new Tag().name("File Upload").description("Start a background profiling job"),
                new Tag().name("Profiling").description("Job status and inline profiling"),
                new Tag().name("Reports").description("JSON, CSV and HTML report downloads")));
  }
}
