package com.tdprofiler.quality.config;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.options;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.redirectedUrl;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import com.tdprofiler.quality.controller.ProfileController;
import com.tdprofiler.quality.service.job.ProfilingJobService;
import com.tdprofiler.quality.service.profiling.ProfilingEngineService;

@WebMvcTest(ProfileController.class)
@TestPropertySource(properties = "cors.allowed-origins=http://localhost:3000")
class WebConfigTest {

  @Autowired private MockMvc mockMvc;

  @MockitoBean private ProfilingJobService jobService;

  @MockitoBean private ProfilingEngineService profilingEngineService;

  @Test
  void shouldAllowConfiguredOriginAndExposeRateLimitHeaders() throws Exception {
    mockMvc
        .perform(
            options("/api/health")
                .header("Origin", "http://localhost:3000")
                .header("Access-Control-Request-Method", "GET"))
        .andExpect(status().isOk())
        .andExpect(header().string("Access-Control-Allow-Origin", "http://localhost:3000"))
        .andExpect(header().string("Access-Control-Allow-Credentials", "true"));

    mockMvc
        .perform(get("/api/health").header("Origin", "http://localhost:3000"))
        .andExpect(status().isOk())
        .andExpect(
            header()
                .string(
                    "Access-Control-Expose-Headers",
                    "Retry-After, X-RateLimit-Remaining, Content-Disposition"));
  }

  @Test
  void shouldRejectUnknownOrigin() throws Exception {
    mockMvc
        .perform(
            options("/api/health")
                .header("Origin", "http://evil.example")
                .header("Access-Control-Request-Method", "GET"))
        .andExpect(status().isForbidden());
  }

  @Test
  void shouldRedirectRootToApiDocs() throws Exception {
    mockMvc
        .perform(get("/"))
        .andExpect(status().is3xxRedirection())
        .andExpect(redirectedUrl("/swagger-ui/index.html"));
  }
}
