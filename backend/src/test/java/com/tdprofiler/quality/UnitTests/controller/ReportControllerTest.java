package com.tdprofiler.quality.controller;

import static com.tdprofiler.quality.fixtures.TestFixtures.sampleProfile;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.nio.charset.StandardCharsets;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import com.tdprofiler.quality.dto.profile.DatasetProfile;
import com.tdprofiler.quality.exception.ResourceNotFoundException;
import com.tdprofiler.quality.service.job.ProfilingJobService;
import com.tdprofiler.quality.service.report.ReportExportService;
import com.tdprofiler.quality.service.report.ReportFormat;

@WebMvcTest(ReportController.class)
@DisplayName("Report Controller Tests")
class ReportControllerTest {

  @Autowired private MockMvc mockMvc;

  @MockitoBean private ProfilingJobService jobService;

  @MockitoBean private ReportExportService reportExportService;

  private DatasetProfile profile;

  @BeforeEach
  void setUp() {
    profile = sampleProfile();
  }

  @Test
  void shouldDownloadCsvAttachment() throws Exception {
    when(jobService.requireResult("job-1")).thenReturn(profile);
    when(reportExportService.export(profile, ReportFormat.CSV)).thenReturn("\"name\"\n\"email\"\n");

    mockMvc
        .perform(get("/api/report/job-1").param("format", "csv"))
        .andExpect(status().isOk())
        .andExpect(content().contentType("text/csv;charset=UTF-8"))
        .andExpect(
            header().string("Content-Disposition", "attachment; filename=\"profile_job-1.csv\""))
        .andExpect(content().string("\"name\"\n\"email\"\n"));
  }

  @Test
  void shouldDefaultToJson() throws Exception {
    when(jobService.requireResult("job-1")).thenReturn(profile);
    when(reportExportService.export(profile, ReportFormat.JSON)).thenReturn("{\"ok\":true}");

    mockMvc
        .perform(get("/api/report/job-1"))
        .andExpect(status().isOk())
        .andExpect(content().contentType("application/json;charset=UTF-8"))
        .andExpect(
            header().string("Content-Disposition", "attachment; filename=\"profile_job-1.json\""));
  }

  @Test
  void shouldEncodeHtmlAsUtf8() throws Exception {
    when(jobService.requireResult("job-1")).thenReturn(profile);
    when(reportExportService.export(profile, ReportFormat.HTML)).thenReturn("<p>caf\u00e9</p>");

    mockMvc
        .perform(get("/api/report/job-1").param("format", "HTML"))
        .andExpect(status().isOk())
        .andExpect(content().contentType("text/html;charset=UTF-8"))
        .andExpect(content().bytes("<p>caf\u00e9</p>".getBytes(StandardCharsets.UTF_8)));
  }

  @Test
  void shouldRejectUnknownFormatBeforeLookingUpJob() throws Exception {
    mockMvc
        .perform(get("/api/report/job-1").param("format", "pdf"))
        .andExpect(status().isBadRequest())
        .andExpect(
            jsonPath("$.message")
                .value("Unsupported report format: pdf. Supported formats: json, csv, html"));

    verifyNoInteractions(jobService, reportExportService);
  }

  @Test
  void shouldReturnNotFoundForUnfinishedJob() throws Exception {
    when(jobService.requireResult("job-1"))
        .thenThrow(new ResourceNotFoundException("Job not found or not completed"));

    mockMvc
        .perform(get("/api/report/job-1").param("format", "csv"))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.message").value("Job not found or not completed"));
  }
}
