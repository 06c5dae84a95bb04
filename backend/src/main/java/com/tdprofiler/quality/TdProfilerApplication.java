package com.tdprofiler.quality;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class TdProfilerApplication {

  public static void main(String[] args) {
    SpringApplication.run(TdProfilerApplication.class, args);
  }
}
