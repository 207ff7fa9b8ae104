package com.drivehr.jobsync;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class JobSyncApplication {

  public static void main(String[] args) {
    SpringApplication.run(JobSyncApplication.class, args);
  }
}
