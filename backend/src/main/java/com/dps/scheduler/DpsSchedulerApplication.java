package com.dps.scheduler;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class DpsSchedulerApplication {

  public static void main(String[] args) {
    SpringApplication.run(DpsSchedulerApplication.class, args);
  }
}
