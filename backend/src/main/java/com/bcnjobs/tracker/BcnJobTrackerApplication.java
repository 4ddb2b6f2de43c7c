package com.bcnjobs.tracker;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class BcnJobTrackerApplication {

  public static void main(String[] args) {
    SpringApplication.run(BcnJobTrackerApplication.class, args);
  }
}
