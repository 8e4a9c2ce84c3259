package com.openlead.intel;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class LeadIntelApplication {

  public static void main(String[] args) {
    SpringApplication.run(LeadIntelApplication.class, args);
  }
}
