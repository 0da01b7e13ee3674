package com.contractlink.harvester;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class ContractHarvesterApplication {

  public static void main(String[] args) {
    SpringApplication.run(ContractHarvesterApplication.class, args);
  }
}
