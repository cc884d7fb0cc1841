package com.catalogharvester;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class CatalogHarvesterApplication {

  public static void main(String[] args) {
    SpringApplication.run(CatalogHarvesterApplication.class, args);
  }
}
