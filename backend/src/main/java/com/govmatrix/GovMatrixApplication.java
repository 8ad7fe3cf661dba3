package com.govmatrix;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class GovMatrixApplication {

  public static void main(String[] args) {
    SpringApplication.run(GovMatrixApplication.class, args);
  }
}
