package com.system.packsolver;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan(basePackages = "com.system.packsolver.config")
public class PackSolverApplication {

  public static void main(String[] args) {
    SpringApplication.run(PackSolverApplication.class, args);
  }
}
