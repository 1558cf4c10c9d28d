package com.companyintel.profiles;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class CompanyIntelApplication {

  public static void main(String[] args) {
    SpringApplication.run(CompanyIntelApplication.class, args);
  }
}
