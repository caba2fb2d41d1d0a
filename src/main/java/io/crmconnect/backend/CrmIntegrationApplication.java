package io.crmconnect.backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CrmIntegrationApplication {
  public static void main(String[] args) {
    SpringApplication.run(CrmIntegrationApplication.class, args);
  }
}
