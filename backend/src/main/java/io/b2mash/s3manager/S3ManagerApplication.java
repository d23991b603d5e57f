package io.b2mash.s3manager;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class S3ManagerApplication {

  public static void main(String[] args) {
    SpringApplication.run(S3ManagerApplication.class, args);
  }
}
