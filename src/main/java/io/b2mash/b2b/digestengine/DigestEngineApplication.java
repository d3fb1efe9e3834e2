package io.b2mash.b2b.digestengine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
@ConfigurationPropertiesScan
public class DigestEngineApplication {

  public static void main(String[] args) {
    SpringApplication.run(DigestEngineApplication.class, args);
  }
}
