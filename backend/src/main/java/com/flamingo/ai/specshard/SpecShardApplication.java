package com.flamingo.ai.specshard;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/** Entry point for the spec sharding service. */
@SpringBootApplication
public class SpecShardApplication {

  public static void main(String[] args) {
    SpringApplication.run(SpecShardApplication.class, args);
  }
}
