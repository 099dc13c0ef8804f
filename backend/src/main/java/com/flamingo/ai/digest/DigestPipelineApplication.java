package com.flamingo.ai.digest;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/** Entry point for the message enrichment and digest pipeline. */
@SpringBootApplication
public class DigestPipelineApplication {

  public static void main(String[] args) {
    SpringApplication.run(DigestPipelineApplication.class, args);
  }
}
