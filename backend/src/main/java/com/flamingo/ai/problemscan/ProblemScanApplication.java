package com.flamingo.ai.problemscan;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/** Entry point for the worksheet scanning backend. */
@SpringBootApplication
public class ProblemScanApplication {

  public static void main(String[] args) {
    SpringApplication.run(ProblemScanApplication.class, args);
  }
}
