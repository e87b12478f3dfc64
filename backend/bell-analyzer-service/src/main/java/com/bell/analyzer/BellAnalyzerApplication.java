package com.bell.analyzer;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class BellAnalyzerApplication {
  public static void main(String[] args) {
    SpringApplication.run(BellAnalyzerApplication.class, args);
  }
}
