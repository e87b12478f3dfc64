package com.bell.api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class BellApiApplication {
  public static void main(String[] args) {
    SpringApplication.run(BellApiApplication.class, args);
  }
}
