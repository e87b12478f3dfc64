package com.bell.alerter;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class BellAlerterApplication {
  public static void main(String[] args) {
    SpringApplication.run(BellAlerterApplication.class, args);
  }
}
