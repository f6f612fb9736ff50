package com.opsdash.coordination;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class CoordinationApplication {
  public static void main(String[] args) {
    SpringApplication.run(CoordinationApplication.class, args);
  }
}
