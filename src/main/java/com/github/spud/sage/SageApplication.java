package com.github.spud.sage;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@EnableScheduling
@SpringBootApplication
public class SageApplication {

  public static void main(String[] args) {
    SpringApplication.run(SageApplication.class, args);
  }

}
