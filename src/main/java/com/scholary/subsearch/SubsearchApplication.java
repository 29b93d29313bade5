package com.scholary.subsearch;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SubsearchApplication {

  public static void main(String[] args) {
    SpringApplication.run(SubsearchApplication.class, args);
  }
}
