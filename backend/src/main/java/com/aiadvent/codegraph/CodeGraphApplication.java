package com.aiadvent.codegraph;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CodeGraphApplication {

  public static void main(String[] args) {
    SpringApplication.run(CodeGraphApplication.class, args);
  }
}
