package com.mk.fx.qa.analysis.service;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class AnalysisServiceApplication {

  public static void main(String[] args) {
    SpringApplication.run(AnalysisServiceApplication.class, args);
  }
}
