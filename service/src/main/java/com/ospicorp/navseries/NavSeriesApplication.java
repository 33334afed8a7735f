package com.ospicorp.navseries;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class NavSeriesApplication {

  public static void main(String[] args) {
    SpringApplication.run(NavSeriesApplication.class, args);
  }
}
