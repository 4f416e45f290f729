package com.scholary.placeholdarr;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PlaceholdarrApplication {

  public static void main(String[] args) {
    SpringApplication.run(PlaceholdarrApplication.class, args);
  }
}
