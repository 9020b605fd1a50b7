package io.intellixity.catchwork.examples;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CatchworkExamplesApplication {
  public static void main(String[] args) {
    SpringApplication.run(CatchworkExamplesApplication.class, args);
  }
}
