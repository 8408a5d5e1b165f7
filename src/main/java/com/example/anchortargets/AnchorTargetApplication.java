package com.example.anchortargets;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class AnchorTargetApplication {

  public static void main(String[] args) {
    SpringApplication.run(AnchorTargetApplication.class, args);
  }
}
