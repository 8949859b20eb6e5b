package com.scholary.radio.recorder;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class RadioRecorderApplication {

  public static void main(String[] args) {
    SpringApplication.run(RadioRecorderApplication.class, args);
  }
}
