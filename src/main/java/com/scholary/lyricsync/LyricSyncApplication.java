package com.scholary.lyricsync;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class LyricSyncApplication {

  public static void main(String[] args) {
    SpringApplication.run(LyricSyncApplication.class, args);
  }
}
