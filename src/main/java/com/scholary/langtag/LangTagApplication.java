package com.scholary.langtag;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableAsync;

@SpringBootApplication
@EnableAsync
public class LangTagApplication {

  public static void main(String[] args) {
    SpringApplication.run(LangTagApplication.class, args);
  }
}
