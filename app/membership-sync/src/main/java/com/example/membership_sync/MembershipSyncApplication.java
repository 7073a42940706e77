package com.example.membership_sync;

import com.example.common.config.TimeConfig;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Import;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@SpringBootApplication
@Import(TimeConfig.class)
@RestController
public class MembershipSyncApplication {

  public static void main(String[] args) {
    SpringApplication.run(MembershipSyncApplication.class, args);
  }

  @GetMapping("/")
  public String home() {
    return "membership-sync: ok";
  }
}
