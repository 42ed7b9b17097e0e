package com.followertracker;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class FollowerTrackerApplication {

  public static void main(String[] args) {
    SpringApplication.run(FollowerTrackerApplication.class, args);
  }
}
