package io.b2mash.meetings.pointtracker;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PointTrackerApplication {

  public static void main(String[] args) {
    SpringApplication.run(PointTrackerApplication.class, args);
  }
}
