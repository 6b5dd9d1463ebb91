package dev.trailanalytics;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Entry point for the trail race analytics service.
 *
 * <p>On start-up the race manifest is loaded, every race is preloaded and each panel selects the
 * configured default year; the analytics are then served under {@code /api}.
 */
@SpringBootApplication
public class TrailAnalyticsApplication {
  public static void main(String[] args) {
    SpringApplication.run(TrailAnalyticsApplication.class, args);
  }
}
