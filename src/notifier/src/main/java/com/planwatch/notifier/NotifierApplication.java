package com.planwatch.notifier;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Spring Boot entrypoint for the flight-plan notifier.
 *
 * <p>The notifier ingests flight plans from the upstream data service, matches them against
 * tenant callsign subscriptions and posts a notification to every matching tenant channel.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class NotifierApplication {
  /**
   * Starts the notifier application.
   *
   * @param args CLI arguments
   */
  public static void main(String[] args) {
    SpringApplication.run(NotifierApplication.class, args);
  }
}
