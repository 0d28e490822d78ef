package com.courtbot.sms.app;

import com.courtbot.sms.app.config.CourtbotProperties;
import lombok.extern.log4j.Log4j2;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Entry point for the Courtbot SMS service.
 *
 * <p>People text a citation number to look up a court case, then opt into a one-time reminder or
 * ask the service to keep checking for a case that has not been ingested yet. The SMS webhook is
 * served by {@link com.courtbot.sms.app.api.SmsWebhookController}; queued lookups are swept by
 * {@link com.courtbot.sms.app.scheduler.QueueSweepScheduler}.
 *
 * <pre>
 *   mvn spring-boot:run
 * </pre>
 */
@Log4j2
@SpringBootApplication
@EnableScheduling
@EnableConfigurationProperties(CourtbotProperties.class)
public class CourtbotSmsApplication {

  /**
   * Main entry point for the Spring Boot application.
   *
   * @param args command-line arguments
   */
  public static void main(String[] args) {
    log.info("Starting Courtbot SMS service...");
    SpringApplication.run(CourtbotSmsApplication.class, args);
    log.info("Courtbot SMS service started successfully.");
  }
}
