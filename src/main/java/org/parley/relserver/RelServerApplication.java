package org.parley.relserver;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application class for the Parley event relations server.
 */
@SpringBootApplication
@SuppressWarnings("PMD.UseUtilityClass") // Spring Boot requires instantiable main class
public class RelServerApplication {

  /**
   * Application entry point.
   *
   * @param args command-line arguments
   */
  public static void main(String[] args) {
    SpringApplication.run(RelServerApplication.class, args);
  }
}
