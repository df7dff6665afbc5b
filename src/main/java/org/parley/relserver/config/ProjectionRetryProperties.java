package org.parley.relserver.config;

import java.time.Duration;
import java.util.Objects;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.kafka.support.ExponentialBackOffWithMaxRetries;
import org.springframework.stereotype.Component;

/**
 * Backoff applied when the projector fails to apply a relation event.
 * After {@code max-attempts} redeliveries the record goes to the dead letter topic.
 *
 * <pre>
 * relations:
 *   projection:
 *     retry:
 *       max-attempts: 10
 *       initial-backoff: 1s
 *       backoff-multiplier: 2.0
 *       max-backoff: 60s
 * </pre>
 */
@Component
@ConfigurationProperties(prefix = "relations.projection.retry")
public class ProjectionRetryProperties {

  private int maxAttempts = 10;
  private Duration initialBackoff = Duration.ofSeconds(1);
  private double backoffMultiplier = 2.0;
  private Duration maxBackoff = Duration.ofMinutes(1);

  /**
   * Builds the Kafka backoff for these settings.
   *
   * @return a new backoff instance
   */
  public ExponentialBackOffWithMaxRetries toBackOff() {
    ExponentialBackOffWithMaxRetries backOff = new ExponentialBackOffWithMaxRetries(maxAttempts);
    backOff.setInitialInterval(initialBackoff.toMillis());
    backOff.setMultiplier(backoffMultiplier);
    backOff.setMaxInterval(maxBackoff.toMillis());
    return backOff;
  }

  public int getMaxAttempts() {
    return maxAttempts;
  }

  public void setMaxAttempts(int maxAttempts) {
    if (maxAttempts < 1) {
      throw new IllegalArgumentException("maxAttempts must be at least 1");
    }
    this.maxAttempts = maxAttempts;
  }

  public Duration getInitialBackoff() {
    return initialBackoff;
  }

  public void setInitialBackoff(Duration initialBackoff) {
    this.initialBackoff = requirePositive(initialBackoff, "initialBackoff");
  }

  public double getBackoffMultiplier() {
    return backoffMultiplier;
  }

  public void setBackoffMultiplier(double backoffMultiplier) {
    if (backoffMultiplier < 1.0) {
      throw new IllegalArgumentException("backoffMultiplier must be at least 1.0");
    }
    this.backoffMultiplier = backoffMultiplier;
  }

  public Duration getMaxBackoff() {
    return maxBackoff;
  }

  public void setMaxBackoff(Duration maxBackoff) {
    this.maxBackoff = requirePositive(maxBackoff, "maxBackoff");
  }

  private static Duration requirePositive(Duration value, String name) {
    Objects.requireNonNull(value, name + " cannot be null");
    if (value.isNegative() || value.isZero()) {
      throw new IllegalArgumentException(name + " must be positive");
    }
    return value;
  }
}
