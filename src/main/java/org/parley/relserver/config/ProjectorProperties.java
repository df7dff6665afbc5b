package org.parley.relserver.config;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.time.Duration;
import java.util.Objects;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration properties for the relation projector.
 *
 * <pre>
 * projector:
 *   kafka-listener:
 *     enabled: true
 *   deduplication:
 *     enabled: true
 *     cache-size: 100000
 *     retention: 1h
 * </pre>
 */
@Component
@ConfigurationProperties(prefix = "projector")
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP",
    justification = "Nested groups are bound in place by Spring Boot")
public class ProjectorProperties {

  private final KafkaListener kafkaListener = new KafkaListener();

  private final Deduplication deduplication = new Deduplication();

  public KafkaListener getKafkaListener() {
    return kafkaListener;
  }

  public Deduplication getDeduplication() {
    return deduplication;
  }

  /**
   * Listener switch. Integration tests turn it off so that only the test
   * decides which events reach the projector.
   */
  public static class KafkaListener {

    private boolean enabled = true;

    public boolean isEnabled() {
      return enabled;
    }

    public void setEnabled(boolean enabled) {
      this.enabled = enabled;
    }
  }

  /**
   * Remembers recently applied log event ids so redelivered records are skipped
   * without touching the index.
   */
  public static class Deduplication {

    private boolean enabled = true;

    private int cacheSize = 100_000;

    private Duration retention = Duration.ofHours(1);

    public boolean isEnabled() {
      return enabled;
    }

    public void setEnabled(boolean enabled) {
      this.enabled = enabled;
    }

    public int getCacheSize() {
      return cacheSize;
    }

    /**
     * Sets the number of event ids kept.
     *
     * @param cacheSize cache capacity (must be positive)
     */
    public void setCacheSize(int cacheSize) {
      if (cacheSize < 1) {
        throw new IllegalArgumentException("cacheSize must be positive");
      }
      this.cacheSize = cacheSize;
    }

    public Duration getRetention() {
      return retention;
    }

    /**
     * Sets how long an applied event id is remembered.
     *
     * @param retention time since the event was applied (must be positive)
     */
    public void setRetention(Duration retention) {
      Objects.requireNonNull(retention, "retention cannot be null");
      if (retention.isNegative() || retention.isZero()) {
        throw new IllegalArgumentException("retention must be positive");
      }
      this.retention = retention;
    }
  }
}
