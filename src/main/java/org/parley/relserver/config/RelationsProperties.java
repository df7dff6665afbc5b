package org.parley.relserver.config;

import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration properties for relation ingest, pagination and bundling.
 */
@Component
@ConfigurationProperties(prefix = "relations")
public class RelationsProperties {

  /**
   * Page size used when a request does not supply a limit.
   */
  private int defaultLimit = 5;

  /**
   * Largest page size a request may ask for.
   */
  private int maxLimit = 1000;

  /**
   * Number of aggregation groups and references bundled into a served event.
   */
  private int bundleLimit = 5;

  /**
   * Event types treated as reactions: an annotation of one of these types
   * must carry a non-empty key.
   */
  private List<String> reactionEventTypes = new ArrayList<>(List.of("m.reaction"));

  /**
   * Whether requests are checked against room membership.
   */
  private boolean enforceMembership = true;

  /**
   * Server name used as the domain part of generated event ids.
   */
  private String serverName = "localhost";

  public int getDefaultLimit() {
    return defaultLimit;
  }

  /**
   * Sets the default page size.
   *
   * @param defaultLimit the default page size (must be positive)
   */
  public void setDefaultLimit(int defaultLimit) {
    if (defaultLimit < 1) {
      throw new IllegalArgumentException("defaultLimit must be positive");
    }
    this.defaultLimit = defaultLimit;
  }

  public int getMaxLimit() {
    return maxLimit;
  }

  /**
   * Sets the maximum page size.
   *
   * @param maxLimit the maximum page size (must be positive)
   */
  public void setMaxLimit(int maxLimit) {
    if (maxLimit < 1) {
      throw new IllegalArgumentException("maxLimit must be positive");
    }
    this.maxLimit = maxLimit;
  }

  public int getBundleLimit() {
    return bundleLimit;
  }

  /**
   * Sets the bundle size.
   *
   * @param bundleLimit the number of bundled groups and references (must be positive)
   */
  public void setBundleLimit(int bundleLimit) {
    if (bundleLimit < 1) {
      throw new IllegalArgumentException("bundleLimit must be positive");
    }
    this.bundleLimit = bundleLimit;
  }

  public List<String> getReactionEventTypes() {
    return List.copyOf(reactionEventTypes);
  }

  public void setReactionEventTypes(List<String> reactionEventTypes) {
    this.reactionEventTypes = new ArrayList<>(reactionEventTypes);
  }

  /**
   * Checks whether an event type is a reaction-style annotation type.
   *
   * @param eventType the event type
   * @return true if annotations of this type require a key
   */
  public boolean isReactionType(String eventType) {
    return reactionEventTypes.contains(eventType);
  }

  public boolean isEnforceMembership() {
    return enforceMembership;
  }

  public void setEnforceMembership(boolean enforceMembership) {
    this.enforceMembership = enforceMembership;
  }

  public String getServerName() {
    return serverName;
  }

  public void setServerName(String serverName) {
    this.serverName = serverName;
  }
}
