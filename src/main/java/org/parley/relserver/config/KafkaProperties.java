package org.parley.relserver.config;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration properties for the relation event log on Kafka.
 */
@Component
@ConfigurationProperties(prefix = "kafka")
public class KafkaProperties {
  /**
   * Kafka bootstrap servers.
   */
  private String bootstrapServers = "localhost:9092";

  /**
   * Topic that carries relation events.
   */
  private String topic = "parley.relations.events";

  /**
   * Number of partitions for the relation topic.
   */
  private int partitions = 3;

  /**
   * Replication factor for the relation topic.
   */
  private short replicationFactor = 1;

  /**
   * Retention period in milliseconds (-1 for infinite).
   */
  private long retentionMs = -1;

  /**
   * Whether the application creates the topics at startup.
   */
  private boolean autoCreateTopics = false;

  /**
   * Producer configuration.
   */
  private Producer producer = new Producer();

  /**
   * Consumer configuration.
   */
  private Consumer consumer = new Consumer();

  public String getBootstrapServers() {
    return bootstrapServers;
  }

  public void setBootstrapServers(String bootstrapServers) {
    this.bootstrapServers = bootstrapServers;
  }

  public String getTopic() {
    return topic;
  }

  public void setTopic(String topic) {
    this.topic = topic;
  }

  /**
   * Returns the dead letter topic for events that could not be projected.
   *
   * @return the DLQ topic name
   */
  public String getDeadLetterTopic() {
    return topic + ".dlq";
  }

  public int getPartitions() {
    return partitions;
  }

  public void setPartitions(int partitions) {
    this.partitions = partitions;
  }

  public short getReplicationFactor() {
    return replicationFactor;
  }

  public void setReplicationFactor(short replicationFactor) {
    this.replicationFactor = replicationFactor;
  }

  public long getRetentionMs() {
    return retentionMs;
  }

  public void setRetentionMs(long retentionMs) {
    this.retentionMs = retentionMs;
  }

  public boolean isAutoCreateTopics() {
    return autoCreateTopics;
  }

  public void setAutoCreateTopics(boolean autoCreateTopics) {
    this.autoCreateTopics = autoCreateTopics;
  }

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP",
      justification = "Spring Boot ConfigurationProperties requires direct access"
          + " to nested objects")
  public Producer getProducer() {
    return producer;
  }

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "Spring Boot ConfigurationProperties requires direct access"
          + " to nested objects")
  public void setProducer(Producer producer) {
    this.producer = producer;
  }

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP",
      justification = "Spring Boot ConfigurationProperties requires direct access"
          + " to nested objects")
  public Consumer getConsumer() {
    return consumer;
  }

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "Spring Boot ConfigurationProperties requires direct access"
          + " to nested objects")
  public void setConsumer(Consumer consumer) {
    this.consumer = consumer;
  }

  /**
   * Producer tuning.
   */
  public static class Producer {
    private int retries = 3;
    private String acks = "all";
    private boolean enableIdempotence = true;
    private int maxInFlightRequests = 5;
    private String compressionType = "none";
    private int lingerMs = 0;
    private long maxBlockMs = 5000;

    public int getRetries() {
      return retries;
    }

    public void setRetries(int retries) {
      this.retries = retries;
    }

    public String getAcks() {
      return acks;
    }

    public void setAcks(String acks) {
      this.acks = acks;
    }

    public boolean isEnableIdempotence() {
      return enableIdempotence;
    }

    public void setEnableIdempotence(boolean enableIdempotence) {
      this.enableIdempotence = enableIdempotence;
    }

    public int getMaxInFlightRequests() {
      return maxInFlightRequests;
    }

    public void setMaxInFlightRequests(int maxInFlightRequests) {
      this.maxInFlightRequests = maxInFlightRequests;
    }

    public String getCompressionType() {
      return compressionType;
    }

    public void setCompressionType(String compressionType) {
      this.compressionType = compressionType;
    }

    public int getLingerMs() {
      return lingerMs;
    }

    public void setLingerMs(int lingerMs) {
      this.lingerMs = lingerMs;
    }

    public long getMaxBlockMs() {
      return maxBlockMs;
    }

    public void setMaxBlockMs(long maxBlockMs) {
      this.maxBlockMs = maxBlockMs;
    }
  }

  /**
   * Consumer tuning.
   */
  public static class Consumer {
    private String groupId = "relation-projector";
    private boolean enableAutoCommit = false;
    private int maxPollRecords = 500;

    public String getGroupId() {
      return groupId;
    }

    public void setGroupId(String groupId) {
      this.groupId = groupId;
    }

    public boolean isEnableAutoCommit() {
      return enableAutoCommit;
    }

    public void setEnableAutoCommit(boolean enableAutoCommit) {
      this.enableAutoCommit = enableAutoCommit;
    }

    public int getMaxPollRecords() {
      return maxPollRecords;
    }

    public void setMaxPollRecords(int maxPollRecords) {
      this.maxPollRecords = maxPollRecords;
    }
  }
}
