package org.parley.relserver.config;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.HashMap;
import java.util.Map;
import org.apache.kafka.clients.admin.AdminClientConfig;
import org.apache.kafka.clients.admin.NewTopic;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.common.TopicPartition;
import org.apache.kafka.common.config.TopicConfig;
import org.apache.kafka.common.serialization.StringDeserializer;
import org.apache.kafka.common.serialization.StringSerializer;
import org.parley.relserver.event.RelationEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.ConcurrentKafkaListenerContainerFactory;
import org.springframework.kafka.config.TopicBuilder;
import org.springframework.kafka.core.ConsumerFactory;
import org.springframework.kafka.core.DefaultKafkaConsumerFactory;
import org.springframework.kafka.core.DefaultKafkaProducerFactory;
import org.springframework.kafka.core.KafkaAdmin;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.core.ProducerFactory;
import org.springframework.kafka.listener.ContainerProperties;
import org.springframework.kafka.listener.DeadLetterPublishingRecoverer;
import org.springframework.kafka.listener.DefaultErrorHandler;
import org.springframework.kafka.support.serializer.JsonDeserializer;
import org.springframework.kafka.support.serializer.JsonSerializer;

/**
 * Kafka configuration for the relation event log.
 * Configures the producer, the projector's consumer, topics and error handling.
 */
@Configuration
public class KafkaConfig {

  private static final Logger logger = LoggerFactory.getLogger(KafkaConfig.class);

  private final KafkaProperties kafkaProperties;
  private final ProjectionRetryProperties retryProperties;
  private final MeterRegistry meterRegistry;

  /**
   * Constructs a KafkaConfig with the specified properties.
   *
   * @param kafkaProperties the Kafka configuration properties
   * @param retryProperties the projection retry configuration
   * @param meterRegistry the meter registry for metrics
   */
  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "All properties are Spring configuration beans, "
          + "immutable after initialization")
  public KafkaConfig(
      KafkaProperties kafkaProperties,
      ProjectionRetryProperties retryProperties,
      MeterRegistry meterRegistry) {
    this.kafkaProperties = kafkaProperties;
    this.retryProperties = retryProperties;
    this.meterRegistry = meterRegistry;
  }

  /**
   * Kafka admin client for topic management.
   * Topics are only created at startup when {@code kafka.auto-create-topics} is set,
   * so the service starts without a reachable broker.
   *
   * @return KafkaAdmin instance
   */
  @Bean
  public KafkaAdmin kafkaAdmin() {
    Map<String, Object> configs = new HashMap<>();
    configs.put(AdminClientConfig.BOOTSTRAP_SERVERS_CONFIG,
        kafkaProperties.getBootstrapServers());
    KafkaAdmin admin = new KafkaAdmin(configs);
    admin.setAutoCreate(kafkaProperties.isAutoCreateTopics());
    admin.setFatalIfBrokerNotAvailable(false);
    return admin;
  }

  /**
   * Producer factory for relation events.
   *
   * @return ProducerFactory instance
   */
  @Bean
  public ProducerFactory<String, RelationEvent> producerFactory() {
    Map<String, Object> configProps = new HashMap<>();
    configProps.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG,
        kafkaProperties.getBootstrapServers());
    configProps.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class);
    configProps.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, JsonSerializer.class);
    configProps.put(JsonSerializer.ADD_TYPE_INFO_HEADERS, false);

    KafkaProperties.Producer producer = kafkaProperties.getProducer();
    configProps.put(ProducerConfig.ACKS_CONFIG, producer.getAcks());
    configProps.put(ProducerConfig.RETRIES_CONFIG, producer.getRetries());
    configProps.put(ProducerConfig.ENABLE_IDEMPOTENCE_CONFIG, producer.isEnableIdempotence());
    configProps.put(ProducerConfig.MAX_IN_FLIGHT_REQUESTS_PER_CONNECTION,
        producer.getMaxInFlightRequests());
    configProps.put(ProducerConfig.COMPRESSION_TYPE_CONFIG, producer.getCompressionType());
    configProps.put(ProducerConfig.LINGER_MS_CONFIG, producer.getLingerMs());
    configProps.put(ProducerConfig.MAX_BLOCK_MS_CONFIG, producer.getMaxBlockMs());

    return new DefaultKafkaProducerFactory<>(configProps);
  }

  /**
   * Kafka template for sending relation events.
   *
   * @return KafkaTemplate instance
   */
  @Bean
  public KafkaTemplate<String, RelationEvent> kafkaTemplate() {
    return new KafkaTemplate<>(producerFactory());
  }

  /**
   * Relation event topic. Append-only with the configured retention.
   *
   * @return NewTopic definition
   */
  @Bean
  public NewTopic relationEventTopic() {
    return TopicBuilder
        .name(kafkaProperties.getTopic())
        .partitions(kafkaProperties.getPartitions())
        .replicas(kafkaProperties.getReplicationFactor())
        .config(TopicConfig.RETENTION_MS_CONFIG, String.valueOf(
            kafkaProperties.getRetentionMs() > 0 ? kafkaProperties.getRetentionMs() : -1))
        .config(TopicConfig.CLEANUP_POLICY_CONFIG, TopicConfig.CLEANUP_POLICY_DELETE)
        .build();
  }

  /**
   * Dead letter topic for events whose projection kept failing.
   * Same partition count as the main topic, since records keep their partition.
   *
   * @return NewTopic definition
   */
  @Bean
  public NewTopic relationDeadLetterTopic() {
    return TopicBuilder
        .name(kafkaProperties.getDeadLetterTopic())
        .partitions(kafkaProperties.getPartitions())
        .replicas(kafkaProperties.getReplicationFactor())
        .build();
  }

  /**
   * Consumer factory for the relation projector.
   * Starts from the earliest offset so a restarted instance replays the log.
   *
   * @return ConsumerFactory instance
   */
  @Bean
  public ConsumerFactory<String, RelationEvent> consumerFactory() {
    Map<String, Object> configProps = new HashMap<>();
    configProps.put(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG,
        kafkaProperties.getBootstrapServers());
    configProps.put(ConsumerConfig.GROUP_ID_CONFIG, kafkaProperties.getConsumer().getGroupId());
    configProps.put(ConsumerConfig.KEY_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class);
    configProps.put(ConsumerConfig.VALUE_DESERIALIZER_CLASS_CONFIG, JsonDeserializer.class);
    configProps.put(JsonDeserializer.TRUSTED_PACKAGES, "org.parley.relserver.event");
    configProps.put(JsonDeserializer.USE_TYPE_INFO_HEADERS, false);
    configProps.put(JsonDeserializer.VALUE_DEFAULT_TYPE, RelationEvent.class.getName());

    configProps.put(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, "earliest");
    configProps.put(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG,
        kafkaProperties.getConsumer().isEnableAutoCommit());
    configProps.put(ConsumerConfig.MAX_POLL_RECORDS_CONFIG,
        kafkaProperties.getConsumer().getMaxPollRecords());

    return new DefaultKafkaConsumerFactory<>(configProps);
  }

  /**
   * Kafka listener container factory for the projector.
   * Single consumer with per-record acknowledgement, so a failed event is
   * retried before later events of the same partition are applied.
   *
   * @return ConcurrentKafkaListenerContainerFactory instance
   */
  @Bean
  public ConcurrentKafkaListenerContainerFactory<String, RelationEvent>
      kafkaListenerContainerFactory() {
    ConcurrentKafkaListenerContainerFactory<String, RelationEvent> factory =
        new ConcurrentKafkaListenerContainerFactory<>();
    factory.setConsumerFactory(consumerFactory());
    factory.setConcurrency(1);
    factory.getContainerProperties().setAckMode(ContainerProperties.AckMode.RECORD);
    factory.setCommonErrorHandler(createErrorHandler());
    return factory;
  }

  /**
   * Creates the error handler: exponential backoff, then the dead letter topic.
   *
   * @return configured DefaultErrorHandler
   */
  private DefaultErrorHandler createErrorHandler() {
    DeadLetterPublishingRecoverer recoverer = new DeadLetterPublishingRecoverer(
        kafkaTemplate(),
        (record, ex) -> {
          String dlqTopic = record.topic() + ".dlq";
          logger.warn("Sending failed relation event to DLQ: topic={}, partition={}, offset={}",
              dlqTopic, record.partition(), record.offset());
          return new TopicPartition(dlqTopic, record.partition());
        }
    );

    DefaultErrorHandler errorHandler = new DefaultErrorHandler(recoverer, retryProperties.toBackOff());
    errorHandler.setRetryListeners((record, ex, deliveryAttempt) -> {
      logger.warn("Retrying relation projection (attempt {}/{}): topic={}, partition={}, "
              + "offset={}",
          deliveryAttempt, retryProperties.getMaxAttempts(),
          record.topic(), record.partition(), record.offset());
      meterRegistry.counter("relations.projection.retries",
          "topic", record.topic()).increment();
    });

    logger.info("Configured projection error handler: maxAttempts={}, initialBackoff={}, "
            + "multiplier={}, maxBackoff={}",
        retryProperties.getMaxAttempts(),
        retryProperties.getInitialBackoff(),
        retryProperties.getBackoffMultiplier(),
        retryProperties.getMaxBackoff());

    return errorHandler;
  }
}
