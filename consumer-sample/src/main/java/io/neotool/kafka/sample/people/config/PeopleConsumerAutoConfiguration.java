package io.neotool.kafka.sample.people.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.uber.m3.tally.Scope;
import io.neotool.kafka.consumer.SequencedMessageConsumer;
import io.neotool.kafka.consumer.commit.OffsetCommitCoordinator;
import io.neotool.kafka.consumer.common.CoreInfra;
import io.neotool.kafka.consumer.config.ConsumerConfiguration;
import io.neotool.kafka.consumer.config.KafkaConsumerConfiguration;
import io.neotool.kafka.consumer.dlq.DlqFallback;
import io.neotool.kafka.consumer.dlq.KafkaDlqPublisher;
import io.neotool.kafka.consumer.dlq.LoggingDlqFallback;
import io.neotool.kafka.consumer.fetcher.KafkaConsumerThread;
import io.neotool.kafka.consumer.metrics.ConsumerMetrics;
import io.neotool.kafka.sample.people.PeopleConsumerLifecycle;
import io.neotool.kafka.sample.people.PeopleMetrics;
import io.neotool.kafka.sample.people.PeopleProcessor;
import io.neotool.kafka.sample.people.model.PeopleMessage;
import io.neotool.kafka.sample.people.serde.PeopleMessageDeserializer;
import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.KafkaConsumer;
import org.apache.kafka.common.serialization.StringDeserializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Wires the people consumer: Kafka clients, DLQ publisher, processing engine and poll thread. */
@Configuration
@EnableConfigurationProperties({ConsumerConfiguration.class, KafkaConsumerConfiguration.class})
public class PeopleConsumerAutoConfiguration {
  private static final Logger LOGGER =
      LoggerFactory.getLogger(PeopleConsumerAutoConfiguration.class);
  private static final String POLL_THREAD_NAME = "people-consumer-poll";

  @Bean
  public ObjectMapper peopleObjectMapper() {
    return new ObjectMapper().registerModule(new JavaTimeModule());
  }

  @Bean
  public ConsumerMetrics peopleMetrics(Scope scope) {
    return new PeopleMetrics(scope);
  }

  @Bean
  public PeopleProcessor peopleProcessor() {
    return new PeopleProcessor();
  }

  @Bean
  public DlqFallback<PeopleMessage> peopleDlqFallback() {
    return new LoggingDlqFallback<>();
  }

  @Bean
  public OffsetCommitCoordinator offsetCommitCoordinator(
      KafkaConsumerConfiguration kafkaConfig, ConsumerConfiguration config, CoreInfra infra) {
    return new OffsetCommitCoordinator(
        kafkaConfig.getGroupId(), config.getCommitTimeout(), infra);
  }

  @Bean(destroyMethod = "close")
  public KafkaDlqPublisher<PeopleMessage> peopleDlqPublisher(
      KafkaConsumerConfiguration kafkaConfig,
      ConsumerConfiguration config,
      ObjectMapper objectMapper,
      CoreInfra infra) {
    return new KafkaDlqPublisher<>(kafkaConfig, config, objectMapper, infra);
  }

  @Bean
  public SequencedMessageConsumer<PeopleMessage> peopleMessageConsumer(
      ConsumerConfiguration config,
      PeopleProcessor processor,
      KafkaDlqPublisher<PeopleMessage> dlqPublisher,
      DlqFallback<PeopleMessage> dlqFallback,
      OffsetCommitCoordinator commitCoordinator,
      ConsumerMetrics metrics,
      CoreInfra infra) {
    return SequencedMessageConsumer.<PeopleMessage>builder()
        .withConfiguration(config)
        .withProcessor(processor)
        .withDlqPublisher(dlqPublisher)
        .withDlqFallback(dlqFallback)
        .withCommitCoordinator(commitCoordinator)
        .withMetrics(metrics)
        .withInfra(infra)
        .build();
  }

  // closed by KafkaConsumerThread when the poll thread stops
  @Bean(destroyMethod = "")
  public Consumer<String, PeopleMessage> peopleKafkaConsumer(
      KafkaConsumerConfiguration kafkaConfig, ObjectMapper objectMapper) {
    LOGGER.info(
        "creating people kafka consumer topic={} group={}",
        kafkaConfig.getTopic(),
        kafkaConfig.getGroupId());
    return new KafkaConsumer<>(
        kafkaConfig.getKafkaConsumerProperties(PeopleMessageDeserializer.class.getName()),
        new StringDeserializer(),
        new PeopleMessageDeserializer(objectMapper));
  }

  @Bean
  public KafkaConsumerThread<PeopleMessage> peopleConsumerThread(
      KafkaConsumerConfiguration kafkaConfig,
      ConsumerConfiguration config,
      Consumer<String, PeopleMessage> consumer,
      SequencedMessageConsumer<PeopleMessage> engine,
      OffsetCommitCoordinator commitCoordinator,
      CoreInfra infra) {
    return new KafkaConsumerThread<>(
        POLL_THREAD_NAME,
        kafkaConfig.getTopic(),
        kafkaConfig.getGroupId(),
        config,
        consumer,
        engine,
        commitCoordinator,
        infra);
  }

  @Bean
  public PeopleConsumerLifecycle peopleConsumerLifecycle(
      KafkaConsumerThread<PeopleMessage> consumerThread,
      @Value("${consumer.autoStartup:true}") boolean autoStartup) {
    return new PeopleConsumerLifecycle(consumerThread, autoStartup);
  }
}
