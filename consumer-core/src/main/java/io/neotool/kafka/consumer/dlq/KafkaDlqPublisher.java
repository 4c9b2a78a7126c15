package io.neotool.kafka.consumer.dlq;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableMap;
import com.uber.m3.tally.Scope;
import com.uber.m3.tally.Stopwatch;
import io.neotool.kafka.consumer.common.CoreInfra;
import io.neotool.kafka.consumer.common.StructuredLogging;
import io.neotool.kafka.consumer.common.StructuredTags;
import io.neotool.kafka.consumer.config.ConsumerConfiguration;
import io.neotool.kafka.consumer.config.KafkaConsumerConfiguration;
import io.neotool.kafka.instrumentation.Instrumentation;
import io.neotool.kafka.instrumentation.Tags;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.apache.kafka.clients.producer.KafkaProducer;
import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * KafkaDlqPublisher produces JSON envelopes to the dead letter topic, keyed by the original message
 * key, and waits for the broker acknowledgement.
 */
public class KafkaDlqPublisher<V> implements DlqPublisher<V>, AutoCloseable {
  private static final Logger LOGGER = LoggerFactory.getLogger(KafkaDlqPublisher.class);

  private final Producer<String, byte[]> producer;
  private final ObjectMapper objectMapper;
  private final String dlqTopic;
  private final long publishTimeoutMs;
  private final CoreInfra infra;

  public KafkaDlqPublisher(
      KafkaConsumerConfiguration kafkaConfig,
      ConsumerConfiguration config,
      ObjectMapper objectMapper,
      CoreInfra infra) {
    this(
        new KafkaProducer<>(kafkaConfig.getKafkaProducerProperties()),
        objectMapper,
        kafkaConfig.getDlqTopic(),
        config.getDlqPublishTimeoutMs(),
        infra);
  }

  @VisibleForTesting
  KafkaDlqPublisher(
      Producer<String, byte[]> producer,
      ObjectMapper objectMapper,
      String dlqTopic,
      long publishTimeoutMs,
      CoreInfra infra) {
    Preconditions.checkArgument(!Strings.isNullOrEmpty(dlqTopic), "dlqTopic is required");
    this.producer = producer;
    this.objectMapper = objectMapper;
    this.dlqTopic = dlqTopic;
    this.publishTimeoutMs = publishTimeoutMs;
    this.infra = infra;
  }

  @Override
  public boolean publish(DlqEnvelope<V> envelope)
      throws JsonProcessingException, InterruptedException, ExecutionException,
          TimeoutException {
    ProducerRecord<String, byte[]> record =
        new ProducerRecord<>(dlqTopic, envelope.getKey(), objectMapper.writeValueAsBytes(envelope));
    Instrumentation.instrument
        .withExceptionalCompletion(
            LOGGER,
            infra.scope(),
            infra.tracer(),
            () -> send(record),
            MetricNames.SEND,
            StructuredLogging.KAFKA_TOPIC,
            dlqTopic)
        .toCompletableFuture()
        .get(publishTimeoutMs, TimeUnit.MILLISECONDS);
    return true;
  }

  private CompletableFuture<Void> send(ProducerRecord<String, byte[]> record) {
    Scope requestScope =
        infra.scope().tagged(StructuredTags.builder().setKafkaTopic(record.topic()).build());
    CompletableFuture<Void> future = new CompletableFuture<>();
    Stopwatch stopwatch = requestScope.timer(MetricNames.SEND_LATENCY).start();
    producer.send(
        record,
        (recordMetadata, e) -> {
          stopwatch.stop();
          if (e != null) {
            requestScope
                .tagged(ImmutableMap.of(Tags.Key.reason, e.getClass().getSimpleName()))
                .counter(MetricNames.SEND_FAILURE)
                .inc(1);
            future.completeExceptionally(e);
          } else {
            LOGGER.debug(
                "consumer.dlq.send.success",
                StructuredLogging.kafkaTopic(recordMetadata.topic()),
                StructuredLogging.kafkaPartition(recordMetadata.partition()),
                StructuredLogging.kafkaOffset(recordMetadata.offset()));
            future.complete(null);
          }
        });
    return future;
  }

  @Override
  public void close() {
    producer.close();
  }

  private static class MetricNames {
    static final String SEND = "consumer.dlq.send";
    static final String SEND_LATENCY = "consumer.dlq.producer.latency";
    static final String SEND_FAILURE = "consumer.dlq.send.failure";
  }
}
