package io.neotool.kafka.consumer.dlq;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.neotool.kafka.consumer.common.CoreInfra;
import io.neotool.kafka.consumer.message.InboundMessage;
import io.neotool.kafka.consumer.processor.ProcessingException;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.apache.kafka.clients.producer.MockProducer;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.serialization.ByteArraySerializer;
import org.apache.kafka.common.serialization.StringSerializer;
import org.awaitility.Awaitility;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class KafkaDlqPublisherTest {
  private static final String DLQ_TOPIC = "people.dlq";

  private ObjectMapper objectMapper;
  private DlqEnvelope<Map<String, String>> envelope;

  @BeforeEach
  public void setUp() {
    objectMapper = new ObjectMapper();
    envelope =
        DlqEnvelope.of(
            new InboundMessage<>(
                "record-1",
                "people",
                3,
                17L,
                Map.of("batchId", "  ", "name", "Luke"),
                Instant.parse("2024-01-01T00:00:00Z")),
            new ProcessingException("downstream unavailable"),
            3,
            Instant.parse("2024-01-01T00:00:05Z"));
  }

  @Test
  public void testPublishWritesJsonEnvelope() throws Exception {
    MockProducer<String, byte[]> producer =
        new MockProducer<>(true, new StringSerializer(), new ByteArraySerializer());
    KafkaDlqPublisher<Map<String, String>> publisher = publisher(producer, 1000);

    Assertions.assertTrue(publisher.publish(envelope));
    Assertions.assertEquals(1, producer.history().size());
    ProducerRecord<String, byte[]> record = producer.history().get(0);
    Assertions.assertEquals(DLQ_TOPIC, record.topic());
    Assertions.assertEquals("record-1", record.key());

    JsonNode json = objectMapper.readTree(record.value());
    Assertions.assertEquals("  ", json.get("originalMessage").get("batchId").asText());
    Assertions.assertEquals("people", json.get("topic").asText());
    Assertions.assertEquals(3, json.get("partition").asInt());
    Assertions.assertEquals(17L, json.get("offset").asLong());
    Assertions.assertEquals(ProcessingException.class.getName(), json.get("errorType").asText());
    Assertions.assertEquals("downstream unavailable", json.get("errorMessage").asText());
    Assertions.assertEquals(3, json.get("retryCount").asInt());
    Assertions.assertEquals("2024-01-01T00:00:05Z", json.get("failedAt").asText());
  }

  @Test
  public void testBrokerErrorFailsPublish() {
    MockProducer<String, byte[]> producer =
        new MockProducer<>(false, new StringSerializer(), new ByteArraySerializer());
    KafkaDlqPublisher<Map<String, String>> publisher = publisher(producer, 5000);
    CompletableFuture.runAsync(
        () -> {
          Awaitility.await()
              .atMost(5, TimeUnit.SECONDS)
              .until(() -> producer.history().size() == 1);
          producer.errorNext(new RuntimeException("not leader"));
        });
    Assertions.assertThrows(ExecutionException.class, () -> publisher.publish(envelope));
  }

  @Test
  public void testMissingAcknowledgementTimesOut() {
    MockProducer<String, byte[]> producer =
        new MockProducer<>(false, new StringSerializer(), new ByteArraySerializer());
    KafkaDlqPublisher<Map<String, String>> publisher = publisher(producer, 50);
    Assertions.assertThrows(TimeoutException.class, () -> publisher.publish(envelope));
  }

  @Test
  public void testDlqTopicRequired() {
    MockProducer<String, byte[]> producer =
        new MockProducer<>(true, new StringSerializer(), new ByteArraySerializer());
    Assertions.assertThrows(
        IllegalArgumentException.class,
        () -> new KafkaDlqPublisher<String>(producer, objectMapper, "", 1000, CoreInfra.NOOP));
  }

  @Test
  public void testCloseClosesProducer() {
    MockProducer<String, byte[]> producer =
        new MockProducer<>(true, new StringSerializer(), new ByteArraySerializer());
    publisher(producer, 1000).close();
    Assertions.assertTrue(producer.closed());
  }

  private KafkaDlqPublisher<Map<String, String>> publisher(
      MockProducer<String, byte[]> producer, long timeoutMs) {
    return new KafkaDlqPublisher<>(producer, objectMapper, DLQ_TOPIC, timeoutMs, CoreInfra.NOOP);
  }
}
