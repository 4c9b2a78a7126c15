package io.neotool.kafka.sample.people;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.uber.m3.tally.Counter;
import com.uber.m3.tally.Scope;
import io.neotool.kafka.consumer.SequencedMessageConsumer;
import io.neotool.kafka.consumer.commit.OffsetCommitCoordinator;
import io.neotool.kafka.consumer.common.CoreInfra;
import io.neotool.kafka.consumer.config.ConsumerConfiguration;
import io.neotool.kafka.consumer.dlq.DlqEnvelope;
import io.neotool.kafka.consumer.fetcher.KafkaConsumerThread;
import io.neotool.kafka.consumer.processor.MessageProcessor;
import io.neotool.kafka.consumer.processor.ValidationException;
import io.neotool.kafka.sample.people.model.PeopleMessage;
import io.neotool.kafka.sample.people.serde.PeopleMessageDeserializer;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.MockConsumer;
import org.apache.kafka.clients.consumer.OffsetAndMetadata;
import org.apache.kafka.clients.consumer.OffsetResetStrategy;
import org.apache.kafka.common.TopicPartition;
import org.awaitility.Awaitility;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentMatchers;
import org.mockito.Mockito;

/** Runs people records through the poll thread, the engine and the processor. */
public class PeopleConsumerScenarioTest {
  private static final String TOPIC = "swapi.people.v1";
  private static final String GROUP = "swapi-people-consumer";
  private static final TopicPartition TP0 = new TopicPartition(TOPIC, 0);
  private static final TopicPartition TP1 = new TopicPartition(TOPIC, 1);

  private Scope scope;
  private Counter processedCounter;
  private Counter errorCounter;
  private Counter otherCounter;
  private MockConsumer<String, PeopleMessage> mockConsumer;
  private PeopleMessageDeserializer deserializer;
  private List<DlqEnvelope<PeopleMessage>> dlq;
  private List<String> processedNames;
  private SequencedMessageConsumer<PeopleMessage> engine;
  private KafkaConsumerThread<PeopleMessage> thread;

  @BeforeEach
  public void setUp() {
    scope = Mockito.mock(Scope.class);
    processedCounter = Mockito.mock(Counter.class);
    errorCounter = Mockito.mock(Counter.class);
    otherCounter = Mockito.mock(Counter.class);
    Mockito.when(scope.tagged(ArgumentMatchers.anyMap())).thenReturn(scope);
    Mockito.when(scope.counter(ArgumentMatchers.anyString())).thenReturn(otherCounter);
    Mockito.when(scope.counter("swapi.people.processed")).thenReturn(processedCounter);
    Mockito.when(scope.counter("swapi.people.error.count")).thenReturn(errorCounter);

    ConsumerConfiguration config = new ConsumerConfiguration();
    config.setPollTimeoutMs(10);
    config.setOffsetCommitIntervalMs(0);
    config.setThreadPoolSize(4);

    dlq = new CopyOnWriteArrayList<>();
    processedNames = new CopyOnWriteArrayList<>();
    deserializer = new PeopleMessageDeserializer(new ObjectMapper());
    mockConsumer = new MockConsumer<>(OffsetResetStrategy.EARLIEST);
    OffsetCommitCoordinator commitCoordinator =
        new OffsetCommitCoordinator(GROUP, Duration.ofSeconds(5), CoreInfra.NOOP);
    engine =
        SequencedMessageConsumer.<PeopleMessage>builder()
            .withConfiguration(config)
            .withProcessor(new RecordingProcessor(new PeopleProcessor(), processedNames))
            .withDlqPublisher(
                envelope -> {
                  dlq.add(envelope);
                  return true;
                })
            .withCommitCoordinator(commitCoordinator)
            .withMetrics(new PeopleMetrics(scope))
            .build();
    thread =
        new KafkaConsumerThread<>(
            "people-poll-test",
            TOPIC,
            GROUP,
            config,
            mockConsumer,
            engine,
            commitCoordinator,
            CoreInfra.NOOP);
    mockConsumer.rebalance(List.of(TP0, TP1));
    mockConsumer.updateBeginningOffsets(Map.of(TP0, 0L, TP1, 0L));
  }

  @AfterEach
  public void tearDown() {
    engine.shutdown(Duration.ZERO);
  }

  @Test
  public void testBlankBatchIdGoesToDlq() {
    addRecord(1, 0L, "4", json("   ", "4", "Darth Vader"));

    pollUntilCommitted(TP1, 1L);
    Assertions.assertEquals(1, dlq.size());
    DlqEnvelope<PeopleMessage> envelope = dlq.get(0);
    Assertions.assertTrue(envelope.getErrorType().contains("ValidationException"));
    Assertions.assertTrue(envelope.getErrorMessage().contains("batchId cannot be blank"));
    Assertions.assertEquals(0, envelope.getRetryCount());
    Assertions.assertEquals("   ", envelope.getOriginalMessage().getBatchId());
    Assertions.assertEquals("4", envelope.getKey());
    Mockito.verify(errorCounter).inc(1);
    Mockito.verify(scope).counter("swapi.people.dlq.count");
    Mockito.verify(processedCounter, Mockito.never()).inc(ArgumentMatchers.anyLong());
  }

  @Test
  public void testSameKeyMessagesAreProcessedInOrder() {
    addRecord(0, 0L, "1", json("batch-1", "1", "Luke Skywalker"));
    addRecord(0, 1L, "1", json("batch-2", "1", "Luke Skywalker (Jedi)"));

    pollUntilCommitted(TP0, 2L);
    Assertions.assertEquals(List.of("Luke Skywalker", "Luke Skywalker (Jedi)"), processedNames);
    Mockito.verify(processedCounter, Mockito.times(2)).inc(1);
    Assertions.assertTrue(dlq.isEmpty());
  }

  @Test
  public void testMalformedRecordDoesNotStopThePartition() {
    addRecord(1, 0L, "9", "{\"batch_id\": oops");
    addRecord(1, 1L, "10", json("batch-1", "10", "Obi-Wan Kenobi"));

    pollUntilCommitted(TP1, 2L);
    Assertions.assertEquals(1, dlq.size());
    Assertions.assertEquals(ValidationException.class.getName(), dlq.get(0).getErrorType());
    Assertions.assertEquals("{\"batch_id\": oops", dlq.get(0).getOriginalMessage().getRawPayload());
    Assertions.assertEquals(List.of("Obi-Wan Kenobi"), processedNames);
  }

  private void addRecord(int partition, long offset, String key, String value) {
    mockConsumer.addRecord(
        new ConsumerRecord<>(
            TOPIC,
            partition,
            offset,
            key,
            deserializer.deserialize(TOPIC, value.getBytes(StandardCharsets.UTF_8))));
  }

  private void pollUntilCommitted(TopicPartition tp, long offset) {
    Awaitility.await()
        .atMost(10, TimeUnit.SECONDS)
        .until(
            () -> {
              thread.doWork();
              OffsetAndMetadata committed = mockConsumer.committed(Set.of(tp)).get(tp);
              return committed != null && committed.offset() == offset;
            });
  }

  private static String json(String batchId, String recordId, String name) {
    return String.format(
        "{\"batch_id\":\"%s\",\"record_id\":\"%s\",\"ingested_at\":\"2024-01-01T00:00:00Z\","
            + "\"payload\":{\"name\":\"%s\",\"birth_year\":\"19BBY\"}}",
        batchId, recordId, name);
  }

  private static class RecordingProcessor implements MessageProcessor<PeopleMessage> {
    private final PeopleProcessor delegate;
    private final List<String> processedNames;

    RecordingProcessor(PeopleProcessor delegate, List<String> processedNames) {
      this.delegate = delegate;
      this.processedNames = processedNames;
    }

    @Override
    public void process(PeopleMessage message) throws ValidationException {
      delegate.process(message);
      processedNames.add(message.getPayload().getName());
    }

    @Override
    public String getRecordId(PeopleMessage message) {
      return delegate.getRecordId(message);
    }
  }
}
