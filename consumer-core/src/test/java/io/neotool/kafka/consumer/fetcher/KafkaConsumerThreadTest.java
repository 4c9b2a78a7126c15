package io.neotool.kafka.consumer.fetcher;

import com.uber.m3.tally.Counter;
import com.uber.m3.tally.Gauge;
import com.uber.m3.tally.Scope;
import com.uber.m3.tally.Stopwatch;
import com.uber.m3.tally.Timer;
import io.neotool.kafka.consumer.SequencedMessageConsumer;
import io.neotool.kafka.consumer.commit.OffsetCommitCoordinator;
import io.neotool.kafka.consumer.common.CoreInfra;
import io.neotool.kafka.consumer.config.ConsumerConfiguration;
import io.neotool.kafka.consumer.dlq.DlqEnvelope;
import io.neotool.kafka.consumer.message.InboundMessage;
import io.neotool.kafka.consumer.processor.MessageProcessor;
import java.time.Clock;
import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.ConsumerRebalanceListener;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.MockConsumer;
import org.apache.kafka.clients.consumer.OffsetAndMetadata;
import org.apache.kafka.clients.consumer.OffsetResetStrategy;
import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.TopicPartition;
import org.awaitility.Awaitility;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.ArgumentMatchers;
import org.mockito.Mockito;

public class KafkaConsumerThreadTest {
  private static final String TOPIC = "people";
  private static final String GROUP = "people-consumer";
  private static final TopicPartition TP0 = new TopicPartition(TOPIC, 0);
  private static final TopicPartition TP1 = new TopicPartition(TOPIC, 1);

  private Scope scope;
  private Counter counter;
  private CoreInfra infra;
  private ConsumerConfiguration config;
  private MockConsumer<String, String> mockConsumer;
  private SequencedMessageConsumer<String> engine;
  private OffsetCommitCoordinator commitCoordinator;

  @BeforeEach
  @SuppressWarnings("unchecked")
  public void setUp() {
    scope = Mockito.mock(Scope.class);
    counter = Mockito.mock(Counter.class);
    Gauge gauge = Mockito.mock(Gauge.class);
    Timer timer = Mockito.mock(Timer.class);
    Stopwatch stopwatch = Mockito.mock(Stopwatch.class);
    Mockito.when(scope.tagged(ArgumentMatchers.anyMap())).thenReturn(scope);
    Mockito.when(scope.counter(ArgumentMatchers.anyString())).thenReturn(counter);
    Mockito.when(scope.gauge(ArgumentMatchers.anyString())).thenReturn(gauge);
    Mockito.when(scope.timer(ArgumentMatchers.anyString())).thenReturn(timer);
    Mockito.when(timer.start()).thenReturn(stopwatch);
    infra = CoreInfra.builder().withScope(scope).build();

    config = new ConsumerConfiguration();
    config.setPollTimeoutMs(10);
    config.setOffsetCommitIntervalMs(0);
    config.setMaxQueuedMessagesPerPartition(100);
    config.setShutdownTimeoutSeconds(1);
    mockConsumer = new MockConsumer<>(OffsetResetStrategy.EARLIEST);
    engine = Mockito.mock(SequencedMessageConsumer.class);
    commitCoordinator = new OffsetCommitCoordinator(GROUP, Duration.ofSeconds(5), infra);
  }

  @Test
  public void testRecordsAreProcessedAndCommitted() {
    List<String> processed = new CopyOnWriteArrayList<>();
    SequencedMessageConsumer<String> realEngine =
        SequencedMessageConsumer.<String>builder()
            .withConfiguration(config)
            .withProcessor(
                new MessageProcessor<String>() {
                  @Override
                  public void process(String payload) {
                    processed.add(payload);
                  }

                  @Override
                  public String getRecordId(String payload) {
                    return payload;
                  }
                })
            .withDlqPublisher((DlqEnvelope<String> envelope) -> true)
            .withCommitCoordinator(commitCoordinator)
            .build();
    KafkaConsumerThread<String> thread = thread(mockConsumer, realEngine);
    assign(TP0);
    for (long offset = 0; offset < 3; offset++) {
      mockConsumer.addRecord(new ConsumerRecord<>(TOPIC, 0, offset, "k" + offset, "v" + offset));
    }

    Awaitility.await()
        .atMost(5, TimeUnit.SECONDS)
        .until(
            () -> {
              thread.doWork();
              OffsetAndMetadata committed = mockConsumer.committed(Set.of(TP0)).get(TP0);
              return committed != null && committed.offset() == 3;
            });
    Assertions.assertEquals(List.of("v0", "v1", "v2"), processed);
    realEngine.shutdown(Duration.ZERO);
  }

  @Test
  public void testRecordsAreHandedOverInOffsetOrder() {
    Mockito.when(engine.handle(ArgumentMatchers.any())).thenReturn(true);
    KafkaConsumerThread<String> thread = thread(mockConsumer, engine);
    assign(TP0);
    mockConsumer.addRecord(new ConsumerRecord<>(TOPIC, 0, 0L, "k0", "v0"));
    mockConsumer.addRecord(new ConsumerRecord<>(TOPIC, 0, 1L, "k1", "v1"));

    thread.doWork();
    @SuppressWarnings("unchecked")
    ArgumentCaptor<InboundMessage<String>> captor = ArgumentCaptor.forClass(InboundMessage.class);
    Mockito.verify(engine, Mockito.times(2)).handle(captor.capture());
    Assertions.assertEquals(0L, captor.getAllValues().get(0).getOffset());
    Assertions.assertEquals(1L, captor.getAllValues().get(1).getOffset());
    Assertions.assertEquals("v1", captor.getAllValues().get(1).getPayload());
    Assertions.assertEquals(TP0, captor.getAllValues().get(1).topicPartition());
  }

  @Test
  public void testRejectedRecordRewindsAndPauses() {
    Mockito.when(engine.handle(ArgumentMatchers.any())).thenReturn(false);
    Mockito.when(engine.blockedPartitions()).thenReturn(Set.of(TP0));
    KafkaConsumerThread<String> thread = thread(mockConsumer, engine);
    assign(TP0);
    mockConsumer.addRecord(new ConsumerRecord<>(TOPIC, 0, 0L, "k0", "v0"));
    mockConsumer.addRecord(new ConsumerRecord<>(TOPIC, 0, 1L, "k1", "v1"));

    thread.doWork();
    Mockito.verify(engine, Mockito.times(1)).handle(ArgumentMatchers.any());
    Assertions.assertTrue(mockConsumer.paused().contains(TP0));
    Assertions.assertEquals(0L, mockConsumer.position(TP0));
    Mockito.verify(scope).counter("consumer.kafka.topic.partition.paused");
  }

  @Test
  public void testBacklogPausesAndResumes() {
    Mockito.when(engine.handle(ArgumentMatchers.any())).thenReturn(true);
    Mockito.when(engine.queuedCount(TP0)).thenReturn(100);
    KafkaConsumerThread<String> thread = thread(mockConsumer, engine);
    assign(TP0, TP1);

    thread.doWork();
    Assertions.assertEquals(Set.of(TP0), mockConsumer.paused());

    Mockito.when(engine.queuedCount(TP0)).thenReturn(0);
    thread.doWork();
    Assertions.assertTrue(mockConsumer.paused().isEmpty());
    Mockito.verify(scope).counter("consumer.kafka.topic.partition.resume");
  }

  @Test
  public void testPollFailureDoesNotEscape() {
    KafkaConsumerThread<String> thread = thread(mockConsumer, engine);
    assign(TP0);
    mockConsumer.setPollException(new KafkaException("broker unreachable"));

    Assertions.assertDoesNotThrow(thread::doWork);
    Mockito.verify(scope).counter("consumer.kafka.poll.exception");
    Mockito.verify(scope).counter("consumer.kafka.dowork.failure");
    Assertions.assertDoesNotThrow(thread::doWork);
  }

  @Test
  public void testWakeupDoesNotEscape() {
    KafkaConsumerThread<String> thread = thread(mockConsumer, engine);
    assign(TP0);
    mockConsumer.wakeup();
    Assertions.assertDoesNotThrow(thread::doWork);
  }

  @Test
  @SuppressWarnings("unchecked")
  public void testRebalanceListener() {
    Consumer<String, String> consumer = Mockito.mock(Consumer.class);
    OffsetCommitCoordinator coordinator = Mockito.mock(OffsetCommitCoordinator.class);
    new KafkaConsumerThread<>(
        "poll-thread", TOPIC, GROUP, config, consumer, engine, coordinator, infra);
    ArgumentCaptor<ConsumerRebalanceListener> listener =
        ArgumentCaptor.forClass(ConsumerRebalanceListener.class);
    Mockito.verify(consumer)
        .subscribe(ArgumentMatchers.eq(List.of(TOPIC)), listener.capture());

    Collection<TopicPartition> partitions = List.of(TP0, TP1);
    listener.getValue().onPartitionsAssigned(partitions);
    Mockito.verify(coordinator).onPartitionsAssigned(partitions);
    Mockito.verify(scope).gauge("consumer.kafka.assigned.partitions");

    listener.getValue().onPartitionsRevoked(partitions);
    Mockito.verify(engine).onPartitionsRevoked(partitions);
    Mockito.verify(coordinator).onPartitionsRevoked(consumer, partitions);

    listener.getValue().onPartitionsLost(List.of(TP1));
    Mockito.verify(engine).onPartitionsRevoked(List.of(TP1));
    Mockito.verify(coordinator).onPartitionsLost(List.of(TP1));
    Mockito.verify(coordinator, Mockito.never())
        .flush(ArgumentMatchers.<Consumer<?, ?>>any());
  }

  @Test
  public void testCloseDrainsCommitsAndClosesConsumer() {
    Mockito.when(engine.shutdown(ArgumentMatchers.any())).thenReturn(true);
    Mockito.when(engine.handle(ArgumentMatchers.any())).thenReturn(true);
    KafkaConsumerThread<String> thread = thread(mockConsumer, engine);
    assign(TP0);
    commitCoordinator.recordResolved(TP0, 41);
    thread.start();
    Awaitility.await().atMost(5, TimeUnit.SECONDS).until(thread::isAlive);

    thread.close();
    Assertions.assertFalse(thread.isRunning());
    Mockito.verify(engine).shutdown(Duration.ofSeconds(1));
    Assertions.assertEquals(42L, commitCoordinator.committedOffset(TP0));
    Assertions.assertTrue(mockConsumer.closed());
    Mockito.verify(scope).counter("consumer.kafka.close.success");
  }

  @Test
  public void testCloseFailure() {
    Mockito.when(engine.shutdown(ArgumentMatchers.any()))
        .thenThrow(new IllegalStateException("boom"));
    KafkaConsumerThread<String> thread = thread(mockConsumer, engine);
    assign(TP0);

    Assertions.assertThrows(RuntimeException.class, thread::close);
    Mockito.verify(scope).counter("consumer.kafka.close.failure");
  }

  private KafkaConsumerThread<String> thread(
      Consumer<String, String> consumer, SequencedMessageConsumer<String> engine) {
    return new KafkaConsumerThread<>(
        "poll-thread",
        TOPIC,
        GROUP,
        config,
        consumer,
        engine,
        commitCoordinator,
        Clock.systemUTC(),
        infra);
  }

  private void assign(TopicPartition... partitions) {
    mockConsumer.rebalance(List.of(partitions));
    for (TopicPartition tp : partitions) {
      mockConsumer.updateBeginningOffsets(Map.of(tp, 0L));
    }
  }
}
