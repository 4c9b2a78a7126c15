package io.neotool.kafka.sample.people;

import io.neotool.kafka.consumer.fetcher.KafkaConsumerThread;
import io.neotool.kafka.sample.people.model.PeopleMessage;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;

/** Starts the people poll thread with the application context and drains it on shutdown. */
public class PeopleConsumerLifecycle implements SmartLifecycle {
  private static final Logger LOGGER = LoggerFactory.getLogger(PeopleConsumerLifecycle.class);

  private final KafkaConsumerThread<PeopleMessage> consumerThread;
  private final boolean autoStartup;
  private final AtomicBoolean running;

  public PeopleConsumerLifecycle(
      KafkaConsumerThread<PeopleMessage> consumerThread, boolean autoStartup) {
    this.consumerThread = consumerThread;
    this.autoStartup = autoStartup;
    this.running = new AtomicBoolean(false);
  }

  @Override
  public void start() {
    if (running.compareAndSet(false, true)) {
      consumerThread.start();
      LOGGER.info("people consumer started");
    }
  }

  @Override
  public void stop() {
    if (running.compareAndSet(true, false)) {
      // blocks until in-flight messages are drained or the shutdown timeout passes
      consumerThread.close();
      LOGGER.info("people consumer stopped");
    }
  }

  @Override
  public boolean isRunning() {
    return running.get();
  }

  @Override
  public boolean isAutoStartup() {
    return autoStartup;
  }
}
