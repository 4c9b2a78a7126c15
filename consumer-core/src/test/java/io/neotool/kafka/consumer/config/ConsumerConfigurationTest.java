package io.neotool.kafka.consumer.config;

import java.time.Duration;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.TestPropertySource;

@EnableConfigurationProperties
@SpringBootTest(classes = {ConsumerConfiguration.class})
@TestPropertySource(properties = {"spring.config.location=classpath:/base.yaml"})
public class ConsumerConfigurationTest {
  @Autowired private ConsumerConfiguration consumerConfiguration;

  @Test
  public void test() {
    Assertions.assertEquals(3, consumerConfiguration.getMaxRetries());
    Assertions.assertEquals(10, consumerConfiguration.getInitialRetryDelayMs());
    Assertions.assertEquals(100, consumerConfiguration.getMaxRetryDelayMs());
    Assertions.assertEquals(2.0, consumerConfiguration.getRetryBackoffMultiplier());
    Assertions.assertEquals(0.1, consumerConfiguration.getRetryJitterFactor());
    Assertions.assertEquals(Duration.ofSeconds(5), consumerConfiguration.getCommitTimeout());
    Assertions.assertFalse(consumerConfiguration.isEnableDlqFallback());
    Assertions.assertEquals(3, consumerConfiguration.getDlqMaxRetries());
    Assertions.assertEquals(2000, consumerConfiguration.getDlqPublishTimeoutMs());
    Assertions.assertEquals(Duration.ofSeconds(5), consumerConfiguration.getShutdownTimeout());
    Assertions.assertEquals(4, consumerConfiguration.getThreadPoolSize());
    Assertions.assertEquals(50, consumerConfiguration.getMaxQueuedTasks());
    Assertions.assertEquals(20, consumerConfiguration.getMaxQueuedMessagesPerPartition());
    Assertions.assertEquals(500, consumerConfiguration.getOffsetCommitIntervalMs());
    Assertions.assertEquals(50, consumerConfiguration.getPollTimeoutMs());
    Assertions.assertSame(consumerConfiguration, consumerConfiguration.validate());
  }

  @Test
  public void testDefaultsAreValid() {
    ConsumerConfiguration config = new ConsumerConfiguration();
    Assertions.assertSame(config, config.validate());
    Assertions.assertEquals(3, config.getMaxRetries());
    Assertions.assertEquals(1000, config.getInitialRetryDelayMs());
    Assertions.assertEquals(30000, config.getMaxRetryDelayMs());
    Assertions.assertFalse(config.isEnableDlqFallback());
  }

  @Test
  public void testValidateRejectsOutOfRangeValues() {
    ConsumerConfiguration negativeRetries = new ConsumerConfiguration();
    negativeRetries.setMaxRetries(-1);
    Assertions.assertThrows(IllegalArgumentException.class, negativeRetries::validate);

    ConsumerConfiguration invertedDelays = new ConsumerConfiguration();
    invertedDelays.setInitialRetryDelayMs(500);
    invertedDelays.setMaxRetryDelayMs(100);
    Assertions.assertThrows(IllegalArgumentException.class, invertedDelays::validate);

    ConsumerConfiguration shrinkingBackoff = new ConsumerConfiguration();
    shrinkingBackoff.setRetryBackoffMultiplier(0.5);
    Assertions.assertThrows(IllegalArgumentException.class, shrinkingBackoff::validate);

    ConsumerConfiguration noWorkers = new ConsumerConfiguration();
    noWorkers.setThreadPoolSize(0);
    Assertions.assertThrows(IllegalArgumentException.class, noWorkers::validate);
  }
}
