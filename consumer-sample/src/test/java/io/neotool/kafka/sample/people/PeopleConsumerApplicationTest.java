package io.neotool.kafka.sample.people;

import io.neotool.kafka.consumer.config.KafkaConsumerConfiguration;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

@SpringBootTest(
    classes = PeopleConsumerApplication.class,
    properties = {"consumer.autoStartup=false"})
public class PeopleConsumerApplicationTest {
  @Autowired private KafkaConsumerConfiguration kafkaConfig;
  @Autowired private PeopleConsumerLifecycle lifecycle;

  @Test
  public void testContextLoadsWithDefaults() {
    Assertions.assertEquals("swapi.people.v1", kafkaConfig.getTopic());
    Assertions.assertEquals("swapi.people.dlq", kafkaConfig.getDlqTopic());
    Assertions.assertEquals("swapi-people-consumer", kafkaConfig.getGroupId());
    Assertions.assertFalse(lifecycle.isRunning());
  }
}
