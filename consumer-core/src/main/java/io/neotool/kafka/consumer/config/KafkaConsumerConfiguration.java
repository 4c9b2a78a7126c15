package io.neotool.kafka.consumer.config;

import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import java.util.HashMap;
import java.util.Map;
import java.util.Properties;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.common.serialization.ByteArraySerializer;
import org.apache.kafka.common.serialization.StringDeserializer;
import org.apache.kafka.common.serialization.StringSerializer;
import org.springframework.boot.context.properties.ConfigurationProperties;

/** Broker connection settings for the source topic consumer and the DLQ producer. */
@ConfigurationProperties("consumer.kafka")
public class KafkaConsumerConfiguration {

  // the core owns commit timing, auto commit must stay disabled.
  private static final String ENABLE_AUTO_COMMIT = "false";

  private String bootstrapServers = "localhost:9092";
  private String groupId = "";
  private String topic = "";
  private String dlqTopic = "";
  private String clientIdPrefix = "neotool-consumer";
  // to guarantee no data loss on a fresh group
  private String autoOffsetReset = "earliest";
  private int maxPollRecords = 100;
  private int sessionTimeoutMs = 30000;
  private int heartbeatIntervalMs = 10000;
  // Passed through to the consumer as is. Cannot re-enable auto commit.
  private Map<String, String> consumerProperties = new HashMap<>();
  // Passed through to the DLQ producer as is.
  private Map<String, String> producerProperties = new HashMap<>();

  /**
   * Builds the Kafka consumer properties.
   *
   * @param valueDeserializerClass deserializer for record values; keys are always strings.
   * @return consumer properties with auto commit disabled.
   */
  public Properties getKafkaConsumerProperties(String valueDeserializerClass) {
    Preconditions.checkArgument(!Strings.isNullOrEmpty(groupId), "groupId is required");
    Properties properties = new Properties();
    properties.putAll(consumerProperties);
    properties.setProperty(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG, bootstrapServers);
    properties.setProperty(ConsumerConfig.CLIENT_ID_CONFIG, clientIdPrefix + "-" + groupId);
    properties.setProperty(ConsumerConfig.GROUP_ID_CONFIG, groupId);
    properties.setProperty(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, autoOffsetReset);
    properties.setProperty(
        ConsumerConfig.MAX_POLL_RECORDS_CONFIG, Integer.toString(maxPollRecords));
    properties.setProperty(
        ConsumerConfig.SESSION_TIMEOUT_MS_CONFIG, Integer.toString(sessionTimeoutMs));
    properties.setProperty(
        ConsumerConfig.HEARTBEAT_INTERVAL_MS_CONFIG, Integer.toString(heartbeatIntervalMs));
    properties.setProperty(
        ConsumerConfig.KEY_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class.getName());
    properties.setProperty(ConsumerConfig.VALUE_DESERIALIZER_CLASS_CONFIG, valueDeserializerClass);
    properties.setProperty(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG, ENABLE_AUTO_COMMIT);
    return properties;
  }

  /**
   * Builds the DLQ producer properties. Values are pre-serialized JSON bytes.
   *
   * @return producer properties.
   */
  public Properties getKafkaProducerProperties() {
    Properties properties = new Properties();
    properties.putAll(producerProperties);
    properties.setProperty(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, bootstrapServers);
    properties.setProperty(ProducerConfig.CLIENT_ID_CONFIG, clientIdPrefix + "-dlq-" + groupId);
    properties.setProperty(ProducerConfig.ACKS_CONFIG, "all");
    properties.setProperty(
        ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class.getName());
    properties.setProperty(
        ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, ByteArraySerializer.class.getName());
    return properties;
  }

  public String getBootstrapServers() {
    return bootstrapServers;
  }

  public void setBootstrapServers(String bootstrapServers) {
    this.bootstrapServers = bootstrapServers;
  }

  public String getGroupId() {
    return groupId;
  }

  public void setGroupId(String groupId) {
    this.groupId = groupId;
  }

  public String getTopic() {
    return topic;
  }

  public void setTopic(String topic) {
    this.topic = topic;
  }

  public String getDlqTopic() {
    return dlqTopic;
  }

  public void setDlqTopic(String dlqTopic) {
    this.dlqTopic = dlqTopic;
  }

  public String getClientIdPrefix() {
    return clientIdPrefix;
  }

  public void setClientIdPrefix(String clientIdPrefix) {
    this.clientIdPrefix = clientIdPrefix;
  }

  public String getAutoOffsetReset() {
    return autoOffsetReset;
  }

  public void setAutoOffsetReset(String autoOffsetReset) {
    this.autoOffsetReset = autoOffsetReset;
  }

  public int getMaxPollRecords() {
    return maxPollRecords;
  }

  public void setMaxPollRecords(int maxPollRecords) {
    this.maxPollRecords = maxPollRecords;
  }

  public int getSessionTimeoutMs() {
    return sessionTimeoutMs;
  }

  public void setSessionTimeoutMs(int sessionTimeoutMs) {
    this.sessionTimeoutMs = sessionTimeoutMs;
  }

  public int getHeartbeatIntervalMs() {
    return heartbeatIntervalMs;
  }

  public void setHeartbeatIntervalMs(int heartbeatIntervalMs) {
    this.heartbeatIntervalMs = heartbeatIntervalMs;
  }

  public Map<String, String> getConsumerProperties() {
    return consumerProperties;
  }

  public void setConsumerProperties(Map<String, String> consumerProperties) {
    this.consumerProperties = consumerProperties;
  }

  public Map<String, String> getProducerProperties() {
    return producerProperties;
  }

  public void setProducerProperties(Map<String, String> producerProperties) {
    this.producerProperties = producerProperties;
  }
}
