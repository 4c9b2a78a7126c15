package io.neotool.kafka.consumer.dlq;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.MoreObjects;
import com.google.common.base.Strings;
import io.neotool.kafka.consumer.message.InboundMessage;
import java.time.Instant;
import java.util.Objects;
import javax.annotation.Nullable;

/**
 * DlqEnvelope is what gets published to the dead letter topic: the untouched original payload plus
 * where it came from and why it failed. Immutable.
 *
 * @param <V> type of the original payload.
 */
public final class DlqEnvelope<V> {
  private final V originalMessage;
  @Nullable private final String key;
  private final String topic;
  private final int partition;
  private final long offset;
  // fully qualified class name of the failure
  private final String errorType;
  private final String errorMessage;
  private final int retryCount;
  // ISO-8601 instant
  private final String failedAt;

  @JsonCreator
  public DlqEnvelope(
      @JsonProperty("originalMessage") V originalMessage,
      @JsonProperty("key") @Nullable String key,
      @JsonProperty("topic") String topic,
      @JsonProperty("partition") int partition,
      @JsonProperty("offset") long offset,
      @JsonProperty("errorType") String errorType,
      @JsonProperty("errorMessage") String errorMessage,
      @JsonProperty("retryCount") int retryCount,
      @JsonProperty("failedAt") String failedAt) {
    this.originalMessage = originalMessage;
    this.key = key;
    this.topic = topic;
    this.partition = partition;
    this.offset = offset;
    this.errorType = errorType;
    this.errorMessage = errorMessage;
    this.retryCount = retryCount;
    this.failedAt = failedAt;
  }

  /**
   * Builds the envelope for a message that failed terminally.
   *
   * @param retryCount number of retries performed before giving up.
   */
  public static <V> DlqEnvelope<V> of(
      InboundMessage<V> message, Throwable failure, int retryCount, Instant failedAt) {
    return new DlqEnvelope<>(
        message.getPayload(),
        message.getKey(),
        message.getTopic(),
        message.getPartition(),
        message.getOffset(),
        failure.getClass().getName(),
        Strings.nullToEmpty(failure.getMessage()),
        retryCount,
        failedAt.toString());
  }

  @JsonProperty("originalMessage")
  public V getOriginalMessage() {
    return originalMessage;
  }

  @Nullable
  @JsonProperty("key")
  public String getKey() {
    return key;
  }

  @JsonProperty("topic")
  public String getTopic() {
    return topic;
  }

  @JsonProperty("partition")
  public int getPartition() {
    return partition;
  }

  @JsonProperty("offset")
  public long getOffset() {
    return offset;
  }

  @JsonProperty("errorType")
  public String getErrorType() {
    return errorType;
  }

  @JsonProperty("errorMessage")
  public String getErrorMessage() {
    return errorMessage;
  }

  @JsonProperty("retryCount")
  public int getRetryCount() {
    return retryCount;
  }

  @JsonProperty("failedAt")
  public String getFailedAt() {
    return failedAt;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    DlqEnvelope<?> that = (DlqEnvelope<?>) o;
    return partition == that.partition
        && offset == that.offset
        && retryCount == that.retryCount
        && Objects.equals(originalMessage, that.originalMessage)
        && Objects.equals(key, that.key)
        && topic.equals(that.topic)
        && errorType.equals(that.errorType)
        && errorMessage.equals(that.errorMessage)
        && failedAt.equals(that.failedAt);
  }

  @Override
  public int hashCode() {
    return Objects.hash(
        originalMessage,
        key,
        topic,
        partition,
        offset,
        errorType,
        errorMessage,
        retryCount,
        failedAt);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("key", key)
        .add("topic", topic)
        .add("partition", partition)
        .add("offset", offset)
        .add("errorType", errorType)
        .add("errorMessage", errorMessage)
        .add("retryCount", retryCount)
        .add("failedAt", failedAt)
        .add("originalMessage", originalMessage)
        .toString();
  }
}
