package io.neotool.kafka.consumer.dlq;

import io.neotool.kafka.consumer.common.StructuredLogging;
import javax.annotation.Nullable;
import net.logstash.logback.argument.StructuredArguments;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Logs the full envelope at error level so that it can be recovered from the logs. */
public class LoggingDlqFallback<V> implements DlqFallback<V> {
  private static final Logger LOGGER = LoggerFactory.getLogger(LoggingDlqFallback.class);

  @Override
  public void handle(DlqEnvelope<V> envelope, @Nullable Throwable lastFailure) {
    LOGGER.error(
        "consumer.dlq.fallback",
        StructuredLogging.kafkaTopic(envelope.getTopic()),
        StructuredLogging.kafkaPartition(envelope.getPartition()),
        StructuredLogging.kafkaOffset(envelope.getOffset()),
        StructuredLogging.retryCount(envelope.getRetryCount()),
        StructuredArguments.keyValue("envelope", envelope),
        lastFailure);
  }
}
