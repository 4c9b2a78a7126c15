package io.neotool.kafka.sample.people;

import com.google.common.base.Strings;
import io.neotool.kafka.consumer.processor.MessageProcessor;
import io.neotool.kafka.consumer.processor.ValidationException;
import io.neotool.kafka.sample.people.common.StructuredLogging;
import io.neotool.kafka.sample.people.model.PeopleMessage;
import io.neotool.kafka.sample.people.model.PeoplePayload;
import javax.annotation.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Validates and handles people records.
 *
 * <p>Blank identifiers and nameless payloads are rejected with a {@link ValidationException}, so
 * they go to the DLQ without retry. Processing a valid record only logs it, which makes it
 * idempotent.
 */
public class PeopleProcessor implements MessageProcessor<PeopleMessage> {
  private static final Logger LOGGER = LoggerFactory.getLogger(PeopleProcessor.class);
  private static final String UNKNOWN_RECORD = "unknown";

  @Override
  public void process(PeopleMessage message) throws ValidationException {
    validate(message);
    PeoplePayload payload = message.getPayload();
    LOGGER.info(
        "people.processed",
        StructuredLogging.recordId(getRecordId(message)),
        StructuredLogging.batchId(message.getBatchId()),
        StructuredLogging.personName(payload.getName()));
  }

  @Override
  public String getRecordId(PeopleMessage message) {
    String recordId = message.getRecordId();
    return isBlank(recordId) ? UNKNOWN_RECORD : recordId;
  }

  private static void validate(PeopleMessage message) throws ValidationException {
    if (message.isMalformed()) {
      throw new ValidationException("malformed people record: " + message.getParseError());
    }
    if (isBlank(message.getBatchId())) {
      throw new ValidationException("batchId cannot be blank");
    }
    if (isBlank(message.getRecordId())) {
      throw new ValidationException("recordId cannot be blank");
    }
    if (message.getPayload() == null) {
      throw new ValidationException("payload is required");
    }
    if (isBlank(message.getPayload().getName())) {
      throw new ValidationException("payload.name cannot be blank");
    }
  }

  private static boolean isBlank(@Nullable String value) {
    return Strings.isNullOrEmpty(value) || value.trim().isEmpty();
  }
}
