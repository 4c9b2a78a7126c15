package io.neotool.kafka.sample.people.serde;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.neotool.kafka.sample.people.model.PeopleMessage;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import javax.annotation.Nullable;
import org.apache.kafka.common.serialization.Deserializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Kafka deserializer for {@link PeopleMessage} JSON.
 *
 * <p>Never throws. A value that is empty or not a JSON object becomes {@link
 * PeopleMessage#malformed}, so the poll loop keeps going and the record is rejected by validation
 * instead.
 */
public class PeopleMessageDeserializer implements Deserializer<PeopleMessage> {
  private static final Logger LOGGER = LoggerFactory.getLogger(PeopleMessageDeserializer.class);
  private static final String EMPTY_VALUE = "empty record value";

  private final ObjectMapper objectMapper;

  /** Used when Kafka instantiates the deserializer from its class name. */
  public PeopleMessageDeserializer() {
    this(new ObjectMapper().findAndRegisterModules());
  }

  public PeopleMessageDeserializer(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  @Override
  public PeopleMessage deserialize(String topic, @Nullable byte[] data) {
    if (data == null || data.length == 0) {
      return PeopleMessage.malformed(null, EMPTY_VALUE);
    }
    try {
      PeopleMessage message = objectMapper.readValue(data, PeopleMessage.class);
      if (message == null) {
        return PeopleMessage.malformed(text(data), EMPTY_VALUE);
      }
      return message;
    } catch (JsonProcessingException e) {
      LOGGER.warn("people.deserialize.failure", e);
      return PeopleMessage.malformed(text(data), e.getOriginalMessage());
    } catch (IOException e) {
      LOGGER.warn("people.deserialize.failure", e);
      return PeopleMessage.malformed(text(data), e.getMessage());
    }
  }

  private static String text(byte[] data) {
    return new String(data, StandardCharsets.UTF_8);
  }
}
