package io.neotool.kafka.sample.people;

import io.neotool.kafka.consumer.processor.ValidationException;
import io.neotool.kafka.sample.people.model.PeopleMessage;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class PeopleProcessorTest {
  private PeopleProcessor processor;

  @BeforeEach
  public void setUp() {
    processor = new PeopleProcessor();
  }

  @Test
  public void testValidMessage() {
    Assertions.assertDoesNotThrow(() -> processor.process(PeopleFixtures.luke()));
    Assertions.assertEquals("1", processor.getRecordId(PeopleFixtures.luke()));
  }

  @Test
  public void testBlankBatchId() {
    ValidationException e =
        Assertions.assertThrows(
            ValidationException.class,
            () -> processor.process(PeopleFixtures.message("   ", "1", "Luke Skywalker")));
    Assertions.assertEquals("batchId cannot be blank", e.getMessage());
  }

  @Test
  public void testMissingRecordId() {
    ValidationException e =
        Assertions.assertThrows(
            ValidationException.class,
            () -> processor.process(PeopleFixtures.message("batch-1", null, "Luke Skywalker")));
    Assertions.assertEquals("recordId cannot be blank", e.getMessage());
  }

  @Test
  public void testBlankName() {
    ValidationException e =
        Assertions.assertThrows(
            ValidationException.class,
            () -> processor.process(PeopleFixtures.message("batch-1", "1", "")));
    Assertions.assertEquals("payload.name cannot be blank", e.getMessage());
  }

  @Test
  public void testMissingPayload() {
    PeopleMessage message = new PeopleMessage("batch-1", "1", null, null);
    Assertions.assertThrows(ValidationException.class, () -> processor.process(message));
  }

  @Test
  public void testMalformedMessage() {
    PeopleMessage message = PeopleMessage.malformed("{not json", "Unexpected character");
    ValidationException e =
        Assertions.assertThrows(ValidationException.class, () -> processor.process(message));
    Assertions.assertTrue(e.getMessage().contains("malformed"));
    Assertions.assertEquals("unknown", processor.getRecordId(message));
  }
}
