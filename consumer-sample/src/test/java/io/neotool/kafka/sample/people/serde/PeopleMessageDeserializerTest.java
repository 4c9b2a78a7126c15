package io.neotool.kafka.sample.people.serde;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.neotool.kafka.sample.people.model.PeopleMessage;
import java.nio.charset.StandardCharsets;
import java.util.List;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class PeopleMessageDeserializerTest {
  private static final String TOPIC = "swapi.people.v1";

  private ObjectMapper objectMapper;
  private PeopleMessageDeserializer deserializer;

  @BeforeEach
  public void setUp() {
    objectMapper = new ObjectMapper();
    deserializer = new PeopleMessageDeserializer(objectMapper);
  }

  @Test
  public void testDeserialize() {
    String json =
        "{\"batch_id\":\"b-7\",\"record_id\":\"4\",\"ingested_at\":\"2024-05-01T10:00:00Z\","
            + "\"unexpected\":true,\"payload\":{\"name\":\"Darth Vader\",\"height\":\"202\","
            + "\"hair_color\":\"none\",\"homeworld_url\":\"https://swapi.dev/api/planets/1/\","
            + "\"films\":[\"https://swapi.dev/api/films/2/\"]}}";
    PeopleMessage message = deserializer.deserialize(TOPIC, bytes(json));

    Assertions.assertFalse(message.isMalformed());
    Assertions.assertEquals("b-7", message.getBatchId());
    Assertions.assertEquals("4", message.getRecordId());
    Assertions.assertEquals("2024-05-01T10:00:00Z", message.getIngestedAt());
    Assertions.assertEquals("Darth Vader", message.getPayload().getName());
    Assertions.assertEquals("none", message.getPayload().getHairColor());
    Assertions.assertEquals(
        "https://swapi.dev/api/planets/1/", message.getPayload().getHomeworldUrl());
    Assertions.assertEquals(
        List.of("https://swapi.dev/api/films/2/"), message.getPayload().getFilms());
    Assertions.assertTrue(message.getPayload().getStarships().isEmpty());
  }

  @Test
  public void testWhitespaceIsPreserved() {
    PeopleMessage message =
        deserializer.deserialize(TOPIC, bytes("{\"batch_id\":\"  \",\"record_id\":\"1\"}"));
    Assertions.assertFalse(message.isMalformed());
    Assertions.assertEquals("  ", message.getBatchId());
  }

  @Test
  public void testMalformedJson() throws Exception {
    PeopleMessage message = deserializer.deserialize(TOPIC, bytes("{\"batch_id\": oops"));

    Assertions.assertTrue(message.isMalformed());
    Assertions.assertNotNull(message.getParseError());
    Assertions.assertEquals("{\"batch_id\": oops", message.getRawPayload());

    JsonNode json = objectMapper.readTree(objectMapper.writeValueAsBytes(message));
    Assertions.assertEquals("{\"batch_id\": oops", json.get("raw_payload").asText());
    Assertions.assertFalse(json.has("batch_id"));
  }

  @Test
  public void testEmptyValue() {
    Assertions.assertTrue(deserializer.deserialize(TOPIC, null).isMalformed());
    Assertions.assertTrue(deserializer.deserialize(TOPIC, new byte[0]).isMalformed());
    Assertions.assertTrue(deserializer.deserialize(TOPIC, bytes("null")).isMalformed());
  }

  @Test
  public void testSerializedFieldNames() throws Exception {
    PeopleMessage message = deserializer.deserialize(TOPIC, bytes("{\"batch_id\":\"b\"}"));
    JsonNode json = objectMapper.readTree(objectMapper.writeValueAsBytes(message));
    Assertions.assertEquals("b", json.get("batch_id").asText());
    Assertions.assertFalse(json.has("parseError"));
    Assertions.assertFalse(json.has("malformed"));
  }

  private static byte[] bytes(String text) {
    return text.getBytes(StandardCharsets.UTF_8);
  }
}
