package io.neotool.kafka.sample.people.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.MoreObjects;
import java.util.Objects;
import javax.annotation.Nullable;

/**
 * One record of the {@code swapi.people.v1} topic.
 *
 * <p>A record that cannot be parsed is represented by {@link #malformed}, which keeps the raw
 * text so that it reaches the DLQ unchanged.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class PeopleMessage {
  @Nullable private final String batchId;
  @Nullable private final String recordId;
  @Nullable private final String ingestedAt;
  @Nullable private final PeoplePayload payload;
  @Nullable private final String rawPayload;
  @Nullable private final String parseError;

  @JsonCreator
  public PeopleMessage(
      @JsonProperty("batch_id") @Nullable String batchId,
      @JsonProperty("record_id") @Nullable String recordId,
      @JsonProperty("ingested_at") @Nullable String ingestedAt,
      @JsonProperty("payload") @Nullable PeoplePayload payload) {
    this(batchId, recordId, ingestedAt, payload, null, null);
  }

  private PeopleMessage(
      @Nullable String batchId,
      @Nullable String recordId,
      @Nullable String ingestedAt,
      @Nullable PeoplePayload payload,
      @Nullable String rawPayload,
      @Nullable String parseError) {
    this.batchId = batchId;
    this.recordId = recordId;
    this.ingestedAt = ingestedAt;
    this.payload = payload;
    this.rawPayload = rawPayload;
    this.parseError = parseError;
  }

  /**
   * Creates a placeholder for a record whose value could not be parsed.
   *
   * @param rawPayload the record value as text, or null for an empty record.
   * @param parseError why parsing failed.
   */
  public static PeopleMessage malformed(@Nullable String rawPayload, String parseError) {
    return new PeopleMessage(null, null, null, null, rawPayload, parseError);
  }

  @Nullable
  @JsonProperty("batch_id")
  public String getBatchId() {
    return batchId;
  }

  @Nullable
  @JsonProperty("record_id")
  public String getRecordId() {
    return recordId;
  }

  @Nullable
  @JsonProperty("ingested_at")
  public String getIngestedAt() {
    return ingestedAt;
  }

  @Nullable
  @JsonProperty("payload")
  public PeoplePayload getPayload() {
    return payload;
  }

  @Nullable
  @JsonProperty("raw_payload")
  public String getRawPayload() {
    return rawPayload;
  }

  @Nullable
  @JsonIgnore
  public String getParseError() {
    return parseError;
  }

  @JsonIgnore
  public boolean isMalformed() {
    return parseError != null;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    PeopleMessage that = (PeopleMessage) o;
    return Objects.equals(batchId, that.batchId)
        && Objects.equals(recordId, that.recordId)
        && Objects.equals(ingestedAt, that.ingestedAt)
        && Objects.equals(payload, that.payload)
        && Objects.equals(rawPayload, that.rawPayload)
        && Objects.equals(parseError, that.parseError);
  }

  @Override
  public int hashCode() {
    return Objects.hash(batchId, recordId, ingestedAt, payload, rawPayload, parseError);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .omitNullValues()
        .add("batchId", batchId)
        .add("recordId", recordId)
        .add("ingestedAt", ingestedAt)
        .add("payload", payload)
        .add("parseError", parseError)
        .toString();
  }
}
