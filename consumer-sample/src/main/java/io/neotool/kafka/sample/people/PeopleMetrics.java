package io.neotool.kafka.sample.people;

import com.uber.m3.tally.Scope;
import io.neotool.kafka.consumer.metrics.TallyConsumerMetrics;

/** Consumer metrics under the "swapi.people" prefix, e.g. "swapi.people.dlq.count". */
public class PeopleMetrics extends TallyConsumerMetrics {
  public static final String PREFIX = "swapi.people";

  public PeopleMetrics(Scope scope) {
    super(scope, PREFIX);
  }
}
