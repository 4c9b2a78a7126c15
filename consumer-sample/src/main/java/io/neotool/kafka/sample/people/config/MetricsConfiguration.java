package io.neotool.kafka.sample.people.config;

import com.uber.m3.tally.NullStatsReporter;
import com.uber.m3.tally.RootScopeBuilder;
import com.uber.m3.tally.Scope;
import com.uber.m3.util.Duration;
import com.uber.m3.util.ImmutableMap;
import io.neotool.kafka.consumer.common.CoreInfra;
import io.opentracing.Tracer;
import io.opentracing.noop.NoopTracerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Configuration for tally metrics and the tracer shared by the consumer components. */
@Configuration
@ConfigurationProperties(prefix = "metrics")
public class MetricsConfiguration {
  // seconds between reports to the stats reporter
  private int publishIntervalSec = 5;
  private String service = "people-consumer";

  public int getPublishIntervalSec() {
    return publishIntervalSec;
  }

  public void setPublishIntervalSec(int publishIntervalSec) {
    this.publishIntervalSec = publishIntervalSec;
  }

  public String getService() {
    return service;
  }

  public void setService(String service) {
    this.service = service;
  }

  @Bean(destroyMethod = "close")
  @ConditionalOnMissingBean
  public Scope rootScope() {
    return new RootScopeBuilder()
        .reporter(new NullStatsReporter())
        .tags(new ImmutableMap.Builder<String, String>().put("service", service).build())
        .reportEvery(Duration.ofSeconds(publishIntervalSec));
  }

  @Bean
  @ConditionalOnMissingBean
  public Tracer tracer() {
    return NoopTracerFactory.create();
  }

  @Bean
  public CoreInfra coreInfra(Scope scope, Tracer tracer) {
    return CoreInfra.builder().withScope(scope).withTracer(tracer).build();
  }
}
