package io.openanomaly.core.common;

import com.timgroup.statsd.NonBlockingStatsDClient;
import com.timgroup.statsd.StatsDClient;
import com.uber.m3.tally.NoopScope;
import com.uber.m3.tally.RootScopeBuilder;
import com.uber.m3.tally.Scope;
import com.uber.m3.tally.StatsReporter;
import com.uber.m3.tally.statsd.StatsdReporter;
import com.uber.m3.util.Duration;
import com.uber.m3.util.ImmutableMap;
import java.util.Objects;
import javax.annotation.Nullable;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;

/** Configuration for tally metrics */
@ConfigurationProperties(prefix = "metrics")
public class MetricsConfiguration {
  @Nullable static Scope INSTANCE;

  static final String METRICS_REPORTER_STATSD = "statsd";
  static final String METRICS_REPORTER_NOOP = "noop";

  // The metrics reporter to use, statsd or noop
  private String metricsReporter = METRICS_REPORTER_NOOP;
  private String statsdHost = "localhost";
  private int statsdPort = 8125;
  private String statsdPrefix = "openanomaly";
  private int publishIntervalSec = 5;

  public String getMetricsReporter() {
    return metricsReporter;
  }

  public void setMetricsReporter(String metricsReporter) {
    this.metricsReporter = metricsReporter;
  }

  public String getStatsdHost() {
    return statsdHost;
  }

  public void setStatsdHost(String statsdHost) {
    this.statsdHost = statsdHost;
  }

  public int getStatsdPort() {
    return statsdPort;
  }

  public void setStatsdPort(int statsdPort) {
    this.statsdPort = statsdPort;
  }

  public String getStatsdPrefix() {
    return statsdPrefix;
  }

  public void setStatsdPrefix(String statsdPrefix) {
    this.statsdPrefix = statsdPrefix;
  }

  public int getPublishIntervalSec() {
    return publishIntervalSec;
  }

  public void setPublishIntervalSec(int publishIntervalSec) {
    this.publishIntervalSec = publishIntervalSec;
  }

  @Bean
  @ConditionalOnProperty(
    prefix = "metrics.rootScope",
    name = "enabled",
    havingValue = "true",
    matchIfMissing = true
  )
  @ConditionalOnMissingBean
  public Scope rootScope() {
    if (INSTANCE == null) {
      if (METRICS_REPORTER_STATSD.equals(metricsReporter)) {
        StatsDClient statsd = new NonBlockingStatsDClient(statsdPrefix, statsdHost, statsdPort);
        StatsReporter statsReporter = new StatsdReporter(statsd);
        INSTANCE =
            new RootScopeBuilder()
                .reporter(statsReporter)
                .tags(new ImmutableMap.Builder<String, String>().build())
                .reportEvery(Duration.ofSeconds(publishIntervalSec));
      } else {
        INSTANCE = new NoopScope();
      }
    }
    return Objects.requireNonNull(INSTANCE);
  }
}
