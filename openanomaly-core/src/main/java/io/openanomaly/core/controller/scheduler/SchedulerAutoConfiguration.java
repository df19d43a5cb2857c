package io.openanomaly.core.controller.scheduler;

import io.openanomaly.core.common.CoreInfra;
import io.openanomaly.core.config.SchedulerConfiguration;
import io.openanomaly.core.controller.coordinator.CoordinatorAutoConfiguration;
import io.openanomaly.core.controller.coordinator.LeaderSelector;
import io.openanomaly.core.queue.JobQueue;
import io.openanomaly.core.queue.QueueAutoConfiguration;
import io.openanomaly.core.registry.PipelineRegistry;
import io.openanomaly.core.registry.RegistryAutoConfiguration;
import java.time.Clock;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Import;
import org.springframework.context.annotation.Profile;
import org.springframework.scheduling.annotation.EnableScheduling;

/** Configuration for the leader elected scheduling loop. */
@Configuration
@Profile(PipelineScheduler.SPRING_PROFILE)
@EnableScheduling
@EnableConfigurationProperties(SchedulerConfiguration.class)
@Import({
  CoordinatorAutoConfiguration.class,
  RegistryAutoConfiguration.class,
  QueueAutoConfiguration.class
})
public class SchedulerAutoConfiguration {

  @Bean
  public TickPlanner tickPlanner(SchedulerConfiguration config) {
    return new TickPlanner(
        config.getGrace(), config.isCatchUpEnabled(), config.getCatchUpWindow(), config.getZone());
  }

  @Bean
  public PipelineScheduler pipelineScheduler(
      PipelineRegistry registry,
      JobQueue queue,
      LeaderSelector leaderSelector,
      TickPlanner tickPlanner,
      Clock clock,
      CoreInfra infra) {
    return new PipelineScheduler(
        registry, queue, leaderSelector, tickPlanner, clock, infra.subScope("scheduler"));
  }
}
