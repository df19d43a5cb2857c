package io.openanomaly.core.queue;

import io.openanomaly.core.common.CoreInfra;
import io.openanomaly.core.common.CoreInfraAutoConfiguration;
import io.openanomaly.core.config.QueueConfiguration;
import io.openanomaly.core.controller.scheduler.JobTrigger;
import io.openanomaly.core.registry.PipelineRegistry;
import io.openanomaly.core.registry.RegistryAutoConfiguration;
import java.time.Clock;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Import;

/** Configuration for the job queue shared by the scheduler, the workers and the ops commands. */
@Configuration
@EnableConfigurationProperties(QueueConfiguration.class)
@Import({CoreInfraAutoConfiguration.class, RegistryAutoConfiguration.class})
public class QueueAutoConfiguration {

  @Bean(destroyMethod = "stop")
  @ConditionalOnMissingBean
  public JobQueue jobQueue(QueueConfiguration config, Clock clock, CoreInfra infra) {
    switch (config.getMode()) {
      case REDIS:
        return RedisJobQueue.connect(
            config.getRedisUri(),
            config.getRedisTimeout(),
            config.getKeyPrefix(),
            clock,
            config.getVisibilityTimeout(),
            config.getPollInterval(),
            infra.subScope("queue"));
      case LOCAL:
      default:
        return new LocalJobQueue(clock, config.getVisibilityTimeout());
    }
  }

  @Bean
  public JobTrigger jobTrigger(PipelineRegistry registry, JobQueue jobQueue, Clock clock) {
    return new JobTrigger(registry, jobQueue, clock);
  }
}
