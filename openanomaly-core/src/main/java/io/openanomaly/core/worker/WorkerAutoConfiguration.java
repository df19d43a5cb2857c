package io.openanomaly.core.worker;

import io.openanomaly.core.common.CoreInfra;
import io.openanomaly.core.common.CoreInfraAutoConfiguration;
import io.openanomaly.core.config.WorkerConfiguration;
import io.openanomaly.core.config.ZookeeperAutoConfiguration;
import io.openanomaly.core.queue.JobQueue;
import io.openanomaly.core.queue.QueueAutoConfiguration;
import java.time.Clock;
import org.apache.curator.framework.CuratorFramework;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Import;
import org.springframework.context.annotation.Profile;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Configuration for the worker runtime.
 *
 * <p>The application provides the {@link TaskExecutor} bean that runs the job bodies.
 */
@Configuration
@Profile(WorkerRuntime.SPRING_PROFILE)
@EnableScheduling
@EnableConfigurationProperties(WorkerConfiguration.class)
@Import({
  CoreInfraAutoConfiguration.class,
  ZookeeperAutoConfiguration.class,
  QueueAutoConfiguration.class
})
public class WorkerAutoConfiguration {

  @Bean
  @ConditionalOnMissingBean
  public ResultLedger resultLedger(
      WorkerConfiguration config,
      ObjectProvider<CuratorFramework> curatorFramework,
      Clock clock,
      CoreInfra infra) {
    switch (config.getLedgerMode()) {
      case ZK:
        return new ZKResultLedger(
            curatorFramework.getObject(), config.getLedgerZkPath(), clock, infra);
      case LOCAL:
      default:
        return new LocalResultLedger(clock);
    }
  }

  @Bean
  public WorkerRuntime workerRuntime(
      JobQueue jobQueue,
      ResultLedger resultLedger,
      TaskExecutor taskExecutor,
      WorkerConfiguration config,
      Clock clock,
      CoreInfra infra) {
    return new WorkerRuntime(
        jobQueue, resultLedger, taskExecutor, config, clock, infra.subScope("worker"));
  }
}
