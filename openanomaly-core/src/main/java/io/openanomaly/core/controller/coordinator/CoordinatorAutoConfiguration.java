package io.openanomaly.core.controller.coordinator;

import com.google.common.collect.ImmutableMap;
import io.openanomaly.core.common.CoreInfra;
import io.openanomaly.core.common.CoreInfraAutoConfiguration;
import io.openanomaly.core.common.StructuredFields;
import io.openanomaly.core.config.CoordinatorConfiguration;
import io.openanomaly.core.config.ZookeeperAutoConfiguration;
import io.openanomaly.core.controller.scheduler.PipelineScheduler;
import java.time.Clock;
import org.apache.curator.framework.CuratorFramework;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Import;
import org.springframework.context.annotation.Profile;

/** Configuration for the leadership lease. */
@Configuration
@Profile(PipelineScheduler.SPRING_PROFILE)
@EnableConfigurationProperties(CoordinatorConfiguration.class)
@Import({CoreInfraAutoConfiguration.class, ZookeeperAutoConfiguration.class})
public class CoordinatorAutoConfiguration {

  @Bean
  @ConditionalOnMissingBean
  public DistributedLock distributedLock(
      CoordinatorConfiguration config,
      ObjectProvider<CuratorFramework> curatorFramework,
      Clock clock,
      CoreInfra infra) {
    switch (config.getMode()) {
      case LOCAL:
        return new LocalDistributedLock(clock);
      case ZK:
      default:
        return new ZKDistributedLock(
            curatorFramework.getObject(), config.getZkPath(), clock, infra);
    }
  }

  @Bean
  public LeaderSelector leaderSelector(
      CoordinatorConfiguration config, DistributedLock distributedLock, CoreInfra infra) {
    return new LeaderSelector(
        distributedLock,
        config.getHolderId(),
        config.getTtl(),
        config.getRenewInterval(),
        config.getSafetyMargin(),
        infra.tagged(ImmutableMap.of(StructuredFields.HOLDER_ID, config.getHolderId())));
  }
}
