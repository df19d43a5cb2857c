package io.openanomaly.task;

import io.openanomaly.config.ModelConfiguration;
import io.openanomaly.config.TsdbConfiguration;
import io.openanomaly.core.common.CoreInfra;
import io.openanomaly.core.common.CoreInfraAutoConfiguration;
import io.openanomaly.core.registry.PipelineRegistry;
import io.openanomaly.core.registry.RegistryAutoConfiguration;
import io.openanomaly.core.worker.TaskExecutor;
import io.openanomaly.core.worker.WorkerRuntime;
import io.openanomaly.model.ModelEngineAutoConfiguration;
import io.openanomaly.model.ModelEngineFactory;
import io.openanomaly.tsdb.PrometheusTsdbClientFactory;
import io.openanomaly.tsdb.TsdbClientFactory;
import java.time.Clock;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Import;
import org.springframework.context.annotation.Profile;

/* This class contains the configuration of the task bodies the worker runtime executes */
@Configuration
@Profile(WorkerRuntime.SPRING_PROFILE)
@EnableConfigurationProperties(TsdbConfiguration.class)
@Import({
  CoreInfraAutoConfiguration.class,
  RegistryAutoConfiguration.class,
  ModelEngineAutoConfiguration.class
})
public class OpenAnomalyWorkerFactory {

  @Bean
  public TsdbClientFactory tsdbClientFactory(TsdbConfiguration config, CoreInfra infra) {
    return new PrometheusTsdbClientFactory(config, infra.subScope("tsdb"));
  }

  @Bean(destroyMethod = "close")
  public TrainingEventPublisher trainingEventPublisher(Clock clock, CoreInfra infra) {
    return new TrainingEventPublisher(clock, infra.subScope("training"));
  }

  @Bean
  public ForecastTask forecastTask(
      TsdbClientFactory tsdbClientFactory,
      ModelEngineFactory modelEngineFactory,
      PipelineRegistry registry,
      ModelConfiguration config,
      CoreInfra infra) {
    return new ForecastTask(
        tsdbClientFactory, modelEngineFactory, registry, config, infra.subScope("forecast"));
  }

  @Bean
  public AnomalyTask anomalyTask(
      TsdbClientFactory tsdbClientFactory,
      ModelEngineFactory modelEngineFactory,
      PipelineRegistry registry,
      ModelConfiguration config,
      CoreInfra infra) {
    return new AnomalyTask(
        tsdbClientFactory, modelEngineFactory, registry, config, infra.subScope("anomaly"));
  }

  @Bean
  public TrainTask trainTask(
      TsdbClientFactory tsdbClientFactory,
      ModelEngineFactory modelEngineFactory,
      PipelineRegistry registry,
      TrainingEventPublisher publisher,
      Clock clock,
      CoreInfra infra) {
    return new TrainTask(
        tsdbClientFactory,
        modelEngineFactory,
        registry,
        publisher,
        clock,
        infra.subScope("train"));
  }

  @Bean
  public TaskExecutor taskExecutor(
      ForecastTask forecastTask, AnomalyTask anomalyTask, TrainTask trainTask) {
    return new PipelineTaskExecutor(forecastTask, anomalyTask, trainTask);
  }
}
