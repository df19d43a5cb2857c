package io.openanomaly.ops;

import io.openanomaly.core.controller.scheduler.JobTrigger;
import io.openanomaly.core.pipeline.PipelineCodec;
import io.openanomaly.core.queue.QueueAutoConfiguration;
import io.openanomaly.core.registry.PipelineRegistry;
import io.openanomaly.core.registry.RegistryAutoConfiguration;
import io.openanomaly.model.ModelEngineAutoConfiguration;
import java.io.PrintWriter;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Import;
import org.springframework.context.annotation.Profile;

/**
 * Configuration of the one-shot ops process. {@code trigger} reaches other processes only when
 * the queue is shared, i.e. {@code queue.mode=redis}.
 */
@Configuration
@Profile(OpsRunner.SPRING_PROFILE)
@Import({
  RegistryAutoConfiguration.class,
  QueueAutoConfiguration.class,
  ModelEngineAutoConfiguration.class
})
public class OpsAutoConfiguration {

  @Bean
  public OpsRunner opsRunner(PipelineRegistry registry, PipelineCodec codec, JobTrigger trigger) {
    return new OpsRunner(
        OpsCommand.commandLine(
            registry,
            codec,
            trigger,
            new PrintWriter(System.out, true),
            new PrintWriter(System.err, true)));
  }
}
