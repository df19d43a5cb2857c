package io.openanomaly;

import com.google.common.annotations.VisibleForTesting;
import io.openanomaly.core.controller.scheduler.PipelineScheduler;
import io.openanomaly.core.worker.WorkerRuntime;
import io.openanomaly.ops.OpsRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.core.env.ConfigurableEnvironment;
import org.springframework.core.env.StandardEnvironment;

@SpringBootApplication
@SuppressWarnings("PrivateConstructorForUtilityClass")
public class OpenAnomaly {

  public static void main(String[] args) {
    SpringApplication app = new SpringApplication(OpenAnomaly.class);
    String[] profiles = provideActiveProfile(args);
    app.setEnvironment(buildConfigurationEnvironment(profiles));
    System.setProperty("spring.profiles.active", String.join(",", profiles));
    app.setAdditionalProfiles(profiles);

    ConfigurableApplicationContext context = app.run(args);
    if (isOps(args)) {
      // the runner has finished the command, its exit code is the process exit code
      System.exit(SpringApplication.exit(context));
    }
  }

  @VisibleForTesting
  static ConfigurableEnvironment buildConfigurationEnvironment(String[] profiles) {
    ConfigurableEnvironment configurableEnvironment = new StandardEnvironment();
    configurableEnvironment.setActiveProfiles(profiles);
    return configurableEnvironment;
  }

  @VisibleForTesting
  static String[] provideActiveProfile(String[] args) {
    String appType = null;
    // try to get app type from parameters first.
    if (args != null && args.length > 0) {
      appType = args[0];
    }
    if (appType == null) {
      appType = "";
    }
    return getActiveProfiles(appType);
  }

  @VisibleForTesting
  static String[] getActiveProfiles(String appType) {
    switch (appType) {
      case OpenAnomalyAppType.SCHEDULER_APP:
        return new String[] {PipelineScheduler.SPRING_PROFILE, OpenAnomalyAppType.SCHEDULER_APP};
      case OpenAnomalyAppType.WORKER_APP:
        return new String[] {WorkerRuntime.SPRING_PROFILE, OpenAnomalyAppType.WORKER_APP};
      case OpenAnomalyAppType.STANDALONE_APP:
        return new String[] {
          PipelineScheduler.SPRING_PROFILE,
          WorkerRuntime.SPRING_PROFILE,
          OpenAnomalyAppType.STANDALONE_APP
        };
      case OpenAnomalyAppType.OPS_APP:
        return new String[] {OpsRunner.SPRING_PROFILE};
      default:
        return new String[] {};
    }
  }

  @VisibleForTesting
  static boolean isOps(String[] args) {
    return args != null && args.length > 0 && OpenAnomalyAppType.OPS_APP.equals(args[0]);
  }
}
