package io.openanomaly.core.pipeline;

import java.time.Duration;

/** Valid pipelines for tests. */
public final class PipelineFixtures {
  private PipelineFixtures() {}

  public static Pipeline pipeline(String name) {
    Pipeline pipeline = new Pipeline();
    pipeline.setName(name);
    pipeline.setQuery("avg(rate(node_cpu_seconds_total{mode!=\"idle\"}[1m]))");
    pipeline.setStep(Duration.ofMinutes(1));
    pipeline.setContextWindow(Duration.ofHours(1));
    pipeline.setPredictionHorizon(Duration.ofMinutes(5));
    return pipeline;
  }

  public static Pipeline forecastOnly(String name, String schedule) {
    Pipeline pipeline = pipeline(name);
    pipeline.setMode(PipelineMode.FORECAST_ONLY);
    pipeline.setForecastSchedule(schedule);
    return pipeline;
  }

  public static Pipeline withTraining(String name) {
    Pipeline pipeline = pipeline(name);
    TrainingConfig training = new TrainingConfig();
    training.setSchedule("0 0 * * *");
    training.setWindow(Duration.ofDays(7));
    pipeline.setTraining(training);
    pipeline.getModel().setId("holt");
    return pipeline;
  }
}
