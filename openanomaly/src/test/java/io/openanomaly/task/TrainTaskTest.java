package io.openanomaly.task;

import io.openanomaly.core.common.CoreInfra;
import io.openanomaly.core.common.TestUtils;
import io.openanomaly.core.errors.ConfigValidationException;
import io.openanomaly.core.errors.DataUnavailableException;
import io.openanomaly.core.errors.InferenceException;
import io.openanomaly.core.pipeline.Pipeline;
import io.openanomaly.core.pipeline.TrainingConfig;
import io.openanomaly.core.registry.PipelineRegistry;
import io.openanomaly.core.registry.TrainingArtifact;
import io.openanomaly.model.ModelEngine;
import io.openanomaly.model.ModelEngineFactory;
import io.openanomaly.tsdb.InMemoryTsdb;
import io.openanomaly.tsdb.Sample;
import io.openanomaly.tsdb.TimeSeries;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.ArgumentMatchers;
import org.mockito.Mockito;

public class TrainTaskTest {
  private static final Instant DUE = Instant.parse("2024-01-08T00:00:00Z");

  private InMemoryTsdb tsdb;
  private ModelEngine engine;
  private PipelineRegistry registry;
  private TrainingEventPublisher publisher;
  private TestUtils.TestClock clock;
  private TrainTask task;
  private Pipeline pipeline;

  @BeforeEach
  public void setup() throws Exception {
    tsdb = new InMemoryTsdb();
    engine = Mockito.mock(ModelEngine.class);
    Mockito.when(engine.isTrainable()).thenReturn(true);
    ModelEngineFactory engineFactory = Mockito.mock(ModelEngineFactory.class);
    Mockito.when(engineFactory.get(ArgumentMatchers.any())).thenReturn(engine);
    registry = Mockito.mock(PipelineRegistry.class);
    publisher = Mockito.mock(TrainingEventPublisher.class);
    clock = new TestUtils.TestClock(DUE.plusSeconds(3));
    task = new TrainTask(tsdb, engineFactory, registry, publisher, clock, CoreInfra.NOOP);

    pipeline = TaskFixtures.cpuAnomaly();
    pipeline.getModel().setId("holt");
    TrainingConfig training = new TrainingConfig();
    training.setWindow(Duration.ofHours(2));
    training.setParameters(Map.of("seasonal_periods", 24));
    pipeline.setTraining(training);
  }

  @Test
  public void testTrainsAndSavesArtifact() throws Exception {
    tsdb.add(TaskFixtures.source(DUE.minus(Duration.ofHours(2)), DUE, 10));
    tsdb.add(
        TimeSeries.named(
            TaskFixtures.SOURCE_METRIC, Map.of("instance", "b"), List.of(new Sample(DUE, 1))));
    Mockito.when(
            engine.train(
                ArgumentMatchers.anyList(),
                ArgumentMatchers.any(),
                ArgumentMatchers.any(),
                ArgumentMatchers.anyMap()))
        .thenAnswer(
            invocation -> {
              clock.add(Duration.ofMillis(2500));
              return "holt:alpha=0.5,beta=0.1";
            });

    TrainingArtifact artifact = task.run(pipeline, DUE);

    Assertions.assertEquals(
        new TrainingArtifact(
            "cpu_anomaly",
            "holt:alpha=0.5,beta=0.1",
            DUE.plusMillis(5500),
            DUE.minus(Duration.ofHours(2)),
            DUE),
        artifact);
    Mockito.verify(registry).saveArtifact(artifact);
    ArgumentCaptor<List<Sample>> history = ArgumentCaptor.forClass(List.class);
    Mockito.verify(engine)
        .train(
            history.capture(),
            ArgumentMatchers.eq(Duration.ofMinutes(1)),
            ArgumentMatchers.eq(Duration.ofHours(2)),
            ArgumentMatchers.eq(Map.of("seasonal_periods", 24)));
    // the series with the most samples
    Assertions.assertEquals(121, history.getValue().size());

    Mockito.verify(publisher)
        .publish(
            pipeline,
            TrainingEventPublisher.TRAINING_STARTED,
            Map.of("model_id", "holt", "training_window", Duration.ofHours(2)),
            false);
    Mockito.verify(publisher)
        .publish(
            pipeline,
            TrainingEventPublisher.TRAINING_COMPLETED,
            Map.of(
                "model_id", "holt:alpha=0.5,beta=0.1",
                "training_window", Duration.ofHours(2),
                "status", "success",
                "duration_seconds", 2.5),
            true);
    Mockito.verifyNoMoreInteractions(publisher);
  }

  @Test
  public void testTrainingFailurePublishesAndRethrows() throws Exception {
    tsdb.add(TaskFixtures.source(DUE.minus(Duration.ofHours(2)), DUE, 10));
    Mockito.when(
            engine.train(
                ArgumentMatchers.anyList(),
                ArgumentMatchers.any(),
                ArgumentMatchers.any(),
                ArgumentMatchers.anyMap()))
        .thenThrow(new InferenceException("trainer returned 500"));

    Assertions.assertThrows(InferenceException.class, () -> task.run(pipeline, DUE));

    ArgumentCaptor<Map<String, Object>> fields = ArgumentCaptor.forClass(Map.class);
    Mockito.verify(publisher)
        .publish(
            ArgumentMatchers.eq(pipeline),
            ArgumentMatchers.eq(TrainingEventPublisher.TRAINING_FAILED),
            fields.capture(),
            ArgumentMatchers.eq(true));
    Assertions.assertEquals("failed", fields.getValue().get("status"));
    Assertions.assertEquals("trainer returned 500", fields.getValue().get("error"));
    Assertions.assertEquals("holt", fields.getValue().get("model_id"));
    Mockito.verify(registry, Mockito.never()).saveArtifact(ArgumentMatchers.any());
  }

  @Test
  public void testNoTrainingData() throws Exception {
    Assertions.assertThrows(DataUnavailableException.class, () -> task.run(pipeline, DUE));

    Mockito.verify(publisher)
        .publish(
            ArgumentMatchers.eq(pipeline),
            ArgumentMatchers.eq(TrainingEventPublisher.TRAINING_FAILED),
            ArgumentMatchers.anyMap(),
            ArgumentMatchers.eq(true));
    Mockito.verify(engine, Mockito.never())
        .train(
            ArgumentMatchers.anyList(),
            ArgumentMatchers.any(),
            ArgumentMatchers.any(),
            ArgumentMatchers.anyMap());
  }

  @Test
  public void testTrainingDisabled() throws Exception {
    pipeline.getTraining().setEnabled(false);

    Assertions.assertThrows(ConfigValidationException.class, () -> task.run(pipeline, DUE));

    Mockito.verifyNoInteractions(publisher);
  }

  @Test
  public void testNoTrainingSection() throws Exception {
    pipeline.setTraining(null);

    Assertions.assertThrows(ConfigValidationException.class, () -> task.run(pipeline, DUE));
  }

  @Test
  public void testEngineNotTrainable() throws Exception {
    Mockito.when(engine.isTrainable()).thenReturn(false);

    Assertions.assertThrows(ConfigValidationException.class, () -> task.run(pipeline, DUE));

    Mockito.verifyNoInteractions(publisher);
    Mockito.verifyNoInteractions(registry);
  }
}
