package io.openanomaly.task;

import io.openanomaly.config.ModelConfiguration;
import io.openanomaly.core.common.CoreInfra;
import io.openanomaly.core.errors.InsufficientDataException;
import io.openanomaly.core.pipeline.Pipeline;
import io.openanomaly.core.pipeline.TrainingConfig;
import io.openanomaly.core.registry.PipelineRegistry;
import io.openanomaly.core.registry.TrainingArtifact;
import io.openanomaly.model.ForecastRequest;
import io.openanomaly.model.ModelEngine;
import io.openanomaly.model.ModelEngineFactory;
import io.openanomaly.tsdb.InMemoryTsdb;
import io.openanomaly.tsdb.Sample;
import io.openanomaly.tsdb.TimeSeries;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.ArgumentMatchers;
import org.mockito.Mockito;

public class ForecastTaskTest {
  private static final Instant DUE = Instant.parse("2024-01-01T12:00:00Z");

  private InMemoryTsdb tsdb;
  private ModelEngine engine;
  private PipelineRegistry registry;
  private ForecastTask task;
  private Pipeline pipeline;

  @BeforeEach
  public void setup() throws Exception {
    tsdb = new InMemoryTsdb();
    engine = Mockito.mock(ModelEngine.class);
    ModelEngineFactory engineFactory = Mockito.mock(ModelEngineFactory.class);
    Mockito.when(engineFactory.get(ArgumentMatchers.any())).thenReturn(engine);
    Mockito.when(
            engine.predict(
                ArgumentMatchers.anyList(),
                ArgumentMatchers.any(),
                ArgumentMatchers.any(ForecastRequest.class)))
        .thenReturn(TaskFixtures.flatForecast(5));
    registry = Mockito.mock(PipelineRegistry.class);
    Mockito.when(registry.latestArtifact(ArgumentMatchers.anyString()))
        .thenReturn(Optional.empty());
    task =
        new ForecastTask(
            tsdb, engineFactory, registry, new ModelConfiguration(), CoreInfra.NOOP);
    pipeline = TaskFixtures.cpuAnomaly();
  }

  @Test
  public void testWritesMeanAndQuantiles() throws Exception {
    tsdb.add(TaskFixtures.source(DUE.minus(Duration.ofHours(1)), DUE, 10));

    List<TimeSeries> results = task.run(pipeline, DUE);

    Assertions.assertEquals(4, results.size());
    Assertions.assertEquals(List.of(results), tsdb.getWrites());
    Map<String, TimeSeries> byName =
        results.stream()
            .collect(
                Collectors.toMap(
                    s ->
                        s.getMetricName()
                            + s.getLabels().getOrDefault(ResultSeries.QUANTILE_LABEL, ""),
                    s -> s));
    TimeSeries mean = byName.get("openanomaly_forecast");
    Assertions.assertEquals(
        Map.of(
            TimeSeries.NAME_LABEL, "openanomaly_forecast",
            "pipeline", "cpu_anomaly",
            "instance", "a"),
        mean.getLabels());
    Assertions.assertEquals(5, mean.getSamples().size());
    Assertions.assertEquals(
        new Sample(Instant.parse("2024-01-01T12:01:00Z"), 10), mean.getSamples().get(0));
    Assertions.assertEquals(
        new Sample(Instant.parse("2024-01-01T12:05:00Z"), 10), mean.getSamples().get(4));
    Assertions.assertEquals(
        8.0, byName.get("openanomaly_forecast_quantile0.1").getSamples().get(0).getValue());
    Assertions.assertEquals(
        10.0, byName.get("openanomaly_forecast_quantile0.5").getSamples().get(2).getValue());
    Assertions.assertEquals(
        12.0, byName.get("openanomaly_forecast_quantile0.9").getSamples().get(4).getValue());
  }

  @Test
  public void testRequestCarriesHorizonAndQuantiles() throws Exception {
    tsdb.add(TaskFixtures.source(DUE.minus(Duration.ofHours(1)), DUE, 10));

    task.run(pipeline, DUE);

    ArgumentCaptor<List<Sample>> context = ArgumentCaptor.forClass(List.class);
    ArgumentCaptor<ForecastRequest> request = ArgumentCaptor.forClass(ForecastRequest.class);
    Mockito.verify(engine)
        .predict(context.capture(), ArgumentMatchers.eq(Duration.ofMinutes(1)), request.capture());
    Assertions.assertEquals(61, context.getValue().size());
    Assertions.assertEquals(5, request.getValue().getPredictionLength());
    Assertions.assertEquals(List.of(0.1, 0.5, 0.9), request.getValue().getQuantiles());
    Assertions.assertNull(request.getValue().getModelId());
  }

  @Test
  public void testConfidenceBandAddsQuantiles() throws Exception {
    pipeline.getAnomaly().setConfidenceLevel(0.95);
    tsdb.add(TaskFixtures.source(DUE.minus(Duration.ofHours(1)), DUE, 10));

    task.run(pipeline, DUE);

    ArgumentCaptor<ForecastRequest> request = ArgumentCaptor.forClass(ForecastRequest.class);
    Mockito.verify(engine)
        .predict(ArgumentMatchers.anyList(), ArgumentMatchers.any(), request.capture());
    Assertions.assertEquals(
        List.of(0.025, 0.1, 0.5, 0.9, 0.975), request.getValue().getQuantiles());
  }

  @Test
  public void testInsufficientData() throws Exception {
    tsdb.add(TaskFixtures.source(DUE.minus(Duration.ofMinutes(10)), DUE, 10));

    InsufficientDataException e =
        Assertions.assertThrows(InsufficientDataException.class, () -> task.run(pipeline, DUE));
    Assertions.assertTrue(e.getMessage().contains("11"), e.getMessage());
    Assertions.assertTrue(tsdb.getWrites().isEmpty());
  }

  @Test
  public void testNoSeries() {
    Assertions.assertThrows(InsufficientDataException.class, () -> task.run(pipeline, DUE));
  }

  @Test
  public void testShortSeriesSkipped() throws Exception {
    tsdb.add(TaskFixtures.source(DUE.minus(Duration.ofHours(1)), DUE, 10));
    tsdb.add(
        TimeSeries.named(
            TaskFixtures.SOURCE_METRIC,
            Map.of("instance", "b"),
            List.of(new Sample(DUE, 3))));

    List<TimeSeries> results = task.run(pipeline, DUE);

    Assertions.assertEquals(4, results.size());
    results.forEach(s -> Assertions.assertEquals("a", s.getLabels().get("instance")));
  }

  @Test
  public void testWriteDisabled() throws Exception {
    pipeline.getOutput().setWriteForecast(false);
    tsdb.add(TaskFixtures.source(DUE.minus(Duration.ofHours(1)), DUE, 10));

    List<TimeSeries> results = task.run(pipeline, DUE);

    Assertions.assertEquals(4, results.size());
    Assertions.assertTrue(tsdb.getWrites().isEmpty());
  }

  @Test
  public void testTrainedModelId() throws Exception {
    pipeline.setTraining(new TrainingConfig());
    Mockito.when(registry.latestArtifact("cpu_anomaly"))
        .thenReturn(
            Optional.of(
                new TrainingArtifact(
                    "cpu_anomaly",
                    "holt:alpha=0.5,beta=0.1",
                    DUE.minus(Duration.ofHours(2)),
                    DUE.minus(Duration.ofDays(7)),
                    DUE.minus(Duration.ofHours(2)))));
    tsdb.add(TaskFixtures.source(DUE.minus(Duration.ofHours(1)), DUE, 10));

    task.run(pipeline, DUE);

    ArgumentCaptor<ForecastRequest> request = ArgumentCaptor.forClass(ForecastRequest.class);
    Mockito.verify(engine)
        .predict(ArgumentMatchers.anyList(), ArgumentMatchers.any(), request.capture());
    Assertions.assertEquals("holt:alpha=0.5,beta=0.1", request.getValue().getModelId());
  }

  @Test
  public void testArtifactLookupFailureFallsBack() throws Exception {
    pipeline.setTraining(new TrainingConfig());
    Mockito.when(registry.latestArtifact("cpu_anomaly"))
        .thenThrow(new IllegalStateException("zk down"));
    tsdb.add(TaskFixtures.source(DUE.minus(Duration.ofHours(1)), DUE, 10));

    task.run(pipeline, DUE);

    ArgumentCaptor<ForecastRequest> request = ArgumentCaptor.forClass(ForecastRequest.class);
    Mockito.verify(engine)
        .predict(ArgumentMatchers.anyList(), ArgumentMatchers.any(), request.capture());
    Assertions.assertNull(request.getValue().getModelId());
  }
}
