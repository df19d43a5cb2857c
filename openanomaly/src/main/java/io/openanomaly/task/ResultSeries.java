package io.openanomaly.task;

import io.openanomaly.anomaly.AnomalyScore;
import io.openanomaly.core.pipeline.Pipeline;
import io.openanomaly.model.Forecast;
import io.openanomaly.model.Quantiles;
import io.openanomaly.tsdb.Sample;
import io.openanomaly.tsdb.TimeSeries;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Names and labels of the series the tasks write.
 *
 * <pre>
 * {prefix}forecast{pipeline, ...}
 * {prefix}forecast_quantile{pipeline, quantile, ...}
 * {prefix}anomaly_score{pipeline, technique, ...}
 * {prefix}anomaly{pipeline, technique, ...}
 * </pre>
 *
 * The remaining labels are those of the source series.
 */
public final class ResultSeries {
  public static final String PIPELINE_LABEL = "pipeline";
  public static final String QUANTILE_LABEL = "quantile";
  public static final String TECHNIQUE_LABEL = "technique";

  private ResultSeries() {}

  public static String forecastMetric(Pipeline pipeline) {
    return pipeline.getOutput().getMetricPrefix() + "forecast";
  }

  public static String quantileMetric(Pipeline pipeline) {
    return pipeline.getOutput().getMetricPrefix() + "forecast_quantile";
  }

  public static String scoreMetric(Pipeline pipeline) {
    return pipeline.getOutput().getMetricPrefix() + "anomaly_score";
  }

  public static String flagMetric(Pipeline pipeline) {
    return pipeline.getOutput().getMetricPrefix() + "anomaly";
  }

  /** PromQL selector of the metric restricted to the pipeline. */
  public static String selector(String metric, Pipeline pipeline) {
    return metric + "{" + PIPELINE_LABEL + "=\"" + escape(pipeline.getName()) + "\"}";
  }

  /** Identity of a source series across source and result metrics. */
  public static Map<String, String> seriesKey(Map<String, String> labels) {
    Map<String, String> key = new TreeMap<>(labels);
    key.remove(TimeSeries.NAME_LABEL);
    key.remove(PIPELINE_LABEL);
    key.remove(QUANTILE_LABEL);
    key.remove(TECHNIQUE_LABEL);
    return key;
  }

  /** Forecast mean and quantile series, with values at {@code origin + i * step}, i from 1. */
  public static List<TimeSeries> forecast(
      Pipeline pipeline,
      Map<String, String> sourceLabels,
      Forecast forecast,
      Instant origin,
      Duration step) {
    Map<String, String> labels = resultLabels(pipeline, sourceLabels);
    List<TimeSeries> series = new ArrayList<>();
    series.add(
        TimeSeries.named(
            forecastMetric(pipeline), labels, path(forecast.getMean(), origin, step)));
    forecast
        .getQuantiles()
        .forEach(
            (q, values) -> {
              Map<String, String> quantileLabels = new TreeMap<>(labels);
              quantileLabels.put(QUANTILE_LABEL, Quantiles.format(q));
              series.add(
                  TimeSeries.named(
                      quantileMetric(pipeline), quantileLabels, path(values, origin, step)));
            });
    return series;
  }

  /** Score and flag series with a single value at the scored timestamp. */
  public static List<TimeSeries> anomaly(
      Pipeline pipeline, Map<String, String> sourceLabels, AnomalyScore score, Instant at) {
    Map<String, String> labels = resultLabels(pipeline, sourceLabels);
    labels.put(TECHNIQUE_LABEL, score.getTechnique().tag());
    return List.of(
        TimeSeries.named(
            scoreMetric(pipeline), labels, List.of(new Sample(at, score.getScore()))),
        TimeSeries.named(
            flagMetric(pipeline), labels, List.of(new Sample(at, score.isAnomaly() ? 1 : 0))));
  }

  private static Map<String, String> resultLabels(
      Pipeline pipeline, Map<String, String> sourceLabels) {
    Map<String, String> labels = seriesKey(sourceLabels);
    labels.put(PIPELINE_LABEL, pipeline.getName());
    return labels;
  }

  private static List<Sample> path(List<Double> values, Instant origin, Duration step) {
    List<Sample> samples = new ArrayList<>(values.size());
    for (int i = 0; i < values.size(); i++) {
      samples.add(new Sample(origin.plus(step.multipliedBy(i + 1L)), values.get(i)));
    }
    return samples;
  }

  private static String escape(String value) {
    return value.replace("\\", "\\\\").replace("\"", "\\\"");
  }
}
