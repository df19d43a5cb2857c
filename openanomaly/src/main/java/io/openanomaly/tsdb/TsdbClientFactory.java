package io.openanomaly.tsdb;

import io.openanomaly.core.pipeline.Pipeline;

/** Resolves the TSDB a pipeline reads from and writes to. */
@FunctionalInterface
public interface TsdbClientFactory {
  TsdbClient get(Pipeline pipeline);
}
