package io.openanomaly.tsdb;

import io.openanomaly.config.TsdbConfiguration;
import io.openanomaly.core.common.CoreInfra;
import io.openanomaly.core.pipeline.Pipeline;
import java.net.http.HttpClient;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import javax.annotation.Nullable;

/**
 * Hands out one {@link PrometheusTsdbClient} per distinct (read url, write url) pair. All clients
 * share a single {@link HttpClient}.
 */
public final class PrometheusTsdbClientFactory implements TsdbClientFactory {
  private final HttpClient httpClient;
  private final TsdbConfiguration config;
  private final CoreInfra infra;
  private final ConcurrentMap<Endpoints, PrometheusTsdbClient> clients = new ConcurrentHashMap<>();

  public PrometheusTsdbClientFactory(
      HttpClient httpClient, TsdbConfiguration config, CoreInfra infra) {
    this.httpClient = httpClient;
    this.config = config;
    this.infra = infra;
  }

  public PrometheusTsdbClientFactory(TsdbConfiguration config, CoreInfra infra) {
    this(
        HttpClient.newBuilder()
            .connectTimeout(config.getConnectTimeout())
            .followRedirects(HttpClient.Redirect.NORMAL)
            .build(),
        config,
        infra);
  }

  @Override
  public PrometheusTsdbClient get(Pipeline pipeline) {
    Endpoints endpoints = resolve(pipeline);
    return clients.computeIfAbsent(
        endpoints,
        e -> new PrometheusTsdbClient(httpClient, e.readUrl, e.writeUrl, config, infra));
  }

  Endpoints resolve(Pipeline pipeline) {
    String readUrl = stripSlash(firstNonBlank(pipeline.getPrometheusUrl(), config.getUrl()));
    String writeUrl = firstNonBlank(pipeline.getPrometheusWriteUrl(), config.getWriteUrl());
    writeUrl =
        writeUrl == null ? readUrl + PrometheusTsdbClient.WRITE_PATH : stripSlash(writeUrl);
    return new Endpoints(readUrl, writeUrl);
  }

  @Nullable
  private static String firstNonBlank(@Nullable String first, @Nullable String second) {
    if (first != null && !first.isBlank()) {
      return first;
    }
    return second != null && !second.isBlank() ? second : null;
  }

  private static String stripSlash(String url) {
    String trimmed = url.trim();
    while (trimmed.endsWith("/")) {
      trimmed = trimmed.substring(0, trimmed.length() - 1);
    }
    return trimmed;
  }

  static final class Endpoints {
    final String readUrl;
    final String writeUrl;

    Endpoints(String readUrl, String writeUrl) {
      this.readUrl = readUrl;
      this.writeUrl = writeUrl;
    }

    @Override
    public boolean equals(Object o) {
      if (this == o) {
        return true;
      }
      if (!(o instanceof Endpoints)) {
        return false;
      }
      Endpoints that = (Endpoints) o;
      return readUrl.equals(that.readUrl) && writeUrl.equals(that.writeUrl);
    }

    @Override
    public int hashCode() {
      return Objects.hash(readUrl, writeUrl);
    }
  }
}
