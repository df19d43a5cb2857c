package io.openanomaly.ops;

import io.openanomaly.core.common.TestUtils;
import io.openanomaly.core.controller.scheduler.JobTrigger;
import io.openanomaly.core.pipeline.Pipeline;
import io.openanomaly.core.pipeline.PipelineCodec;
import io.openanomaly.core.pipeline.PipelineMode;
import io.openanomaly.core.pipeline.PipelineValidator;
import io.openanomaly.core.queue.Delivery;
import io.openanomaly.core.queue.LocalJobQueue;
import io.openanomaly.core.registry.PipelineRegistry;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mockito;
import org.springframework.boot.DefaultApplicationArguments;
import picocli.CommandLine;

public class OpsCommandTest {
  private static final Instant NOW = Instant.parse("2024-01-01T12:00:00.250Z");

  @TempDir Path tempDir;

  private PipelineRegistry registry;
  private LocalJobQueue queue;
  private StringWriter out;
  private StringWriter err;
  private CommandLine commandLine;

  @BeforeEach
  public void setup() throws Exception {
    registry = Mockito.mock(PipelineRegistry.class);
    Mockito.when(registry.get(Mockito.anyString())).thenReturn(Optional.empty());
    Mockito.when(registry.get("cpu_anomaly")).thenReturn(Optional.of(pipeline("cpu_anomaly")));
    TestUtils.TestClock clock = new TestUtils.TestClock(NOW);
    queue = new LocalJobQueue(clock, Duration.ofMinutes(5));
    out = new StringWriter();
    err = new StringWriter();
    commandLine =
        OpsCommand.commandLine(
            registry,
            new PipelineCodec(new PipelineValidator()),
            new JobTrigger(registry, queue, clock),
            new PrintWriter(out, true),
            new PrintWriter(err, true));
  }

  private static Pipeline pipeline(String name) {
    Pipeline pipeline = new Pipeline();
    pipeline.setName(name);
    pipeline.setQuery("up");
    return pipeline;
  }

  private List<String> outLines() {
    return List.of(out.toString().split("\\R"));
  }

  @Test
  public void testList() throws Exception {
    Pipeline latency = pipeline("request_latency");
    latency.setMode(PipelineMode.ANOMALY_ONLY);
    latency.setEnabled(false);
    Mockito.when(registry.list()).thenReturn(List.of(latency, pipeline("cpu_anomaly")));
    Mockito.when(registry.rejected()).thenReturn(Map.of("broken", "query must not be empty"));

    Assertions.assertEquals(0, commandLine.execute("list"));

    Assertions.assertEquals(
        List.of(
            "cpu_anomaly\tforecast_and_anomaly\tenabled\tanomaly,forecast",
            "request_latency\tanomaly_only\tdisabled\tanomaly",
            "broken\trejected\tquery must not be empty"),
        outLines());
  }

  @Test
  public void testListRegistryFailure() throws Exception {
    Mockito.when(registry.list()).thenThrow(new IllegalStateException("zk down"));

    Assertions.assertEquals(1, commandLine.execute("list"));
    Assertions.assertTrue(err.toString().startsWith("internal: zk down"), err.toString());
  }

  @Test
  public void testValidate() throws Exception {
    Path file = tempDir.resolve("pipelines.yaml");
    Files.write(
        file,
        String.join(
                "\n",
                "pipelines:",
                "  - name: cpu_anomaly",
                "    query: up",
                "  - name: broken",
                "    query: ''")
            .getBytes(StandardCharsets.UTF_8));

    Assertions.assertEquals(2, commandLine.execute("validate", file.toString()));

    List<String> lines = outLines();
    Assertions.assertEquals("ok\tcpu_anomaly", lines.get(0));
    Assertions.assertTrue(lines.get(1).startsWith("rejected\tbroken\t"), lines.get(1));
    Assertions.assertTrue(lines.get(1).contains("query must not be empty"), lines.get(1));
  }

  @Test
  public void testValidateJson() throws Exception {
    Path file = tempDir.resolve("pipelines.json");
    Files.write(
        file,
        "{\"pipelines\": [{\"name\": \"cpu_anomaly\", \"query\": \"up\"}]}"
            .getBytes(StandardCharsets.UTF_8));

    Assertions.assertEquals(0, commandLine.execute("validate", file.toString()));
    Assertions.assertEquals(List.of("ok\tcpu_anomaly"), outLines());
  }

  @Test
  public void testValidateMissingFile() {
    Path file = tempDir.resolve("missing.yaml");

    Assertions.assertEquals(2, commandLine.execute("validate", file.toString()));
    Assertions.assertTrue(err.toString().startsWith("config_validation: cannot read"));
  }

  @Test
  public void testTrigger() throws Exception {
    Assertions.assertEquals(0, commandLine.execute("trigger", "cpu_anomaly", "forecast"));

    Assertions.assertEquals(1, queue.size());
    Delivery delivery = queue.consume(Duration.ZERO);
    Assertions.assertEquals(
        List.of(
            String.join(
                "\t",
                "enqueued",
                delivery.getJob().getJobId(),
                "cpu_anomaly",
                "forecast",
                "2024-01-01T12:00:00Z")),
        outLines());
  }

  @Test
  public void testTriggerUnknownKind() {
    Assertions.assertEquals(2, commandLine.execute("trigger", "cpu_anomaly", "backfill"));
    Assertions.assertTrue(err.toString().contains("unknown job kind backfill"));
    Assertions.assertEquals(0, queue.size());
  }

  @Test
  public void testTriggerUnknownPipeline() {
    Assertions.assertEquals(2, commandLine.execute("trigger", "disk", "forecast"));
    Assertions.assertTrue(err.toString().contains("unknown pipeline disk"));
  }

  @Test
  public void testTriggerKindNotScheduled() {
    Assertions.assertEquals(2, commandLine.execute("trigger", "cpu_anomaly", "train"));
    Assertions.assertEquals(0, queue.size());
  }

  @Test
  public void testUsage() {
    Assertions.assertEquals(2, commandLine.execute());
    Assertions.assertTrue(err.toString().contains("Usage: ops"));
  }

  @Test
  public void testMissingParameter() {
    Assertions.assertEquals(2, commandLine.execute("trigger", "cpu_anomaly"));
    Assertions.assertTrue(err.toString().contains("KIND"), err.toString());
  }

  @Test
  public void testCommandArgs() {
    Assertions.assertArrayEquals(
        new String[] {"trigger", "cpu_anomaly", "forecast"},
        OpsRunner.commandArgs(
            new String[] {
              "ops", "--queue.mode=redis", "trigger", "cpu_anomaly", "forecast"
            }));
    Assertions.assertArrayEquals(
        new String[] {"list", "--help"},
        OpsRunner.commandArgs(new String[] {"list", "--help"}));
  }

  @Test
  public void testRunnerKeepsExitCode() {
    OpsRunner runner = new OpsRunner(commandLine);
    runner.run(new DefaultApplicationArguments("ops", "trigger", "disk", "forecast"));

    Assertions.assertEquals(2, runner.getExitCode());
  }
}
