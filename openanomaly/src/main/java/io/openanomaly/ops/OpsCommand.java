package io.openanomaly.ops;

import io.openanomaly.common.StructuredLogging;
import io.openanomaly.core.controller.scheduler.JobTrigger;
import io.openanomaly.core.errors.ConfigValidationException;
import io.openanomaly.core.errors.ErrorClass;
import io.openanomaly.core.errors.ErrorClassifier;
import io.openanomaly.core.pipeline.JobKind;
import io.openanomaly.core.pipeline.Pipeline;
import io.openanomaly.core.pipeline.PipelineCodec;
import io.openanomaly.core.queue.Job;
import io.openanomaly.core.registry.PipelineRegistry;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

/**
 * Operator commands against the pipeline registry and the job queue.
 *
 * <pre>
 * openanomaly ops list
 * openanomaly ops validate pipelines.yaml
 * openanomaly ops trigger cpu_anomaly forecast
 * </pre>
 *
 * <p>The exit code is 0 on success and otherwise the {@link ErrorClass} exit code of the failure.
 * Usage errors exit with the configuration validation code.
 */
@Command(
    name = "ops",
    mixinStandardHelpOptions = true,
    description = "Inspects and validates pipelines and enqueues jobs by hand.")
public class OpsCommand implements Callable<Integer> {
  private static final Logger logger = LoggerFactory.getLogger(OpsCommand.class);

  @Spec CommandSpec spec;

  @Override
  public Integer call() {
    spec.commandLine().usage(spec.commandLine().getErr());
    return ErrorClass.CONFIG_VALIDATION.exitCode();
  }

  /** Builds the command line with its subcommands bound to the given collaborators. */
  public static CommandLine commandLine(
      PipelineRegistry registry,
      PipelineCodec codec,
      JobTrigger trigger,
      PrintWriter out,
      PrintWriter err) {
    CommandLine commandLine =
        new CommandLine(new OpsCommand())
            .addSubcommand(new ListCommand(registry))
            .addSubcommand(new ValidateCommand(codec))
            .addSubcommand(new TriggerCommand(trigger));
    // applies to the whole hierarchy, so it must follow the subcommands
    commandLine.setOut(out);
    commandLine.setErr(err);
    commandLine.setExecutionExceptionHandler(
        (e, failed, parseResult) -> {
          ErrorClass errorClass = ErrorClassifier.classify(e);
          failed.getErr().println(errorClass.tag() + ": " + e.getMessage());
          logger.debug(
              "ops.command.failure",
              StructuredLogging.errorClass(errorClass.tag()),
              StructuredLogging.exitCode(errorClass.exitCode()),
              e);
          return errorClass.exitCode();
        });
    commandLine.setParameterExceptionHandler(
        (e, args) -> {
          CommandLine failed = e.getCommandLine();
          failed.getErr().println(e.getMessage());
          failed.usage(failed.getErr());
          return ErrorClass.CONFIG_VALIDATION.exitCode();
        });
    return commandLine;
  }

  @Command(name = "list", description = "Lists the registered and the rejected pipelines.")
  static final class ListCommand implements Callable<Integer> {
    private final PipelineRegistry registry;

    @Spec CommandSpec spec;

    ListCommand(PipelineRegistry registry) {
      this.registry = registry;
    }

    @Override
    public Integer call() throws Exception {
      PrintWriter out = spec.commandLine().getOut();
      List<Pipeline> pipelines = new ArrayList<>(registry.list());
      pipelines.sort(Comparator.comparing(Pipeline::getName));
      for (Pipeline pipeline : pipelines) {
        out.printf(
            "%s\t%s\t%s\t%s%n",
            pipeline.getName(),
            pipeline.getMode().name().toLowerCase(),
            pipeline.isEnabled() ? "enabled" : "disabled",
            pipeline.getScheduledKinds().stream()
                .map(JobKind::tag)
                .sorted()
                .collect(Collectors.joining(",")));
      }
      for (Map.Entry<String, String> rejected : registry.rejected().entrySet()) {
        out.printf("%s\trejected\t%s%n", rejected.getKey(), rejected.getValue());
      }
      out.flush();
      return 0;
    }
  }

  @Command(
      name = "validate",
      description = "Validates a pipeline document without registering it.")
  static final class ValidateCommand implements Callable<Integer> {
    private final PipelineCodec codec;

    @Spec CommandSpec spec;

    @Parameters(index = "0", paramLabel = "FILE", description = "YAML or JSON document.")
    Path file;

    ValidateCommand(PipelineCodec codec) {
      this.codec = codec;
    }

    @Override
    public Integer call() throws Exception {
      byte[] content;
      try {
        content = Files.readAllBytes(file);
      } catch (IOException e) {
        throw new ConfigValidationException("cannot read " + file, e);
      }
      PipelineCodec.LoadResult result = codec.read(content, PipelineCodec.Format.forPath(file));
      PrintWriter out = spec.commandLine().getOut();
      for (Pipeline pipeline : result.getPipelines()) {
        out.printf("ok\t%s%n", pipeline.getName());
      }
      for (Map.Entry<String, String> rejected : result.getRejected().entrySet()) {
        out.printf("rejected\t%s\t%s%n", rejected.getKey(), rejected.getValue());
      }
      out.flush();
      return result.getRejected().isEmpty() ? 0 : ErrorClass.CONFIG_VALIDATION.exitCode();
    }
  }

  @Command(name = "trigger", description = "Enqueues one job for a pipeline now.")
  static final class TriggerCommand implements Callable<Integer> {
    private final JobTrigger trigger;

    @Spec CommandSpec spec;

    @Parameters(index = "0", paramLabel = "PIPELINE")
    String pipeline;

    @Parameters(index = "1", paramLabel = "KIND", description = "forecast, anomaly or train.")
    String kind;

    TriggerCommand(JobTrigger trigger) {
      this.trigger = trigger;
    }

    @Override
    public Integer call() throws Exception {
      JobKind jobKind;
      try {
        jobKind = JobKind.fromTag(kind);
      } catch (IllegalArgumentException e) {
        throw new ConfigValidationException("unknown job kind " + kind, e);
      }
      Job job = trigger.trigger(pipeline, jobKind);
      PrintWriter out = spec.commandLine().getOut();
      out.printf(
          "enqueued\t%s\t%s\t%s\t%s%n",
          job.getJobId(), job.pipelineName(), jobKind.tag(), job.getDueTime());
      out.flush();
      return 0;
    }
  }
}
