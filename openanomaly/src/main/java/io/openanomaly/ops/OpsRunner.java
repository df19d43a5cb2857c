package io.openanomaly.ops;

import io.openanomaly.OpenAnomalyAppType;
import io.openanomaly.common.StructuredLogging;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import picocli.CommandLine;

/**
 * Runs one ops command once the context is up and keeps its exit code for {@code
 * SpringApplication.exit}.
 *
 * <p>The leading app type argument and Spring property arguments ({@code --name=value}) are not
 * passed to the command.
 */
public class OpsRunner implements ApplicationRunner, ExitCodeGenerator {
  public static final String SPRING_PROFILE = "ops";
  private static final Logger logger = LoggerFactory.getLogger(OpsRunner.class);

  private final CommandLine commandLine;
  private volatile int exitCode;

  public OpsRunner(CommandLine commandLine) {
    this.commandLine = commandLine;
  }

  @Override
  public void run(ApplicationArguments args) {
    String[] command = commandArgs(args.getSourceArgs());
    exitCode = commandLine.execute(command);
    logger.info(
        "ops.command.completed",
        StructuredLogging.action(command.length > 0 ? command[0] : ""),
        StructuredLogging.exitCode(exitCode));
  }

  @Override
  public int getExitCode() {
    return exitCode;
  }

  static String[] commandArgs(String[] sourceArgs) {
    List<String> command = new ArrayList<>();
    for (int i = 0; i < sourceArgs.length; i++) {
      String arg = sourceArgs[i];
      if (i == 0 && OpenAnomalyAppType.OPS_APP.equals(arg)) {
        continue;
      }
      if (arg.startsWith("--") && arg.contains("=")) {
        continue;
      }
      command.add(arg);
    }
    return command.toArray(new String[0]);
  }
}
