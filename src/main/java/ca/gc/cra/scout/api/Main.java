package ca.gc.cra.scout.api;

import ca.gc.cra.scout.logging.LoggingConfigurator;
import java.util.Arrays;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * scout CLI dispatcher that routes to subcommands.
 *
 * @since 0.1.0
 */
public final class Main {
  private static final Logger log = LoggerFactory.getLogger(Main.class);
  private static final String SUMMARY_USAGE = "usage: scout <collect|deployments> [options]";
  private static final String HELP_TEXT = """
      scout: symptom collection for Kubernetes workloads

      Usage:
        scout <command> [options]

      Commands:
        collect      Validate deployments, collect evidence while the exerciser runs, write a report
        deployments  List deployments of a namespace with their readiness

      Global flags:
        --help       Show this message (collect --help for command options)
        --verbose    Enable DEBUG logging before dispatching to the subcommand
      """;

  private Main() {}

  /**
   * Entry point invoked by the JVM.
   *
   * @param args raw CLI arguments
   */
  public static void main(String[] args) {
    ExitCode exit = run(args);
    System.exit(exit.code());
  }

  /**
   * Dispatches a subcommand and returns its exit code without terminating the JVM.
   *
   * @param args dispatcher arguments (first token is the subcommand)
   * @return exit code reported by the delegated CLI
   */
  static ExitCode run(String[] args) {
    if (args == null || args.length == 0) {
      log.error("Missing command");
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    String command = args[0] == null ? "" : args[0].trim().toLowerCase(Locale.ROOT);
    String[] delegateArgs = Arrays.copyOfRange(args, 1, args.length);
    if (command.equals("--help") || command.equals("-h") || command.equals("help")) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (command.equals("--verbose") || command.equals("-v")) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for dispatcher");
      return run(delegateArgs);
    }

    return switch (command) {
      case "collect" -> CollectCli.run(delegateArgs);
      case "deployments" -> DeploymentsCli.run(delegateArgs);
      default -> {
        log.error("Unknown command: {}", command);
        CliPrinter.println(SUMMARY_USAGE);
        yield ExitCode.INVALID_ARGS;
      }
    };
  }
}
