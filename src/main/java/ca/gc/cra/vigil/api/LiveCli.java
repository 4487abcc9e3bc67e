package ca.gc.cra.vigil.api;

import ca.gc.cra.vigil.application.pipeline.LiveReport;
import ca.gc.cra.vigil.application.pipeline.LiveWatchUseCase;
import ca.gc.cra.vigil.config.CompositionRoot;
import ca.gc.cra.vigil.config.DefaultsForMode;
import ca.gc.cra.vigil.config.LiveConfig;
import ca.gc.cra.vigil.config.PipelineConfig;
import ca.gc.cra.vigil.config.Session;
import ca.gc.cra.vigil.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.vigil.validation.Paths;
import java.io.IOException;
import java.time.Duration;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs one frame watcher against a ring buffer that a producer thread keeps filling.
 *
 * @since 0.1.0
 */
public final class LiveCli {
  private static final Logger log = LoggerFactory.getLogger(LiveCli.class);
  private static final Duration SHUTDOWN_WAIT = Duration.ofSeconds(10);
  static final String SUMMARY_USAGE =
      "usage: live [config=PATH] [source=DIR|synthetic] [detector=motion|neural-net|replay-log] "
          + "[bufferCapacity=N] [runSeconds=N] [heartbeatSeconds=N] [--display] "
          + "[eventsOut=log|kafka:TOPIC|none] [--dry-run] [--verbose]";
  private static final String HELP_TEXT = """
      VIGIL live watcher

      Usage:
        live [options]

      Source and buffer:
        source=DIR|synthetic        Directory of PNG/JPEG/BMP stills or generated frames (default synthetic)
        sourceFps=F                 Nominal frame rate used for timestamps (default 9.0)
        paceMillis=N                Pause after each buffered frame (default 0)
        bufferCapacity=N            Ring buffer slots, 2-65536 (default 64)

      Watcher:
        name=NAME                   Watcher name for threads, logs, and windows (default vigil)
        detector=motion|neural-net|replay-log
        fpsWindow=N                 Frames per FPS measurement (default 20)
        idleWaitMillis=N            Upper bound on an idle wait (default 5)
        heartbeatSeconds=N          Heartbeat log interval (default 60)
        runSeconds=N                Stop after N seconds; 0 runs until the source drains or SIGINT
        distanceThreshold=F         Tracker association radius, normalized (default 0.1)

      Outputs:
        --display                   Render processed frames (same as display=true)
        eventsOut=log|kafka:TOPIC|none
        kafkaBootstrap=HOST:PORT    Required for kafka output
        metricsExporter=otlp|none   Metrics exporter (default from environment, else otlp)
        otelEndpoint=URL            OTLP metrics endpoint

      Other:
        config=PATH                 YAML file with common/live sections; CLI values win
        --dry-run                   Validate and print the plan without starting threads
        --verbose                   Enable DEBUG logging
        --help                      Show this message
      """;

  private LiveCli() {}

  /**
   * Entry point invoked by the JVM.
   *
   * @param args raw CLI arguments
   */
  public static void main(String[] args) {
    System.exit(run(args).code());
  }

  /**
   * Runs the live command and returns its exit code.
   *
   * @param args raw CLI arguments
   * @return exit code
   */
  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }

    LiveConfig config;
    try {
      Map<String, String> effective = CliSupport.effectiveConfig(DefaultsForMode.MODE_LIVE, input, SUMMARY_USAGE);
      TelemetryConfigurator.configureMetrics(effective);
      config = LiveConfig.fromMap(effective);
      PipelineConfig.SourceSettings source = config.pipeline().source();
      if (!source.synthetic()) {
        Paths.validateReadableDir(source.directory());
      }
    } catch (CliSupport.CliAbort abort) {
      return abort.exitCode();
    } catch (IllegalArgumentException ex) {
      log.error("Invalid live configuration: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    if (input.hasFlag("--dry-run")) {
      printDryRunPlan(config);
      return ExitCode.SUCCESS;
    }
    return execute(config);
  }

  private static ExitCode execute(LiveConfig config) {
    String name = config.pipeline().name();
    try (OpenTelemetryMetricsAdapter metrics = new OpenTelemetryMetricsAdapter()) {
      CompositionRoot root = new CompositionRoot(metrics);
      Session<LiveWatchUseCase> session;
      try {
        session = root.liveSession(config);
      } catch (IllegalArgumentException | IllegalStateException ex) {
        log.error("Unable to wire live session {}: {}", name, ex.getMessage(), ex);
        return ExitCode.CONFIG_ERROR;
      }
      try (Session<LiveWatchUseCase> active = session) {
        LiveWatchUseCase useCase = active.useCase();
        Thread hook = new Thread(() -> awaitShutdown(useCase, name), "vigil-live-shutdown");
        Runtime.getRuntime().addShutdownHook(hook);
        try {
          log.info("Starting live session {} (runSeconds={})", name, config.runTime().toSeconds());
          LiveReport report = useCase.run(config.runTime());
          log.info("Live session {} complete: {} frames processed, {} written ({})",
              name, report.framesProcessed(), report.framesWritten(), report.reason());
          if (report.reason() == LiveReport.EndReason.INTERRUPTED) {
            return ExitCode.INTERRUPTED;
          }
        } finally {
          PlayCli.removeHook(hook);
        }
      }
      return ExitCode.SUCCESS;
    } catch (IOException ex) {
      log.error("Live session {} I/O failure", name, ex);
      return ExitCode.IO_ERROR;
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.error("Live session {} interrupted", name, ex);
      return ExitCode.INTERRUPTED;
    } catch (Exception ex) {
      log.error("Live session {} failed", name, ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }

  private static void awaitShutdown(LiveWatchUseCase useCase, String name) {
    try {
      if (!useCase.stopAndAwait(SHUTDOWN_WAIT)) {
        log.warn("Live session {} did not stop within {} s", name, SHUTDOWN_WAIT.toSeconds());
      }
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.warn("Interrupted while stopping live session {}", name);
    }
  }

  private static void printDryRunPlan(LiveConfig config) {
    PipelineConfig pipeline = config.pipeline();
    CliPrinter.printLines(
        "Live dry-run: no threads will be started.",
        " Name             : " + pipeline.name(),
        " Source           : " + pipeline.source(),
        " Buffer capacity  : " + config.bufferCapacity(),
        " Detector         : " + pipeline.detector().kind().configName(),
        " Classes          : " + pipeline.classes(),
        " Idle wait (ms)   : " + config.idleWait().toMillis(),
        " Heartbeat (s)    : " + config.heartbeat().toSeconds(),
        " Run time (s)     : " + (config.runTime().isZero() ? "until stopped" : config.runTime().toSeconds()),
        " Display          : " + pipeline.display(),
        " Events           : " + pipeline.eventsOut(),
        " Re-run without --dry-run to start watching.");
  }
}
