package ca.gc.cra.vigil.api;

import ca.gc.cra.vigil.application.pipeline.PlaybackReport;
import ca.gc.cra.vigil.application.pipeline.PlaybackUseCase;
import ca.gc.cra.vigil.config.CompositionRoot;
import ca.gc.cra.vigil.config.DefaultsForMode;
import ca.gc.cra.vigil.config.PipelineConfig;
import ca.gc.cra.vigil.config.PlaybackConfig;
import ca.gc.cra.vigil.config.Session;
import ca.gc.cra.vigil.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.vigil.validation.Paths;
import java.io.IOException;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Processes a finite frame source on the calling thread, one frame at a time.
 *
 * @since 0.1.0
 */
public final class PlayCli {
  private static final Logger log = LoggerFactory.getLogger(PlayCli.class);
  static final String SUMMARY_USAGE =
      "usage: play [config=PATH] [source=DIR|synthetic] [detector=motion|neural-net|replay-log] "
          + "[skip=N] [scale=F] [sleepMillis=N] [--save-frames captureDir=PATH] [--display] "
          + "[eventsOut=log|kafka:TOPIC|none] [--dry-run] [--verbose]";
  private static final String HELP_TEXT = """
      VIGIL playback (synchronous)

      Usage:
        play [options]

      Source:
        source=DIR|synthetic        Directory of PNG/JPEG/BMP stills (sorted by name) or generated frames
        sourceFps=F                 Nominal frame rate used for timestamps (default 9.0)
        synthetic.frames=N          Generated frame count (default 300)

      Processing:
        detector=motion|neural-net|replay-log
        skip=N                      Keep one frame, then drop N (default 0)
        scale=F                     Uniform rescale before processing (default 1.0)
        sleepMillis=N               Pause after each processed frame (default 0)
        fpsWindow=N                 Frames per FPS measurement (default 20)
        distanceThreshold=F         Tracker association radius, normalized (default 0.1)
        classes.<id>.label=NAME     Class catalog entry (also color=R,G,B, verticalOffset, memoryFrames)

      Outputs:
        --save-frames               Save frames with detections (same as saveFrames=true)
        captureDir=PATH             Capture directory (default ~/.vigil/captures)
        --display                   Render processed frames (same as display=true)
        eventsOut=log|kafka:TOPIC|none
        kafkaBootstrap=HOST:PORT    Required for kafka output
        metricsExporter=otlp|none   Metrics exporter (default from environment, else otlp)
        otelEndpoint=URL            OTLP metrics endpoint

      Other:
        config=PATH                 YAML file with common/play sections; CLI values win
        --dry-run                   Validate and print the plan without processing
        --verbose                   Enable DEBUG logging
        --help                      Show this message
      """;

  private PlayCli() {}

  /**
   * Entry point invoked by the JVM.
   *
   * @param args raw CLI arguments
   */
  public static void main(String[] args) {
    System.exit(run(args).code());
  }

  /**
   * Runs the play command and returns its exit code.
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

    PlaybackConfig config;
    try {
      Map<String, String> effective = CliSupport.effectiveConfig(DefaultsForMode.MODE_PLAY, input, SUMMARY_USAGE);
      TelemetryConfigurator.configureMetrics(effective);
      config = PlaybackConfig.fromMap(effective);
      validatePaths(config, !input.hasFlag("--dry-run"));
    } catch (CliSupport.CliAbort abort) {
      return abort.exitCode();
    } catch (IllegalArgumentException ex) {
      log.error("Invalid play configuration: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    if (input.hasFlag("--dry-run")) {
      printDryRunPlan(config);
      return ExitCode.SUCCESS;
    }
    return execute(config);
  }

  private static void validatePaths(PlaybackConfig config, boolean createCaptureDir) {
    PipelineConfig.SourceSettings source = config.pipeline().source();
    if (!source.synthetic()) {
      Paths.validateReadableDir(source.directory());
    }
    if (config.captureDir() != null && createCaptureDir) {
      Paths.validateWritableDir(config.captureDir());
    }
  }

  private static ExitCode execute(PlaybackConfig config) {
    String name = config.pipeline().name();
    try (OpenTelemetryMetricsAdapter metrics = new OpenTelemetryMetricsAdapter()) {
      CompositionRoot root = new CompositionRoot(metrics);
      Session<PlaybackUseCase> session;
      try {
        session = root.playbackSession(config);
      } catch (IllegalArgumentException | IllegalStateException ex) {
        log.error("Unable to wire play session {}: {}", name, ex.getMessage(), ex);
        return ExitCode.CONFIG_ERROR;
      }
      try (Session<PlaybackUseCase> active = session) {
        PlaybackUseCase useCase = active.useCase();
        Thread hook = new Thread(useCase::requestStop, "vigil-play-shutdown");
        Runtime.getRuntime().addShutdownHook(hook);
        try {
          PlaybackReport report = useCase.run();
          log.info("Play session {} complete: {} of {} frames processed, {} with events, {} saved",
              name, report.framesProcessed(), report.framesRead(), report.framesWithEvents(),
              report.framesSaved());
        } finally {
          removeHook(hook);
        }
      }
      return ExitCode.SUCCESS;
    } catch (IOException ex) {
      log.error("Play session {} I/O failure", name, ex);
      return ExitCode.IO_ERROR;
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.error("Play session {} interrupted", name, ex);
      return ExitCode.INTERRUPTED;
    } catch (Exception ex) {
      log.error("Play session {} failed", name, ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }

  static void removeHook(Thread hook) {
    try {
      Runtime.getRuntime().removeShutdownHook(hook);
    } catch (IllegalStateException ex) {
      log.debug("JVM already shutting down; shutdown hook left in place", ex);
    }
  }

  private static void printDryRunPlan(PlaybackConfig config) {
    PipelineConfig pipeline = config.pipeline();
    PlaybackUseCase.Settings playback = config.playback();
    CliPrinter.printLines(
        "Play dry-run: no frames will be processed.",
        " Name             : " + pipeline.name(),
        " Source           : " + pipeline.source(),
        " Detector         : " + pipeline.detector().kind().configName(),
        " Classes          : " + pipeline.classes(),
        " Skip / scale     : " + playback.skip() + " / " + playback.scale(),
        " Sleep (ms)       : " + playback.sleep().toMillis(),
        " Save frames      : " + (config.captureDir() == null ? "no" : config.captureDir()),
        " Display          : " + playback.display(),
        " Events           : " + pipeline.eventsOut(),
        " Re-run without --dry-run to start processing.");
  }
}
