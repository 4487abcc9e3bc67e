package ca.gc.cra.vigil.config;

import ca.gc.cra.vigil.domain.detect.ClassCatalog;
import ca.gc.cra.vigil.infrastructure.detect.DetectorKind;
import ca.gc.cra.vigil.infrastructure.detect.DetectorSettings;
import ca.gc.cra.vigil.infrastructure.detect.MotionDetectionStep;
import ca.gc.cra.vigil.infrastructure.detect.NeuralNetDetectionStep;
import ca.gc.cra.vigil.validation.Net;
import ca.gc.cra.vigil.validation.Strings;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Settings shared by the live and play modes: watcher identity, detector, tracker, source, and outputs.
 *
 * @param name watcher name used for threads, windows, logs, and event keys
 * @param detector detector selection and options
 * @param classes class catalog for labels, colours, and tracker memory
 * @param fpsWindow frames per FPS measurement window
 * @param display whether processed frames are rendered
 * @param distanceThreshold tracker association radius in normalized coordinates
 * @param source frame source selection
 * @param eventsOut detection event destination
 * @param kafkaBootstrap Kafka bootstrap servers; {@code null} unless events go to Kafka
 * @since 0.1.0
 */
public record PipelineConfig(
    String name,
    DetectorSettings detector,
    ClassCatalog classes,
    int fpsWindow,
    boolean display,
    double distanceThreshold,
    SourceSettings source,
    EventsOutput eventsOut,
    String kafkaBootstrap) {
  private static final int MAX_NAME_LENGTH = 64;

  /**
   * Validates cross-field rules.
   *
   * @param name watcher name
   * @param detector detector settings
   * @param classes class catalog
   * @param fpsWindow FPS window
   * @param display render flag
   * @param distanceThreshold tracker radius
   * @param source source settings
   * @param eventsOut events destination
   * @param kafkaBootstrap bootstrap servers
   */
  public PipelineConfig {
    name = Strings.requirePrintableAscii("name", name, MAX_NAME_LENGTH);
    Objects.requireNonNull(detector, "detector");
    Objects.requireNonNull(classes, "classes");
    Objects.requireNonNull(source, "source");
    Objects.requireNonNull(eventsOut, "eventsOut");
    if (fpsWindow < 1) {
      throw new IllegalArgumentException("fpsWindow must be >= 1");
    }
    if (!(distanceThreshold > 0d)) {
      throw new IllegalArgumentException("distanceThreshold must be positive");
    }
    if (eventsOut.kind() == EventsOutput.Kind.KAFKA) {
      if (kafkaBootstrap == null) {
        throw new IllegalArgumentException("kafkaBootstrap is required when eventsOut=" + eventsOut);
      }
      kafkaBootstrap = Net.validateBootstrapServers(kafkaBootstrap);
    } else {
      kafkaBootstrap = null;
    }
  }

  /**
   * Reads the shared settings from a flat configuration map.
   *
   * @param kv effective configuration
   * @return parsed settings
   * @throws IllegalArgumentException when a value is missing or out of range
   */
  public static PipelineConfig fromMap(Map<String, String> kv) {
    Objects.requireNonNull(kv, "kv");
    String name = ConfigValues.string(kv, "name", "vigil");
    return new PipelineConfig(
        name,
        detectorSettings(kv),
        ClassCatalogs.fromMap(kv),
        ConfigValues.boundedInt(kv, "fpsWindow", 20, 1, 10_000),
        ConfigValues.bool(kv, "display", false),
        ConfigValues.boundedDouble(kv, "distanceThreshold", 0.1d, 1e-6d, 2d),
        SourceSettings.fromMap(kv),
        EventsOutput.parse(kv.get("eventsOut")),
        ConfigValues.string(kv, "kafkaBootstrap", null));
  }

  static DetectorSettings detectorSettings(Map<String, String> kv) {
    DetectorKind kind = DetectorKind.fromString(ConfigValues.string(kv, "detector", "motion"));
    MotionDetectionStep.Settings defaults = MotionDetectionStep.Settings.defaults();
    MotionDetectionStep.Settings motion = new MotionDetectionStep.Settings(
        ConfigValues.boundedDouble(kv, "motion.threshold", defaults.threshold(), 1e-6d, 0.999999d),
        ConfigValues.boundedInt(kv, "motion.minArea", defaults.minArea(), 0, Integer.MAX_VALUE),
        ConfigValues.boundedDouble(kv, "motion.memory", defaults.memory(), 1e-6d, 1d),
        ConfigValues.bool(kv, "motion.fullFrame", defaults.fullFrame()),
        ConfigValues.boundedInt(kv, "motion.cellSize", defaults.cellSize(), 1, 256));

    NeuralNetDetectionStep.Settings neuralNet = null;
    String engine = ConfigValues.string(kv, "nn.engine", null);
    if (engine != null) {
      neuralNet = new NeuralNetDetectionStep.Settings(
          engine,
          ConfigValues.path(kv, "nn.model").orElse(null),
          ConfigValues.boundedInt(kv, "nn.inputSize", 640, 1, 8_192),
          ConfigValues.boundedDouble(kv, "nn.confidence", 0.25d, 0d, 1d),
          parseLabels(ConfigValues.string(kv, "nn.ignore", "")));
    }
    Path replayLog = ConfigValues.path(kv, "replay.log").orElse(null);
    return new DetectorSettings(kind, motion, neuralNet, replayLog);
  }

  private static Set<String> parseLabels(String csv) {
    Set<String> labels = new LinkedHashSet<>();
    Arrays.stream(csv.split(","))
        .map(String::trim)
        .filter(label -> !label.isEmpty())
        .forEach(labels::add);
    return labels;
  }

  /**
   * Frame source selection: an image directory, or generated frames when {@code directory} is {@code null}.
   *
   * @param directory directory of still images, or {@code null} for synthetic frames
   * @param fps nominal frame rate used to timestamp frames
   * @param width synthetic frame width
   * @param height synthetic frame height
   * @param frames synthetic frame count; zero means unbounded
   */
  public record SourceSettings(Path directory, double fps, int width, int height, long frames) {
    /** Keyword selecting generated frames. */
    public static final String SYNTHETIC = "synthetic";

    /**
     * Validates source settings.
     *
     * @param directory image directory or {@code null}
     * @param fps positive frame rate
     * @param width positive width
     * @param height positive height
     * @param frames non-negative frame count
     */
    public SourceSettings {
      if (!(fps > 0d)) {
        throw new IllegalArgumentException("sourceFps must be positive");
      }
      if (width <= 0 || height <= 0) {
        throw new IllegalArgumentException("synthetic frame size must be positive");
      }
      if (frames < 0) {
        throw new IllegalArgumentException("synthetic.frames must be >= 0");
      }
    }

    public boolean synthetic() {
      return directory == null;
    }

    static SourceSettings fromMap(Map<String, String> kv) {
      String source = ConfigValues.string(kv, "source", SYNTHETIC);
      Path directory = SYNTHETIC.equalsIgnoreCase(source) ? null : ConfigValues.path(kv, "source").orElse(null);
      return new SourceSettings(
          directory,
          ConfigValues.boundedDouble(kv, "sourceFps", 9.0d, 0.001d, 1_000d),
          ConfigValues.boundedInt(kv, "synthetic.width", 320, 16, 8_192),
          ConfigValues.boundedInt(kv, "synthetic.height", 240, 16, 8_192),
          ConfigValues.boundedLong(kv, "synthetic.frames", 300L, 0L, Long.MAX_VALUE));
    }

    @Override
    public String toString() {
      return synthetic() ? SYNTHETIC + " " + width + "x" + height : directory.toString();
    }
  }
}
