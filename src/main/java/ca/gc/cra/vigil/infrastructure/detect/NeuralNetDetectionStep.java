package ca.gc.cra.vigil.infrastructure.detect;

import ca.gc.cra.vigil.application.port.DetectionStep;
import ca.gc.cra.vigil.application.port.InferenceEngine;
import ca.gc.cra.vigil.application.port.InferenceEngine.Inference;
import ca.gc.cra.vigil.domain.detect.BoundingBox;
import ca.gc.cra.vigil.domain.detect.ClassCatalog;
import ca.gc.cra.vigil.domain.detect.ClassMetadata;
import ca.gc.cra.vigil.domain.detect.DetectionEvent;
import ca.gc.cra.vigil.domain.detect.ProcessedFrame;
import ca.gc.cra.vigil.domain.frame.Frame;
import ca.gc.cra.vigil.domain.frame.Overlay;
import java.time.Instant;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * Object detector delegating inference to an {@link InferenceEngine}.
 * <p>Inferences below the confidence threshold or whose label is ignored are dropped. Labels and box colours
 * come from the {@link ClassCatalog} when the class is listed, otherwise from the engine.</p>
 *
 * @since 0.1.0
 */
public final class NeuralNetDetectionStep implements DetectionStep {
  private final InferenceEngine engine;
  private final Settings settings;
  private final ClassCatalog catalog;

  /**
   * Creates a detector around an engine. The engine is closed with this step.
   *
   * @param engine inference engine
   * @param settings filtering options
   * @param catalog class labels and colours
   */
  public NeuralNetDetectionStep(InferenceEngine engine, Settings settings, ClassCatalog catalog) {
    this.engine = Objects.requireNonNull(engine, "engine");
    this.settings = Objects.requireNonNull(settings, "settings");
    this.catalog = Objects.requireNonNull(catalog, "catalog");
  }

  @Override
  public ProcessedFrame detect(Instant timestamp, Frame frame) throws Exception {
    List<Inference> inferences = engine.infer(frame);
    if (inferences == null || inferences.isEmpty()) {
      return ProcessedFrame.empty(frame);
    }
    int width = frame.width();
    int height = frame.height();
    List<DetectionEvent> events = new ArrayList<>(inferences.size());
    List<Overlay> overlays = new ArrayList<>(inferences.size() * 2);
    for (Inference inference : inferences) {
      double confidence = Math.max(0d, Math.min(1d, inference.confidence()));
      if (confidence < settings.confidenceThreshold()) {
        continue;
      }
      ClassMetadata metadata = catalog.resolve(inference.classId(), inference.label());
      if (settings.ignoreLabels().contains(metadata.label())) {
        continue;
      }
      BoundingBox box = BoundingBox.fromCorners(
          toPixel(inference.x1(), width),
          toPixel(inference.y1(), height),
          toPixel(inference.x2(), width),
          toPixel(inference.y2(), height));
      events.add(new DetectionEvent(inference.classId(), metadata.label(), box, confidence));
      overlays.add(new Overlay.Box(box.x(), box.y(), box.width(), box.height(), metadata.color(), 2));
      overlays.add(new Overlay.Text(box.x(), Math.max(12, box.y() - 4),
          String.format(Locale.ROOT, "%s %.2f", metadata.label(), confidence), 0.5d, metadata.color()));
    }
    return new ProcessedFrame(frame.withOverlays(overlays), events);
  }

  @Override
  public String variant() {
    return DetectorKind.NEURAL_NET.configName();
  }

  @Override
  public void close() throws Exception {
    engine.close();
  }

  private static int toPixel(double normalized, int extent) {
    double clamped = Math.max(0d, Math.min(1d, normalized));
    return (int) Math.round(clamped * extent);
  }

  /**
   * Neural-net detector options.
   *
   * @param engine name of the {@code InferenceEngineProvider} to load
   * @param model model file handed to the provider; may be {@code null} for engines without one
   * @param inputSize square input edge expected by the model
   * @param confidenceThreshold minimum confidence kept
   * @param ignoreLabels labels dropped from the output
   */
  public record Settings(
      String engine, Path model, int inputSize, double confidenceThreshold, Set<String> ignoreLabels) {
    /**
     * Validates neural-net options.
     *
     * @param engine provider name
     * @param model model path
     * @param inputSize positive input edge
     * @param confidenceThreshold threshold in {@code [0, 1]}
     * @param ignoreLabels ignored labels; {@code null} means none
     */
    public Settings {
      engine = Objects.requireNonNull(engine, "engine");
      if (inputSize <= 0) {
        throw new IllegalArgumentException("nn.inputSize must be positive");
      }
      if (!(confidenceThreshold >= 0d && confidenceThreshold <= 1d)) {
        throw new IllegalArgumentException("nn.confidence must be in [0, 1] (was " + confidenceThreshold + ")");
      }
      ignoreLabels = ignoreLabels == null ? Set.of() : Set.copyOf(ignoreLabels);
    }
  }
}
