package ca.gc.cra.vigil.infrastructure.detect;

import ca.gc.cra.vigil.application.port.DetectionStep;
import ca.gc.cra.vigil.application.port.InferenceEngine;
import ca.gc.cra.vigil.application.port.InferenceEngineProvider;
import ca.gc.cra.vigil.domain.detect.ClassCatalog;
import ca.gc.cra.vigil.validation.Paths;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.ServiceLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves the configured {@link DetectorKind} to a {@link DetectionStep} once, at construction time.
 * <p>Neural-net engines are discovered through {@link ServiceLoader} as {@link InferenceEngineProvider}
 * implementations and selected by name.</p>
 *
 * @since 0.1.0
 */
public final class DetectorFactory {
  private static final Logger log = LoggerFactory.getLogger(DetectorFactory.class);

  private final Iterable<InferenceEngineProvider> providers;

  /** Creates a factory that discovers engines on the context class path. */
  public DetectorFactory() {
    this(ServiceLoader.load(InferenceEngineProvider.class));
  }

  /**
   * Creates a factory over an explicit provider list (primarily for tests).
   *
   * @param providers available inference engine providers
   */
  public DetectorFactory(Iterable<InferenceEngineProvider> providers) {
    this.providers = Objects.requireNonNull(providers, "providers");
  }

  /**
   * Builds the detection step for the selected variant.
   *
   * @param settings detector selection and options
   * @param catalog class metadata used for labels and colours
   * @return new detection step owned by the caller
   * @throws Exception if the replay log cannot be loaded or the engine fails to initialize
   */
  public DetectionStep create(DetectorSettings settings, ClassCatalog catalog) throws Exception {
    Objects.requireNonNull(settings, "settings");
    Objects.requireNonNull(catalog, "catalog");
    DetectionStep step = switch (settings.kind()) {
      case MOTION -> new MotionDetectionStep(settings.motion());
      case NEURAL_NET -> createNeuralNet(settings.neuralNet(), catalog);
      case REPLAY_LOG -> ReplayLogDetectionStep.load(Paths.validateReadableFile(settings.replayLog()), catalog);
    };
    log.info("Detector {} ready", step.variant());
    return step;
  }

  private DetectionStep createNeuralNet(NeuralNetDetectionStep.Settings nn, ClassCatalog catalog) throws Exception {
    InferenceEngineProvider provider = findProvider(nn.engine());
    Path model = nn.model() == null ? null : Paths.validateReadableFile(nn.model());
    InferenceEngine engine = provider.create(model, nn.inputSize());
    if (engine == null) {
      throw new IllegalStateException("Inference engine provider " + provider.name() + " returned no engine");
    }
    log.info("Inference engine {} loaded (model={}, inputSize={})", provider.name(), model, nn.inputSize());
    return new NeuralNetDetectionStep(engine, nn, catalog);
  }

  private InferenceEngineProvider findProvider(String name) {
    List<String> available = new ArrayList<>();
    for (InferenceEngineProvider provider : providers) {
      if (provider.name().equalsIgnoreCase(name)) {
        return provider;
      }
      available.add(provider.name());
    }
    throw new IllegalArgumentException(
        "No inference engine named '" + name + "' (available: " + (available.isEmpty() ? "none" : available) + ")");
  }
}
