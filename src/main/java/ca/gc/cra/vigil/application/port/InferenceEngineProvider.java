package ca.gc.cra.vigil.application.port;

import java.nio.file.Path;

/**
 * {@link java.util.ServiceLoader} SPI that creates {@link InferenceEngine}s by name.
 * Implementations are registered under {@code META-INF/services}.
 *
 * @since 0.1.0
 */
public interface InferenceEngineProvider {
  /**
   * Engine name matched against the {@code nn.engine} configuration key.
   *
   * @return provider name
   */
  String name();

  /**
   * Loads an engine for the given model.
   *
   * @param model model path; may be {@code null} for engines with built-in models
   * @param inputSize square input size expected by the model
   * @return ready engine
   * @throws Exception if the model cannot be loaded
   */
  InferenceEngine create(Path model, int inputSize) throws Exception;
}
