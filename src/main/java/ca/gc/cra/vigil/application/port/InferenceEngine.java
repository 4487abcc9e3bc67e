package ca.gc.cra.vigil.application.port;

import ca.gc.cra.vigil.domain.frame.Frame;
import java.util.List;
import java.util.Objects;

/**
 * Neural-network inference backend consumed by the neural-net detector variant. Model loading and tensor
 * handling live behind this port.
 *
 * @since 0.1.0
 */
public interface InferenceEngine extends AutoCloseable {
  /**
   * Runs inference on one frame.
   *
   * @param frame input frame
   * @return raw detections in model order; never {@code null}
   * @throws Exception if inference fails
   */
  List<Inference> infer(Frame frame) throws Exception;

  @Override
  default void close() throws Exception {}

  /**
   * Raw model output for one object. Coordinates are normalized to {@code [0,1]}.
   *
   * @param classId model class index
   * @param label model-supplied label, may be blank
   * @param confidence model confidence
   * @param x1 left edge
   * @param y1 top edge
   * @param x2 right edge
   * @param y2 bottom edge
   */
  record Inference(int classId, String label, double confidence, double x1, double y1, double x2, double y2) {
    public Inference {
      label = Objects.requireNonNullElse(label, "");
    }
  }
}
