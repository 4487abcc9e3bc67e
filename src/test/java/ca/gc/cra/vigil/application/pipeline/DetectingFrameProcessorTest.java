package ca.gc.cra.vigil.application.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.vigil.application.port.DetectionStep;
import ca.gc.cra.vigil.domain.detect.ProcessedFrame;
import ca.gc.cra.vigil.domain.frame.Frame;
import ca.gc.cra.vigil.domain.frame.Overlay;
import ca.gc.cra.vigil.testutil.RecordingMetricsPort;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class DetectingFrameProcessorTest {
  private static final Instant T0 = Instant.parse("2024-05-01T12:00:00Z");

  @Test
  void stampsMarkerAndFpsTextBeforeDetection() throws Exception {
    CapturingStep step = new CapturingStep();
    DetectingFrameProcessor processor =
        new DetectingFrameProcessor("cam-1", step, 20, new FakeClock(), new RecordingMetricsPort());
    Frame input = Frame.filled(64, 48, 3, 10);

    ProcessedFrame result = processor.processFrame(T0, input);

    List<Overlay> overlays = result.frame().overlays();
    assertEquals(2, overlays.size());
    Overlay.Marker marker = assertInstanceOf(Overlay.Marker.class, overlays.get(0));
    assertEquals(8, marker.x());
    assertEquals(12, marker.y());
    assertEquals(4, marker.radius());
    Overlay.Text text = assertInstanceOf(Overlay.Text.class, overlays.get(1));
    assertEquals(17, text.x());
    assertEquals(16, text.y());
    assertEquals("cam-1 0.0 FPS", text.text());
    assertTrue(input.overlays().isEmpty(), "input frame must not be modified");
    assertSame(step.seen.get(0), result.frame());
  }

  @Test
  void overlayTextReportsCompletedWindowRate() throws Exception {
    FakeClock clock = new FakeClock();
    CapturingStep step = new CapturingStep();
    DetectingFrameProcessor processor =
        new DetectingFrameProcessor("cam-2", step, 2, clock, new RecordingMetricsPort());
    Frame input = Frame.filled(16, 16, 1, 0);

    clock.advance(Duration.ofMillis(100));
    processor.processFrame(T0, input);
    clock.advance(Duration.ofMillis(100));
    ProcessedFrame second = processor.processFrame(T0.plusMillis(100), input);

    Overlay.Text text = (Overlay.Text) second.frame().overlays().get(1);
    assertEquals("cam-2 10.0 FPS", text.text());
    assertEquals(10.0d, processor.fps(), 1e-9);
    assertEquals(Duration.ofMillis(100), processor.lastFrameGap());
  }

  @Test
  void rejectsStepThatReturnsNoResult() {
    DetectionStep broken = new DetectionStep() {
      @Override
      public ProcessedFrame detect(Instant timestamp, Frame frame) {
        return null;
      }

      @Override
      public String variant() {
        return "broken";
      }
    };
    DetectingFrameProcessor processor = new DetectingFrameProcessor("cam-3", broken);

    IllegalStateException ex = assertThrows(IllegalStateException.class,
        () -> processor.processFrame(T0, Frame.filled(8, 8, 1, 0)));
    assertTrue(ex.getMessage().contains("broken"));
  }

  @Test
  void recordsLatencyAndClosesStep() throws Exception {
    RecordingMetricsPort metrics = new RecordingMetricsPort();
    CapturingStep step = new CapturingStep();
    DetectingFrameProcessor processor = new DetectingFrameProcessor("cam-4", step, 20, new FakeClock(), metrics);

    processor.processFrame(T0, Frame.filled(8, 8, 1, 0));
    processor.close();

    assertEquals(1, metrics.observed("processor.latencyNanos").size());
    assertTrue(step.closed);
  }

  private static final class CapturingStep implements DetectionStep {
    private final List<Frame> seen = new ArrayList<>();
    private boolean closed;

    @Override
    public ProcessedFrame detect(Instant timestamp, Frame frame) {
      seen.add(frame);
      return ProcessedFrame.empty(frame);
    }

    @Override
    public String variant() {
      return "capturing";
    }

    @Override
    public void close() {
      closed = true;
    }
  }
}
