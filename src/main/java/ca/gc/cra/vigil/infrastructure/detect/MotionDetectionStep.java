package ca.gc.cra.vigil.infrastructure.detect;

import ca.gc.cra.vigil.application.port.DetectionStep;
import ca.gc.cra.vigil.domain.detect.BoundingBox;
import ca.gc.cra.vigil.domain.detect.DetectionEvent;
import ca.gc.cra.vigil.domain.detect.ProcessedFrame;
import ca.gc.cra.vigil.domain.frame.Frame;
import ca.gc.cra.vigil.domain.frame.Overlay;
import ca.gc.cra.vigil.domain.frame.Rgb;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Motion detector based on a running-average background model.
 * <p>Each frame's luma is compared with the background; pixels differing by more than
 * {@code threshold * 255} are marked as changed. Changed pixels are grouped on a coarse grid of
 * {@code cellSize} cells, 4-connected cells form a region, and regions whose bounding box covers at least
 * {@code minArea} pixels become {@code motion} events. With {@code fullFrame} set the regions are merged into a
 * single box. The background then moves toward the current frame by {@code memory}.</p>
 * <p>The first frame, and any frame whose size differs from the model, only seeds the background.</p>
 * <p>Not thread-safe.</p>
 *
 * @since 0.1.0
 */
public final class MotionDetectionStep implements DetectionStep {
  static final String LABEL = "motion";
  private static final Rgb BOX_COLOR = new Rgb(0, 255, 0);

  private final Settings settings;
  private float[] background;
  private int modelWidth;
  private int modelHeight;

  /**
   * Creates a motion detector.
   *
   * @param settings tuning
   */
  public MotionDetectionStep(Settings settings) {
    this.settings = Objects.requireNonNull(settings, "settings");
  }

  @Override
  public ProcessedFrame detect(Instant timestamp, Frame frame) {
    int width = frame.width();
    int height = frame.height();
    if (background == null || width != modelWidth || height != modelHeight) {
      seed(frame);
      return ProcessedFrame.empty(frame);
    }

    int cellSize = settings.cellSize();
    int cols = (width + cellSize - 1) / cellSize;
    int rows = (height + cellSize - 1) / cellSize;
    int[] changedPerCell = new int[cols * rows];
    double limit = settings.threshold() * 255d;
    float memory = (float) settings.memory();

    for (int y = 0; y < height; y++) {
      int rowBase = (y / cellSize) * cols;
      for (int x = 0; x < width; x++) {
        int i = y * width + x;
        int luma = frame.luma(x, y);
        if (Math.abs(luma - background[i]) > limit) {
          changedPerCell[rowBase + x / cellSize]++;
        }
        background[i] += memory * (luma - background[i]);
      }
    }

    List<Region> regions = regions(changedPerCell, cols, rows, width, height);
    if (settings.fullFrame() && regions.size() > 1) {
      regions = List.of(Region.union(regions));
    }

    List<DetectionEvent> events = new ArrayList<>(regions.size());
    List<Overlay> overlays = new ArrayList<>(regions.size());
    for (Region region : regions) {
      BoundingBox box = region.box();
      if (box.area() < settings.minArea()) {
        continue;
      }
      double confidence = Math.min(1d, region.changed / (double) Math.max(1, box.area()));
      events.add(new DetectionEvent(0, LABEL, box, confidence));
      overlays.add(new Overlay.Box(box.x(), box.y(), box.width(), box.height(), BOX_COLOR, 2));
    }
    return new ProcessedFrame(frame.withOverlays(overlays), events);
  }

  @Override
  public String variant() {
    return DetectorKind.MOTION.configName();
  }

  private void seed(Frame frame) {
    modelWidth = frame.width();
    modelHeight = frame.height();
    background = new float[modelWidth * modelHeight];
    for (int y = 0; y < modelHeight; y++) {
      for (int x = 0; x < modelWidth; x++) {
        background[y * modelWidth + x] = frame.luma(x, y);
      }
    }
  }

  private List<Region> regions(int[] changedPerCell, int cols, int rows, int width, int height) {
    int cellSize = settings.cellSize();
    boolean[] visited = new boolean[changedPerCell.length];
    List<Region> regions = new ArrayList<>();
    ArrayDeque<Integer> queue = new ArrayDeque<>();
    for (int start = 0; start < changedPerCell.length; start++) {
      if (visited[start] || changedPerCell[start] == 0) {
        continue;
      }
      int minCol = Integer.MAX_VALUE;
      int minRow = Integer.MAX_VALUE;
      int maxCol = -1;
      int maxRow = -1;
      long changed = 0;
      visited[start] = true;
      queue.add(start);
      while (!queue.isEmpty()) {
        int cell = queue.poll();
        int col = cell % cols;
        int row = cell / cols;
        changed += changedPerCell[cell];
        minCol = Math.min(minCol, col);
        maxCol = Math.max(maxCol, col);
        minRow = Math.min(minRow, row);
        maxRow = Math.max(maxRow, row);
        enqueue(queue, visited, changedPerCell, col - 1, row, cols, rows);
        enqueue(queue, visited, changedPerCell, col + 1, row, cols, rows);
        enqueue(queue, visited, changedPerCell, col, row - 1, cols, rows);
        enqueue(queue, visited, changedPerCell, col, row + 1, cols, rows);
      }
      int x1 = minCol * cellSize;
      int y1 = minRow * cellSize;
      int x2 = Math.min(width, (maxCol + 1) * cellSize);
      int y2 = Math.min(height, (maxRow + 1) * cellSize);
      regions.add(new Region(x1, y1, x2, y2, changed));
    }
    return regions;
  }

  private static void enqueue(
      ArrayDeque<Integer> queue, boolean[] visited, int[] changedPerCell, int col, int row, int cols, int rows) {
    if (col < 0 || row < 0 || col >= cols || row >= rows) {
      return;
    }
    int cell = row * cols + col;
    if (!visited[cell] && changedPerCell[cell] > 0) {
      visited[cell] = true;
      queue.add(cell);
    }
  }

  private record Region(int x1, int y1, int x2, int y2, long changed) {
    BoundingBox box() {
      return BoundingBox.fromCorners(x1, y1, x2, y2);
    }

    static Region union(List<Region> regions) {
      int x1 = Integer.MAX_VALUE;
      int y1 = Integer.MAX_VALUE;
      int x2 = 0;
      int y2 = 0;
      long changed = 0;
      for (Region r : regions) {
        x1 = Math.min(x1, r.x1);
        y1 = Math.min(y1, r.y1);
        x2 = Math.max(x2, r.x2);
        y2 = Math.max(y2, r.y2);
        changed += r.changed;
      }
      return new Region(x1, y1, x2, y2, changed);
    }
  }

  /**
   * Motion detector tuning.
   *
   * @param threshold per-pixel luma change, as a fraction of full scale, that counts as motion
   * @param minArea smallest region, in pixels of bounding-box area, reported as an event
   * @param memory weight of the current frame when updating the background, in {@code (0, 1]}
   * @param fullFrame merge all regions into one box
   * @param cellSize grid cell edge in pixels used to group changed pixels
   */
  public record Settings(double threshold, int minArea, double memory, boolean fullFrame, int cellSize) {
    /**
     * Validates motion settings.
     *
     * @param threshold change fraction in {@code (0, 1)}
     * @param minArea non-negative area
     * @param memory background weight in {@code (0, 1]}
     * @param fullFrame merge flag
     * @param cellSize positive cell edge
     */
    public Settings {
      if (!(threshold > 0d && threshold < 1d)) {
        throw new IllegalArgumentException("motion.threshold must be in (0, 1) (was " + threshold + ")");
      }
      if (minArea < 0) {
        throw new IllegalArgumentException("motion.minArea must be >= 0");
      }
      if (!(memory > 0d && memory <= 1d)) {
        throw new IllegalArgumentException("motion.memory must be in (0, 1] (was " + memory + ")");
      }
      if (cellSize <= 0) {
        throw new IllegalArgumentException("motion cell size must be positive");
      }
    }

    /**
     * Returns the default motion tuning.
     *
     * @return threshold 0.04, min area 1600, memory 0.1, full frame, 8 pixel cells
     */
    public static Settings defaults() {
      return new Settings(0.04d, 1600, 0.1d, true, 8);
    }
  }
}
