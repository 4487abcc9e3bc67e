package ca.gc.cra.vigil.infrastructure.track;

import ca.gc.cra.vigil.application.port.MetricsPort;
import ca.gc.cra.vigil.application.port.ObjectTracker;
import ca.gc.cra.vigil.domain.detect.ClassCatalog;
import ca.gc.cra.vigil.domain.detect.ClassMetadata;
import ca.gc.cra.vigil.domain.detect.DetectionEvent;
import ca.gc.cra.vigil.domain.frame.Frame;
import ca.gc.cra.vigil.domain.track.CollisionAlert;
import ca.gc.cra.vigil.domain.track.TrackedObject;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link ObjectTracker} that keeps identities by nearest-centroid association.
 * <p><strong>Association:</strong> Centroids are normalized by frame size, so the distance threshold is a
 * fraction of the frame. A class's vertical offset shifts its centroid by that fraction of the box height.
 * Each detection is paired with the closest unclaimed track of the same class within the threshold, closest
 * pairs first. Unpaired detections start new identities.</p>
 * <p><strong>Retirement:</strong> A track unseen for more than its class's memory window is dropped.</p>
 * <p><strong>Collisions:</strong> Two tracks of different classes seen in the current frame whose boxes overlap.</p>
 * <p><strong>Thread-safety:</strong> Not thread-safe; driven by a single pipeline thread.</p>
 *
 * @since 0.1.0
 */
public final class ProximityObjectTracker implements ObjectTracker {
  private static final Logger log = LoggerFactory.getLogger(ProximityObjectTracker.class);

  private final ClassCatalog catalog;
  private final double distanceThreshold;
  private final MetricsPort metrics;
  private final Map<Long, TrackedObject> tracks = new LinkedHashMap<>();
  private long frameNumber;
  private long nextId = 1;

  /**
   * Creates a tracker without metrics.
   *
   * @param catalog class metadata providing memory windows and offsets
   * @param distanceThreshold maximum normalized centroid distance for association
   */
  public ProximityObjectTracker(ClassCatalog catalog, double distanceThreshold) {
    this(catalog, distanceThreshold, MetricsPort.NO_OP);
  }

  /**
   * Creates a tracker.
   *
   * @param catalog class metadata providing memory windows and offsets
   * @param distanceThreshold maximum normalized centroid distance for association; must be positive
   * @param metrics metrics sink
   */
  public ProximityObjectTracker(ClassCatalog catalog, double distanceThreshold, MetricsPort metrics) {
    this.catalog = Objects.requireNonNull(catalog, "catalog");
    if (!(distanceThreshold > 0d)) {
      throw new IllegalArgumentException("distanceThreshold must be positive (was " + distanceThreshold + ")");
    }
    this.distanceThreshold = distanceThreshold;
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  @Override
  public void update(Frame frame, List<DetectionEvent> events) {
    frameNumber++;
    List<Candidate> candidates = new ArrayList<>();
    List<double[]> centroids = new ArrayList<>(events.size());
    for (int d = 0; d < events.size(); d++) {
      DetectionEvent event = events.get(d);
      double[] centroid = centroid(event, frame);
      centroids.add(centroid);
      for (TrackedObject track : tracks.values()) {
        if (track.classId() != event.classId()) {
          continue;
        }
        double distance = track.distanceTo(centroid[0], centroid[1]);
        if (distance <= distanceThreshold) {
          candidates.add(new Candidate(track.id(), d, distance));
        }
      }
    }
    candidates.sort(Comparator.comparingDouble(Candidate::distance));

    boolean[] claimedDetections = new boolean[events.size()];
    List<Long> claimedTracks = new ArrayList<>();
    for (Candidate candidate : candidates) {
      if (claimedDetections[candidate.detection()] || claimedTracks.contains(candidate.trackId())) {
        continue;
      }
      claimedDetections[candidate.detection()] = true;
      claimedTracks.add(candidate.trackId());
      TrackedObject previous = tracks.get(candidate.trackId());
      DetectionEvent event = events.get(candidate.detection());
      double[] centroid = centroids.get(candidate.detection());
      tracks.put(previous.id(), new TrackedObject(previous.id(), previous.classId(), event.label(),
          centroid[0], centroid[1], event.box(), frameNumber, previous.hits() + 1));
    }

    for (int d = 0; d < events.size(); d++) {
      if (claimedDetections[d]) {
        continue;
      }
      DetectionEvent event = events.get(d);
      double[] centroid = centroids.get(d);
      long id = nextId++;
      tracks.put(id, new TrackedObject(id, event.classId(), event.label(),
          centroid[0], centroid[1], event.box(), frameNumber, 1));
      metrics.increment("tracker.identities.created");
      log.debug("New {} identity {} at ({}, {})", event.label(), id, centroid[0], centroid[1]);
    }

    retire();
  }

  @Override
  public List<CollisionAlert> detect(Frame frame) {
    List<TrackedObject> current = new ArrayList<>();
    for (TrackedObject track : tracks.values()) {
      if (track.lastSeenFrame() == frameNumber) {
        current.add(track);
      }
    }
    List<CollisionAlert> alerts = new ArrayList<>();
    for (int i = 0; i < current.size(); i++) {
      for (int j = i + 1; j < current.size(); j++) {
        TrackedObject a = current.get(i);
        TrackedObject b = current.get(j);
        if (a.classId() != b.classId() && a.box().overlaps(b.box())) {
          alerts.add(new CollisionAlert(a, b, frameNumber));
        }
      }
    }
    for (CollisionAlert alert : alerts) {
      metrics.increment("tracker.collisions");
      log.warn("Collision at frame {} between {} {} and {} {}", alert.frameNumber(),
          alert.first().label(), alert.first().id(), alert.second().label(), alert.second().id());
    }
    return alerts;
  }

  @Override
  public List<TrackedObject> tracks() {
    return List.copyOf(tracks.values());
  }

  private void retire() {
    Iterator<TrackedObject> it = tracks.values().iterator();
    while (it.hasNext()) {
      TrackedObject track = it.next();
      int memory = catalog.resolve(track.classId(), track.label()).memoryFrames();
      if (frameNumber - track.lastSeenFrame() > memory) {
        it.remove();
        metrics.increment("tracker.identities.retired");
        log.debug("Retired {} identity {} after {} frames unseen", track.label(), track.id(), memory);
      }
    }
  }

  private double[] centroid(DetectionEvent event, Frame frame) {
    ClassMetadata metadata = catalog.resolve(event.classId(), event.label());
    double x = event.normalizedCenterX(frame.width());
    double y = event.normalizedCenterY(frame.height())
        + metadata.verticalOffset() * event.box().height() / frame.height();
    return new double[] {x, y};
  }

  private record Candidate(long trackId, int detection, double distance) {}
}
