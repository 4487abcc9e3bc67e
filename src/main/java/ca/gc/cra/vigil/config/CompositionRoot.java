package ca.gc.cra.vigil.config;

import ca.gc.cra.vigil.adapter.kafka.KafkaDetectionEventPublisher;
import ca.gc.cra.vigil.application.pipeline.DetectingFrameProcessor;
import ca.gc.cra.vigil.application.pipeline.FrameWatcher;
import ca.gc.cra.vigil.application.pipeline.LiveWatchUseCase;
import ca.gc.cra.vigil.application.pipeline.PlaybackUseCase;
import ca.gc.cra.vigil.application.port.CaptureStore;
import ca.gc.cra.vigil.application.port.ClockPort;
import ca.gc.cra.vigil.application.port.DetectionEventPublisher;
import ca.gc.cra.vigil.application.port.DetectionStep;
import ca.gc.cra.vigil.application.port.FrameRenderer;
import ca.gc.cra.vigil.application.port.FrameSource;
import ca.gc.cra.vigil.application.port.MetricsPort;
import ca.gc.cra.vigil.infrastructure.buffer.RingFrameBuffer;
import ca.gc.cra.vigil.infrastructure.capture.BufferingFrameProducer;
import ca.gc.cra.vigil.infrastructure.capture.ImageDirectoryFrameSource;
import ca.gc.cra.vigil.infrastructure.capture.SyntheticFrameSource;
import ca.gc.cra.vigil.infrastructure.detect.DetectorFactory;
import ca.gc.cra.vigil.infrastructure.events.LoggingDetectionEventPublisher;
import ca.gc.cra.vigil.infrastructure.persistence.FileCaptureStore;
import ca.gc.cra.vigil.infrastructure.render.AsyncFrameRenderer;
import ca.gc.cra.vigil.infrastructure.render.LoggingFrameRenderer;
import ca.gc.cra.vigil.infrastructure.render.SwingFrameRenderer;
import ca.gc.cra.vigil.infrastructure.time.SystemClockAdapter;
import ca.gc.cra.vigil.infrastructure.track.ProximityObjectTracker;
import java.awt.GraphicsEnvironment;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Central composition root that turns validated configuration into runnable VIGIL sessions.
 * <p>Every adapter a session creates is registered with it, so closing the {@link Session} releases the
 * detector, renderer, publisher, and capture store. The metrics port is supplied by the caller and is
 * not closed here.</p>
 *
 * @since 0.1.0
 */
public final class CompositionRoot {
  private static final Logger log = LoggerFactory.getLogger(CompositionRoot.class);

  private final MetricsPort metrics;
  private final ClockPort clock;
  private final DetectorFactory detectorFactory;

  /**
   * Creates a composition root with the system clock and ServiceLoader-discovered inference engines.
   *
   * @param metrics metrics port shared by every adapter
   */
  public CompositionRoot(MetricsPort metrics) {
    this(metrics, new SystemClockAdapter(), new DetectorFactory());
  }

  /**
   * Creates a composition root with explicit collaborators.
   *
   * @param metrics metrics port shared by every adapter
   * @param clock time source
   * @param detectorFactory factory for detection steps
   */
  public CompositionRoot(MetricsPort metrics, ClockPort clock, DetectorFactory detectorFactory) {
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.detectorFactory = Objects.requireNonNull(detectorFactory, "detectorFactory");
  }

  /**
   * Wires a live session: source, producer, ring buffer, and one watcher whose idle wait is cut short by
   * buffer writes.
   *
   * @param config live settings
   * @return session owning the wired adapters
   * @throws Exception if the detector or an output cannot be created
   */
  public Session<LiveWatchUseCase> liveSession(LiveConfig config) throws Exception {
    Objects.requireNonNull(config, "config");
    PipelineConfig pipeline = config.pipeline();
    Deque<AutoCloseable> resources = new ArrayDeque<>();
    try {
      DetectingFrameProcessor processor = processor(pipeline);
      resources.push(processor);
      DetectionEventPublisher publisher = publisher(pipeline);
      resources.push(publisher);
      FrameRenderer renderer = renderer(pipeline);
      resources.push(renderer);

      RingFrameBuffer buffer = new RingFrameBuffer(config.bufferCapacity());
      FrameWatcher watcher = FrameWatcher.create(pipeline.name(), buffer, processor)
          .tracker(new ProximityObjectTracker(pipeline.classes(), pipeline.distanceThreshold(), metrics))
          .publisher(publisher)
          .renderer(renderer)
          .metrics(metrics)
          .clock(clock)
          .settings(new FrameWatcher.Settings(
              config.idleWait(), config.heartbeat(), pipeline.display(), -1))
          .build();
      buffer.addWriteListener(watcher::signalFrameAvailable);
      BufferingFrameProducer producer = new BufferingFrameProducer(
          pipeline.name(), frameSource(pipeline.source()), buffer, config.pace(), metrics);
      log.info("Wired live session {}: detector={}, buffer={}, source={}, events={}",
          pipeline.name(), pipeline.detector().kind().configName(), config.bufferCapacity(),
          pipeline.source(), pipeline.eventsOut());
      return new Session<>(new LiveWatchUseCase(watcher, buffer, producer, clock), resources);
    } catch (Exception | Error ex) {
      closeQuietly(resources, ex);
      throw ex;
    }
  }

  /**
   * Wires a play session that processes a finite source on the calling thread.
   *
   * @param config play settings
   * @return session owning the wired adapters
   * @throws Exception if the detector or an output cannot be created
   */
  public Session<PlaybackUseCase> playbackSession(PlaybackConfig config) throws Exception {
    Objects.requireNonNull(config, "config");
    PipelineConfig pipeline = config.pipeline();
    Deque<AutoCloseable> resources = new ArrayDeque<>();
    try {
      DetectingFrameProcessor processor = processor(pipeline);
      resources.push(processor);
      DetectionEventPublisher publisher = publisher(pipeline);
      resources.push(publisher);
      FrameRenderer renderer = renderer(pipeline);
      resources.push(renderer);
      CaptureStore captureStore = config.playback().saveFrames()
          ? new FileCaptureStore(config.captureDir())
          : CaptureStore.NONE;
      resources.push(captureStore);

      PlaybackUseCase useCase = new PlaybackUseCase(
          frameSource(pipeline.source()),
          processor,
          new ProximityObjectTracker(pipeline.classes(), pipeline.distanceThreshold(), metrics),
          captureStore,
          renderer,
          publisher,
          metrics,
          config.playback());
      log.info("Wired play session {}: detector={}, source={}, events={}, capture={}",
          pipeline.name(), pipeline.detector().kind().configName(), pipeline.source(), pipeline.eventsOut(),
          config.captureDir() == null ? "<off>" : config.captureDir());
      return new Session<>(useCase, resources);
    } catch (Exception | Error ex) {
      closeQuietly(resources, ex);
      throw ex;
    }
  }

  DetectingFrameProcessor processor(PipelineConfig pipeline) throws Exception {
    DetectionStep step = detectorFactory.create(pipeline.detector(), pipeline.classes());
    return new DetectingFrameProcessor(pipeline.name(), step, pipeline.fpsWindow(), clock, metrics);
  }

  DetectionEventPublisher publisher(PipelineConfig pipeline) {
    EventsOutput out = pipeline.eventsOut();
    return switch (out.kind()) {
      case LOG -> new LoggingDetectionEventPublisher(metrics);
      case KAFKA -> new KafkaDetectionEventPublisher(pipeline.kafkaBootstrap(), out.topic(), metrics);
      case NONE -> DetectionEventPublisher.NO_OP;
    };
  }

  FrameRenderer renderer(PipelineConfig pipeline) {
    if (!pipeline.display()) {
      return FrameRenderer.NONE;
    }
    if (GraphicsEnvironment.isHeadless()) {
      log.warn("display=true but no display is available; frames for {} are logged at DEBUG instead",
          pipeline.name());
      return new LoggingFrameRenderer();
    }
    return new AsyncFrameRenderer(pipeline.name(), new SwingFrameRenderer(), metrics);
  }

  FrameSource frameSource(PipelineConfig.SourceSettings source) {
    if (source.synthetic()) {
      return new SyntheticFrameSource(source.width(), source.height(), source.frames(), source.fps(), clock);
    }
    return new ImageDirectoryFrameSource(source.directory(), source.fps(), clock);
  }

  private static void closeQuietly(Deque<AutoCloseable> resources, Throwable cause) {
    while (!resources.isEmpty()) {
      try {
        resources.pop().close();
      } catch (Exception ex) {
        cause.addSuppressed(ex);
      }
    }
  }
}
