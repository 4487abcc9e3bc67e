/**
 * Detector variants implementing {@link ca.gc.cra.vigil.application.port.DetectionStep}.
 * <p>The variant set is closed ({@link ca.gc.cra.vigil.infrastructure.detect.DetectorKind}) and resolved once by
 * {@link ca.gc.cra.vigil.infrastructure.detect.DetectorFactory}. Steps are not thread-safe; each watcher owns its own.</p>
 */
package ca.gc.cra.vigil.infrastructure.detect;
