/**
 * Frame sources and the producer that feeds live buffers.
 * <p><strong>Role:</strong> Capture-side adapters implementing {@link ca.gc.cra.vigil.application.port.FrameSource}.</p>
 * <p><strong>Concurrency:</strong> Sources are polled from a single thread; the producer owns one thread.</p>
 */
package ca.gc.cra.vigil.infrastructure.capture;
