/**
 * On-screen and headless renderers implementing {@link ca.gc.cra.vigil.application.port.FrameRenderer}.
 * <p><strong>Concurrency:</strong> {@link ca.gc.cra.vigil.infrastructure.render.AsyncFrameRenderer} keeps drawing
 * latency and failures off the pipeline thread.</p>
 */
package ca.gc.cra.vigil.infrastructure.render;
