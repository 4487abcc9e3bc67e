/**
 * Shared frame buffers between producers and watchers.
 * <p><strong>Concurrency:</strong> Single writer, many readers; readers never block the writer.</p>
 */
package ca.gc.cra.vigil.infrastructure.buffer;
