/**
 * Thread factories for watcher loops and background renderers.
 * <p><strong>Role:</strong> Infrastructure utilities that name threads and install uncaught-exception handlers.</p>
 * <p><strong>Concurrency:</strong> Factories are thread-safe; each watcher owns exactly one thread.</p>
 */
package ca.gc.cra.vigil.infrastructure.exec;
