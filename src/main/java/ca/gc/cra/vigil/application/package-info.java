/**
 * Application layer orchestration for VIGIL pipelines.
 * <p><strong>Role:</strong> Hosts use cases and ports that coordinate capture, detection, tracking, and output.</p>
 * <p><strong>Concurrency:</strong> The live watcher owns one thread per instance; playback runs on the caller's thread.</p>
 * <p><strong>Metrics:</strong> Emits namespaces including {@code watcher.*}, {@code processor.*}, and {@code playback.*}.</p>
 */
package ca.gc.cra.vigil.application;
