/**
 * Configuration loading and composition root wiring for the VIGIL CLI.
 * <p>Values are layered as CLI over YAML over {@link ca.gc.cra.vigil.config.DefaultsForMode}, then parsed
 * into immutable records validated with {@code ca.gc.cra.vigil.validation}. Invalid values surface as
 * {@link java.lang.IllegalArgumentException}.</p>
 */
package ca.gc.cra.vigil.config;
