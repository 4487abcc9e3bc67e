/**
 * Frame value types shared between producers, watchers, and renderers.
 *
 * @since 0.1.0
 */
package ca.gc.cra.vigil.domain.frame;
