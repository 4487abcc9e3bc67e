/**
 * Cross-frame identity snapshots and collision alerts reported by object trackers.
 *
 * @since 0.1.0
 */
package ca.gc.cra.vigil.domain.track;
