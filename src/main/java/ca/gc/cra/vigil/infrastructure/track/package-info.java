/**
 * Object tracking adapters implementing {@link ca.gc.cra.vigil.application.port.ObjectTracker}.
 */
package ca.gc.cra.vigil.infrastructure.track;
