/**
 * Detection event publishers that do not need an external broker.
 */
package ca.gc.cra.vigil.infrastructure.events;
