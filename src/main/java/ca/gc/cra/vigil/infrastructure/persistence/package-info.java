/**
 * Persistence adapters for captured frames and detection metadata.
 * <p><strong>Format:</strong> PNG images plus JSON event arrays written with the Jackson streaming API.</p>
 */
package ca.gc.cra.vigil.infrastructure.persistence;
