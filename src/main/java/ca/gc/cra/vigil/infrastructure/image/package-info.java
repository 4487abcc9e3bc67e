/**
 * AWT image helpers shared by frame sources, capture stores, and renderers.
 */
package ca.gc.cra.vigil.infrastructure.image;
