/**
 * Detection results and class metadata produced by detector variants.
 *
 * @since 0.1.0
 */
package ca.gc.cra.vigil.domain.detect;
