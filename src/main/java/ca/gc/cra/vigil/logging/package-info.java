/**
 * Logging helpers: runtime verbosity control for the CLI and truncation of user-supplied values.
 * <p>Logback is the backend; every class logs through the SLF4J API.</p>
 */
package ca.gc.cra.vigil.logging;
