/**
 * Command-line entry points: the {@code vigil} dispatcher with its {@code live} and {@code play} commands.
 * <p>Commands return an {@link ca.gc.cra.vigil.api.ExitCode} instead of exiting so they can be driven
 * from tests; only the {@code main} methods call {@link java.lang.System#exit(int)}.</p>
 */
package ca.gc.cra.vigil.api;
