package ca.gc.cra.vigil.api;

/**
 * Process exit statuses returned by the VIGIL command line.
 *
 * @since 0.1.0
 */
public enum ExitCode {
  /** Successful execution. */
  SUCCESS(0),
  /** Command-line arguments or configuration values were invalid. */
  INVALID_ARGS(2),
  /** A source, capture directory, or configuration file could not be read or written. */
  IO_ERROR(3),
  /** Adapters could not be wired from otherwise valid configuration. */
  CONFIG_ERROR(4),
  /** The pipeline failed while running. */
  RUNTIME_FAILURE(5),
  /** The process was interrupted (e.g., SIGINT). */
  INTERRUPTED(130);

  private final int code;

  ExitCode(int code) {
    this.code = code;
  }

  /**
   * Returns the numeric status handed to the operating system.
   *
   * @return exit status
   */
  public int code() {
    return code;
  }
}
