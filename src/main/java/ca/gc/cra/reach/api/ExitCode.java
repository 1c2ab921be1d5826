package ca.gc.cra.reach.api;

/**
 * <strong>What:</strong> Process exit codes returned by the REACH commands.
 * <p><strong>Why:</strong> Scripts wrapping a scan distinguish bad input from I/O trouble and interruption.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable.</p>
 *
 * @since 0.1.0
 */
public enum ExitCode {
  /** Successful execution, including a scan that found no open ports. */
  SUCCESS(0),
  /** Invalid arguments, target, port specification, configuration, or output format. */
  INVALID_ARGS(2),
  /** Results or configuration could not be read or written. */
  IO_ERROR(3),
  /** Unexpected runtime failure. */
  RUNTIME_FAILURE(5),
  /** Process was interrupted (e.g., SIGINT). */
  INTERRUPTED(130);

  private final int code;

  ExitCode(int code) {
    this.code = code;
  }

  /**
   * Returns the numeric value passed to {@link System#exit(int)}.
   *
   * @return numeric exit code
   */
  public int code() {
    return code;
  }
}
