package ca.gc.cra.reach.api;

/** Stops a command early with a prepared exit code; the cause has already been logged. */
final class CliAbort extends Exception {
  private static final long serialVersionUID = 1L;

  private final transient ExitCode exitCode;

  CliAbort(ExitCode exitCode) {
    super(null, null, false, false);
    this.exitCode = exitCode;
  }

  ExitCode exitCode() {
    return exitCode;
  }
}
