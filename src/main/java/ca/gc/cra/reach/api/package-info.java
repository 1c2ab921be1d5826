/**
 * CLI entry points for the {@code scan} and {@code targets} commands.
 * <p><strong>Role:</strong> Driving adapters; parse arguments, configure logging, run use cases, and map failures
 * to {@link ca.gc.cra.reach.api.ExitCode}.</p>
 * <p><strong>Output:</strong> Results and usage go to stdout via {@link ca.gc.cra.reach.api.CliPrinter};
 * diagnostics go to stderr through Logback.</p>
 */
package ca.gc.cra.reach.api;
