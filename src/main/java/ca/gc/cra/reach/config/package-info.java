/**
 * <strong>Purpose:</strong> Configuration loading, merging, and wiring for REACH commands.
 * <p><strong>Precedence:</strong> CLI key=value arguments override the YAML {@code config=} file, which overrides
 * {@link ca.gc.cra.reach.config.DefaultsForMode}.
 * <p><strong>Concurrency:</strong> Used on the CLI thread during startup only.
 * <p><strong>Security:</strong> YAML is parsed with SnakeYAML's safe constructor; no arbitrary types are built.
 *
 * @since 0.1.0
 */
package ca.gc.cra.reach.config;
