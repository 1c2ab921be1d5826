package ca.gc.cra.reach.domain.scan;

import java.util.Objects;

/**
 * Per-task probe result consumed only for aggregation; failures are values, never exceptions.
 *
 * @param task probed pair
 * @param outcome connect outcome
 * @since 0.1.0
 */
public record ProbeResult(ProbeTask task, ProbeOutcome outcome) {
  public ProbeResult {
    Objects.requireNonNull(task, "task");
    Objects.requireNonNull(outcome, "outcome");
  }

  public static ProbeResult open(ProbeTask task) {
    return new ProbeResult(task, ProbeOutcome.OPEN);
  }

  public static ProbeResult notOpen(ProbeTask task) {
    return new ProbeResult(task, ProbeOutcome.NOT_OPEN);
  }

  public boolean isOpen() {
    return outcome == ProbeOutcome.OPEN;
  }
}
