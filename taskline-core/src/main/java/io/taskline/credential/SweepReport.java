package io.taskline.credential;

import io.taskline.util.JsonSummary;

import java.util.List;

/**
 * Per-credential outcomes of one {@link TokenRefreshManager#sweepExpiring} run.
 *
 * @param outcomes one entry per credential found expiring, soonest expiry first
 */
public record SweepReport(List<RefreshOutcome> outcomes) {

  public SweepReport {
    outcomes = List.copyOf(outcomes);
  }

  public int total() {
    return outcomes.size();
  }

  public int count(RefreshOutcome.Status status) {
    int n = 0;
    for (RefreshOutcome outcome : outcomes) {
      if (outcome.status() == status) {
        n++;
      }
    }
    return n;
  }

  /**
   * Returns the counts as {@code {"total":n,"refreshed":n,"skipped":n,"failed":n,"revoked":n}}.
   */
  public String toJson() {
    return new JsonSummary()
        .put("total", total())
        .put("refreshed", count(RefreshOutcome.Status.REFRESHED))
        .put("skipped", count(RefreshOutcome.Status.ALREADY_FRESH))
        .put("failed", count(RefreshOutcome.Status.FAILED))
        .put("revoked", count(RefreshOutcome.Status.REVOKED))
        .toJson();
  }
}
