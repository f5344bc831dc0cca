package io.taskline.jobs;

import io.taskline.JobContext;
import io.taskline.JobHandler;
import io.taskline.JobResult;
import io.taskline.credential.SweepReport;
import io.taskline.credential.TokenRefreshManager;

import java.time.Duration;
import java.util.Objects;

/**
 * Handles {@code token_refresh} jobs by refreshing every credential expiring within the
 * threshold. Per-credential failures are part of the result; only a failure to list the
 * credentials fails the job.
 */
public final class TokenRefreshSweepHandler implements JobHandler {
  public static final Duration DEFAULT_THRESHOLD = Duration.ofHours(24);

  private final TokenRefreshManager refreshManager;
  private final Duration threshold;

  public TokenRefreshSweepHandler(TokenRefreshManager refreshManager) {
    this(refreshManager, DEFAULT_THRESHOLD);
  }

  public TokenRefreshSweepHandler(TokenRefreshManager refreshManager, Duration threshold) {
    this.refreshManager = Objects.requireNonNull(refreshManager, "refreshManager");
    this.threshold = Objects.requireNonNull(threshold, "threshold");
  }

  @Override
  public JobResult handle(JobContext context) {
    SweepReport report = refreshManager.sweepExpiring(threshold);
    return JobResult.ok(report.toJson());
  }
}
