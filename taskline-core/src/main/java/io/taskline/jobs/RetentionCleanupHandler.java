package io.taskline.jobs;

import io.taskline.JobContext;
import io.taskline.JobHandler;
import io.taskline.JobResult;
import io.taskline.spi.ConnectionProvider;
import io.taskline.spi.JobPurger;
import io.taskline.spi.OAuthStateStore;
import io.taskline.util.JsonSummary;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Handles {@code cleanup} jobs: deletes terminal jobs older than the retention period and
 * expired OAuth states.
 *
 * <p>Jobs are deleted in batches until fewer than {@code batchSize} rows are deleted.
 * Each batch uses its own auto-committed connection to limit lock duration.
 *
 * @see RetentionCleanupHandler.Builder
 */
public final class RetentionCleanupHandler implements JobHandler {
  private static final Logger logger = Logger.getLogger(RetentionCleanupHandler.class.getName());

  private final ConnectionProvider connectionProvider;
  private final JobPurger purger;
  private final OAuthStateStore stateStore;
  private final Clock clock;
  private final Duration retention;
  private final int batchSize;

  private RetentionCleanupHandler(Builder builder) {
    this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
    this.purger = Objects.requireNonNull(builder.purger, "purger");
    if (builder.retention.isNegative()) {
      throw new IllegalArgumentException("retention must be >= 0");
    }
    if (builder.batchSize <= 0) {
      throw new IllegalArgumentException("batchSize must be > 0");
    }
    this.stateStore = builder.stateStore;
    this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
    this.retention = builder.retention;
    this.batchSize = builder.batchSize;
  }

  public static Builder builder() {
    return new Builder();
  }

  @Override
  public JobResult handle(JobContext context) throws SQLException {
    Instant now = clock.instant();
    Instant cutoff = now.minus(retention);
    long jobsDeleted = 0;
    int deleted;
    do {
      deleted = purgeBatch(cutoff);
      jobsDeleted += deleted;
    } while (deleted >= batchSize);

    int statesDeleted = 0;
    if (stateStore != null) {
      try (Connection conn = connectionProvider.getConnection()) {
        conn.setAutoCommit(true);
        statesDeleted = stateStore.purgeExpired(conn, now);
      }
    }
    logger.log(Level.INFO, "Purged {0} terminal job(s) older than {1} and {2} expired OAuth state(s)",
        new Object[]{jobsDeleted, cutoff, statesDeleted});
    return JobResult.ok(new JsonSummary()
        .put("jobs_deleted", jobsDeleted)
        .put("states_deleted", statesDeleted)
        .toJson());
  }

  private int purgeBatch(Instant cutoff) throws SQLException {
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      return purger.purge(conn, cutoff, batchSize);
    }
  }

  /** Builder for {@link RetentionCleanupHandler}. */
  public static final class Builder {
    private ConnectionProvider connectionProvider;
    private JobPurger purger;
    private OAuthStateStore stateStore;
    private Clock clock;
    private Duration retention = Duration.ofDays(30);
    private int batchSize = 500;

    private Builder() {
    }

    /**
     * <b>Required.</b>
     */
    public Builder connectionProvider(ConnectionProvider connectionProvider) {
      this.connectionProvider = connectionProvider;
      return this;
    }

    /**
     * Sets the purge strategy that deletes terminal jobs.
     *
     * <p><b>Required.</b>
     */
    public Builder purger(JobPurger purger) {
      this.purger = purger;
      return this;
    }

    /**
     * Sets the store whose expired OAuth states are deleted.
     *
     * <p>Optional. States are left alone when unset.
     */
    public Builder stateStore(OAuthStateStore stateStore) {
      this.stateStore = stateStore;
      return this;
    }

    /**
     * Optional. Defaults to {@link Clock#systemUTC()}.
     */
    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    /**
     * Sets the retention period for COMPLETED, FAILED and CANCELLED jobs.
     *
     * <p>Optional. Defaults to 30 days. Must be &ge; 0.
     */
    public Builder retention(Duration retention) {
      this.retention = Objects.requireNonNull(retention, "retention");
      return this;
    }

    /**
     * Sets the maximum number of jobs deleted per batch.
     *
     * <p>Optional. Defaults to {@code 500}. Must be &gt; 0.
     */
    public Builder batchSize(int batchSize) {
      this.batchSize = batchSize;
      return this;
    }

    public RetentionCleanupHandler build() {
      return new RetentionCleanupHandler(this);
    }
  }
}
