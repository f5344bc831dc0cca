package io.taskline.recurring;

import io.taskline.StandardJobType;

import java.time.DayOfWeek;
import java.time.Duration;
import java.time.LocalTime;
import java.time.ZoneId;
import java.util.List;

/**
 * The built-in system job definitions.
 */
public final class DefaultRecurringJobs {
  public static final String TOKEN_REFRESH_SWEEP = "token-refresh-sweep";
  public static final String ANALYTICS_SYNC = "analytics-sync";
  public static final String RETENTION_CLEANUP = "retention-cleanup";

  private DefaultRecurringJobs() {
  }

  /**
   * Returns the credential refresh sweep (every 6 hours), the analytics sync (daily at 02:00)
   * and the retention cleanup (Sundays at 03:00).
   *
   * @param zone zone for the wall-clock cadences
   * @return the definitions
   */
  public static List<RecurringJobDefinition> definitions(ZoneId zone) {
    return List.of(
        RecurringJobDefinition.of(TOKEN_REFRESH_SWEEP,
            CadenceRule.every(Duration.ofHours(6)), StandardJobType.TOKEN_REFRESH),
        RecurringJobDefinition.of(ANALYTICS_SYNC,
            CadenceRule.daily(LocalTime.of(2, 0), zone), StandardJobType.ANALYTICS_SYNC),
        RecurringJobDefinition.of(RETENTION_CLEANUP,
            CadenceRule.weekly(DayOfWeek.SUNDAY, LocalTime.of(3, 0), zone), StandardJobType.CLEANUP));
  }
}
