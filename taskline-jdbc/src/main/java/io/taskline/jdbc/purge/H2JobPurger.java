package io.taskline.jdbc.purge;

/**
 * H2 job purger.
 *
 * <p>Uses the default subquery-based purge from {@link AbstractJdbcJobPurger}.
 */
public final class H2JobPurger extends AbstractJdbcJobPurger {

  public H2JobPurger() {
    super();
  }

  public H2JobPurger(String tableName) {
    super(tableName);
  }
}
