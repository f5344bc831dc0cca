package io.taskline;

/**
 * Identifies a kind of job and the handler that executes it.
 *
 * <p>Implement as an enum for a closed set of job types, or use
 * {@link StringJobType} for types named at runtime. The {@link #key()} value is
 * what gets persisted in the {@code job_type} column.
 *
 * @see StandardJobType
 */
public interface JobType {

  /**
   * Returns the persisted job type key.
   *
   * @return the job type key
   */
  String key();
}
