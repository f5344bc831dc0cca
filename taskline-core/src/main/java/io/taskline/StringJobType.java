package io.taskline;

import java.util.Objects;

/**
 * A string-based job type for job types defined at runtime or in configuration.
 *
 * <pre>{@code
 * JobType type = StringJobType.of("crm_export");
 * }</pre>
 */
public final class StringJobType implements JobType {

  private final String key;

  private StringJobType(String key) {
    this.key = Objects.requireNonNull(key, "key");
    if (key.isEmpty()) {
      throw new IllegalArgumentException("Job type name cannot be empty");
    }
  }

  /**
   * Creates a job type from a string.
   *
   * @param key the job type key
   * @return the job type
   * @throws NullPointerException if key is null
   * @throws IllegalArgumentException if key is empty
   */
  public static StringJobType of(String key) {
    return new StringJobType(key);
  }

  @Override
  public String key() {
    return key;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof StringJobType)) return false;
    StringJobType that = (StringJobType) o;
    return key.equals(that.key);
  }

  @Override
  public int hashCode() {
    return key.hashCode();
  }

  @Override
  public String toString() {
    return key;
  }
}
