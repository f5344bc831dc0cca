package io.taskline.registry;

import io.taskline.JobHandler;
import io.taskline.JobType;

import java.util.Collection;
import java.util.Set;

/**
 * Looks up the {@link JobHandler} for a persisted job type key.
 *
 * @see DefaultHandlerRegistry
 */
public interface HandlerRegistry {

  /**
   * Returns the handler for the given job type key.
   *
   * @param jobType the persisted job type key
   * @return the handler, or {@code null} if none is registered
   */
  JobHandler handlerFor(String jobType);

  /**
   * Returns the registered job type keys.
   */
  Set<String> jobTypes();

  /**
   * Verifies that every required job type has a handler.
   *
   * @param required job types that must be dispatchable
   * @throws IllegalStateException naming every missing job type
   */
  default void validate(Collection<? extends JobType> required) {
    Set<String> registered = jobTypes();
    StringBuilder missing = new StringBuilder();
    for (JobType type : required) {
      if (!registered.contains(type.key())) {
        if (missing.length() > 0) {
          missing.append(", ");
        }
        missing.append(type.key());
      }
    }
    if (missing.length() > 0) {
      throw new IllegalStateException("No handler registered for job type(s): " + missing
          + ". Registered: " + registered);
    }
  }
}
