package io.taskline.model;

import io.taskline.ErrorKind;

import java.time.Instant;
import java.util.Objects;

/**
 * Structured failure recorded in a job's {@code last_error}.
 *
 * @param kind       failure classification
 * @param message    failure detail
 * @param occurredAt when the failure was recorded
 */
public record JobError(ErrorKind kind, String message, Instant occurredAt) {

  public JobError {
    Objects.requireNonNull(kind, "kind");
    Objects.requireNonNull(message, "message");
    Objects.requireNonNull(occurredAt, "occurredAt");
  }

  /**
   * Returns {@code true} if the owner must re-authorize before this job type can succeed.
   */
  public boolean reauthorizationRequired() {
    return kind == ErrorKind.AUTH;
  }
}
