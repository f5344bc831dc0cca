package io.taskline.spring.boot;

import io.taskline.JobHandler;
import io.taskline.JobType;

import java.util.Objects;

/**
 * Binds a {@link JobHandler} bean to the job type it executes.
 *
 * <pre>{@code
 * @Bean
 * JobHandlerBinding scheduledPostHandler(PostPublisher publisher) {
 *   return JobHandlerBinding.of(StandardJobType.SCHEDULED_POST, publisher::publish);
 * }
 * }</pre>
 *
 * <p>A binding for {@code token_refresh} or {@code cleanup} replaces the built-in handler.
 *
 * @param jobType the job type key
 * @param handler the handler
 */
public record JobHandlerBinding(String jobType, JobHandler handler) {

  public JobHandlerBinding {
    Objects.requireNonNull(jobType, "jobType");
    Objects.requireNonNull(handler, "handler");
    if (jobType.isEmpty()) {
      throw new IllegalArgumentException("jobType cannot be empty");
    }
  }

  public static JobHandlerBinding of(JobType jobType, JobHandler handler) {
    return new JobHandlerBinding(Objects.requireNonNull(jobType, "jobType").key(), handler);
  }

  public static JobHandlerBinding of(String jobType, JobHandler handler) {
    return new JobHandlerBinding(jobType, handler);
  }
}
