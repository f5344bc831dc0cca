package io.taskline.registry;

import io.taskline.JobHandler;
import io.taskline.JobType;

import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Thread-safe registry holding exactly one handler per job type.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * HandlerRegistry registry = new DefaultHandlerRegistry()
 *     .register(StandardJobType.SCHEDULED_POST, ctx -> publisher.publish(ctx))
 *     .register(StandardJobType.EMAIL_CAMPAIGN, ctx -> mailer.send(ctx))
 *     .register("crm_export", ctx -> exporter.run(ctx));
 * }</pre>
 *
 * <p>Registering a second handler for the same type is rejected; a job type maps to a
 * single side effect.
 */
public final class DefaultHandlerRegistry implements HandlerRegistry {

  private final Map<String, JobHandler> handlers = new ConcurrentHashMap<>();

  /**
   * Registers the handler for a type-safe job type.
   *
   * @param jobType the job type
   * @param handler the handler
   * @return this registry for chaining
   * @throws IllegalStateException if the job type already has a handler
   */
  public DefaultHandlerRegistry register(JobType jobType, JobHandler handler) {
    Objects.requireNonNull(jobType, "jobType");
    return register(jobType.key(), handler);
  }

  /**
   * Registers the handler for a job type key.
   *
   * @param jobType the job type key
   * @param handler the handler
   * @return this registry for chaining
   * @throws IllegalStateException if the job type already has a handler
   */
  public DefaultHandlerRegistry register(String jobType, JobHandler handler) {
    Objects.requireNonNull(jobType, "jobType");
    Objects.requireNonNull(handler, "handler");
    if (jobType.isEmpty()) {
      throw new IllegalArgumentException("jobType cannot be empty");
    }
    JobHandler previous = handlers.putIfAbsent(jobType, handler);
    if (previous != null) {
      throw new IllegalStateException("Handler already registered for job type: " + jobType);
    }
    return this;
  }

  @Override
  public JobHandler handlerFor(String jobType) {
    return jobType == null ? null : handlers.get(jobType);
  }

  @Override
  public Set<String> jobTypes() {
    return Set.copyOf(handlers.keySet());
  }
}
