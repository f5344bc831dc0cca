/**
 * Root API for Taskline: a JDBC-backed background job scheduler with an OAuth
 * credential lifecycle manager.
 *
 * <h2>Core Design</h2>
 * <p>Jobs are rows in a single table. A {@linkplain io.taskline.scheduler.JobScheduler scheduler}
 * ticks on a fixed delay, claims due PENDING jobs with an atomic status update, and runs them
 * on a bounded worker pool. Handlers are looked up by job type in a
 * {@linkplain io.taskline.registry.HandlerRegistry registry} and return a {@link io.taskline.JobResult}.
 * Transient failures are retried with exponential backoff until {@code maxAttempts};
 * permanent and authorization failures end the job at once.
 *
 * <p>A {@linkplain io.taskline.recurring.RecurringJobRegistry recurring registry} enqueues
 * system jobs on fixed cadences. The
 * {@linkplain io.taskline.credential.TokenRefreshManager token refresh manager} hands out
 * valid access tokens to handlers, refreshing them before they expire.
 *
 * <h2>Module Layout</h2>
 * <ul>
 *   <li><b>taskline-core</b>: model, SPIs, scheduler, registries, credential and OAuth state management</li>
 *   <li><b>taskline-jdbc</b>: JDBC stores for H2, MySQL and PostgreSQL</li>
 *   <li><b>taskline-micrometer</b>: Micrometer metrics exporter</li>
 *   <li><b>taskline-spring-boot-starter</b>: Spring Boot auto-configuration</li>
 * </ul>
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * var connProvider = new DataSourceConnectionProvider(dataSource);
 * var jobStore     = JdbcJobStores.detect(dataSource);
 * var registry     = new DefaultHandlerRegistry()
 *     .register(StandardJobType.SCHEDULED_POST, ctx -> {
 *         String token = refreshManager.getValidToken(ctx.ownerId(), "linkedin");
 *         publisher.publish(token, ctx.payload());
 *         return JobResult.ok();
 *     });
 *
 * try (Taskline taskline = Taskline.builder()
 *     .connectionProvider(connProvider)
 *     .jobStore(jobStore)
 *     .runStore(new JdbcRecurringRunStore())
 *     .handlerRegistry(registry)
 *     .build()) {
 *   taskline.start();
 *   new JobAdmin(connProvider, jobStore, Clock.systemUTC(), taskline)
 *       .schedulePost("user-42", "{\"postId\":\"p-1\"}", Instant.now().plusSeconds(3600));
 * }
 * }</pre>
 */
package io.taskline;
