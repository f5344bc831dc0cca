package io.taskline;

import io.taskline.model.Job;
import io.taskline.model.JobStatus;
import io.taskline.recurring.CadenceRule;
import io.taskline.recurring.DefaultRecurringJobs;
import io.taskline.recurring.RecurringJobDefinition;
import io.taskline.registry.DefaultHandlerRegistry;
import io.taskline.spi.MetricsExporter;
import io.taskline.testing.MutableClock;
import io.taskline.testing.StubJobStore;
import io.taskline.testing.StubRecurringRunStore;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static io.taskline.testing.Stubs.awaitTrue;
import static io.taskline.testing.Stubs.stubCp;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TasklineTest {
  private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

  private final MutableClock clock = new MutableClock(NOW);
  private final StubJobStore jobStore = new StubJobStore();
  private final StubRecurringRunStore runStore = new StubRecurringRunStore();

  // ── Builder validation ──────────────────────────────────────────

  @Test
  void missingHandlerForRecurringJobFailsBuild() {
    Taskline.Builder builder = Taskline.builder()
        .connectionProvider(stubCp())
        .jobStore(jobStore)
        .runStore(runStore)
        .handlerRegistry(new DefaultHandlerRegistry()
            .register(StandardJobType.TOKEN_REFRESH, ctx -> JobResult.ok()))
        .definitions(DefaultRecurringJobs.definitions(ZoneOffset.UTC));

    IllegalStateException e = assertThrows(IllegalStateException.class, builder::build);
    assertTrue(e.getMessage().contains("analytics_sync"), e.getMessage());
    assertTrue(e.getMessage().contains("cleanup"), e.getMessage());
  }

  @Test
  void builderIsSingleUse() {
    Taskline.Builder builder = Taskline.builder()
        .connectionProvider(stubCp())
        .jobStore(jobStore)
        .runStore(runStore)
        .handlerRegistry(new DefaultHandlerRegistry());

    builder.build().close();
    assertThrows(IllegalStateException.class, builder::build);
  }

  @Test
  void requiredComponentsAreChecked() {
    assertThrows(NullPointerException.class, () -> Taskline.builder()
        .connectionProvider(stubCp())
        .jobStore(jobStore)
        .handlerRegistry(new DefaultHandlerRegistry())
        .build());
  }

  // ── End to end ──────────────────────────────────────────────────

  @Test
  void recurringDefinitionIsEnqueuedAndExecuted() {
    runStore.put("hourly-sync", NOW.minus(Duration.ofHours(2)));
    AtomicInteger runs = new AtomicInteger();
    try (Taskline taskline = Taskline.builder()
        .connectionProvider(stubCp())
        .jobStore(jobStore)
        .runStore(runStore)
        .handlerRegistry(new DefaultHandlerRegistry()
            .register(StandardJobType.ANALYTICS_SYNC, ctx -> {
              runs.incrementAndGet();
              return JobResult.ok("{\"synced\":4}");
            }))
        .clock(clock)
        .intervalMs(20)
        .recurringIntervalMs(20)
        .definition(RecurringJobDefinition.of("hourly-sync",
            CadenceRule.every(Duration.ofHours(1)), StandardJobType.ANALYTICS_SYNC))
        .build()) {
      taskline.start();
      assertTrue(taskline.isRunning());

      awaitTrue(() -> jobStore.completeCount.get() == 1, Duration.ofSeconds(5), "sync job completed");

      Job job = jobStore.all().get(0);
      assertEquals(JobStatus.COMPLETED, job.status());
      assertEquals("{\"synced\":4}", job.result());
      assertEquals(NOW, runStore.get("hourly-sync"));
      assertEquals(1, runs.get());
      assertEquals(1, jobStore.all().size());
    }
  }

  @Test
  void closeClosesCloseableMetricsExporter() {
    AtomicBoolean closed = new AtomicBoolean();
    CloseableMetrics metrics = new CloseableMetrics(closed);
    Taskline taskline = Taskline.builder()
        .connectionProvider(stubCp())
        .jobStore(jobStore)
        .runStore(runStore)
        .handlerRegistry(new DefaultHandlerRegistry())
        .metrics(metrics)
        .build();

    taskline.start();
    taskline.close();

    assertTrue(closed.get());
    assertFalse(taskline.isRunning());
  }

  private static final class CloseableMetrics implements MetricsExporter, AutoCloseable {
    private final AtomicBoolean closed;

    CloseableMetrics(AtomicBoolean closed) {
      this.closed = closed;
    }

    @Override
    public void incrementJobsClaimed(int count) {
    }

    @Override
    public void incrementJobsCompleted() {
    }

    @Override
    public void incrementJobsRetried() {
    }

    @Override
    public void incrementJobsFailed() {
    }

    @Override
    public void recordActiveWorkers(int activeWorkers) {
    }

    @Override
    public void close() {
      closed.set(true);
    }
  }
}
