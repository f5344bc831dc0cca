package io.taskline.recurring;

import io.taskline.StandardJobType;
import io.taskline.model.Job;
import io.taskline.model.JobStatus;
import io.taskline.testing.MutableClock;
import io.taskline.testing.StubJobStore;
import io.taskline.testing.StubRecurringRunStore;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static io.taskline.testing.Stubs.stubCp;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RecurringJobRegistryTest {
  private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

  private final StubJobStore jobStore = new StubJobStore();
  private final StubRecurringRunStore runStore = new StubRecurringRunStore();
  private final MutableClock clock = new MutableClock(NOW);

  private static final RecurringJobDefinition SWEEP = RecurringJobDefinition.of(
      "token-refresh-sweep", CadenceRule.every(Duration.ofHours(6)), StandardJobType.TOKEN_REFRESH);

  @Test
  void dueIntervalEnqueuesExactlyOneJobAndAdvancesLastRun() {
    runStore.put(SWEEP.id(), NOW.minus(Duration.ofHours(7)));
    RecurringJobRegistry registry = newRegistry(SWEEP);

    int enqueued = registry.tick(NOW);

    assertEquals(1, enqueued);
    List<Job> jobs = jobStore.all();
    assertEquals(1, jobs.size());
    Job job = jobs.get(0);
    assertEquals("token_refresh", job.jobType());
    assertEquals("system", job.ownerId());
    assertEquals(JobStatus.PENDING, job.status());
    assertEquals(NOW, job.scheduledTime());
    assertEquals(NOW, runStore.get(SWEEP.id()));
  }

  @Test
  void secondTickAtSameTimeEnqueuesNothing() {
    runStore.put(SWEEP.id(), NOW.minus(Duration.ofHours(7)));
    RecurringJobRegistry registry = newRegistry(SWEEP);

    registry.tick(NOW);
    int enqueued = registry.tick(NOW.plusSeconds(60));

    assertEquals(0, enqueued);
    assertEquals(1, jobStore.all().size());
  }

  @Test
  void notYetDueEnqueuesNothing() {
    Instant lastRun = NOW.minus(Duration.ofHours(5));
    runStore.put(SWEEP.id(), lastRun);
    RecurringJobRegistry registry = newRegistry(SWEEP);

    assertEquals(0, registry.tick(NOW));
    assertEquals(lastRun, runStore.get(SWEEP.id()));
  }

  @Test
  void manyMissedOccurrencesEnqueueOnce() {
    runStore.put(SWEEP.id(), NOW.minus(Duration.ofDays(3)));
    RecurringJobRegistry registry = newRegistry(SWEEP);

    assertEquals(1, registry.tick(NOW));
    assertEquals(1, jobStore.all().size());
  }

  @Test
  void firstSightingRegistersWithoutEnqueueing() {
    RecurringJobRegistry registry = newRegistry(SWEEP);

    assertEquals(0, registry.tick(NOW));

    assertEquals(NOW, runStore.get(SWEEP.id()));
    assertTrue(jobStore.all().isEmpty());
    assertEquals(1, registry.tick(NOW.plus(Duration.ofHours(6))));
  }

  @Test
  void lostCompareAndSetEnqueuesNothing() {
    StubRecurringRunStore racing = new StubRecurringRunStore() {
      @Override
      public synchronized int advance(Connection conn, String definitionId, Instant expected, Instant lastRunTime) {
        return 0;
      }
    };
    racing.put(SWEEP.id(), NOW.minus(Duration.ofHours(7)));
    RecurringJobRegistry registry = RecurringJobRegistry.builder()
        .connectionProvider(stubCp())
        .jobStore(jobStore)
        .runStore(racing)
        .definition(SWEEP)
        .build();

    assertEquals(0, registry.tick(NOW));
    assertTrue(jobStore.all().isEmpty());
  }

  @Test
  void failingDefinitionDoesNotBlockOthers() {
    RecurringJobDefinition broken = RecurringJobDefinition.of(
        "broken", CadenceRule.every(Duration.ofHours(1)), StandardJobType.ANALYTICS_SYNC);
    StubRecurringRunStore flaky = new StubRecurringRunStore() {
      @Override
      public synchronized Optional<Instant> lastRunTime(Connection conn, String definitionId) {
        if (definitionId.equals("broken")) {
          throw new IllegalStateException("row locked");
        }
        return super.lastRunTime(conn, definitionId);
      }
    };
    flaky.put(SWEEP.id(), NOW.minus(Duration.ofHours(7)));
    RecurringJobRegistry registry = RecurringJobRegistry.builder()
        .connectionProvider(stubCp())
        .jobStore(jobStore)
        .runStore(flaky)
        .definition(broken)
        .definition(SWEEP)
        .build();

    assertEquals(1, registry.tick(NOW));
  }

  @Test
  void statusReportsLastRunAndNextDue() {
    RecurringJobDefinition cleanup = RecurringJobDefinition.of(
        "retention-cleanup", CadenceRule.every(Duration.ofDays(7)), StandardJobType.CLEANUP);
    runStore.put(SWEEP.id(), NOW);
    RecurringJobRegistry registry = newRegistry(SWEEP, cleanup);

    List<RecurringJobStatus> status = registry.status();

    assertEquals(2, status.size());
    assertEquals(NOW, status.get(0).lastRunTime());
    assertEquals(NOW.plus(Duration.ofHours(6)), status.get(0).nextDue());
    assertEquals("every 6h", status.get(0).cadence());
    assertNull(status.get(1).lastRunTime());
    assertNull(status.get(1).nextDue());
  }

  @Test
  void clockDrivenTickUsesInjectedClock() {
    runStore.put(SWEEP.id(), NOW.minus(Duration.ofHours(7)));
    RecurringJobRegistry registry = newRegistry(SWEEP);

    registry.tick();

    assertEquals(NOW, runStore.get(SWEEP.id()));
  }

  @Test
  void rejectsDuplicateDefinitionIds() {
    assertThrows(IllegalStateException.class, () -> RecurringJobRegistry.builder()
        .definition(SWEEP)
        .definition(SWEEP.withPayload("{}")));
  }

  private RecurringJobRegistry newRegistry(RecurringJobDefinition... definitions) {
    return RecurringJobRegistry.builder()
        .connectionProvider(stubCp())
        .jobStore(jobStore)
        .runStore(runStore)
        .clock(clock)
        .definitions(List.of(definitions))
        .build();
  }
}
