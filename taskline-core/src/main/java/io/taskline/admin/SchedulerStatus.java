package io.taskline.admin;

import io.taskline.model.JobStatus;
import io.taskline.recurring.RecurringJobStatus;

import java.util.List;
import java.util.Map;

/**
 * Point-in-time view of the scheduler.
 *
 * @param running      {@code true} if the scheduler loop is ticking
 * @param activeJobs   handlers currently executing in this process
 * @param recurring    recurring definitions with their last and next run times
 * @param statusCounts job counts for every status
 */
public record SchedulerStatus(
    boolean running,
    int activeJobs,
    List<RecurringJobStatus> recurring,
    Map<JobStatus, Long> statusCounts) {

  public SchedulerStatus {
    recurring = List.copyOf(recurring);
    statusCounts = Map.copyOf(statusCounts);
  }
}
