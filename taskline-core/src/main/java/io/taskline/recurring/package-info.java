/**
 * Jobs enqueued on fixed cadences.
 *
 * <p>{@link io.taskline.recurring.CadenceRule} computes due times from the persisted last
 * run, so schedules survive restarts without drift. {@link io.taskline.recurring.DefaultRecurringJobs}
 * lists the built-in system jobs.
 */
package io.taskline.recurring;
