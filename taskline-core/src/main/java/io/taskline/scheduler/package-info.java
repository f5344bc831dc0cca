/**
 * The scheduler loop and its retry policy.
 *
 * @see io.taskline.scheduler.JobScheduler
 */
package io.taskline.scheduler;
