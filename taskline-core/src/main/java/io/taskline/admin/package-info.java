/**
 * In-process administration of jobs and the scheduler.
 */
package io.taskline.admin;
