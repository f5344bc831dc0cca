/**
 * Handlers for the built-in system job types.
 */
package io.taskline.jobs;
