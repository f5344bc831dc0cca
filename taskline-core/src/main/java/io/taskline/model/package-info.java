/**
 * Persisted records: jobs, credentials and OAuth states, with their status enums.
 */
package io.taskline.model;
