/**
 * Job type to handler lookup.
 */
package io.taskline.registry;
