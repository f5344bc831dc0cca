/**
 * Spring Boot auto-configuration for the job scheduler and credential lifecycle.
 *
 * <p>{@link io.taskline.spring.boot.TasklineAutoConfiguration} wires a
 * {@link io.taskline.Taskline} instance from {@code taskline.*} application properties.
 * Register job handlers and provider refresh calls as
 * {@link io.taskline.spring.boot.JobHandlerBinding} and
 * {@link io.taskline.spring.boot.ProviderRefresherBinding} beans.
 *
 * @see io.taskline.spring.boot.TasklineAutoConfiguration
 * @see io.taskline.spring.boot.TasklineProperties
 */
package io.taskline.spring.boot;
