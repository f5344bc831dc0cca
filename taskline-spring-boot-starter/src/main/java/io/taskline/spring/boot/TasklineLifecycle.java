package io.taskline.spring.boot;

import io.taskline.Taskline;
import org.springframework.context.SmartLifecycle;

/**
 * Starts {@link Taskline} after the application context is refreshed and stops it before
 * singletons are destroyed.
 */
public class TasklineLifecycle implements SmartLifecycle {

  private final Taskline taskline;

  public TasklineLifecycle(Taskline taskline) {
    this.taskline = taskline;
  }

  @Override
  public void start() {
    taskline.start();
  }

  @Override
  public void stop() {
    taskline.stop();
  }

  @Override
  public boolean isRunning() {
    return taskline.isRunning();
  }
}
