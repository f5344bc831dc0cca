package io.taskline.testing;

import io.taskline.spi.ConnectionProvider;

import java.lang.reflect.Proxy;
import java.sql.Connection;
import java.time.Duration;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.fail;

public final class Stubs {
  private Stubs() {
  }

  /**
   * Connection provider whose connections accept and ignore every call.
   */
  public static ConnectionProvider stubCp() {
    return () -> (Connection) Proxy.newProxyInstance(
        Connection.class.getClassLoader(),
        new Class<?>[]{Connection.class},
        (proxy, method, args) -> null);
  }

  /**
   * Polls until the condition holds.
   */
  public static void awaitTrue(BooleanSupplier condition, Duration timeout, String description) {
    long deadline = System.nanoTime() + timeout.toNanos();
    while (!condition.getAsBoolean()) {
      if (System.nanoTime() > deadline) {
        fail("Timed out waiting for: " + description);
      }
      try {
        Thread.sleep(10);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        fail("Interrupted waiting for: " + description);
      }
    }
  }
}
