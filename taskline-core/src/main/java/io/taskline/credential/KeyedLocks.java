package io.taskline.credential;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * One lock per key. A key's lock exists only while some thread holds or waits for it,
 * so the map stays bounded by the number of keys in use.
 */
final class KeyedLocks<K> {
  private final Map<K, Entry> locks = new ConcurrentHashMap<>();

  <T> T withLock(K key, Supplier<T> action) {
    // users is only read and written inside compute, which is atomic per key
    Entry entry = locks.compute(key, (k, existing) -> {
      Entry e = existing != null ? existing : new Entry();
      e.users++;
      return e;
    });
    entry.lock.lock();
    try {
      return action.get();
    } finally {
      entry.lock.unlock();
      locks.computeIfPresent(key, (k, e) -> --e.users == 0 ? null : e);
    }
  }

  boolean hasWaiters(K key) {
    Entry entry = locks.get(key);
    return entry != null && entry.lock.hasQueuedThreads();
  }

  int size() {
    return locks.size();
  }

  private static final class Entry {
    final ReentrantLock lock = new ReentrantLock();
    int users;
  }
}
