package com.courtbot.sms.app.util;

import com.courtbot.sms.app.exception.SenderBusyException;
import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * One mutual-exclusion scope per sender. Messages from different senders never contend; messages
 * from the same sender run one at a time. Entries are dropped once no thread holds or waits on
 * them.
 */
public class SenderLockRegistry {

  private static final class Entry {
    final ReentrantLock lock = new ReentrantLock();
    int users;
  }

  private final ConcurrentHashMap<String, Entry> locks = new ConcurrentHashMap<>();
  private final Duration timeout;

  public SenderLockRegistry(Duration timeout) {
    this.timeout = timeout;
  }

  public <T> T withLock(String sender, Supplier<T> action) {
    Entry entry = retain(sender);
    boolean acquired = false;
    try {
      acquired = entry.lock.tryLock(timeout.toMillis(), TimeUnit.MILLISECONDS);
      if (!acquired) {
        throw new SenderBusyException(
            "Timed out after " + timeout.toMillis() + "ms waiting for " + PhoneMasker.mask(sender));
      }
      return action.get();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new SenderBusyException("Interrupted waiting for " + PhoneMasker.mask(sender));
    } finally {
      if (acquired) entry.lock.unlock();
      release(sender);
    }
  }

  /** Number of senders currently holding or waiting on a lock. */
  public int activeSenders() {
    return locks.size();
  }

  private Entry retain(String sender) {
    return locks.compute(
        sender,
        (k, e) -> {
          Entry x = e == null ? new Entry() : e;
          x.users++;
          return x;
        });
  }

  private void release(String sender) {
    locks.computeIfPresent(sender, (k, e) -> --e.users == 0 ? null : e);
  }
}
