package com.courtbot.sms.app.util;

import static org.junit.jupiter.api.Assertions.*;

import com.courtbot.sms.app.exception.SenderBusyException;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

class SenderLockRegistryTest {

  @Test
  void sameSenderRunsOneAtATime() throws Exception {
    SenderLockRegistry registry = new SenderLockRegistry(Duration.ofSeconds(5));
    AtomicInteger inside = new AtomicInteger();
    AtomicInteger maxInside = new AtomicInteger();
    ExecutorService pool = Executors.newFixedThreadPool(6);
    try {
      CountDownLatch start = new CountDownLatch(1);
      Future<?>[] futures = new Future<?>[6];
      for (int i = 0; i < futures.length; i++) {
        futures[i] =
            pool.submit(
                () -> {
                  start.await();
                  return registry.withLock(
                      "+15551230000",
                      () -> {
                        maxInside.accumulateAndGet(inside.incrementAndGet(), Math::max);
                        sleep(10);
                        inside.decrementAndGet();
                        return null;
                      });
                });
      }
      start.countDown();
      for (Future<?> f : futures) f.get(10, TimeUnit.SECONDS);
    } finally {
      pool.shutdownNow();
    }
    assertEquals(1, maxInside.get());
    assertEquals(0, registry.activeSenders());
  }

  @Test
  void busySenderTimesOut() throws Exception {
    SenderLockRegistry registry = new SenderLockRegistry(Duration.ofMillis(50));
    CountDownLatch held = new CountDownLatch(1);
    CountDownLatch release = new CountDownLatch(1);
    Thread holder =
        new Thread(
            () ->
                registry.withLock(
                    "+15551230001",
                    () -> {
                      held.countDown();
                      await(release);
                      return null;
                    }));
    holder.start();
    try {
      assertTrue(held.await(5, TimeUnit.SECONDS));
      assertThrows(
          SenderBusyException.class, () -> registry.withLock("+15551230001", () -> "never"));
      assertEquals("other", registry.withLock("+15551230002", () -> "other"));
    } finally {
      release.countDown();
      holder.join(5000);
    }
    assertEquals(0, registry.activeSenders());
  }

  private static void sleep(long ms) {
    try {
      Thread.sleep(ms);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
  }

  private static void await(CountDownLatch latch) {
    try {
      latch.await(5, TimeUnit.SECONDS);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
  }
}
