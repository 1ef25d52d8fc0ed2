package livefeed.util;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class SerialExecutorTest {
  private final ExecutorService pool = Executors.newFixedThreadPool(4, new DaemonThreadFactory("test-lane-"));

  @AfterEach
  void tearDown() {
    pool.shutdownNow();
  }

  @Test
  void runsTasksInSubmissionOrderWithoutOverlap() throws Exception {
    SerialExecutor lane = new SerialExecutor(pool);
    List<Integer> seen = new CopyOnWriteArrayList<>();
    AtomicInteger running = new AtomicInteger();
    CountDownLatch done = new CountDownLatch(100);

    for (int i = 0; i < 100; i++) {
      int n = i;
      lane.execute(() -> {
        assertEquals(1, running.incrementAndGet());
        seen.add(n);
        running.decrementAndGet();
        done.countDown();
      });
    }

    assertTrue(done.await(5, TimeUnit.SECONDS));
    for (int i = 0; i < 100; i++) {
      assertEquals(i, seen.get(i));
    }
  }

  @Test
  void blockedLaneDoesNotHoldUpAnother() throws Exception {
    SerialExecutor blocked = new SerialExecutor(pool);
    SerialExecutor free = new SerialExecutor(pool);
    CountDownLatch release = new CountDownLatch(1);
    CountDownLatch ran = new CountDownLatch(1);

    blocked.execute(() -> {
      try {
        release.await();
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
    });
    free.execute(ran::countDown);

    assertTrue(ran.await(2, TimeUnit.SECONDS));
    release.countDown();
  }

  @Test
  void failingTaskDoesNotStallLane() throws Exception {
    ExecutorService single = Executors.newSingleThreadExecutor(new DaemonThreadFactory("test-fail-"));
    try {
      SerialExecutor lane = new SerialExecutor(single);
      CountDownLatch after = new CountDownLatch(1);

      lane.execute(() -> {
        throw new IllegalStateException("boom");
      });
      lane.execute(after::countDown);

      assertTrue(after.await(2, TimeUnit.SECONDS));
    } finally {
      single.shutdownNow();
    }
  }

  @Test
  void daemonThreadFactoryNamesThreads() {
    DaemonThreadFactory factory = new DaemonThreadFactory("worker-");

    Thread first = factory.newThread(() -> {});
    Thread second = factory.newThread(() -> {});

    assertEquals("worker-1", first.getName());
    assertEquals("worker-2", second.getName());
    assertTrue(first.isDaemon());
  }
}
