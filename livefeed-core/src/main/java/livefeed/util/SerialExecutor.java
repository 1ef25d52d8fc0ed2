package livefeed.util;

import java.util.ArrayDeque;
import java.util.Objects;
import java.util.Queue;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs tasks one at a time, in submission order, on a shared executor.
 *
 * <p>Many lanes can share one pool: tasks of one lane never overlap or reorder, while
 * different lanes run independently.
 */
public final class SerialExecutor implements Executor {
  private static final Logger logger = Logger.getLogger(SerialExecutor.class.getName());

  private final Executor executor;
  private final Queue<Runnable> tasks = new ArrayDeque<>();
  private Runnable active;

  public SerialExecutor(Executor executor) {
    this.executor = Objects.requireNonNull(executor, "executor");
  }

  @Override
  public synchronized void execute(Runnable task) {
    Objects.requireNonNull(task, "task");
    tasks.add(() -> {
      try {
        task.run();
      } finally {
        scheduleNext();
      }
    });
    if (active == null) {
      scheduleNext();
    }
  }

  private synchronized void scheduleNext() {
    active = tasks.poll();
    if (active == null) {
      return;
    }
    try {
      executor.execute(active);
    } catch (RejectedExecutionException e) {
      logger.log(Level.FINE, "Executor rejected task, dropping {0} queued task(s)", tasks.size() + 1);
      tasks.clear();
      active = null;
    }
  }
}
