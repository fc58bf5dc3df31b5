package socs.routing.sim;

import socs.routing.node.Router;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs every router's tick hook once per tick, either one after the other on the calling thread
 * or concurrently on a pool of worker threads. The next tick never starts before every router has
 * finished the current one.
 */
class TickScheduler {
  private final int threads;
  private final Random shuffle;
  private ExecutorService pool;

  /**
   * @param threads worker threads, or 1 to tick on the calling thread
   * @param shuffle source of a fresh router order for every tick, or null for a fixed order
   */
  TickScheduler(int threads, Random shuffle) {
    if (threads < 1) {
      throw new IllegalArgumentException("need at least one tick thread, got " + threads);
    }
    this.threads = threads;
    this.shuffle = shuffle;
  }

  void start() {
    if (pool != null || threads == 1) {
      return;
    }
    AtomicInteger count = new AtomicInteger();
    pool = Executors.newFixedThreadPool(threads, r -> {
      Thread t = new Thread(r, "router-tick-" + count.incrementAndGet());
      // never keep the JVM alive for an abandoned simulation
      t.setDaemon(true);
      return t;
    });
  }

  void runTick(List<Router> routers) {
    List<Router> order = routers;
    if (shuffle != null) {
      order = new ArrayList<Router>(routers);
      Collections.shuffle(order, shuffle);
    }

    if (pool == null) {
      for (Router router : order) {
        router.runOneTick();
      }
      return;
    }

    List<Future<?>> pending = new ArrayList<Future<?>>();
    for (Router router : order) {
      pending.add(pool.submit(router::runOneTick));
    }
    for (Future<?> f : pending) {
      try {
        f.get();
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new IllegalStateException("interrupted while waiting for routers to tick", e);
      } catch (ExecutionException e) {
        Throwable cause = e.getCause();
        if (cause instanceof RuntimeException) {
          throw (RuntimeException) cause;
        }
        if (cause instanceof Error) {
          throw (Error) cause;
        }
        throw new IllegalStateException("router tick failed", cause);
      }
    }
  }

  void stop() {
    if (pool != null) {
      pool.shutdownNow();
      pool = null;
    }
  }
}
