package io.intellixity.paging.exec;

import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/** Default execution contexts for page loads. */
public final class PagingExecutors {
  private PagingExecutors() {}

  private static final class IoHolder {
    static final ExecutorService IO = Executors.newCachedThreadPool(new DaemonThreadFactory("paging-io-"));
  }

  /**
   * Shared background pool for blocking query execution.\n
   *
   * Threads are daemons, so the pool never keeps the JVM alive.\n
   */
  public static Executor io() {
    return IoHolder.IO;
  }

  /** Runs loads on the calling thread (tests, or callers that already sit on a worker thread). */
  public static Executor direct() {
    return Runnable::run;
  }

  private static final class DaemonThreadFactory implements ThreadFactory {
    private final String prefix;
    private final AtomicInteger seq = new AtomicInteger();

    DaemonThreadFactory(String prefix) {
      this.prefix = prefix;
    }

    @Override
    public Thread newThread(Runnable r) {
      Thread t = new Thread(r, prefix + seq.incrementAndGet());
      t.setDaemon(true);
      return t;
    }
  }
}
