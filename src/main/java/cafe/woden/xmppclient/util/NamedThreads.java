package cafe.woden.xmppclient.util;

import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/** Shared helpers for creating app-owned executors on named daemon threads. */
public final class NamedThreads {

  private NamedThreads() {}

  public static ThreadFactory namedFactory(String baseName) {
    String base = normalize(baseName);
    AtomicInteger seq = new AtomicInteger(1);
    return r -> {
      Thread t = new Thread(r, base + "-" + seq.getAndIncrement());
      t.setDaemon(true);
      return t;
    };
  }

  public static ExecutorService newSingleThreadExecutor(String baseName) {
    return Executors.newSingleThreadExecutor(namedFactory(baseName));
  }

  public static ScheduledExecutorService newSingleThreadScheduledExecutor(String baseName) {
    return Executors.newSingleThreadScheduledExecutor(namedFactory(baseName));
  }

  private static String normalize(String baseName) {
    String base = Objects.toString(baseName, "").trim();
    return base.isEmpty() ? "xmpp-presence" : base;
  }
}
