package io.upreview.backend.invitation;

import io.upreview.backend.token.ReviewLinkProperties;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Fixed-size worker pool shared by all invitation batches. Shut down with the application context;
 * in-flight sends get a grace period before being interrupted.
 */
@Component
public class DispatchExecutor implements DisposableBean {

  private static final Logger log = LoggerFactory.getLogger(DispatchExecutor.class);
  private static final long SHUTDOWN_GRACE_SECONDS = 30;

  private final ExecutorService executor;
  private final int poolSize;

  @Autowired
  public DispatchExecutor(ReviewLinkProperties properties) {
    this(properties.dispatchConcurrency());
  }

  DispatchExecutor(int poolSize) {
    var threadCount = new AtomicInteger();
    this.poolSize = poolSize;
    this.executor =
        Executors.newFixedThreadPool(
            poolSize,
            r -> {
              Thread t = new Thread(r, "invitation-dispatch-" + threadCount.incrementAndGet());
              t.setDaemon(true);
              return t;
            });
  }

  public Future<?> submit(Runnable task) {
    return executor.submit(task);
  }

  public int poolSize() {
    return poolSize;
  }

  @Override
  public void destroy() {
    executor.shutdown();
    try {
      if (!executor.awaitTermination(SHUTDOWN_GRACE_SECONDS, TimeUnit.SECONDS)) {
        log.warn(
            "Invitation dispatch did not finish within {}s, interrupting",
            SHUTDOWN_GRACE_SECONDS);
        executor.shutdownNow();
      }
    } catch (InterruptedException e) {
      executor.shutdownNow();
      Thread.currentThread().interrupt();
    }
  }
}
