package io.neotool.kafka.consumer.common.utils;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.apache.kafka.common.internals.FatalExitError;
import org.apache.kafka.common.utils.Exit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * ShutdownableThread runs {@link #doWork()} in a loop until shutdown is initiated.
 *
 * <p>Modeled after Kafka's server ShutdownableThread: {@link #initiateShutdown()} flips the running
 * flag (and interrupts the thread when interruptible), {@link #awaitShutdown()} blocks until the
 * loop has exited. A {@link FatalExitError} thrown by {@code doWork} terminates the process.
 */
public abstract class ShutdownableThread extends Thread {
  protected final Logger log = LoggerFactory.getLogger(getClass());

  private final boolean isInterruptible;
  private final CountDownLatch shutdownInitiated = new CountDownLatch(1);
  private final CountDownLatch shutdownComplete = new CountDownLatch(1);
  private volatile boolean isStarted = false;

  public ShutdownableThread(String name) {
    this(name, true);
  }

  public ShutdownableThread(String name, boolean isInterruptible) {
    super(name);
    this.isInterruptible = isInterruptible;
    this.setDaemon(false);
  }

  /** Initiates shutdown and blocks until the work loop has exited. */
  public void shutdown() throws InterruptedException {
    initiateShutdown();
    awaitShutdown();
  }

  public boolean isShutdownInitiated() {
    return shutdownInitiated.getCount() == 0;
  }

  public boolean isShutdownComplete() {
    return shutdownComplete.getCount() == 0;
  }

  /** @return true if there has been an unexpected error and the thread shut down */
  public boolean isThreadFailed() {
    return isShutdownComplete() && !isShutdownInitiated();
  }

  /** @return true if this call initiated the shutdown. */
  public synchronized boolean initiateShutdown() {
    if (isRunning()) {
      log.info("shutting down {}", getName());
      shutdownInitiated.countDown();
      if (isInterruptible) {
        interrupt();
      }
      return true;
    }
    return false;
  }

  /** After calling initiateShutdown(), use this API to wait until the shutdown is complete. */
  public void awaitShutdown() throws InterruptedException {
    if (!isShutdownInitiated()) {
      throw new IllegalStateException("initiateShutdown() was not called before awaitShutdown()");
    }
    if (isStarted) {
      shutdownComplete.await();
    }
    log.info("shutdown completed");
  }

  /**
   * Causes the current thread to wait until the shutdown is initiated, or the specified waiting
   * time elapses.
   */
  public void pause(long timeout, TimeUnit unit) throws InterruptedException {
    if (shutdownInitiated.await(timeout, unit)) {
      log.trace("shutdownInitiated latch count reached zero, shutdown called");
    }
  }

  /** This method is repeatedly invoked until the thread shuts down or this method throws. */
  public abstract void doWork();

  @Override
  public void run() {
    isStarted = true;
    log.info("starting");
    try {
      while (isRunning()) {
        doWork();
      }
    } catch (FatalExitError e) {
      shutdownInitiated.countDown();
      shutdownComplete.countDown();
      log.info("stopped");
      Exit.exit(e.statusCode());
    } catch (Throwable e) {
      if (isRunning()) {
        log.error("error due to", e);
      }
    } finally {
      shutdownComplete.countDown();
    }
    log.info("stopped");
  }

  public boolean isRunning() {
    return !isShutdownInitiated();
  }
}
