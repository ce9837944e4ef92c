package com.solanaeda.eventbus.connection;

import com.rabbitmq.client.BlockedListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Tracks broker {@code connection.blocked} / {@code connection.unblocked} notifications so
 * publishers can wait for the broker to drain instead of piling frames onto a blocked socket.
 */
final class FlowControl implements BlockedListener {
  private static final Logger log = LoggerFactory.getLogger(FlowControl.class);

  private final ReentrantLock lock = new ReentrantLock();
  private final Condition unblocked = lock.newCondition();
  private boolean blocked;

  @Override
  public void handleBlocked(String reason) {
    lock.lock();
    try {
      blocked = true;
    } finally {
      lock.unlock();
    }
    log.warn("Broker blocked publishing on this connection: {}", reason);
  }

  @Override
  public void handleUnblocked() {
    release();
    log.info("Broker unblocked publishing on this connection");
  }

  void release() {
    lock.lock();
    try {
      blocked = false;
      unblocked.signalAll();
    } finally {
      lock.unlock();
    }
  }

  boolean isBlocked() {
    lock.lock();
    try {
      return blocked;
    } finally {
      lock.unlock();
    }
  }

  boolean awaitWritable(Duration timeout) throws InterruptedException {
    long remaining = timeout.toNanos();
    lock.lock();
    try {
      while (blocked) {
        if (remaining <= 0) return false;
        remaining = unblocked.awaitNanos(remaining);
      }
      return true;
    } finally {
      lock.unlock();
    }
  }
}
