package com.bulkload.pipeline;

import com.bulkload.BulkLoadException;
import java.util.ArrayDeque;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Bounded hand-off between pipeline stages.
 *
 * Producers block in {@link #put} while the queue is full, consumers block in
 * {@link #take} while it is empty. {@link #close} is the only end-of-input
 * signal: once closed and drained, {@code take} returns null to every
 * consumer. {@link #abort} tears the hand-off down from either side, waking
 * all blocked threads with a {@link BulkLoadException}.
 */
public class BoundedQueue<T> {

  private final ArrayDeque<T> items;
  private final int capacity;
  private final ReentrantLock lock = new ReentrantLock();
  private final Condition notEmpty = lock.newCondition();
  private final Condition notFull = lock.newCondition();

  private boolean closed;
  private Throwable failure;

  public BoundedQueue(int capacity) {
    if (capacity < 1) {
      throw new IllegalArgumentException("capacity must be >= 1: " + capacity);
    }
    this.capacity = capacity;
    this.items = new ArrayDeque<>(capacity);
  }

  /** Blocks until there is room, then enqueues. */
  public void put(T item) throws InterruptedException {
    if (item == null) {
      throw new NullPointerException("item");
    }
    lock.lockInterruptibly();
    try {
      while (items.size() == capacity && failure == null) {
        notFull.await();
      }
      checkNotAborted();
      if (closed) {
        throw new IllegalStateException("put on closed queue");
      }
      items.addLast(item);
      notEmpty.signal();
    } finally {
      lock.unlock();
    }
  }

  /**
   * Blocks until an item is available.
   *
   * @return the next item, or null once the queue is closed and empty
   */
  public T take() throws InterruptedException {
    lock.lockInterruptibly();
    try {
      while (items.isEmpty() && !closed && failure == null) {
        notEmpty.await();
      }
      checkNotAborted();
      T item = items.pollFirst();
      if (item != null) {
        notFull.signal();
      }
      return item;
    } finally {
      lock.unlock();
    }
  }

  /** Marks end of input. Call once, from the side that owns all producers. */
  public void close() {
    lock.lock();
    try {
      if (closed) {
        throw new IllegalStateException("queue already closed");
      }
      closed = true;
      notEmpty.signalAll();
    } finally {
      lock.unlock();
    }
  }

  /** Fails every current and future put/take. The first cause is kept. */
  public void abort(Throwable cause) {
    lock.lock();
    try {
      if (failure == null) {
        failure = cause;
      }
      items.clear();
      notEmpty.signalAll();
      notFull.signalAll();
    } finally {
      lock.unlock();
    }
  }

  public boolean isAborted() {
    lock.lock();
    try {
      return failure != null;
    } finally {
      lock.unlock();
    }
  }

  /** Cause passed to the first {@link #abort}, or null. */
  public Throwable failure() {
    lock.lock();
    try {
      return failure;
    } finally {
      lock.unlock();
    }
  }

  public int size() {
    lock.lock();
    try {
      return items.size();
    } finally {
      lock.unlock();
    }
  }

  private void checkNotAborted() {
    if (failure != null) {
      throw new BulkLoadException("pipeline aborted: " + failure, failure);
    }
  }
}
