package io.b2mash.b2b.digestengine.history;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Predicate;

/**
 * Append-only history capped at a fixed capacity. Once full, every append evicts the oldest entry
 * (FIFO). Entries are never mutated or removed individually.
 *
 * @param <T> immutable entry type
 */
public class BoundedLog<T> {

  private final int capacity;
  private final Deque<T> entries;
  private final ReentrantLock lock = new ReentrantLock();
  private long evicted;

  public BoundedLog(int capacity) {
    if (capacity <= 0) {
      throw new IllegalArgumentException("capacity must be positive, was " + capacity);
    }
    this.capacity = capacity;
    this.entries = new ArrayDeque<>(capacity);
  }

  public void append(T entry) {
    lock.lock();
    try {
      entries.addLast(entry);
      while (entries.size() > capacity) {
        entries.removeFirst();
        evicted++;
      }
    } finally {
      lock.unlock();
    }
  }

  /** Entries oldest first. */
  public List<T> snapshot() {
    lock.lock();
    try {
      return List.copyOf(entries);
    } finally {
      lock.unlock();
    }
  }

  /** Entries newest first, at most {@code limit}, matching {@code filter}. */
  public List<T> recent(Predicate<? super T> filter, int limit) {
    lock.lock();
    try {
      var result = new ArrayList<T>(Math.min(limit, entries.size()));
      var it = entries.descendingIterator();
      while (it.hasNext() && result.size() < limit) {
        T entry = it.next();
        if (filter.test(entry)) {
          result.add(entry);
        }
      }
      return List.copyOf(result);
    } finally {
      lock.unlock();
    }
  }

  public List<T> recent(int limit) {
    return recent(entry -> true, limit);
  }

  public int size() {
    lock.lock();
    try {
      return entries.size();
    } finally {
      lock.unlock();
    }
  }

  public long evictedCount() {
    lock.lock();
    try {
      return evicted;
    } finally {
      lock.unlock();
    }
  }

  public int capacity() {
    return capacity;
  }
}
