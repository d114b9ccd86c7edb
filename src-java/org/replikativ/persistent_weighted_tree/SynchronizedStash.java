package org.replikativ.persistent_weighted_tree;

import java.util.concurrent.locks.*;

/**
 * Stash shared between threads. Every bookkeeping call, reads included
 * (slot arrays grow on allocation), runs under one lock.
 */
public class SynchronizedStash<Key> extends Stash<Key> {
  private final ReentrantLock _lock = new ReentrantLock();

  public SynchronizedStash() {
    this(false);
  }

  public SynchronizedStash(boolean intern) {
    super(intern);
  }

  @Override
  public Location allocate(Key key, int level, Location left, Location right, Object[] measure) {
    _lock.lock();
    try {
      return super.allocate(key, level, left, right, measure);
    } finally {
      _lock.unlock();
    }
  }

  @Override
  public Node<Key> get(Location location) {
    _lock.lock();
    try {
      return super.get(location);
    } finally {
      _lock.unlock();
    }
  }

  @Override
  public void retain(Location location) {
    _lock.lock();
    try {
      super.retain(location);
    } finally {
      _lock.unlock();
    }
  }

  @Override
  public void release(Location location) {
    _lock.lock();
    try {
      super.release(location);
    } finally {
      _lock.unlock();
    }
  }

  @Override
  public int refCount(Location location) {
    _lock.lock();
    try {
      return super.refCount(location);
    } finally {
      _lock.unlock();
    }
  }

  @Override
  public int live() {
    _lock.lock();
    try {
      return super.live();
    } finally {
      _lock.unlock();
    }
  }

  @Override
  public long allocations() {
    _lock.lock();
    try {
      return super.allocations();
    } finally {
      _lock.unlock();
    }
  }
}
