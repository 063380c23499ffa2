/*
 * Copyright © 2011-2024 Chris Vest (mr.chrisvest@gmail.com)
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package stockpot.internal;

import stockpot.Factory;
import stockpot.Loan;
import stockpot.ManagedPool;
import stockpot.Pool;
import stockpot.PoolException;
import stockpot.Timeout;

import java.lang.ref.ReferenceQueue;
import java.util.Objects;
import java.util.concurrent.atomic.LongAdder;

/**
 * The {@link Pool} implementation.
 * <p>
 * A borrow passes the {@link AdmissionGate}, takes a handle from the
 * {@link LoanRecycler}, and fills it with an item from the {@link FreeList},
 * or from the factory if the free-list is empty. A release reverses this,
 * and leaves the gate only once the item and the handle have been put back,
 * so an admitted borrower never observes a half-returned loan.
 * <p>
 * With idle reclamation enabled, the free-list holds its items through soft
 * references. Items the garbage collector reclaims are counted as discarded
 * when their references come off the reclamation queue.
 *
 * @param <T> The item type.
 */
public final class StockPool<T> implements Pool<T>, ManagedPool {
  private final Factory<T> factory;
  private final AdmissionGate gate;
  private final FreeList<IdleItem<T>> items;
  private final ReferenceQueue<T> reclamationQueue;
  private final LoanRecycler<T> handles;
  private final LiveCounter counter;
  private final LeakDetector leakDetector;
  private final LongAdder factoryInvocations;
  private final LongAdder failedFactoryInvocations;
  private final LongAdder discards;
  private final LongAdder reclaims;

  /**
   * Construct a new pool from the given builder, and create its initial
   * population of items.
   * @param builder The pool configuration to use.
   */
  StockPool(PoolBuilderImpl<T> builder) {
    int initial;
    synchronized (builder) {
      builder.validate();
      factory = builder.getFactory();
      int max = builder.getMax().orElse(-1);
      gate = AdmissionGate.forMax(max);
      handles = new LoanRecycler<>(max < 0 ? LoanRecycler.DEFAULT_CAPACITY : max);
      counter = new LiveCounter(builder.isCountingEnabled());
      leakDetector = builder.isLeakDetectionEnabled() ? new LeakDetector() : null;
      reclamationQueue = builder.isIdleReclamationEnabled() ? new ReferenceQueue<>() : null;
      initial = builder.getInitial();
    }
    items = new FreeList<>();
    factoryInvocations = new LongAdder();
    failedFactoryInvocations = new LongAdder();
    discards = new LongAdder();
    reclaims = new LongAdder();
    populate(initial);
  }

  @SuppressWarnings("unchecked")
  private void populate(int initial) {
    if (initial == 0) {
      return;
    }
    LoanHandle<T>[] loans = new LoanHandle[initial];
    int borrowed = 0;
    try {
      while (borrowed < initial) {
        // The gate has at least 'initial' permits, so this never fails.
        if (!gate.tryEnter()) {
          throw new IllegalStateException("Admission gate rejected the initial population.");
        }
        loans[borrowed++] = admitted();
      }
    } finally {
      // Reverse order puts the first created item on top of the free-list.
      for (int i = borrowed - 1; i >= 0; i--) {
        release(loans[i]);
      }
    }
  }

  @Override
  public Loan<T> borrow() throws InterruptedException {
    gate.enter();
    return admitted();
  }

  @Override
  public Loan<T> borrow(Timeout timeout) throws InterruptedException {
    Objects.requireNonNull(timeout, "Timeout cannot be null.");
    if (!gate.enter(timeout)) {
      return null;
    }
    return admitted();
  }

  private LoanHandle<T> admitted() {
    boolean success = false;
    counter.borrowed();
    LoanHandle<T> handle = handles.take();
    try {
      T item = takeIdle();
      if (item == null) {
        item = create();
      }
      handle.lend(this, item);
      if (leakDetector != null) {
        leakDetector.register(handle);
      }
      success = true;
      return handle;
    } finally {
      if (!success) {
        handles.give(handle);
        counter.returned();
        gate.leave();
      }
    }
  }

  private T takeIdle() {
    IdleItem<T> idle;
    while ((idle = items.pop()) != null) {
      T item = idle.take();
      if (item != null) {
        return item;
      }
    }
    return null;
  }

  private void accumulateReclaimed() {
    if (reclamationQueue == null) {
      return;
    }
    while (reclamationQueue.poll() != null) {
      reclaims.increment();
      counter.discarded();
    }
  }

  private T create() {
    factoryInvocations.increment();
    T item;
    try {
      item = factory.create();
    } catch (RuntimeException | Error e) {
      failedFactoryInvocations.increment();
      throw e;
    } catch (Exception e) {
      failedFactoryInvocations.increment();
      throw new PoolException("Factory failed to create an item.", e);
    }
    if (item == null) {
      failedFactoryInvocations.increment();
      throw new PoolException("Factory returned null.");
    }
    counter.created();
    return item;
  }

  @Override
  public void release(Loan<T> loan) {
    LoanHandle<T> handle = (LoanHandle<T>) loan;
    assert handle.owner == this : "Loan is not on loan from this pool: " + handle;
    if (leakDetector != null) {
      leakDetector.unregister(handle);
    }
    T item = handle.item;
    if (handle.invalid) {
      discards.increment();
      counter.discarded();
    } else {
      items.push(reclamationQueue == null ? IdleItem.pinned(item) : IdleItem.soft(item, reclamationQueue));
    }
    handle.reset();
    handles.give(handle);
    counter.returned();
    gate.leave();
    accumulateReclaimed();
  }

  @Override
  public long count() {
    accumulateReclaimed();
    return counter.idle();
  }

  @Override
  public long onLoan() {
    return counter.onLoan();
  }

  @Override
  public ManagedPool getManagedPool() {
    return this;
  }

  @Override
  public long getIdleCount() {
    return count();
  }

  @Override
  public long getOnLoanCount() {
    return onLoan();
  }

  @Override
  public int getMaxOnLoan() {
    return gate.getMax();
  }

  @Override
  public int getAvailablePermits() {
    return gate.availablePermits();
  }

  @Override
  public long getFactoryInvocationCount() {
    return factoryInvocations.sum();
  }

  @Override
  public long getFailedFactoryInvocationCount() {
    return failedFactoryInvocations.sum();
  }

  @Override
  public long getDiscardedCount() {
    return discards.sum();
  }

  @Override
  public long getReclaimedCount() {
    accumulateReclaimed();
    return reclaims.sum();
  }

  @Override
  public long getLeakedLoansCount() {
    return leakDetector == null ? 0 : leakDetector.countLeakedLoans();
  }

  @Override
  public String toString() {
    return "StockPool[" + gate + ", " + counter + "]";
  }
}
