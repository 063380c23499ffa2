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
package stockpot;

import stockpot.internal.PoolBuilderImpl;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * A Pool is a set of reusable items, from which callers can borrow exclusive
 * access to an item, until they release it back into the pool.
 * <p>
 * Pools are thread-safe, and all of their methods can be called concurrently
 * from multiple threads.
 * <p>
 * Items are fungible: any idle item satisfies any borrow. When no idle item
 * is available, the pool asks its {@link Factory} for a new one. A pool can
 * optionally be <em>bounded</em>, in which case at most a configured number
 * of items can be on loan at any one time, and further borrows wait until a
 * loan is released. Idle items do not count towards the bound.
 * <p>
 * When you borrow an item, you also take upon yourself the responsibility of
 * eventually releasing it again:
 * <pre>{@code
 * try (Loan<Buffer> loan = pool.borrow()) {
 *   fill(loan.item());
 * }
 * }</pre>
 * A pool is an identity object that is meant to live as long as the
 * component that uses it. There is nothing to shut down; idle items are
 * reclaimed by the garbage collector together with the pool.
 *
 * @author Chris Vest
 * @param <T> The type of items in the pool, as produced by its factory.
 */
public interface Pool<T> {
  /**
   * Get a {@link PoolBuilder} based on the given {@link Factory}, which can
   * then be used to {@linkplain PoolBuilder#build() build} a pool with the
   * desired configuration.
   *
   * @param factory The factory the pool will use to create items. Never
   * {@code null}.
   * @param <T> The type of items produced by the factory.
   * @return A {@link PoolBuilder} that admits additional configuration.
   */
  static <T> PoolBuilder<T> from(Factory<T> factory) {
    return new PoolBuilderImpl<>(factory);
  }

  /**
   * Build an unbounded pool with no initial items and no counting.
   *
   * @param factory The factory the pool will use to create items.
   * @param <T> The type of items produced by the factory.
   * @return A new pool.
   */
  static <T> Pool<T> of(Factory<T> factory) {
    return from(factory).build();
  }

  /**
   * Build a pool that permits at most {@code max} items to be on loan at the
   * same time.
   *
   * @param factory The factory the pool will use to create items.
   * @param max The maximum number of concurrently borrowed items; at least 1.
   * @param <T> The type of items produced by the factory.
   * @return A new bounded pool.
   * @throws IllegalArgumentException if {@code max} is less than 1.
   */
  static <T> Pool<T> bounded(Factory<T> factory, int max) {
    return from(factory).setMax(max).build();
  }

  /**
   * Borrow an item from the pool, waiting as long as it takes for the
   * admission gate of a bounded pool to let us in.
   * <p>
   * The item is taken from the free-list if one is idle, otherwise it is
   * created by the {@link Factory}, on the calling thread.
   * <p>
   * An {@link InterruptedException} will be thrown if the thread has its
   * interrupted flag set upon entry to this method, or is interrupted while
   * waiting. In that case nothing has been borrowed, and the pool is left as
   * if the call never happened.
   *
   * <h4>Memory effects:</h4>
   * <ul>
   * <li>The {@linkplain #release(Loan) release} of an item happens-before
   *   any subsequent borrow of that item, and,</li>
   * <li>The {@linkplain Factory#create() creation} of an item happens-before
   *   any borrow of that item.</li>
   * </ul>
   *
   * @return A loan of an item. Never {@code null}.
   * @throws InterruptedException if the current thread is interrupted upon
   * entry, or becomes interrupted while waiting.
   * @throws PoolException if the factory threw a checked exception or
   * returned {@code null}.
   */
  Loan<T> borrow() throws InterruptedException;

  /**
   * Borrow an item from the pool, waiting at most the given amount of time
   * for the admission gate of a bounded pool to let us in.
   * <p>
   * The timeout only covers waiting for admission. A slow factory can make
   * the call take longer than the timeout.
   *
   * @param timeout The maximum time to wait for admission. A timeout of zero
   * or less means the call will not wait at all.
   * @return A loan of an item, or {@code null} if the timeout elapsed before
   * we were admitted.
   * @throws InterruptedException if the current thread is interrupted upon
   * entry, or becomes interrupted while waiting.
   * @throws PoolException if the factory threw a checked exception or
   * returned {@code null}.
   * @see #borrow()
   */
  Loan<T> borrow(Timeout timeout) throws InterruptedException;

  /**
   * Borrow an item only if it can be done without waiting for admission.
   *
   * @return A loan of an item, or {@code null} if a bounded pool already has
   * its maximum number of items on loan. Also {@code null} if the thread was
   * interrupted, in which case the interrupt status is restored.
   * @throws PoolException if the factory threw a checked exception or
   * returned {@code null}.
   */
  default Loan<T> tryBorrow() {
    try {
      return borrow(Timeout.ZERO);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return null;
    }
  }

  /**
   * Return a borrowed item to this pool.
   * <p>
   * If the loan has been {@linkplain Loan#markAsInvalid() marked as invalid},
   * its item is discarded; otherwise the item goes back on the free-list for
   * the next borrower. Either way, a waiting borrower can then be admitted.
   * <p>
   * This method never blocks, and can be called from any thread. Releasing a
   * loan more than once, or releasing a loan into a pool it did not come
   * from, is a programming error with unspecified results.
   *
   * @param loan The loan to return, as obtained from this pool.
   */
  void release(Loan<T> loan);

  /**
   * Get the number of idle items in the pool.
   * <p>
   * This is only tracked when {@linkplain PoolBuilder#setCountingEnabled(boolean)
   * counting is enabled}, and otherwise returns 0. The figure is read without
   * locking while other threads borrow and release, so it is only suitable
   * for observation, never as an input to capacity decisions.
   *
   * @return The number of items created and not discarded, minus the items
   * currently on loan; never negative.
   */
  long count();

  /**
   * Get the number of loans that have been handed out and not yet released.
   * <p>
   * This is only tracked when {@linkplain PoolBuilder#setCountingEnabled(boolean)
   * counting is enabled}, and otherwise returns 0.
   *
   * @return The number of items currently on loan.
   */
  long onLoan();

  /**
   * Get a {@link ManagedPool} view of this pool, suitable for monitoring.
   * @return The management interface of this pool.
   */
  ManagedPool getManagedPool();

  /**
   * Borrow an item and apply the given function to it, returning the result
   * and releasing the loan again, even if the function throws.
   * <p>
   * If the timeout elapses before an item can be borrowed, then
   * {@link Optional#empty()} is returned instead. The {@code empty()} value
   * is also returned if the function returns {@code null}.
   *
   * @param timeout The maximum time to wait for admission.
   * @param function The function to apply to the borrowed item. It should
   * avoid borrowing further items, since holding more than one loan per
   * thread is deadlock prone in a bounded pool.
   * @param <R> The return type of the given function.
   * @return The result of the function, if any.
   * @throws InterruptedException if the thread was interrupted.
   * @see #borrow(Timeout) The {@code borrow} method for failure modes.
   */
  default <R> Optional<R> apply(Timeout timeout, Function<T, R> function) throws InterruptedException {
    Objects.requireNonNull(function, "Function cannot be null.");
    Loan<T> loan = borrow(timeout);
    if (loan == null) {
      return Optional.empty();
    }
    try {
      return Optional.ofNullable(function.apply(loan.item()));
    } finally {
      loan.release();
    }
  }

  /**
   * Borrow an item and supply it to the given consumer, then release the
   * loan again, even if the consumer throws.
   *
   * @param timeout The maximum time to wait for admission.
   * @param consumer The consumer to pass the borrowed item to.
   * @return {@code true} if an item was borrowed and passed to the consumer,
   * or {@code false} if the timeout elapsed first.
   * @throws InterruptedException if the thread was interrupted.
   * @see #borrow(Timeout) The {@code borrow} method for failure modes.
   */
  default boolean supply(Timeout timeout, Consumer<T> consumer) throws InterruptedException {
    Objects.requireNonNull(consumer, "Consumer cannot be null.");
    Loan<T> loan = borrow(timeout);
    if (loan == null) {
      return false;
    }
    try {
      consumer.accept(loan.item());
      return true;
    } finally {
      loan.release();
    }
  }
}
