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

import java.util.OptionalInt;

/**
 * The {@code PoolBuilder} collects information about how big a pool should
 * be, and how it should behave, and then {@linkplain #build() builds} the
 * pool.
 * <p>
 * The defaults are: no initial items, no maximum (unbounded), counting
 * disabled, leak detection disabled, and idle reclamation enabled.
 * <p>
 * Builders are obtained from {@link Pool#from(Factory)}. They are thread-safe,
 * but a pool only sees the configuration as it was at the time
 * {@link #build()} was called. Changing the builder afterwards does not affect
 * pools that have already been built.
 *
 * @author Chris Vest
 * @param <T> The type of items in the pools built by this builder.
 */
public interface PoolBuilder<T> extends Cloneable {
  /**
   * Set the number of items that the pool creates eagerly, as part of
   * {@link #build()}, so they are ready for the first borrowers.
   * <p>
   * For a bounded pool, this cannot be greater than the maximum; that is
   * checked when the pool is built.
   *
   * @param initial The number of items to create up front. At least 0.
   * @return This builder.
   * @throws IllegalArgumentException if {@code initial} is negative.
   */
  PoolBuilder<T> setInitial(int initial);

  int getInitial();

  /**
   * Bound the pool, so at most {@code max} items can be on loan at the same
   * time. Borrowers beyond that wait for a loan to be released.
   *
   * @param max The maximum number of concurrently borrowed items. At least 1.
   * @return This builder.
   * @throws IllegalArgumentException if {@code max} is less than 1.
   */
  PoolBuilder<T> setMax(int max);

  /**
   * Remove any maximum, so the built pool is unbounded.
   * @return This builder.
   */
  PoolBuilder<T> clearMax();

  /**
   * @return The configured maximum number of concurrent loans, or an empty
   * value if the pool is unbounded.
   */
  OptionalInt getMax();

  /**
   * Enable tracking of the numbers reported by {@link Pool#count()} and
   * {@link Pool#onLoan()}. When disabled, both methods return 0.
   * <p>
   * Counting costs a couple of atomic updates per borrow and release.
   *
   * @param enabled {@code true} to enable counting.
   * @return This builder.
   */
  PoolBuilder<T> setCountingEnabled(boolean enabled);

  boolean isCountingEnabled();

  /**
   * Enable detection of loans that are garbage collected without having
   * been released. Leaks are reported by
   * {@link ManagedPool#getLeakedLoansCount()}.
   * <p>
   * Leak detection allocates a reference object for every borrow, so it is
   * disabled by default.
   *
   * @param enabled {@code true} to enable leak detection.
   * @return This builder.
   */
  PoolBuilder<T> setLeakDetectionEnabled(boolean enabled);

  boolean isLeakDetectionEnabled();

  /**
   * Let the garbage collector reclaim idle items when memory runs low.
   * <p>
   * When enabled, the free-list only holds its items softly, so a pool that
   * grew large under load shrinks again once it is quiet and the memory is
   * needed elsewhere. Reclaimed items are never handed out; the factory
   * creates replacements on demand. Items on loan are never reclaimed.
   * Reclaimed items are reported by {@link ManagedPool#getReclaimedCount()}
   * and no longer included in {@link Pool#count()}.
   * <p>
   * Disable this for items that must be explicitly closed, since the pool
   * cannot tell the factory when one of its items is gone.
   *
   * @param enabled {@code true} to enable idle reclamation.
   * @return This builder.
   */
  PoolBuilder<T> setIdleReclamationEnabled(boolean enabled);

  boolean isIdleReclamationEnabled();

  /**
   * Change the factory used by the pools built from here on.
   *
   * @param factory The new factory. Never {@code null}.
   * @param <X> The type of items produced by the new factory.
   * @return This builder, retyped for the new factory.
   */
  <X> PoolBuilder<X> setFactory(Factory<X> factory);

  Factory<T> getFactory();

  /**
   * Create a copy of this builder, with the same configuration.
   * @return A new, independent builder.
   */
  PoolBuilder<T> clone();

  /**
   * Build a pool from the current configuration.
   * <p>
   * If an initial population is configured, then the factory is called that
   * many times before this method returns. A failure of the factory during
   * this phase propagates out of this method, the same way it would from
   * {@link Pool#borrow()}.
   *
   * @return A new pool.
   * @throws IllegalArgumentException if the initial population exceeds the
   * maximum.
   */
  Pool<T> build();
}
