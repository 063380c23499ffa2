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

import javax.management.MXBean;

/**
 * This is the monitoring view of a {@link Pool}, obtained through
 * {@link Pool#getManagedPool()}. It is an {@link MXBean}, so it can be
 * registered with a platform MBean server as it is.
 * <p>
 * All figures are read without coordination with concurrent borrows and
 * releases, and are only suitable for observation.
 */
@MXBean
public interface ManagedPool {
  /**
   * @return The same as {@link Pool#count()}.
   */
  long getIdleCount();

  /**
   * @return The same as {@link Pool#onLoan()}.
   */
  long getOnLoanCount();

  /**
   * @return The configured maximum number of concurrent loans, or -1 if the
   * pool is unbounded.
   */
  int getMaxOnLoan();

  /**
   * @return The number of borrowers that could be admitted right now without
   * waiting, or -1 if the pool is unbounded.
   */
  int getAvailablePermits();

  /**
   * @return The number of times the factory has been called, whether or not
   * it succeeded. This includes the initial population.
   */
  long getFactoryInvocationCount();

  /**
   * @return The number of times the factory has thrown or returned
   * {@code null}.
   */
  long getFailedFactoryInvocationCount();

  /**
   * @return The number of items that were released as invalid, and
   * discarded.
   */
  long getDiscardedCount();

  /**
   * @return The number of idle items the garbage collector took back from
   * the free-list under memory pressure. Always 0 when
   * {@linkplain PoolBuilder#setIdleReclamationEnabled(boolean) idle
   * reclamation} is disabled.
   */
  long getReclaimedCount();

  /**
   * Get the number of loans that were garbage collected without being
   * released. This is always 0 unless
   * {@linkplain PoolBuilder#setLeakDetectionEnabled(boolean) leak detection}
   * is enabled. In a bounded pool, every leaked loan permanently holds one
   * admission permit.
   *
   * @return The number of leaked loans observed so far.
   */
  long getLeakedLoansCount();
}
