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
package examples;

import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.MeterBinder;
import stockpot.ManagedPool;
import stockpot.Pool;

import java.util.function.ToDoubleFunction;

/**
 * Publishes the {@link ManagedPool} figures of a pool as Micrometer gauges,
 * named {@code <poolName>.<figure>}.
 */
public class MicrometerBinderExample implements MeterBinder {
  static final String IDLE = "idle";
  static final String ON_LOAN = "onLoan";
  static final String FACTORY_INVOCATIONS = "factoryInvocations";
  static final String FAILED_FACTORY_INVOCATIONS = "failedFactoryInvocations";
  static final String DISCARDED = "discarded";
  static final String RECLAIMED = "reclaimed";
  static final String LEAKED_LOANS = "leakedLoans";
  private static final String SEP = ".";
  private final ManagedPool pool;
  private final String poolName;

  public MicrometerBinderExample(String poolName, Pool<?> pool) {
    this.poolName = poolName;
    this.pool = pool.getManagedPool();
  }

  @Override
  public void bindTo(MeterRegistry registry) {
    gauge(registry, IDLE, ManagedPool::getIdleCount, "Idle items in pool");
    gauge(registry, ON_LOAN, ManagedPool::getOnLoanCount, "Items on loan from pool");
    gauge(registry, FACTORY_INVOCATIONS, ManagedPool::getFactoryInvocationCount,
        "Factory invocation count for pool");
    gauge(registry, FAILED_FACTORY_INVOCATIONS, ManagedPool::getFailedFactoryInvocationCount,
        "Failed factory invocation count for pool");
    gauge(registry, DISCARDED, ManagedPool::getDiscardedCount, "Invalidated items discarded by pool");
    gauge(registry, RECLAIMED, ManagedPool::getReclaimedCount, "Idle items reclaimed from pool by the garbage collector");
    gauge(registry, LEAKED_LOANS, ManagedPool::getLeakedLoansCount, "Leaked loan count for pool");
  }

  private void gauge(MeterRegistry registry, String figure, ToDoubleFunction<ManagedPool> reader, String description) {
    Gauge.builder(poolName + SEP + figure, pool, reader)
        .description(description)
        .baseUnit("items")
        .register(registry);
  }
}
