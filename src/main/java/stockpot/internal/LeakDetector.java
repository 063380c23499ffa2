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

import java.lang.ref.PhantomReference;
import java.lang.ref.Reference;
import java.lang.ref.ReferenceQueue;
import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.LongAdder;

/**
 * Leak detector, used to detect loans that get garbage collected without
 * first being released back to the pool.
 * <p>
 * Enqueued references are only processed when the detector is used, so the
 * leak count lags behind the garbage collector.
 */
public final class LeakDetector {
  private final ReferenceQueue<Object> referenceQueue;
  private final LongAdder leakedLoanCount;
  private final Set<Reference<?>> refs;

  public LeakDetector() {
    referenceQueue = new ReferenceQueue<>();
    leakedLoanCount = new LongAdder();
    refs = Collections.newSetFromMap(new IdentityHashMap<>());
  }

  /**
   * Start watching the given handle, which is about to be handed out.
   * @param handle The handle to register.
   */
  public void register(LoanHandle<?> handle) {
    PhantomReference<Object> ref = new PhantomReference<>(handle, referenceQueue);
    handle.leakCheck = ref;
    synchronized (refs) {
      refs.add(ref);
    }
    accumulateLeaks();
  }

  /**
   * Stop watching the given handle, which has been released.
   * @param handle The handle to deregister.
   */
  public void unregister(LoanHandle<?> handle) {
    Reference<?> ref = handle.leakCheck;
    if (ref == null) {
      return;
    }
    handle.leakCheck = null;
    ref.clear();
    synchronized (refs) {
      refs.remove(ref);
    }
    accumulateLeaks();
  }

  /**
   * Compute a count of the leaked loans that this detector has detected.
   * @return The number of leaks observed.
   */
  public long countLeakedLoans() {
    accumulateLeaks();
    return leakedLoanCount.sum();
  }

  private void accumulateLeaks() {
    List<Reference<?>> refsToRemove = null;
    Reference<?> ref;
    while ((ref = referenceQueue.poll()) != null) {
      if (refsToRemove == null) {
        refsToRemove = new ArrayList<>();
      }
      refsToRemove.add(ref);
    }
    if (refsToRemove != null) {
      leakedLoanCount.add(refsToRemove.size());
      synchronized (refs) {
        for (Reference<?> toRemove : refsToRemove) {
          refs.remove(toRemove);
        }
      }
    }
  }
}
