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

import java.util.concurrent.atomic.AtomicLong;

/**
 * Keeps track of how many items are alive, and how many of them are on loan.
 * <p>
 * An item is alive from the moment the factory returns it, until the pool
 * discards it. The pool is the only place an item can leave its custody, so
 * the count is exact rather than depending on when the garbage collector gets
 * around to reclaiming discarded items.
 * <p>
 * A disabled counter ignores all updates and reports zero.
 */
public final class LiveCounter {
  private final boolean enabled;
  private final AtomicLong live;
  private final AtomicLong borrowed;

  public LiveCounter(boolean enabled) {
    this.enabled = enabled;
    live = new AtomicLong();
    borrowed = new AtomicLong();
  }

  public boolean isEnabled() {
    return enabled;
  }

  public void created() {
    if (enabled) {
      live.incrementAndGet();
    }
  }

  public void discarded() {
    if (enabled) {
      live.decrementAndGet();
    }
  }

  public void borrowed() {
    if (enabled) {
      borrowed.incrementAndGet();
    }
  }

  public void returned() {
    if (enabled) {
      borrowed.decrementAndGet();
    }
  }

  /**
   * @return Live items that are not on loan. Never negative.
   */
  public long idle() {
    if (!enabled) {
      return 0;
    }
    // A borrow is counted before its item is created, so reading live first
    // means a racing borrow can only lower the result.
    long l = live.get();
    long b = borrowed.get();
    return Math.max(0, l - b);
  }

  public long onLoan() {
    return enabled ? borrowed.get() : 0;
  }

  @Override
  public String toString() {
    return enabled ? "LiveCounter[live=" + live.get() + ", borrowed=" + borrowed.get() + "]" : "LiveCounter[disabled]";
  }
}
