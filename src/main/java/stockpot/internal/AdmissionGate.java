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

import stockpot.Timeout;

/**
 * The admission gate bounds the number of items that can be on loan at once.
 * <p>
 * Every successful {@code enter} must be paired with exactly one
 * {@link #leave()}.
 */
public interface AdmissionGate {
  /**
   * Create the gate for the given maximum.
   * @param max The maximum number of concurrent loans, or -1 for no maximum.
   * @return A gate that enforces the maximum.
   */
  static AdmissionGate forMax(int max) {
    return max < 0 ? UnboundedGate.INSTANCE : new SemaphoreGate(max);
  }

  /**
   * Wait until admitted.
   * @throws InterruptedException if the thread is interrupted upon entry or
   * while waiting.
   */
  void enter() throws InterruptedException;

  /**
   * Wait at most the given timeout to be admitted.
   * @param timeout The time to wait, where zero or less means no waiting.
   * @return {@code true} if admitted, {@code false} if the timeout elapsed.
   * @throws InterruptedException if the thread is interrupted upon entry or
   * while waiting.
   */
  boolean enter(Timeout timeout) throws InterruptedException;

  /**
   * Enter only if it can be done right away, regardless of the interrupt
   * status of the current thread.
   * @return {@code true} if admitted.
   */
  boolean tryEnter();

  /**
   * Let the next borrower in. Never blocks.
   */
  void leave();

  /**
   * @return The configured maximum, or -1 if unbounded.
   */
  int getMax();

  /**
   * @return The number of borrowers that can be admitted right now, or -1 if
   * unbounded.
   */
  int availablePermits();
}
