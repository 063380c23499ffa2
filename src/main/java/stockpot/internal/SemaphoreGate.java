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

import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;

/**
 * An {@link AdmissionGate} backed by a non-fair {@link Semaphore}, with one
 * permit per item that may be on loan.
 */
final class SemaphoreGate implements AdmissionGate {
  private final Semaphore permits;
  private final int max;

  SemaphoreGate(int max) {
    if (max < 1) {
      throw new IllegalArgumentException("The maximum must be at least 1, but was " + max + ".");
    }
    this.max = max;
    permits = new Semaphore(max);
  }

  @Override
  public void enter() throws InterruptedException {
    permits.acquire();
  }

  @Override
  public boolean enter(Timeout timeout) throws InterruptedException {
    if (timeout.isZeroOrNegative()) {
      // Semaphore.tryAcquire() ignores the interrupt flag, unlike the timed variant.
      if (Thread.interrupted()) {
        throw new InterruptedException();
      }
      return tryEnter();
    }
    return permits.tryAcquire(timeout.toNanos(), TimeUnit.NANOSECONDS);
  }

  @Override
  public boolean tryEnter() {
    return permits.tryAcquire();
  }

  @Override
  public void leave() {
    permits.release();
  }

  @Override
  public int getMax() {
    return max;
  }

  @Override
  public int availablePermits() {
    return permits.availablePermits();
  }

  @Override
  public String toString() {
    return "SemaphoreGate[" + permits.availablePermits() + "/" + max + "]";
  }
}
