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
 * The {@link AdmissionGate} of an unbounded pool. Admits everyone, but still
 * honours a pending interrupt, so cancellation behaves the same as in a
 * bounded pool.
 */
enum UnboundedGate implements AdmissionGate {
  INSTANCE;

  @Override
  public void enter() throws InterruptedException {
    if (Thread.interrupted()) {
      throw new InterruptedException();
    }
  }

  @Override
  public boolean enter(Timeout timeout) throws InterruptedException {
    enter();
    return true;
  }

  @Override
  public boolean tryEnter() {
    return true;
  }

  @Override
  public void leave() {
  }

  @Override
  public int getMax() {
    return -1;
  }

  @Override
  public int availablePermits() {
    return -1;
  }
}
