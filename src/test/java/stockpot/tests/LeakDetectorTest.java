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
package stockpot.tests;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import stockpot.internal.LeakDetector;
import stockpot.internal.LoanHandle;
import testkits.GarbageCreator;

import java.lang.ref.Reference;

import static org.assertj.core.api.Assertions.assertThat;

class LeakDetectorTest {
  private LeakDetector detector;

  @BeforeEach
  void setUp() {
    detector = new LeakDetector();
  }

  @Test
  void mustHandleManyRegisteredAndUnregisteredHandles() throws Exception {
    LoanHandle<?>[] handles = new LoanHandle<?>[100_000];
    for (int i = 0; i < handles.length; i++) {
      handles[i] = new LoanHandle<>();
      detector.register(handles[i]);
    }
    // Re-register, as a recycled handle would be.
    for (LoanHandle<?> handle : handles) {
      detector.unregister(handle);
      detector.register(handle);
    }
    for (LoanHandle<?> handle : handles) {
      detector.unregister(handle);
    }

    //noinspection UnusedAssignment
    handles = null;
    GarbageCreator.awaitReferenceProcessing(10);

    assertThat(detector.countLeakedLoans()).isZero();
  }

  @Test
  void unregisteringUnknownHandleIsHarmless() {
    detector.unregister(new LoanHandle<>());
    assertThat(detector.countLeakedLoans()).isZero();
  }

  @Test
  void mustCountHandlesThatWereCollectedWhileRegistered() throws Exception {
    LoanHandle<?>[] handles = new LoanHandle<?>[1000];
    for (int i = 0; i < handles.length; i++) {
      handles[i] = new LoanHandle<>();
      detector.register(handles[i]);
    }
    handles[100] = null;
    handles[500] = null;
    handles[900] = null;

    int i = 0;
    do {
      GarbageCreator.awaitReferenceProcessing(10);
    } while (++i < 10 && detector.countLeakedLoans() < 3);

    assertThat(detector.countLeakedLoans()).isEqualTo(3L);
    for (LoanHandle<?> handle : handles) {
      if (handle != null) {
        detector.unregister(handle);
      }
    }
    assertThat(detector.countLeakedLoans()).isEqualTo(3L);
    Reference.reachabilityFence(handles);
  }
}
