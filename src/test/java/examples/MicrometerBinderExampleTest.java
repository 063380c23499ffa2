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

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;
import stockpot.Loan;
import stockpot.Pool;
import testkits.Item;

import static org.assertj.core.api.Assertions.assertThat;
import static testkits.FactoryKit.factory;

class MicrometerBinderExampleTest {
  @Test
  void gaugesMustFollowThePool() throws Exception {
    Pool<Item> pool = Pool.from(factory()).setCountingEnabled(true).setMax(4).build();
    MeterRegistry registry = new SimpleMeterRegistry();
    new MicrometerBinderExample("items", pool).bindTo(registry);

    Loan<Item> a = pool.borrow();
    Loan<Item> b = pool.borrow();
    b.markAsInvalid();
    b.release();

    assertThat(gauge(registry, MicrometerBinderExample.ON_LOAN)).isEqualTo(1.0);
    assertThat(gauge(registry, MicrometerBinderExample.IDLE)).isEqualTo(0.0);
    assertThat(gauge(registry, MicrometerBinderExample.FACTORY_INVOCATIONS)).isEqualTo(2.0);
    assertThat(gauge(registry, MicrometerBinderExample.FAILED_FACTORY_INVOCATIONS)).isEqualTo(0.0);
    assertThat(gauge(registry, MicrometerBinderExample.DISCARDED)).isEqualTo(1.0);
    assertThat(gauge(registry, MicrometerBinderExample.RECLAIMED)).isEqualTo(0.0);
    assertThat(gauge(registry, MicrometerBinderExample.LEAKED_LOANS)).isEqualTo(0.0);

    a.release();
    assertThat(gauge(registry, MicrometerBinderExample.IDLE)).isEqualTo(1.0);
  }

  private static double gauge(MeterRegistry registry, String figure) {
    return registry.get("items." + figure).gauge().value();
  }
}
