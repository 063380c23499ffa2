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

import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * An amount of time that a {@link Pool#borrow(Timeout) borrow} is willing to
 * wait for the admission gate of a bounded pool.
 * <p>
 * Timeouts are immutable values. Two timeouts of the same duration are equal,
 * even when they were expressed in different units.
 *
 * @author Chris Vest
 */
public final class Timeout {
  /**
   * A timeout that does not permit any waiting.
   */
  public static final Timeout ZERO = new Timeout(0, TimeUnit.NANOSECONDS);

  private final long timeout;
  private final TimeUnit unit;
  private final long nanos;

  /**
   * Construct a new timeout with the given value and unit.
   * <p>
   * A zero or negative value means that the borrower is not willing to wait
   * at all.
   *
   * @param timeout The numerical value of the timeout.
   * @param unit The unit of the timeout value. Never {@code null}.
   */
  public Timeout(long timeout, TimeUnit unit) {
    this.unit = Objects.requireNonNull(unit, "The TimeUnit cannot be null.");
    this.timeout = timeout;
    this.nanos = unit.toNanos(timeout);
  }

  /**
   * Shorthand for {@code new Timeout(timeout, unit)}.
   * @param timeout The numerical value of the timeout.
   * @param unit The unit of the timeout value. Never {@code null}.
   * @return A new timeout.
   */
  public static Timeout of(long timeout, TimeUnit unit) {
    return new Timeout(timeout, unit);
  }

  public long getTimeout() {
    return timeout;
  }

  public TimeUnit getUnit() {
    return unit;
  }

  /**
   * Get this timeout in nanoseconds, which is the unit the pool waits in.
   * @return The timeout in nanoseconds; possibly zero or negative.
   */
  public long toNanos() {
    return nanos;
  }

  /**
   * @return {@code true} if this timeout permits no waiting at all.
   */
  public boolean isZeroOrNegative() {
    return nanos <= 0;
  }

  @Override
  public boolean equals(Object obj) {
    return obj instanceof Timeout that && this.nanos == that.nanos;
  }

  @Override
  public int hashCode() {
    return Long.hashCode(nanos);
  }

  @Override
  public String toString() {
    return "Timeout[" + timeout + " " + unit + "]";
  }
}
