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

import stockpot.Factory;
import stockpot.Pool;
import stockpot.PoolBuilder;

import java.util.OptionalInt;

import static java.util.Objects.requireNonNull;

/**
 * The {@link PoolBuilder} implementation.
 * @param <T> The item type.
 */
public final class PoolBuilderImpl<T> implements PoolBuilder<T> {
  private Factory<T> factory;
  private int initial;
  private int max = -1;
  private boolean countingEnabled;
  private boolean leakDetectionEnabled;
  private boolean idleReclamationEnabled = true;

  /**
   * Build a new {@code PoolBuilder} with default settings.
   * @param factory The factory instance to use.
   */
  public PoolBuilderImpl(Factory<T> factory) {
    this.factory = requireNonNull(factory, "The Factory cannot be null.");
  }

  @Override
  public synchronized PoolBuilder<T> setInitial(int initial) {
    if (initial < 0) {
      throw new IllegalArgumentException("Initial must be at least 0, but was " + initial + ".");
    }
    this.initial = initial;
    return this;
  }

  @Override
  public synchronized int getInitial() {
    return initial;
  }

  @Override
  public synchronized PoolBuilder<T> setMax(int max) {
    if (max < 1) {
      throw new IllegalArgumentException("Max must be at least 1, but was " + max + ".");
    }
    this.max = max;
    return this;
  }

  @Override
  public synchronized PoolBuilder<T> clearMax() {
    max = -1;
    return this;
  }

  @Override
  public synchronized OptionalInt getMax() {
    return max < 0 ? OptionalInt.empty() : OptionalInt.of(max);
  }

  @Override
  public synchronized PoolBuilder<T> setCountingEnabled(boolean enabled) {
    countingEnabled = enabled;
    return this;
  }

  @Override
  public synchronized boolean isCountingEnabled() {
    return countingEnabled;
  }

  @Override
  public synchronized PoolBuilder<T> setLeakDetectionEnabled(boolean enabled) {
    leakDetectionEnabled = enabled;
    return this;
  }

  @Override
  public synchronized boolean isLeakDetectionEnabled() {
    return leakDetectionEnabled;
  }

  @Override
  public synchronized PoolBuilder<T> setIdleReclamationEnabled(boolean enabled) {
    idleReclamationEnabled = enabled;
    return this;
  }

  @Override
  public synchronized boolean isIdleReclamationEnabled() {
    return idleReclamationEnabled;
  }

  @SuppressWarnings("unchecked")
  @Override
  public synchronized <X> PoolBuilder<X> setFactory(Factory<X> factory) {
    requireNonNull(factory, "The Factory cannot be null.");
    this.factory = (Factory<T>) factory;
    return (PoolBuilderImpl<X>) this;
  }

  @Override
  public synchronized Factory<T> getFactory() {
    return factory;
  }

  @SuppressWarnings("unchecked")
  @Override
  public synchronized PoolBuilderImpl<T> clone() {
    try {
      return (PoolBuilderImpl<T>) super.clone();
    } catch (CloneNotSupportedException e) {
      throw new AssertionError(e);
    }
  }

  @Override
  public synchronized Pool<T> build() {
    return new StockPool<>(this);
  }

  /**
   * Check the settings that depend on each other.
   * @throws IllegalArgumentException if the initial population exceeds the
   * maximum.
   */
  synchronized void validate() {
    if (max >= 0 && initial > max) {
      throw new IllegalArgumentException(
          "Initial (" + initial + ") must not exceed max (" + max + ").");
    }
  }
}
