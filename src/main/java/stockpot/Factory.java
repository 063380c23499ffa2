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

/**
 * A Factory is the sole source of new items for a {@link Pool}.
 * <p>
 * The pool only calls {@link #create()} when its free-list is empty, which
 * means that a busy pool may call it from several threads at the same time.
 * Implementations must therefore be thread-safe, and they must never call
 * back into the pool that uses them.
 * <p>
 * Creating an item is allowed to block, for instance while performing I/O.
 * Such blocking is not coordinated with other borrowers in any way.
 *
 * @param <T> The type of items produced by this factory.
 * @see Pool#from(Factory)
 */
@FunctionalInterface
public interface Factory<T> {
  /**
   * Create a new item for the pool.
   * <p>
   * Unchecked exceptions and errors thrown from this method propagate
   * unchanged out of the {@link Pool#borrow() borrow} call that triggered
   * the creation. Checked exceptions are wrapped in a {@link PoolException}.
   * Either way, the pool rolls back its bookkeeping for the failed borrow.
   *
   * @return A new item, never {@code null}.
   * @throws Exception If the item could not be created.
   */
  T create() throws Exception;
}
