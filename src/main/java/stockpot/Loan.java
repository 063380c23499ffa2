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
 * A Loan represents one outstanding borrow of an item from a {@link Pool}.
 * <p>
 * Whoever borrows an item takes on the responsibility of eventually
 * {@linkplain #release() releasing} the loan again, exactly once. The most
 * common way to do that is with try-with-resources:
 * <pre>{@code
 * try (Loan<Connection> loan = pool.borrow()) {
 *   loan.item().send(message);
 * }
 * }</pre>
 * If the item turns out to be broken, {@linkplain #markAsInvalid() mark it as
 * invalid} before releasing the loan, and the pool will discard the item
 * instead of handing it out again.
 * <p>
 * Loan objects are recycled by the pool. A loan must not be used in any way
 * after it has been released, because the same object may already represent
 * somebody else's borrow. Loans are not thread-safe, but a loan can be
 * released by a thread other than the one that borrowed it.
 *
 * @param <T> The type of the borrowed item.
 */
public interface Loan<T> extends AutoCloseable {
  /**
   * Get the borrowed item.
   * @return The item, which is exclusively ours until the loan is released.
   */
  T item();

  /**
   * Mark the borrowed item as unusable, so that the pool discards it when
   * the loan is released, instead of recycling it.
   * <p>
   * This only sets a flag; the loan must still be released.
   */
  void markAsInvalid();

  /**
   * @return {@code true} if {@link #markAsInvalid()} has been called on this
   * loan.
   */
  boolean isInvalid();

  /**
   * Return the item to the pool it was borrowed from. This is equivalent to
   * calling {@link Pool#release(Loan)} on the owning pool.
   */
  void release();

  /**
   * Loans are {@link AutoCloseable} as a convenient way to release them,
   * using the try-with-resources syntax.
   */
  @Override
  default void close() {
    release();
  }
}
