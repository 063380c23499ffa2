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

import stockpot.Loan;

import java.lang.ref.Reference;

/**
 * The {@link Loan} implementation handed out by {@link StockPool}.
 * <p>
 * Handles are recycled through a {@link LoanRecycler}, so one handle object
 * represents many loans over its lifetime. Between loans, all fields are
 * cleared and the handle refers to no pool and no item.
 *
 * @param <T> The item type.
 */
public final class LoanHandle<T> implements Loan<T> {
  T item;
  boolean invalid;
  StockPool<T> owner;
  // Link to the next idle handle, while this one sits in a LoanRecycler.
  LoanHandle<T> next;
  // Non-null while on loan, if the owner has leak detection enabled.
  Reference<?> leakCheck;

  void lend(StockPool<T> owner, T item) {
    this.owner = owner;
    this.item = item;
    this.invalid = false;
  }

  void reset() {
    item = null;
    invalid = false;
    owner = null;
  }

  @Override
  public T item() {
    assert owner != null : "Loan has already been released";
    return item;
  }

  @Override
  public void markAsInvalid() {
    invalid = true;
  }

  @Override
  public boolean isInvalid() {
    return invalid;
  }

  @Override
  public void release() {
    StockPool<T> pool = owner;
    assert pool != null : "Loan has already been released";
    pool.release(this);
  }

  @Override
  public String toString() {
    return "Loan[" + (owner == null ? "released" : item + (invalid ? ", invalid" : "")) + "]";
  }
}
