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

/**
 * A stack of idle {@link LoanHandle} objects, so that borrowing does not have
 * to allocate a new handle every time.
 * <p>
 * The stack is intrusive, linking handles through their own {@code next}
 * field, and guarded by a lock. Handles are re-pushed after reuse, so a
 * lock-free version would be open to the ABA problem.
 * <p>
 * At most {@code capacity} handles are retained; surplus handles are left
 * to the garbage collector.
 *
 * @param <T> The item type of the handles.
 */
public final class LoanRecycler<T> {
  /**
   * The number of idle handles retained by the recycler of an unbounded pool.
   */
  public static final int DEFAULT_CAPACITY = 1024;

  private final int capacity;
  private LoanHandle<T> top;
  private int size;

  public LoanRecycler(int capacity) {
    if (capacity < 0) {
      throw new IllegalArgumentException("Capacity cannot be negative, but was " + capacity + ".");
    }
    this.capacity = capacity;
  }

  /**
   * Take an idle handle, or create a new one if there are none.
   * @return A blank handle, never {@code null}.
   */
  public LoanHandle<T> take() {
    LoanHandle<T> handle;
    synchronized (this) {
      handle = top;
      if (handle != null) {
        top = handle.next;
        size--;
      }
    }
    if (handle == null) {
      return new LoanHandle<>();
    }
    handle.next = null;
    return handle;
  }

  /**
   * Give a blank handle back to the recycler.
   * @param handle The handle, which must already have been reset.
   */
  public void give(LoanHandle<T> handle) {
    assert handle.owner == null && handle.item == null : "Handle must be reset before recycling";
    synchronized (this) {
      if (size < capacity) {
        handle.next = top;
        top = handle;
        size++;
      }
    }
  }

  public synchronized int size() {
    return size;
  }
}
