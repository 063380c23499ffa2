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

import java.lang.ref.ReferenceQueue;
import java.lang.ref.SoftReference;

/**
 * An entry on the free-list of a {@link StockPool}.
 * <p>
 * A soft entry lets the garbage collector reclaim the idle item when memory
 * runs low, and is then enqueued on the pool's reclamation queue. A pinned
 * entry also keeps a strong reference, so the item stays until it is taken.
 *
 * @param <T> The item type.
 */
final class IdleItem<T> extends SoftReference<T> {
  private final T pinned;

  private IdleItem(T item, ReferenceQueue<? super T> queue, T pinned) {
    super(item, queue);
    this.pinned = pinned;
  }

  static <T> IdleItem<T> soft(T item, ReferenceQueue<? super T> queue) {
    return new IdleItem<>(item, queue, null);
  }

  static <T> IdleItem<T> pinned(T item) {
    return new IdleItem<>(item, null, item);
  }

  /**
   * Take the item out of this entry. A cleared entry is never enqueued, so
   * only items the garbage collector got to first show up on the queue.
   * @return The item, or {@code null} if it has been reclaimed.
   */
  T take() {
    T item = pinned != null ? pinned : get();
    clear();
    return item;
  }
}
