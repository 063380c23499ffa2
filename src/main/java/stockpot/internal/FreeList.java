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

import java.io.Serial;
import java.util.concurrent.atomic.AtomicReference;

/**
 * A {@code FreeList} is a concurrent LIFO stack of idle items.
 * <p>
 * Pushing is wait-free. Popping is lock-free, and may briefly spin on an
 * element whose push has not yet linked it to the rest of the stack.
 * Every push allocates a fresh node, and nodes are never reused, so a
 * compare-and-set on the top of the stack cannot succeed on a stale view.
 *
 * @param <E> The type of elements in the list.
 */
@SuppressWarnings("unchecked")
public final class FreeList<E> extends AtomicReference<FreeList.Node<E>> {
  @Serial
  private static final long serialVersionUID = 6318523704811269405L;
  private static final Node<Object> STACK_END = new Node<>(null);

  public FreeList() {
    set((Node<E>) STACK_END);
  }

  /**
   * Push the given element onto the stack. This method is wait-free.
   * @param element The element to push. Never {@code null}.
   */
  public void push(E element) {
    Node<E> node = new Node<>(element);
    node.next = getAndSet(node);
  }

  /**
   * Pop the most recently pushed element.
   * @return The element, or {@code null} if the stack is empty.
   */
  public E pop() {
    Node<E> node;
    Node<E> next;
    do {
      node = get();
      if (node == STACK_END) {
        return null;
      }
      next = node.next;
    } while ((next == null && pause()) || !compareAndSet(node, next));
    return node.element;
  }

  public boolean isEmpty() {
    return get() == STACK_END;
  }

  private boolean pause() {
    Thread.onSpinWait();
    return true;
  }

  @Override
  public String toString() {
    Node<E> top = get();
    return "FreeList[" + (top == STACK_END ? "EMPTY" : "top=" + top.element) + "]";
  }

  static final class Node<E> {
    final E element;
    volatile Node<E> next;

    Node(E element) {
      this.element = element;
    }
  }
}
