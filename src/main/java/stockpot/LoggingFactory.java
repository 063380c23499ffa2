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

/**
 * An abstract wrapper for {@link Factory} instances, that adds a logging
 * callback when item creation fails.
 * <p>
 * The pool itself does not log. Subclass this and delegate
 * {@link #logMessage(String, Throwable)} to your logging framework of choice,
 * then give the subclass to {@link Pool#from(Factory)}.
 *
 * @param <T> The type of items produced by the wrapped factory.
 */
public abstract class LoggingFactory<T> implements Factory<T> {
  /**
   * Indicates an exception was thrown by {@link Factory#create()}.
   */
  public static final String FACTORY_FAILED = "Item creation failed";
  /**
   * Indicates {@link Factory#create()} returned {@code null}.
   */
  public static final String FACTORY_RETURNED_NULL = "Item creation returned null";

  private final Factory<T> factory;

  /**
   * Constructs a LoggingFactory by wrapping the provided {@code Factory}.
   *
   * @param factory The factory to wrap. It must not be {@code null}.
   */
  protected LoggingFactory(Factory<T> factory) {
    this.factory = Objects.requireNonNull(factory, "The Factory cannot be null.");
  }

  @Override
  public T create() throws Exception {
    T item;
    try {
      item = factory.create();
    } catch (Exception e) {
      logMessage(FACTORY_FAILED, e);
      throw e;
    }
    if (item == null) {
      logMessage(FACTORY_RETURNED_NULL, null);
    }
    return item;
  }

  /**
   * Logs a message and an optional associated throwable.
   * The message will be one of the string constants defined on this class.
   *
   * @param message The log message to record, never {@code null}.
   * @param throwable The throwable associated with the message, possibly
   * {@code null}.
   */
  protected abstract void logMessage(String message, Throwable throwable);
}
