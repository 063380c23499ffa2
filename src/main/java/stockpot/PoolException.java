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

import java.io.Serial;

/**
 * Thrown by {@link Pool#borrow()} and friends when the pool could not hand
 * out an item because its {@link Factory} failed with a checked exception,
 * or produced {@code null}.
 * <p>
 * Unchecked exceptions from the factory are not wrapped.
 *
 * @author Chris Vest
 */
public class PoolException extends RuntimeException {
  @Serial
  private static final long serialVersionUID = 4818920382749038121L;

  /**
   * Construct a new PoolException with the given message.
   * @param message A description of the failure.
   */
  public PoolException(String message) {
    super(message);
  }

  /**
   * Construct a new PoolException with the given message and cause.
   * @param message A description of the failure.
   * @param cause The exception thrown by the factory.
   */
  public PoolException(String message, Throwable cause) {
    super(message, cause);
  }
}
