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
package stockpot.tests;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import stockpot.Factory;
import stockpot.LoggingFactory;
import stockpot.Pool;
import stockpot.PoolException;
import testkits.Item;

import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static testkits.FactoryKit.$new;
import static testkits.FactoryKit.$null;
import static testkits.FactoryKit.$throw;
import static testkits.FactoryKit.factory;

class LoggingFactoryTest {
  private BlockingQueue<LogEvent> queue;
  private Exception exception;

  @BeforeEach
  void setUp() {
    queue = new LinkedBlockingQueue<>();
    exception = new Exception("boom");
  }

  @Test
  void factoryCannotBeNull() {
    assertThrows(NullPointerException.class, () -> new QueueLoggingFactory(null, queue));
  }

  @Test
  void createMustLogFailures() throws Exception {
    LoggingFactory<Item> factory = new QueueLoggingFactory(factory($throw(exception)), queue);

    Exception thrown = assertThrows(Exception.class, factory::create);

    assertSame(exception, thrown);
    assertLogged(queue, LoggingFactory.FACTORY_FAILED, exception);
  }

  @Test
  void createMustLogWhenNullIsReturned() throws Exception {
    LoggingFactory<Item> factory = new QueueLoggingFactory(factory($null), queue);

    assertNull(factory.create());
    assertLogged(queue, LoggingFactory.FACTORY_RETURNED_NULL, null);
  }

  @Test
  void successfulCreationMustNotLog() throws Exception {
    LoggingFactory<Item> factory = new QueueLoggingFactory(factory($new), queue);

    assertThat(factory.create().label).isEqualTo("A");
    assertThat(queue).isEmpty();
  }

  @Test
  void poolMustSeeTheSameFailureThatWasLogged() throws Exception {
    RuntimeException runtimeException = new IllegalStateException("boom");
    Pool<Item> pool = Pool.of(new QueueLoggingFactory(factory($throw(runtimeException), $throw(exception)), queue));

    assertSame(runtimeException, assertThrows(RuntimeException.class, pool::borrow));
    assertLogged(queue, LoggingFactory.FACTORY_FAILED, runtimeException);

    PoolException wrapped = assertThrows(PoolException.class, pool::borrow);
    assertThat(wrapped).hasCause(exception);
    assertLogged(queue, LoggingFactory.FACTORY_FAILED, exception);
  }

  private static void assertLogged(
      BlockingQueue<LogEvent> queue, String expectedMessage, Throwable expectedThrowable) throws Exception {
    LogEvent event = queue.poll(1, TimeUnit.SECONDS);
    assertNotNull(event, "Expected a log event");
    assertSame(expectedThrowable, event.throwable);
    assertEquals(expectedMessage, event.message);
  }

  private record LogEvent(String message, Throwable throwable) {
  }

  private static final class QueueLoggingFactory extends LoggingFactory<Item> {
    private final BlockingQueue<LogEvent> queue;

    private QueueLoggingFactory(Factory<Item> factory, BlockingQueue<LogEvent> queue) {
      super(factory);
      this.queue = queue;
    }

    @Override
    protected void logMessage(String message, Throwable throwable) {
      queue.add(new LogEvent(message, throwable));
    }
  }
}
