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
/**
 * Stockpot is a generic, thread-safe object pool for reusing items that are
 * expensive to create.
 * <p>
 * Pools implement the {@link stockpot.Pool} interface, and are built from a
 * {@link stockpot.Factory} that creates the pooled items. Borrowing an item
 * gives you a {@link stockpot.Loan}, which you release when you are done with
 * the item, or mark as invalid first if the item should never be reused.
 * <p>
 * A pool can be bounded, so that only a fixed number of items can be on loan
 * at once, and it can pre-create an initial population of items.
 */
package stockpot;
