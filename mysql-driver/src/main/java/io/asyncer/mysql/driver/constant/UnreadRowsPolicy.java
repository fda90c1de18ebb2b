/*
 * Copyright 2023 asyncer.io projects
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     https://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.asyncer.mysql.driver.constant;

/**
 * The behavior of a connection when a new command is issued while the rows of the previous query have not
 * been read until the end.
 * <p>
 * A connection carries one in-order byte stream, so the unread rows must leave the stream before any
 * response of the new command can be read.
 * <p>
 * Rows whose cursor has latched an error are always discarded regardless of the policy, {@code next()} has
 * already returned {@code false} on them.
 */
public enum UnreadRowsPolicy {

    /**
     * Rejects the new command with an {@link IllegalStateException}, the previous rows are untouched and can
     * still be read.
     */
    FAIL_FAST,

    /**
     * Reads and discards the unread rows of the previous query, then issues the new command. The discarded
     * rows are no longer available on the previous cursor.
     */
    DRAIN
}
