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

package io.asyncer.mysql.driver.message.client;

import io.asyncer.mysql.driver.ConnectionContext;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufAllocator;

/**
 * A message sent from a MySQL client to a MySQL server.
 */
public interface ClientMessage {

    /**
     * Returns whether the message starts a new command, i.e. the sequence id of its first packet is zero.
     *
     * @return {@code true} if the sequence id should be reset.
     */
    default boolean isSequenceReset() {
        return true;
    }

    /**
     * Encode a message into a {@link ByteBuf}, which is the payload without packet headers.
     *
     * @param allocator the {@link ByteBufAllocator} that use to get {@link ByteBuf} to write into.
     * @param context   current MySQL connection context.
     * @return the encoded payload, the caller should release it.
     * @throws IllegalArgumentException if {@code allocator} or {@code context} is {@code null}.
     */
    ByteBuf encode(ByteBufAllocator allocator, ConnectionContext context);
}
