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

package io.asyncer.mysql.driver.client;

import io.asyncer.mysql.driver.ConnectionContext;
import io.asyncer.mysql.driver.message.client.ClientMessage;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufAllocator;
import io.r2dbc.spi.R2dbcNonTransientResourceException;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.InputStream;
import java.io.OutputStream;

import static io.asyncer.mysql.driver.internal.util.AssertUtils.require;
import static io.asyncer.mysql.driver.internal.util.AssertUtils.requireNonNull;

/**
 * An abstraction that wraps the networking part of exchanging methods.
 * <p>
 * All methods block the calling thread until the bytes are written or arrived. It is not thread-safe, the
 * requests and the responses of a connection are one in-order stream.
 */
public interface Client {

    /**
     * Sends a request message. The responses should be read by {@link #receive()} until the last one before
     * sending another request.
     *
     * @param message the request message.
     * @throws IllegalArgumentException           if {@code message} is {@code null}.
     * @throws IllegalStateException              if the client has been closed.
     * @throws R2dbcNonTransientResourceException if the message can not be written.
     */
    void send(ClientMessage message);

    /**
     * Receives the next packet payload from server, multiple frames of a large payload are combined.
     *
     * @return the payload, the caller should release it.
     * @throws IllegalStateException              if the client has been closed.
     * @throws R2dbcNonTransientResourceException if the payload can not be read, or the server closed the
     *                                            connection.
     */
    ByteBuf receive();

    /**
     * Returns the current {@link ConnectionContext}.
     *
     * @return the {@link ConnectionContext}
     */
    ConnectionContext getContext();

    /**
     * Checks if the connection is open, i.e. not closed and no I/O failure has happened.
     *
     * @return if connection is valid
     */
    boolean isConnected();

    /**
     * Closes the underlying streams without any request. It does nothing if it has been closed.
     *
     * @throws R2dbcNonTransientResourceException if the streams can not be closed.
     */
    void close();

    /**
     * Creates a {@link Client} on the streams of a connection which has finished the connection phase, e.g.
     * authenticated streams of a {@link java.net.Socket}.
     *
     * @param input      the input stream of the connection.
     * @param output     the output stream of the connection.
     * @param context    the connection context.
     * @param allocator  the allocator of packet buffers.
     * @param bufferSize the buffer size of the input and output streams.
     * @return the {@link Client}.
     * @throws IllegalArgumentException if any argument is {@code null}, or {@code bufferSize} is not positive.
     */
    static Client connect(InputStream input, OutputStream output, ConnectionContext context,
        ByteBufAllocator allocator, int bufferSize) {
        requireNonNull(input, "input must not be null");
        requireNonNull(output, "output must not be null");
        requireNonNull(context, "context must not be null");
        requireNonNull(allocator, "allocator must not be null");
        require(bufferSize > 0, "bufferSize must be positive");

        return new StreamClient(new BufferedInputStream(input, bufferSize),
            new BufferedOutputStream(output, bufferSize), context, allocator);
    }
}
