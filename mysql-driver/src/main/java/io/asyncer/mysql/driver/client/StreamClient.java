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
import io.asyncer.mysql.driver.constant.Packets;
import io.asyncer.mysql.driver.internal.util.NettyBufferUtils;
import io.asyncer.mysql.driver.message.client.ClientMessage;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufAllocator;
import io.netty.util.internal.logging.InternalLogger;
import io.netty.util.internal.logging.InternalLoggerFactory;
import io.r2dbc.spi.R2dbcNonTransientResourceException;

import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.ArrayList;
import java.util.List;

import static io.asyncer.mysql.driver.internal.util.AssertUtils.requireNonNull;

/**
 * An implementation of {@link Client} based on blocking streams.
 * <ul>
 * <li>Read: frames of {@link InputStream} -&gt; combined payload {@link ByteBuf}</li>
 * <li>Write: {@link ClientMessage} -&gt; framed payload with last flush</li>
 * </ul>
 */
final class StreamClient implements Client {

    private static final InternalLogger logger = InternalLoggerFactory.getInstance(StreamClient.class);

    private final InputStream input;

    private final OutputStream output;

    private final ConnectionContext context;

    private final ByteBufAllocator allocator;

    private final byte[] header = new byte[Packets.NORMAL_HEADER_SIZE];

    private int sequenceId;

    private boolean connected = true;

    private boolean closed;

    StreamClient(InputStream input, OutputStream output, ConnectionContext context, ByteBufAllocator allocator) {
        this.input = requireNonNull(input, "input must not be null");
        this.output = requireNonNull(output, "output must not be null");
        this.context = requireNonNull(context, "context must not be null");
        this.allocator = requireNonNull(allocator, "allocator must not be null");
    }

    @Override
    public void send(ClientMessage message) {
        requireNonNull(message, "message must not be null");
        requireConnected();

        if (message.isSequenceReset()) {
            logger.trace("Reset sequence id");
            this.sequenceId = 0;
        }

        ByteBuf payload = message.encode(allocator, context);

        try {
            writePayload(payload);
            output.flush();
        } catch (IOException e) {
            this.connected = false;
            throw new R2dbcNonTransientResourceException("Failed to send " + message, e);
        } finally {
            payload.release();
        }
    }

    @Override
    public ByteBuf receive() {
        requireConnected();

        List<ByteBuf> frames = new ArrayList<>(1);

        try {
            int size;

            do {
                size = readFrame(frames);
            } while (size == Packets.MAX_PAYLOAD_SIZE);
        } catch (IOException e) {
            NettyBufferUtils.releaseAll(frames);
            this.connected = false;

            if (e instanceof EOFException) {
                throw new R2dbcNonTransientResourceException("Connection closed by server", e);
            }

            throw new R2dbcNonTransientResourceException("Failed to receive packet", e);
        }

        return NettyBufferUtils.composite(frames);
    }

    @Override
    public ConnectionContext getContext() {
        return context;
    }

    @Override
    public boolean isConnected() {
        return connected;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }

        this.closed = true;
        this.connected = false;

        IOException error = null;

        try {
            input.close();
        } catch (IOException e) {
            error = e;
        }

        try {
            output.close();
        } catch (IOException e) {
            if (error == null) {
                error = e;
            } else {
                error.addSuppressed(e);
            }
        }

        if (error != null) {
            throw new R2dbcNonTransientResourceException("Failed to close connection streams", error);
        }
    }

    @Override
    public String toString() {
        return "StreamClient{connected=" + connected + ", sequenceId=" + sequenceId + '}';
    }

    private void writePayload(ByteBuf payload) throws IOException {
        int size;

        // An exact multiple of MAX_PAYLOAD_SIZE ends with an empty frame.
        do {
            size = Math.min(payload.readableBytes(), Packets.MAX_PAYLOAD_SIZE);

            header[0] = (byte) size;
            header[1] = (byte) (size >>> 8);
            header[2] = (byte) (size >>> 16);
            header[3] = (byte) sequenceId;

            output.write(header);
            payload.readBytes(output, size);

            logger.trace("Encoded frame with sequence id: {}, payload size: {}", sequenceId, size);
            this.sequenceId = (sequenceId + 1) & 0xFF;
        } while (size == Packets.MAX_PAYLOAD_SIZE);
    }

    private int readFrame(List<ByteBuf> frames) throws IOException {
        readFully(header);

        int size = (header[0] & 0xFF) | ((header[1] & 0xFF) << 8) | ((header[2] & 0xFF) << 16);
        int sequenceId = header[3] & 0xFF;
        ByteBuf frame = allocator.buffer(size, size);

        frames.add(frame);

        int remaining = size;

        while (remaining > 0) {
            int read = frame.writeBytes(input, remaining);

            if (read < 0) {
                throw new EOFException("Frame truncated, " + remaining + " bytes of " + size + " missing");
            }

            remaining -= read;
        }

        logger.trace("Decoded frame with sequence id: {}, payload size: {}", sequenceId, size);
        this.sequenceId = (sequenceId + 1) & 0xFF;

        return size;
    }

    private void readFully(byte[] bytes) throws IOException {
        int offset = 0;

        while (offset < bytes.length) {
            int read = input.read(bytes, offset, bytes.length - offset);

            if (read < 0) {
                throw new EOFException("Connection closed by server");
            }

            offset += read;
        }
    }

    private void requireConnected() {
        if (!connected) {
            throw new IllegalStateException("Client has been closed or broken");
        }
    }
}
