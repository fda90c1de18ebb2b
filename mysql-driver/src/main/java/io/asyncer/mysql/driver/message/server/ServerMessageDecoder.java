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

package io.asyncer.mysql.driver.message.server;

import io.asyncer.mysql.driver.ConnectionContext;
import io.asyncer.mysql.driver.constant.Packets;
import io.netty.buffer.ByteBuf;
import io.r2dbc.spi.R2dbcNonTransientResourceException;
import org.jetbrains.annotations.Nullable;

/**
 * Decodes packets of server-side into {@link ServerMessage}s, by the phase of the current command.
 * <p>
 * It never releases the packet, the caller owns it. A malformed packet is reported as a
 * {@link R2dbcNonTransientResourceException}, the connection should not be used after that.
 */
public final class ServerMessageDecoder {

    /**
     * Decodes the first response of a text query command.
     *
     * @param buf     the packet.
     * @param context the connection context.
     * @return an {@link OkMessage}, an {@link ErrorMessage} or a {@link ColumnCountMessage}.
     * @throws R2dbcNonTransientResourceException if the packet is malformed or unsupported.
     */
    public static ServerMessage decodeCommand(ByteBuf buf, ConnectionContext context) {
        short header = readHeader(buf, "command response");

        try {
            switch (header) {
                case Packets.OK_HEADER:
                    return OkMessage.decode(false, buf, context);
                case Packets.ERROR_HEADER:
                    return ErrorMessage.decode(buf, context);
                case Packets.LOCAL_INFILE_HEADER:
                    throw new R2dbcNonTransientResourceException("LOAD DATA LOCAL INFILE is not supported");
                default:
                    return ColumnCountMessage.decode(buf);
            }
        } catch (IndexOutOfBoundsException | IllegalArgumentException e) {
            throw malformed("command response", e);
        }
    }

    /**
     * Decodes a packet of the result metadata phase.
     *
     * @param buf     the packet.
     * @param context the connection context.
     * @return a {@link ColumnDefinitionMessage}, an {@link EofMessage} or an {@link ErrorMessage}.
     * @throws R2dbcNonTransientResourceException if the packet is malformed.
     */
    public static ServerMessage decodeMetadata(ByteBuf buf, ConnectionContext context) {
        short header = readHeader(buf, "column definition");

        try {
            if (header == Packets.ERROR_HEADER) {
                return ErrorMessage.decode(buf, context);
            } else if (header == Packets.EOF_HEADER && buf.readableBytes() < Packets.EOF_MAX_SIZE) {
                return EofMessage.decode(buf);
            }

            return ColumnDefinitionMessage.decode(buf, context);
        } catch (IndexOutOfBoundsException | IllegalArgumentException e) {
            throw malformed("column definition", e);
        }
    }

    /**
     * Decodes a packet of the rows phase if it is not a row.
     *
     * @param buf     the packet.
     * @param context the connection context.
     * @return {@code null} if the packet is a row, otherwise the {@link ErrorMessage} or the message which
     * terminates the rows, i.e. an {@link OkMessage} if EOF is deprecated, or an {@link EofMessage}.
     * @throws R2dbcNonTransientResourceException if the packet is malformed.
     */
    @Nullable
    public static ServerMessage decodeRows(ByteBuf buf, ConnectionContext context) {
        short header = readHeader(buf, "row");

        try {
            if (header == Packets.ERROR_HEADER) {
                return ErrorMessage.decode(buf, context);
            } else if (header != Packets.EOF_HEADER) {
                return null;
            }

            // A row starting with 0xFE has a first field larger than 16 MiB.
            if (context.getCapability().isEofDeprecated()) {
                return buf.readableBytes() < Packets.MAX_PAYLOAD_SIZE ? OkMessage.decode(true, buf, context) :
                    null;
            }

            return buf.readableBytes() < Packets.EOF_MAX_SIZE ? EofMessage.decode(buf) : null;
        } catch (IndexOutOfBoundsException | IllegalArgumentException e) {
            throw malformed("end of rows", e);
        }
    }

    private static short readHeader(ByteBuf buf, String phase) {
        if (!buf.isReadable()) {
            throw new R2dbcNonTransientResourceException("Malformed " + phase + " message, it is empty");
        }

        return buf.getUnsignedByte(buf.readerIndex());
    }

    private static R2dbcNonTransientResourceException malformed(String phase, RuntimeException cause) {
        return new R2dbcNonTransientResourceException("Malformed " + phase + " message", cause);
    }

    private ServerMessageDecoder() { }
}
