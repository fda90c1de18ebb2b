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

package io.asyncer.mysql.driver;

import io.asyncer.mysql.driver.client.Client;
import io.asyncer.mysql.driver.message.server.ColumnCountMessage;
import io.asyncer.mysql.driver.message.server.ColumnDefinitionMessage;
import io.asyncer.mysql.driver.message.server.EofMessage;
import io.asyncer.mysql.driver.message.server.ErrorMessage;
import io.asyncer.mysql.driver.message.server.OkMessage;
import io.asyncer.mysql.driver.message.server.ServerMessage;
import io.asyncer.mysql.driver.message.server.ServerMessageDecoder;
import io.asyncer.mysql.driver.message.server.ServerStatusMessage;
import io.netty.buffer.ByteBuf;
import io.netty.util.internal.logging.InternalLogger;
import io.netty.util.internal.logging.InternalLoggerFactory;
import io.r2dbc.spi.R2dbcNonTransientResourceException;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Function;

import static io.asyncer.mysql.driver.internal.util.AssertUtils.requireNonNull;

/**
 * A {@link RowSource} reads the rows of a text protocol result from a {@link Client}.
 * <p>
 * The column definitions are read by {@link #open(Client)}, so the first packet of the source is the first
 * row or the terminator. The server statuses of the terminator are recorded into the connection context.
 */
final class TextResultSource implements RowSource {

    private static final InternalLogger logger = InternalLoggerFactory.getInstance(TextResultSource.class);

    private final Client client;

    private final List<ColumnDefinitionMessage> columns;

    private boolean ended;

    private TextResultSource(Client client, List<ColumnDefinitionMessage> columns, boolean ended) {
        this.client = client;
        this.columns = columns;
        this.ended = ended;
    }

    List<ColumnDefinitionMessage> getColumns() {
        return columns;
    }

    boolean isEnded() {
        return ended;
    }

    @Nullable
    @Override
    public ByteBuf nextRow() {
        if (ended) {
            return null;
        }

        ByteBuf buf;
        ServerMessage message;

        try {
            buf = client.receive();
        } catch (RuntimeException e) {
            this.ended = true;
            throw e;
        }

        try {
            message = ServerMessageDecoder.decodeRows(buf, client.getContext());
        } catch (RuntimeException e) {
            buf.release();
            this.ended = true;
            throw e;
        }

        if (message == null) {
            return buf;
        }

        buf.release();
        this.ended = true;

        if (message instanceof ErrorMessage) {
            throw ((ErrorMessage) message).toException();
        }

        complete(client, (ServerStatusMessage) message);

        return null;
    }

    @Override
    public String toString() {
        return "TextResultSource{columns=" + columns.size() + ", ended=" + ended + '}';
    }

    /**
     * Reads the response header of a text query and the column definitions if it is a result set.
     *
     * @param client the client which has sent the query.
     * @return the source of rows, it has been ended if the response is an OK message.
     * @throws io.r2dbc.spi.R2dbcException if the server returned an error, or the response can not be read.
     */
    static TextResultSource open(Client client) {
        requireNonNull(client, "client must not be null");

        ServerMessage header = receive(client, buf -> ServerMessageDecoder.decodeCommand(buf,
            client.getContext()));

        if (header instanceof ErrorMessage) {
            throw ((ErrorMessage) header).toException();
        } else if (header instanceof OkMessage) {
            complete(client, (OkMessage) header);

            return new TextResultSource(client, Collections.emptyList(), true);
        }

        List<ColumnDefinitionMessage> columns = readColumns(client,
            ((ColumnCountMessage) header).getTotalColumns());

        return new TextResultSource(client, columns, false);
    }

    /**
     * Reads the response of a text query which should not return a result set.
     *
     * @param client the client which has sent the query.
     * @return the OK message.
     * @throws io.r2dbc.spi.R2dbcException if the server returned an error or a result set, or the response can
     *                                     not be read.
     */
    static OkMessage execute(Client client) {
        requireNonNull(client, "client must not be null");

        ServerMessage header = receive(client, buf -> ServerMessageDecoder.decodeCommand(buf,
            client.getContext()));

        if (header instanceof ErrorMessage) {
            throw ((ErrorMessage) header).toException();
        } else if (header instanceof OkMessage) {
            OkMessage ok = (OkMessage) header;

            complete(client, ok);

            return ok;
        }

        int totalColumns = ((ColumnCountMessage) header).getTotalColumns();

        readColumns(client, totalColumns);
        complete(client, discardRows(client));

        throw new R2dbcNonTransientResourceException("Statement returned a result set of " + totalColumns +
            " columns, use query instead");
    }

    /**
     * Records the server statuses of the last message of a result, and discards following results if exist.
     */
    private static void complete(Client client, ServerStatusMessage message) {
        ConnectionContext context = client.getContext();
        ServerStatusMessage last = message;

        context.setServerStatuses(last.getServerStatuses());

        while (!last.isDone()) {
            last = discardResult(client);
            context.setServerStatuses(last.getServerStatuses());
        }
    }

    private static ServerStatusMessage discardResult(Client client) {
        ServerMessage header = receive(client, buf -> ServerMessageDecoder.decodeCommand(buf,
            client.getContext()));

        if (header instanceof ErrorMessage) {
            throw ((ErrorMessage) header).toException();
        } else if (header instanceof OkMessage) {
            return (OkMessage) header;
        }

        int totalColumns = ((ColumnCountMessage) header).getTotalColumns();

        logger.warn("Discarding an extra result of {} columns, multiple results are not supported",
            totalColumns);
        readColumns(client, totalColumns);

        return discardRows(client);
    }

    private static ServerStatusMessage discardRows(Client client) {
        int discarded = 0;

        while (true) {
            ServerMessage message = receive(client, buf -> ServerMessageDecoder.decodeRows(buf,
                client.getContext()));

            if (message == null) {
                ++discarded;
            } else if (message instanceof ErrorMessage) {
                throw ((ErrorMessage) message).toException();
            } else {
                logger.debug("Discarded {} rows of an unused result", discarded);

                return (ServerStatusMessage) message;
            }
        }
    }

    private static List<ColumnDefinitionMessage> readColumns(Client client, int totalColumns) {
        List<ColumnDefinitionMessage> columns = new ArrayList<>(totalColumns);

        for (int i = 0; i < totalColumns; ++i) {
            ServerMessage message = receive(client, buf -> ServerMessageDecoder.decodeMetadata(buf,
                client.getContext()));

            if (message instanceof ErrorMessage) {
                throw ((ErrorMessage) message).toException();
            } else if (!(message instanceof ColumnDefinitionMessage)) {
                throw new R2dbcNonTransientResourceException("Expected " + totalColumns +
                    " column definitions but got " + i);
            }

            columns.add((ColumnDefinitionMessage) message);
        }

        if (!client.getContext().getCapability().isEofDeprecated()) {
            ServerMessage message = receive(client, buf -> ServerMessageDecoder.decodeMetadata(buf,
                client.getContext()));

            if (message instanceof ErrorMessage) {
                throw ((ErrorMessage) message).toException();
            } else if (!(message instanceof EofMessage)) {
                throw new R2dbcNonTransientResourceException("Expected end of column definitions but got " +
                    message);
            }
        }

        return Collections.unmodifiableList(columns);
    }

    /**
     * Receives a packet and decodes it, the packet will always be released.
     */
    @Nullable
    private static ServerMessage receive(Client client, Function<ByteBuf, ServerMessage> decoder) {
        ByteBuf buf = client.receive();

        try {
            return decoder.apply(buf);
        } finally {
            buf.release();
        }
    }
}
