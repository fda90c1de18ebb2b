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
import io.asyncer.mysql.driver.constant.UnreadRowsPolicy;
import io.asyncer.mysql.driver.message.client.ExitMessage;
import io.asyncer.mysql.driver.message.client.TextQueryMessage;
import io.asyncer.mysql.driver.message.server.OkMessage;
import io.netty.util.internal.logging.InternalLogger;
import io.netty.util.internal.logging.InternalLoggerFactory;
import io.r2dbc.spi.R2dbcException;
import org.jetbrains.annotations.Nullable;

import java.io.InputStream;
import java.io.OutputStream;

import static io.asyncer.mysql.driver.internal.util.AssertUtils.require;
import static io.asyncer.mysql.driver.internal.util.AssertUtils.requireNonNull;

/**
 * A blocking connection of MySQL which executes text queries.
 * <p>
 * It is attached to the streams of an established connection, i.e. the handshake and the authentication have
 * been done. Responses are read in order, so the rows of a query must be read, or closed, before the next
 * statement, see also {@link UnreadRowsPolicy}.
 * <p>
 * It is not thread-safe.
 */
public final class MySqlConnection implements AutoCloseable {

    private static final InternalLogger logger = InternalLoggerFactory.getInstance(MySqlConnection.class);

    private final Client client;

    private final UnreadRowsPolicy unreadRowsPolicy;

    @Nullable
    private MySqlRows current;

    private boolean closed;

    MySqlConnection(Client client, UnreadRowsPolicy unreadRowsPolicy) {
        this.client = requireNonNull(client, "client must not be null");
        this.unreadRowsPolicy = requireNonNull(unreadRowsPolicy, "unreadRowsPolicy must not be null");
    }

    /**
     * Creates a connection on the streams of an authenticated session.
     *
     * @param input         the input stream of the session.
     * @param output        the output stream of the session.
     * @param capability    the capability negotiated by the handshake.
     * @param configuration the configuration.
     * @return the connection.
     * @throws IllegalArgumentException if any argument is {@code null}, or {@code capability} does not support
     *                                  the protocol 4.1.
     */
    public static MySqlConnection attach(InputStream input, OutputStream output, Capability capability,
        MySqlConnectionConfiguration configuration) {
        requireNonNull(input, "input must not be null");
        requireNonNull(output, "output must not be null");
        requireNonNull(capability, "capability must not be null");
        requireNonNull(configuration, "configuration must not be null");
        require(capability.isProtocol41(), "capability must support the protocol 4.1");

        ConnectionContext context = new ConnectionContext(capability, configuration.getClientCharset());
        Client client = Client.connect(input, output, context, configuration.getAllocator(),
            configuration.getReadBufferSize());

        return new MySqlConnection(client, configuration.getUnreadRowsPolicy());
    }

    /**
     * Executes a text query and returns the cursor of its rows. If the statement returns no result set, the
     * cursor is empty.
     *
     * @param sql the statement.
     * @return the cursor of the rows.
     * @throws IllegalArgumentException if {@code sql} is {@code null}.
     * @throws IllegalStateException    if the connection has been closed, or the rows of the previous query
     *                                  have not been fully read under {@link UnreadRowsPolicy#FAIL_FAST}
     *                                  and no error has been latched on them.
     * @throws R2dbcException           if the server returned an error, or the connection failed.
     */
    public MySqlRows query(String sql) {
        requireNonNull(sql, "sql must not be null");
        requireOpen();
        guardUnreadRows();

        QueryLogger.log(sql);
        client.send(new TextQueryMessage(sql));

        TextResultSource source = TextResultSource.open(client);
        MySqlRows rows = new MySqlRows(source, source.getColumns(), client.getContext());

        this.current = source.isEnded() ? null : rows;

        return rows;
    }

    /**
     * Executes a text statement which returns no result set, e.g. {@code INSERT}, {@code UPDATE}.
     *
     * @param sql the statement.
     * @return the OK message, which contains affected rows, last inserted ID, etc.
     * @throws IllegalArgumentException if {@code sql} is {@code null}.
     * @throws IllegalStateException    if the connection has been closed, or the rows of the previous query
     *                                  have not been fully read under {@link UnreadRowsPolicy#FAIL_FAST}
     *                                  and no error has been latched on them.
     * @throws R2dbcException           if the server returned an error or a result set, or the connection
     *                                  failed.
     */
    public OkMessage exec(String sql) {
        requireNonNull(sql, "sql must not be null");
        requireOpen();
        guardUnreadRows();

        QueryLogger.log(sql);
        client.send(new TextQueryMessage(sql));

        return TextResultSource.execute(client);
    }

    /**
     * Checks if the session is in a transaction, inferred by the server statuses of the latest response.
     *
     * @return if in a transaction.
     */
    public boolean isInTransaction() {
        return client.getContext().isInTransaction();
    }

    /**
     * Checks if the session has auto-commit enabled, inferred by the server statuses of the latest response.
     *
     * @return if auto-commit enabled.
     */
    public boolean isAutoCommit() {
        return client.getContext().isAutoCommit();
    }

    /**
     * Discards unread rows, sends a quit request and closes the streams. It does nothing if it has been
     * closed.
     *
     * @throws R2dbcException if the quit request can not be sent, or the streams can not be closed.
     */
    @Override
    public void close() {
        if (closed) {
            return;
        }

        this.closed = true;

        MySqlRows rows = this.current;

        this.current = null;

        try {
            if (client.isConnected()) {
                if (rows != null && !rows.isDrained()) {
                    logger.debug("Discarding {} unread rows before close", rows.drain());
                }

                if (client.isConnected()) {
                    client.send(ExitMessage.INSTANCE);
                }
            }
        } finally {
            client.close();
        }

        logger.debug("Connection closed");
    }

    @Override
    public String toString() {
        return "MySqlConnection{client=" + client + ", unreadRowsPolicy=" + unreadRowsPolicy + ", closed=" +
            closed + '}';
    }

    private void guardUnreadRows() {
        MySqlRows rows = this.current;

        if (rows == null) {
            return;
        }

        if (rows.isDrained()) {
            this.current = null;
            return;
        }

        // next() has returned false on the latched error, the caller is done with the rows.
        if (rows.getLastError() != null) {
            int discarded = rows.drain();

            this.current = null;
            logger.debug("Discarded {} rows of the previous query after error", discarded);
            return;
        }

        if (unreadRowsPolicy == UnreadRowsPolicy.FAIL_FAST) {
            throw new IllegalStateException("Rows of the previous query have not been fully read, call next() " +
                "until it returns false, or close the rows");
        }

        int discarded = rows.drain();

        this.current = null;
        logger.warn("Discarded {} unread rows of the previous query", discarded);
    }

    private void requireOpen() {
        if (closed) {
            throw new IllegalStateException("Connection has been closed");
        }
    }
}
