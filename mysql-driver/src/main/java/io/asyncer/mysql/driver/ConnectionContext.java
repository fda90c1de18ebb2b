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

import io.asyncer.mysql.driver.codec.CodecContext;
import io.asyncer.mysql.driver.constant.ServerStatuses;

import java.nio.charset.Charset;

import static io.asyncer.mysql.driver.internal.util.AssertUtils.requireNonNull;

/**
 * The MySQL connection context considers the behavior of server or client.
 * <p>
 * WARNING: Do NOT change any data outside of this project, try to configure
 * {@link MySqlConnectionConfiguration} to control connection context and client behavior.
 */
public final class ConnectionContext implements CodecContext {

    private final Capability capability;

    private final Charset clientCharset;

    /**
     * Assume that the auto commit is always turned on, it will be updated by OK and EOF messages.
     */
    private short serverStatuses = ServerStatuses.AUTO_COMMIT;

    ConnectionContext(Capability capability, Charset clientCharset) {
        this.capability = requireNonNull(capability, "capability must not be null");
        this.clientCharset = requireNonNull(clientCharset, "clientCharset must not be null");
    }

    /**
     * Get the negotiated capabilities of the connection.
     *
     * @return the {@link Capability}.
     */
    public Capability getCapability() {
        return capability;
    }

    @Override
    public Charset getClientCharset() {
        return clientCharset;
    }

    /**
     * Get the bitmap of server statuses reported by the latest OK or EOF message.
     *
     * @return the bitmap of server statuses.
     */
    public short getServerStatuses() {
        return serverStatuses;
    }

    /**
     * Updates server statuses.
     *
     * @param serverStatuses the bitmap of server statuses.
     */
    public void setServerStatuses(short serverStatuses) {
        this.serverStatuses = serverStatuses;
    }

    /**
     * Checks if the server is in a transaction, inferred by the latest server statuses.
     *
     * @return if in a transaction.
     */
    public boolean isInTransaction() {
        return (serverStatuses & ServerStatuses.IN_TRANSACTION) != 0;
    }

    /**
     * Checks if the session has auto-commit enabled, inferred by the latest server statuses.
     *
     * @return if auto-commit enabled.
     */
    public boolean isAutoCommit() {
        return (serverStatuses & ServerStatuses.AUTO_COMMIT) != 0;
    }
}
