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

import io.asyncer.mysql.driver.Capability;
import io.asyncer.mysql.driver.ConnectionContext;
import io.asyncer.mysql.driver.internal.util.VarIntUtils;
import io.netty.buffer.ByteBuf;

import java.nio.charset.Charset;

import static io.asyncer.mysql.driver.internal.util.AssertUtils.requireNonNull;

/**
 * OK message, it is the acknowledgment of a command which does not return rows.
 * <p>
 * Note: OK message are also used to indicate the end of rows if EOF message is deprecated, see
 * {@link Capability#isEofDeprecated()}.
 */
public final class OkMessage implements ServerStatusMessage {

    private final boolean isEndOfRows;

    private final long affectedRows;

    /**
     * Last insert-id, not business id on table.
     */
    private final long lastInsertId;

    private final short serverStatuses;

    private final int warnings;

    private final String information;

    private OkMessage(boolean isEndOfRows, long affectedRows, long lastInsertId, short serverStatuses,
        int warnings, String information) {
        this.isEndOfRows = isEndOfRows;
        this.affectedRows = affectedRows;
        this.lastInsertId = lastInsertId;
        this.serverStatuses = serverStatuses;
        this.warnings = warnings;
        this.information = requireNonNull(information, "information must not be null");
    }

    public boolean isEndOfRows() {
        return isEndOfRows;
    }

    /**
     * Get the count of affected rows, it is an unsigned 64-bits integer.
     *
     * @return the affected rows, should use {@link Long#toUnsignedString(long)} if it is negative.
     */
    public long getAffectedRows() {
        return affectedRows;
    }

    public long getLastInsertId() {
        return lastInsertId;
    }

    @Override
    public short getServerStatuses() {
        return serverStatuses;
    }

    public int getWarnings() {
        return warnings;
    }

    /**
     * Get the human-readable information, e.g. {@code Rows matched: 1  Changed: 1  Warnings: 0}.
     *
     * @return the information, or empty string if server does not provide it.
     */
    public String getInformation() {
        return information;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof OkMessage)) {
            return false;
        }

        OkMessage okMessage = (OkMessage) o;

        return isEndOfRows == okMessage.isEndOfRows &&
            affectedRows == okMessage.affectedRows &&
            lastInsertId == okMessage.lastInsertId &&
            serverStatuses == okMessage.serverStatuses &&
            warnings == okMessage.warnings &&
            information.equals(okMessage.information);
    }

    @Override
    public int hashCode() {
        int result = (isEndOfRows ? 1 : 0);
        result = 31 * result + (int) (affectedRows ^ (affectedRows >>> 32));
        result = 31 * result + (int) (lastInsertId ^ (lastInsertId >>> 32));
        result = 31 * result + serverStatuses;
        result = 31 * result + warnings;
        return 31 * result + information.hashCode();
    }

    @Override
    public String toString() {
        if (warnings == 0) {
            return "OkMessage{isEndOfRows=" + isEndOfRows +
                ", affectedRows=" + Long.toUnsignedString(affectedRows) +
                ", lastInsertId=" + Long.toUnsignedString(lastInsertId) +
                ", serverStatuses=" + Integer.toHexString(serverStatuses) +
                ", information='" + information +
                "'}";
        }

        return "OkMessage{isEndOfRows=" + isEndOfRows +
            ", affectedRows=" + Long.toUnsignedString(affectedRows) +
            ", lastInsertId=" + Long.toUnsignedString(lastInsertId) +
            ", serverStatuses=" + Integer.toHexString(serverStatuses) +
            ", warnings=" + warnings +
            ", information='" + information +
            "'}";
    }

    static OkMessage decode(boolean isEndOfRows, ByteBuf buf, ConnectionContext context) {
        buf.skipBytes(1); // OK message header, 0x00 or 0xFE

        Capability capability = context.getCapability();
        long affectedRows = VarIntUtils.readVarInt(buf);
        long lastInsertId = VarIntUtils.readVarInt(buf);
        short serverStatuses;
        int warnings;

        if (capability.isProtocol41()) {
            serverStatuses = buf.readShortLE();
            warnings = buf.readUnsignedShortLE();
        } else if (capability.isTransactionAllowed()) {
            serverStatuses = buf.readShortLE();
            warnings = 0;
        } else {
            warnings = serverStatuses = 0;
        }

        if (!buf.isReadable()) {
            // Maybe have no human-readable message
            return new OkMessage(isEndOfRows, affectedRows, lastInsertId, serverStatuses, warnings, "");
        }

        Charset charset = context.getClientCharset();

        if (capability.isSessionTrackAllowed()) {
            // Ignore session state changes, they are not used by this driver.
            String information = VarIntUtils.readVarIntSized(buf).toString(charset);

            return new OkMessage(isEndOfRows, affectedRows, lastInsertId, serverStatuses, warnings,
                information);
        }

        return new OkMessage(isEndOfRows, affectedRows, lastInsertId, serverStatuses, warnings,
            buf.toString(charset));
    }
}
