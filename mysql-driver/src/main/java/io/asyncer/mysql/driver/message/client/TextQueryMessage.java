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

import static io.asyncer.mysql.driver.internal.util.AssertUtils.requireNonNull;

/**
 * A plain text SQL query message, i.e. {@code COM_QUERY}. The server responds with an OK message, an error
 * message, or a result set in the text protocol.
 */
public final class TextQueryMessage extends ScalarClientMessage {

    static final byte QUERY_FLAG = 3;

    private final String sql;

    /**
     * Creates a {@link TextQueryMessage} without parameter.
     *
     * @param sql plain text SQL, should not contain any parameter placeholder.
     * @throws IllegalArgumentException if {@code sql} is {@code null}.
     */
    public TextQueryMessage(String sql) {
        this.sql = requireNonNull(sql, "sql must not be null");
    }

    @Override
    protected void writeTo(ByteBuf buf, ConnectionContext context) {
        buf.writeByte(QUERY_FLAG).writeCharSequence(sql, context.getClientCharset());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof TextQueryMessage)) {
            return false;
        }

        TextQueryMessage that = (TextQueryMessage) o;

        return sql.equals(that.sql);
    }

    @Override
    public int hashCode() {
        return sql.hashCode();
    }

    @Override
    public String toString() {
        return "TextQueryMessage{sql=REDACTED}";
    }
}
