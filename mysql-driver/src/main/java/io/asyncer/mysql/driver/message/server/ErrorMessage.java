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
import io.netty.buffer.ByteBuf;
import io.r2dbc.spi.R2dbcBadGrammarException;
import io.r2dbc.spi.R2dbcDataIntegrityViolationException;
import io.r2dbc.spi.R2dbcException;
import io.r2dbc.spi.R2dbcNonTransientResourceException;
import io.r2dbc.spi.R2dbcPermissionDeniedException;
import io.r2dbc.spi.R2dbcRollbackException;
import io.r2dbc.spi.R2dbcTimeoutException;
import io.r2dbc.spi.R2dbcTransientResourceException;
import org.jetbrains.annotations.Nullable;

import java.nio.charset.StandardCharsets;
import java.util.Objects;

import static io.asyncer.mysql.driver.internal.util.AssertUtils.requireNonNull;

/**
 * A message considers an error that's reported by server-side. Not like JDBC MySQL, the SQL state is an
 * independent property.
 * <p>
 * The {@link #toException()} maps it to an exception of the R2DBC SPI hierarchy.
 */
public final class ErrorMessage implements ServerMessage {

    private static final byte SQL_STATE_MARKER = '#';

    private static final int SQL_STATE_SIZE = 5;

    private static final int ER_DBACCESS_DENIED_ERROR = 1044;

    private static final int ER_ACCESS_DENIED_ERROR = 1045;

    private static final int ER_CON_COUNT_ERROR = 1040;

    private static final int ER_LOCK_WAIT_TIMEOUT = 1205;

    private static final int ER_LOCK_DEADLOCK = 1213;

    private static final int ER_QUERY_TIMEOUT = 3024;

    private final int code;

    @Nullable
    private final String sqlState;

    private final String message;

    private ErrorMessage(int code, @Nullable String sqlState, String message) {
        this.code = code;
        this.sqlState = sqlState;
        this.message = requireNonNull(message, "message must not be null");
    }

    public int getCode() {
        return code;
    }

    @Nullable
    public String getSqlState() {
        return sqlState;
    }

    public String getMessage() {
        return message;
    }

    /**
     * Converts this error to an exception of the R2DBC SPI hierarchy, chosen by the error code and the SQL
     * state class.
     *
     * @return the exception, it is never thrown by this method.
     */
    public R2dbcException toException() {
        switch (code) {
            case ER_DBACCESS_DENIED_ERROR:
            case ER_ACCESS_DENIED_ERROR:
                return new R2dbcPermissionDeniedException(message, sqlState, code);
            case ER_CON_COUNT_ERROR:
                return new R2dbcTransientResourceException(message, sqlState, code);
            case ER_LOCK_WAIT_TIMEOUT:
            case ER_QUERY_TIMEOUT:
                return new R2dbcTimeoutException(message, sqlState, code);
            case ER_LOCK_DEADLOCK:
                return new R2dbcRollbackException(message, sqlState, code);
        }

        if (sqlState == null || sqlState.length() < 2) {
            return new R2dbcNonTransientResourceException(message, sqlState, code);
        }

        switch (sqlState.substring(0, 2)) {
            case "42": // Syntax error or access rule violation
                return new R2dbcBadGrammarException(message, sqlState, code);
            case "23": // Integrity constraint violation
                return new R2dbcDataIntegrityViolationException(message, sqlState, code);
            case "28": // Invalid authorization specification
                return new R2dbcPermissionDeniedException(message, sqlState, code);
            case "40": // Transaction rollback
                return new R2dbcRollbackException(message, sqlState, code);
            default:
                return new R2dbcNonTransientResourceException(message, sqlState, code);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ErrorMessage)) {
            return false;
        }

        ErrorMessage that = (ErrorMessage) o;

        return code == that.code && Objects.equals(sqlState, that.sqlState) && message.equals(that.message);
    }

    @Override
    public int hashCode() {
        int result = code;
        result = 31 * result + Objects.hashCode(sqlState);
        return 31 * result + message.hashCode();
    }

    @Override
    public String toString() {
        return "ErrorMessage{code=" + code + ", sqlState='" + sqlState + "', message='" + message + "'}";
    }

    static ErrorMessage decode(ByteBuf buf, ConnectionContext context) {
        buf.skipBytes(1); // 0xFF, error message header

        int code = buf.readUnsignedShortLE(); // error code should be unsigned
        String sqlState;

        // Exists only under the protocol 4.1, and maybe not exist in the handshake phase.
        if (buf.isReadable() && buf.getByte(buf.readerIndex()) == SQL_STATE_MARKER) {
            buf.skipBytes(1);
            sqlState = buf.readCharSequence(SQL_STATE_SIZE, StandardCharsets.US_ASCII).toString();
        } else {
            sqlState = null;
        }

        return new ErrorMessage(code, sqlState, buf.toString(context.getClientCharset()));
    }
}
