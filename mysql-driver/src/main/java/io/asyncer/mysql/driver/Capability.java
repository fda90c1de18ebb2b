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

/**
 * A capabilities flag bitmap which is negotiated by the handshake of the connection, it decides how the
 * responses of commands are encoded.
 * <p>
 * The handshake is not performed by this driver, the bitmap is given by whoever authenticated the stream.
 */
public final class Capability {

    /**
     * If UNSET, the server supports the MariaDB protocol and statements.
     */
    private static final long CLIENT_MYSQL = 1L;

    /**
     * Use found/touched rows instead of changed rows for affected rows.
     */
    private static final long FOUND_ROWS = 2L;

    /**
     * Use 2-bytes definition flags of column definitions.
     */
    private static final long LONG_FLAG = 4L;

    /**
     * Connect to server with a database.
     */
    private static final long CONNECT_WITH_DB = 8L;

//    private static final long LOCAL_FILES = 128L; // LOAD DATA LOCAL INFILE is not supported.

    /**
     * The protocol version is 4.1 (instead of 3.20).
     */
    private static final long PROTOCOL_41 = 512L;

    /**
     * Enable SSL.
     */
    private static final long SSL = 2048L;

    /**
     * Allow transactions. All available versions of MySQL server support it.
     */
    private static final long TRANSACTIONS = 8192L;

    /**
     * Allow second part of authentication hashing salt.
     */
    private static final long SECURE_SALT = 32768L;

    /**
     * Allow to send multiple statements in text query.
     */
    private static final long MULTI_STATEMENTS = 65536L;

    /**
     * Allow to receive multiple results in the response of executing a text query.
     */
    private static final long MULTI_RESULTS = 1L << 17;

    /**
     * Supports authentication plugins.
     */
    private static final long PLUGIN_AUTH = 1L << 19;

    /**
     * The OK message carries a length-encoded information and session state changes.
     */
    private static final long SESSION_TRACK = 1L << 23;

    /**
     * The MySQL server marks the EOF message as deprecated and use OK message instead.
     */
    private static final long DEPRECATE_EOF = 1L << 24;

    private static final long ALL_SUPPORTED = CLIENT_MYSQL | FOUND_ROWS | LONG_FLAG | CONNECT_WITH_DB |
        PROTOCOL_41 | SSL | TRANSACTIONS | SECURE_SALT | MULTI_STATEMENTS | MULTI_RESULTS | PLUGIN_AUTH |
        SESSION_TRACK | DEPRECATE_EOF;

    /**
     * The capabilities which a MySQL 5.7.5 or above server negotiates with a common client.
     */
    public static final Capability DEFAULT = of(CLIENT_MYSQL | FOUND_ROWS | LONG_FLAG | PROTOCOL_41 |
        TRANSACTIONS | SECURE_SALT | MULTI_RESULTS | PLUGIN_AUTH | DEPRECATE_EOF);

    private final long bitmap;

    /**
     * Checks if the connection is using MariaDB capabilities.
     *
     * @return if using MariaDB capabilities.
     */
    public boolean isMariaDb() {
        return (bitmap & CLIENT_MYSQL) == 0;
    }

    /**
     * Checks if the connection is using protocol 4.1.
     *
     * @return if using protocol 4.1.
     */
    public boolean isProtocol41() {
        return (bitmap & PROTOCOL_41) != 0;
    }

    /**
     * Checks if server supports transaction.
     *
     * @return if server supported.
     */
    public boolean isTransactionAllowed() {
        return (bitmap & TRANSACTIONS) != 0;
    }

    /**
     * Checks if server supports multiple-statement. i.e. computed statement.
     *
     * @return if server supported.
     */
    public boolean isMultiStatementsAllowed() {
        return (bitmap & MULTI_STATEMENTS) != 0;
    }

    /**
     * Checks if the OK message contains length-encoded information and session states.
     *
     * @return if session track enabled.
     */
    public boolean isSessionTrackAllowed() {
        return (bitmap & SESSION_TRACK) != 0;
    }

    /**
     * Checks if server marks EOF message as deprecated.
     *
     * @return if EOF message was deprecated.
     */
    public boolean isEofDeprecated() {
        return (bitmap & DEPRECATE_EOF) != 0;
    }

    /**
     * Get the bitmap of {@link Capability this}.
     *
     * @return the bitmap.
     */
    public long getBitmap() {
        return bitmap;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Capability)) {
            return false;
        }

        Capability that = (Capability) o;

        return bitmap == that.bitmap;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(bitmap);
    }

    @Override
    public String toString() {
        // Do not consider complex output, just use hex.
        return "Capability<0x" + Long.toHexString(bitmap) + '>';
    }

    private Capability(long bitmap) {
        this.bitmap = bitmap;
    }

    /**
     * Creates a {@link Capability} with capabilities bitmap. It will unset all unknown or unsupported
     * flags.
     *
     * @param capabilities the bitmap of capabilities.
     * @return the {@link Capability} without unknown flags.
     */
    public static Capability of(long capabilities) {
        return new Capability(capabilities & ALL_SUPPORTED);
    }
}
