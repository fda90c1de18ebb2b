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
import io.asyncer.mysql.driver.codec.Codecs;
import io.asyncer.mysql.driver.message.FieldValue;
import io.asyncer.mysql.driver.message.server.ColumnDefinitionMessage;
import io.asyncer.mysql.driver.message.server.TextRowDecoder;
import io.netty.buffer.ByteBuf;
import io.netty.util.internal.logging.InternalLogger;
import io.netty.util.internal.logging.InternalLoggerFactory;
import org.jetbrains.annotations.Nullable;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.List;

import static io.asyncer.mysql.driver.internal.util.AssertUtils.require;
import static io.asyncer.mysql.driver.internal.util.AssertUtils.requireNonNull;

/**
 * A forward-only cursor of the rows of a text protocol result.
 * <p>
 * {@link #next()} must be called before reading the first row, and until it returns {@code false} to read all
 * rows from the connection. Each accessor reads the next column of the current row, columns can not be read
 * twice or skipped back.
 * <p>
 * Accessors never throw. A column which can not be read or converted makes the accessor return the zero value
 * of the type, and the error is latched: the first error can be got by {@link #getLastError()}, and
 * {@link #next()} will return {@code false} since then.
 * <pre>{@code
 * try (MySqlRows rows = connection.query("SELECT id, name FROM users")) {
 *     while (rows.next()) {
 *         int id = rows.getInt();
 *         String name = rows.getNullableString();
 *     }
 *
 *     if (rows.getLastError() != null) {
 *         // handle error
 *     }
 * }
 * }</pre>
 * <p>
 * It is not thread-safe, same as the connection.
 */
public final class MySqlRows implements AutoCloseable {

    private static final InternalLogger logger = InternalLoggerFactory.getInstance(MySqlRows.class);

    private static final byte[] EMPTY_BYTES = {};

    private final RowSource source;

    private final List<ColumnDefinitionMessage> columns;

    private final CodecContext context;

    private final Codecs codecs;

    private State state = Opened.INSTANCE;

    @Nullable
    private RuntimeException error;

    private boolean wasNull;

    private boolean closed;

    MySqlRows(RowSource source, List<ColumnDefinitionMessage> columns, CodecContext context) {
        this.source = requireNonNull(source, "source must not be null");
        this.columns = requireNonNull(columns, "columns must not be null");
        this.context = requireNonNull(context, "context must not be null");
        this.codecs = Codecs.getInstance();
    }

    /**
     * Moves the cursor to the next row.
     * <p>
     * It returns {@code false} if there are no more rows, the stream failed, or an error has been latched.
     * Check {@link #getLastError()} once it returns {@code false}.
     *
     * @return if the cursor is on a row.
     */
    public boolean next() {
        if (state.isTerminal() || error != null) {
            return false;
        }

        ByteBuf packet;

        try {
            packet = source.nextRow();
        } catch (RuntimeException e) {
            // Any failure of the source ends the stream, e.g. an I/O error of a closed client.
            logger.debug("Failed to read the next row", e);
            releaseRow();
            latch(e);
            this.state = new Failed(e);

            return false;
        }

        releaseRow();

        if (packet == null) {
            this.state = Ended.INSTANCE;

            return false;
        }

        this.state = new OnRow(packet);

        return true;
    }

    /**
     * Checks if the last column read was {@code NULL}.
     *
     * @return if the last column was {@code NULL}.
     */
    public boolean wasNull() {
        return wasNull;
    }

    /**
     * Gets the first error that occurred during reading rows or columns, it should be checked after all rows
     * have been read.
     *
     * @return the first error, or {@code null} if none.
     */
    @Nullable
    public RuntimeException getLastError() {
        return error;
    }

    /**
     * Gets the column definitions of the result, it is empty if the statement returned no result set.
     *
     * @return the column definitions.
     */
    public List<ColumnDefinitionMessage> getColumns() {
        return columns;
    }

    public int getColumnCount() {
        return columns.size();
    }

    /**
     * Reads the next column as a specified type.
     *
     * @param type the specified type, e.g. {@code Integer.class}, {@code int.class}, {@code BigDecimal.class}.
     * @param <T>  the generic type.
     * @return the value, or {@code null} if it is {@code NULL}.
     * @throws IllegalArgumentException if {@code type} is {@code null} or unsupported.
     */
    @Nullable
    public <T> T getNullable(Class<T> type) {
        requireNonNull(type, "type must not be null");
        require(codecs.canDecode(type), "Cannot decode value of type '" + type.getTypeName() + "'");

        return read(type);
    }

    /**
     * Reads the next column as a specified type, {@code NULL} is read as the zero value of the type.
     *
     * @param type the specified type.
     * @param <T>  the generic type.
     * @return the value.
     * @throws IllegalArgumentException if {@code type} is {@code null} or unsupported.
     */
    public <T> T get(Class<T> type) {
        T value = getNullable(type);

        if (value == null) {
            return codecs.getDefault(type);
        }

        return value;
    }

    public byte[] getBytes() {
        byte[] value = getNullableBytes();

        return value == null ? EMPTY_BYTES : value;
    }

    @Nullable
    public byte[] getNullableBytes() {
        return read(byte[].class);
    }

    public String getString() {
        String value = getNullableString();

        return value == null ? "" : value;
    }

    @Nullable
    public String getNullableString() {
        return read(String.class);
    }

    /**
     * Reads the next column as a 32-bit {@code int}, {@code NULL} or an unconvertible value is read as
     * {@code 0}. It is the only plain accessor of the MySQL {@code INT} width, a value out of the range of
     * {@code int} is a conversion error instead of being widened, use {@link #getLong()} for 64-bit values.
     *
     * @return the value.
     */
    public int getInt() {
        Integer value = getNullableInt();

        return value == null ? 0 : value;
    }

    /**
     * Reads the next column as a 32-bit {@code Integer}, see also {@link #getInt()}.
     *
     * @return the value, or {@code null} if it is {@code NULL}.
     */
    @Nullable
    public Integer getNullableInt() {
        return read(Integer.class);
    }

    public byte getByte() {
        Byte value = getNullableByte();

        return value == null ? (byte) 0 : value;
    }

    @Nullable
    public Byte getNullableByte() {
        return read(Byte.class);
    }

    public short getShort() {
        Short value = getNullableShort();

        return value == null ? (short) 0 : value;
    }

    @Nullable
    public Short getNullableShort() {
        return read(Short.class);
    }

    public long getLong() {
        Long value = getNullableLong();

        return value == null ? 0 : value;
    }

    @Nullable
    public Long getNullableLong() {
        return read(Long.class);
    }

    public float getFloat() {
        Float value = getNullableFloat();

        return value == null ? 0 : value;
    }

    @Nullable
    public Float getNullableFloat() {
        return read(Float.class);
    }

    public double getDouble() {
        Double value = getNullableDouble();

        return value == null ? 0 : value;
    }

    @Nullable
    public Double getNullableDouble() {
        return read(Double.class);
    }

    public boolean getBoolean() {
        Boolean value = getNullableBoolean();

        return value != null && value;
    }

    @Nullable
    public Boolean getNullableBoolean() {
        return read(Boolean.class);
    }

    @Nullable
    public BigInteger getNullableBigInteger() {
        return read(BigInteger.class);
    }

    @Nullable
    public BigDecimal getNullableBigDecimal() {
        return read(BigDecimal.class);
    }

    /**
     * Discards all remaining rows, so that the connection can be used by the next query. A stream error met
     * while discarding is latched if no error has been latched. It does nothing if it has been closed.
     */
    @Override
    public void close() {
        if (closed) {
            return;
        }

        this.closed = true;

        int discarded = drain();

        if (discarded > 0) {
            logger.debug("Discarded {} unread rows on close", discarded);
        }
    }

    @Override
    public String toString() {
        return "MySqlRows{state=" + state + ", columns=" + columns.size() + ", error=" + error + '}';
    }

    /**
     * Reads and releases all remaining rows regardless of the latched error.
     *
     * @return the number of discarded rows.
     */
    int drain() {
        if (state.isTerminal()) {
            return 0;
        }

        releaseRow();

        int discarded = 0;

        while (true) {
            ByteBuf packet;

            try {
                packet = source.nextRow();
            } catch (RuntimeException e) {
                logger.debug("Failed to discard rows", e);
                latch(e);
                this.state = new Failed(e);

                return discarded;
            }

            if (packet == null) {
                this.state = Ended.INSTANCE;

                return discarded;
            }

            packet.release();
            ++discarded;
        }
    }

    /**
     * Checks if the stream has been read to its end, normally or by failure.
     *
     * @return if the stream has been drained.
     */
    boolean isDrained() {
        return state.isTerminal();
    }

    @Nullable
    private <T> T read(Class<?> type) {
        this.wasNull = false;

        if (!(state instanceof OnRow)) {
            latch(new IllegalStateException("No row is available, next() must return true before reading " +
                "columns"));

            return codecs.getDefault(type);
        }

        OnRow row = (OnRow) state;
        int index = row.index;
        FieldValue field;

        try {
            field = TextRowDecoder.decode(row.packet, row.offset);
        } catch (IndexOutOfBoundsException e) {
            latch(e);

            return codecs.getDefault(type);
        }

        row.offset = field.getNextOffset();
        row.index = index + 1;

        if (field.isNull()) {
            this.wasNull = true;

            return null;
        }

        try {
            return codecs.decode(field, type, context);
        } catch (IllegalArgumentException e) {
            logger.trace("Failed to convert column {} to {}", index, type.getTypeName(), e);
            latch(new ColumnConversionException(index, type, e));

            return codecs.getDefault(type);
        }
    }

    private void latch(RuntimeException e) {
        if (error == null) {
            this.error = e;
        }
    }

    private void releaseRow() {
        State state = this.state;

        if (state instanceof OnRow) {
            ((OnRow) state).packet.release();
        }
    }

    /**
     * The state of a {@link MySqlRows}, it is transitioned by {@link #next()} and draining.
     */
    private abstract static class State {

        abstract boolean isTerminal();
    }

    /**
     * No row has been fetched yet.
     */
    private static final class Opened extends State {

        static final Opened INSTANCE = new Opened();

        @Override
        boolean isTerminal() {
            return false;
        }

        @Override
        public String toString() {
            return "Opened";
        }
    }

    /**
     * A row has been fetched, the offset and the index point to the next unread column.
     */
    private static final class OnRow extends State {

        private final ByteBuf packet;

        private int offset;

        private int index;

        OnRow(ByteBuf packet) {
            this.packet = packet;
        }

        @Override
        boolean isTerminal() {
            return false;
        }

        @Override
        public String toString() {
            return "OnRow{offset=" + offset + ", index=" + index + '}';
        }
    }

    private static final class Ended extends State {

        static final Ended INSTANCE = new Ended();

        @Override
        boolean isTerminal() {
            return true;
        }

        @Override
        public String toString() {
            return "Ended";
        }
    }

    private static final class Failed extends State {

        private final RuntimeException cause;

        Failed(RuntimeException cause) {
            this.cause = cause;
        }

        @Override
        boolean isTerminal() {
            return true;
        }

        @Override
        public String toString() {
            return "Failed{cause=" + cause + '}';
        }
    }
}
