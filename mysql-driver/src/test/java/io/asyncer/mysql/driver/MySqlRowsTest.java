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

import io.asyncer.mysql.driver.internal.util.TestPackets;
import io.asyncer.mysql.driver.message.server.ColumnDefinitionMessage;
import io.asyncer.mysql.driver.message.server.ServerMessageDecoder;
import io.netty.buffer.ByteBuf;
import io.r2dbc.spi.R2dbcException;
import io.r2dbc.spi.R2dbcNonTransientResourceException;
import org.jetbrains.annotations.Nullable;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.LocalDate;
import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Collections;
import java.util.Deque;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatIllegalArgumentException;

/**
 * Unit tests for {@link MySqlRows}.
 */
class MySqlRowsTest {

    @Test
    void nextYieldsRowsInOrder() {
        QueueRowSource source = new QueueRowSource(TestPackets.row("1"), TestPackets.row("2"),
            TestPackets.row("3"));
        MySqlRows rows = rows(source);

        assertThat(rows.next()).isTrue();
        assertThat(rows.getInt()).isEqualTo(1);
        assertThat(rows.next()).isTrue();
        assertThat(rows.getInt()).isEqualTo(2);
        assertThat(rows.next()).isTrue();
        assertThat(rows.getInt()).isEqualTo(3);
        assertThat(rows.next()).isFalse();
        assertThat(rows.next()).isFalse();
        assertThat(rows.getLastError()).isNull();
        assertThat(rows.isDrained()).isTrue();
        assertThat(source.calls).isEqualTo(4);
    }

    @Test
    void zeroRows() {
        QueueRowSource source = new QueueRowSource();
        MySqlRows rows = rows(source);

        assertThat(rows.next()).isFalse();
        assertThat(rows.getLastError()).isNull();
        assertThat(rows.next()).isFalse();
        assertThat(source.calls).isOne();
    }

    @Test
    void nullColumns() {
        MySqlRows rows = rows(new QueueRowSource(TestPackets.row(new String[11])));

        assertThat(rows.next()).isTrue();
        assertThat(rows.getNullableBytes()).isNull();
        assertThat(rows.wasNull()).isTrue();
        assertThat(rows.getNullableString()).isNull();
        assertThat(rows.getNullableInt()).isNull();
        assertThat(rows.getNullableByte()).isNull();
        assertThat(rows.getNullableShort()).isNull();
        assertThat(rows.getNullableLong()).isNull();
        assertThat(rows.getNullableFloat()).isNull();
        assertThat(rows.getNullableDouble()).isNull();
        assertThat(rows.getNullableBoolean()).isNull();
        assertThat(rows.getNullableBigInteger()).isNull();
        assertThat(rows.getNullableBigDecimal()).isNull();
        assertThat(rows.wasNull()).isTrue();
        assertThat(rows.getLastError()).isNull();
    }

    @Test
    void plainAccessorsReturnZeroOnNull() {
        MySqlRows rows = rows(new QueueRowSource(TestPackets.row(new String[9])));

        assertThat(rows.next()).isTrue();
        assertThat(rows.getBytes()).isEmpty();
        assertThat(rows.getString()).isEmpty();
        assertThat(rows.getInt()).isZero();
        assertThat(rows.wasNull()).isTrue();
        assertThat(rows.getByte()).isZero();
        assertThat(rows.getShort()).isZero();
        assertThat(rows.getLong()).isZero();
        assertThat(rows.getFloat()).isZero();
        assertThat(rows.getDouble()).isZero();
        assertThat(rows.getBoolean()).isFalse();
        assertThat(rows.getLastError()).isNull();
    }

    @Test
    void mixedRow() {
        MySqlRows rows = rows(new QueueRowSource(TestPackets.row("42", null, "3.14")));

        assertThat(rows.next()).isTrue();
        assertThat(rows.getInt()).isEqualTo(42);
        assertThat(rows.wasNull()).isFalse();
        assertThat(rows.getNullableString()).isNull();
        assertThat(rows.wasNull()).isTrue();
        assertThat(rows.getDouble()).isEqualTo(3.14);
        assertThat(rows.wasNull()).isFalse();
        assertThat(rows.next()).isFalse();
        assertThat(rows.getLastError()).isNull();
    }

    @Test
    void allTypes() {
        MySqlRows rows = rows(new QueueRowSource(TestPackets.row("raw", "text", "-2147483648", "-128", "32767",
            "9223372036854775807", "1.5", "2.25", "t", "18446744073709551615", "0.1")));

        assertThat(rows.next()).isTrue();
        assertThat(rows.getBytes()).containsExactly('r', 'a', 'w');
        assertThat(rows.getString()).isEqualTo("text");
        assertThat(rows.getNullableInt()).isEqualTo(Integer.MIN_VALUE);
        assertThat(rows.getByte()).isEqualTo(Byte.MIN_VALUE);
        assertThat(rows.getNullableShort()).isEqualTo(Short.MAX_VALUE);
        assertThat(rows.getLong()).isEqualTo(Long.MAX_VALUE);
        assertThat(rows.getFloat()).isEqualTo(1.5f);
        assertThat(rows.getNullableDouble()).isEqualTo(2.25);
        assertThat(rows.getBoolean()).isTrue();
        assertThat(rows.getNullableBigInteger()).isEqualTo(new BigInteger("18446744073709551615"));
        assertThat(rows.getNullableBigDecimal()).isEqualTo(new BigDecimal("0.1"));
        assertThat(rows.getLastError()).isNull();
    }

    @Test
    void conversionFailureLatches() {
        MySqlRows rows = rows(new QueueRowSource(TestPackets.row("123", "abc"), TestPackets.row("1", "2")));

        assertThat(rows.next()).isTrue();
        assertThat(rows.getInt()).isEqualTo(123);
        assertThat(rows.getNullableInt()).isEqualTo(0);
        assertThat(rows.wasNull()).isFalse();
        assertThat(rows.getLastError()).isExactlyInstanceOf(ColumnConversionException.class);

        ColumnConversionException e = (ColumnConversionException) rows.getLastError();

        assertThat(e.getIndex()).isOne();
        assertThat(e.getType()).isEqualTo(Integer.class);
        assertThat(e.getCause()).isInstanceOf(NumberFormatException.class);
    }

    @Test
    void outOfRange() {
        MySqlRows rows = rows(new QueueRowSource(TestPackets.row("2147483648", "128", "40000", "1e39", "yes")));

        assertThat(rows.next()).isTrue();
        assertThat(rows.getInt()).isZero();
        assertThat(rows.getByte()).isZero();
        assertThat(rows.getShort()).isZero();
        assertThat(rows.getFloat()).isZero();
        assertThat(rows.getNullableBoolean()).isFalse();
        assertThat(((ColumnConversionException) rows.getLastError()).getIndex()).isZero();
    }

    @Test
    void firstErrorWins() {
        QueueRowSource source = new QueueRowSource(TestPackets.row("abc", "x"), TestPackets.row("1", "2"));
        MySqlRows rows = rows(source);

        assertThat(rows.next()).isTrue();
        rows.getInt();
        rows.getLong();

        RuntimeException first = rows.getLastError();

        assertThat(first).isExactlyInstanceOf(ColumnConversionException.class);
        assertThat(((ColumnConversionException) first).getIndex()).isZero();
        assertThat(((ColumnConversionException) first).getType()).isEqualTo(Integer.class);

        rows.getString();

        assertThat(rows.getLastError()).isSameAs(first);

        // A latched error stops the cursor without ending the stream.
        assertThat(rows.next()).isFalse();
        assertThat(source.calls).isOne();
        assertThat(rows.isDrained()).isFalse();
    }

    @Test
    void consecutiveColumnsAndPastEnd() {
        MySqlRows rows = rows(new QueueRowSource(TestPackets.row("a", "b")));

        assertThat(rows.next()).isTrue();
        assertThat(rows.getString()).isEqualTo("a");
        assertThat(rows.getString()).isEqualTo("b");
        assertThat(rows.getString()).isEmpty();
        assertThat(rows.getNullableInt()).isEqualTo(0);
        assertThat(rows.getLastError()).isInstanceOf(IndexOutOfBoundsException.class);
    }

    @Test
    void readBeforeNext() {
        MySqlRows rows = rows(new QueueRowSource(TestPackets.row("1")));

        assertThat(rows.getInt()).isZero();
        assertThat(rows.getNullableString()).isEmpty();
        assertThat(rows.getLastError()).isInstanceOf(IllegalStateException.class);
        assertThat(rows.next()).isFalse();
    }

    @Test
    void readAfterEnd() {
        MySqlRows rows = rows(new QueueRowSource(TestPackets.row("1")));

        assertThat(rows.next()).isTrue();
        assertThat(rows.next()).isFalse();
        assertThat(rows.getLastError()).isNull();
        assertThat(rows.getLong()).isZero();
        assertThat(rows.getLastError()).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void sourceFailsOnSecondCall() {
        R2dbcException failure = new R2dbcNonTransientResourceException("Connection reset");
        QueueRowSource source = new QueueRowSource(TestPackets.row("1"), failure);
        MySqlRows rows = rows(source);

        assertThat(rows.next()).isTrue();
        assertThat(rows.next()).isFalse();
        assertThat(rows.getLastError()).isSameAs(failure);
        assertThat(rows.next()).isFalse();
        assertThat(source.calls).isEqualTo(2);
        assertThat(rows.isDrained()).isTrue();
    }

    @Test
    void sourceFailsWithUncheckedException() {
        UncheckedIOException failure = new UncheckedIOException(new IOException("Broken pipe"));
        ByteBuf first = TestPackets.row("1");
        QueueRowSource source = new QueueRowSource(first, failure);
        MySqlRows rows = rows(source);

        assertThat(rows.next()).isTrue();
        assertThat(rows.next()).isFalse();
        assertThat(rows.next()).isFalse();
        assertThat(rows.getLastError()).isSameAs(failure);
        assertThat(rows.getInt()).isZero();
        assertThat(rows.getLastError()).isSameAs(failure);
        assertThat(source.calls).isEqualTo(2);
        assertThat(rows.isDrained()).isTrue();
        assertThat(first.refCnt()).isZero();
    }

    @Test
    void drainFailsWithUncheckedException() {
        IllegalStateException failure = new IllegalStateException("Client has been closed or broken");
        ByteBuf first = TestPackets.row("1");
        QueueRowSource source = new QueueRowSource(first, TestPackets.row("2"), failure);
        MySqlRows rows = rows(source);

        assertThat(rows.next()).isTrue();
        assertThat(rows.drain()).isOne();
        assertThat(rows.isDrained()).isTrue();
        assertThat(rows.getLastError()).isSameAs(failure);
        assertThat(first.refCnt()).isZero();

        rows.close();

        assertThat(source.calls).isEqualTo(3);
        assertThat(rows.next()).isFalse();
    }

    @Test
    void sourceFailureDoesNotReplaceLatchedError() {
        R2dbcException failure = new R2dbcNonTransientResourceException("Connection reset");
        MySqlRows rows = rows(new QueueRowSource(TestPackets.row("x"), failure));

        assertThat(rows.next()).isTrue();
        rows.getInt();
        rows.close();

        assertThat(rows.getLastError()).isExactlyInstanceOf(ColumnConversionException.class);
        assertThat(rows.isDrained()).isTrue();
    }

    @Test
    void releasePackets() {
        ByteBuf first = TestPackets.row("1");
        ByteBuf second = TestPackets.row("2");
        MySqlRows rows = rows(new QueueRowSource(first, second));

        assertThat(rows.next()).isTrue();
        assertThat(first.refCnt()).isOne();
        assertThat(rows.next()).isTrue();
        assertThat(first.refCnt()).isZero();
        assertThat(second.refCnt()).isOne();
        assertThat(rows.next()).isFalse();
        assertThat(second.refCnt()).isZero();
    }

    @Test
    void closeDrainsRemainingRows() {
        ByteBuf first = TestPackets.row("1");
        ByteBuf second = TestPackets.row("2");
        ByteBuf third = TestPackets.row("3");
        QueueRowSource source = new QueueRowSource(first, second, third);
        MySqlRows rows = rows(source);

        assertThat(rows.next()).isTrue();
        assertThat(rows.drain()).isEqualTo(2);
        assertThat(rows.isDrained()).isTrue();
        assertThat(first.refCnt()).isZero();
        assertThat(second.refCnt()).isZero();
        assertThat(third.refCnt()).isZero();

        rows.close();
        rows.close();

        assertThat(source.calls).isEqualTo(4);
        assertThat(rows.next()).isFalse();
        assertThat(rows.getLastError()).isNull();
    }

    @Test
    void closeAfterConversionError() {
        QueueRowSource source = new QueueRowSource(TestPackets.row("x"), TestPackets.row("1"));

        try (MySqlRows rows = rows(source)) {
            while (rows.next()) {
                rows.getInt();
            }

            assertThat(rows.getLastError()).isInstanceOf(ColumnConversionException.class);
            assertThat(rows.isDrained()).isFalse();
        }

        assertThat(source.calls).isEqualTo(3);
    }

    @Test
    void typedGet() {
        MySqlRows rows = rows(new QueueRowSource(TestPackets.row("12.50", null, "7", null)));

        assertThat(rows.next()).isTrue();
        assertThat(rows.get(BigDecimal.class)).isEqualByComparingTo("12.5");
        assertThat(rows.getNullable(String.class)).isNull();
        assertThat(rows.get(int.class)).isEqualTo(7);
        assertThat(rows.get(BigInteger.class)).isEqualTo(BigInteger.ZERO);
        assertThat(rows.wasNull()).isTrue();
        assertThat(rows.getLastError()).isNull();
    }

    @Test
    void unsupportedType() {
        MySqlRows rows = rows(new QueueRowSource(TestPackets.row("2024-01-01", "1")));

        assertThat(rows.next()).isTrue();
        assertThatIllegalArgumentException().isThrownBy(() -> rows.getNullable(LocalDate.class));
        assertThatIllegalArgumentException().isThrownBy(() -> rows.get(null));
        assertThat(rows.getLastError()).isNull();
        // The column has not been consumed.
        assertThat(rows.getString()).isEqualTo("2024-01-01");
    }

    @Test
    void malformedRowLatches() {
        ByteBuf row = TestPackets.row("a");

        row.writeByte(9).writeByte('b');

        MySqlRows rows = rows(new QueueRowSource(row));

        assertThat(rows.next()).isTrue();
        assertThat(rows.getString()).isEqualTo("a");
        assertThat(rows.getString()).isEmpty();
        assertThat(rows.getLastError()).isInstanceOf(IndexOutOfBoundsException.class);
    }

    @Test
    void stringWithClientCharset() {
        MySqlRows rows = rows(new QueueRowSource(TestPackets.row("数据库")));

        assertThat(rows.next()).isTrue();
        assertThat(rows.getString()).isEqualTo("数据库");
    }

    @Test
    void columns() {
        ConnectionContext context = ConnectionContextTest.mock();
        ColumnDefinitionMessage id = (ColumnDefinitionMessage) ServerMessageDecoder.decodeMetadata(
            TestPackets.columnDefinition("users", "id", 3), context);
        ColumnDefinitionMessage name = (ColumnDefinitionMessage) ServerMessageDecoder.decodeMetadata(
            TestPackets.columnDefinition("users", "name", 253), context);
        MySqlRows rows = new MySqlRows(new QueueRowSource(), Arrays.asList(id, name), context);

        assertThat(rows.getColumnCount()).isEqualTo(2);
        assertThat(rows.getColumns()).extracting(ColumnDefinitionMessage::getName).containsExactly("id", "name");
        assertThat(rows.getColumns().get(1).getTypeId()).isEqualTo((short) 253);
    }

    private static MySqlRows rows(RowSource source) {
        return new MySqlRows(source, Collections.emptyList(), ConnectionContextTest.mock());
    }

    /**
     * A {@link RowSource} which returns packets or throws errors in order, then the end of stream.
     */
    private static final class QueueRowSource implements RowSource {

        private final Deque<Object> items;

        private int calls;

        QueueRowSource(Object... items) {
            this.items = new ArrayDeque<>(Arrays.asList(items));
        }

        @Nullable
        @Override
        public ByteBuf nextRow() {
            ++calls;

            Object item = items.poll();

            if (item instanceof RuntimeException) {
                throw (RuntimeException) item;
            }

            return (ByteBuf) item;
        }
    }
}
