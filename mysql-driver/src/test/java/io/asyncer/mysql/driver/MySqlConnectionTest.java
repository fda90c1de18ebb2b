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
import io.asyncer.mysql.driver.constant.ServerStatuses;
import io.asyncer.mysql.driver.constant.UnreadRowsPolicy;
import io.asyncer.mysql.driver.internal.util.TestPackets;
import io.asyncer.mysql.driver.message.client.ExitMessage;
import io.asyncer.mysql.driver.message.client.TextQueryMessage;
import io.asyncer.mysql.driver.message.server.OkMessage;
import io.netty.buffer.ByteBuf;
import io.r2dbc.spi.R2dbcBadGrammarException;
import io.r2dbc.spi.R2dbcDataIntegrityViolationException;
import io.r2dbc.spi.R2dbcNonTransientResourceException;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatExceptionOfType;
import static org.assertj.core.api.Assertions.assertThatIllegalArgumentException;
import static org.assertj.core.api.Assertions.assertThatIllegalStateException;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for {@link MySqlConnection}.
 */
class MySqlConnectionTest {

    @Test
    void query() {
        Client client = client();
        MySqlConnection connection = new MySqlConnection(client, UnreadRowsPolicy.FAIL_FAST);

        when(client.receive()).thenReturn(
            TestPackets.columnCount(2),
            TestPackets.columnDefinition("people", "name", 253),
            TestPackets.columnDefinition("people", "age", 3),
            TestPackets.row("Alice", "30"),
            TestPackets.row("Bob", null),
            TestPackets.okEof(ServerStatuses.AUTO_COMMIT)
        );

        MySqlRows rows = connection.query("SELECT name, age FROM people");

        verify(client).send(new TextQueryMessage("SELECT name, age FROM people"));
        assertThat(rows.getColumnCount()).isEqualTo(2);
        assertThat(rows.next()).isTrue();
        assertThat(rows.getString()).isEqualTo("Alice");
        assertThat(rows.getInt()).isEqualTo(30);
        assertThat(rows.next()).isTrue();
        assertThat(rows.getString()).isEqualTo("Bob");
        assertThat(rows.getNullableInt()).isNull();
        assertThat(rows.next()).isFalse();
        assertThat(rows.getLastError()).isNull();
    }

    @Test
    void queryWithoutResultSet() {
        Client client = client();
        MySqlConnection connection = new MySqlConnection(client, UnreadRowsPolicy.FAIL_FAST);

        when(client.receive()).thenReturn(
            TestPackets.ok(0, 0, ServerStatuses.IN_TRANSACTION, 0),
            TestPackets.ok(0, 0, ServerStatuses.AUTO_COMMIT, 0)
        );

        MySqlRows rows = connection.query("BEGIN");

        assertThat(connection.isInTransaction()).isTrue();
        assertThat(connection.isAutoCommit()).isFalse();

        // Not an unread result even if next() has never been called.
        connection.query("SET autocommit = 1");

        assertThat(rows.next()).isFalse();
        assertThat(rows.getLastError()).isNull();
        assertThat(connection.isAutoCommit()).isTrue();
    }

    @Test
    void failFastOnUnreadRows() {
        Client client = client();
        MySqlConnection connection = new MySqlConnection(client, UnreadRowsPolicy.FAIL_FAST);

        when(client.receive()).thenReturn(
            TestPackets.columnCount(1),
            TestPackets.columnDefinition("t", "v", 253),
            TestPackets.row("1"),
            TestPackets.row("2"),
            TestPackets.okEof(ServerStatuses.AUTO_COMMIT),
            TestPackets.ok(1, 0, ServerStatuses.AUTO_COMMIT, 0)
        );

        MySqlRows rows = connection.query("SELECT v FROM t");

        assertThat(rows.next()).isTrue();
        assertThatIllegalStateException().isThrownBy(() -> connection.query("SELECT 1"));
        assertThatIllegalStateException().isThrownBy(() -> connection.exec("DELETE FROM t"));
        verify(client, times(1)).send(any());

        while (rows.next()) {
            rows.getString();
        }

        assertThat(connection.exec("DELETE FROM t").getAffectedRows()).isOne();
    }

    @Test
    void conversionErrorDiscardsRowsUnderFailFast() {
        Client client = client();
        MySqlConnection connection = new MySqlConnection(client, UnreadRowsPolicy.FAIL_FAST);
        ByteBuf second = TestPackets.row("2");

        when(client.receive()).thenReturn(
            TestPackets.columnCount(1),
            TestPackets.columnDefinition("t", "v", 253),
            TestPackets.row("abc"),
            second,
            TestPackets.okEof(ServerStatuses.AUTO_COMMIT),
            TestPackets.ok(1, 0, ServerStatuses.AUTO_COMMIT, 0)
        );

        MySqlRows rows = connection.query("SELECT v FROM t");
        int count = 0;

        while (rows.next()) {
            rows.getInt();
            ++count;
        }

        assertThat(count).isOne();
        assertThat(rows.getLastError()).isInstanceOf(ColumnConversionException.class);
        assertThat(rows.isDrained()).isFalse();

        OkMessage ok = connection.exec("DELETE FROM t");

        assertThat(ok.getAffectedRows()).isOne();
        assertThat(rows.isDrained()).isTrue();
        assertThat(rows.getLastError()).isInstanceOf(ColumnConversionException.class);
        assertThat(second.refCnt()).isZero();
        verify(client, times(6)).receive();
    }

    @Test
    void drainUnreadRows() {
        Client client = client();
        MySqlConnection connection = new MySqlConnection(client, UnreadRowsPolicy.DRAIN);

        when(client.receive()).thenReturn(
            TestPackets.columnCount(1),
            TestPackets.columnDefinition("t", "v", 253),
            TestPackets.row("1"),
            TestPackets.row("2"),
            TestPackets.row("3"),
            TestPackets.okEof(ServerStatuses.AUTO_COMMIT),
            TestPackets.ok(3, 0, ServerStatuses.AUTO_COMMIT, 0)
        );

        MySqlRows rows = connection.query("SELECT v FROM t");

        assertThat(rows.next()).isTrue();

        OkMessage ok = connection.exec("DELETE FROM t");

        assertThat(ok.getAffectedRows()).isEqualTo(3);
        assertThat(rows.isDrained()).isTrue();
        assertThat(rows.next()).isFalse();
        verify(client, times(7)).receive();
    }

    @Test
    void dispatchFailure() {
        Client client = client();
        MySqlConnection connection = new MySqlConnection(client, UnreadRowsPolicy.FAIL_FAST);

        doThrow(new R2dbcNonTransientResourceException("Broken pipe")).when(client).send(any());

        assertThatExceptionOfType(R2dbcNonTransientResourceException.class)
            .isThrownBy(() -> connection.query("SELECT 1"));
        verify(client, never()).receive();
    }

    @Test
    void queryError() {
        Client client = client();
        MySqlConnection connection = new MySqlConnection(client, UnreadRowsPolicy.FAIL_FAST);

        when(client.receive()).thenReturn(TestPackets.error(1146, "42S02", "Table 'test.nope' doesn't exist"));

        assertThatExceptionOfType(R2dbcBadGrammarException.class)
            .isThrownBy(() -> connection.query("SELECT * FROM nope"))
            .satisfies(e -> assertThat(e.getErrorCode()).isEqualTo(1146));
    }

    @Test
    void exec() {
        Client client = client();
        MySqlConnection connection = new MySqlConnection(client, UnreadRowsPolicy.FAIL_FAST);

        when(client.receive()).thenReturn(
            TestPackets.ok(1, 7, ServerStatuses.AUTO_COMMIT, 0),
            TestPackets.error(1062, "23000", "Duplicate entry '7' for key 'PRIMARY'")
        );

        OkMessage ok = connection.exec("INSERT INTO t VALUES (7)");

        assertThat(ok.getAffectedRows()).isOne();
        assertThat(ok.getLastInsertId()).isEqualTo(7);
        assertThatExceptionOfType(R2dbcDataIntegrityViolationException.class)
            .isThrownBy(() -> connection.exec("INSERT INTO t VALUES (7)"));
    }

    @Test
    void close() {
        Client client = client();
        MySqlConnection connection = new MySqlConnection(client, UnreadRowsPolicy.FAIL_FAST);

        when(client.receive()).thenReturn(
            TestPackets.columnCount(1),
            TestPackets.columnDefinition("t", "v", 253),
            TestPackets.row("1"),
            TestPackets.row("2"),
            TestPackets.okEof(ServerStatuses.AUTO_COMMIT)
        );

        MySqlRows rows = connection.query("SELECT v FROM t");

        connection.close();
        connection.close();

        assertThat(rows.isDrained()).isTrue();
        verify(client, times(1)).send(ExitMessage.INSTANCE);
        verify(client, times(1)).close();
        assertThatIllegalStateException().isThrownBy(() -> connection.query("SELECT 1"));
        assertThatIllegalStateException().isThrownBy(() -> connection.exec("SELECT 1"));
    }

    @Test
    void closeBrokenConnection() {
        Client client = client();
        MySqlConnection connection = new MySqlConnection(client, UnreadRowsPolicy.FAIL_FAST);

        when(client.isConnected()).thenReturn(false);

        connection.close();

        verify(client, never()).send(any());
        verify(client).close();
    }

    @Test
    void attachToStreams() {
        byte[] input = concat(
            TestPackets.response(
                TestPackets.columnCount(1),
                TestPackets.columnDefinition("t", "greeting", 253),
                TestPackets.eof(ServerStatuses.AUTO_COMMIT),
                TestPackets.row("hello"),
                TestPackets.row("世界"),
                TestPackets.eof(ServerStatuses.AUTO_COMMIT)
            ),
            TestPackets.response(TestPackets.ok(2, 0, ServerStatuses.AUTO_COMMIT, 0))
        );
        ByteArrayOutputStream output = new ByteArrayOutputStream();
        long bitmap = Capability.DEFAULT.getBitmap() & ~(1L << 24);
        MySqlConnection connection = MySqlConnection.attach(new ByteArrayInputStream(input), output,
            Capability.of(bitmap), MySqlConnectionConfiguration.builder().readBufferSize(16).build());

        try (MySqlRows rows = connection.query("SELECT greeting FROM t")) {
            assertThat(rows.next()).isTrue();
            assertThat(rows.getString()).isEqualTo("hello");
            assertThat(rows.next()).isTrue();
            assertThat(rows.getString()).isEqualTo("世界");
            assertThat(rows.next()).isFalse();
            assertThat(rows.getLastError()).isNull();
        }

        assertThat(connection.exec("UPDATE t SET greeting = 'hi'").getAffectedRows()).isEqualTo(2);

        connection.close();

        byte[] sent = output.toByteArray();
        String query = "SELECT greeting FROM t";

        assertThat(sent).startsWith(query.length() + 1, 0, 0, 0, 3);
        assertThat(new String(sent, 5, query.length(), StandardCharsets.UTF_8)).isEqualTo(query);
        assertThat(Arrays.copyOfRange(sent, sent.length - 5, sent.length)).containsExactly(1, 0, 0, 0, 1);
    }

    @Test
    void attachBadArguments() {
        MySqlConnectionConfiguration configuration = MySqlConnectionConfiguration.builder().build();
        ByteArrayInputStream input = new ByteArrayInputStream(new byte[0]);
        ByteArrayOutputStream output = new ByteArrayOutputStream();

        assertThatIllegalArgumentException().isThrownBy(() -> MySqlConnection.attach(input, output,
            Capability.of(0), configuration));
        assertThatIllegalArgumentException().isThrownBy(() -> MySqlConnection.attach(input, output,
            Capability.DEFAULT, null));
        assertThatIllegalArgumentException().isThrownBy(() -> MySqlConnection.attach(input, output,
            Capability.DEFAULT, configuration).query(null));
    }

    private static Client client() {
        Client client = mock(Client.class);
        ConnectionContext context = ConnectionContextTest.mock();

        when(client.getContext()).thenReturn(context);
        when(client.isConnected()).thenReturn(true);

        return client;
    }

    private static byte[] concat(byte[] first, byte[] second) {
        byte[] result = Arrays.copyOf(first, first.length + second.length);

        System.arraycopy(second, 0, result, first.length, second.length);

        return result;
    }
}
