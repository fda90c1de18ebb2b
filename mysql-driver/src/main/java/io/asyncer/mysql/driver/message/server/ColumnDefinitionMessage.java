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
import io.asyncer.mysql.driver.internal.util.VarIntUtils;
import io.netty.buffer.ByteBuf;

import java.nio.charset.Charset;

import static io.asyncer.mysql.driver.internal.util.AssertUtils.requireNonNull;

/**
 * A column definition of a result set, under the protocol 4.1.
 */
public final class ColumnDefinitionMessage implements ServerMessage {

    private final String database;

    private final String table;

    private final String originTable;

    private final String name;

    private final String originName;

    private final int collationId;

    private final long size;

    private final short typeId;

    private final int flags;

    private final short decimals;

    private ColumnDefinitionMessage(String database, String table, String originTable, String name,
        String originName, int collationId, long size, short typeId, int flags, short decimals) {
        this.database = requireNonNull(database, "database must not be null");
        this.table = requireNonNull(table, "table must not be null");
        this.originTable = requireNonNull(originTable, "originTable must not be null");
        this.name = requireNonNull(name, "name must not be null");
        this.originName = requireNonNull(originName, "originName must not be null");
        this.collationId = collationId;
        this.size = size;
        this.typeId = typeId;
        this.flags = flags;
        this.decimals = decimals;
    }

    public String getDatabase() {
        return database;
    }

    /**
     * Get the table name, or its alias if the query uses one.
     *
     * @return the table name.
     */
    public String getTable() {
        return table;
    }

    public String getOriginTable() {
        return originTable;
    }

    /**
     * Get the column name, or its alias if the query uses one, i.e. the label of the column.
     *
     * @return the column name.
     */
    public String getName() {
        return name;
    }

    public String getOriginName() {
        return originName;
    }

    public int getCollationId() {
        return collationId;
    }

    /**
     * Get the maximum display size of the column, it is an unsigned 32-bits integer.
     *
     * @return the size.
     */
    public long getSize() {
        return size;
    }

    /**
     * Get the MySQL type identifier of the column, e.g. {@code 3} for {@code INT}, {@code 253} for
     * {@code VARCHAR}.
     *
     * @return the type identifier.
     */
    public short getTypeId() {
        return typeId;
    }

    public int getFlags() {
        return flags;
    }

    public short getDecimals() {
        return decimals;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ColumnDefinitionMessage)) {
            return false;
        }

        ColumnDefinitionMessage that = (ColumnDefinitionMessage) o;

        return collationId == that.collationId && size == that.size && typeId == that.typeId &&
            flags == that.flags && decimals == that.decimals && database.equals(that.database) &&
            table.equals(that.table) && originTable.equals(that.originTable) && name.equals(that.name) &&
            originName.equals(that.originName);
    }

    @Override
    public int hashCode() {
        int result = database.hashCode();
        result = 31 * result + table.hashCode();
        result = 31 * result + originTable.hashCode();
        result = 31 * result + name.hashCode();
        result = 31 * result + originName.hashCode();
        result = 31 * result + collationId;
        result = 31 * result + (int) (size ^ (size >>> 32));
        result = 31 * result + typeId;
        result = 31 * result + flags;
        return 31 * result + decimals;
    }

    @Override
    public String toString() {
        return "ColumnDefinitionMessage{database='" + database + "', table='" + table + "' (origin:'" +
            originTable + "'), name='" + name + "' (origin:'" + originName + "'), collationId=" +
            collationId + ", size=" + size + ", typeId=" + typeId + ", flags=" + flags + ", decimals=" +
            decimals + '}';
    }

    static ColumnDefinitionMessage decode(ByteBuf buf, ConnectionContext context) {
        Charset charset = context.getClientCharset();

        VarIntUtils.readVarIntSized(buf); // Catalog, always "def"

        String database = VarIntUtils.readVarIntSized(buf).toString(charset);
        String table = VarIntUtils.readVarIntSized(buf).toString(charset);
        String originTable = VarIntUtils.readVarIntSized(buf).toString(charset);
        String name = VarIntUtils.readVarIntSized(buf).toString(charset);
        String originName = VarIntUtils.readVarIntSized(buf).toString(charset);

        VarIntUtils.readVarInt(buf); // Size of following fields, always 0x0C

        int collationId = buf.readUnsignedShortLE();
        long size = buf.readUnsignedIntLE();
        short typeId = buf.readUnsignedByte();
        int flags = buf.readUnsignedShortLE();
        short decimals = buf.readUnsignedByte();

        return new ColumnDefinitionMessage(database, table, originTable, name, originName, collationId, size,
            typeId, flags, decimals);
    }
}
