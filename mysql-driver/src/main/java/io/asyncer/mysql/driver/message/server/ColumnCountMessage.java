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

import io.asyncer.mysql.driver.internal.util.VarIntUtils;
import io.netty.buffer.ByteBuf;

/**
 * The header of a result set, it contains the count of columns which definitions will follow.
 */
public final class ColumnCountMessage implements ServerMessage {

    private final int totalColumns;

    private ColumnCountMessage(int totalColumns) {
        this.totalColumns = totalColumns;
    }

    public int getTotalColumns() {
        return totalColumns;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ColumnCountMessage)) {
            return false;
        }

        ColumnCountMessage that = (ColumnCountMessage) o;

        return totalColumns == that.totalColumns;
    }

    @Override
    public int hashCode() {
        return totalColumns;
    }

    @Override
    public String toString() {
        return "ColumnCountMessage{totalColumns=" + totalColumns + '}';
    }

    static ColumnCountMessage decode(ByteBuf buf) {
        long totalColumns = VarIntUtils.readVarInt(buf);

        if (totalColumns <= 0 || totalColumns > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("Invalid count of columns: " +
                Long.toUnsignedString(totalColumns));
        }

        return new ColumnCountMessage((int) totalColumns);
    }
}
