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
import io.asyncer.mysql.driver.message.FieldValue;
import io.netty.buffer.ByteBuf;

/**
 * Decodes fields from a row of the text protocol. Each field is a length-encoded string, or {@code 0xFB}
 * for {@code NULL}.
 * <p>
 * It never changes the reader or writer index of the row, so the same row can be decoded from any field
 * offset and any number of times.
 */
public final class TextRowDecoder {

    /**
     * Decodes the field at {@code offset}.
     *
     * @param row    the row packet.
     * @param offset the offset of the field, relative to the reader index of {@code row}.
     * @return the field, its value is a slice of {@code row}.
     * @throws IndexOutOfBoundsException if there is no field at {@code offset}, or the field is truncated.
     */
    public static FieldValue decode(ByteBuf row, int offset) {
        int start = row.readerIndex();
        int index = start + offset;
        int end = row.writerIndex();

        if (offset < 0 || index >= end) {
            throw new IndexOutOfBoundsException("No field at offset " + offset + ", row size is " +
                row.readableBytes());
        }

        short code = row.getUnsignedByte(index);

        if (code == VarIntUtils.NULL_CODE) {
            return FieldValue.nullField(offset + 1);
        }

        long size;
        int sizeBytes;

        try {
            size = VarIntUtils.getVarInt(row, index);
            sizeBytes = VarIntUtils.sizeOf(code);
        } catch (IllegalArgumentException e) {
            throw new IndexOutOfBoundsException("Malformed field size at offset " + offset + ": " +
                e.getMessage());
        }

        int valueIndex = index + sizeBytes;

        if (size < 0 || size > end - valueIndex) {
            throw new IndexOutOfBoundsException("Field at offset " + offset + " needs " +
                Long.toUnsignedString(size) + " bytes but only " + (end - valueIndex) + " remaining");
        }

        int valueSize = (int) size;

        return FieldValue.normalField(row.slice(valueIndex, valueSize), valueIndex + valueSize - start);
    }

    private TextRowDecoder() { }
}
