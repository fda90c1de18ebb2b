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

package io.asyncer.mysql.driver.internal.util;

import io.netty.buffer.ByteBuf;

/**
 * A utility for reading length-encoded integers (var-int) of the MySQL protocol.
 * <p>
 * The first byte decides the size: less than {@code 0xFB} is the value itself, {@code 0xFC} is followed by
 * an unsigned int16, {@code 0xFD} by an unsigned int24 and {@code 0xFE} by an int64. {@code 0xFB} marks a
 * {@code NULL} value in row data and {@code 0xFF} is never a var-int.
 */
public final class VarIntUtils {

    public static final short NULL_CODE = 0xFB;

    private static final short VAR_INT_2_BYTE_CODE = 0xFC;

    private static final short VAR_INT_3_BYTE_CODE = 0xFD;

    private static final short VAR_INT_8_BYTE_CODE = 0xFE;

    /**
     * Reads a var-int at the reader index and moves the reader index after it.
     *
     * @param buf the buffer.
     * @return the value, may be negative if it is greater than {@code Long.MAX_VALUE}.
     * @throws IllegalArgumentException  if the first byte is not a var-int code.
     * @throws IndexOutOfBoundsException if the buffer is truncated.
     */
    public static long readVarInt(ByteBuf buf) {
        int index = buf.readerIndex();
        long value = getVarInt(buf, index);

        buf.readerIndex(index + sizeOf(buf.getUnsignedByte(index)));

        return value;
    }

    /**
     * Gets a var-int at an absolute index without moving any index of the buffer.
     *
     * @param buf   the buffer.
     * @param index the absolute index of the first byte.
     * @return the value, may be negative if it is greater than {@code Long.MAX_VALUE}.
     * @throws IllegalArgumentException  if the first byte is not a var-int code.
     * @throws IndexOutOfBoundsException if the buffer is truncated.
     */
    public static long getVarInt(ByteBuf buf, int index) {
        short code = buf.getUnsignedByte(index);

        if (code < NULL_CODE) {
            return code;
        }

        int size = sizeOf(code);

        if (index + size > buf.writerIndex()) {
            throw new IndexOutOfBoundsException("Truncated var-int, need " + size + " bytes from index " +
                index + " but writer index is " + buf.writerIndex());
        }

        switch (code) {
            case VAR_INT_2_BYTE_CODE:
                return buf.getUnsignedShortLE(index + 1);
            case VAR_INT_3_BYTE_CODE:
                return buf.getUnsignedMediumLE(index + 1);
            default:
                return buf.getLongLE(index + 1);
        }
    }

    /**
     * Gets the total size of a var-int, including the first byte.
     *
     * @param code the first byte, as unsigned.
     * @return the size in bytes.
     * @throws IllegalArgumentException if {@code code} is not a var-int code.
     */
    public static int sizeOf(short code) {
        if (code < NULL_CODE) {
            return Byte.BYTES;
        }

        switch (code) {
            case VAR_INT_2_BYTE_CODE:
                return Byte.BYTES + Short.BYTES;
            case VAR_INT_3_BYTE_CODE:
                return Byte.BYTES + 3;
            case VAR_INT_8_BYTE_CODE:
                return Byte.BYTES + Long.BYTES;
            default:
                throw new IllegalArgumentException("Not a var-int code: 0x" + Integer.toHexString(code));
        }
    }

    /**
     * Reads a length-encoded string at the reader index as a slice, and moves the reader index after it.
     *
     * @param buf the buffer.
     * @return the slice of the string content, which shares the content of {@code buf}.
     * @throws IndexOutOfBoundsException if the buffer is truncated.
     */
    public static ByteBuf readVarIntSized(ByteBuf buf) {
        long size = readVarInt(buf);

        if (size < 0 || size > buf.readableBytes()) {
            throw new IndexOutOfBoundsException("Length-encoded content of " + Long.toUnsignedString(size) +
                " bytes exceeds readable bytes " + buf.readableBytes());
        }

        return buf.readSlice((int) size);
    }

    private VarIntUtils() { }
}
