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

package io.asyncer.mysql.driver.message;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;

import static io.asyncer.mysql.driver.internal.util.AssertUtils.requireNonNull;

/**
 * A field of a row, it is the value bytes of the field and the offset of the next field in the same row.
 * <p>
 * The value is a slice of the row packet, it is valid only while the row packet is not released, and it
 * should never be released by itself.
 */
public final class FieldValue {

    private final ByteBuf value;

    private final int nextOffset;

    private final boolean isNull;

    private FieldValue(ByteBuf value, int nextOffset, boolean isNull) {
        this.value = value;
        this.nextOffset = nextOffset;
        this.isNull = isNull;
    }

    /**
     * Checks if value is {@code null}.
     *
     * @return if value is {@code null}.
     */
    public boolean isNull() {
        return isNull;
    }

    /**
     * Gets the value bytes, it is empty if value is {@code null}.
     *
     * @return the value bytes.
     */
    public ByteBuf getValue() {
        return value;
    }

    /**
     * Gets the offset of the next field, relative to the beginning of the row.
     *
     * @return the offset of the next field.
     */
    public int getNextOffset() {
        return nextOffset;
    }

    @Override
    public String toString() {
        if (isNull) {
            return "FieldValue{NULL, nextOffset=" + nextOffset + '}';
        }

        return "FieldValue{size=" + value.readableBytes() + ", nextOffset=" + nextOffset + '}';
    }

    /**
     * Creates a field contains a {@code null} value.
     *
     * @param nextOffset the offset of the next field.
     * @return the field.
     */
    public static FieldValue nullField(int nextOffset) {
        return new FieldValue(Unpooled.EMPTY_BUFFER, nextOffset, true);
    }

    /**
     * Creates a field contains a value.
     *
     * @param value      the value bytes.
     * @param nextOffset the offset of the next field.
     * @return the field.
     */
    public static FieldValue normalField(ByteBuf value, int nextOffset) {
        return new FieldValue(requireNonNull(value, "value must not be null"), nextOffset, false);
    }
}
