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

import io.r2dbc.spi.R2dbcNonTransientException;

/**
 * An exception considers the text value of a column can not be converted to the requested type, e.g.
 * {@code "abc"} read as an {@code int}, or {@code "300"} read as a {@code byte}.
 * <p>
 * It is never thrown by {@link MySqlRows}, it is latched and can be got by {@link MySqlRows#getLastError()}.
 */
public final class ColumnConversionException extends R2dbcNonTransientException {

    private static final long serialVersionUID = -3154285619475813692L;

    private final int index;

    private final Class<?> type;

    ColumnConversionException(int index, Class<?> type, Throwable cause) {
        super("Cannot convert column " + index + " to " + type.getTypeName() + ": " + cause.getMessage(), cause);

        this.index = index;
        this.type = type;
    }

    /**
     * Gets the zero-based index of the column in its row.
     *
     * @return the column index.
     */
    public int getIndex() {
        return index;
    }

    /**
     * Gets the requested type of the conversion.
     *
     * @return the requested type.
     */
    public Class<?> getType() {
        return type;
    }
}
