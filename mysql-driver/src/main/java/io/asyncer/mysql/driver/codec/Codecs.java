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

package io.asyncer.mysql.driver.codec;

import io.asyncer.mysql.driver.message.FieldValue;
import org.jetbrains.annotations.Nullable;

/**
 * Bind all codecs for all types.
 */
public interface Codecs {

    /**
     * Decodes a {@link FieldValue} as specified {@link Class} type.
     *
     * @param value   the {@link FieldValue}.
     * @param type    the specified {@link Class}, it can be a primitive class like {@link Integer#TYPE}.
     * @param context the codec context.
     * @param <T>     the generic result type.
     * @return the decoded result, {@code null} if the value is {@code null}.
     * @throws IllegalArgumentException if {@code type} is unsupported, or the value can not be converted.
     */
    @Nullable
    <T> T decode(FieldValue value, Class<?> type, CodecContext context);

    /**
     * Gets the zero value of a specified {@link Class} type.
     *
     * @param type the specified {@link Class}.
     * @param <T>  the generic result type.
     * @return the zero value, e.g. {@code 0} for {@link Integer}, an empty {@link String}.
     * @throws IllegalArgumentException if {@code type} is unsupported.
     */
    <T> T getDefault(Class<?> type);

    /**
     * Checks if a specified {@link Class} type can be decoded.
     *
     * @param type the specified {@link Class}.
     * @return if it is supported.
     */
    boolean canDecode(Class<?> type);

    /**
     * Gets the default {@link Codecs} which supports all built-in types.
     *
     * @return the {@link Codecs}.
     */
    static Codecs getInstance() {
        return DefaultCodecs.INSTANCE;
    }
}
