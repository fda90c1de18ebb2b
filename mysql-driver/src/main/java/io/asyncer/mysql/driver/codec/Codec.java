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

import io.netty.buffer.ByteBuf;

/**
 * Codec to decode values based on MySQL text protocol.
 *
 * @param <T> the type that is handled by this codec.
 */
public interface Codec<T> {

    /**
     * Decodes a {@link ByteBuf} of a non-{@code null} text value. It should never release {@code value}
     * and never move its reader index.
     *
     * @param value   the {@link ByteBuf}.
     * @param context the codec context.
     * @return the decoded result.
     * @throws IllegalArgumentException if the text can not be converted, e.g. {@link NumberFormatException}.
     */
    T decode(ByteBuf value, CodecContext context);

    /**
     * Gets the zero value of the handling type, e.g. {@code 0} for {@code int}, an empty {@link String}.
     *
     * @return the zero value.
     */
    T getDefault();

    /**
     * Gets the main {@link Class} that is handled by this codec.
     *
     * @return the main {@link Class}.
     */
    Class<? extends T> getMainClass();
}
