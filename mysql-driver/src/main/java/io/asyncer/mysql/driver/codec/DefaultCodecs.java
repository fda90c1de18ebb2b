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

import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static io.asyncer.mysql.driver.internal.util.AssertUtils.requireNonNull;

/**
 * An implementation of {@link Codecs}.
 */
final class DefaultCodecs implements Codecs {

    static final DefaultCodecs INSTANCE = new DefaultCodecs(Arrays.asList(
        ByteCodec.INSTANCE,
        ShortCodec.INSTANCE,
        IntegerCodec.INSTANCE,
        LongCodec.INSTANCE,
        BigIntegerCodec.INSTANCE,

        BigDecimalCodec.INSTANCE,
        FloatCodec.INSTANCE,
        DoubleCodec.INSTANCE,

        BooleanCodec.INSTANCE,

        StringCodec.INSTANCE,
        ByteArrayCodec.INSTANCE
    ));

    private final Map<Class<?>, Codec<?>> fastPath;

    private DefaultCodecs(List<Codec<?>> codecs) {
        requireNonNull(codecs, "codecs must not be null");

        Map<Class<?>, Codec<?>> fastPath = new HashMap<>();

        for (Codec<?> codec : codecs) {
            fastPath.putIfAbsent(codec.getMainClass(), codec);

            if (codec instanceof PrimitiveCodec<?>) {
                fastPath.putIfAbsent(((PrimitiveCodec<?>) codec).getPrimitiveClass(), codec);
            }
        }

        this.fastPath = Collections.unmodifiableMap(fastPath);
    }

    /**
     * Note: this method should NEVER release {@code value} because of it come from {@code MySqlRows} which
     * will release the row packet.
     */
    @Nullable
    @Override
    public <T> T decode(FieldValue value, Class<?> type, CodecContext context) {
        requireNonNull(value, "value must not be null");
        requireNonNull(type, "type must not be null");
        requireNonNull(context, "context must not be null");

        Codec<T> codec = getCodec(type);

        if (value.isNull()) {
            // T is always an object, so null should be returned even if the type is a primitive class.
            return null;
        }

        return codec.decode(value.getValue(), context);
    }

    @Override
    public <T> T getDefault(Class<?> type) {
        requireNonNull(type, "type must not be null");

        Codec<T> codec = getCodec(type);

        return codec.getDefault();
    }

    @Override
    public boolean canDecode(Class<?> type) {
        return fastPath.containsKey(type);
    }

    @SuppressWarnings("unchecked")
    private <T> Codec<T> getCodec(Class<?> type) {
        Codec<?> codec = fastPath.get(type);

        if (codec == null) {
            throw new IllegalArgumentException("Cannot decode value of type '" + type.getTypeName() + "'");
        }

        return (Codec<T>) codec;
    }
}
