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
 * Codec for {@code long}.
 * <p>
 * Note: {@code BIGINT UNSIGNED} values greater than {@link Long#MAX_VALUE} are rejected, read them as a
 * {@link java.math.BigInteger} instead.
 */
final class LongCodec extends AbstractPrimitiveCodec<Long> {

    static final LongCodec INSTANCE = new LongCodec();

    private LongCodec() {
        super(Long.TYPE, Long.class, 0L);
    }

    @Override
    public Long decode(ByteBuf value, CodecContext context) {
        return CodecUtils.parseLong(value, Long.MIN_VALUE, Long.MAX_VALUE);
    }
}
