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
import io.netty.buffer.ByteBufUtil;

/**
 * Codec for {@code byte[]}, it copies the raw bytes of the value.
 */
final class ByteArrayCodec implements Codec<byte[]> {

    static final ByteArrayCodec INSTANCE = new ByteArrayCodec();

    private static final byte[] EMPTY_BYTES = {};

    private ByteArrayCodec() {
    }

    @Override
    public byte[] decode(ByteBuf value, CodecContext context) {
        if (!value.isReadable()) {
            return EMPTY_BYTES;
        }

        return ByteBufUtil.getBytes(value);
    }

    @Override
    public byte[] getDefault() {
        return EMPTY_BYTES;
    }

    @Override
    public Class<? extends byte[]> getMainClass() {
        return byte[].class;
    }
}
