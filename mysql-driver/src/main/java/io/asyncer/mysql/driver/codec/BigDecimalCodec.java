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

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;

/**
 * Codec for {@link BigDecimal}, it is mostly used for {@code DECIMAL}.
 */
final class BigDecimalCodec implements Codec<BigDecimal> {

    static final BigDecimalCodec INSTANCE = new BigDecimalCodec();

    private BigDecimalCodec() {
    }

    @Override
    public BigDecimal decode(ByteBuf value, CodecContext context) {
        return new BigDecimal(value.toString(StandardCharsets.US_ASCII));
    }

    @Override
    public BigDecimal getDefault() {
        return BigDecimal.ZERO;
    }

    @Override
    public Class<? extends BigDecimal> getMainClass() {
        return BigDecimal.class;
    }
}
