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
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatIllegalArgumentException;

/**
 * Unit tests for {@link DefaultCodecs}.
 */
class DefaultCodecsTest {

    private final Codecs codecs = Codecs.getInstance();

    private final CodecContext context = () -> StandardCharsets.UTF_8;

    @Test
    void decodePrimitives() {
        assertThat(codecs.<Byte>decode(field("-128"), Byte.class, context)).isEqualTo((byte) -128);
        assertThat(codecs.<Short>decode(field("32767"), Short.TYPE, context)).isEqualTo((short) 32767);
        assertThat(codecs.<Integer>decode(field("123"), Integer.class, context)).isEqualTo(123);
        assertThat(codecs.<Integer>decode(field("123"), Integer.TYPE, context)).isEqualTo(123);
        assertThat(codecs.<Long>decode(field("-9000000000"), Long.class, context)).isEqualTo(-9000000000L);
        assertThat(codecs.<Float>decode(field("1.5"), Float.class, context)).isEqualTo(1.5f);
        assertThat(codecs.<Double>decode(field("3.14"), Double.TYPE, context)).isEqualTo(3.14);
        assertThat(codecs.<Boolean>decode(field("1"), Boolean.class, context)).isTrue();
    }

    @Test
    void decodeObjects() {
        assertThat(codecs.<BigInteger>decode(field("18446744073709551615"), BigInteger.class, context))
            .isEqualTo(new BigInteger("18446744073709551615"));
        assertThat(codecs.<BigDecimal>decode(field("12345.678"), BigDecimal.class, context))
            .isEqualByComparingTo("12345.678");
        assertThat(codecs.<String>decode(field("你好"), String.class, context)).isEqualTo("你好");
        assertThat(codecs.<byte[]>decode(field("ab"), byte[].class, context)).containsExactly('a', 'b');
        assertThat(codecs.<String>decode(field(""), String.class, context)).isEmpty();
    }

    @Test
    void decodeWithClientCharset() {
        Charset latin1 = StandardCharsets.ISO_8859_1;
        ByteBuf value = Unpooled.wrappedBuffer(new byte[] { (byte) 0xE9 });

        assertThat(codecs.<String>decode(FieldValue.normalField(value, 2), String.class, () -> latin1))
            .isEqualTo("é");
    }

    @Test
    void decodeNull() {
        FieldValue value = FieldValue.nullField(1);

        assertThat(codecs.<Integer>decode(value, Integer.TYPE, context)).isNull();
        assertThat(codecs.<String>decode(value, String.class, context)).isNull();
    }

    @Test
    void conversionFailed() {
        assertThatIllegalArgumentException()
            .isThrownBy(() -> codecs.decode(field("300"), Byte.class, context));
        assertThatIllegalArgumentException()
            .isThrownBy(() -> codecs.decode(field("1.5"), BigInteger.class, context));
        assertThatIllegalArgumentException()
            .isThrownBy(() -> codecs.decode(field("abc"), BigDecimal.class, context));
    }

    @Test
    void defaults() {
        assertThat(codecs.<Integer>getDefault(Integer.TYPE)).isZero();
        assertThat(codecs.<Long>getDefault(Long.class)).isZero();
        assertThat(codecs.<Boolean>getDefault(Boolean.class)).isFalse();
        assertThat(codecs.<String>getDefault(String.class)).isEmpty();
        assertThat(codecs.<byte[]>getDefault(byte[].class)).isEmpty();
        assertThat(codecs.<BigDecimal>getDefault(BigDecimal.class)).isEqualTo(BigDecimal.ZERO);
    }

    @Test
    void unsupported() {
        assertThat(codecs.canDecode(LocalDate.class)).isFalse();
        assertThat(codecs.canDecode(Integer.TYPE)).isTrue();
        assertThatIllegalArgumentException()
            .isThrownBy(() -> codecs.decode(field("2024-01-01"), LocalDate.class, context));
        assertThatIllegalArgumentException().isThrownBy(() -> codecs.getDefault(LocalDate.class));
    }

    private static FieldValue field(String text) {
        ByteBuf value = Unpooled.copiedBuffer(text, StandardCharsets.UTF_8);

        return FieldValue.normalField(value, value.readableBytes() + 1);
    }
}
