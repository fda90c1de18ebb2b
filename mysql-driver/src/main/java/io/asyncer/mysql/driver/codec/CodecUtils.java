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
import org.jetbrains.annotations.Nullable;

import java.nio.charset.StandardCharsets;
import java.util.regex.Pattern;

/**
 * An utility considers strict parsing of text protocol values.
 * <p>
 * All parsers throw {@link NumberFormatException} (or {@link IllegalArgumentException}) for malformed or
 * out of range text, they never truncate or round a value into the range.
 */
final class CodecUtils {

    private static final Pattern DECIMAL_FLOAT = Pattern.compile(
        "[+-]?(?:[0-9]+(?:\\.[0-9]*)?|\\.[0-9]+)(?:[eE][+-]?[0-9]+)?");

    private static final Pattern SPECIAL_FLOAT = Pattern.compile("[+-]?(?:inf|infinity|nan)",
        Pattern.CASE_INSENSITIVE);

    /**
     * Parses a base 10 integer with an optional sign, e.g. {@code -128}, {@code +5}.
     *
     * @param buf the text bytes, its reader index will not be moved.
     * @param min the minimum value of the target width.
     * @param max the maximum value of the target width.
     * @return the integer.
     * @throws NumberFormatException if the text is not an integer, or it is out of {@code [min, max]}.
     */
    static long parseLong(ByteBuf buf, long min, long max) {
        int index = buf.readerIndex();
        int end = buf.writerIndex();

        if (index >= end) {
            throw new NumberFormatException("Empty text is not an integer");
        }

        byte first = buf.getByte(index);
        boolean negative = first == '-';

        if (negative || first == '+') {
            if (++index >= end) {
                throw notInteger(buf);
            }
        }

        // Accumulates negatively because of the magnitude of Long.MIN_VALUE.
        long limit = negative ? Long.MIN_VALUE : -Long.MAX_VALUE;
        long multiplyMin = limit / 10;
        long result = 0;

        for (; index < end; ++index) {
            int digit = buf.getByte(index) - '0';

            if (digit < 0 || digit > 9) {
                throw notInteger(buf);
            }

            if (result < multiplyMin) {
                throw outOfRange(buf, min, max);
            }

            result *= 10;

            if (result < limit + digit) {
                throw outOfRange(buf, min, max);
            }

            result -= digit;
        }

        long value = negative ? result : -result;

        if (value < min || value > max) {
            throw outOfRange(buf, min, max);
        }

        return value;
    }

    /**
     * Parses a 64-bits floating point number. {@code NaN}, {@code Inf} and {@code Infinity} are accepted with
     * an optional sign, case-insensitive.
     *
     * @param buf the text bytes, its reader index will not be moved.
     * @return the number.
     * @throws NumberFormatException if the text is not a number, or a finite number overflows.
     */
    static double parseDouble(ByteBuf buf) {
        String text = buf.toString(StandardCharsets.US_ASCII);
        Double special = parseSpecial(text);

        if (special != null) {
            return special;
        }

        requireDecimal(text);

        double value = Double.parseDouble(text);

        if (Double.isInfinite(value)) {
            throw new NumberFormatException("Value '" + text + "' out of range of double");
        }

        return value;
    }

    /**
     * Parses a 32-bits floating point number, same rules as {@link #parseDouble(ByteBuf)}.
     *
     * @param buf the text bytes, its reader index will not be moved.
     * @return the number.
     * @throws NumberFormatException if the text is not a number, or a finite number overflows.
     */
    static float parseFloat(ByteBuf buf) {
        String text = buf.toString(StandardCharsets.US_ASCII);
        Double special = parseSpecial(text);

        if (special != null) {
            return special.floatValue();
        }

        requireDecimal(text);

        float value = Float.parseFloat(text);

        if (Float.isInfinite(value)) {
            throw new NumberFormatException("Value '" + text + "' out of range of float");
        }

        return value;
    }

    /**
     * Parses a boolean, accepts {@code 1}, {@code t}, {@code T}, {@code true}, {@code TRUE}, {@code True} and
     * {@code 0}, {@code f}, {@code F}, {@code false}, {@code FALSE}, {@code False}.
     *
     * @param buf the text bytes, its reader index will not be moved.
     * @return the boolean.
     * @throws IllegalArgumentException if the text is not a boolean.
     */
    static boolean parseBoolean(ByteBuf buf) {
        String text = buf.toString(StandardCharsets.US_ASCII);

        switch (text) {
            case "1":
            case "t":
            case "T":
            case "true":
            case "TRUE":
            case "True":
                return true;
            case "0":
            case "f":
            case "F":
            case "false":
            case "FALSE":
            case "False":
                return false;
            default:
                throw new IllegalArgumentException("Value '" + text + "' is not a boolean");
        }
    }

    @Nullable
    private static Double parseSpecial(String text) {
        if (!SPECIAL_FLOAT.matcher(text).matches()) {
            return null;
        }

        if (text.regionMatches(true, text.length() - 3, "nan", 0, 3)) {
            return Double.NaN;
        }

        return text.charAt(0) == '-' ? Double.NEGATIVE_INFINITY : Double.POSITIVE_INFINITY;
    }

    private static void requireDecimal(String text) {
        if (!DECIMAL_FLOAT.matcher(text).matches()) {
            throw new NumberFormatException("Value '" + text + "' is not a number");
        }
    }

    private static NumberFormatException notInteger(ByteBuf buf) {
        return new NumberFormatException("Value '" + buf.toString(StandardCharsets.US_ASCII) +
            "' is not an integer");
    }

    private static NumberFormatException outOfRange(ByteBuf buf, long min, long max) {
        return new NumberFormatException("Value '" + buf.toString(StandardCharsets.US_ASCII) +
            "' out of range [" + min + ", " + max + "]");
    }

    private CodecUtils() { }
}
