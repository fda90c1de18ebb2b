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

import static io.asyncer.mysql.driver.internal.util.AssertUtils.require;

/**
 * Codec for primitive types, like {@code int} or {@code double}.
 *
 * @param <T> the boxed type of handling primitive data.
 */
abstract class AbstractPrimitiveCodec<T> implements PrimitiveCodec<T> {

    private final Class<T> primitiveClass;

    private final Class<T> boxedClass;

    private final T defaultValue;

    AbstractPrimitiveCodec(Class<T> primitiveClass, Class<T> boxedClass, T defaultValue) {
        require(primitiveClass.isPrimitive() && !boxedClass.isPrimitive(),
            "primitiveClass must be primitive and boxedClass must not be primitive");

        this.primitiveClass = primitiveClass;
        this.boxedClass = boxedClass;
        this.defaultValue = defaultValue;
    }

    @Override
    public final T getDefault() {
        return defaultValue;
    }

    @Override
    public final Class<? extends T> getMainClass() {
        return boxedClass;
    }

    @Override
    public final Class<T> getPrimitiveClass() {
        return primitiveClass;
    }
}
