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

import io.netty.buffer.ByteBuf;
import io.r2dbc.spi.R2dbcException;
import org.jetbrains.annotations.Nullable;

/**
 * A sequential source of row packets of a result set, it is the only channel between a {@link MySqlRows} and
 * the connection.
 */
public interface RowSource {

    /**
     * Reads the next row packet.
     *
     * @return the next row packet, the caller owns and should release it, or {@code null} if the result is
     * ended. It keeps returning {@code null} once the result has been ended, normally or by failure.
     * @throws R2dbcException if the stream failed, e.g. I/O failure, an error from server or malformed
     *                        packets.
     */
    @Nullable
    ByteBuf nextRow();
}
