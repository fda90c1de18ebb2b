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

package io.asyncer.mysql.driver.message.client;

import io.asyncer.mysql.driver.ConnectionContext;
import io.netty.buffer.ByteBuf;

/**
 * The exit request message, i.e. {@code COM_QUIT}. The server closes the connection without any response.
 */
public final class ExitMessage extends ScalarClientMessage {

    public static final ExitMessage INSTANCE = new ExitMessage();

    private static final byte EXIT_FLAG = 1;

    private ExitMessage() { }

    @Override
    protected void writeTo(ByteBuf buf, ConnectionContext context) {
        buf.writeByte(EXIT_FLAG);
    }

    @Override
    public String toString() {
        return "ExitMessage{}";
    }
}
