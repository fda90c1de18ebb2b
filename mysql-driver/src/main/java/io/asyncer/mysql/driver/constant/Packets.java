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

package io.asyncer.mysql.driver.constant;

/**
 * Constants for MySQL protocol packets.
 * <p>
 * WARNING: do NOT use it outer than {@literal mysql-driver}.
 */
public final class Packets {

    /**
     * The length of the byte size field, it is 3 bytes.
     */
    public static final int SIZE_FIELD_SIZE = 3;

    /**
     * The max bytes size of payload, value is 16777215. (i.e. max value of int24, (2 ** 24) - 1)
     */
    public static final int MAX_PAYLOAD_SIZE = 0xFFFFFF;

    /**
     * The header size of a normal frame, which includes entire frame size (unsigned int24) and normal
     * sequence id (unsigned int8).
     */
    public static final int NORMAL_HEADER_SIZE = SIZE_FIELD_SIZE + 1;

    /**
     * The first byte of an OK message.
     */
    public static final short OK_HEADER = 0x00;

    /**
     * The first byte of an EOF message, or an OK message which terminates rows if EOF is deprecated.
     */
    public static final short EOF_HEADER = 0xFE;

    /**
     * The first byte of an error message.
     */
    public static final short ERROR_HEADER = 0xFF;

    /**
     * The first byte of a {@code LOAD DATA LOCAL INFILE} request.
     */
    public static final short LOCAL_INFILE_HEADER = 0xFB;

    /**
     * An EOF message is always smaller than this size, a row may start with {@link #EOF_HEADER} when its
     * first field is a huge length-encoded string.
     */
    public static final int EOF_MAX_SIZE = 9;

    private Packets() { }
}
