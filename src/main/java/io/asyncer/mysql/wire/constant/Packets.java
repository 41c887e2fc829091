/*
 * Copyright 2024 asyncer.io projects
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

package io.asyncer.mysql.wire.constant;

/**
 * Constants for MySQL protocol packets and length-encoded values.
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
     * The terminal of C-style string or C-style binary data.
     */
    public static final byte TERMINAL = 0;

    /**
     * The largest value that a length-encoded integer stores in its first byte.
     */
    public static final int VAR_INT_1_BYTE_LIMIT = 0xFA;

    /**
     * The first byte of a length-encoded integer which means the value is {@code NULL}.
     */
    public static final int NULL_CODE = 0xFB;

    /**
     * The first byte of a length-encoded integer followed by an unsigned int16.
     */
    public static final int VAR_INT_2_BYTE_CODE = 0xFC;

    /**
     * The first byte of a length-encoded integer followed by an unsigned int24.
     */
    public static final int VAR_INT_3_BYTE_CODE = 0xFD;

    /**
     * The first byte of a length-encoded integer followed by an int64.
     */
    public static final int VAR_INT_8_BYTE_CODE = 0xFE;

    private Packets() { }
}
