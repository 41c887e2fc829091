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

package io.asyncer.mysql.wire.codec.binary;

import io.asyncer.mysql.wire.buffer.PacketCursor;

/**
 * Encoder to write a parameter value of binary protocol, e.g. parameters of a prepared statement.
 */
public interface BinaryEncoder {

    /**
     * Checks if it can encode the specified value.
     *
     * @param value the specified value.
     * @return if it can encode.
     */
    boolean canEncode(Object value);

    /**
     * Encodes a value into the cursor.
     *
     * @param value  the specified value, it must be accepted by {@link #canEncode(Object)}.
     * @param cursor the cursor to write.
     * @throws IllegalArgumentException if {@code value} or {@code cursor} is {@code null}, or the value is
     *                                  not supported.
     */
    void encode(Object value, PacketCursor cursor);

    /**
     * Gets the MySQL column type that the encoded value should be declared as.
     *
     * @return the column type identifier.
     * @see io.asyncer.mysql.wire.constant.ColumnTypes
     */
    short getType();
}
