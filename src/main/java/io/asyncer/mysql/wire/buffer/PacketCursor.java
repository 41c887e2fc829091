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

package io.asyncer.mysql.wire.buffer;

/**
 * A byte cursor over a growable buffer, which has an independent reader index and writer index.
 * <p>
 * All multi-byte values are read and written in the MySQL wire order, i.e. little-endian. A read that
 * requests more bytes than readable throws {@link IndexOutOfBoundsException} without moving the reader
 * index.
 * <p>
 * Note: a cursor is not thread-safe, cursor advancement is a mutation.
 */
public interface PacketCursor {

    int readableBytes();

    int writableBytes();

    int readerIndex();

    int writerIndex();

    /**
     * Makes sure that at least {@code size} bytes can be written, expanding the underlying buffer if
     * necessary.
     *
     * @param size the number of bytes about to be written.
     * @throws IndexOutOfBoundsException if the buffer can not be expanded to hold {@code size} more bytes.
     */
    void ensureWritable(int size);

    byte readByte();

    short readUnsignedByte();

    byte[] readBytes(int length);

    int readUnsignedShort();

    int readUnsignedMedium();

    long readLong();

    /**
     * Gets a byte at an absolute index, without moving any index.
     *
     * @param index the absolute index.
     * @return the byte.
     */
    byte getByte(int index);

    void skipBytes(int length);

    /**
     * Writes the low 8 bits of {@code value}.
     *
     * @param value the value.
     */
    void writeByte(int value);

    /**
     * Writes the low 16 bits of {@code value}.
     *
     * @param value the value.
     */
    void writeShort(int value);

    /**
     * Writes the low 24 bits of {@code value}.
     *
     * @param value the value.
     */
    void writeMedium(int value);

    void writeBytes(byte[] bytes);

    /**
     * Sets the low 8 bits of {@code value} at an absolute index, without moving any index.
     *
     * @param index the absolute index.
     * @param value the value.
     */
    void setByte(int index, int value);

    /**
     * Sets the low 24 bits of {@code value} at an absolute index, without moving any index. It is used to
     * fill a reserved packet header in place.
     *
     * @param index the absolute index.
     * @param value the value.
     */
    void setMedium(int index, int value);

    void writeLong(long value);
}
