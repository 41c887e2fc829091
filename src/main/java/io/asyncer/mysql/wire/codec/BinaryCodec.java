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

package io.asyncer.mysql.wire.codec;

import io.asyncer.mysql.wire.buffer.PacketCursor;
import io.asyncer.mysql.wire.constant.Packets;
import io.asyncer.mysql.wire.internal.util.PacketBufferUtils;
import org.jetbrains.annotations.Nullable;

import java.nio.charset.Charset;

import static io.asyncer.mysql.wire.internal.util.AssertUtils.require;
import static io.asyncer.mysql.wire.internal.util.AssertUtils.requireArrayLength;
import static io.asyncer.mysql.wire.internal.util.AssertUtils.requireNonNull;

/**
 * Encode and decode the variable-width values of MySQL client/server protocol on a {@link PacketCursor}.
 * <p>
 * It holds no state, so it is safe to call from any thread as long as each call has its own cursor. A
 * write either completes or fails before any byte of it is written.
 *
 * @see <a href="https://dev.mysql.com/doc/dev/mysql-server/latest/page_protocol_basic_dt_integers.html">
 * Integer Types</a>
 * @see <a href="https://dev.mysql.com/doc/dev/mysql-server/latest/page_protocol_basic_dt_strings.html">
 * String Types</a>
 */
public final class BinaryCodec {

    /**
     * The value returned by {@link #readBinaryLength(PacketCursor)} when the length-encoded integer is
     * {@code NULL}.
     */
    public static final long NULL_LENGTH = -1;

    private static final int SIGN_BIT_24 = 0x800000;

    private static final int SIGN_EXTENSION_24 = 0xFF000000;

    private static final long MAX_INT_2_BYTE = 0xFFFF;

    private static final long MAX_INT_3_BYTE = 0xFFFFFF;

    /**
     * Reads a length-encoded integer.
     *
     * @param cursor the cursor to read.
     * @return the value, or {@link #NULL_LENGTH} if it is {@code NULL}.
     * @throws IllegalArgumentException       if {@code cursor} is {@code null}.
     * @throws UnknownLengthEncodingException if the first byte is not a length-encoded integer marker, no
     *                                        more bytes are read after the first byte.
     * @throws IndexOutOfBoundsException      if not enough readable bytes.
     */
    public static long readBinaryLength(PacketCursor cursor) {
        requireNonNull(cursor, "cursor must not be null");

        int marker = cursor.readUnsignedByte();

        if (marker <= Packets.VAR_INT_1_BYTE_LIMIT) {
            return marker;
        }

        switch (marker) {
            case Packets.NULL_CODE:
                return NULL_LENGTH;
            case Packets.VAR_INT_2_BYTE_CODE:
                return cursor.readUnsignedShort();
            case Packets.VAR_INT_3_BYTE_CODE:
                // The 3-byte length is unsigned, unlike read3ByteInt.
                return cursor.readUnsignedMedium();
            case Packets.VAR_INT_8_BYTE_CODE:
                return cursor.readLong();
            default:
                throw new UnknownLengthEncodingException(marker);
        }
    }

    /**
     * Writes a length-encoded integer in its shortest form. It never writes the {@code NULL} marker, see
     * also {@link #writeNull(PacketCursor)}.
     *
     * @param cursor the cursor to write.
     * @param length the non-negative value.
     * @throws IllegalArgumentException  if {@code cursor} is {@code null} or {@code length} is negative.
     * @throws IndexOutOfBoundsException if the cursor can not be expanded.
     */
    public static void writeLength(PacketCursor cursor, long length) {
        requireNonNull(cursor, "cursor must not be null");
        require(length >= 0, "length must not be negative");

        cursor.ensureWritable(sizeOfLength(length));
        writeLength0(cursor, length);
    }

    /**
     * Writes the {@code NULL} marker of length-encoded integer.
     *
     * @param cursor the cursor to write.
     * @throws IllegalArgumentException if {@code cursor} is {@code null}.
     */
    public static void writeNull(PacketCursor cursor) {
        requireNonNull(cursor, "cursor must not be null");

        cursor.writeByte(Packets.NULL_CODE);
    }

    /**
     * Calculates the encoded size of a length-encoded integer.
     *
     * @param length the non-negative value.
     * @return the bytes size, it is 1, 3, 4 or 9.
     * @throws IllegalArgumentException if {@code length} is negative.
     */
    public static int sizeOfLength(long length) {
        require(length >= 0, "length must not be negative");

        if (length <= Packets.VAR_INT_1_BYTE_LIMIT) {
            return Byte.BYTES;
        } else if (length <= MAX_INT_2_BYTE) {
            return Byte.BYTES + Short.BYTES;
        } else if (length <= MAX_INT_3_BYTE) {
            return Byte.BYTES + Packets.SIZE_FIELD_SIZE;
        }

        return Byte.BYTES + Long.BYTES;
    }

    /**
     * Reads a string of fixed bytes size, without any prefix or terminal.
     *
     * @param cursor  the cursor to read.
     * @param length  the bytes size of the string.
     * @param charset the character set of the string.
     * @return the string.
     * @throws IllegalArgumentException  if {@code cursor} or {@code charset} is {@code null}, or
     *                                   {@code length} is negative.
     * @throws IndexOutOfBoundsException if not enough readable bytes, nothing is read.
     */
    public static String readFixedString(PacketCursor cursor, int length, Charset charset) {
        requireNonNull(cursor, "cursor must not be null");
        requireNonNull(charset, "charset must not be null");
        require(length >= 0, "length must not be negative");

        return new String(cursor.readBytes(length), charset);
    }

    /**
     * Reads a length-encoded string. A {@code NULL} length is not a valid size, use
     * {@link #readNullableLengthEncodedString(PacketCursor, Charset)} if the value can be {@code NULL}.
     *
     * @param cursor  the cursor to read.
     * @param charset the character set of the string.
     * @return the string.
     * @throws IllegalArgumentException       if {@code cursor} or {@code charset} is {@code null}, or the
     *                                        length is {@code NULL} or greater than
     *                                        {@link Integer#MAX_VALUE}.
     * @throws UnknownLengthEncodingException if the length has an unknown marker.
     * @throws IndexOutOfBoundsException      if not enough readable bytes.
     */
    public static String readLengthEncodedString(PacketCursor cursor, Charset charset) {
        requireNonNull(charset, "charset must not be null");

        long length = readBinaryLength(cursor);

        return readFixedString(cursor, requireArrayLength(length, "length of string"), charset);
    }

    /**
     * Reads a length-encoded string which can be {@code NULL}.
     *
     * @param cursor  the cursor to read.
     * @param charset the character set of the string.
     * @return the string, or {@code null} if the length is {@code NULL}.
     * @throws IllegalArgumentException       if {@code cursor} or {@code charset} is {@code null}, or the
     *                                        length is greater than {@link Integer#MAX_VALUE}.
     * @throws UnknownLengthEncodingException if the length has an unknown marker.
     * @throws IndexOutOfBoundsException      if not enough readable bytes.
     */
    @Nullable
    public static String readNullableLengthEncodedString(PacketCursor cursor, Charset charset) {
        requireNonNull(charset, "charset must not be null");

        long length = readBinaryLength(cursor);

        if (length == NULL_LENGTH) {
            return null;
        }

        return readFixedString(cursor, requireArrayLength(length, "length of string"), charset);
    }

    /**
     * Writes a length-encoded string.
     *
     * @param cursor  the cursor to write.
     * @param value   the string.
     * @param charset the character set of the string.
     * @throws IllegalArgumentException  if any argument is {@code null}.
     * @throws IndexOutOfBoundsException if the cursor can not be expanded, nothing is written.
     */
    public static void writeLengthEncodedString(PacketCursor cursor, String value, Charset charset) {
        requireNonNull(cursor, "cursor must not be null");
        requireNonNull(value, "value must not be null");
        requireNonNull(charset, "charset must not be null");

        byte[] bytes = value.getBytes(charset);

        cursor.ensureWritable(sizeOfLength(bytes.length) + bytes.length);
        writeLength0(cursor, bytes.length);
        cursor.writeBytes(bytes);
    }

    /**
     * Reads a little-endian signed int24, the result is sign-extended if the highest bit of the last byte
     * is set.
     *
     * @param cursor the cursor to read.
     * @return the value, between -8388608 and 8388607.
     * @throws IllegalArgumentException  if {@code cursor} is {@code null}.
     * @throws IndexOutOfBoundsException if not enough readable bytes.
     */
    public static int read3ByteInt(PacketCursor cursor) {
        requireNonNull(cursor, "cursor must not be null");

        int first = cursor.readUnsignedByte();
        int second = cursor.readUnsignedByte();
        int third = cursor.readUnsignedByte();
        int value = third << 16 | second << 8 | first;

        if ((value & SIGN_BIT_24) != 0) {
            value |= SIGN_EXTENSION_24;
        }

        return value;
    }

    /**
     * Writes the low 24 bits of {@code value} as a little-endian int24, higher bits are discarded.
     *
     * @param cursor the cursor to write.
     * @param value  the value.
     * @throws IllegalArgumentException  if {@code cursor} is {@code null}.
     * @throws IndexOutOfBoundsException if the cursor can not be expanded.
     */
    public static void writeLongInt(PacketCursor cursor, int value) {
        requireNonNull(cursor, "cursor must not be null");

        cursor.writeMedium(value);
    }

    /**
     * Reads a C-style string.
     *
     * @param cursor  the cursor to read.
     * @param charset the character set of the string.
     * @return the string without terminal.
     * @see PacketBufferUtils#readCString(PacketCursor, Charset)
     */
    public static String readCString(PacketCursor cursor, Charset charset) {
        return PacketBufferUtils.readCString(cursor, charset);
    }

    /**
     * Reads a string until a terminal or the end of readable bytes.
     *
     * @param cursor  the cursor to read.
     * @param charset the character set of the string.
     * @return the string without terminal.
     * @see PacketBufferUtils#readUntilEof(PacketCursor, Charset)
     */
    public static String readUntilEof(PacketCursor cursor, Charset charset) {
        return PacketBufferUtils.readUntilEof(cursor, charset);
    }

    /**
     * Fills the header of a packet with sequence id 0.
     *
     * @param cursor the packet buffer, which has reserved the header.
     * @see PacketBufferUtils#writePacketLength(PacketCursor, int)
     */
    public static void writePacketLength(PacketCursor cursor) {
        writePacketLength(cursor, 0);
    }

    /**
     * Fills the header of a packet.
     *
     * @param cursor     the packet buffer, which has reserved the header.
     * @param sequenceId the sequence id of the packet.
     * @see PacketBufferUtils#writePacketLength(PacketCursor, int)
     */
    public static void writePacketLength(PacketCursor cursor, int sequenceId) {
        PacketBufferUtils.writePacketLength(cursor, sequenceId);
    }

    private static void writeLength0(PacketCursor cursor, long length) {
        if (length <= Packets.VAR_INT_1_BYTE_LIMIT) {
            cursor.writeByte((int) length);
        } else if (length <= MAX_INT_2_BYTE) {
            cursor.writeByte(Packets.VAR_INT_2_BYTE_CODE);
            cursor.writeShort((int) length);
        } else if (length <= MAX_INT_3_BYTE) {
            cursor.writeByte(Packets.VAR_INT_3_BYTE_CODE);
            cursor.writeMedium((int) length);
        } else {
            cursor.writeByte(Packets.VAR_INT_8_BYTE_CODE);
            cursor.writeLong(length);
        }
    }

    private BinaryCodec() { }
}
