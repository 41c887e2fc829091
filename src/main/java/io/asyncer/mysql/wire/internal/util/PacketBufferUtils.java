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

package io.asyncer.mysql.wire.internal.util;

import io.asyncer.mysql.wire.buffer.PacketCursor;
import io.asyncer.mysql.wire.constant.Packets;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufAllocator;
import io.netty.util.internal.logging.InternalLogger;
import io.netty.util.internal.logging.InternalLoggerFactory;

import java.nio.charset.Charset;

import static io.asyncer.mysql.wire.internal.util.AssertUtils.require;
import static io.asyncer.mysql.wire.internal.util.AssertUtils.requireNonNull;

/**
 * An internal utility for packet buffers: allocating a buffer with a reserved header, filling the header
 * after the payload is written, and reading the terminated strings of MySQL protocol.
 */
public final class PacketBufferUtils {

    private static final InternalLogger logger = InternalLoggerFactory.getInstance(PacketBufferUtils.class);

    private static final int MAX_SEQUENCE_ID = 0xFF;

    /**
     * Allocates a buffer for a packet. The header is reserved with zeros, so the payload can be written
     * directly and the header filled by {@link #writePacketLength(PacketCursor, int)} later.
     *
     * @param allocator the {@link ByteBufAllocator} used to allocate the buffer.
     * @return a buffer that's writer index is after the header, it should be released by the caller.
     * @throws IllegalArgumentException if {@code allocator} is {@code null}.
     */
    public static ByteBuf packetBuffer(ByteBufAllocator allocator) {
        requireNonNull(allocator, "allocator must not be null");

        ByteBuf buf = allocator.buffer();

        try {
            return buf.writeZero(Packets.NORMAL_HEADER_SIZE);
        } catch (Throwable e) {
            buf.release();
            throw e;
        }
    }

    /**
     * Fills the packet header at the absolute index 0 of a packet buffer, the payload size is everything
     * written after the header. Neither reader index nor writer index is moved.
     *
     * @param cursor     the packet buffer.
     * @param sequenceId the sequence id of the packet, between 0 and 255.
     * @throws IllegalArgumentException if {@code cursor} is {@code null}, {@code sequenceId} is out of
     *                                  range, the header is not reserved or the payload is too large.
     */
    public static void writePacketLength(PacketCursor cursor, int sequenceId) {
        requireNonNull(cursor, "cursor must not be null");
        require(sequenceId >= 0 && sequenceId <= MAX_SEQUENCE_ID, "sequenceId must be between 0 and 255");

        int size = cursor.writerIndex() - Packets.NORMAL_HEADER_SIZE;

        require(size >= 0, "packet header must be reserved before writing packet length");
        require(size <= Packets.MAX_PAYLOAD_SIZE, "payload size must not be greater than 16777215");

        cursor.setMedium(0, size);
        cursor.setByte(Packets.SIZE_FIELD_SIZE, sequenceId);

        if (logger.isTraceEnabled()) {
            logger.trace("Packet header written with size {} and sequence id {}", size, sequenceId);
        }
    }

    /**
     * Reads a C-style string, the terminal is consumed but not a part of the result.
     *
     * @param cursor  the cursor to read.
     * @param charset the character set of the string.
     * @return the string without terminal.
     * @throws IllegalArgumentException  if {@code cursor} or {@code charset} is {@code null}.
     * @throws IndexOutOfBoundsException if no terminal in readable bytes, the reader index is not moved.
     */
    public static String readCString(PacketCursor cursor, Charset charset) {
        requireNonNull(cursor, "cursor must not be null");
        requireNonNull(charset, "charset must not be null");

        int size = indexOfTerminal(cursor);

        if (size < 0) {
            throw new IndexOutOfBoundsException("C-style string terminal not found in " +
                cursor.readableBytes() + " readable bytes");
        }

        String result = new String(cursor.readBytes(size), charset);

        cursor.skipBytes(1);

        return result;
    }

    /**
     * Reads a string until a terminal or the end of readable bytes. The terminal is consumed if it exists.
     *
     * @param cursor  the cursor to read.
     * @param charset the character set of the string.
     * @return the string without terminal, or empty string if nothing readable.
     * @throws IllegalArgumentException if {@code cursor} or {@code charset} is {@code null}.
     */
    public static String readUntilEof(PacketCursor cursor, Charset charset) {
        requireNonNull(cursor, "cursor must not be null");
        requireNonNull(charset, "charset must not be null");

        if (cursor.readableBytes() == 0) {
            return "";
        }

        int size = indexOfTerminal(cursor);

        if (size < 0) {
            return new String(cursor.readBytes(cursor.readableBytes()), charset);
        }

        String result = new String(cursor.readBytes(size), charset);

        cursor.skipBytes(1);

        return result;
    }

    /**
     * Finds the terminal in readable bytes.
     *
     * @param cursor the cursor to find.
     * @return the offset of terminal relative to the reader index, or {@code -1} if not found.
     */
    private static int indexOfTerminal(PacketCursor cursor) {
        int start = cursor.readerIndex();
        int end = start + cursor.readableBytes();

        for (int i = start; i < end; ++i) {
            if (cursor.getByte(i) == Packets.TERMINAL) {
                return i - start;
            }
        }

        return -1;
    }

    private PacketBufferUtils() { }
}
