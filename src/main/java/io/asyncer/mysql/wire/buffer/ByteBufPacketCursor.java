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

import io.netty.buffer.ByteBuf;

import static io.asyncer.mysql.wire.internal.util.AssertUtils.requireNonNull;

/**
 * A {@link PacketCursor} backed by a netty {@link ByteBuf}.
 * <p>
 * It never retains or releases the {@link ByteBuf}, the reference count is always owned by the caller.
 */
public final class ByteBufPacketCursor implements PacketCursor {

    private final ByteBuf buf;

    private ByteBufPacketCursor(ByteBuf buf) {
        this.buf = buf;
    }

    /**
     * Wraps a {@link ByteBuf} as a {@link PacketCursor}, the cursor shares indexes with the {@code buf}.
     *
     * @param buf the buffer.
     * @return the cursor.
     * @throws IllegalArgumentException if {@code buf} is {@code null}.
     */
    public static ByteBufPacketCursor wrap(ByteBuf buf) {
        return new ByteBufPacketCursor(requireNonNull(buf, "buf must not be null"));
    }

    public ByteBuf unwrap() {
        return buf;
    }

    @Override
    public int readableBytes() {
        return buf.readableBytes();
    }

    @Override
    public int writableBytes() {
        return buf.writableBytes();
    }

    @Override
    public int readerIndex() {
        return buf.readerIndex();
    }

    @Override
    public int writerIndex() {
        return buf.writerIndex();
    }

    @Override
    public void ensureWritable(int size) {
        buf.ensureWritable(size);
    }

    @Override
    public byte readByte() {
        return buf.readByte();
    }

    @Override
    public short readUnsignedByte() {
        return buf.readUnsignedByte();
    }

    @Override
    public byte[] readBytes(int length) {
        // Underrun must be detected before the array allocation.
        if (length > buf.readableBytes()) {
            throw new IndexOutOfBoundsException("readerIndex(" + buf.readerIndex() + ") + length(" +
                length + ") exceeds writerIndex(" + buf.writerIndex() + "): " + buf);
        }

        byte[] bytes = new byte[length];

        buf.readBytes(bytes);

        return bytes;
    }

    @Override
    public int readUnsignedShort() {
        return buf.readUnsignedShortLE();
    }

    @Override
    public int readUnsignedMedium() {
        return buf.readUnsignedMediumLE();
    }

    @Override
    public long readLong() {
        return buf.readLongLE();
    }

    @Override
    public byte getByte(int index) {
        return buf.getByte(index);
    }

    @Override
    public void skipBytes(int length) {
        buf.skipBytes(length);
    }

    @Override
    public void writeByte(int value) {
        buf.writeByte(value);
    }

    @Override
    public void writeShort(int value) {
        buf.writeShortLE(value);
    }

    @Override
    public void writeMedium(int value) {
        buf.writeMediumLE(value);
    }

    @Override
    public void writeBytes(byte[] bytes) {
        buf.writeBytes(bytes);
    }

    @Override
    public void setByte(int index, int value) {
        buf.setByte(index, value);
    }

    @Override
    public void setMedium(int index, int value) {
        buf.setMediumLE(index, value);
    }

    @Override
    public void writeLong(long value) {
        buf.writeLongLE(value);
    }

    @Override
    public String toString() {
        return "ByteBufPacketCursor{buf=" + buf + '}';
    }
}
