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
import io.netty.buffer.ByteBufUtil;
import io.netty.buffer.Unpooled;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatExceptionOfType;
import static org.assertj.core.api.Assertions.assertThatIllegalArgumentException;

/**
 * Unit tests for {@link ByteBufPacketCursor}.
 */
class ByteBufPacketCursorTest {

    @Test
    void writeLittleEndian() {
        ByteBuf buf = Unpooled.buffer();
        PacketCursor cursor = ByteBufPacketCursor.wrap(buf);

        cursor.writeByte(0x1FF);
        cursor.writeShort(0x0102);
        cursor.writeMedium(0x030405);
        cursor.writeLong(0x060708090A0B0C0DL);
        cursor.writeBytes(new byte[] { 0x0E, 0x0F });

        assertThat(ByteBufUtil.getBytes(buf)).containsExactly(
            0xFF,
            0x02, 0x01,
            0x05, 0x04, 0x03,
            0x0D, 0x0C, 0x0B, 0x0A, 0x09, 0x08, 0x07, 0x06,
            0x0E, 0x0F);
        assertThat(cursor.writerIndex()).isEqualTo(16);
    }

    @Test
    void readLittleEndian() {
        PacketCursor cursor = ByteBufPacketCursor.wrap(Unpooled.wrappedBuffer(new byte[] {
            (byte) 0xFF,
            (byte) 0xFE, (byte) 0xFF,
            0x01, 0x00, (byte) 0x80,
            0x01, 0, 0, 0, 0, 0, 0, (byte) 0x80,
            0x41, 0x42,
        }));

        assertThat(cursor.readUnsignedByte()).isEqualTo((short) 0xFF);
        assertThat(cursor.readUnsignedShort()).isEqualTo(0xFFFE);
        assertThat(cursor.readUnsignedMedium()).isEqualTo(0x800001);
        assertThat(cursor.readLong()).isEqualTo(Long.MIN_VALUE + 1);
        assertThat(cursor.readBytes(2)).containsExactly(0x41, 0x42);
        assertThat(cursor.readableBytes()).isZero();
        assertThat(cursor.readerIndex()).isEqualTo(16);
    }

    @Test
    void readBytesUnderrun() {
        ByteBuf buf = Unpooled.wrappedBuffer(new byte[] { 1, 2, 3 });
        PacketCursor cursor = ByteBufPacketCursor.wrap(buf);

        cursor.skipBytes(1);

        assertThatExceptionOfType(IndexOutOfBoundsException.class).isThrownBy(() -> cursor.readBytes(3));
        assertThat(cursor.readerIndex()).isOne();
    }

    @Test
    void setWithoutMovingIndexes() {
        ByteBuf buf = Unpooled.buffer().writeZero(6);
        PacketCursor cursor = ByteBufPacketCursor.wrap(buf);

        cursor.skipBytes(2);
        cursor.setMedium(0, 0x0A0B0C);
        cursor.setByte(3, 0x1D);

        assertThat(ByteBufUtil.getBytes(buf, 0, 6)).containsExactly(0x0C, 0x0B, 0x0A, 0x1D, 0, 0);
        assertThat(cursor.getByte(1)).isEqualTo((byte) 0x0B);
        assertThat(cursor.readerIndex()).isEqualTo(2);
        assertThat(cursor.writerIndex()).isEqualTo(6);
    }

    @Test
    void ensureWritable() {
        ByteBuf buf = Unpooled.buffer(1, 8);
        PacketCursor cursor = ByteBufPacketCursor.wrap(buf);

        cursor.ensureWritable(8);

        assertThat(cursor.writableBytes()).isGreaterThanOrEqualTo(8);
        assertThatExceptionOfType(IndexOutOfBoundsException.class).isThrownBy(() -> cursor.ensureWritable(9));
    }

    @Test
    void sharesIndexesWithBuffer() {
        ByteBuf buf = Unpooled.buffer();
        ByteBufPacketCursor cursor = ByteBufPacketCursor.wrap(buf);

        buf.writeInt(1);

        assertThat(cursor.unwrap()).isSameAs(buf);
        assertThat(cursor.readableBytes()).isEqualTo(4);
        assertThat(buf.refCnt()).isOne();
    }

    @Test
    void wrapNull() {
        assertThatIllegalArgumentException().isThrownBy(() -> ByteBufPacketCursor.wrap(null));
    }
}
