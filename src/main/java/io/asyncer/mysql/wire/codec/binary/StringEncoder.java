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
import io.asyncer.mysql.wire.codec.BinaryCodec;
import io.asyncer.mysql.wire.constant.ColumnTypes;
import io.netty.util.internal.logging.InternalLogger;
import io.netty.util.internal.logging.InternalLoggerFactory;

import java.nio.charset.Charset;

import static io.asyncer.mysql.wire.internal.util.AssertUtils.require;
import static io.asyncer.mysql.wire.internal.util.AssertUtils.requireNonNull;

/**
 * An implementation of {@link BinaryEncoder} writes {@link CharSequence} values, and any other value by its
 * {@link Object#toString()}, as length-encoded strings of {@link ColumnTypes#VARCHAR}.
 */
public final class StringEncoder implements BinaryEncoder {

    private static final InternalLogger logger = InternalLoggerFactory.getInstance(StringEncoder.class);

    private final Charset charset;

    public StringEncoder(Charset charset) {
        this.charset = requireNonNull(charset, "charset must not be null");
    }

    @Override
    public boolean canEncode(Object value) {
        return value != null;
    }

    @Override
    public void encode(Object value, PacketCursor cursor) {
        require(canEncode(value), "value must not be null");

        String s = value.toString();

        if (!(value instanceof CharSequence) && logger.isDebugEnabled()) {
            logger.debug("Encoding {} as string parameter", value.getClass().getName());
        }

        BinaryCodec.writeLengthEncodedString(cursor, s, charset);
    }

    @Override
    public short getType() {
        return ColumnTypes.VARCHAR;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }

        return charset.equals(((StringEncoder) o).charset);
    }

    @Override
    public int hashCode() {
        return charset.hashCode();
    }

    @Override
    public String toString() {
        return "StringEncoder{charset=" + charset + '}';
    }
}
