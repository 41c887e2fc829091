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

import io.netty.handler.codec.DecoderException;

/**
 * An exception considers the first byte of a length-encoded integer is not a known marker. It means the
 * reader is misaligned with the packet, or the packet is corrupted.
 */
public final class UnknownLengthEncodingException extends DecoderException {

    private static final long serialVersionUID = 4960398520618227593L;

    private final int marker;

    /**
     * Creates a new exception with the unknown marker.
     *
     * @param marker the unsigned first byte of the length-encoded integer.
     */
    public UnknownLengthEncodingException(int marker) {
        super("Unknown length-encoded integer marker 0x" + Integer.toHexString(marker) + " (" + marker + ')');

        this.marker = marker;
    }

    public int getMarker() {
        return marker;
    }
}
