/*
 * Copyright 2026 LINE Corporation
 *
 * LINE Corporation licenses this file to you under the Apache License,
 * version 2.0 (the "License"); you may not use this file except in compliance
 * with the License. You may obtain a copy of the License at:
 *
 *   https://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS, WITHOUT
 * WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied. See the
 * License for the specific language governing permissions and limitations
 * under the License.
 */
package com.linecorp.staticfiles;

import static io.netty.util.internal.StringUtil.decodeHexNibble;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

/**
 * Decodes a percent-encoded path string strictly. Unlike a lenient decoder, a malformed escape or
 * an invalid UTF-8 sequence is never replaced with {@code '�'}.
 */
final class PercentDecoder {

    /**
     * Decodes the percent-encoded octets in the specified {@code path} and interprets the result as UTF-8.
     *
     * @throws InvalidPathEncodingException if {@code path} contains a malformed percent-encoded sequence
     *                                      or its decoded octets are not a valid UTF-8 sequence
     */
    static String decode(String path) {
        if (path.indexOf('%') < 0) {
            // No need to decode; not percent-encoded
            return path;
        }

        final byte[] src = path.getBytes(StandardCharsets.UTF_8);
        final int len = src.length;
        final byte[] buf = new byte[len];
        int dstLen = 0;
        for (int i = 0; i < len; i++) {
            final byte b = src[i];
            if (b != '%') {
                buf[dstLen++] = b;
                continue;
            }

            if (i + 2 >= len) {
                // '%' or '%x' at the end (must be followed by two hexadigits)
                throw new InvalidPathEncodingException(
                        "incomplete percent-encoded sequence at index " + i + ": " + path);
            }

            final int digit1 = decodeHexNibble((char) (src[i + 1] & 0xFF));
            final int digit2 = decodeHexNibble((char) (src[i + 2] & 0xFF));
            if (digit1 < 0 || digit2 < 0) {
                throw new InvalidPathEncodingException(
                        "invalid percent-encoded sequence at index " + i + ": " + path);
            }
            buf[dstLen++] = (byte) ((digit1 << 4) | digit2);
            i += 2;
        }

        final CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
                                                             .onMalformedInput(CodingErrorAction.REPORT)
                                                             .onUnmappableCharacter(CodingErrorAction.REPORT);
        try {
            return decoder.decode(ByteBuffer.wrap(buf, 0, dstLen)).toString();
        } catch (CharacterCodingException e) {
            throw new InvalidPathEncodingException("invalid UTF-8 sequence in path: " + path, e);
        }
    }

    private PercentDecoder() {}
}
