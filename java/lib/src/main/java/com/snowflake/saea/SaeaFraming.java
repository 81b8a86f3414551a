// Copyright 2025 Snowflake Inc.
// SPDX-License-Identifier: Apache-2.0
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
// http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.

package com.snowflake.saea;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;

/**
 * Reads and writes the SAEA wire layout: one {@link SaeaHeader} followed by length-prefixed records.
 * <pre>
 * record = BE32(len) || ciphertext[len]
 * </pre>
 * Readers always know how many bytes make up the next authenticable unit, so chunk boundaries
 * never depend on how the transport happens to split its reads.
 */
public final class SaeaFraming {
    public static final int LENGTH_PREFIX = 4;

    private SaeaFraming() {
    }

    public static byte[] encodeHeader(final byte[] baseNonce, final int chunkSize, final SaeaAead aead) {
        return new SaeaHeader(new SaeaParameterSpec(aead, chunkSize), baseNonce).encode();
    }

    public static void writeHeader(final OutputStream out, final SaeaHeader header) throws IOException {
        out.write(header.encodedView());
    }

    public static SaeaHeader readHeader(final InputStream in) throws IOException {
        final byte[] data = new byte[SaeaHeader.LENGTH];
        final int read = readFully(in, data, 0, data.length);
        if (read < data.length) {
            throw new SaeaIntegrityException(SaeaError.TRUNCATED_HEADER);
        }
        return SaeaHeader.decode(data);
    }

    public static void writeRecord(final OutputStream out, final byte[] ciphertext) throws IOException {
        final byte[] prefix = new byte[LENGTH_PREFIX];
        Saea.i2be(ciphertext.length, LENGTH_PREFIX, prefix, 0);
        out.write(prefix);
        out.write(ciphertext);
    }

    /** Returns the complete encoding of a record, length prefix included. */
    public static byte[] encodeRecord(final byte[] ciphertext) {
        final byte[] record = new byte[LENGTH_PREFIX + ciphertext.length];
        Saea.i2be(ciphertext.length, LENGTH_PREFIX, record, 0);
        System.arraycopy(ciphertext, 0, record, LENGTH_PREFIX, ciphertext.length);
        return record;
    }

    /**
     * Reads one record body.
     *
     * @param minLength smallest acceptable declared length (the AEAD tag length)
     * @param maxLength largest acceptable declared length (chunk size plus tag length)
     * @return the record body, or {@code null} if the input ended cleanly before a new record started
     * @throws SaeaIntegrityException if the record is cut short or declares an invalid length
     */
    public static byte[] readRecord(final InputStream in, final int minLength, final int maxLength) throws IOException {
        final byte[] prefix = new byte[LENGTH_PREFIX];
        final int prefixRead = readFully(in, prefix, 0, LENGTH_PREFIX);
        if (prefixRead == 0) {
            return null;
        }
        if (prefixRead < LENGTH_PREFIX) {
            throw new SaeaIntegrityException(SaeaError.TRUNCATED_RECORD);
        }
        final long length = Saea.be2u32(prefix, 0);
        if (length > maxLength) {
            throw new SaeaIntegrityException(SaeaError.RECORD_TOO_LARGE);
        }
        if (length < minLength) {
            throw new SaeaIntegrityException(SaeaError.RECORD_TOO_SMALL);
        }
        final byte[] body = new byte[(int) length];
        if (readFully(in, body, 0, body.length) < body.length) {
            throw new SaeaIntegrityException(SaeaError.TRUNCATED_RECORD);
        }
        return body;
    }

    /** Reads until {@code length} bytes arrived or the input ended; returns the count read. */
    static int readFully(final InputStream in, final byte[] buf, final int offset, final int length) throws IOException {
        int total = 0;
        while (total < length) {
            final int read = in.read(buf, offset + total, length - total);
            if (read == -1) {
                break;
            }
            total += read;
        }
        return total;
    }
}
