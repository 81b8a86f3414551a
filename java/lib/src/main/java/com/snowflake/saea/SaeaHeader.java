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

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * The fixed 34 byte prefix of every SAEA stream.
 * <pre>
 * magic "SAEA" (4) | version (1) | algorithm id (1) | chunk size (4, big-endian) | base nonce (24)
 * </pre>
 */
public final class SaeaHeader {
    public static final int LENGTH = 34;
    public static final int CURRENT_VERSION = 1;
    static final byte[] MAGIC = "SAEA".getBytes(StandardCharsets.US_ASCII);

    private final SaeaParameterSpec params;
    private final byte[] baseNonce;
    private final byte[] encoded;

    SaeaHeader(final SaeaParameterSpec params, final byte[] baseNonce) {
        if (baseNonce.length != SaeaNonceSequencer.NONCE_LENGTH) {
            throw new IllegalArgumentException("Invalid base nonce length: " + baseNonce.length);
        }
        this.params = params;
        this.baseNonce = baseNonce.clone();
        final ByteBuffer buf = ByteBuffer.allocate(LENGTH);
        buf.put(MAGIC);
        buf.put((byte) CURRENT_VERSION);
        buf.put((byte) params.getAead().getId());
        buf.putInt(params.getChunkSize());
        buf.put(baseNonce);
        if (buf.hasRemaining()) {
            throw new IllegalStateException("Unexpected remaining bytes: " + buf.remaining());
        }
        this.encoded = buf.array();
    }

    /**
     * Parses and validates an encoded header.
     *
     * @throws SaeaIntegrityException if the bytes are not a header this implementation understands
     */
    static SaeaHeader decode(final byte[] data) throws SaeaIntegrityException {
        if (data.length < LENGTH) {
            throw new SaeaIntegrityException(SaeaError.TRUNCATED_HEADER);
        }
        final ByteBuffer buf = ByteBuffer.wrap(data, 0, LENGTH);
        final byte[] magic = new byte[MAGIC.length];
        buf.get(magic);
        if (!Arrays.equals(MAGIC, magic)) {
            throw new SaeaIntegrityException(SaeaError.BAD_MAGIC);
        }
        final int version = buf.get() & 0xFF;
        if (version != CURRENT_VERSION) {
            throw new SaeaIntegrityException(SaeaError.UNSUPPORTED_VERSION);
        }
        final SaeaAead aead;
        try {
            aead = SaeaAead.fromId(buf.get() & 0xFF);
        } catch (final IllegalArgumentException ex) {
            throw new SaeaIntegrityException(SaeaError.UNSUPPORTED_ALGORITHM, ex);
        }
        final int chunkSize = buf.getInt();
        if (chunkSize < 1 || chunkSize > SaeaParameterSpec.MAX_CHUNK_SIZE) {
            throw new SaeaIntegrityException(SaeaError.INVALID_CHUNK_SIZE);
        }
        final byte[] baseNonce = new byte[SaeaNonceSequencer.NONCE_LENGTH];
        buf.get(baseNonce);
        return new SaeaHeader(new SaeaParameterSpec(aead, chunkSize), baseNonce);
    }

    public SaeaParameterSpec getParameterSpec() {
        return params;
    }

    public int getVersion() {
        return CURRENT_VERSION;
    }

    public byte[] getBaseNonce() {
        return baseNonce.clone();
    }

    public byte[] encode() {
        return encoded.clone();
    }

    // Shared read-only view for AAD; never handed out.
    byte[] encodedView() {
        return encoded;
    }
}
