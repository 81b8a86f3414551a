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

/**
 * Derives per-chunk nonces for one stream.
 * <pre>
 * nonce = baseNonce[0..15) || BE64(chunkIndex) || finalFlag
 * </pre>
 * The suffix is disjoint from the base prefix, so distinct {@code (index, final)} pairs never collide.
 * The index is an unsigned 64-bit value carried in a {@code long}.
 */
public final class SaeaNonceSequencer {
    public static final int NONCE_LENGTH = 24;
    static final int PREFIX_LENGTH = 15;

    private final byte[] baseNonce;

    public SaeaNonceSequencer(final byte[] baseNonce) {
        if (baseNonce == null || baseNonce.length != NONCE_LENGTH) {
            throw new IllegalArgumentException("Base nonce must be " + NONCE_LENGTH + " bytes");
        }
        this.baseNonce = baseNonce.clone();
    }

    public byte[] derive(final long chunkIndex, final boolean isFinal) {
        final byte[] nonce = new byte[NONCE_LENGTH];
        System.arraycopy(baseNonce, 0, nonce, 0, PREFIX_LENGTH);
        Saea.u64be(chunkIndex, nonce, PREFIX_LENGTH);
        nonce[NONCE_LENGTH - 1] = (byte) (isFinal ? 1 : 0);
        return nonce;
    }

    public byte[] getBaseNonce() {
        return baseNonce.clone();
    }
}
