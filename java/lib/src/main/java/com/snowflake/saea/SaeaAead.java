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
 * The closed set of AEAD constructions a SAEA stream may name in its header.
 * Every member takes a 256-bit key and a 192-bit nonce and produces a 128-bit tag.
 */
public enum SaeaAead {
    XCHACHA20_POLY1305(1, 32, 24, 16),
    AES_GCM_256(2, 32, 24, 16);

    private final int id;
    private final int keyLength;
    private final int nonceLength;
    private final int tagLength;

    SaeaAead(int id, int keyLength, int nonceLength, int tagLength) {
        this.id = id;
        this.keyLength = keyLength;
        this.nonceLength = nonceLength;
        this.tagLength = tagLength;
    }

    public int getId() {
        return id;
    }

    public int getKeyLength() {
        return keyLength;
    }

    public int getNonceLength() {
        return nonceLength;
    }

    public int getTagLength() {
        return tagLength;
    }

    /** Returns a fresh, single-session cipher for this construction. */
    SaeaAeadCipher newCipher() {
        switch (this) {
            case XCHACHA20_POLY1305:
                return new XChaCha20Poly1305Cipher();
            case AES_GCM_256:
                return new AesGcmExtendedNonceCipher();
            default:
                throw new IllegalArgumentException("Unsupported AEAD algorithm: " + this);
        }
    }

    static SaeaAead fromId(int id) {
        switch (id) {
            case 1:
                return XCHACHA20_POLY1305;
            case 2:
                return AES_GCM_256;
            default:
                throw new IllegalArgumentException("Unsupported AEAD algorithm ID: " + id);
        }
    }
}
