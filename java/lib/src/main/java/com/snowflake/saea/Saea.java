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
import java.security.SecureRandom;
import java.util.Arrays;

import javax.crypto.SecretKey;

/**
 * Entry point for SAEA sessions.
 * An instance fixes the parameters used for encryption; decryption takes its parameters from the stream header.
 * Instances are thread-safe, the sessions they open are not.
 */
public final class Saea {
    private final ThreadLocal<SecureRandom> random;
    private final SaeaParameterSpec params;

    public static Saea getInstance(final SaeaParameterSpec params) {
        return new Saea(params, null);
    }

    public static Saea getInstance(final SaeaParameterSpec params, SecureRandom rndOverride) {
        return new Saea(params, rndOverride);
    }

    private Saea(final SaeaParameterSpec params, SecureRandom rndOverride) {
        if (params == null) {
            throw new IllegalArgumentException("params must not be null");
        }
        this.params = params;
        if (rndOverride == null) {
            random = ThreadLocal.withInitial(SecureRandom::new);
        } else {
            // SecureRandom instances are thread safe
            random = ThreadLocal.withInitial(() -> rndOverride);
        }
    }

    public SaeaParameterSpec getParameterSpec() {
        return params;
    }

    /**
     * Starts an encryption session. The header is written to {@code sink} before this returns.
     */
    public SaeaEncryptor openEncryptor(final OutputStream sink, final SecretKey key) throws IOException {
        assertValidKey(key, params.getAead());
        final byte[] baseNonce = new byte[SaeaNonceSequencer.NONCE_LENGTH];
        random.get().nextBytes(baseNonce);
        return new SaeaEncryptor(sink, key, new SaeaHeader(params, baseNonce));
    }

    /**
     * Returns an {@link OutputStream} that encrypts everything written to it into {@code sink}.
     * Closing it finishes the stream but leaves {@code sink} open.
     */
    public SaeaEncryptingOutputStream createEncryptingOutputStream(final OutputStream sink, final SecretKey key) throws IOException {
        return new SaeaEncryptingOutputStream(openEncryptor(sink, key));
    }

    /**
     * Starts a decryption session by reading and validating the header from {@code source}.
     * The chunk size and algorithm come from the header.
     */
    public static SaeaDecryptor openDecryptor(final InputStream source, final SecretKey key) throws IOException {
        return new SaeaDecryptor(source, key);
    }

    public static SaeaDecryptingInputStream createDecryptingInputStream(final InputStream source, final SecretKey key) throws IOException {
        return new SaeaDecryptingInputStream(openDecryptor(source, key));
    }

    static void assertValidKey(final SecretKey key, final SaeaAead aead) {
        if (key == null) {
            throw new IllegalArgumentException("key must not be null");
        }
        if (key.getFormat() != null && key.getFormat().equalsIgnoreCase("RAW")) {
            final byte[] rawKey = key.getEncoded();
            if (rawKey != null) {
                Arrays.fill(rawKey, (byte) 0);
                if (rawKey.length != aead.getKeyLength()) {
                    throw new IllegalArgumentException("SAEA key must have length equal to AEAD key. Was " + rawKey.length + " not " + aead.getKeyLength());
                }
            }
        }
    }

    // VisibleForTesting
    static void i2be(final long val, int len, final byte[] buf, int offset) {
        if (val < 0) {
            throw new IllegalArgumentException("Value cannot be negative: " + val);
        }
        if (len == 1) {
            if (val > 255) {
                throw new IllegalArgumentException("Value out of range: " + val);
            }
            buf[offset] = (byte) val;
        } else if (len == 4) {
            if (val > 0xFFFFFFFFL) {
                throw new IllegalArgumentException("Value out of range: " + val);
            }
            buf[offset] = (byte) ((val >> 24) & 0xff);
            buf[offset + 1] = (byte) ((val >> 16) & 0xff);
            buf[offset + 2] = (byte) ((val >> 8) & 0xff);
            buf[offset + 3] = (byte) (val & 0xff);
        } else if (len == 8) {
            u64be(val, buf, offset);
        } else {
            throw new IllegalArgumentException("Unsupported length: " + len);
        }
    }

    /** Writes {@code val} as an unsigned 64-bit big-endian integer. */
    static void u64be(final long val, final byte[] buf, int offset) {
        for (int i = 7; i >= 0; i--) {
            buf[offset + 7 - i] = (byte) ((val >>> (i * 8)) & 0xff);
        }
    }

    static long be2u32(final byte[] buf, int offset) {
        return ((buf[offset] & 0xffL) << 24)
            | ((buf[offset + 1] & 0xffL) << 16)
            | ((buf[offset + 2] & 0xffL) << 8)
            | (buf[offset + 3] & 0xffL);
    }
}
