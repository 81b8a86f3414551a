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

import java.security.GeneralSecurityException;
import java.util.Arrays;

import javax.crypto.AEADBadTagException;
import javax.crypto.Cipher;
import javax.crypto.SecretKey;
import javax.crypto.spec.IvParameterSpec;
import javax.crypto.spec.SecretKeySpec;

/**
 * XChaCha20-Poly1305 as described in draft-irtf-cfrg-xchacha.
 * HChaCha20 turns the key and the first 16 nonce bytes into a subkey, which then drives the
 * JCE's IETF ChaCha20-Poly1305 with the nonce {@code 00 00 00 00 || nonce[16..24)}.
 */
final class XChaCha20Poly1305Cipher implements SaeaAeadCipher {
    private static final String JCE_NAME = "ChaCha20-Poly1305";
    private static final String JCE_KEY_ALG = "ChaCha20";
    private static final int[] SIGMA = {0x61707865, 0x3320646e, 0x79622d32, 0x6b206574};

    private Cipher cipher;
    // Nonce of the most recent init, whatever the mode
    private byte[] lastNonce;

    XChaCha20Poly1305Cipher() {
        cipher = newJceCipher();
    }

    private static Cipher newJceCipher() {
        try {
            return Cipher.getInstance(JCE_NAME);
        } catch (final GeneralSecurityException ex) {
            throw new IllegalStateException("Unexpected exception", ex);
        }
    }

    @Override
    public byte[] seal(SecretKey key, byte[] nonce, byte[] aad, byte[] plaintext, int offset, int length) {
        try {
            init(Cipher.ENCRYPT_MODE, key, nonce, aad);
            return cipher.doFinal(plaintext, offset, length);
        } catch (final GeneralSecurityException ex) {
            throw new IllegalStateException("Unexpected exception", ex);
        }
    }

    @Override
    public byte[] open(SecretKey key, byte[] nonce, byte[] aad, byte[] ciphertext, int offset, int length) throws AEADBadTagException {
        try {
            init(Cipher.DECRYPT_MODE, key, nonce, aad);
            return cipher.doFinal(ciphertext, offset, length);
        } catch (final AEADBadTagException ex) {
            throw ex;
        } catch (final GeneralSecurityException ex) {
            throw new IllegalStateException("Unexpected exception", ex);
        }
    }

    private void init(int mode, SecretKey key, byte[] nonce, byte[] aad) throws GeneralSecurityException {
        if (nonce.length != 24) {
            throw new IllegalArgumentException("Invalid nonce length: " + nonce.length);
        }
        final byte[] rawKey = key.getEncoded();
        if (rawKey == null) {
            throw new IllegalArgumentException("XChaCha20-Poly1305 requires an extractable key");
        }
        final byte[] subKey;
        try {
            subKey = hChaCha20(rawKey, nonce);
        } finally {
            Arrays.fill(rawKey, (byte) 0);
        }
        final byte[] innerNonce = new byte[12];
        System.arraycopy(nonce, 16, innerNonce, 4, 8);
        // SunJCE rejects re-initialising ChaCha20 with its previous key and nonce in either mode.
        // Opening again under the same nonce is harmless, so decryption gets a fresh instance;
        // sealing twice under one nonce stays an error.
        if (mode == Cipher.DECRYPT_MODE && Arrays.equals(nonce, lastNonce)) {
            cipher = newJceCipher();
        }
        lastNonce = nonce.clone();
        try {
            cipher.init(mode, new SecretKeySpec(subKey, JCE_KEY_ALG), new IvParameterSpec(innerNonce));
        } finally {
            Arrays.fill(subKey, (byte) 0);
        }
        if (aad != null) {
            cipher.updateAAD(aad);
        }
    }

    // VisibleForTesting
    static byte[] hChaCha20(final byte[] key, final byte[] nonce) {
        if (key.length != 32) {
            throw new IllegalArgumentException("Invalid key length: " + key.length);
        }
        if (nonce.length < 16) {
            throw new IllegalArgumentException("Invalid nonce length: " + nonce.length);
        }
        final int[] x = new int[16];
        System.arraycopy(SIGMA, 0, x, 0, 4);
        for (int i = 0; i < 8; i++) {
            x[4 + i] = le2i(key, i * 4);
        }
        for (int i = 0; i < 4; i++) {
            x[12 + i] = le2i(nonce, i * 4);
        }
        for (int round = 0; round < 10; round++) {
            quarterRound(x, 0, 4, 8, 12);
            quarterRound(x, 1, 5, 9, 13);
            quarterRound(x, 2, 6, 10, 14);
            quarterRound(x, 3, 7, 11, 15);
            quarterRound(x, 0, 5, 10, 15);
            quarterRound(x, 1, 6, 11, 12);
            quarterRound(x, 2, 7, 8, 13);
            quarterRound(x, 3, 4, 9, 14);
        }
        final byte[] out = new byte[32];
        for (int i = 0; i < 4; i++) {
            i2le(x[i], out, i * 4);
            i2le(x[12 + i], out, 16 + i * 4);
        }
        Arrays.fill(x, 0);
        return out;
    }

    private static void quarterRound(final int[] x, int a, int b, int c, int d) {
        x[a] += x[b];
        x[d] = Integer.rotateLeft(x[d] ^ x[a], 16);
        x[c] += x[d];
        x[b] = Integer.rotateLeft(x[b] ^ x[c], 12);
        x[a] += x[b];
        x[d] = Integer.rotateLeft(x[d] ^ x[a], 8);
        x[c] += x[d];
        x[b] = Integer.rotateLeft(x[b] ^ x[c], 7);
    }

    private static int le2i(final byte[] buf, int offset) {
        return (buf[offset] & 0xff)
            | (buf[offset + 1] & 0xff) << 8
            | (buf[offset + 2] & 0xff) << 16
            | (buf[offset + 3] & 0xff) << 24;
    }

    private static void i2le(final int val, final byte[] buf, int offset) {
        buf[offset] = (byte) val;
        buf[offset + 1] = (byte) (val >>> 8);
        buf[offset + 2] = (byte) (val >>> 16);
        buf[offset + 3] = (byte) (val >>> 24);
    }
}
