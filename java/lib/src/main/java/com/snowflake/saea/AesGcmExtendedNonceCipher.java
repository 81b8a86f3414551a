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

import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.util.Arrays;

import javax.crypto.AEADBadTagException;
import javax.crypto.Cipher;
import javax.crypto.Mac;
import javax.crypto.SecretKey;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;

/**
 * AES-256-GCM widened to a 24 byte nonce.
 * The first 12 nonce bytes select a subkey, {@code HMAC-SHA256(key, "SAEA_GCM_SUBKEY:" || nonce[0..12) || 0x01)},
 * and the last 12 are the GCM IV under that subkey.
 */
final class AesGcmExtendedNonceCipher implements SaeaAeadCipher {
    private static final String JCE_NAME = "AES/GCM/NoPadding";
    private static final String JCE_KEY_ALG = "AES";
    private static final String HMAC_NAME = "HmacSHA256";
    private static final byte[] SUBKEY_PURPOSE = "SAEA_GCM_SUBKEY:".getBytes(StandardCharsets.UTF_8);
    private static final int SUBKEY_NONCE_LENGTH = 12;
    private static final int TAG_BITS = 128;

    private final Cipher cipher;
    private final Mac hmac;

    AesGcmExtendedNonceCipher() {
        try {
            cipher = Cipher.getInstance(JCE_NAME);
            hmac = Mac.getInstance(HMAC_NAME);
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
        final byte[] subKey = deriveSubKey(key, nonce);
        try {
            cipher.init(mode, new SecretKeySpec(subKey, JCE_KEY_ALG),
                new GCMParameterSpec(TAG_BITS, nonce, SUBKEY_NONCE_LENGTH, nonce.length - SUBKEY_NONCE_LENGTH));
        } finally {
            Arrays.fill(subKey, (byte) 0);
        }
        if (aad != null) {
            cipher.updateAAD(aad);
        }
    }

    private byte[] deriveSubKey(SecretKey key, byte[] nonce) throws GeneralSecurityException {
        hmac.init(key);
        hmac.update(SUBKEY_PURPOSE);
        hmac.update(nonce, 0, SUBKEY_NONCE_LENGTH);
        hmac.update((byte) 1);
        return hmac.doFinal();
    }
}
