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

import javax.crypto.AEADBadTagException;
import javax.crypto.SecretKey;

/**
 * An extended-nonce AEAD. Instances hold JCE state and belong to a single session.
 */
interface SaeaAeadCipher {
    /**
     * Encrypts {@code plaintext[offset, offset + length)} and returns ciphertext with the tag appended.
     * Sealing twice in a row under the same key and nonce is refused with an {@link IllegalStateException}.
     */
    byte[] seal(SecretKey key, byte[] nonce, byte[] aad, byte[] plaintext, int offset, int length);

    /**
     * Verifies and decrypts {@code ciphertext[offset, offset + length)}, tag included.
     * Nothing is returned unless the tag verifies. Any key and nonce may be opened any number of times.
     */
    byte[] open(SecretKey key, byte[] nonce, byte[] aad, byte[] ciphertext, int offset, int length) throws AEADBadTagException;
}
