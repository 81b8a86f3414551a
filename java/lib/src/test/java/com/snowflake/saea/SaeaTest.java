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

import static com.snowflake.saea.TestUtils.*;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.ByteArrayInputStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import javax.crypto.AEADBadTagException;
import javax.crypto.SecretKey;

import org.apache.commons.codec.binary.Hex;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.EnumSource;
import org.junit.jupiter.params.provider.MethodSource;

public class SaeaTest {
    @Test
    public void i2beTest1() {
        byte[] buf = new byte[3];
        for (int val = 0; val < 256; val++) {
            Arrays.fill(buf, (byte) 0);
            Saea.i2be(val, 1, buf, 1);
            assertEquals(buf[0], 0);
            assertEquals(buf[1], (byte) val);
            assertEquals(buf[2], 0);
        }
    }

    @Test
    public void i2beTest4() {
        long[] testCases = {0, 1, 128, 256, Short.MAX_VALUE, Short.MAX_VALUE + 1, Integer.MAX_VALUE, 0xFFFFFFFFL};
        byte[] buf = new byte[6];
        for (long val : testCases) {
            Arrays.fill(buf, (byte) 0);
            Saea.i2be(val, 4, buf, 1);
            assertEquals(buf[0], 0);
            assertEquals(val, Saea.be2u32(buf, 1));
            assertEquals(buf[5], 0);
        }
        assertThrows(IllegalArgumentException.class, () -> Saea.i2be(0x100000000L, 4, buf, 0));
        assertThrows(IllegalArgumentException.class, () -> Saea.i2be(-1, 4, buf, 0));
    }

    @Test
    public void u64beIsUnsigned() {
        byte[] buf = new byte[8];
        Saea.u64be(-1L, buf, 0);
        byte[] expected = new byte[8];
        Arrays.fill(expected, (byte) 0xFF);
        assertArrayEquals(expected, buf);

        Saea.u64be(0x0102030405060708L, buf, 0);
        assertArrayEquals(new byte[] {1, 2, 3, 4, 5, 6, 7, 8}, buf);
    }

    public static List<Arguments> boundaryParameters() {
        final List<Arguments> result = new ArrayList<>();
        for (SaeaAead aead : SaeaAead.values()) {
            for (int chunkSize : new int[] {1, 16, 1000}) {
                for (int length : new int[] {0, 1, chunkSize - 1, chunkSize, chunkSize + 1, 3 * chunkSize + 5}) {
                    result.add(Arguments.of(new SaeaParameterSpec(aead, chunkSize), length));
                }
            }
        }
        return result;
    }

    @ParameterizedTest
    @MethodSource("boundaryParameters")
    public void recordCountAndRoundTrip(final SaeaParameterSpec params, final int length) throws Exception {
        final SecretKey key = randomKey();
        final byte[] plaintext = randomBytes(length);
        final byte[] ciphertext = encrypt(Saea.getInstance(params), key, plaintext);

        final int expectedRecords = Math.max(1, (length + params.getChunkSize() - 1) / params.getChunkSize());
        assertEquals(expectedRecords, records(ciphertext).size());
        assertEquals(SaeaHeader.LENGTH + length + expectedRecords * params.getRecordOverhead(), ciphertext.length);
        assertArrayEquals(plaintext, decrypt(key, ciphertext));
    }

    @Test
    public void endToEnd150000Bytes() throws Exception {
        final SaeaParameterSpec params = SaeaParameterSpec.XCHACHA20_POLY1305_64K;
        final SecretKey key = randomKey();
        final byte[] plaintext = randomBytes(150000);

        final byte[] ciphertext = encrypt(Saea.getInstance(params), key, plaintext);
        final byte[] header = header(ciphertext);
        final List<byte[]> records = records(ciphertext);
        assertEquals(3, records.size());
        assertEquals(65536 + 16, be2i(records.get(0), 0));
        assertEquals(65536 + 16, be2i(records.get(1), 0));
        assertEquals(18928 + 16, be2i(records.get(2), 0));

        // Only the last record opens under the final flag
        final SaeaHeader parsed = SaeaFraming.readHeader(new ByteArrayInputStream(header));
        final SaeaNonceSequencer sequencer = new SaeaNonceSequencer(parsed.getBaseNonce());
        final SaeaAeadCipher cipher = params.getAead().newCipher();
        final byte[] last = records.get(2);
        final byte[] opened = cipher.open(key, sequencer.derive(2, true), header, last, 4, last.length - 4);
        assertArrayEquals(Arrays.copyOfRange(plaintext, 131072, 150000), opened);
        assertThrows(AEADBadTagException.class, () -> cipher.open(key, sequencer.derive(2, false), header, last, 4, last.length - 4));
        final byte[] first = records.get(0);
        assertThrows(AEADBadTagException.class, () -> cipher.open(key, sequencer.derive(0, true), header, first, 4, first.length - 4));

        final SaeaDecryptor decryptor = Saea.openDecryptor(new ByteArrayInputStream(ciphertext), key);
        assertArrayEquals(Arrays.copyOfRange(plaintext, 0, 65536), decryptor.processNext().get());
        assertArrayEquals(Arrays.copyOfRange(plaintext, 65536, 131072), decryptor.processNext().get());
        assertFalse(decryptor.isFinished());
        assertArrayEquals(Arrays.copyOfRange(plaintext, 131072, 150000), decryptor.processNext().get());
        assertTrue(decryptor.isFinished());
        assertEquals(2, decryptor.getChunkIndex());
        assertFalse(decryptor.processNext().isPresent());
    }

    @Test
    public void emptyPT() throws Exception {
        final SecretKey key = randomKey();
        final byte[] ciphertext = encrypt(Saea.getInstance(SaeaParameterSpec.XCHACHA20_POLY1305_64K), key, new byte[0]);

        assertEquals(SaeaHeader.LENGTH + 4 + 16, ciphertext.length);
        final List<byte[]> records = records(ciphertext);
        assertEquals(1, records.size());
        assertEquals(16, be2i(records.get(0), 0));
        assertEquals(0, decrypt(key, ciphertext).length);
    }

    @Test
    public void alignedInputEndsWithFullFinalChunk() throws Exception {
        final SaeaParameterSpec params = new SaeaParameterSpec(SaeaAead.XCHACHA20_POLY1305, 32);
        final SecretKey key = randomKey();
        final byte[] plaintext = randomBytes(64);
        final byte[] ciphertext = encrypt(Saea.getInstance(params), key, plaintext);

        final List<byte[]> records = records(ciphertext);
        assertEquals(2, records.size());
        assertEquals(32 + 16, be2i(records.get(1), 0));
        assertArrayEquals(plaintext, decrypt(key, ciphertext));
    }

    @Test
    public void explicitEmptyFinalChunk() throws Exception {
        final SaeaParameterSpec params = new SaeaParameterSpec(SaeaAead.XCHACHA20_POLY1305, 32);
        final SecretKey key = randomKey();
        final byte[] plaintext = randomBytes(32);
        final java.io.ByteArrayOutputStream out = new java.io.ByteArrayOutputStream();
        final SaeaEncryptor encryptor = Saea.getInstance(params).openEncryptor(out, key);
        encryptor.encryptChunk(plaintext);
        encryptor.finish(new byte[0]);

        final byte[] ciphertext = out.toByteArray();
        final List<byte[]> records = records(ciphertext);
        assertEquals(2, records.size());
        assertEquals(16, be2i(records.get(1), 0));
        assertArrayEquals(plaintext, decrypt(key, ciphertext));
    }

    @ParameterizedTest
    @EnumSource(SaeaAead.class)
    public void everySingleBitFlipIsDetected(final SaeaAead aead) throws Exception {
        final SecretKey key = randomKey();
        final byte[] ciphertext = encrypt(Saea.getInstance(new SaeaParameterSpec(aead, 16)), key, randomBytes(40));
        assertEquals(SaeaHeader.LENGTH + 3 * 20 + 40, ciphertext.length);

        for (int bit = 0; bit < ciphertext.length * 8; bit++) {
            final byte[] tampered = ciphertext.clone();
            tampered[bit / 8] ^= (byte) (1 << (bit % 8));
            decryptFailure(key, tampered);
        }
    }

    @Test
    public void droppedFinalRecordIsTruncation() throws Exception {
        final SecretKey key = randomKey();
        final byte[] plaintext = randomBytes(40);
        final byte[] ciphertext = encrypt(Saea.getInstance(new SaeaParameterSpec(SaeaAead.XCHACHA20_POLY1305, 16)), key, plaintext);
        final List<byte[]> records = records(ciphertext);
        final byte[] truncated = concat(header(ciphertext), records.get(0), records.get(1));

        assertEquals(SaeaError.TRUNCATED_STREAM, decryptFailure(key, truncated));

        // The last surviving chunk authenticates but is never released
        final SaeaDecryptor decryptor = Saea.openDecryptor(new ByteArrayInputStream(truncated), key);
        assertArrayEquals(Arrays.copyOfRange(plaintext, 0, 16), decryptor.processNext().get());
        final SaeaIntegrityException ex = assertThrows(SaeaIntegrityException.class, decryptor::processNext);
        assertEquals(SaeaError.TRUNCATED_STREAM, ex.getError());
        assertFalse(decryptor.isFinished());
    }

    @Test
    public void truncationAtEveryRecordBoundary() throws Exception {
        final SecretKey key = randomKey();
        final byte[] ciphertext = encrypt(Saea.getInstance(new SaeaParameterSpec(SaeaAead.AES_GCM_256, 16)), key, randomBytes(40));
        final List<byte[]> records = records(ciphertext);

        assertEquals(SaeaError.TRUNCATED_STREAM, decryptFailure(key, header(ciphertext)));
        assertEquals(SaeaError.TRUNCATED_STREAM, decryptFailure(key, concat(header(ciphertext), records.get(0))));
        assertEquals(SaeaError.TRUNCATED_STREAM, decryptFailure(key, concat(header(ciphertext), records.get(0), records.get(1))));
    }

    @Test
    public void truncationInsideRecord() throws Exception {
        final SecretKey key = randomKey();
        final byte[] ciphertext = encrypt(Saea.getInstance(new SaeaParameterSpec(SaeaAead.XCHACHA20_POLY1305, 16)), key, randomBytes(40));
        final List<byte[]> records = records(ciphertext);

        assertEquals(SaeaError.TRUNCATED_RECORD, decryptFailure(key, Arrays.copyOf(ciphertext, ciphertext.length - 5)));
        final byte[] partialPrefix = concat(header(ciphertext), records.get(0), Arrays.copyOf(records.get(1), 2));
        assertEquals(SaeaError.TRUNCATED_RECORD, decryptFailure(key, partialPrefix));
    }

    @Test
    public void reorderedRecordsFailAuthentication() throws Exception {
        final SecretKey key = randomKey();
        final byte[] ciphertext = encrypt(Saea.getInstance(new SaeaParameterSpec(SaeaAead.XCHACHA20_POLY1305, 16)), key, randomBytes(40));
        final List<byte[]> records = records(ciphertext);
        final byte[] header = header(ciphertext);

        assertEquals(SaeaError.AUTHENTICATION_FAILURE, decryptFailure(key, concat(header, records.get(1), records.get(0), records.get(2))));
        assertEquals(SaeaError.AUTHENTICATION_FAILURE, decryptFailure(key, concat(header, records.get(0), records.get(2), records.get(1))));
        assertEquals(SaeaError.AUTHENTICATION_FAILURE, decryptFailure(key, concat(header, records.get(0), records.get(0), records.get(1), records.get(2))));
        assertEquals(SaeaError.AUTHENTICATION_FAILURE, decryptFailure(key, concat(header, records.get(0), records.get(2))));
    }

    @Test
    public void swappedRecordReleasesNoPlaintext() throws Exception {
        final SecretKey key = randomKey();
        final byte[] ciphertext = encrypt(Saea.getInstance(new SaeaParameterSpec(SaeaAead.XCHACHA20_POLY1305, 16)), key, randomBytes(40));
        final List<byte[]> records = records(ciphertext);
        final byte[] swapped = concat(header(ciphertext), records.get(1), records.get(0), records.get(2));

        final SaeaDecryptor decryptor = Saea.openDecryptor(new ByteArrayInputStream(swapped), key);
        assertThrows(SaeaIntegrityException.class, decryptor::processNext);
        assertEquals(0, decryptor.getChunkIndex());
    }

    @Test
    public void dataAfterFinalRecord() throws Exception {
        final SecretKey key = randomKey();
        final byte[] ciphertext = encrypt(Saea.getInstance(new SaeaParameterSpec(SaeaAead.XCHACHA20_POLY1305, 16)), key, randomBytes(40));
        final List<byte[]> records = records(ciphertext);

        assertEquals(SaeaError.TRAILING_DATA, decryptFailure(key, concat(ciphertext, new byte[1])));
        assertEquals(SaeaError.TRAILING_DATA, decryptFailure(key, concat(ciphertext, records.get(2))));
    }

    @Test
    public void wrongKeyFailsAuthentication() throws Exception {
        final byte[] ciphertext = encrypt(Saea.getInstance(SaeaParameterSpec.XCHACHA20_POLY1305_64K), randomKey(), randomBytes(100));
        assertEquals(SaeaError.AUTHENTICATION_FAILURE, decryptFailure(randomKey(), ciphertext));
    }

    @Test
    public void badHeaders() throws Exception {
        final SecretKey key = randomKey();
        final byte[] ciphertext = encrypt(Saea.getInstance(SaeaParameterSpec.XCHACHA20_POLY1305_64K), key, randomBytes(100));

        assertEquals(SaeaError.TRUNCATED_HEADER, decryptFailure(key, new byte[0]));
        assertEquals(SaeaError.TRUNCATED_HEADER, decryptFailure(key, Arrays.copyOf(ciphertext, 10)));

        byte[] bad = ciphertext.clone();
        bad[0] = 'X';
        assertEquals(SaeaError.BAD_MAGIC, decryptFailure(key, bad));

        bad = ciphertext.clone();
        bad[4] = 2;
        assertEquals(SaeaError.UNSUPPORTED_VERSION, decryptFailure(key, bad));

        bad = ciphertext.clone();
        bad[5] = 0;
        assertEquals(SaeaError.UNSUPPORTED_ALGORITHM, decryptFailure(key, bad));

        bad = ciphertext.clone();
        bad[5] = 99;
        assertEquals(SaeaError.UNSUPPORTED_ALGORITHM, decryptFailure(key, bad));

        bad = ciphertext.clone();
        Arrays.fill(bad, 6, 10, (byte) 0);
        assertEquals(SaeaError.INVALID_CHUNK_SIZE, decryptFailure(key, bad));
        assertTrue(SaeaError.INVALID_CHUNK_SIZE.isHeaderInvalid());

        // The header is bound to every chunk, a chunk size that still parses fails at the first chunk
        bad = ciphertext.clone();
        bad[9] ^= 0x01;
        assertEquals(SaeaError.AUTHENTICATION_FAILURE, decryptFailure(key, bad));
    }

    @Test
    public void failuresLookAlike() throws Exception {
        final SecretKey key = randomKey();
        final byte[] ciphertext = encrypt(Saea.getInstance(new SaeaParameterSpec(SaeaAead.XCHACHA20_POLY1305, 16)), key, randomBytes(40));
        final List<byte[]> records = records(ciphertext);
        final byte[][] broken = {
            Arrays.copyOf(ciphertext, 3),
            concat(header(ciphertext), records.get(0)),
            concat(header(ciphertext), records.get(1), records.get(0), records.get(2)),
            concat(ciphertext, new byte[1]),
            Arrays.copyOf(ciphertext, ciphertext.length - 1),
        };
        for (byte[] ct : broken) {
            SaeaIntegrityException ex = assertThrows(SaeaIntegrityException.class, () -> decrypt(key, ct));
            assertEquals("stream invalid or tampered", ex.getMessage());
        }
    }

    @Test
    public void rndOverride() throws Exception {
        final Saea saea = Saea.getInstance(SaeaParameterSpec.XCHACHA20_POLY1305_64K, new CountingSecRandom());
        final SecretKey key = zeroKey();
        final byte[] ciphertext = encrypt(saea, key, new byte[10]);

        final byte[] expectedNonce = new byte[24];
        for (int i = 0; i < expectedNonce.length; i++) {
            expectedNonce[i] = (byte) i;
        }
        assertArrayEquals(expectedNonce, Arrays.copyOfRange(ciphertext, 10, 34));
        assertArrayEquals(new byte[10], decrypt(key, ciphertext));
    }

    @Test
    public void sessionsUseFreshBaseNonces() throws Exception {
        final Saea saea = Saea.getInstance(SaeaParameterSpec.XCHACHA20_POLY1305_64K);
        final SecretKey key = randomKey();
        final byte[] first = encrypt(saea, key, new byte[10]);
        final byte[] second = encrypt(saea, key, new byte[10]);
        assertFalse(Arrays.equals(Arrays.copyOfRange(first, 10, 34), Arrays.copyOfRange(second, 10, 34)));
        // Records from another stream under the same key do not authenticate
        final byte[] spliced = concat(header(first), records(second).get(0));
        assertEquals(SaeaError.AUTHENTICATION_FAILURE, decryptFailure(key, spliced));
    }

    public static List<Arguments> katTestParameters() {
        final List<Arguments> result = new ArrayList<>();
        result.add(Arguments.of(new SaeaParameterSpec(SaeaAead.XCHACHA20_POLY1305, 64), "XCHACHA20_POLY1305_64"));
        result.add(Arguments.of(new SaeaParameterSpec(SaeaAead.AES_GCM_256, 64), "AES_GCM_256_64"));
        return result;
    }

    @ParameterizedTest
    @MethodSource("katTestParameters")
    public void testKat(final SaeaParameterSpec spec, final String katName) throws Exception {
        final String[] kats = loadKatsFromFile(katName);
        final byte[] ciphertext = Hex.decodeHex(kats[0]);
        final byte[] plaintext = Hex.decodeHex(kats[1]);

        assertArrayEquals(plaintext, decrypt(zeroKey(), ciphertext));

        final Saea saea = Saea.getInstance(spec, new CountingSecRandom());
        assertEquals(kats[0], Hex.encodeHexString(encrypt(saea, zeroKey(), plaintext)));
    }

    @ParameterizedTest
    @EnumSource(SaeaAead.class)
    public void properKeySize(final SaeaAead aead) throws Exception {
        final Saea saea = Saea.getInstance(new SaeaParameterSpec(aead, 64));
        final SecretKey longKey = new javax.crypto.spec.SecretKeySpec(new byte[aead.getKeyLength() + 1], "SAEA");
        final SecretKey shortKey = new javax.crypto.spec.SecretKeySpec(new byte[16], "SAEA");

        assertThrows(IllegalArgumentException.class, () -> saea.openEncryptor(new java.io.ByteArrayOutputStream(), longKey));
        assertThrows(IllegalArgumentException.class, () -> saea.openEncryptor(new java.io.ByteArrayOutputStream(), shortKey));

        final byte[] ciphertext = encrypt(saea, zeroKey(), new byte[5]);
        assertThrows(IllegalArgumentException.class, () -> Saea.openDecryptor(new ByteArrayInputStream(ciphertext), longKey));
    }

    @Test
    public void badParams() {
        assertThrows(IllegalArgumentException.class, () -> new SaeaParameterSpec(SaeaAead.XCHACHA20_POLY1305, 0));
        assertThrows(IllegalArgumentException.class, () -> new SaeaParameterSpec(SaeaAead.XCHACHA20_POLY1305, SaeaParameterSpec.MAX_CHUNK_SIZE + 1));
        assertThrows(IllegalArgumentException.class, () -> new SaeaParameterSpec(null, 64));
        assertThrows(IllegalArgumentException.class, () -> SaeaAead.fromId(3));
        assertEquals(SaeaAead.AES_GCM_256, SaeaAead.fromId(2));
    }
}
