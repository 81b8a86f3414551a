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
import java.io.PushbackInputStream;
import java.util.Arrays;
import java.util.Optional;

import javax.crypto.AEADBadTagException;
import javax.crypto.SecretKey;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One decryption session reading a SAEA stream from a source.
 * <p>
 * The nonce of every chunk is derived from this session's own counter, never from the input, so a record
 * that was moved, duplicated or dropped fails authentication. Only a chunk that authenticates under the
 * final flag ends the stream; running out of input before that is a truncation.
 * <p>
 * Any failure is permanent. Not thread-safe.
 */
public final class SaeaDecryptor implements SaeaChunkProcessor {
    private static final Logger LOG = LoggerFactory.getLogger(SaeaDecryptor.class);

    enum State {
        STREAMING,
        COMPLETE,
        FAILED
    }

    private final PushbackInputStream source;
    private final SecretKey key;
    private final SaeaHeader header;
    private final SaeaParameterSpec params;
    private final SaeaNonceSequencer sequencer;
    private final SaeaAeadCipher cipher;
    private long chunkIndex = 0;
    private State state;

    SaeaDecryptor(final InputStream in, final SecretKey key) throws IOException {
        if (in == null) {
            throw new IllegalArgumentException("source must not be null");
        }
        this.source = new PushbackInputStream(in, 1);
        this.key = key;
        try {
            this.header = SaeaFraming.readHeader(source);
        } catch (final SaeaIntegrityException ex) {
            LOG.debug("Rejected stream header: {}", ex.getError());
            throw ex;
        }
        this.params = header.getParameterSpec();
        Saea.assertValidKey(key, params.getAead());
        this.sequencer = new SaeaNonceSequencer(header.getBaseNonce());
        this.cipher = params.getAead().newCipher();
        this.state = State.STREAMING;
        LOG.debug("Opened {} decryption session with chunk size {}", params.getAead(), params.getChunkSize());
    }

    /**
     * Reads, authenticates and returns the next chunk of plaintext.
     *
     * @return the plaintext, or empty once the final chunk has been returned
     * @throws SaeaIntegrityException if the stream is truncated, malformed or tampered with
     * @throws SaeaStateException if the session already failed
     * @throws IOException if reading the source fails
     */
    public Optional<byte[]> processNext() throws IOException {
        if (state == State.COMPLETE) {
            return Optional.empty();
        }
        if (state == State.FAILED) {
            throw new SaeaStateException(SaeaError.SESSION_FAILED, "Decryption session has failed");
        }
        try {
            return Optional.of(readChunk());
        } catch (final IOException | RuntimeException ex) {
            state = State.FAILED;
            if (ex instanceof SaeaIntegrityException) {
                LOG.debug("Decryption failed at chunk {}: {}", Long.toUnsignedString(chunkIndex), ((SaeaIntegrityException) ex).getError());
            }
            throw ex;
        }
    }

    /**
     * Decrypts the rest of the stream into {@code out}.
     *
     * @return the number of plaintext bytes written
     */
    public long transferTo(final OutputStream out) throws IOException {
        long total = 0;
        Optional<byte[]> chunk = processNext();
        while (chunk.isPresent()) {
            out.write(chunk.get());
            total += chunk.get().length;
            chunk = processNext();
        }
        return total;
    }

    private byte[] readChunk() throws IOException {
        final byte[] record = SaeaFraming.readRecord(source, params.getAead().getTagLength(), params.getMaxRecordLength());
        if (record == null) {
            throw new SaeaIntegrityException(SaeaError.TRUNCATED_STREAM);
        }
        // End of input only decides which flag is tried first; the stream ends on an authenticated final chunk.
        if (atEndOfInput()) {
            final byte[] plaintext = open(record, true);
            if (plaintext != null) {
                state = State.COMPLETE;
                LOG.debug("Finished decryption session after {} chunks", Long.toUnsignedString(chunkIndex + 1));
                return plaintext;
            }
            discard(open(record, false), SaeaError.TRUNCATED_STREAM);
        } else {
            if (chunkIndex == -1L) {
                throw new SaeaStateException(SaeaError.CHUNK_INDEX_EXHAUSTED, "Too many chunks");
            }
            final byte[] plaintext = open(record, false);
            if (plaintext != null) {
                chunkIndex++;
                return plaintext;
            }
            discard(open(record, true), SaeaError.TRAILING_DATA);
        }
        throw new SaeaIntegrityException(SaeaError.AUTHENTICATION_FAILURE);
    }

    private byte[] open(final byte[] record, final boolean isFinal) {
        try {
            return cipher.open(key, sequencer.derive(chunkIndex, isFinal), header.encodedView(), record, 0, record.length);
        } catch (final AEADBadTagException ex) {
            return null;
        }
    }

    // Authenticated under the wrong flag: the chunk is genuine but sits in the wrong place in the stream.
    private static void discard(final byte[] plaintext, final SaeaError error) throws SaeaIntegrityException {
        if (plaintext != null) {
            Arrays.fill(plaintext, (byte) 0);
            throw new SaeaIntegrityException(error);
        }
    }

    private boolean atEndOfInput() throws IOException {
        final int next = source.read();
        if (next == -1) {
            return true;
        }
        source.unread(next);
        return false;
    }

    State getState() {
        return state;
    }

    @Override
    public boolean isFinished() {
        return state == State.COMPLETE;
    }

    @Override
    public byte[] getHeader() {
        return header.encode();
    }

    @Override
    public SaeaParameterSpec getParameterSpec() {
        return params;
    }

    @Override
    public long getChunkIndex() {
        return chunkIndex;
    }
}
