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
import java.util.Arrays;
import java.util.Optional;

import javax.crypto.SecretKey;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One encryption session writing a SAEA stream to a sink.
 * <p>
 * Each supplied chunk is held back until the next one arrives (or the session is finished), so that the
 * last chunk of the stream can be sealed with the final flag without the caller knowing in advance which
 * chunk is last. At most one chunk of plaintext is buffered.
 * <p>
 * Not thread-safe. Chunks of one session are always sealed in index order.
 */
public final class SaeaEncryptor implements SaeaChunkProcessor {
    private static final Logger LOG = LoggerFactory.getLogger(SaeaEncryptor.class);
    private static final byte[] EMPTY_ARRAY = new byte[0];

    enum State {
        INIT,
        STREAMING,
        FINALIZED,
        FAILED
    }

    private final OutputStream sink;
    private final SecretKey key;
    private final SaeaHeader header;
    private final SaeaParameterSpec params;
    private final SaeaNonceSequencer sequencer;
    private final SaeaAeadCipher cipher;
    private final byte[] pending;
    // -1 when nothing is pending
    private int pendingLength = -1;
    private long chunkIndex = 0;
    private State state = State.INIT;

    SaeaEncryptor(final OutputStream sink, final SecretKey key, final SaeaHeader header) throws IOException {
        if (sink == null) {
            throw new IllegalArgumentException("sink must not be null");
        }
        this.sink = sink;
        this.key = key;
        this.header = header;
        this.params = header.getParameterSpec();
        this.sequencer = new SaeaNonceSequencer(header.getBaseNonce());
        this.cipher = params.getAead().newCipher();
        this.pending = new byte[params.getChunkSize()];
        try {
            SaeaFraming.writeHeader(sink, header);
        } catch (final IOException ex) {
            state = State.FAILED;
            throw ex;
        }
        state = State.STREAMING;
        LOG.debug("Opened {} encryption session with chunk size {}", params.getAead(), params.getChunkSize());
    }

    /**
     * Supplies the next interior-or-last chunk of plaintext.
     *
     * @throws IllegalArgumentException if the chunk is larger than the chunk size
     */
    public void encryptChunk(final byte[] plaintext) throws IOException {
        processNext(plaintext, 0, plaintext.length);
    }

    public void encryptChunk(final byte[] plaintext, final int offset, final int length) throws IOException {
        processNext(plaintext, offset, length);
    }

    /**
     * Supplies the next chunk of plaintext and returns the record this call wrote to the sink, if any.
     * The first call never writes anything since its chunk is held back.
     */
    public Optional<byte[]> processNext(final byte[] plaintext) throws IOException {
        return processNext(plaintext, 0, plaintext.length);
    }

    public Optional<byte[]> processNext(final byte[] plaintext, final int offset, final int length) throws IOException {
        assertStreaming();
        assertChunk(plaintext, offset, length);
        Optional<byte[]> written = Optional.empty();
        if (pendingLength >= 0) {
            written = Optional.of(seal(pending, 0, pendingLength, false));
        }
        System.arraycopy(plaintext, offset, pending, 0, length);
        pendingLength = length;
        return written;
    }

    /**
     * Seals the held-back chunk, or an empty chunk if none was supplied, as the final chunk.
     */
    public void finish() throws IOException {
        assertStreaming();
        if (pendingLength >= 0) {
            seal(pending, 0, pendingLength, true);
        } else {
            seal(EMPTY_ARRAY, 0, 0, true);
        }
        complete();
    }

    /**
     * Seals any held-back chunk as an interior chunk and then {@code lastChunk}, which may be empty, as the final chunk.
     */
    public void finish(final byte[] lastChunk) throws IOException {
        assertStreaming();
        assertChunk(lastChunk, 0, lastChunk.length);
        if (pendingLength >= 0) {
            seal(pending, 0, pendingLength, false);
        }
        seal(lastChunk, 0, lastChunk.length, true);
        complete();
    }

    /**
     * Encrypts everything {@code in} yields and finishes the session.
     *
     * @return the number of plaintext bytes consumed
     */
    public long transferFrom(final InputStream in) throws IOException {
        final byte[] chunk = new byte[params.getChunkSize()];
        long total = 0;
        while (true) {
            final int read = SaeaFraming.readFully(in, chunk, 0, chunk.length);
            if (read > 0) {
                encryptChunk(chunk, 0, read);
                total += read;
            }
            if (read < chunk.length) {
                break;
            }
        }
        Arrays.fill(chunk, (byte) 0);
        finish();
        return total;
    }

    private byte[] seal(final byte[] plaintext, final int offset, final int length, final boolean isFinal) throws IOException {
        if (!isFinal && chunkIndex == -1L) {
            // The last index is reserved for the final chunk
            state = State.FAILED;
            throw new SaeaStateException(SaeaError.CHUNK_INDEX_EXHAUSTED, "Too many chunks");
        }
        final byte[] nonce = sequencer.derive(chunkIndex, isFinal);
        final byte[] record = SaeaFraming.encodeRecord(cipher.seal(key, nonce, header.encodedView(), plaintext, offset, length));
        try {
            sink.write(record);
        } catch (final IOException ex) {
            state = State.FAILED;
            throw ex;
        }
        if (!isFinal) {
            chunkIndex++;
        }
        return record;
    }

    private void complete() throws IOException {
        pendingLength = -1;
        Arrays.fill(pending, (byte) 0);
        state = State.FINALIZED;
        try {
            sink.flush();
        } catch (final IOException ex) {
            state = State.FAILED;
            throw ex;
        }
        LOG.debug("Finished encryption session after {} chunks", Long.toUnsignedString(chunkIndex + 1));
    }

    private void assertChunk(final byte[] plaintext, final int offset, final int length) {
        if (offset < 0 || length < 0 || (long) offset + (long) length > plaintext.length) {
            throw new ArrayIndexOutOfBoundsException(String.format("%d + %d ?> %d", offset, length, plaintext.length));
        }
        if (length > params.getChunkSize()) {
            throw new IllegalArgumentException("Chunk too large: " + length + " > " + params.getChunkSize());
        }
    }

    private void assertStreaming() {
        if (state == State.FINALIZED) {
            throw new SaeaStateException(SaeaError.SESSION_CLOSED, "Encryption session is finished");
        }
        if (state != State.STREAMING) {
            throw new SaeaStateException(SaeaError.SESSION_FAILED, "Encryption session has failed");
        }
    }

    State getState() {
        return state;
    }

    // VisibleForTesting
    void setChunkIndex(final long chunkIndex) {
        this.chunkIndex = chunkIndex;
    }

    @Override
    public boolean isFinished() {
        return state == State.FINALIZED;
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
