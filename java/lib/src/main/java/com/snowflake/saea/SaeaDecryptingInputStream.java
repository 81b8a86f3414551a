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
import java.util.Optional;

/**
 * Plaintext view of a SAEA stream. Only authenticated chunks are ever returned.
 * {@link #close()} throws if the stream has not been read up to its final chunk;
 * it does not close the underlying source.
 */
public class SaeaDecryptingInputStream extends InputStream {
    private static final byte[] EMPTY_ARRAY = new byte[0];

    private final SaeaDecryptor saea;
    private byte[] chunk = EMPTY_ARRAY;
    private int chunkOffset = 0;
    private boolean closed = false;

    SaeaDecryptingInputStream(final SaeaDecryptor saea) {
        this.saea = saea;
    }

    @Override
    public int read() throws IOException {
        assertOpen();
        if (!fillChunk()) {
            return -1;
        }
        return chunk[chunkOffset++] & 0xFF;
    }

    @Override
    public int read(final byte[] out, final int offset, final int length) throws IOException {
        assertOpen();
        if (offset < 0 || length < 0 || (long) offset + (long) length > out.length) {
            throw new IndexOutOfBoundsException();
        }
        if (length == 0) {
            return 0;
        }
        if (!fillChunk()) {
            return -1;
        }
        final int toCopy = Math.min(length, chunk.length - chunkOffset);
        System.arraycopy(chunk, chunkOffset, out, offset, toCopy);
        chunkOffset += toCopy;
        return toCopy;
    }

    @Override
    public int available() throws IOException {
        assertOpen();
        return chunk.length - chunkOffset;
    }

    /** Returns false once the final chunk has been fully consumed. */
    private boolean fillChunk() throws IOException {
        while (chunkOffset == chunk.length) {
            final Optional<byte[]> next;
            try {
                next = saea.processNext();
            } catch (final SaeaStateException ex) {
                throw new IOException(ex.getMessage(), ex);
            }
            if (next.isEmpty()) {
                return false;
            }
            chunk = next.get();
            chunkOffset = 0;
        }
        return true;
    }

    private void assertOpen() throws IOException {
        if (closed) {
            throw new IOException("Stream is closed");
        }
    }

    @Override
    public void close() throws IOException {
        if (closed) {
            return;
        }
        closed = true;
        // A failed session already reported its error from read()
        if (!saea.isFinished() && saea.getState() != SaeaDecryptor.State.FAILED) {
            throw new SaeaIntegrityException(SaeaError.TRUNCATED_STREAM);
        }
    }

    public boolean isFinished() {
        return saea.isFinished();
    }

    public byte[] getHeader() {
        return saea.getHeader();
    }

    public SaeaParameterSpec getParameterSpec() {
        return saea.getParameterSpec();
    }
}
