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
import java.io.OutputStream;
import java.nio.ByteBuffer;

/**
 * Cuts whatever is written into full chunks for a {@link SaeaEncryptor}.
 * {@link #close()} seals the final chunk; it does not close the underlying sink.
 */
public class SaeaEncryptingOutputStream extends OutputStream {
    private final SaeaEncryptor saea;
    private final ByteBuffer ptBuff;
    private boolean closed = false;

    SaeaEncryptingOutputStream(final SaeaEncryptor saea) {
        this.saea = saea;
        this.ptBuff = ByteBuffer.allocate(saea.getParameterSpec().getChunkSize());
    }

    @Override
    public void write(int val) throws IOException {
        assertNotClosed();
        ptBuff.put((byte) val);
        maybeFlush();
    }

    @Override
    public void write(byte[] input, int offset, int length) throws IOException {
        assertNotClosed();
        if (offset < 0 || length < 0 || (long) offset + (long) length > input.length) {
            throw new IndexOutOfBoundsException();
        }
        while (length > 0) {
            final int toCopy = Math.min(length, ptBuff.remaining());
            ptBuff.put(input, offset, toCopy);
            offset += toCopy;
            length -= toCopy;
            maybeFlush();
        }
    }

    private void maybeFlush() throws IOException {
        if (ptBuff.hasRemaining()) {
            return;
        }
        encryptBuffered();
    }

    private void encryptBuffered() throws IOException {
        try {
            saea.encryptChunk(ptBuff.array(), 0, ptBuff.position());
        } catch (final SaeaStateException ex) {
            throw new IOException(ex.getMessage(), ex);
        } finally {
            ptBuff.clear();
        }
    }

    @Override
    public void close() throws IOException {
        if (closed) {
            return;
        }
        closed = true;
        if (ptBuff.position() > 0) {
            encryptBuffered();
        }
        try {
            saea.finish();
        } catch (final SaeaStateException ex) {
            throw new IOException(ex.getMessage(), ex);
        }
    }

    private void assertNotClosed() throws IOException {
        if (closed) {
            throw new IOException("Stream is closed");
        }
        if (saea.getState() == SaeaEncryptor.State.FAILED) {
            throw new IOException("Encryption session has failed");
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
