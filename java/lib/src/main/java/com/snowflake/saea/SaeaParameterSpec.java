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

public final class SaeaParameterSpec {
    public static final int DEFAULT_CHUNK_SIZE = 64 * 1024;
    public static final int MAX_CHUNK_SIZE = 64 * 1024 * 1024;

    public static final SaeaParameterSpec XCHACHA20_POLY1305_64K = new SaeaParameterSpec(SaeaAead.XCHACHA20_POLY1305, DEFAULT_CHUNK_SIZE);
    public static final SaeaParameterSpec XCHACHA20_POLY1305_1M = new SaeaParameterSpec(SaeaAead.XCHACHA20_POLY1305, 1024 * 1024);
    public static final SaeaParameterSpec AES_GCM_256_64K = new SaeaParameterSpec(SaeaAead.AES_GCM_256, DEFAULT_CHUNK_SIZE);

    private final SaeaAead aead;
    private final int chunkSize;

    public SaeaParameterSpec(final SaeaAead aead, final int chunkSize) {
        if (aead == null) {
            throw new IllegalArgumentException("aead must not be null");
        }
        if (chunkSize < 1 || chunkSize > MAX_CHUNK_SIZE) {
            throw new IllegalArgumentException("chunkSize must be between 1 and " + MAX_CHUNK_SIZE + " but was " + chunkSize);
        }
        this.aead = aead;
        this.chunkSize = chunkSize;
    }

    public SaeaAead getAead() {
        return aead;
    }

    /** Largest plaintext a single chunk may carry. */
    public int getChunkSize() {
        return chunkSize;
    }

    /** Largest value a record's length prefix may declare. */
    public int getMaxRecordLength() {
        return chunkSize + aead.getTagLength();
    }

    /** Bytes a record adds on top of its plaintext: length prefix plus tag. */
    public int getRecordOverhead() {
        return 4 + aead.getTagLength();
    }

    @Override
    public int hashCode() {
        final int prime = 31;
        int result = 1;
        result = prime * result + aead.hashCode();
        result = prime * result + chunkSize;
        return result;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj)
            return true;
        if (obj == null)
            return false;
        if (getClass() != obj.getClass())
            return false;
        SaeaParameterSpec other = (SaeaParameterSpec) obj;
        return aead == other.aead && chunkSize == other.chunkSize;
    }

    @Override
    public String toString() {
        return "SaeaParameterSpec[" + aead + ", chunkSize=" + chunkSize + "]";
    }
}
