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

public interface SaeaChunkProcessor {
    /**
     * Returns true if and only if the session has processed a complete SAEA stream.
     * In the case of encryption, this happens after the final chunk has been written.
     * In the case of decryption, this happens after the final chunk has been successfully authenticated.
     */
    boolean isFinished();

    /**
     * Returns the encoded stream header.
     */
    byte[] getHeader();

    SaeaParameterSpec getParameterSpec();

    /**
     * Index the next chunk will be processed under, as an unsigned 64-bit value.
     */
    long getChunkIndex();
}
