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

/**
 * Reasons a SAEA session can terminate abnormally.
 * All of them are fatal for the session that raised them.
 */
public enum SaeaError {
    TRUNCATED_HEADER(true),
    BAD_MAGIC(true),
    UNSUPPORTED_VERSION(true),
    UNSUPPORTED_ALGORITHM(true),
    INVALID_CHUNK_SIZE(true),
    TRUNCATED_RECORD(false),
    RECORD_TOO_LARGE(false),
    RECORD_TOO_SMALL(false),
    AUTHENTICATION_FAILURE(false),
    TRUNCATED_STREAM(false),
    TRAILING_DATA(false),
    SESSION_CLOSED(false),
    SESSION_FAILED(false),
    CHUNK_INDEX_EXHAUSTED(false);

    private final boolean headerInvalid;

    SaeaError(boolean headerInvalid) {
        this.headerInvalid = headerInvalid;
    }

    /** True for every error raised while validating the stream header. */
    public boolean isHeaderInvalid() {
        return headerInvalid;
    }
}
