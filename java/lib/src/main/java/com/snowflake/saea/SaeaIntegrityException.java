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

/**
 * Thrown when an encrypted stream fails validation: a bad header, broken framing, a truncated tail
 * or a chunk that does not authenticate.
 * The message is identical for every cause so that callers cannot be used as an oracle.
 * {@link #getError()} exposes the specific cause for diagnostics; do not surface it to untrusted parties.
 */
public class SaeaIntegrityException extends IOException {
    private static final long serialVersionUID = 1L;

    static final String MESSAGE = "stream invalid or tampered";

    private final SaeaError error;

    SaeaIntegrityException(final SaeaError error) {
        super(MESSAGE);
        this.error = error;
    }

    SaeaIntegrityException(final SaeaError error, final Throwable cause) {
        super(MESSAGE, cause);
        this.error = error;
    }

    public SaeaError getError() {
        return error;
    }
}
