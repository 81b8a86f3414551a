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
 * Thrown when a session is used after it has finished or failed, or when its chunk counter is used up.
 */
public class SaeaStateException extends IllegalStateException {
    private static final long serialVersionUID = 1L;

    private final SaeaError error;

    SaeaStateException(final SaeaError error, final String message) {
        super(message);
        this.error = error;
    }

    public SaeaError getError() {
        return error;
    }
}
