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

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

import javax.crypto.SecretKey;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Whole-file helpers on top of {@link SaeaEncryptor} and {@link SaeaDecryptor}.
 */
public final class SaeaFiles {
    private static final Logger LOG = LoggerFactory.getLogger(SaeaFiles.class);
    private static final int IO_BUFFER = 64 * 1024;

    private SaeaFiles() {
    }

    /**
     * Encrypts {@code input} into {@code output}, replacing it if it exists.
     * Ciphertext goes to a temporary file next to {@code output} first, so {@code input} and
     * {@code output} may be the same file and a failed encryption leaves {@code output} untouched.
     *
     * @return the number of plaintext bytes encrypted
     */
    public static long encryptFile(final Path input, final Path output, final SecretKey key, final SaeaParameterSpec params) throws IOException {
        final long total = transformFile(input, output, (in, out) -> Saea.getInstance(params).openEncryptor(out, key).transferFrom(in));
        LOG.debug("Encrypted {} bytes from {} to {}", total, input, output);
        return total;
    }

    /**
     * Decrypts {@code input} into {@code output}.
     * Plaintext goes to a temporary file next to {@code output} and is moved into place only once the
     * final chunk has authenticated, so a failed decryption never leaves partial plaintext at {@code output}.
     *
     * @return the number of plaintext bytes recovered
     */
    public static long decryptFile(final Path input, final Path output, final SecretKey key) throws IOException {
        final long total = transformFile(input, output, (in, out) -> Saea.openDecryptor(in, key).transferTo(out));
        LOG.debug("Decrypted {} bytes from {} to {}", total, input, output);
        return total;
    }

    /**
     * Encrypts several files in parallel, one independent session per file.
     * Chunks within a file are still sealed sequentially.
     * The first failure cancels the jobs that have not completed and is rethrown.
     *
     * @param jobs input file to output file
     * @return plaintext byte count per input file, in the iteration order of {@code jobs}
     */
    public static Map<Path, Long> encryptFiles(
            final Map<Path, Path> jobs,
            final SecretKey key,
            final SaeaParameterSpec params,
            final ExecutorService executor) throws IOException, InterruptedException {
        final List<Path> inputs = new ArrayList<>(jobs.keySet());
        final List<Future<Long>> futures = new ArrayList<>(inputs.size());
        for (final Path input : inputs) {
            final Path output = jobs.get(input);
            futures.add(executor.submit(() -> encryptFile(input, output, key, params)));
        }
        final Map<Path, Long> result = new LinkedHashMap<>();
        try {
            for (int i = 0; i < futures.size(); i++) {
                result.put(inputs.get(i), futures.get(i).get());
            }
        } catch (final ExecutionException ex) {
            for (final Future<Long> future : futures) {
                future.cancel(true);
            }
            final Throwable cause = ex.getCause();
            if (cause instanceof IOException) {
                throw (IOException) cause;
            }
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw new IOException("Encryption job failed", cause);
        } catch (final InterruptedException ex) {
            for (final Future<Long> future : futures) {
                future.cancel(true);
            }
            throw ex;
        }
        return result;
    }

    @FunctionalInterface
    private interface Transfer {
        long run(InputStream in, OutputStream out) throws IOException;
    }

    private static long transformFile(final Path input, final Path output, final Transfer transfer) throws IOException {
        final Path dir = output.toAbsolutePath().getParent();
        final Path tmp = Files.createTempFile(dir, "." + output.getFileName(), ".part");
        boolean moved = false;
        try {
            final long total;
            try (InputStream in = new BufferedInputStream(Files.newInputStream(input), IO_BUFFER);
                 OutputStream out = new BufferedOutputStream(Files.newOutputStream(tmp), IO_BUFFER)) {
                total = transfer.run(in, out);
            }
            moveIntoPlace(tmp, output);
            moved = true;
            return total;
        } finally {
            if (!moved) {
                Files.deleteIfExists(tmp);
            }
        }
    }

    private static void moveIntoPlace(final Path tmp, final Path output) throws IOException {
        try {
            Files.move(tmp, output, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (final AtomicMoveNotSupportedException ex) {
            LOG.debug("Atomic move not supported for {}, falling back to replace", output);
            Files.move(tmp, output, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
