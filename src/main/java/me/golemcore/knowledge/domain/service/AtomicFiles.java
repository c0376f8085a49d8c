/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

package me.golemcore.knowledge.domain.service;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.Arrays;

/**
 * Crash-safe replacement of small text files: write a synced temp file next to
 * the target, read it back, then rename it over the target. Used for the JSON
 * index and the pattern ledger, which are rewritten whole on every change.
 */
@Slf4j
public final class AtomicFiles {

    private AtomicFiles() {
    }

    public static void writeString(Path targetPath, String content, boolean backup) throws IOException {
        Path parent = targetPath.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Path tempPath = targetPath.resolveSibling(targetPath.getFileName() + ".tmp");
        Path backupPath = targetPath.resolveSibling(targetPath.getFileName() + ".bak");

        try {
            byte[] bytes = content.getBytes(StandardCharsets.UTF_8);
            try (OutputStream os = Files.newOutputStream(tempPath,
                    StandardOpenOption.CREATE,
                    StandardOpenOption.TRUNCATE_EXISTING,
                    StandardOpenOption.SYNC);
                    FileChannel channel = FileChannel.open(tempPath, StandardOpenOption.WRITE)) {
                os.write(bytes);
                os.flush();
                channel.force(true);
            }
            if (!Arrays.equals(Files.readAllBytes(tempPath), bytes)) {
                throw new IOException("Written content does not match for " + targetPath);
            }

            if (backup && Files.exists(targetPath)) {
                Files.copy(targetPath, backupPath, StandardCopyOption.REPLACE_EXISTING);
                log.debug("[Files] Created backup: {}", backupPath);
            }

            try {
                Files.move(tempPath, targetPath,
                        StandardCopyOption.REPLACE_EXISTING,
                        StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                log.warn("[Files] Atomic move not supported, using regular move");
                Files.move(tempPath, targetPath, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            try {
                Files.deleteIfExists(tempPath);
            } catch (IOException cleanupEx) {
                log.warn("[Files] Failed to cleanup temp file: {}", tempPath);
            }
            throw e;
        }
    }
}
