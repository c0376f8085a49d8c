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

package me.golemcore.knowledge.adapter.outbound.storage;

import me.golemcore.knowledge.domain.exception.StorageUnavailableException;

import java.nio.file.Path;
import java.sql.SQLException;
import java.util.Locale;

/**
 * Translates SQLite driver failures into {@link StorageUnavailableException}s
 * carrying a troubleshooting hint.
 */
final class SqliteErrors {

    private SqliteErrors() {
    }

    static StorageUnavailableException wrap(SQLException e, Path dbPath) {
        String message = e.getMessage() != null ? e.getMessage() : "";
        String normalized = message.toLowerCase(Locale.ROOT);

        if (normalized.contains("sqlite_corrupt") || normalized.contains("malformed")
                || normalized.contains("not a database")) {
            return new StorageUnavailableException("Database file is corrupted: " + dbPath
                    + ". Delete it and rebuild from the markdown files.", e);
        }
        if (normalized.contains("sqlite_cantopen") || normalized.contains("unable to open")) {
            return new StorageUnavailableException("Cannot open database at " + dbPath
                    + ". Check that the directory exists and is writable.", e);
        }
        if (normalized.contains("sqlite_busy") || normalized.contains("locked")) {
            return new StorageUnavailableException("Database is locked: " + dbPath
                    + ". Another process may be using it; retry when it finishes.", e);
        }
        if (normalized.contains("sqlite_readonly") || normalized.contains("readonly")
                || normalized.contains("read-only")) {
            return new StorageUnavailableException("Database is read-only: " + dbPath
                    + ". Check file permissions.", e);
        }
        return new StorageUnavailableException("Database error at " + dbPath + ": " + message, e);
    }
}
