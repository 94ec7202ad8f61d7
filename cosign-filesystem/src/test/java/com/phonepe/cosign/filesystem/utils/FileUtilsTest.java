/*
 * Copyright (c) 2025 Original Author(s), PhonePe India Pvt. Ltd.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package com.phonepe.cosign.filesystem.utils;

import com.phonepe.cosign.core.errors.PersistenceError;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FileUtilsTest {

    @TempDir
    Path tempDir;

    @Test
    void testEnsurePathCreate() {
        final Path path = tempDir.resolve("new-dir/nested");
        final Path ensured = FileUtils.ensurePath(path.toString(), true);
        assertNotNull(ensured);
        assertTrue(Files.isDirectory(ensured));
    }

    @Test
    void testEnsurePathExisting() {
        final Path path = tempDir.resolve("existing-dir");
        FileUtils.ensurePath(path.toString(), true);
        assertEquals(path.toAbsolutePath().normalize(), FileUtils.ensurePath(path.toString(), false));
    }

    @Test
    void testEnsurePathIsFile() throws Exception {
        final Path path = tempDir.resolve("a-file");
        Files.writeString(path, "content");
        assertThrows(IllegalArgumentException.class, () -> FileUtils.ensurePath(path.toString(), true));
    }

    @Test
    void testEnsurePathNotExistsNoCreate() {
        final Path path = tempDir.resolve("not-exists");
        assertThrows(IllegalArgumentException.class, () -> FileUtils.ensurePath(path.toString(), false));
    }

    @Test
    void testWriteAppendAndReplace() throws Exception {
        final Path path = tempDir.resolve("test-file");
        FileUtils.write(path, "a".getBytes(StandardCharsets.UTF_8), true, false);
        FileUtils.write(path, "b".getBytes(StandardCharsets.UTF_8), true, false);
        assertEquals("ab", Files.readString(path));
        FileUtils.write(path, "c".getBytes(StandardCharsets.UTF_8), false, false);
        assertEquals("c", Files.readString(path));
    }

    @Test
    void testWriteMustBeNew() {
        final Path path = tempDir.resolve("once");
        FileUtils.write(path, "a".getBytes(StandardCharsets.UTF_8), false, true);
        assertThrows(PersistenceError.class,
                     () -> FileUtils.write(path, "b".getBytes(StandardCharsets.UTF_8), false, true));
    }
}
