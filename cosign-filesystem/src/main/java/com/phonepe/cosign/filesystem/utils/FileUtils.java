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
import lombok.experimental.UtilityClass;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

@UtilityClass
@Slf4j
public class FileUtils {

    /**
     * Ensures that the provided path exists and is a readable and writable directory. If the path does not exist and
     * createIfNotExists is true, it will attempt to create the directory.
     *
     * @param path              The path to check or create.
     * @param createIfNotExists Whether to create the directory if it does not exist.
     * @return The absolute, normalized Path object representing the directory.
     * @throws IllegalArgumentException If the path is not a usable directory or does not exist and creation was not
     *                                  requested.
     * @throws PersistenceError         If the directory could not be created.
     */
    public static Path ensurePath(String path, boolean createIfNotExists) {
        final var absolutePath = Path.of(path).toAbsolutePath().normalize();
        if (!Files.exists(absolutePath)) {
            if (!createIfNotExists) {
                throw new IllegalArgumentException("Provided path does not exist: " + absolutePath);
            }
            try {
                Files.createDirectories(absolutePath);
                log.debug("Created directory {}", absolutePath);
            }
            catch (IOException e) {
                throw new PersistenceError("Failed to create directory: " + absolutePath, e);
            }
        }
        if (!Files.isDirectory(absolutePath) || !Files.isReadable(absolutePath) || !Files.isWritable(absolutePath)) {
            throw new IllegalArgumentException("Sanity check for %s Failed. Please check it exists and has the required permissions"
                    .formatted(absolutePath));
        }
        return absolutePath;
    }

    /**
     * Writes data to a file, either appending to or replacing existing content.
     *
     * @param filePath  The path of the file to write to.
     * @param data      The byte array data to write.
     * @param append    Whether to append to the existing file or overwrite it.
     * @param mustBeNew Fail if the file already exists. Ignored when appending.
     * @throws PersistenceError if the write fails
     */
    public static void write(Path filePath, byte[] data, boolean append, boolean mustBeNew) {
        final StandardOpenOption[] options;
        if (append) {
            options = new StandardOpenOption[]{
                    StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.APPEND
            };
        }
        else if (mustBeNew) {
            options = new StandardOpenOption[]{StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE};
        }
        else {
            options = new StandardOpenOption[]{
                    StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.TRUNCATE_EXISTING
            };
        }
        try {
            Files.write(filePath, data, options);
        }
        catch (IOException e) {
            throw new PersistenceError("Failed to write file: " + filePath.toAbsolutePath(), e);
        }
    }

}
