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
package com.phonepe.cosign.session.export;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.phonepe.cosign.core.errors.PersistenceError;
import com.phonepe.cosign.core.utils.JsonUtils;
import com.phonepe.cosign.session.model.SessionExport;
import lombok.NonNull;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads audit documents written by a session export
 */
public class SessionExportReader {
    private final ObjectMapper mapper;

    public SessionExportReader() {
        this(JsonUtils.createMapper());
    }

    public SessionExportReader(@NonNull ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public SessionExport read(@NonNull Path path) {
        try (var in = Files.newInputStream(path)) {
            return read(in);
        }
        catch (IOException e) {
            throw new PersistenceError("Could not read session export " + path, e);
        }
    }

    public SessionExport read(@NonNull InputStream in) {
        try {
            return mapper.readValue(in, SessionExport.class);
        }
        catch (IOException e) {
            throw new PersistenceError("Could not parse session export", e);
        }
    }
}
