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

package com.phonepe.cosign.filesystem.identity;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import com.phonepe.cosign.core.crypto.Ed25519Identities;
import com.phonepe.cosign.core.crypto.IdentityLoader;
import com.phonepe.cosign.core.errors.ConfigurationError;
import com.phonepe.cosign.core.errors.CosignError;
import com.phonepe.cosign.core.model.AgentIdentity;
import com.phonepe.cosign.core.utils.EnvLoader;
import com.phonepe.cosign.core.utils.JsonUtils;
import com.phonepe.cosign.filesystem.utils.FileUtils;
import lombok.Getter;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;

/**
 * Reads and writes identity JSON files. Sources handed to {@link #load(String)} are file paths, resolved against the
 * base directory when relative.
 */
@Slf4j
public class FileSystemIdentityStore implements IdentityLoader {
    public static final String BASE_DIR_VARIABLE = "COSIGN_IDENTITY_DIR";
    public static final String DEFAULT_BASE_DIR = ".cosign/identities";
    public static final String FILE_SUFFIX = ".json";

    @Getter
    private final Path baseDir;
    private final ObjectMapper mapper;
    private final Clock clock;

    public FileSystemIdentityStore(@NonNull String baseDir, @NonNull ObjectMapper mapper) {
        this(baseDir, mapper, Clock.systemUTC());
    }

    public FileSystemIdentityStore(@NonNull String baseDir, @NonNull ObjectMapper mapper, @NonNull Clock clock) {
        this.baseDir = FileUtils.ensurePath(baseDir, true);
        this.mapper = mapper;
        this.clock = clock;
    }

    /**
     * Store rooted at {@value #BASE_DIR_VARIABLE}, or {@value #DEFAULT_BASE_DIR} if that is not set
     */
    public static FileSystemIdentityStore fromEnv() {
        return new FileSystemIdentityStore(EnvLoader.readEnv(BASE_DIR_VARIABLE, DEFAULT_BASE_DIR),
                                           JsonUtils.createMapper());
    }

    @Override
    public AgentIdentity load(String source) {
        if (Strings.isNullOrEmpty(source)) {
            throw new ConfigurationError("Identity source cannot be empty");
        }
        final var file = resolve(source);
        if (!Files.isRegularFile(file)) {
            throw new ConfigurationError("Identity file not found: " + file);
        }
        final IdentityFile stored;
        try {
            stored = mapper.readValue(file.toFile(), IdentityFile.class);
        }
        catch (IOException e) {
            throw new ConfigurationError("Could not read identity file " + file, e);
        }
        final AgentIdentity identity;
        try {
            identity = Ed25519Identities.fromEncoded(stored.getPublicKey(), stored.getPrivateKey());
        }
        catch (CosignError e) {
            throw new ConfigurationError("Identity file %s holds invalid keys".formatted(file), e);
        }
        if (!Strings.isNullOrEmpty(stored.getAgentId()) && !stored.getAgentId().equals(identity.getAgentId())) {
            throw new ConfigurationError("Identity file %s claims agent id %s but its key derives %s"
                                                 .formatted(file, stored.getAgentId(), identity.getAgentId()));
        }
        log.debug("Loaded identity {} from {}", identity.getAgentId(), file);
        return identity;
    }

    /**
     * Generates a fresh identity and writes it to {@code <baseDir>/<name>.json}. Existing files are never overwritten.
     *
     * @param name Agent name, also used as the file name
     * @return Path of the written file, usable as an identity source
     */
    public Path create(@NonNull String name) {
        Preconditions.checkArgument(!Strings.isNullOrEmpty(name), "Identity name cannot be empty");
        final var file = resolve(name + FILE_SUFFIX);
        if (!baseDir.equals(file.getParent())) {
            throw new ConfigurationError("Identity name cannot be used as a file name: " + name);
        }
        if (Files.exists(file)) {
            throw new ConfigurationError("Identity file already exists: " + file);
        }
        final var identity = Ed25519Identities.generate();
        final var stored = IdentityFile.builder()
                .agentId(identity.getAgentId())
                .name(name)
                .algorithm(Ed25519Identities.ALGORITHM)
                .publicKey(Ed25519Identities.encodePublicKey(identity.getPublicKey()))
                .privateKey(Ed25519Identities.encodePrivateKey(identity.getPrivateKey()))
                .createdAt(clock.instant().getEpochSecond())
                .build();
        try {
            FileUtils.write(file, mapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(stored), false, true);
        }
        catch (JsonProcessingException e) {
            throw new ConfigurationError("Could not serialize identity " + name, e);
        }
        log.info("Created identity {} for {} at {}", identity.getAgentId(), name, file);
        return file;
    }

    private Path resolve(final String source) {
        return baseDir.resolve(source).toAbsolutePath().normalize();
    }
}
