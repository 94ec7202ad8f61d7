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

package com.phonepe.cosign.filesystem.events;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import com.phonepe.cosign.core.errors.PersistenceError;
import com.phonepe.cosign.core.model.SignedEvent;
import com.phonepe.cosign.core.store.EventStore;
import com.phonepe.cosign.core.utils.EnvLoader;
import com.phonepe.cosign.core.utils.JsonUtils;
import com.phonepe.cosign.filesystem.utils.FileUtils;
import lombok.Getter;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.StampedLock;
import java.util.stream.Stream;

/**
 * Disk based event store.
 * Implementation:
 * - Every agent gets a directory named after its agent id under the base directory.
 * - Events are appended to an events.jsonl file in that directory, one event per line, oldest first.
 * - All existing files are read in one shot at startup and served from memory afterwards.
 * - Writes go to the file first and are added to the cache only once the append succeeded.
 * - A single stamped lock guards file appends and cache access.
 */
@Slf4j
public class FileSystemEventStore implements EventStore {
    public static final String EVENTS_FILE_NAME = "events.jsonl";
    public static final String BASE_DIR_VARIABLE = "COSIGN_EVENT_STORE_DIR";
    public static final String DEFAULT_BASE_DIR = ".cosign/events";

    @Getter
    private final Path baseDir;
    private final ObjectMapper mapper;
    private final Map<String, List<SignedEvent>> cache = new HashMap<>();
    private final StampedLock lock = new StampedLock();

    public FileSystemEventStore(@NonNull String baseDir, @NonNull ObjectMapper mapper) {
        this.baseDir = FileUtils.ensurePath(baseDir, true);
        this.mapper = mapper;
        loadExisting();
    }

    /**
     * Store rooted at {@value #BASE_DIR_VARIABLE}, or {@value #DEFAULT_BASE_DIR} if that is not set
     */
    public static FileSystemEventStore fromEnv(final ObjectMapper mapper) {
        return new FileSystemEventStore(EnvLoader.readEnv(BASE_DIR_VARIABLE, DEFAULT_BASE_DIR), mapper);
    }

    public static FileSystemEventStore fromEnv() {
        return fromEnv(JsonUtils.createMapper());
    }

    @Override
    public void persist(@NonNull SignedEvent event) {
        Preconditions.checkArgument(!Strings.isNullOrEmpty(event.getAgentId()), "Event has no agent id");
        final byte[] line;
        try {
            line = (mapper.writeValueAsString(event) + System.lineSeparator()).getBytes(StandardCharsets.UTF_8);
        }
        catch (JsonProcessingException e) {
            throw new PersistenceError("Failed to serialize event for agent " + event.getAgentId(), e);
        }
        final var stamp = lock.writeLock();
        try {
            final var agentDir = FileUtils.ensurePath(agentDir(event.getAgentId()).toString(), true);
            FileUtils.write(agentDir.resolve(EVENTS_FILE_NAME), line, true, false);
            cache.computeIfAbsent(event.getAgentId(), id -> new ArrayList<>()).add(event);
        }
        finally {
            lock.unlockWrite(stamp);
        }
    }

    @Override
    public List<SignedEvent> events(String agentId) {
        final var stamp = lock.readLock();
        try {
            return List.copyOf(cache.getOrDefault(agentId, List.of()));
        }
        finally {
            lock.unlockRead(stamp);
        }
    }

    private Path agentDir(final String agentId) {
        final var dir = baseDir.resolve(agentId).normalize();
        if (!baseDir.equals(dir.getParent())) {
            throw new PersistenceError("Agent id cannot be used as a directory name: " + agentId);
        }
        return dir;
    }

    private void loadExisting() {
        try (Stream<Path> dirs = Files.list(baseDir)) {
            dirs.filter(Files::isDirectory)
                    .forEach(dir -> {
                        final var events = readEvents(dir.resolve(EVENTS_FILE_NAME));
                        if (!events.isEmpty()) {
                            cache.put(dir.getFileName().toString(), events);
                        }
                    });
        }
        catch (IOException e) {
            throw new PersistenceError("Failed to list event directories under " + baseDir, e);
        }
        log.debug("Loaded events for {} agents from {}", cache.size(), baseDir);
    }

    private List<SignedEvent> readEvents(final Path file) {
        final var events = new ArrayList<SignedEvent>();
        if (!Files.exists(file, LinkOption.NOFOLLOW_LINKS)) {
            return events;
        }
        try (var lines = Files.lines(file, StandardCharsets.UTF_8)) {
            for (String line : (Iterable<String>) lines::iterator) {
                if (line.isBlank()) {
                    continue;
                }
                try {
                    events.add(mapper.readValue(line, SignedEvent.class));
                }
                catch (JsonProcessingException e) {
                    throw new PersistenceError("Failed to parse event from " + file, e);
                }
            }
        }
        catch (IOException e) {
            throw new PersistenceError("Failed to read " + file, e);
        }
        return events;
    }
}
