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
package com.phonepe.cosign.session;

import lombok.NonNull;

import java.security.SecureRandom;
import java.util.Random;

/**
 * Generates ids of the form {@code sess_} followed by 16 lowercase hex characters
 */
public class RandomSessionIdGenerator implements SessionIdGenerator {
    public static final String PREFIX = "sess_";

    private final Random random;

    public RandomSessionIdGenerator() {
        this(new SecureRandom());
    }

    public RandomSessionIdGenerator(@NonNull Random random) {
        this.random = random;
    }

    /**
     * Deterministic generator, same seed gives the same id sequence
     */
    public static RandomSessionIdGenerator seeded(long seed) {
        return new RandomSessionIdGenerator(new Random(seed));
    }

    @Override
    public synchronized String generate() {
        return PREFIX + "%016x".formatted(random.nextLong());
    }
}
