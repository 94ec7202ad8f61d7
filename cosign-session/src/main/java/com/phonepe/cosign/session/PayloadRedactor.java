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

import com.google.common.base.Preconditions;
import com.phonepe.cosign.core.digest.ContentDigest;
import com.phonepe.cosign.core.model.PayloadKeys;
import lombok.experimental.UtilityClass;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Keeps raw values out of agent logs. Keys ending in {@code _hash} or {@code _id}, and {@code session_id} itself, are
 * taken to already be digests or identifiers and pass through. Every other entry {@code key -> value} is replaced by
 * {@code key_hash -> digest(value)}. A payload holding both {@code key} and {@code key_hash} is rejected with
 * {@link IllegalArgumentException}.
 */
@UtilityClass
public class PayloadRedactor {
    public static final String HASH_SUFFIX = "_hash";
    public static final String ID_SUFFIX = "_id";

    public static Map<String, Object> redact(final Map<String, ?> payload) {
        final var redacted = new LinkedHashMap<String, Object>();
        if (payload == null) {
            return Collections.unmodifiableMap(redacted);
        }
        payload.forEach((key, value) -> {
            final var target = passesThrough(key) ? key : key + HASH_SUFFIX;
            Preconditions.checkArgument(!redacted.containsKey(target),
                                        "Payload keys '%s' and '%s' both map to '%s'",
                                        key, target.equals(key) ? stripHashSuffix(key) : target, target);
            redacted.put(target, target.equals(key) ? value : ContentDigest.digest(value));
        });
        return Collections.unmodifiableMap(redacted);
    }

    private static String stripHashSuffix(final String key) {
        return key.substring(0, key.length() - HASH_SUFFIX.length());
    }

    public static boolean passesThrough(final String key) {
        return key.endsWith(HASH_SUFFIX) || key.endsWith(ID_SUFFIX) || key.equals(PayloadKeys.SESSION_ID);
    }
}
