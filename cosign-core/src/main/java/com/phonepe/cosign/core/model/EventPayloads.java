package com.phonepe.cosign.core.model;

import lombok.experimental.UtilityClass;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Builds event payloads. Inputs are never modified, the result is a new unmodifiable map.
 */
@UtilityClass
public class EventPayloads {

    /**
     * Merges extension fields over base fields. On a key clash the extension wins. Entries with null values are
     * dropped from both.
     *
     * @param base       Caller supplied fields, may be null
     * @param extensions Protocol fields to lay on top, may be null
     * @return Unmodifiable map preserving insertion order (base keys first)
     */
    public static Map<String, Object> build(final Map<String, ?> base, final Map<String, ?> extensions) {
        final var merged = new LinkedHashMap<String, Object>();
        copyNonNull(base, merged);
        copyNonNull(extensions, merged);
        return Collections.unmodifiableMap(merged);
    }

    private static void copyNonNull(final Map<String, ?> source, final Map<String, Object> target) {
        if (source == null) {
            return;
        }
        source.forEach((key, value) -> {
            if (value != null) {
                target.put(key, value);
            }
        });
    }
}
