package com.phonepe.cosign.core.digest;

import com.google.common.hash.Hashing;
import lombok.experimental.UtilityClass;

import java.nio.charset.StandardCharsets;

/**
 * One-way SHA-256 digest used to keep raw content out of every log. Output is always 64 lowercase hex characters.
 */
@UtilityClass
public class ContentDigest {

    /**
     * Digest of the string form of any value. {@code null} digests as the string "null".
     */
    public static String digest(final Object value) {
        return Hashing.sha256()
                .hashString(String.valueOf(value), StandardCharsets.UTF_8)
                .toString();
    }

    public static String digestBytes(final byte[] data) {
        return Hashing.sha256()
                .hashBytes(data)
                .toString();
    }
}
