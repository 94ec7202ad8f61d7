package com.phonepe.cosign.core.digest;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;

class ContentDigestTest {

    @Test
    void testKnownValues() {
        assertEquals("1eb44d625271a4eb75016f276d13783617c012685cb598f20ae93249164c0121",
                     ContentDigest.digest("AAPL"));
        assertEquals("e3b0c44298fc1c149afbf4c8996fb92427ae41e4649b934ca495991b7852b855",
                     ContentDigest.digest(""));
    }

    @Test
    void testUsesStringForm() {
        assertEquals("6b86b273ff34fce19d6b804eff5a3f5747ada4eaa22f1d49c01e52ddb7875b4b",
                     ContentDigest.digest(1));
        assertEquals(ContentDigest.digest("1"), ContentDigest.digest(1L));
        assertEquals(ContentDigest.digest("null"), ContentDigest.digest(null));
    }

    @Test
    void testDeterministicAndFixedLength() {
        final var first = ContentDigest.digest("buy");
        assertEquals(first, ContentDigest.digest("buy"));
        assertEquals(64, first.length());
        assertNotEquals(first, ContentDigest.digest("sell"));
    }

    @Test
    void testBytesMatchString() {
        assertEquals(ContentDigest.digest("hello"),
                     ContentDigest.digestBytes("hello".getBytes(StandardCharsets.UTF_8)));
    }
}
