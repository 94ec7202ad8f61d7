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

import com.phonepe.cosign.core.digest.ContentDigest;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertAll;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PayloadRedactorTest {

    @Test
    void testRawValuesAreDigested() {
        final var redacted = PayloadRedactor.redact(Map.of("symbol", "AAPL"));
        assertEquals(Map.of("symbol_hash", ContentDigest.digest("AAPL")), redacted);
        assertEquals("1eb44d625271a4eb75016f276d13783617c012685cb598f20ae93249164c0121", redacted.get("symbol_hash"));
        assertFalse(redacted.containsKey("symbol"));
    }

    @Test
    void testIdsHashesAndSessionIdPassThrough() {
        final var payload = new LinkedHashMap<String, Object>();
        payload.put("order_id", "X1");
        payload.put("doc_hash", "abc");
        payload.put("session_id", "sess_1");
        payload.put("quantity", 10);
        payload.put("tags", List.of("a", "b"));

        final var redacted = PayloadRedactor.redact(payload);
        assertAll(
                () -> assertEquals("X1", redacted.get("order_id")),
                () -> assertEquals("abc", redacted.get("doc_hash")),
                () -> assertEquals("sess_1", redacted.get("session_id")),
                () -> assertEquals(ContentDigest.digest(10), redacted.get("quantity_hash")),
                () -> assertEquals(ContentDigest.digest(List.of("a", "b")), redacted.get("tags_hash")),
                () -> assertEquals(List.of("order_id", "doc_hash", "session_id", "quantity_hash", "tags_hash"),
                                   List.copyOf(redacted.keySet()))
                 );
    }

    @Test
    void testInputUntouchedAndResultReadOnly() {
        final var payload = new HashMap<String, Object>(Map.of("x", 1));
        final var redacted = PayloadRedactor.redact(payload);
        assertEquals(Map.of("x", 1), payload);
        assertThrows(UnsupportedOperationException.class, () -> redacted.put("y", 2));
    }

    @Test
    void testRawKeyClashingWithHashKeyRejected() {
        final var hashFirst = new LinkedHashMap<String, Object>();
        hashFirst.put("symbol_hash", "abc");
        hashFirst.put("symbol", "AAPL");
        final var rawFirst = new LinkedHashMap<String, Object>();
        rawFirst.put("symbol", "AAPL");
        rawFirst.put("symbol_hash", "abc");

        final var error = assertThrows(IllegalArgumentException.class, () -> PayloadRedactor.redact(hashFirst));
        assertTrue(error.getMessage().contains("'symbol'"));
        assertTrue(error.getMessage().contains("'symbol_hash'"));
        assertThrows(IllegalArgumentException.class, () -> PayloadRedactor.redact(rawFirst));
        assertEquals(2, PayloadRedactor.redact(Map.of("symbol", "AAPL", "symbol_id", "S1")).size());
    }

    @Test
    void testNullAndEmptyPayloads() {
        assertTrue(PayloadRedactor.redact(null).isEmpty());
        assertTrue(PayloadRedactor.redact(Map.of()).isEmpty());
    }

    @Test
    void testSuffixRules() {
        assertTrue(PayloadRedactor.passesThrough("peer_agent_id"));
        assertTrue(PayloadRedactor.passesThrough("interaction_hash"));
        assertTrue(PayloadRedactor.passesThrough("session_id"));
        assertFalse(PayloadRedactor.passesThrough("identity"));
        assertFalse(PayloadRedactor.passesThrough("hash"));
    }
}
