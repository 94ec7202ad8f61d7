package com.phonepe.cosign.core.utils;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.phonepe.cosign.core.errors.CryptoError;
import lombok.experimental.UtilityClass;

import java.io.IOException;
import java.util.Collections;
import java.util.Map;

/**
 * Jackson setup shared by all modules. Everything on the wire uses snake_case property names.
 */
@UtilityClass
public class JsonUtils {

    public static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    public static JsonMapper createMapper() {
        final var mapper = new JsonMapper();
        mapper.findAndRegisterModules()
                .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
                .setSerializationInclusion(JsonInclude.Include.NON_NULL)
                .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .enable(MapperFeature.ACCEPT_CASE_INSENSITIVE_ENUMS);
        return mapper;
    }

    /**
     * Mapper producing a stable byte representation: properties and map entries sorted by key, no whitespace.
     * Used for everything that gets signed or hashed.
     */
    public static JsonMapper canonicalMapper() {
        final var mapper = createMapper();
        mapper.enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
                .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
                .disable(SerializationFeature.INDENT_OUTPUT);
        return mapper;
    }

    public static byte[] canonicalBytes(final ObjectMapper canonicalMapper, final Object value) {
        try {
            return canonicalMapper.writeValueAsBytes(value);
        }
        catch (JsonProcessingException e) {
            throw new CryptoError("Could not serialize %s for signing".formatted(value.getClass().getSimpleName()), e);
        }
    }

    /**
     * Writes the map out and parses it back, so values hold exactly what a reader of the serialized form gets
     * (e.g. {@code BigDecimal("1.50")} becomes {@code 1.5}, an {@code Instant} becomes its numeric timestamp).
     */
    public static Map<String, Object> normalize(final ObjectMapper mapper, final Map<String, ?> value) {
        try {
            return Collections.unmodifiableMap(mapper.readValue(mapper.writeValueAsBytes(value), MAP_TYPE));
        }
        catch (IOException e) {
            throw new CryptoError("Could not normalize payload", e);
        }
    }

    public static Map<String, Object> toMap(final ObjectMapper mapper, final Object value) {
        return mapper.convertValue(value, MAP_TYPE);
    }
}
