package io.taskrelay.util;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.jspecify.annotations.Nullable;

/**
 * Shared JSON mapper and small collection helpers.
 */
public final class Utils {

    /**
     * The protocol version this implementation speaks when a caller does not declare one.
     */
    public static final String SPEC_VERSION_1_0 = "1.0";

    public static final ObjectMapper OBJECT_MAPPER = createObjectMapper();

    private Utils() {
    }

    private static ObjectMapper createObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.ADJUST_DATES_TO_CONTEXT_TIME_ZONE);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        mapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);
        return mapper;
    }

    public static <T> T unmarshalFrom(String data, TypeReference<T> typeRef) throws JsonProcessingException {
        return OBJECT_MAPPER.readValue(data, typeRef);
    }

    public static <T> T unmarshalFrom(String data, Class<T> type) throws JsonProcessingException {
        return OBJECT_MAPPER.readValue(data, type);
    }

    public static String toJsonString(Object value) throws JsonProcessingException {
        return OBJECT_MAPPER.writeValueAsString(value);
    }

    public static <T> T defaultIfNull(@Nullable T value, T defaultValue) {
        return value == null ? defaultValue : value;
    }

    /**
     * Returns an unmodifiable copy of the list, or {@code null} when the list is {@code null}.
     * Unlike {@link List#copyOf(java.util.Collection)} this tolerates {@code null} elements
     * coming from loosely typed JSON input.
     */
    public static <T> @Nullable List<T> copyOfNullable(@Nullable List<T> list) {
        if (list == null) {
            return null;
        }
        return Collections.unmodifiableList(new ArrayList<>(list));
    }

    public static <K, V> @Nullable Map<K, V> copyOfNullable(@Nullable Map<K, V> map) {
        if (map == null) {
            return null;
        }
        return Collections.unmodifiableMap(new java.util.LinkedHashMap<>(map));
    }
}
