package io.kubeclient.util;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;
import org.jspecify.annotations.Nullable;

/**
 * JSON helpers around the shared {@link ObjectMapper}.
 * <p>
 * Enumerations travel as their string names. A numeric value for an enum-typed
 * property is rejected instead of being read as an ordinal.
 */
public final class Utils {

    public static final ObjectMapper OBJECT_MAPPER = JsonMapper.builder()
            .addModule(new Jdk8Module())
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .enable(DeserializationFeature.FAIL_ON_NUMBERS_FOR_ENUMS)
            .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS)
            .disable(SerializationFeature.WRITE_ENUMS_USING_INDEX)
            .serializationInclusion(JsonInclude.Include.NON_NULL)
            .build();

    private Utils() {
    }

    public static <T> T unmarshalFrom(String data, Class<T> type) throws JsonProcessingException {
        return OBJECT_MAPPER.readValue(data, type);
    }

    public static String marshal(Object value) throws JsonProcessingException {
        return OBJECT_MAPPER.writeValueAsString(value);
    }

    /**
     * @return {@code true} if the string is {@code null} or contains only whitespace
     */
    public static boolean isBlank(@Nullable String value) {
        return value == null || value.isBlank();
    }
}
