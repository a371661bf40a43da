package io.periodic4j.utils;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * JSON codec for the positional and keyword arguments stored on a schedule entry.
 *
 * <p>Decoding a blob that is not valid JSON of the expected shape is a data-integrity fault and
 * fails with {@link IllegalStateException}. A JSON {@code null} decodes to an empty list or map.
 *
 * <p>Values come back as Jackson's untyped JSON mapping, not as the types that were encoded: whole
 * numbers decode as {@code Integer} (or {@code Long}/{@code BigInteger} when they do not fit), decimals
 * as {@code Double}, objects as {@code LinkedHashMap}.
 */
public final class TaskArgumentCodec {

    public static final String EMPTY_ARGS = "[]";
    public static final String EMPTY_KWARGS = "{}";

    private static final TaskArgumentCodec DEFAULT = new TaskArgumentCodec(new ObjectMapper());

    private static final TypeReference<List<Object>> ARGS_TYPE = new TypeReference<>() {
    };
    private static final TypeReference<LinkedHashMap<String, Object>> KWARGS_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    public TaskArgumentCodec(ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
    }

    public static TaskArgumentCodec defaults() {
        return DEFAULT;
    }

    public String encodeArgs(List<?> args) {
        return write(args == null ? List.of() : args);
    }

    public String encodeKwargs(Map<String, ?> kwargs) {
        return write(kwargs == null ? Map.of() : kwargs);
    }

    public List<Object> decodeArgs(String json) {
        if (json == null) {
            return new ArrayList<>();
        }
        try {
            List<Object> args = objectMapper.readValue(json, ARGS_TYPE);
            return args == null ? new ArrayList<>() : args;
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Malformed task arguments: " + json, ex);
        }
    }

    public Map<String, Object> decodeKwargs(String json) {
        if (json == null) {
            return new LinkedHashMap<>();
        }
        try {
            Map<String, Object> kwargs = objectMapper.readValue(json, KWARGS_TYPE);
            return kwargs == null ? new LinkedHashMap<>() : kwargs;
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Malformed task keyword arguments: " + json, ex);
        }
    }

    private String write(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException ex) {
            throw new IllegalArgumentException("Task arguments are not JSON-serializable: " + ex.getOriginalMessage(), ex);
        }
    }
}
