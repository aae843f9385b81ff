package com.nayem.tessera.operation;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.exc.InvalidTypeIdException;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.nayem.tessera.error.EngineError;
import com.nayem.tessera.error.ErrorCode;
import com.nayem.tessera.error.Result;

/**
 * JSON codec for request envelopes and response views.
 * <p>
 * Type errors are turned into {@code ValidationError}s that point at the
 * offending field, so the request layer never sees a Jackson exception.
 * </p>
 */
public class BatchCodec {

    private final ObjectMapper mapper;

    public BatchCodec() {
        this(defaultMapper());
    }

    public BatchCodec(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public static ObjectMapper defaultMapper() {
        return JsonMapper.builder()
                .addModule(new JavaTimeModule())
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .build();
    }

    /**
     * Mapper that always writes the same bytes for equal values: properties in
     * alphabetical order, map entries by key, nulls left out.
     */
    public static ObjectMapper canonicalMapper() {
        return JsonMapper.builder()
                .addModule(new JavaTimeModule())
                .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
                .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
                .serializationInclusion(JsonInclude.Include.NON_NULL)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .build();
    }

    public Result<Batch> readBatch(String json) {
        try {
            Batch batch = mapper.readValue(json, Batch.class);
            if (batch == null) {
                return Result.err(EngineError.of(ErrorCode.VALIDATION_ERROR, "Request body is empty"));
            }
            return Result.ok(batch);
        } catch (InvalidTypeIdException e) {
            return Result.err(located(e, "Unknown operation type '" + e.getTypeId() + "'")
                    .withHint("Use one of the supported op names, e.g. createElement or addToView"));
        } catch (JsonMappingException e) {
            return Result.err(located(e, e.getOriginalMessage()));
        } catch (JsonProcessingException e) {
            return Result.err(EngineError.of(ErrorCode.VALIDATION_ERROR, "Malformed JSON: " + e.getOriginalMessage()));
        }
    }

    public String write(Object value) {
        try {
            return mapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize " + value.getClass().getSimpleName(), e);
        }
    }

    public ObjectMapper mapper() {
        return mapper;
    }

    private static EngineError located(JsonMappingException e, String message) {
        StringBuilder path = new StringBuilder();
        Integer opIndex = null;
        String field = null;
        boolean inChanges = false;
        for (JsonMappingException.Reference ref : e.getPath()) {
            if (ref.getFieldName() != null) {
                path.append('/').append(ref.getFieldName());
                inChanges = opIndex == null && "changes".equals(ref.getFieldName());
                if (opIndex != null) {
                    field = field == null ? ref.getFieldName() : field + "." + ref.getFieldName();
                }
            } else if (ref.getIndex() >= 0) {
                path.append('/').append(ref.getIndex());
                if (inChanges && opIndex == null) {
                    opIndex = ref.getIndex();
                }
            }
        }
        return new EngineError(ErrorCode.VALIDATION_ERROR, message, opIndex,
                path.length() > 0 ? path.toString() : null, field, null, null);
    }
}
