package com.nayem.tessera.error;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Structured error payload. Carries enough context to locate the offending
 * operation and field without consulting logs.
 *
 * @param code      failure kind
 * @param message   human readable description
 * @param opIndex   index of the offending operation in the batch, if any
 * @param path      JSON pointer into the request, e.g. {@code /changes/3/sourceId}
 * @param field     offending field name
 * @param reference the reference value that could not be resolved
 * @param hint      what the client can do about it
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record EngineError(
        ErrorCode code,
        String message,
        Integer opIndex,
        String path,
        String field,
        String reference,
        String hint) {

    public static EngineError of(ErrorCode code, String message) {
        return new EngineError(code, message, null, null, null, null, null);
    }

    /**
     * Error located at an operation. The path defaults to the operation itself,
     * or to the field when one is given.
     */
    public static EngineError at(ErrorCode code, int opIndex, String field, String message) {
        String path = "/changes/" + opIndex + (field != null ? "/" + field.replace('.', '/') : "");
        return new EngineError(code, message, opIndex, path, field, null, null);
    }

    public EngineError withReference(String reference) {
        return new EngineError(code, message, opIndex, path, field, reference, hint);
    }

    public EngineError withHint(String hint) {
        return new EngineError(code, message, opIndex, path, field, reference, hint);
    }

    public EngineError withPath(String path) {
        return new EngineError(code, message, opIndex, path, field, reference, hint);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(code.wireName()).append(": ").append(message);
        if (opIndex != null) {
            sb.append(" (opIndex=").append(opIndex).append(')');
        }
        return sb.toString();
    }
}
