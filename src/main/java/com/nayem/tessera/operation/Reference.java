package com.nayem.tessera.operation;

import com.nayem.tessera.tempid.MappingKind;

import java.util.EnumSet;
import java.util.Set;

/**
 * A field of an operation that names another object, either by literal id or
 * by tempId.
 *
 * @param field   field path relative to the operation, e.g. {@code create.sourceId}
 * @param value   the id or tempId as sent by the client
 * @param accepts kinds of object the field may point at
 */
public record Reference(String field, String value, Set<MappingKind> accepts) {

    public static Reference to(String field, String value, MappingKind kind, MappingKind... more) {
        return new Reference(field, value, EnumSet.of(kind, more));
    }
}
