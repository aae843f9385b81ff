package com.nayem.tessera.job;

import com.nayem.tessera.tempid.MappingKind;

/**
 * A resolved tempId as reported to the client.
 */
public record TempIdMapping(String tempId, String resolvedId, MappingKind kind, int opIndex) {
}
