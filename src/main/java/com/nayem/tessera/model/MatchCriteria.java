package com.nayem.tessera.model;

/**
 * Lookup criteria for duplicate detection. Null components are wildcards,
 * except for {@code kind} which is mandatory.
 */
public record MatchCriteria(
        ObjectKind kind,
        String type,
        String name,
        String sourceId,
        String targetId,
        String accessType,
        String strength) {

    public static MatchCriteria element(String type, String name) {
        return new MatchCriteria(ObjectKind.ELEMENT, type, name, null, null, null, null);
    }

    public static MatchCriteria relationship(String type, String sourceId, String targetId) {
        return new MatchCriteria(ObjectKind.RELATIONSHIP, type, null, sourceId, targetId, null, null);
    }

    public MatchCriteria withQualifiers(String accessType, String strength) {
        return new MatchCriteria(kind, type, name, sourceId, targetId, accessType, strength);
    }

    public boolean matches(ModelObject object) {
        if (object.kind() != kind) {
            return false;
        }
        return same(type, object.type())
                && same(name, object.name())
                && same(sourceId, object.sourceId())
                && same(targetId, object.targetId())
                && same(accessType, (String) object.attribute(Fields.ACCESS_TYPE))
                && same(strength, (String) object.attribute(Fields.STRENGTH));
    }

    private static boolean same(String expected, String actual) {
        return expected == null || expected.equals(actual);
    }
}
