package com.nayem.tessera.idempotency;

import com.nayem.tessera.operation.Batch;
import com.nayem.tessera.operation.DuplicateStrategy;
import com.nayem.tessera.operation.Operation;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.nayem.tessera.support.Ops.createElement;
import static org.assertj.core.api.Assertions.assertThat;

class PayloadFingerprinterTest {

    private final PayloadFingerprinter fingerprinter = new PayloadFingerprinter();

    @Test
    void ignoresTheIdempotencyKey() {
        Batch batch = Batch.of(List.of(createElement("a", "node", "Host")));

        assertThat(fingerprinter.fingerprint(batch.withIdempotencyKey("one")))
                .isEqualTo(fingerprinter.fingerprint(batch.withIdempotencyKey("two")))
                .hasSize(64);
    }

    @Test
    void absentDuplicateStrategyEqualsExplicitError() {
        Batch batch = Batch.of(List.of(createElement("a", "node", "Host")));

        assertThat(fingerprinter.fingerprint(batch))
                .isEqualTo(fingerprinter.fingerprint(batch.withDuplicateStrategy(DuplicateStrategy.ERROR)));
        assertThat(fingerprinter.fingerprint(batch))
                .isNotEqualTo(fingerprinter.fingerprint(batch.withDuplicateStrategy(DuplicateStrategy.REUSE)));
    }

    @Test
    void propertyOrderDoesNotMatter() {
        Map<String, String> forward = new LinkedHashMap<>();
        forward.put("owner", "ops");
        forward.put("tier", "1");
        Map<String, String> backward = new LinkedHashMap<>();
        backward.put("tier", "1");
        backward.put("owner", "ops");

        String first = fingerprinter.fingerprint(Batch.of(List.of(
                new Operation.CreateElement("a", "node", "Host", null, forward, null, null))));
        String second = fingerprinter.fingerprint(Batch.of(List.of(
                new Operation.CreateElement("a", "node", "Host", null, backward, null, null))));

        assertThat(first).isEqualTo(second);
    }

    @Test
    void operationOrderMatters() {
        Batch ab = Batch.of(List.of(createElement("a", "node", "A"), createElement("b", "node", "B")));
        Batch ba = Batch.of(List.of(createElement("b", "node", "B"), createElement("a", "node", "A")));

        assertThat(fingerprinter.fingerprint(ab)).isNotEqualTo(fingerprinter.fingerprint(ba));
    }

    @Test
    void canonicalFormCarriesOperationNameAndLeavesOutNulls() {
        String json = fingerprinter.canonicalJson(Batch.of(List.of(createElement("a", "node", "Host"))));

        assertThat(json).contains("\"op\":\"createElement\"").doesNotContain("null").doesNotContain("idempotencyKey");
    }
}
