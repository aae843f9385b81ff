package com.nayem.tessera.core;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.nayem.tessera.idempotency.IdempotencyMeta;
import com.nayem.tessera.job.Digest;
import com.nayem.tessera.job.JobStatus;
import com.nayem.tessera.job.JobView;
import com.nayem.tessera.job.TempIdMapping;

import java.util.List;
import java.util.Map;

/**
 * Answer to a submit request.
 *
 * @param operationId    job id to poll
 * @param status         {@code queued} for new jobs; the current status for
 *                       replays
 * @param replayed       whether the request matched an earlier one by
 *                       idempotency key
 * @param digest         current digest
 * @param tempIdMap      resolved tempIds, empty until the job has committed
 * @param tempIdMappings resolved tempIds with kinds
 * @param idempotency    idempotency metadata when the request carried a key
 * @param result         full job view for replays
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SubmitReceipt(
        String operationId,
        JobStatus status,
        boolean replayed,
        Digest digest,
        Map<String, String> tempIdMap,
        List<TempIdMapping> tempIdMappings,
        IdempotencyMeta idempotency,
        JobView result) {

    static SubmitReceipt queued(JobView view) {
        return new SubmitReceipt(view.operationId(), view.status(), false, view.digest(), view.tempIdMap(),
                view.tempIdMappings(), view.idempotency(), null);
    }

    static SubmitReceipt replay(JobView view) {
        return new SubmitReceipt(view.operationId(), view.status(), true, view.digest(), view.tempIdMap(),
                view.tempIdMappings(), view.idempotency(), view);
    }
}
