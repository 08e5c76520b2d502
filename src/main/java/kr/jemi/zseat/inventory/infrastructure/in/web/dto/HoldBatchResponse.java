package kr.jemi.zseat.inventory.infrastructure.in.web.dto;

import kr.jemi.zseat.inventory.domain.HoldBatch;

import java.time.Instant;
import java.util.List;

public record HoldBatchResponse(long batchId, Instant expiresAt, List<HoldResponse> holds) {

    public static HoldBatchResponse from(HoldBatch batch) {
        return new HoldBatchResponse(
                batch.batchId(),
                batch.expiresAt(),
                batch.holds().stream().map(HoldResponse::from).toList()
        );
    }
}
