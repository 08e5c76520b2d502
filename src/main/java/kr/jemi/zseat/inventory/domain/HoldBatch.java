package kr.jemi.zseat.inventory.domain;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;

/**
 * 한 번의 선점 요청으로 만들어진 선점 묶음. 모든 선점이 같은 만료 시각과 배치 ID를 가진다.
 */
public record HoldBatch(long batchId, long eventId, String sessionId, List<SeatHold> holds) {

    public HoldBatch {
        if (holds == null || holds.isEmpty()) {
            throw new IllegalArgumentException("선점 묶음은 비어 있을 수 없습니다");
        }
        holds = holds.stream().sorted(Comparator.comparingLong(SeatHold::getSeatId)).toList();
    }

    public List<Long> seatIds() {
        return holds.stream().map(SeatHold::getSeatId).toList();
    }

    public Instant expiresAt() {
        return holds.get(0).getExpiresAt();
    }
}
