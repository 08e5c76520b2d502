package kr.jemi.zseat.inventory.application.port.out;

import kr.jemi.zseat.inventory.domain.AcquireOutcome;
import kr.jemi.zseat.inventory.domain.HoldExtension;
import kr.jemi.zseat.inventory.domain.SaleOutcome;
import kr.jemi.zseat.inventory.domain.SaleRecord;
import kr.jemi.zseat.inventory.domain.SaleRequest;
import kr.jemi.zseat.inventory.domain.SeatHold;
import kr.jemi.zseat.inventory.domain.SeatOccupancies;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * 좌석 선점/판매 상태 저장소. 모든 변경은 원자적인 조건부 쓰기다.
 */
public interface SeatInventoryPort {

    /**
     * 판매되지 않았고 유효한 선점이 없는 좌석이면 선점을 기록한다.
     * 시간이 지난 기존 선점은 같은 쓰기 안에서 EXPIRED로 바꾼다.
     *
     * @throws kr.jemi.zseat.inventory.domain.exception.StorageConflictException 읽은 뒤 좌석 슬롯이 바뀐 경우
     */
    AcquireOutcome tryAcquireHold(SeatHold hold, Instant now);

    /**
     * @return 유효한 선점을 실제로 해제했으면 true. 이미 종료되었거나 없는 선점이면 false
     */
    boolean releaseHold(long holdId, Instant now);

    HoldExtension extendHold(long holdId, int additionalMinutes, Instant now);

    int markExpired(List<Long> holdIds, Instant now);

    List<Long> findExpiredHoldIds(Instant now, int limit);

    /**
     * 주어진 선점을 모두 판매하거나, 하나라도 만료되었으면 아무것도 판매하지 않는다.
     * 같은 세션이 같은 좌석을 다시 잡아 유효한 선점이 함께 있으면, 그 좌석의 예전 만료 선점은 만료로 보지 않고 정리만 한다.
     */
    SaleOutcome commitSale(SaleRequest sale, List<SeatHold> holds, Instant now);

    /**
     * 판매 확정 후 원장 기록이 확인되지 않은 판매. finalizedAt이 주어진 시각 이전인 것만 오래된 순으로.
     */
    List<SaleRecord> findUnrecordedSales(Instant finalizedBefore, int limit);

    void markSalesRecorded(Collection<SaleRecord> sales);

    SeatOccupancies querySeatStates(long eventId, Collection<Long> seatIds, Instant now);

    Optional<SeatHold> findHold(long holdId);

    List<SeatHold> findHolds(Collection<Long> holdIds);

    Set<Long> findSessionHoldIds(String sessionId);

    Set<Long> findEventHoldIds(long eventId);
}
