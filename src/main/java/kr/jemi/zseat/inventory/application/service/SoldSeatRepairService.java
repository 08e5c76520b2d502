package kr.jemi.zseat.inventory.application.service;

import kr.jemi.zseat.inventory.application.port.in.RecordSoldSeatsUseCase;
import kr.jemi.zseat.inventory.application.port.in.RepairSoldSeatsUseCase;
import kr.jemi.zseat.inventory.application.port.out.SeatInventoryPort;
import kr.jemi.zseat.inventory.domain.SaleRecord;
import kr.jemi.zseat.inventory.domain.SeatsSoldEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * 판매 확정 후 원장에 옮겨졌는지 확인되지 않은 판매를 주문 단위로 다시 기록한다.
 * 원장 기록은 좌석 단위로 멱등이라 이미 기록된 판매는 확인만 하고 넘어간다.
 */
@Service
public class SoldSeatRepairService implements RepairSoldSeatsUseCase {

    private static final Logger log = LoggerFactory.getLogger(SoldSeatRepairService.class);

    private final SeatInventoryPort seatInventoryPort;
    private final RecordSoldSeatsUseCase recordSoldSeatsUseCase;
    private final Clock clock;
    private final Duration olderThan;
    private final int batchSize;

    public SoldSeatRepairService(SeatInventoryPort seatInventoryPort,
                                 RecordSoldSeatsUseCase recordSoldSeatsUseCase,
                                 Clock clock,
                                 @Value("${zseat.ledger-repair.older-than}") Duration olderThan,
                                 @Value("${zseat.ledger-repair.batch-size}") int batchSize) {
        this.seatInventoryPort = seatInventoryPort;
        this.recordSoldSeatsUseCase = recordSoldSeatsUseCase;
        this.clock = clock;
        this.olderThan = olderThan;
        this.batchSize = batchSize;
    }

    @Override
    public int repairUnrecordedSales() {
        Instant finalizedBefore = clock.instant().minus(olderThan);
        List<SaleRecord> pending = seatInventoryPort.findUnrecordedSales(finalizedBefore, batchSize);
        if (pending.isEmpty()) {
            return 0;
        }

        Map<String, List<SaleRecord>> byOrder = pending.stream()
                .collect(Collectors.groupingBy(sale -> sale.eventId() + ":" + sale.orderId(),
                        LinkedHashMap::new, Collectors.toList()));

        List<SaleRecord> recorded = new ArrayList<>();
        for (List<SaleRecord> sales : byOrder.values()) {
            SaleRecord first = sales.get(0);
            List<SeatsSoldEvent.Line> lines = sales.stream()
                    .map(sale -> new SeatsSoldEvent.Line(sale.seatId(), sale.price()))
                    .toList();
            try {
                recordSoldSeatsUseCase.record(new SeatsSoldEvent(first.eventId(), first.orderId(),
                        first.sessionId(), lines, first.customer(), first.finalizedAt()));
                recorded.addAll(sales);
            } catch (Exception e) {
                log.error("판매 원장 복구 실패: orderId={}, eventId={}", first.orderId(), first.eventId(), e);
            }
        }

        if (!recorded.isEmpty()) {
            seatInventoryPort.markSalesRecorded(recorded);
            log.info("판매 원장 확인 완료. 좌석 {}건, 주문 {}건", recorded.size(), byOrder.size());
        }
        return recorded.size();
    }
}
