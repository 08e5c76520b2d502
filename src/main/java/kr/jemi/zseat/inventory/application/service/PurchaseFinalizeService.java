package kr.jemi.zseat.inventory.application.service;

import kr.jemi.zseat.inventory.application.port.in.CompletePurchaseCommand;
import kr.jemi.zseat.inventory.application.port.in.CompletePurchaseUseCase;
import kr.jemi.zseat.inventory.application.port.out.CatalogPort;
import kr.jemi.zseat.inventory.application.port.out.SeatInventoryPort;
import kr.jemi.zseat.inventory.domain.HoldStatus;
import kr.jemi.zseat.inventory.domain.PricedSeat;
import kr.jemi.zseat.inventory.domain.SaleOutcome;
import kr.jemi.zseat.inventory.domain.SaleRequest;
import kr.jemi.zseat.inventory.domain.SeatHold;
import kr.jemi.zseat.inventory.domain.SeatsSoldEvent;
import kr.jemi.zseat.inventory.domain.exception.HoldNotFoundException;
import kr.jemi.zseat.inventory.domain.exception.PartialExpiryException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

@Service
public class PurchaseFinalizeService implements CompletePurchaseUseCase {

    private static final Logger log = LoggerFactory.getLogger(PurchaseFinalizeService.class);

    private final SeatInventoryPort seatInventoryPort;
    private final CatalogPort catalogPort;
    private final SaleEventWriter saleEventWriter;
    private final Clock clock;

    public PurchaseFinalizeService(SeatInventoryPort seatInventoryPort,
                                   CatalogPort catalogPort,
                                   SaleEventWriter saleEventWriter,
                                   Clock clock) {
        this.seatInventoryPort = seatInventoryPort;
        this.catalogPort = catalogPort;
        this.saleEventWriter = saleEventWriter;
        this.clock = clock;
    }

    @Override
    public List<Long> completePurchase(CompletePurchaseCommand command) {
        Instant now = clock.instant();

        // 1. 세션이 이 이벤트에 가진 미결 선점 (만료된 것 포함)
        List<SeatHold> holds = seatInventoryPort.findHolds(seatInventoryPort.findSessionHoldIds(command.sessionId()))
                .stream()
                .filter(hold -> hold.getEventId() == command.eventId())
                .filter(hold -> hold.getStatus().isLive() || hold.getStatus() == HoldStatus.EXPIRED)
                .sorted(Comparator.comparingLong(SeatHold::getSeatId))
                .toList();
        if (holds.isEmpty()) {
            throw new HoldNotFoundException(command.sessionId(), command.eventId());
        }

        // 2. 판매 가격은 확정 전에 읽어 둔다. 다시 잡은 좌석은 예전 선점과 좌석 ID가 겹친다
        List<Long> seatIds = holds.stream().map(SeatHold::getSeatId).distinct().toList();
        Map<Long, BigDecimal> prices = catalogPort.findSeats(command.eventId(), seatIds)
                .stream()
                .collect(Collectors.toMap(PricedSeat::seatId, PricedSeat::price));

        // 3. 전부 판매하거나 전부 실패
        SaleRequest sale = new SaleRequest(command.eventId(), command.sessionId(), command.orderId(),
                command.customer(), prices);
        SaleOutcome outcome = seatInventoryPort.commitSale(sale, holds, now);
        if (!outcome.sold()) {
            log.warn("결제 확정 실패, 만료된 선점: sessionId={}, eventId={}, seats={}",
                    command.sessionId(), command.eventId(), outcome.seatIds());
            throw new PartialExpiryException(outcome.seatIds());
        }
        if (outcome.seatIds().isEmpty()) {
            throw new HoldNotFoundException(command.sessionId(), command.eventId());
        }

        // 4. 판매 원장 기록은 이벤트 발행 저장소를 거쳐 비동기로.
        // 판매는 이미 확정되었으므로 발행 실패는 판매 기록 복구 작업이 메운다
        List<SeatsSoldEvent.Line> lines = outcome.seatIds().stream()
                .map(seatId -> new SeatsSoldEvent.Line(seatId, sale.priceOf(seatId)))
                .toList();
        try {
            saleEventWriter.publish(new SeatsSoldEvent(command.eventId(), command.orderId(), command.sessionId(),
                    lines, command.customer(), now));
        } catch (Exception e) {
            log.error("판매 이벤트 발행 실패, 원장은 복구 작업이 기록: orderId={}, seats={}",
                    command.orderId(), outcome.seatIds(), e);
        }

        log.info("좌석 판매 확정: orderId={}, eventId={}, seats={}",
                command.orderId(), command.eventId(), outcome.seatIds());
        return outcome.seatIds();
    }
}
