package kr.jemi.zseat.inventory.application.service;

import io.hypersistence.tsid.TSID;
import kr.jemi.zseat.inventory.application.port.in.GetOrderSeatsUseCase;
import kr.jemi.zseat.inventory.application.port.in.RecordSoldSeatsUseCase;
import kr.jemi.zseat.inventory.application.port.out.SoldSeatPort;
import kr.jemi.zseat.inventory.domain.SeatsSoldEvent;
import kr.jemi.zseat.inventory.domain.SoldSeat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Service
public class SoldSeatLedgerService implements RecordSoldSeatsUseCase, GetOrderSeatsUseCase {

    private static final Logger log = LoggerFactory.getLogger(SoldSeatLedgerService.class);

    private final SoldSeatPort soldSeatPort;
    private final TSID.Factory tsidFactory;

    public SoldSeatLedgerService(SoldSeatPort soldSeatPort, TSID.Factory tsidFactory) {
        this.soldSeatPort = soldSeatPort;
        this.tsidFactory = tsidFactory;
    }

    /**
     * 재발행으로 같은 이벤트가 다시 와도 이미 기록된 좌석은 건너뛴다.
     */
    @Override
    @Transactional
    public void record(SeatsSoldEvent event) {
        List<SoldSeat> soldSeats = event.seats().stream()
                .filter(line -> !soldSeatPort.exists(event.eventId(), line.seatId()))
                .map(line -> new SoldSeat(
                        tsidFactory.generate().toLong(),
                        line.seatId(),
                        event.eventId(),
                        event.orderId(),
                        event.customer().email(),
                        event.customer().name(),
                        event.customer().paymentMethod(),
                        line.price(),
                        event.finalizedAt()))
                .toList();
        if (soldSeats.isEmpty()) {
            log.info("이미 기록된 판매: orderId={}", event.orderId());
            return;
        }
        soldSeatPort.insertAll(soldSeats);
    }

    @Override
    public List<SoldSeat> getOrderSeats(String orderId) {
        return soldSeatPort.findByOrderId(orderId);
    }
}
