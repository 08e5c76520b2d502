package kr.jemi.zseat.inventory.application.service;

import kr.jemi.zseat.inventory.application.port.in.GetAvailabilityUseCase;
import kr.jemi.zseat.inventory.application.port.out.CatalogPort;
import kr.jemi.zseat.inventory.application.port.out.SeatInventoryPort;
import kr.jemi.zseat.inventory.domain.AvailabilitySummary;
import kr.jemi.zseat.inventory.domain.PricedSeat;
import kr.jemi.zseat.inventory.domain.SeatOccupancies;
import kr.jemi.zseat.inventory.domain.SeatView;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Comparator;
import java.util.List;

/**
 * 좌석 현황 읽기 모델. 판매 불가로 설정된 좌석은 포함하지 않는다.
 * 쓰기 시점의 판정은 선점 저장소가 다시 한다.
 */
@Service
public class SeatAvailabilityService implements GetAvailabilityUseCase {

    private static final Comparator<SeatView> SEATING_ORDER = Comparator
            .comparing((SeatView v) -> v.seat().section(), Comparator.nullsFirst(Comparator.naturalOrder()))
            .thenComparing(v -> v.seat().rowLabel(), Comparator.nullsFirst(Comparator.naturalOrder()))
            .thenComparingInt(v -> v.seat().seatNumber())
            .thenComparingLong(SeatView::seatId);

    private final CatalogPort catalogPort;
    private final SeatInventoryPort seatInventoryPort;
    private final Clock clock;

    public SeatAvailabilityService(CatalogPort catalogPort, SeatInventoryPort seatInventoryPort, Clock clock) {
        this.catalogPort = catalogPort;
        this.seatInventoryPort = seatInventoryPort;
        this.clock = clock;
    }

    @Override
    public List<SeatView> getAvailableSeats(long eventId, long chartId) {
        List<PricedSeat> seats = catalogPort.getEventSeats(eventId, chartId).stream()
                .filter(PricedSeat::sellable)
                .toList();
        if (seats.isEmpty()) {
            return List.of();
        }
        List<Long> seatIds = seats.stream().map(PricedSeat::seatId).toList();
        SeatOccupancies occupancies = seatInventoryPort.querySeatStates(eventId, seatIds, clock.instant());
        return seats.stream()
                .map(seat -> new SeatView(seat, occupancies.stateOf(seat.seatId())))
                .sorted(SEATING_ORDER)
                .toList();
    }

    @Override
    public AvailabilitySummary getSummary(long eventId, long chartId) {
        return AvailabilitySummary.of(getAvailableSeats(eventId, chartId));
    }
}
