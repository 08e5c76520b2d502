package kr.jemi.zseat.inventory.application.service;

import kr.jemi.zseat.inventory.application.port.in.BestSeatsQuery;
import kr.jemi.zseat.inventory.application.port.in.FindBestSeatsUseCase;
import kr.jemi.zseat.inventory.application.port.in.GetAvailabilityUseCase;
import kr.jemi.zseat.inventory.domain.BestAvailableSeatSelector;
import kr.jemi.zseat.inventory.domain.SeatView;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
public class SeatAllocationService implements FindBestSeatsUseCase {

    private final GetAvailabilityUseCase getAvailabilityUseCase;

    public SeatAllocationService(GetAvailabilityUseCase getAvailabilityUseCase) {
        this.getAvailabilityUseCase = getAvailabilityUseCase;
    }

    @Override
    public List<SeatView> findBestSeats(BestSeatsQuery query) {
        List<SeatView> seats = getAvailabilityUseCase.getAvailableSeats(query.eventId(), query.chartId());
        return BestAvailableSeatSelector.select(seats, query.criteria());
    }
}
