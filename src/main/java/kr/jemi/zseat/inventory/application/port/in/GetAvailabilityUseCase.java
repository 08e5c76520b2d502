package kr.jemi.zseat.inventory.application.port.in;

import kr.jemi.zseat.inventory.domain.AvailabilitySummary;
import kr.jemi.zseat.inventory.domain.SeatView;

import java.util.List;

public interface GetAvailabilityUseCase {

    List<SeatView> getAvailableSeats(long eventId, long chartId);

    AvailabilitySummary getSummary(long eventId, long chartId);
}
