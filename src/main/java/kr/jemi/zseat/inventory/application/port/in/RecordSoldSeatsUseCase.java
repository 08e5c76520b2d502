package kr.jemi.zseat.inventory.application.port.in;

import kr.jemi.zseat.inventory.domain.SeatsSoldEvent;

public interface RecordSoldSeatsUseCase {

    void record(SeatsSoldEvent event);
}
