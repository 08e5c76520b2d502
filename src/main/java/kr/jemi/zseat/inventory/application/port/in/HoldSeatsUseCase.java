package kr.jemi.zseat.inventory.application.port.in;

import kr.jemi.zseat.inventory.domain.HoldBatch;

public interface HoldSeatsUseCase {

    HoldBatch holdSeats(HoldSeatsCommand command);
}
