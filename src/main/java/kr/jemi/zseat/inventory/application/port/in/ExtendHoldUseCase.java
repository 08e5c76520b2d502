package kr.jemi.zseat.inventory.application.port.in;

import kr.jemi.zseat.inventory.domain.SeatHold;

public interface ExtendHoldUseCase {

    SeatHold extendHold(long holdId, int additionalMinutes);
}
