package kr.jemi.zseat.inventory.application.port.in;

import kr.jemi.zseat.inventory.domain.SessionHold;

import java.util.List;

public interface GetSessionHoldsUseCase {

    List<SessionHold> getSessionHolds(String sessionId, long eventId);
}
