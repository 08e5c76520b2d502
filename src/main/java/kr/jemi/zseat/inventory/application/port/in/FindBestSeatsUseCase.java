package kr.jemi.zseat.inventory.application.port.in;

import kr.jemi.zseat.inventory.domain.SeatView;

import java.util.List;

public interface FindBestSeatsUseCase {

    List<SeatView> findBestSeats(BestSeatsQuery query);
}
