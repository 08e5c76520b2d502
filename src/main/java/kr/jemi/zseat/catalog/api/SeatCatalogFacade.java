package kr.jemi.zseat.catalog.api;

import java.util.Collection;
import java.util.List;

public interface SeatCatalogFacade {

    /**
     * 배치도의 모든 좌석을 이벤트 가격과 판매 가능 여부를 반영해 돌려준다.
     */
    List<CatalogSeat> listEventSeats(long eventId, long chartId);

    /**
     * 좌석 ID로 좌석을 찾는다. 하나라도 없으면 SEAT_NOT_FOUND로 실패한다.
     */
    List<CatalogSeat> findEventSeats(long eventId, Collection<Long> seatIds);
}
