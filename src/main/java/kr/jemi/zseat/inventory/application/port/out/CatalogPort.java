package kr.jemi.zseat.inventory.application.port.out;

import kr.jemi.zseat.inventory.domain.PricedSeat;

import java.util.Collection;
import java.util.List;

public interface CatalogPort {

    List<PricedSeat> getEventSeats(long eventId, long chartId);

    List<PricedSeat> findSeats(long eventId, Collection<Long> seatIds);
}
