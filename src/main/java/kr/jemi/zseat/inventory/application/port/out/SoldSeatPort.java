package kr.jemi.zseat.inventory.application.port.out;

import kr.jemi.zseat.inventory.domain.SoldSeat;

import java.util.List;

public interface SoldSeatPort {

    boolean exists(long eventId, long seatId);

    void insertAll(List<SoldSeat> soldSeats);

    List<SoldSeat> findByOrderId(String orderId);
}
