package kr.jemi.zseat.inventory.application.port.in;

import kr.jemi.zseat.inventory.domain.SoldSeat;

import java.util.List;

public interface GetOrderSeatsUseCase {

    List<SoldSeat> getOrderSeats(String orderId);
}
