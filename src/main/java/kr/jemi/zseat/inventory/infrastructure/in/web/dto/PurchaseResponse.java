package kr.jemi.zseat.inventory.infrastructure.in.web.dto;

import java.util.List;

public record PurchaseResponse(String orderId, List<Long> seatIds) {
}
