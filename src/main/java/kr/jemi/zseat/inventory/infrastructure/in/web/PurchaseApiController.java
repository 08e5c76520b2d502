package kr.jemi.zseat.inventory.infrastructure.in.web;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import kr.jemi.zseat.inventory.application.port.in.CompletePurchaseCommand;
import kr.jemi.zseat.inventory.application.port.in.CompletePurchaseUseCase;
import kr.jemi.zseat.inventory.application.port.in.GetOrderSeatsUseCase;
import kr.jemi.zseat.inventory.domain.CustomerInfo;
import kr.jemi.zseat.inventory.infrastructure.in.web.dto.CompletePurchaseRequest;
import kr.jemi.zseat.inventory.infrastructure.in.web.dto.PurchaseResponse;
import kr.jemi.zseat.inventory.infrastructure.in.web.dto.SoldSeatResponse;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@Tag(name = "Purchase", description = "좌석 판매 확정")
@RestController
public class PurchaseApiController {

    private final CompletePurchaseUseCase completePurchaseUseCase;
    private final GetOrderSeatsUseCase getOrderSeatsUseCase;

    public PurchaseApiController(CompletePurchaseUseCase completePurchaseUseCase,
                                 GetOrderSeatsUseCase getOrderSeatsUseCase) {
        this.completePurchaseUseCase = completePurchaseUseCase;
        this.getOrderSeatsUseCase = getOrderSeatsUseCase;
    }

    @Operation(summary = "판매 확정", description = "결제 완료 후 세션의 선점을 모두 판매 처리합니다. 만료된 선점이 있으면 아무것도 판매하지 않습니다.")
    @PostMapping("/api/events/{eventId}/purchases")
    public ResponseEntity<PurchaseResponse> complete(
            @Parameter(description = "이벤트 ID") @PathVariable long eventId,
            @Valid @RequestBody CompletePurchaseRequest request) {
        CustomerInfo customer = new CustomerInfo(request.customerEmail(), request.customerName(),
                request.paymentMethod());
        CompletePurchaseCommand command = new CompletePurchaseCommand(request.sessionId(), eventId,
                request.orderId(), customer);
        List<Long> seatIds = completePurchaseUseCase.completePurchase(command);
        return ResponseEntity.ok(new PurchaseResponse(request.orderId(), seatIds));
    }

    @Operation(summary = "주문 좌석 조회", description = "판매 원장에 기록된 주문의 좌석을 반환합니다. 기록은 비동기로 반영됩니다.")
    @GetMapping("/api/orders/{orderId}/seats")
    public ResponseEntity<List<SoldSeatResponse>> getOrderSeats(
            @Parameter(description = "주문 ID") @PathVariable String orderId) {
        List<SoldSeatResponse> response = getOrderSeatsUseCase.getOrderSeats(orderId).stream()
                .map(SoldSeatResponse::from)
                .toList();
        return ResponseEntity.ok(response);
    }
}
