package kr.jemi.zseat.inventory.infrastructure.in.web;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import kr.jemi.zseat.inventory.application.port.in.BestSeatsQuery;
import kr.jemi.zseat.inventory.application.port.in.FindBestSeatsUseCase;
import kr.jemi.zseat.inventory.application.port.in.GetAvailabilityUseCase;
import kr.jemi.zseat.inventory.infrastructure.in.web.dto.AvailabilitySummaryResponse;
import kr.jemi.zseat.inventory.infrastructure.in.web.dto.SeatViewResponse;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.math.BigDecimal;
import java.util.List;

@Tag(name = "Seat Availability", description = "좌석 현황 및 최적 좌석 조회")
@RestController
public class SeatAvailabilityApiController {

    private final GetAvailabilityUseCase getAvailabilityUseCase;
    private final FindBestSeatsUseCase findBestSeatsUseCase;

    public SeatAvailabilityApiController(GetAvailabilityUseCase getAvailabilityUseCase,
                                         FindBestSeatsUseCase findBestSeatsUseCase) {
        this.getAvailabilityUseCase = getAvailabilityUseCase;
        this.findBestSeatsUseCase = findBestSeatsUseCase;
    }

    @Operation(summary = "이벤트 좌석 현황", description = "좌석별 판매/선점/가능 상태를 구역, 열, 번호 순으로 반환합니다.")
    @GetMapping("/api/events/{eventId}/charts/{chartId}/seats")
    public ResponseEntity<List<SeatViewResponse>> getSeats(
            @Parameter(description = "이벤트 ID") @PathVariable long eventId,
            @Parameter(description = "배치도 ID") @PathVariable long chartId) {
        List<SeatViewResponse> response = getAvailabilityUseCase.getAvailableSeats(eventId, chartId).stream()
                .map(SeatViewResponse::from)
                .toList();
        return ResponseEntity.ok(response);
    }

    @Operation(summary = "좌석 현황 요약", description = "전체/가능/선점/판매 좌석 수와 판매 금액 합계를 반환합니다.")
    @GetMapping("/api/events/{eventId}/charts/{chartId}/seats/summary")
    public ResponseEntity<AvailabilitySummaryResponse> getSummary(
            @Parameter(description = "이벤트 ID") @PathVariable long eventId,
            @Parameter(description = "배치도 ID") @PathVariable long chartId) {
        return ResponseEntity.ok(AvailabilitySummaryResponse.from(getAvailabilityUseCase.getSummary(eventId, chartId)));
    }

    @Operation(summary = "최적 좌석 추천", description = "조건에 맞는 좌석을 고릅니다. 좌석을 선점하지는 않습니다.")
    @GetMapping("/api/events/{eventId}/charts/{chartId}/best-seats")
    public ResponseEntity<List<SeatViewResponse>> getBestSeats(
            @Parameter(description = "이벤트 ID") @PathVariable long eventId,
            @Parameter(description = "배치도 ID") @PathVariable long chartId,
            @Parameter(description = "좌석 수") @RequestParam int quantity,
            @Parameter(description = "붙어 있는 좌석 우선") @RequestParam(defaultValue = "true") boolean preferTogether,
            @Parameter(description = "좌석당 최대 가격") @RequestParam(required = false) BigDecimal maxPrice,
            @Parameter(description = "선호 구역") @RequestParam(required = false) String section) {
        BestSeatsQuery query = new BestSeatsQuery(eventId, chartId, quantity, preferTogether, maxPrice, section);
        List<SeatViewResponse> response = findBestSeatsUseCase.findBestSeats(query).stream()
                .map(SeatViewResponse::from)
                .toList();
        return ResponseEntity.ok(response);
    }
}
