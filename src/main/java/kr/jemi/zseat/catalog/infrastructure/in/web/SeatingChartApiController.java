package kr.jemi.zseat.catalog.infrastructure.in.web;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import kr.jemi.zseat.catalog.application.port.in.GetSeatingChartUseCase;
import kr.jemi.zseat.catalog.infrastructure.in.web.dto.SeatCategoryResponse;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@Tag(name = "Seating Chart", description = "좌석 배치도 조회")
@RestController
public class SeatingChartApiController {

    private final GetSeatingChartUseCase getSeatingChartUseCase;

    public SeatingChartApiController(GetSeatingChartUseCase getSeatingChartUseCase) {
        this.getSeatingChartUseCase = getSeatingChartUseCase;
    }

    @Operation(summary = "좌석 카테고리 목록", description = "배치도의 좌석 카테고리를 정렬 순서대로 반환합니다.")
    @GetMapping("/api/charts/{chartId}/categories")
    public ResponseEntity<List<SeatCategoryResponse>> getCategories(
            @Parameter(description = "배치도 ID") @PathVariable long chartId) {
        List<SeatCategoryResponse> response = getSeatingChartUseCase.getCategories(chartId).stream()
                .map(SeatCategoryResponse::from)
                .toList();
        return ResponseEntity.ok(response);
    }
}
