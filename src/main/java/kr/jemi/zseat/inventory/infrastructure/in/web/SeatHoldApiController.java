package kr.jemi.zseat.inventory.infrastructure.in.web;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import kr.jemi.zseat.inventory.application.port.in.ExtendHoldUseCase;
import kr.jemi.zseat.inventory.application.port.in.GetSessionHoldsUseCase;
import kr.jemi.zseat.inventory.application.port.in.HoldSeatsCommand;
import kr.jemi.zseat.inventory.application.port.in.HoldSeatsUseCase;
import kr.jemi.zseat.inventory.application.port.in.ReleaseHoldsCommand;
import kr.jemi.zseat.inventory.application.port.in.ReleaseHoldsUseCase;
import kr.jemi.zseat.inventory.domain.HoldBatch;
import kr.jemi.zseat.inventory.infrastructure.in.web.dto.ExtendHoldRequest;
import kr.jemi.zseat.inventory.infrastructure.in.web.dto.HoldBatchResponse;
import kr.jemi.zseat.inventory.infrastructure.in.web.dto.HoldResponse;
import kr.jemi.zseat.inventory.infrastructure.in.web.dto.HoldSeatsRequest;
import kr.jemi.zseat.inventory.infrastructure.in.web.dto.ReleaseHoldsRequest;
import kr.jemi.zseat.inventory.infrastructure.in.web.dto.ReleaseHoldsResponse;
import kr.jemi.zseat.inventory.infrastructure.in.web.dto.SessionHoldResponse;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@Tag(name = "Seat Hold", description = "좌석 선점, 연장, 해제")
@RestController
public class SeatHoldApiController {

    private final HoldSeatsUseCase holdSeatsUseCase;
    private final ExtendHoldUseCase extendHoldUseCase;
    private final ReleaseHoldsUseCase releaseHoldsUseCase;
    private final GetSessionHoldsUseCase getSessionHoldsUseCase;

    public SeatHoldApiController(HoldSeatsUseCase holdSeatsUseCase,
                                 ExtendHoldUseCase extendHoldUseCase,
                                 ReleaseHoldsUseCase releaseHoldsUseCase,
                                 GetSessionHoldsUseCase getSessionHoldsUseCase) {
        this.holdSeatsUseCase = holdSeatsUseCase;
        this.extendHoldUseCase = extendHoldUseCase;
        this.releaseHoldsUseCase = releaseHoldsUseCase;
        this.getSessionHoldsUseCase = getSessionHoldsUseCase;
    }

    @Operation(summary = "좌석 선점", description = "요청한 좌석을 모두 선점하거나, 하나라도 불가능하면 아무것도 선점하지 않습니다.")
    @PostMapping("/api/events/{eventId}/holds")
    public ResponseEntity<HoldBatchResponse> hold(
            @Parameter(description = "이벤트 ID") @PathVariable long eventId,
            @Valid @RequestBody HoldSeatsRequest request) {
        HoldSeatsCommand command = new HoldSeatsCommand(request.seatIds(), eventId, request.sessionId(),
                request.durationMinutes(), request.customerEmail(), request.reason());
        HoldBatch batch = holdSeatsUseCase.holdSeats(command);
        return ResponseEntity.ok(HoldBatchResponse.from(batch));
    }

    @Operation(summary = "선점 연장", description = "ACTIVE 상태의 선점만 한 번 연장할 수 있습니다.")
    @PatchMapping("/api/holds/{holdId}/extension")
    public ResponseEntity<HoldResponse> extend(
            @Parameter(description = "선점 ID") @PathVariable long holdId,
            @Valid @RequestBody ExtendHoldRequest request) {
        return ResponseEntity.ok(HoldResponse.from(extendHoldUseCase.extendHold(holdId, request.additionalMinutes())));
    }

    @Operation(summary = "선점 해제", description = "선점 ID, 세션, 이벤트 조건을 모두 만족하는 유효한 선점을 해제합니다.")
    @PostMapping("/api/holds/release")
    public ResponseEntity<ReleaseHoldsResponse> release(@RequestBody ReleaseHoldsRequest request) {
        ReleaseHoldsCommand command = new ReleaseHoldsCommand(request.holdIds(), request.sessionId(), request.eventId());
        return ResponseEntity.ok(new ReleaseHoldsResponse(releaseHoldsUseCase.releaseHolds(command)));
    }

    @Operation(summary = "세션 선점 현황", description = "세션이 이벤트에 가진 유효한 선점과 남은 시간(분)을 반환합니다.")
    @GetMapping("/api/events/{eventId}/sessions/{sessionId}/holds")
    public ResponseEntity<List<SessionHoldResponse>> getSessionHolds(
            @Parameter(description = "이벤트 ID") @PathVariable long eventId,
            @Parameter(description = "세션 ID") @PathVariable String sessionId) {
        List<SessionHoldResponse> response = getSessionHoldsUseCase.getSessionHolds(sessionId, eventId).stream()
                .map(SessionHoldResponse::from)
                .toList();
        return ResponseEntity.ok(response);
    }
}
