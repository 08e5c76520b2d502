package kr.jemi.zseat.inventory.application.service;

import io.hypersistence.tsid.TSID;
import kr.jemi.zseat.common.exception.BusinessException;
import kr.jemi.zseat.common.exception.ErrorCode;
import kr.jemi.zseat.inventory.application.port.in.HoldSeatsCommand;
import kr.jemi.zseat.inventory.application.port.in.ReleaseHoldsCommand;
import kr.jemi.zseat.inventory.application.port.out.CatalogPort;
import kr.jemi.zseat.inventory.application.port.out.SeatInventoryPort;
import kr.jemi.zseat.inventory.domain.AcquireOutcome;
import kr.jemi.zseat.inventory.domain.HoldBatch;
import kr.jemi.zseat.inventory.domain.HoldExtension;
import kr.jemi.zseat.inventory.domain.HoldReason;
import kr.jemi.zseat.inventory.domain.HoldStatus;
import kr.jemi.zseat.inventory.domain.PricedSeat;
import kr.jemi.zseat.inventory.domain.SeatHold;
import kr.jemi.zseat.inventory.domain.SeatOccupancies;
import kr.jemi.zseat.inventory.domain.SeatOccupancy;
import kr.jemi.zseat.inventory.domain.exception.SeatUnavailableException;
import kr.jemi.zseat.inventory.domain.exception.StorageConflictException;
import kr.jemi.zseat.inventory.infrastructure.config.HoldRetryConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.BDDMockito.*;

@ExtendWith(MockitoExtension.class)
class SeatHoldServiceTest {

    private static final long EVENT_ID = 100L;
    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");
    private static final int DEFAULT_DURATION = 15;

    @Mock
    private SeatInventoryPort seatInventoryPort;

    @Mock
    private CatalogPort catalogPort;

    private SeatHoldService seatHoldService;

    @BeforeEach
    void setUp() {
        seatHoldService = new SeatHoldService(
                seatInventoryPort,
                catalogPort,
                new HoldRetryConfig().holdAcquisitionRetry(3, Duration.ofMillis(1), 2.0),
                TSID.Factory.newInstance256(0),
                Clock.fixed(NOW, ZoneOffset.UTC),
                DEFAULT_DURATION);
    }

    private static PricedSeat seat(long seatId) {
        return seat(seatId, 1L, true);
    }

    private static PricedSeat seat(long seatId, long chartId, boolean sellable) {
        return new PricedSeat(seatId, chartId, "FLOOR", "A", (int) seatId, "A-" + seatId,
                "일반석", "#3B82F6", new BigDecimal("50.00"), sellable);
    }

    private static SeatHold hold(long holdId, long seatId, long eventId, String sessionId) {
        return SeatHold.create(holdId, 1L, seatId, eventId, sessionId, null, HoldReason.CHECKOUT, NOW, 10);
    }

    @Nested
    @DisplayName("holdSeats() - 여러 좌석 선점")
    class HoldSeats {

        @Test
        @DisplayName("모든 좌석을 좌석 ID 오름차순으로 선점하고 같은 배치와 만료 시각을 부여한다")
        void holdsAllInAscendingOrder() {
            // given
            given(catalogPort.findSeats(EVENT_ID, List.of(3L, 1L, 2L)))
                    .willReturn(List.of(seat(1L), seat(2L), seat(3L)));
            given(seatInventoryPort.tryAcquireHold(any(), eq(NOW))).willReturn(AcquireOutcome.ACQUIRED);

            // when
            HoldBatch batch = seatHoldService.holdSeats(new HoldSeatsCommand(List.of(3L, 1L, 2L), EVENT_ID, "s1"));

            // then
            assertThat(batch.seatIds()).containsExactly(1L, 2L, 3L);
            assertThat(batch.holds()).allSatisfy(hold -> {
                assertThat(hold.getBatchId()).isEqualTo(batch.batchId());
                assertThat(hold.getExpiresAt()).isEqualTo(NOW.plus(Duration.ofMinutes(DEFAULT_DURATION)));
                assertThat(hold.getStatus()).isEqualTo(HoldStatus.ACTIVE);
            });
            InOrder inOrder = inOrder(seatInventoryPort);
            inOrder.verify(seatInventoryPort).tryAcquireHold(argThat(h -> h.getSeatId() == 1L), eq(NOW));
            inOrder.verify(seatInventoryPort).tryAcquireHold(argThat(h -> h.getSeatId() == 2L), eq(NOW));
            inOrder.verify(seatInventoryPort).tryAcquireHold(argThat(h -> h.getSeatId() == 3L), eq(NOW));
        }

        @Test
        @DisplayName("중간 좌석이 실패하면 먼저 잡은 선점을 해제하고 막힌 좌석 목록을 담아 실패한다")
        void compensatesOnFailure() {
            // given
            given(catalogPort.findSeats(eq(EVENT_ID), anyList()))
                    .willReturn(List.of(seat(1L), seat(2L), seat(3L)));
            given(seatInventoryPort.tryAcquireHold(argThat(h -> h != null && h.getSeatId() == 1L), eq(NOW)))
                    .willReturn(AcquireOutcome.ACQUIRED);
            given(seatInventoryPort.tryAcquireHold(argThat(h -> h != null && h.getSeatId() == 2L), eq(NOW)))
                    .willReturn(AcquireOutcome.HELD_BY_OTHER);
            given(seatInventoryPort.querySeatStates(EVENT_ID, List.of(3L), NOW))
                    .willReturn(new SeatOccupancies(Map.of(3L, SeatOccupancy.sold(3L, "order-1"))));

            // when & then
            assertThatThrownBy(() -> seatHoldService.holdSeats(
                    new HoldSeatsCommand(List.of(1L, 2L, 3L), EVENT_ID, "s1")))
                    .isInstanceOf(SeatUnavailableException.class)
                    .satisfies(e -> assertThat(((SeatUnavailableException) e).getSeatIds()).containsExactly(2L, 3L));
            then(seatInventoryPort).should(times(1)).releaseHold(anyLong(), eq(NOW));
            then(seatInventoryPort).should(never()).tryAcquireHold(argThat(h -> h != null && h.getSeatId() == 3L), any());
        }

        @Test
        @DisplayName("슬롯 경합은 재시도해서 이겨내면 성공한다")
        void retriesStorageConflict() {
            // given
            given(catalogPort.findSeats(eq(EVENT_ID), anyList())).willReturn(List.of(seat(1L)));
            given(seatInventoryPort.tryAcquireHold(any(), eq(NOW)))
                    .willThrow(new StorageConflictException(EVENT_ID, 1L))
                    .willReturn(AcquireOutcome.ACQUIRED);

            // when
            HoldBatch batch = seatHoldService.holdSeats(new HoldSeatsCommand(List.of(1L), EVENT_ID, "s1"));

            // then
            assertThat(batch.seatIds()).containsExactly(1L);
            then(seatInventoryPort).should(times(2)).tryAcquireHold(any(), eq(NOW));
        }

        @Test
        @DisplayName("재시도 횟수를 모두 써도 경합이 계속되면 좌석을 잡지 못한 것으로 본다")
        void conflictExhausted() {
            // given
            given(catalogPort.findSeats(eq(EVENT_ID), anyList())).willReturn(List.of(seat(1L)));
            given(seatInventoryPort.tryAcquireHold(any(), eq(NOW)))
                    .willThrow(new StorageConflictException(EVENT_ID, 1L));

            // when & then
            assertThatThrownBy(() -> seatHoldService.holdSeats(new HoldSeatsCommand(List.of(1L), EVENT_ID, "s1")))
                    .isInstanceOf(SeatUnavailableException.class);
            then(seatInventoryPort).should(times(3)).tryAcquireHold(any(), eq(NOW));
        }

        @Test
        @DisplayName("판매 불가 좌석이 있으면 저장소에 쓰지 않고 실패한다")
        void unsellableSeat() {
            // given
            given(catalogPort.findSeats(eq(EVENT_ID), anyList()))
                    .willReturn(List.of(seat(1L), seat(2L, 1L, false)));

            // when & then
            assertThatThrownBy(() -> seatHoldService.holdSeats(
                    new HoldSeatsCommand(List.of(1L, 2L), EVENT_ID, "s1")))
                    .isInstanceOf(SeatUnavailableException.class)
                    .satisfies(e -> assertThat(((SeatUnavailableException) e).getSeatIds()).containsExactly(2L));
            then(seatInventoryPort).shouldHaveNoInteractions();
        }

        @Test
        @DisplayName("서로 다른 배치도의 좌석은 한 번에 선점할 수 없다")
        void mixedCharts() {
            // given
            given(catalogPort.findSeats(eq(EVENT_ID), anyList()))
                    .willReturn(List.of(seat(1L, 1L, true), seat(2L, 2L, true)));

            // when & then
            assertThatThrownBy(() -> seatHoldService.holdSeats(
                    new HoldSeatsCommand(List.of(1L, 2L), EVENT_ID, "s1")))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("빈 좌석 목록은 명령 생성 단계에서 거부된다")
        void emptySeatIds() {
            assertThatThrownBy(() -> new HoldSeatsCommand(List.of(), EVENT_ID, "s1"))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("extendHold() - 선점 연장")
    class ExtendHold {

        @Test
        @DisplayName("연장하면 EXTENDED 상태의 선점을 돌려준다")
        void extended() {
            // given
            SeatHold extended = new SeatHold(7L, 1L, 1L, EVENT_ID, "s1", null, NOW,
                    NOW.plus(Duration.ofMinutes(20)), 20, HoldStatus.EXTENDED, HoldReason.CHECKOUT, null);
            given(seatInventoryPort.extendHold(7L, 10, NOW))
                    .willReturn(HoldExtension.extended(extended.getExpiresAt()));
            given(seatInventoryPort.findHold(7L)).willReturn(Optional.of(extended));

            // when
            SeatHold result = seatHoldService.extendHold(7L, 10);

            // then
            assertThat(result.getStatus()).isEqualTo(HoldStatus.EXTENDED);
            assertThat(result.getExpiresAt()).isEqualTo(NOW.plus(Duration.ofMinutes(20)));
        }

        @Test
        @DisplayName("저장소 결과를 오류 코드로 옮긴다")
        void mapsOutcomes() {
            given(seatInventoryPort.extendHold(1L, 5, NOW)).willReturn(HoldExtension.of(HoldExtension.Outcome.NOT_FOUND));
            given(seatInventoryPort.extendHold(2L, 5, NOW)).willReturn(HoldExtension.of(HoldExtension.Outcome.EXPIRED));
            given(seatInventoryPort.extendHold(3L, 5, NOW)).willReturn(HoldExtension.of(HoldExtension.Outcome.NOT_ACTIVE));
            given(seatInventoryPort.findHold(3L)).willReturn(Optional.of(new SeatHold(3L, 1L, 1L, EVENT_ID, "s1",
                    null, NOW, NOW.plusSeconds(600), 10, HoldStatus.COMPLETED, HoldReason.CHECKOUT, "order-1")));

            assertThatThrownBy(() -> seatHoldService.extendHold(1L, 5))
                    .extracting(e -> ((BusinessException) e).getErrorCode())
                    .isEqualTo(ErrorCode.HOLD_NOT_FOUND);
            assertThatThrownBy(() -> seatHoldService.extendHold(2L, 5))
                    .extracting(e -> ((BusinessException) e).getErrorCode())
                    .isEqualTo(ErrorCode.HOLD_EXPIRED);
            assertThatThrownBy(() -> seatHoldService.extendHold(3L, 5))
                    .extracting(e -> ((BusinessException) e).getErrorCode())
                    .isEqualTo(ErrorCode.HOLD_NOT_ACTIVE);
        }

        @Test
        @DisplayName("연장 시간이 0 이하이면 거부한다")
        void nonPositiveMinutes() {
            assertThatThrownBy(() -> seatHoldService.extendHold(1L, 0))
                    .isInstanceOf(IllegalArgumentException.class);
            then(seatInventoryPort).shouldHaveNoInteractions();
        }
    }

    @Nested
    @DisplayName("releaseHolds() - 선점 해제")
    class ReleaseHolds {

        @Test
        @DisplayName("세션과 이벤트를 함께 주면 두 조건을 모두 만족하는 선점만 해제한다")
        void sessionAndEventFilter() {
            // given
            given(seatInventoryPort.findSessionHoldIds("s1")).willReturn(Set.of(1L, 2L));
            given(seatInventoryPort.findHolds(Set.of(1L, 2L)))
                    .willReturn(List.of(hold(1L, 1L, EVENT_ID, "s1"), hold(2L, 2L, 999L, "s1")));
            given(seatInventoryPort.releaseHold(1L, NOW)).willReturn(true);

            // when
            int released = seatHoldService.releaseHolds(new ReleaseHoldsCommand(null, "s1", EVENT_ID));

            // then
            assertThat(released).isEqualTo(1);
            then(seatInventoryPort).should(never()).releaseHold(eq(2L), any());
        }

        @Test
        @DisplayName("이미 종료된 선점은 해제 수에 세지 않는다")
        void alreadyTerminal() {
            // given
            given(seatInventoryPort.findHolds(List.of(1L))).willReturn(List.of(hold(1L, 1L, EVENT_ID, "s1")));
            given(seatInventoryPort.releaseHold(1L, NOW)).willReturn(false);

            // when & then
            assertThat(seatHoldService.releaseHolds(ReleaseHoldsCommand.ofHolds(List.of(1L)))).isZero();
        }

        @Test
        @DisplayName("조건이 하나도 없으면 거부한다")
        void noFilter() {
            assertThatThrownBy(() -> new ReleaseHoldsCommand(List.of(), " ", null))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Test
    @DisplayName("getSessionHolds()는 해당 이벤트의 유효한 선점만 좌석 이름과 함께 돌려준다")
    void sessionHolds() {
        // given
        SeatHold expired = new SeatHold(3L, 1L, 3L, EVENT_ID, "s1", null, NOW.minusSeconds(600),
                NOW.minusSeconds(1), 10, HoldStatus.ACTIVE, HoldReason.CHECKOUT, null);
        given(seatInventoryPort.findSessionHoldIds("s1")).willReturn(Set.of(1L, 2L, 3L));
        given(seatInventoryPort.findHolds(Set.of(1L, 2L, 3L)))
                .willReturn(List.of(hold(2L, 2L, EVENT_ID, "s1"), hold(1L, 1L, 999L, "s1"), expired));
        given(catalogPort.findSeats(EVENT_ID, List.of(2L))).willReturn(List.of(seat(2L)));

        // when
        var holds = seatHoldService.getSessionHolds("s1", EVENT_ID);

        // then
        assertThat(holds).hasSize(1);
        assertThat(holds.get(0).seatLabel()).isEqualTo("A-2");
        assertThat(holds.get(0).remainingMinutes()).isEqualTo(10);
    }
}
