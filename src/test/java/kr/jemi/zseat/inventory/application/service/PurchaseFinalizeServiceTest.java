package kr.jemi.zseat.inventory.application.service;

import kr.jemi.zseat.common.exception.BusinessException;
import kr.jemi.zseat.common.exception.ErrorCode;
import kr.jemi.zseat.inventory.application.port.in.CompletePurchaseCommand;
import kr.jemi.zseat.inventory.application.port.out.CatalogPort;
import kr.jemi.zseat.inventory.application.port.out.SeatInventoryPort;
import kr.jemi.zseat.inventory.domain.CustomerInfo;
import kr.jemi.zseat.inventory.domain.HoldReason;
import kr.jemi.zseat.inventory.domain.HoldStatus;
import kr.jemi.zseat.inventory.domain.PricedSeat;
import kr.jemi.zseat.inventory.domain.SaleOutcome;
import kr.jemi.zseat.inventory.domain.SaleRequest;
import kr.jemi.zseat.inventory.domain.SeatHold;
import kr.jemi.zseat.inventory.domain.SeatsSoldEvent;
import kr.jemi.zseat.inventory.domain.exception.PartialExpiryException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.BDDMockito.*;

@ExtendWith(MockitoExtension.class)
class PurchaseFinalizeServiceTest {

    private static final long EVENT_ID = 100L;
    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");
    private static final CustomerInfo CUSTOMER = new CustomerInfo("buyer@example.com", "김구매", "CARD");

    @Mock
    private SeatInventoryPort seatInventoryPort;

    @Mock
    private CatalogPort catalogPort;

    @Mock
    private SaleEventWriter saleEventWriter;

    private PurchaseFinalizeService purchaseFinalizeService;

    @BeforeEach
    void setUp() {
        purchaseFinalizeService = new PurchaseFinalizeService(
                seatInventoryPort, catalogPort, saleEventWriter, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static SeatHold hold(long holdId, long seatId, long eventId, HoldStatus status) {
        return new SeatHold(holdId, 1L, seatId, eventId, "s1", null, NOW.minusSeconds(60),
                NOW.plusSeconds(540), 10, status, HoldReason.CHECKOUT, null);
    }

    private static PricedSeat seat(long seatId, String price) {
        return new PricedSeat(seatId, 1L, "FLOOR", "A", (int) seatId, "A-" + seatId,
                "일반석", "#3B82F6", new BigDecimal(price), true);
    }

    private static CompletePurchaseCommand command() {
        return new CompletePurchaseCommand("s1", EVENT_ID, "order-1", CUSTOMER);
    }

    @Test
    @DisplayName("세션의 이 이벤트 선점만 판매하고 판매 이벤트를 가격과 함께 발행한다")
    void sellsSessionHolds() {
        // given
        SeatHold first = hold(1L, 1L, EVENT_ID, HoldStatus.ACTIVE);
        SeatHold second = hold(2L, 2L, EVENT_ID, HoldStatus.EXTENDED);
        given(seatInventoryPort.findSessionHoldIds("s1")).willReturn(Set.of(1L, 2L, 3L));
        given(seatInventoryPort.findHolds(Set.of(1L, 2L, 3L)))
                .willReturn(List.of(second, hold(3L, 3L, 999L, HoldStatus.ACTIVE), first));
        given(catalogPort.findSeats(EVENT_ID, List.of(1L, 2L)))
                .willReturn(List.of(seat(1L, "50.00"), seat(2L, "70.00")));
        given(seatInventoryPort.commitSale(any(SaleRequest.class), eq(List.of(first, second)), eq(NOW)))
                .willReturn(SaleOutcome.sold(List.of(2L, 1L)));

        // when
        List<Long> sold = purchaseFinalizeService.completePurchase(command());

        // then
        assertThat(sold).containsExactly(1L, 2L);
        ArgumentCaptor<SeatsSoldEvent> captor = ArgumentCaptor.forClass(SeatsSoldEvent.class);
        then(saleEventWriter).should().publish(captor.capture());
        SeatsSoldEvent event = captor.getValue();
        assertThat(event.orderId()).isEqualTo("order-1");
        assertThat(event.seats()).extracting(SeatsSoldEvent.Line::price)
                .containsExactly(new BigDecimal("50.00"), new BigDecimal("70.00"));
        assertThat(event.finalizedAt()).isEqualTo(NOW);
    }

    @Test
    @DisplayName("만료된 좌석이 있으면 아무것도 판매하지 않고 만료 좌석 목록을 담아 실패한다")
    void partialExpiry() {
        // given
        SeatHold live = hold(1L, 1L, EVENT_ID, HoldStatus.ACTIVE);
        SeatHold expired = hold(2L, 2L, EVENT_ID, HoldStatus.EXPIRED);
        given(seatInventoryPort.findSessionHoldIds("s1")).willReturn(Set.of(1L, 2L));
        given(seatInventoryPort.findHolds(Set.of(1L, 2L))).willReturn(List.of(live, expired));
        given(catalogPort.findSeats(eq(EVENT_ID), anyList())).willReturn(List.of(seat(1L, "50"), seat(2L, "50")));
        given(seatInventoryPort.commitSale(any(SaleRequest.class), anyList(), eq(NOW)))
                .willReturn(SaleOutcome.expired(List.of(2L)));

        // when & then
        assertThatThrownBy(() -> purchaseFinalizeService.completePurchase(command()))
                .isInstanceOf(PartialExpiryException.class)
                .satisfies(e -> assertThat(((PartialExpiryException) e).getSeatIds()).containsExactly(2L));
        then(saleEventWriter).shouldHaveNoInteractions();
    }

    @Test
    @DisplayName("판매 이벤트 발행이 실패해도 확정된 좌석 목록을 돌려준다")
    void publishFailureKeepsSale() {
        // given
        SeatHold first = hold(1L, 1L, EVENT_ID, HoldStatus.ACTIVE);
        given(seatInventoryPort.findSessionHoldIds("s1")).willReturn(Set.of(1L));
        given(seatInventoryPort.findHolds(Set.of(1L))).willReturn(List.of(first));
        given(catalogPort.findSeats(EVENT_ID, List.of(1L))).willReturn(List.of(seat(1L, "50.00")));
        given(seatInventoryPort.commitSale(any(SaleRequest.class), eq(List.of(first)), eq(NOW)))
                .willReturn(SaleOutcome.sold(List.of(1L)));
        willThrow(new IllegalStateException("발행 저장소 장애")).given(saleEventWriter).publish(any());

        // when
        List<Long> sold = purchaseFinalizeService.completePurchase(command());

        // then
        assertThat(sold).containsExactly(1L);
    }

    @Test
    @DisplayName("같은 좌석을 다시 선점한 세션은 좌석 ID를 한 번만 조회하고 가격을 판매 요청에 싣는다")
    void reheldSeatLooksUpPriceOnce() {
        // given
        SeatHold old = hold(1L, 1L, EVENT_ID, HoldStatus.EXPIRED);
        SeatHold current = hold(2L, 1L, EVENT_ID, HoldStatus.ACTIVE);
        given(seatInventoryPort.findSessionHoldIds("s1")).willReturn(Set.of(1L, 2L));
        given(seatInventoryPort.findHolds(Set.of(1L, 2L))).willReturn(List.of(old, current));
        given(catalogPort.findSeats(EVENT_ID, List.of(1L))).willReturn(List.of(seat(1L, "80.00")));
        given(seatInventoryPort.commitSale(any(SaleRequest.class), anyList(), eq(NOW)))
                .willReturn(SaleOutcome.sold(List.of(1L)));

        // when
        List<Long> sold = purchaseFinalizeService.completePurchase(command());

        // then
        assertThat(sold).containsExactly(1L);
        ArgumentCaptor<SaleRequest> captor = ArgumentCaptor.forClass(SaleRequest.class);
        then(seatInventoryPort).should().commitSale(captor.capture(), anyList(), eq(NOW));
        assertThat(captor.getValue().priceOf(1L)).isEqualByComparingTo("80.00");
        assertThat(captor.getValue().orderId()).isEqualTo("order-1");
    }

    @Test
    @DisplayName("결제할 선점이 없으면 HOLD_NOT_FOUND로 실패한다")
    void noHolds() {
        // given
        given(seatInventoryPort.findSessionHoldIds("s1")).willReturn(Set.of(5L));
        given(seatInventoryPort.findHolds(Set.of(5L)))
                .willReturn(List.of(hold(5L, 5L, EVENT_ID, HoldStatus.CANCELLED)));

        // when & then
        assertThatThrownBy(() -> purchaseFinalizeService.completePurchase(command()))
                .isInstanceOf(BusinessException.class)
                .extracting(e -> ((BusinessException) e).getErrorCode())
                .isEqualTo(ErrorCode.HOLD_NOT_FOUND);
        then(seatInventoryPort).should(never()).commitSale(any(), any(), any());
    }

    @Test
    @DisplayName("고객 정보가 잘못되면 명령 생성 단계에서 거부된다")
    void invalidCustomer() {
        assertThatThrownBy(() -> new CustomerInfo("not-an-email", "김구매", null))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new CompletePurchaseCommand("s1", EVENT_ID, " ", CUSTOMER))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
