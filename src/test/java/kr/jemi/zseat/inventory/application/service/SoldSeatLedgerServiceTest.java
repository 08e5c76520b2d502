package kr.jemi.zseat.inventory.application.service;

import io.hypersistence.tsid.TSID;
import kr.jemi.zseat.inventory.application.port.out.SoldSeatPort;
import kr.jemi.zseat.inventory.domain.CustomerInfo;
import kr.jemi.zseat.inventory.domain.SeatsSoldEvent;
import kr.jemi.zseat.inventory.domain.SoldSeat;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.BDDMockito.*;

@ExtendWith(MockitoExtension.class)
class SoldSeatLedgerServiceTest {

    private static final long EVENT_ID = 100L;
    private static final Instant FINALIZED_AT = Instant.parse("2026-03-01T10:00:00Z");

    @Mock
    private SoldSeatPort soldSeatPort;

    @Captor
    private ArgumentCaptor<List<SoldSeat>> captor;

    private SoldSeatLedgerService soldSeatLedgerService;

    @BeforeEach
    void setUp() {
        soldSeatLedgerService = new SoldSeatLedgerService(soldSeatPort, TSID.Factory.newInstance256(0));
    }

    private static SeatsSoldEvent event() {
        return new SeatsSoldEvent(EVENT_ID, "order-1", "s1",
                List.of(new SeatsSoldEvent.Line(1L, new BigDecimal("50.00")),
                        new SeatsSoldEvent.Line(2L, new BigDecimal("70.00"))),
                new CustomerInfo("buyer@example.com", "김구매", "CARD"),
                FINALIZED_AT);
    }

    @Test
    @DisplayName("판매된 좌석마다 고객 정보와 가격을 담아 원장에 기록한다")
    void recordsEachSeat() {
        // given
        given(soldSeatPort.exists(eq(EVENT_ID), anyLong())).willReturn(false);

        // when
        soldSeatLedgerService.record(event());

        // then
        then(soldSeatPort).should().insertAll(captor.capture());
        assertThat(captor.getValue()).hasSize(2)
                .allSatisfy(seat -> {
                    assertThat(seat.getOrderId()).isEqualTo("order-1");
                    assertThat(seat.getCustomerName()).isEqualTo("김구매");
                    assertThat(seat.getFinalizedAt()).isEqualTo(FINALIZED_AT);
                });
        assertThat(captor.getValue()).extracting(SoldSeat::getPrice)
                .containsExactly(new BigDecimal("50.00"), new BigDecimal("70.00"));
    }

    @Test
    @DisplayName("같은 이벤트가 다시 와도 이미 기록된 좌석은 건너뛴다")
    void idempotent() {
        // given
        given(soldSeatPort.exists(EVENT_ID, 1L)).willReturn(true);
        given(soldSeatPort.exists(EVENT_ID, 2L)).willReturn(true);

        // when
        soldSeatLedgerService.record(event());

        // then
        then(soldSeatPort).should(never()).insertAll(any());
    }
}
