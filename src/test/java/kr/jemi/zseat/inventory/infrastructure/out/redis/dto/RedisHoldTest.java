package kr.jemi.zseat.inventory.infrastructure.out.redis.dto;

import kr.jemi.zseat.inventory.domain.HoldReason;
import kr.jemi.zseat.inventory.domain.HoldStatus;
import kr.jemi.zseat.inventory.domain.SeatHold;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class RedisHoldTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    @Test
    @DisplayName("스크립트 인자는 필드 이름 순의 필드/값 쌍이다")
    void argsSortedByField() {
        // given
        SeatHold hold = SeatHold.create(1L, 2L, 3L, 100L, "s1", null, HoldReason.CHECKOUT, NOW, 10);

        // when
        List<String> args = RedisHold.from(hold).toArgs();

        // then
        assertThat(args).hasSize(24);
        assertThat(args.subList(0, 4)).containsExactly("batchId", "2", "customerEmail", "");
        assertThat(args).containsSequence("expiresAt", String.valueOf(NOW.plusSeconds(600).toEpochMilli()));
    }

    @Test
    @DisplayName("스크립트가 쓴 orderId와 상태를 읽고, 빈 이메일은 null로 돌린다")
    void readsScriptWrittenFields() {
        // given
        SeatHold hold = SeatHold.create(1L, 2L, 3L, 100L, "s1", null, HoldReason.CHECKOUT, NOW, 10);
        Map<Object, Object> hash = new HashMap<>(RedisHold.from(hold).fields());
        hash.put("status", "COMPLETED");
        hash.put("orderId", "order-1");

        // when
        SeatHold read = RedisHold.fromHash(hash).toDomain();

        // then
        assertThat(read.getStatus()).isEqualTo(HoldStatus.COMPLETED);
        assertThat(read.getOrderId()).isEqualTo("order-1");
        assertThat(read.getCustomerEmail()).isNull();
        assertThat(read.getExpiresAt()).isEqualTo(hold.getExpiresAt());
    }
}
