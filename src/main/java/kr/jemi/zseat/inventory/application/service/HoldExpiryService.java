package kr.jemi.zseat.inventory.application.service;

import kr.jemi.zseat.inventory.application.port.in.ExpireHoldsUseCase;
import kr.jemi.zseat.inventory.application.port.out.SeatInventoryPort;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

@Service
public class HoldExpiryService implements ExpireHoldsUseCase {

    private static final Logger log = LoggerFactory.getLogger(HoldExpiryService.class);

    private final SeatInventoryPort seatInventoryPort;
    private final Clock clock;
    private final int batchSize;

    public HoldExpiryService(SeatInventoryPort seatInventoryPort,
                             Clock clock,
                             @Value("${zseat.sweep.batch-size}") int batchSize) {
        this.seatInventoryPort = seatInventoryPort;
        this.clock = clock;
        this.batchSize = batchSize;
    }

    @Override
    public int expireOverdueHolds() {
        Instant now = clock.instant();
        List<Long> overdue = seatInventoryPort.findExpiredHoldIds(now, batchSize);
        if (overdue.isEmpty()) {
            return 0;
        }
        int expired = seatInventoryPort.markExpired(overdue, now);
        log.info("만료 선점 정리: 후보={}, 만료={}", overdue.size(), expired);
        return expired;
    }
}
