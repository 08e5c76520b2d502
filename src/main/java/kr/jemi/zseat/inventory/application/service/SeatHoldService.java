package kr.jemi.zseat.inventory.application.service;

import io.github.resilience4j.retry.Retry;
import io.hypersistence.tsid.TSID;
import kr.jemi.zseat.common.validation.ValidationUtils;
import kr.jemi.zseat.inventory.application.port.in.ExtendHoldUseCase;
import kr.jemi.zseat.inventory.application.port.in.GetSessionHoldsUseCase;
import kr.jemi.zseat.inventory.application.port.in.HoldSeatsCommand;
import kr.jemi.zseat.inventory.application.port.in.HoldSeatsUseCase;
import kr.jemi.zseat.inventory.application.port.in.ReleaseHoldsCommand;
import kr.jemi.zseat.inventory.application.port.in.ReleaseHoldsUseCase;
import kr.jemi.zseat.inventory.application.port.out.CatalogPort;
import kr.jemi.zseat.inventory.application.port.out.SeatInventoryPort;
import kr.jemi.zseat.inventory.domain.AcquireOutcome;
import kr.jemi.zseat.inventory.domain.HoldBatch;
import kr.jemi.zseat.inventory.domain.HoldExtension;
import kr.jemi.zseat.inventory.domain.PricedSeat;
import kr.jemi.zseat.inventory.domain.SeatHold;
import kr.jemi.zseat.inventory.domain.SeatOccupancies;
import kr.jemi.zseat.inventory.domain.SeatState;
import kr.jemi.zseat.inventory.domain.SessionHold;
import kr.jemi.zseat.inventory.domain.exception.HoldExpiredException;
import kr.jemi.zseat.inventory.domain.exception.HoldNotActiveException;
import kr.jemi.zseat.inventory.domain.exception.HoldNotFoundException;
import kr.jemi.zseat.inventory.domain.exception.SeatUnavailableException;
import kr.jemi.zseat.inventory.domain.exception.StorageConflictException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

@Service
public class SeatHoldService implements HoldSeatsUseCase, ExtendHoldUseCase, ReleaseHoldsUseCase,
        GetSessionHoldsUseCase {

    private static final Logger log = LoggerFactory.getLogger(SeatHoldService.class);

    private final SeatInventoryPort seatInventoryPort;
    private final CatalogPort catalogPort;
    private final Retry holdAcquisitionRetry;
    private final TSID.Factory tsidFactory;
    private final Clock clock;
    private final int defaultDurationMinutes;

    public SeatHoldService(SeatInventoryPort seatInventoryPort,
                           CatalogPort catalogPort,
                           Retry holdAcquisitionRetry,
                           TSID.Factory tsidFactory,
                           Clock clock,
                           @Value("${zseat.hold.default-duration-minutes}") int defaultDurationMinutes) {
        this.seatInventoryPort = seatInventoryPort;
        this.catalogPort = catalogPort;
        this.holdAcquisitionRetry = holdAcquisitionRetry;
        this.tsidFactory = tsidFactory;
        this.clock = clock;
        this.defaultDurationMinutes = defaultDurationMinutes;
    }

    @Override
    public HoldBatch holdSeats(HoldSeatsCommand command) {
        int duration = command.durationMinutes() != null ? command.durationMinutes() : defaultDurationMinutes;
        List<PricedSeat> seats = catalogPort.findSeats(command.eventId(), command.seatIds());
        validateSeats(seats);

        // 교착을 피하기 위해 항상 좌석 ID 오름차순으로 잡는다
        List<Long> seatIds = seats.stream().map(PricedSeat::seatId).sorted().toList();
        Instant now = clock.instant();
        long batchId = tsidFactory.generate().toLong();

        List<SeatHold> acquired = new ArrayList<>();
        for (int i = 0; i < seatIds.size(); i++) {
            long seatId = seatIds.get(i);
            SeatHold hold = SeatHold.create(tsidFactory.generate().toLong(), batchId, seatId, command.eventId(),
                    command.sessionId(), command.customerEmail(), command.reason(), now, duration);
            boolean success;
            try {
                success = acquire(hold, now);
            } catch (RuntimeException e) {
                log.error("좌석 선점 중 저장소 오류, 선점 {}건 되돌림: seatId={}", acquired.size(), seatId, e);
                compensate(acquired, now);
                throw e;
            }
            if (!success) {
                compensate(acquired, now);
                List<Long> blocked = blockingSeats(command.eventId(), seatId, seatIds.subList(i + 1, seatIds.size()), now);
                log.warn("좌석 선점 실패: eventId={}, sessionId={}, blocked={}",
                        command.eventId(), command.sessionId(), blocked);
                throw new SeatUnavailableException(blocked);
            }
            acquired.add(hold);
        }

        log.info("좌석 선점 완료: eventId={}, sessionId={}, batchId={}, seats={}",
                command.eventId(), command.sessionId(), batchId, seatIds);
        return new HoldBatch(batchId, command.eventId(), command.sessionId(), acquired);
    }

    private void validateSeats(List<PricedSeat> seats) {
        long chartCount = seats.stream().map(PricedSeat::chartId).distinct().count();
        ValidationUtils.require(chartCount <= 1, "한 번에 선점하는 좌석은 같은 배치도에 있어야 합니다");
        List<Long> unsellable = seats.stream()
                .filter(seat -> !seat.sellable())
                .map(PricedSeat::seatId)
                .sorted()
                .toList();
        if (!unsellable.isEmpty()) {
            throw new SeatUnavailableException(unsellable);
        }
    }

    private boolean acquire(SeatHold hold, Instant now) {
        try {
            AcquireOutcome outcome = Retry.decorateSupplier(holdAcquisitionRetry,
                    () -> seatInventoryPort.tryAcquireHold(hold, now)).get();
            return outcome.acquired();
        } catch (StorageConflictException e) {
            log.warn("좌석 슬롯 경합이 재시도 후에도 계속됨: seatId={}", hold.getSeatId());
            return false;
        }
    }

    private void compensate(List<SeatHold> acquired, Instant now) {
        for (SeatHold hold : acquired) {
            seatInventoryPort.releaseHold(hold.getId(), now);
        }
    }

    private List<Long> blockingSeats(long eventId, long failedSeatId, List<Long> remaining, Instant now) {
        TreeSet<Long> blocked = new TreeSet<>();
        blocked.add(failedSeatId);
        if (!remaining.isEmpty()) {
            SeatOccupancies occupancies = seatInventoryPort.querySeatStates(eventId, remaining, now);
            remaining.stream()
                    .filter(seatId -> occupancies.stateOf(seatId) != SeatState.AVAILABLE)
                    .forEach(blocked::add);
        }
        return List.copyOf(blocked);
    }

    @Override
    public SeatHold extendHold(long holdId, int additionalMinutes) {
        ValidationUtils.require(additionalMinutes > 0, "연장 시간은 0보다 커야 합니다: " + additionalMinutes);
        HoldExtension extension = seatInventoryPort.extendHold(holdId, additionalMinutes, clock.instant());
        switch (extension.outcome()) {
            case NOT_FOUND -> throw new HoldNotFoundException(holdId);
            case EXPIRED -> throw new HoldExpiredException(holdId);
            case NOT_ACTIVE -> {
                SeatHold hold = seatInventoryPort.findHold(holdId)
                        .orElseThrow(() -> new HoldNotFoundException(holdId));
                throw new HoldNotActiveException(holdId, hold.getStatus());
            }
            case EXTENDED -> log.info("선점 연장: holdId={}, expiresAt={}", holdId, extension.expiresAt());
        }
        return seatInventoryPort.findHold(holdId)
                .orElseThrow(() -> new HoldNotFoundException(holdId));
    }

    @Override
    public int releaseHolds(ReleaseHoldsCommand command) {
        Instant now = clock.instant();
        List<SeatHold> targets = seatInventoryPort.findHolds(candidateIds(command)).stream()
                .filter(hold -> command.matches(hold.getId(), hold.getSessionId(), hold.getEventId()))
                .toList();

        int released = 0;
        for (SeatHold hold : targets) {
            if (seatInventoryPort.releaseHold(hold.getId(), now)) {
                released++;
            }
        }
        log.info("선점 해제: 대상={}, 해제={}", targets.size(), released);
        return released;
    }

    private Collection<Long> candidateIds(ReleaseHoldsCommand command) {
        if (command.holdIds() != null) {
            return command.holdIds();
        }
        if (command.sessionId() != null) {
            return seatInventoryPort.findSessionHoldIds(command.sessionId());
        }
        return seatInventoryPort.findEventHoldIds(command.eventId());
    }

    @Override
    public List<SessionHold> getSessionHolds(String sessionId, long eventId) {
        Instant now = clock.instant();
        Set<Long> holdIds = seatInventoryPort.findSessionHoldIds(sessionId);
        List<SeatHold> holds = seatInventoryPort.findHolds(holdIds).stream()
                .filter(hold -> hold.getEventId() == eventId)
                .filter(hold -> hold.isLiveAt(now))
                .sorted(Comparator.comparingLong(SeatHold::getSeatId))
                .toList();
        if (holds.isEmpty()) {
            return List.of();
        }

        Map<Long, String> labels = catalogPort.findSeats(eventId, holds.stream().map(SeatHold::getSeatId).toList())
                .stream()
                .collect(Collectors.toMap(PricedSeat::seatId, PricedSeat::label));
        return holds.stream()
                .map(hold -> new SessionHold(hold.getId(), hold.getSeatId(), labels.get(hold.getSeatId()),
                        hold.getStatus(), hold.getExpiresAt(), hold.remainingMinutes(now)))
                .toList();
    }
}
