package kr.jemi.zseat.inventory.infrastructure.out.redis;

import kr.jemi.zseat.inventory.application.port.out.SeatInventoryPort;
import kr.jemi.zseat.inventory.domain.AcquireOutcome;
import kr.jemi.zseat.inventory.domain.CustomerInfo;
import kr.jemi.zseat.inventory.domain.HoldExtension;
import kr.jemi.zseat.inventory.domain.SaleOutcome;
import kr.jemi.zseat.inventory.domain.SaleRecord;
import kr.jemi.zseat.inventory.domain.SaleRequest;
import kr.jemi.zseat.inventory.domain.SeatHold;
import kr.jemi.zseat.inventory.domain.SeatOccupancies;
import kr.jemi.zseat.inventory.domain.SeatOccupancy;
import kr.jemi.zseat.inventory.domain.exception.StorageConflictException;
import kr.jemi.zseat.inventory.infrastructure.out.redis.dto.RedisHold;
import kr.jemi.zseat.inventory.infrastructure.out.redis.dto.RedisSale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

@Component
public class SeatInventoryRedisAdapter implements SeatInventoryPort {

    private static final Logger log = LoggerFactory.getLogger(SeatInventoryRedisAdapter.class);

    private static final String HELD_PREFIX = "held:";
    private static final String SOLD_PREFIX = "sold:";

    private final StringRedisTemplate redisTemplate;
    private final DefaultRedisScript<Long> acquireHoldScript;
    private final DefaultRedisScript<Long> releaseHoldScript;
    private final DefaultRedisScript<Long> extendHoldScript;
    private final DefaultRedisScript<Long> expireHoldsScript;
    private final DefaultRedisScript<String> commitSaleScript;
    private final String retentionMillis;

    /**
     * @param retention 끝난 선점 해시와 세션 선점 집합을 남겨 두는 기간
     */
    public SeatInventoryRedisAdapter(StringRedisTemplate redisTemplate,
                                     DefaultRedisScript<Long> acquireHoldScript,
                                     DefaultRedisScript<Long> releaseHoldScript,
                                     DefaultRedisScript<Long> extendHoldScript,
                                     DefaultRedisScript<Long> expireHoldsScript,
                                     DefaultRedisScript<String> commitSaleScript,
                                     @Value("${zseat.hold.retention}") Duration retention) {
        this.redisTemplate = redisTemplate;
        this.acquireHoldScript = acquireHoldScript;
        this.releaseHoldScript = releaseHoldScript;
        this.extendHoldScript = extendHoldScript;
        this.expireHoldsScript = expireHoldsScript;
        this.commitSaleScript = commitSaleScript;
        this.retentionMillis = String.valueOf(retention.toMillis());
    }

    @Override
    public AcquireOutcome tryAcquireHold(SeatHold hold, Instant now) {
        String slotKey = InventoryRedisKeys.seat(hold.getEventId(), hold.getSeatId());
        String current = redisTemplate.opsForValue().get(slotKey);
        String previousHoldKey = current != null && current.startsWith(HELD_PREFIX)
                ? InventoryRedisKeys.hold(Long.parseLong(current.substring(HELD_PREFIX.length())))
                : InventoryRedisKeys.hold(hold.getId());

        List<String> keys = List.of(
                slotKey,
                InventoryRedisKeys.hold(hold.getId()),
                InventoryRedisKeys.sessionHolds(hold.getSessionId()),
                InventoryRedisKeys.eventHolds(hold.getEventId()),
                InventoryRedisKeys.EXPIRY_INDEX,
                previousHoldKey);
        List<String> args = new ArrayList<>(List.of(
                current == null ? "" : current,
                String.valueOf(hold.getId()),
                String.valueOf(now.toEpochMilli()),
                String.valueOf(hold.getExpiresAt().toEpochMilli()),
                retentionMillis));
        args.addAll(RedisHold.from(hold).toArgs());

        Long result = redisTemplate.execute(acquireHoldScript, keys, args.toArray());
        if (result == null) {
            throw new IllegalStateException("선점 스크립트 결과가 없습니다: seatId=" + hold.getSeatId());
        }
        return switch (result.intValue()) {
            case 1 -> AcquireOutcome.ACQUIRED;
            case 0 -> AcquireOutcome.HELD_BY_OTHER;
            case -1 -> AcquireOutcome.SOLD;
            case -2 -> throw new StorageConflictException(hold.getEventId(), hold.getSeatId());
            default -> throw new IllegalStateException("알 수 없는 선점 스크립트 결과: " + result);
        };
    }

    @Override
    public boolean releaseHold(long holdId, Instant now) {
        Optional<SeatHold> found = findHold(holdId);
        if (found.isEmpty()) {
            return false;
        }
        SeatHold hold = found.get();
        List<String> keys = List.of(
                InventoryRedisKeys.hold(holdId),
                InventoryRedisKeys.seat(hold.getEventId(), hold.getSeatId()),
                InventoryRedisKeys.EXPIRY_INDEX,
                InventoryRedisKeys.eventHolds(hold.getEventId()),
                InventoryRedisKeys.sessionHolds(hold.getSessionId()));
        Long result = redisTemplate.execute(releaseHoldScript, keys,
                String.valueOf(holdId), String.valueOf(now.toEpochMilli()), retentionMillis);
        return result != null && result == 1L;
    }

    @Override
    public HoldExtension extendHold(long holdId, int additionalMinutes, Instant now) {
        Optional<SeatHold> found = findHold(holdId);
        if (found.isEmpty()) {
            return HoldExtension.of(HoldExtension.Outcome.NOT_FOUND);
        }
        SeatHold hold = found.get();
        List<String> keys = List.of(
                InventoryRedisKeys.hold(holdId),
                InventoryRedisKeys.seat(hold.getEventId(), hold.getSeatId()),
                InventoryRedisKeys.EXPIRY_INDEX,
                InventoryRedisKeys.eventHolds(hold.getEventId()),
                InventoryRedisKeys.sessionHolds(hold.getSessionId()));
        Long result = redisTemplate.execute(extendHoldScript, keys,
                String.valueOf(holdId),
                String.valueOf(now.toEpochMilli()),
                String.valueOf(additionalMinutes * 60_000L),
                String.valueOf(additionalMinutes),
                retentionMillis);
        if (result == null || result == -1L) {
            return HoldExtension.of(HoldExtension.Outcome.NOT_FOUND);
        }
        if (result == 0L) {
            return HoldExtension.of(HoldExtension.Outcome.EXPIRED);
        }
        if (result == -2L) {
            return HoldExtension.of(HoldExtension.Outcome.NOT_ACTIVE);
        }
        return HoldExtension.extended(Instant.ofEpochMilli(result));
    }

    @Override
    public int markExpired(List<Long> holdIds, Instant now) {
        List<SeatHold> holds = findHolds(holdIds);
        Set<Long> found = holds.stream().map(SeatHold::getId).collect(Collectors.toSet());
        List<String> missing = holdIds.stream()
                .filter(id -> !found.contains(id))
                .map(String::valueOf)
                .toList();
        if (!missing.isEmpty()) {
            log.warn("선점 해시 없이 만료 색인에 남은 항목 제거: {}", missing);
            redisTemplate.opsForZSet().remove(InventoryRedisKeys.EXPIRY_INDEX, missing.toArray());
        }
        if (holds.isEmpty()) {
            return 0;
        }

        List<String> keys = new ArrayList<>();
        List<String> args = new ArrayList<>();
        keys.add(InventoryRedisKeys.EXPIRY_INDEX);
        args.add(String.valueOf(now.toEpochMilli()));
        args.add(retentionMillis);
        for (SeatHold hold : holds) {
            keys.add(InventoryRedisKeys.hold(hold.getId()));
            keys.add(InventoryRedisKeys.seat(hold.getEventId(), hold.getSeatId()));
            keys.add(InventoryRedisKeys.eventHolds(hold.getEventId()));
            args.add(String.valueOf(hold.getId()));
        }
        Long result = redisTemplate.execute(expireHoldsScript, keys, args.toArray());
        return result == null ? 0 : result.intValue();
    }

    @Override
    public List<Long> findExpiredHoldIds(Instant now, int limit) {
        Set<String> ids = redisTemplate.opsForZSet()
                .rangeByScore(InventoryRedisKeys.EXPIRY_INDEX, 0, now.toEpochMilli(), 0, limit);
        if (ids == null) {
            return List.of();
        }
        return ids.stream().map(Long::parseLong).toList();
    }

    @Override
    public SaleOutcome commitSale(SaleRequest sale, List<SeatHold> holds, Instant now) {
        long eventId = sale.eventId();
        CustomerInfo customer = sale.customer();
        List<String> keys = new ArrayList<>();
        List<String> args = new ArrayList<>();
        keys.add(InventoryRedisKeys.sessionHolds(sale.sessionId()));
        keys.add(InventoryRedisKeys.EXPIRY_INDEX);
        keys.add(InventoryRedisKeys.eventHolds(eventId));
        keys.add(InventoryRedisKeys.UNRECORDED_SALES);
        args.add(sale.orderId());
        args.add(String.valueOf(now.toEpochMilli()));
        args.add(String.valueOf(eventId));
        args.add(sale.sessionId());
        args.add(customer.email());
        args.add(customer.name());
        args.add(customer.paymentMethod() == null ? "" : customer.paymentMethod());
        args.add(retentionMillis);
        for (SeatHold hold : holds) {
            keys.add(InventoryRedisKeys.hold(hold.getId()));
            keys.add(InventoryRedisKeys.seat(eventId, hold.getSeatId()));
            keys.add(InventoryRedisKeys.sale(eventId, hold.getSeatId()));
            args.add(String.valueOf(hold.getId()));
            args.add(sale.priceOf(hold.getSeatId()).toPlainString());
        }

        String result = redisTemplate.execute(commitSaleScript, keys, args.toArray());
        if (result == null || !result.contains(":")) {
            throw new IllegalStateException("판매 확정 스크립트 결과가 없습니다: orderId=" + sale.orderId());
        }
        String status = result.substring(0, result.indexOf(':'));
        List<Long> seatIds = Arrays.stream(result.substring(result.indexOf(':') + 1).split(","))
                .filter(value -> !value.isBlank())
                .map(Long::parseLong)
                .toList();
        if ("EXPIRED".equals(status)) {
            return SaleOutcome.expired(seatIds);
        }
        return SaleOutcome.sold(seatIds);
    }

    @Override
    public List<SaleRecord> findUnrecordedSales(Instant finalizedBefore, int limit) {
        Set<String> members = redisTemplate.opsForZSet()
                .rangeByScore(InventoryRedisKeys.UNRECORDED_SALES, 0, finalizedBefore.toEpochMilli(), 0, limit);
        if (members == null || members.isEmpty()) {
            return List.of();
        }
        List<SaleRecord> sales = new ArrayList<>();
        List<String> orphans = new ArrayList<>();
        for (String member : members) {
            Map<Object, Object> hash = redisTemplate.opsForHash().entries(InventoryRedisKeys.sale(member));
            if (hash.isEmpty()) {
                orphans.add(member);
            } else {
                sales.add(RedisSale.fromHash(hash).toDomain());
            }
        }
        if (!orphans.isEmpty()) {
            log.warn("판매 해시 없이 미기록 인덱스에 남은 항목 제거: {}", orphans);
            redisTemplate.opsForZSet().remove(InventoryRedisKeys.UNRECORDED_SALES, orphans.toArray());
        }
        return sales;
    }

    @Override
    public void markSalesRecorded(Collection<SaleRecord> sales) {
        if (sales.isEmpty()) {
            return;
        }
        Object[] members = sales.stream()
                .map(sale -> InventoryRedisKeys.saleMember(sale.eventId(), sale.seatId()))
                .toArray();
        redisTemplate.opsForZSet().remove(InventoryRedisKeys.UNRECORDED_SALES, members);
    }

    @Override
    public SeatOccupancies querySeatStates(long eventId, Collection<Long> seatIds, Instant now) {
        List<Long> ids = List.copyOf(new LinkedHashSet<>(seatIds));
        List<String> keys = ids.stream().map(seatId -> InventoryRedisKeys.seat(eventId, seatId)).toList();
        List<String> values = redisTemplate.opsForValue().multiGet(keys);

        Map<Long, SeatOccupancy> occupancies = new HashMap<>();
        for (int i = 0; i < ids.size(); i++) {
            long seatId = ids.get(i);
            String value = values == null ? null : values.get(i);
            occupancies.put(seatId, toOccupancy(seatId, value, now));
        }
        return new SeatOccupancies(occupancies);
    }

    private SeatOccupancy toOccupancy(long seatId, String slot, Instant now) {
        if (slot == null) {
            return SeatOccupancy.available(seatId);
        }
        if (slot.startsWith(SOLD_PREFIX)) {
            return SeatOccupancy.sold(seatId, slot.substring(SOLD_PREFIX.length()));
        }
        long holdId = Long.parseLong(slot.substring(HELD_PREFIX.length()));
        // 슬롯이 남아 있어도 만료 시각이 지났으면 비어 있는 좌석이다
        boolean live = findHold(holdId).map(hold -> hold.isLiveAt(now)).orElse(false);
        return live ? SeatOccupancy.held(seatId, holdId) : SeatOccupancy.available(seatId);
    }

    @Override
    public Optional<SeatHold> findHold(long holdId) {
        Map<Object, Object> hash = redisTemplate.opsForHash().entries(InventoryRedisKeys.hold(holdId));
        if (hash.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(RedisHold.fromHash(hash).toDomain());
    }

    @Override
    public List<SeatHold> findHolds(Collection<Long> holdIds) {
        return holdIds.stream()
                .distinct()
                .map(this::findHold)
                .flatMap(Optional::stream)
                .toList();
    }

    @Override
    public Set<Long> findSessionHoldIds(String sessionId) {
        return toIds(redisTemplate.opsForSet().members(InventoryRedisKeys.sessionHolds(sessionId)));
    }

    @Override
    public Set<Long> findEventHoldIds(long eventId) {
        return toIds(redisTemplate.opsForSet().members(InventoryRedisKeys.eventHolds(eventId)));
    }

    private static Set<Long> toIds(Set<String> members) {
        if (members == null) {
            return Set.of();
        }
        return members.stream().map(Long::parseLong).collect(Collectors.toSet());
    }
}
