package kr.jemi.zseat.inventory.domain;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import kr.jemi.zseat.common.validation.SelfValidating;

import java.time.Duration;
import java.time.Instant;

/**
 * 한 좌석에 대한 시간 제한 선점. 만료 시각이 현재 시각 이하이면 만료된 것으로 본다.
 */
public class SeatHold implements SelfValidating {

    private final long id;
    private final long batchId;
    private final long seatId;
    private final long eventId;
    @NotBlank
    private final String sessionId;
    @Email
    private final String customerEmail;
    @NotNull
    private final Instant heldAt;
    @NotNull
    private final Instant expiresAt;
    @Positive
    private final int durationMinutes;
    @NotNull
    private final HoldStatus status;
    @NotNull
    private final HoldReason reason;
    private final String orderId;

    public SeatHold(long id, long batchId, long seatId, long eventId, String sessionId, String customerEmail,
                    Instant heldAt, Instant expiresAt, int durationMinutes, HoldStatus status, HoldReason reason,
                    String orderId) {
        this.id = id;
        this.batchId = batchId;
        this.seatId = seatId;
        this.eventId = eventId;
        this.sessionId = sessionId;
        this.customerEmail = customerEmail == null || customerEmail.isBlank() ? null : customerEmail;
        this.heldAt = heldAt;
        this.expiresAt = expiresAt;
        this.durationMinutes = durationMinutes;
        this.status = status;
        this.reason = reason;
        this.orderId = orderId == null || orderId.isBlank() ? null : orderId;
        validateSelf();
        if (!expiresAt.isAfter(heldAt)) {
            throw new IllegalArgumentException("만료 시각은 선점 시각 이후여야 합니다: holdId=" + id);
        }
    }

    public static SeatHold create(long id, long batchId, long seatId, long eventId, String sessionId,
                                  String customerEmail, HoldReason reason, Instant now, int durationMinutes) {
        return new SeatHold(id, batchId, seatId, eventId, sessionId, customerEmail,
                now, now.plus(Duration.ofMinutes(durationMinutes)), durationMinutes,
                HoldStatus.ACTIVE, reason, null);
    }

    public boolean isExpiredAt(Instant now) {
        return !expiresAt.isAfter(now);
    }

    /**
     * 상태가 ACTIVE/EXTENDED이고 아직 만료 시각이 지나지 않았는지.
     */
    public boolean isLiveAt(Instant now) {
        return status.isLive() && !isExpiredAt(now);
    }

    /**
     * 남은 시간을 분 단위로 내림한다. 음수가 되지 않는다.
     */
    public long remainingMinutes(Instant now) {
        return Math.max(0, Duration.between(now, expiresAt).toMinutes());
    }

    public long getId() {
        return id;
    }

    public long getBatchId() {
        return batchId;
    }

    public long getSeatId() {
        return seatId;
    }

    public long getEventId() {
        return eventId;
    }

    public String getSessionId() {
        return sessionId;
    }

    public String getCustomerEmail() {
        return customerEmail;
    }

    public Instant getHeldAt() {
        return heldAt;
    }

    public Instant getExpiresAt() {
        return expiresAt;
    }

    public int getDurationMinutes() {
        return durationMinutes;
    }

    public HoldStatus getStatus() {
        return status;
    }

    public HoldReason getReason() {
        return reason;
    }

    public String getOrderId() {
        return orderId;
    }
}
