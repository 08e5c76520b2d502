package kr.jemi.zseat.inventory.domain;

import java.time.Instant;

/**
 * 선점 연장 시도 결과. EXTENDED일 때만 expiresAt이 있다.
 */
public record HoldExtension(Outcome outcome, Instant expiresAt) {

    public enum Outcome {
        EXTENDED,
        EXPIRED,
        NOT_FOUND,
        NOT_ACTIVE
    }

    public static HoldExtension extended(Instant expiresAt) {
        return new HoldExtension(Outcome.EXTENDED, expiresAt);
    }

    public static HoldExtension of(Outcome outcome) {
        return new HoldExtension(outcome, null);
    }
}
