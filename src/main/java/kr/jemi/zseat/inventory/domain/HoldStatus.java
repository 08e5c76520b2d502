package kr.jemi.zseat.inventory.domain;

public enum HoldStatus {
    ACTIVE,
    EXTENDED,
    COMPLETED,
    EXPIRED,
    CANCELLED;

    /**
     * 시간이 지나지 않았다면 좌석을 점유하고 있는 상태.
     */
    public boolean isLive() {
        return this == ACTIVE || this == EXTENDED;
    }
}
