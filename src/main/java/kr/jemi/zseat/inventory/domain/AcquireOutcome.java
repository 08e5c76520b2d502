package kr.jemi.zseat.inventory.domain;

public enum AcquireOutcome {
    ACQUIRED,
    HELD_BY_OTHER,
    SOLD;

    public boolean acquired() {
        return this == ACQUIRED;
    }
}
