package kr.jemi.zseat.inventory.domain;

public enum SeatState {
    AVAILABLE,
    HELD,
    SOLD
}
