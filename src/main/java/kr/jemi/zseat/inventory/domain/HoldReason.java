package kr.jemi.zseat.inventory.domain;

public enum HoldReason {
    CHECKOUT,
    ADMIN,
    MAINTENANCE
}
