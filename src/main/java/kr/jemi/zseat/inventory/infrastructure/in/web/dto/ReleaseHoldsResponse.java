package kr.jemi.zseat.inventory.infrastructure.in.web.dto;

public record ReleaseHoldsResponse(int releasedCount) {
}
