package kr.jemi.zseat.inventory.infrastructure.in.web.dto;

import java.util.List;

public record ReleaseHoldsRequest(List<Long> holdIds, String sessionId, Long eventId) {
}
