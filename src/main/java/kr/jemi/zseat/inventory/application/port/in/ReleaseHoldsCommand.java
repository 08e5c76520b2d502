package kr.jemi.zseat.inventory.application.port.in;

import kr.jemi.zseat.common.validation.ValidationUtils;

import java.util.List;
import java.util.Set;

/**
 * 여러 조건을 주면 모두 만족하는 선점만 해제한다. 최소 하나는 있어야 한다.
 */
public record ReleaseHoldsCommand(List<Long> holdIds, String sessionId, Long eventId) {

    public ReleaseHoldsCommand {
        holdIds = holdIds == null || holdIds.isEmpty() ? null : List.copyOf(holdIds);
        sessionId = sessionId == null || sessionId.isBlank() ? null : sessionId;
        ValidationUtils.require(holdIds != null || sessionId != null || eventId != null,
                "holdIds, sessionId, eventId 중 하나 이상이 필요합니다");
    }

    public static ReleaseHoldsCommand ofHolds(List<Long> holdIds) {
        return new ReleaseHoldsCommand(holdIds, null, null);
    }

    public static ReleaseHoldsCommand ofSession(String sessionId) {
        return new ReleaseHoldsCommand(null, sessionId, null);
    }

    public boolean matches(long holdId, String holdSessionId, long holdEventId) {
        return (holdIds == null || Set.copyOf(holdIds).contains(holdId))
                && (sessionId == null || sessionId.equals(holdSessionId))
                && (eventId == null || eventId == holdEventId);
    }
}
