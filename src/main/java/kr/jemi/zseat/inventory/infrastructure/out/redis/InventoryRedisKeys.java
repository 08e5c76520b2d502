package kr.jemi.zseat.inventory.infrastructure.out.redis;

final class InventoryRedisKeys {

    private static final String PREFIX = "zseat:";

    static final String EXPIRY_INDEX = PREFIX + "holds:expiry";

    static final String UNRECORDED_SALES = PREFIX + "sales:unrecorded";

    private InventoryRedisKeys() {}

    static String hold(long holdId) {
        return PREFIX + "hold:" + holdId;
    }

    static String seat(long eventId, long seatId) {
        return PREFIX + "seat:" + eventId + ":" + seatId;
    }

    static String sale(long eventId, long seatId) {
        return PREFIX + "sale:" + eventId + ":" + seatId;
    }

    static String sale(String saleMember) {
        return PREFIX + "sale:" + saleMember;
    }

    /**
     * 원장 미기록 판매 인덱스의 멤버. "{eventId}:{seatId}"
     */
    static String saleMember(long eventId, long seatId) {
        return eventId + ":" + seatId;
    }

    static String sessionHolds(String sessionId) {
        return PREFIX + "holds:session:" + sessionId;
    }

    static String eventHolds(long eventId) {
        return PREFIX + "holds:event:" + eventId;
    }
}
