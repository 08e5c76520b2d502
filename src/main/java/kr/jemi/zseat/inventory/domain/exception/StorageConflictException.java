package kr.jemi.zseat.inventory.domain.exception;

/**
 * 조건부 쓰기 직전에 좌석 슬롯 값이 바뀌었다. 재시도 대상이며 응답으로 나가지 않는다.
 */
public class StorageConflictException extends RuntimeException {

    public StorageConflictException(long eventId, long seatId) {
        super("좌석 슬롯이 변경되어 선점을 기록하지 못했습니다: eventId=" + eventId + ", seatId=" + seatId);
    }
}
