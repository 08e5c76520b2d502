package kr.jemi.zseat.common.exception;

/**
 * 요청 수량을 채우지 못해 실패한 요청. 응답 본문에 실제 가능한 수량이 함께 실린다.
 */
public abstract class ShortageException extends BusinessException {

    private final int available;

    protected ShortageException(ErrorCode errorCode, String message, int available) {
        super(errorCode, message);
        this.available = available;
    }

    public int getAvailable() {
        return available;
    }
}
