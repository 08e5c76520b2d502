package kr.jemi.zseat.inventory.application.port.in;

public interface ReleaseHoldsUseCase {

    /**
     * @return 실제로 해제된 선점 수
     */
    int releaseHolds(ReleaseHoldsCommand command);
}
