package kr.jemi.zseat.inventory.application.port.in;

public interface RepairSoldSeatsUseCase {

    /**
     * @return 원장 기록을 확인한 판매 좌석 수
     */
    int repairUnrecordedSales();
}
