package kr.jemi.zseat.inventory.application.port.in;

import java.util.List;

public interface CompletePurchaseUseCase {

    /**
     * @return 판매 확정된 좌석 ID (오름차순)
     */
    List<Long> completePurchase(CompletePurchaseCommand command);
}
