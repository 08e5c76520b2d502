package kr.jemi.zseat.inventory.infrastructure.in.event;

import kr.jemi.zseat.inventory.application.port.in.RecordSoldSeatsUseCase;
import kr.jemi.zseat.inventory.domain.SeatsSoldEvent;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionalEventListener;

@Component
public class SeatsSoldEventListener {

    private final RecordSoldSeatsUseCase recordSoldSeatsUseCase;

    public SeatsSoldEventListener(RecordSoldSeatsUseCase recordSoldSeatsUseCase) {
        this.recordSoldSeatsUseCase = recordSoldSeatsUseCase;
    }

    @Async
    @TransactionalEventListener
    public void handle(SeatsSoldEvent event) {
        recordSoldSeatsUseCase.record(event);
    }
}
