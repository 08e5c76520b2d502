package kr.jemi.zseat.inventory.application.service;

import kr.jemi.zseat.inventory.domain.SeatsSoldEvent;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * 판매 이벤트를 트랜잭션 안에서 발행해 이벤트 발행 저장소에 남긴다.
 * 리스너가 실패해도 미완료 발행으로 남아 재발행된다.
 */
@Service
public class SaleEventWriter {

    private final ApplicationEventPublisher eventPublisher;

    public SaleEventWriter(ApplicationEventPublisher eventPublisher) {
        this.eventPublisher = eventPublisher;
    }

    @Transactional
    public void publish(SeatsSoldEvent event) {
        eventPublisher.publishEvent(event);
    }
}
