package kr.jemi.zseat.inventory.infrastructure.out.persistence;

import kr.jemi.zseat.inventory.application.port.out.SoldSeatPort;
import kr.jemi.zseat.inventory.domain.SoldSeat;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Component
public class SoldSeatJpaAdapter implements SoldSeatPort {

    private final SoldSeatJpaRepository repository;

    public SoldSeatJpaAdapter(SoldSeatJpaRepository repository) {
        this.repository = repository;
    }

    @Override
    public boolean exists(long eventId, long seatId) {
        return repository.existsByEventIdAndSeatId(eventId, seatId);
    }

    @Override
    @Transactional
    public void insertAll(List<SoldSeat> soldSeats) {
        repository.saveAll(soldSeats.stream().map(SoldSeatJpaEntity::fromDomain).toList());
    }

    @Override
    public List<SoldSeat> findByOrderId(String orderId) {
        return repository.findByOrderIdOrderBySeatId(orderId).stream()
                .map(SoldSeatJpaEntity::toDomain)
                .toList();
    }
}
