package kr.jemi.zseat.inventory.infrastructure.out.persistence;

import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface SoldSeatJpaRepository extends JpaRepository<SoldSeatJpaEntity, Long> {

    boolean existsByEventIdAndSeatId(long eventId, long seatId);

    List<SoldSeatJpaEntity> findByOrderIdOrderBySeatId(String orderId);
}
